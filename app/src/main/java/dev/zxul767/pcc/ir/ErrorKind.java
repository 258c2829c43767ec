package dev.zxul767.pcc.ir;

import java.util.HashMap;
import java.util.Map;

// Exception kinds understood by `raise` / `except` and by the runtime library.
public enum ErrorKind {
  GENERIC("Exception", "RT_EXC_Exception"),
  ZERO_DIVISION("ZeroDivisionError", "RT_EXC_ZeroDivisionError"),
  INDEX("IndexError", "RT_EXC_IndexError"),
  KEY("KeyError", "RT_EXC_KeyError"),
  TYPE("TypeError", "RT_EXC_TypeError"),
  VALUE("ValueError", "RT_EXC_ValueError");

  private static final Map<String, ErrorKind> bySourceName = new HashMap<>();
  static {
    for (ErrorKind kind : values())
      bySourceName.put(kind.sourceName, kind);
  }

  public final String sourceName;
  public final String runtimeName;

  ErrorKind(String sourceName, String runtimeName) {
    this.sourceName = sourceName;
    this.runtimeName = runtimeName;
  }

  public static ErrorKind lookup(String sourceName) {
    return bySourceName.get(sourceName);
  }
}
