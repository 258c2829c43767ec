package dev.zxul767.pcc.typing;

import dev.zxul767.pcc.CompileError;

public class TypeError extends CompileError {
  public TypeError(String message, int line) {
    super(Stage.TYPE, message, line, /*column:*/ 0);
  }
}
