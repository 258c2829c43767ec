package dev.zxul767.pcc.ir;

import java.util.HashMap;
import java.util.Map;

// The fixed catalog of callable builtins with their accepted arities.
public enum Builtin {
  LEN("len", 1, 1),
  ABS("abs", 1, 1),
  MIN("min", 2, Integer.MAX_VALUE),
  MAX("max", 2, Integer.MAX_VALUE),
  POW("pow", 2, 3),
  STR("str", 1, 1),
  INT("int", 1, 1);

  private static final Map<String, Builtin> byName = new HashMap<>();
  static {
    for (Builtin builtin : values())
      byName.put(builtin.name, builtin);
  }

  public final String name;
  public final int minArity;
  public final int maxArity;

  Builtin(String name, int minArity, int maxArity) {
    this.name = name;
    this.minArity = minArity;
    this.maxArity = maxArity;
  }

  public static Builtin lookup(String name) { return byName.get(name); }

  public boolean accepts(int arity) {
    return arity >= minArity && arity <= maxArity;
  }

  public String describeArity() {
    if (minArity == maxArity)
      return String.format("exactly %d argument%s", minArity, minArity == 1 ? "" : "s");
    if (maxArity == Integer.MAX_VALUE)
      return String.format("at least %d arguments", minArity);
    return String.format("%d to %d arguments", minArity, maxArity);
  }
}
