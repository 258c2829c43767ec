package dev.zxul767.pcc.codegen;

import dev.zxul767.pcc.typing.Type;

// Result of lowering an expression: a C expression of the storage type of
// `type`. Values of `bigint`, `str`, `list` and `dict` type are always
// lvalues (variables, fields or temporaries), since the runtime takes them
// by address.
class Value {
  final String code;
  final Type type;
  // the value lives in a temporary of the current statement, so it may be
  // moved into a variable instead of being copied
  final boolean owned;

  Value(String code, Type type, boolean owned) {
    this.code = code;
    this.type = type;
    this.owned = owned;
  }

  static Value borrowed(String code, Type type) {
    return new Value(code, type, false);
  }

  static Value owned(String code, Type type) { return new Value(code, type, true); }

  static Value none() { return new Value("", Type.NONE, false); }

  boolean is(Type.Kind kind) { return type.is(kind); }

  String address() { return "&" + code; }

  @Override
  public String toString() {
    return String.format("%s: %s", code, type);
  }
}
