package dev.zxul767.pcc.typing;

import java.util.Objects;

// Storage type of a value in the generated program.
public class Type {
  public enum Kind {
    // native `long long`
    INT,
    // arbitrary precision `rt_int`
    BIGINT,
    FLOAT,
    STR,
    // result of comparisons and logical operators
    BOOL,
    // list of native integers
    LIST,
    // dict from strings to native integers
    DICT,
    OBJECT,
    // result of calls made only for their effect (`list.append`)
    NONE
  }

  public static final Type INT = new Type(Kind.INT, null);
  public static final Type BIGINT = new Type(Kind.BIGINT, null);
  public static final Type FLOAT = new Type(Kind.FLOAT, null);
  public static final Type STR = new Type(Kind.STR, null);
  public static final Type BOOL = new Type(Kind.BOOL, null);
  public static final Type LIST = new Type(Kind.LIST, null);
  public static final Type DICT = new Type(Kind.DICT, null);
  public static final Type NONE = new Type(Kind.NONE, null);

  public final Kind kind;
  // only set for objects
  public final String className;

  private Type(Kind kind, String className) {
    this.kind = kind;
    this.className = className;
  }

  public static Type object(String className) {
    return new Type(Kind.OBJECT, className);
  }

  public boolean is(Kind kind) { return this.kind == kind; }

  // booleans take part in arithmetic as 0 and 1
  public boolean isInteger() {
    return kind == Kind.INT || kind == Kind.BIGINT || kind == Kind.BOOL;
  }

  public boolean isNumeric() { return isInteger() || kind == Kind.FLOAT; }

  public boolean hasLength() {
    return kind == Kind.STR || kind == Kind.LIST || kind == Kind.DICT;
  }

  @Override
  public boolean equals(Object other) {
    if (!(other instanceof Type))
      return false;
    Type that = (Type)other;
    return kind == that.kind && Objects.equals(className, that.className);
  }

  @Override
  public int hashCode() { return Objects.hash(kind, className); }

  @Override
  public String toString() {
    switch (kind) {
    case INT:
      return "int";
    case BIGINT:
      return "bigint";
    case FLOAT:
      return "float";
    case STR:
      return "str";
    case BOOL:
      return "bool";
    case LIST:
      return "list";
    case DICT:
      return "dict";
    case OBJECT:
      return className;
    default:
      return "None";
    }
  }
}
