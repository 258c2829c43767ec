package dev.zxul767.pcc.codegen;

import dev.zxul767.pcc.ir.ErrorKind;
import dev.zxul767.pcc.typing.Type;
import java.nio.charset.StandardCharsets;

// Spelling of everything that ends up in the generated C: identifiers,
// storage types and literals.
class CNames {
  static final String SOURCE_NAME = "pcc_source";
  static final String RESULT = "pcc_ret";
  static final String OUT = "pcc_out";
  static final String EXIT_LABEL = "pcc_exit";

  private CNames() {}

  static String variable(String name) { return "v_" + name; }

  static String argument(String name) { return "pcc_arg_" + name; }

  static String temp(int id) { return "pcc_tmp_" + id; }

  static String label(String kind, int id) {
    return String.format("pcc_%s_%d", kind, id);
  }

  static String function(String name) { return "pcc_fn_" + name; }

  static String classStruct(String className) { return "pcc_class_" + className; }

  static String constructor(String className) { return "pcc_new_" + className; }

  static String destructor(String className) { return "pcc_delete_" + className; }

  static String method(String className, String name) {
    return String.format("pcc_method_%s_%s", className, name);
  }

  static String field(String name) { return "f_" + name; }

  static String cType(Type type) {
    switch (type.kind) {
    case INT:
      return "long long";
    case BIGINT:
      return "rt_int";
    case FLOAT:
      return "double";
    case STR:
      return "rt_str";
    case BOOL:
      return "int";
    case LIST:
      return "rt_list_si";
    case DICT:
      return "rt_dict_ssi";
    case OBJECT:
      return classStruct(type.className) + "*";
    default:
      throw new CodegenError("no C storage for values of type " + type);
    }
  }

  // Scalars kept in registers lose their updates when a `longjmp` returns to
  // the `setjmp` of a `try`, so they are volatile in scopes that have one.
  // Every other kind is only ever accessed through its address.
  static boolean needsVolatile(Type type) {
    switch (type.kind) {
    case INT:
    case FLOAT:
    case BOOL:
    case OBJECT:
      return true;
    default:
      return false;
    }
  }

  // declaration plus initialization, so releasing it is always valid even
  // when it was never assigned
  static void declare(CWriter out, Type type, String name, boolean isVolatile) {
    String cType = cType(type);
    boolean qualified = isVolatile && needsVolatile(type);
    switch (type.kind) {
    case INT:
    case FLOAT:
    case BOOL:
      out.println("%s%s %s = 0;", qualified ? "volatile " : "", cType, name);
      break;
    case OBJECT:
      out.println("%s%s %s = NULL;", cType, qualified ? " volatile" : "", name);
      break;
    case BIGINT:
      out.println("rt_int %s;", name);
      out.println("rt_int_init(&%s);", name);
      break;
    case STR:
      out.println("rt_str %s = rt_str_null();", name);
      break;
    case LIST:
      out.println("rt_list_si %s;", name);
      out.println("rt_list_si_init(&%s);", name);
      break;
    case DICT:
      out.println("rt_dict_ssi %s;", name);
      out.println("rt_dict_ssi_init(&%s);", name);
      break;
    default:
      throw new CodegenError("cannot declare a variable of type " + type);
    }
  }

  // statement releasing the storage of `name`, or null for plain scalars
  static String release(Type type, String name) {
    switch (type.kind) {
    case BIGINT:
      return String.format("rt_int_clear(&%s);", name);
    case STR:
      return String.format("rt_str_clear(&%s);", name);
    case LIST:
      return String.format("rt_list_si_clear(&%s);", name);
    case DICT:
      return String.format("rt_dict_ssi_clear(&%s);", name);
    case OBJECT:
      return String.format("%s(%s);", destructor(type.className), name);
    default:
      return null;
    }
  }

  // `rt_raise(...)` statement; the runtime prints an empty message for NULL
  static String raise(ErrorKind kind, String message, int line) {
    return String.format(
        "rt_raise(%s, %s, %s, %d);", kind.runtimeName,
        message == null ? "NULL" : cString(message), SOURCE_NAME, line
    );
  }

  static String intLiteral(long value) {
    // -9223372036854775808LL would be the negation of an out-of-range literal
    if (value == Long.MIN_VALUE)
      return "(-9223372036854775807LL - 1)";
    if (value < 0)
      return "(" + value + "LL)";
    return value + "LL";
  }

  static String floatLiteral(double value) {
    if (Double.isNaN(value))
      return "NAN";
    if (Double.isInfinite(value))
      return value > 0 ? "HUGE_VAL" : "(-HUGE_VAL)";
    String text = Double.toString(value);
    return value < 0 ? "(" + text + ")" : text;
  }

  // Double-quoted C string. Everything outside printable ASCII is written as
  // a 3-digit octal escape of its UTF-8 bytes (hex escapes would swallow a
  // following hex digit).
  // a fresh rt_str holding `text`; literals with a NUL byte can't go through
  // rt_str_from_cstr, so they are copied from a borrowed rt_str of known length
  static String newString(String text) {
    if (text.indexOf('\0') < 0)
      return String.format("rt_str_from_cstr(%s)", cString(text));
    int length = text.getBytes(StandardCharsets.UTF_8).length;
    return copyString(String.format("((rt_str){%d, 0, (char*)%s})", length, cString(text)));
  }

  // copies `len` bytes, so embedded NULs survive
  static String copyString(String code) {
    return String.format("rt_str_concat(%s, rt_str_null())", code);
  }

  static String cString(String text) {
    StringBuilder builder = new StringBuilder("\"");
    for (byte b : text.getBytes(StandardCharsets.UTF_8)) {
      int c = b & 0xff;
      switch (c) {
      case '"':
        builder.append("\\\"");
        break;
      case '\\':
        builder.append("\\\\");
        break;
      case '\n':
        builder.append("\\n");
        break;
      case '\t':
        builder.append("\\t");
        break;
      case '\r':
        builder.append("\\r");
        break;
      case '?':
        // avoids trigraphs
        builder.append("\\?");
        break;
      default:
        if (c < 0x20 || c >= 0x7f) {
          builder.append(String.format("\\%03o", c));
        } else {
          builder.append((char)c);
        }
      }
    }
    return builder.append('"').toString();
  }
}
