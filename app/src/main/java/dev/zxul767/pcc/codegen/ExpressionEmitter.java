package dev.zxul767.pcc.codegen;

import dev.zxul767.pcc.Backend;
import dev.zxul767.pcc.ir.BinaryOp;
import dev.zxul767.pcc.ir.Builtin;
import dev.zxul767.pcc.ir.ClassDef;
import dev.zxul767.pcc.ir.CompareOp;
import dev.zxul767.pcc.ir.ErrorKind;
import dev.zxul767.pcc.ir.Expr;
import dev.zxul767.pcc.ir.LogicalOp;
import dev.zxul767.pcc.ir.UnaryOp;
import dev.zxul767.pcc.typing.Type;
import dev.zxul767.pcc.typing.TypeError;
import dev.zxul767.pcc.typing.TypeRules;
import java.util.ArrayList;
import java.util.List;

// Lowers the expressions of one statement. Anything with an effect (calls,
// container reads, checked operations) is computed into a temporary as soon
// as it is visited, so the remaining pure C expressions can be combined in
// any order without changing the left-to-right evaluation of the source.
class ExpressionEmitter implements Expr.Visitor<Value, RuntimeException> {
  static final String OVERFLOW = "integer overflow (native int out of range)";

  private final FunctionScope scope;
  private final CWriter out;
  private final TempScope temps;
  private final TypeRules rules;
  private final Backend backend;

  ExpressionEmitter(FunctionScope scope, CWriter out, TempScope temps) {
    this.scope = scope;
    this.out = out;
    this.temps = temps;
    this.rules = scope.types.rules;
    this.backend = scope.types.backend;
  }

  Value emit(Expr expr) { return expr.accept(this); }

  Value emit(Expr expr, Type target) {
    return coerce(emit(expr), target, expr.line);
  }

  // C `int` expression holding the truthiness of `value`
  String truth(Value value) {
    switch (value.type.kind) {
    case BOOL:
      return value.code;
    case INT:
    case FLOAT:
      return String.format("(%s != 0)", value.code);
    case BIGINT:
      return String.format("(!rt_int_is_zero(&%s))", value.code);
    case STR:
      return String.format("(rt_str_len(&%s) != 0)", value.code);
    case LIST:
      return String.format("(rt_list_si_len(&%s) != 0)", value.code);
    case DICT:
      return String.format("(rt_dict_ssi_len(&%s) != 0)", value.code);
    default:
      throw new CodegenError("no truth value for type " + value.type);
    }
  }

  // Converts between the numeric representations. Narrowing to a native
  // integer is checked at runtime.
  Value coerce(Value value, Type target, int line) {
    if (value.type.equals(target))
      return value;
    switch (target.kind) {
    case INT:
      return toNative(value, line);
    case BIGINT:
      return toBig(value);
    case FLOAT:
      return toFloat(value, line);
    case BOOL:
      return Value.borrowed(truth(value), Type.BOOL);
    default:
      throw new CodegenError(
          String.format("cannot convert %s to %s", value.type, target)
      );
    }
  }

  private Value toNative(Value value, int line) {
    switch (value.type.kind) {
    case BOOL:
      return Value.borrowed(String.format("((long long)%s)", value.code), Type.INT);
    case BIGINT:
      return Value.borrowed(
          String.format("((long long)%s)", narrow(value, line)), Type.INT
      );
    default:
      throw new CodegenError(
          String.format("cannot convert %s to a native int", value.type)
      );
    }
  }

  private Value toBig(Value value) {
    if (!value.is(Type.Kind.INT) && !value.is(Type.Kind.BOOL))
      throw new CodegenError(String.format("cannot convert %s to bigint", value.type));
    String temp = temps.temp(Type.BIGINT);
    out.println("rt_int_set_si(&%s, %s);", temp, value.code);
    return Value.owned(temp, Type.BIGINT);
  }

  private Value toFloat(Value value, int line) {
    switch (value.type.kind) {
    case INT:
    case BOOL:
      return Value.borrowed(String.format("((double)%s)", value.code), Type.FLOAT);
    case BIGINT:
      return Value.borrowed(
          String.format("((double)%s)", narrow(value, line)), Type.FLOAT
      );
    default:
      throw new CodegenError(String.format("cannot convert %s to float", value.type));
    }
  }

  // `int64_t` temporary holding a bigint that must fit in 64 bits
  private String narrow(Value big, int line) {
    String temp = temps.raw("int64_t");
    out.println(
        "if (rt_int_to_si_checked(&%s, &%s) != RT_OK) %s", big.code, temp,
        raise(ErrorKind.VALUE, "integer too large for a native int", line)
    );
    return temp;
  }

  private static String raise(ErrorKind kind, String message, int line) {
    return CNames.raise(kind, message, line);
  }

  @Override
  public Value visitIntLiteralExpr(Expr.IntLiteral expr) {
    Type type = backend.literalType(expr.value);
    if (type.is(Type.Kind.INT))
      return Value.borrowed(CNames.intLiteral(expr.value.longValueExact()), Type.INT);

    String temp = temps.temp(Type.BIGINT);
    if (Backend.fitsNative(expr.value)) {
      out.println(
          "rt_int_set_si(&%s, %s);", temp,
          CNames.intLiteral(expr.value.longValueExact())
      );
    } else {
      out.println("rt_int_from_dec(&%s, \"%s\");", temp, expr.value.toString());
    }
    return Value.owned(temp, Type.BIGINT);
  }

  @Override
  public Value visitFloatLiteralExpr(Expr.FloatLiteral expr) {
    return Value.borrowed(CNames.floatLiteral(expr.value), Type.FLOAT);
  }

  @Override
  public Value visitStrLiteralExpr(Expr.StrLiteral expr) {
    String temp = temps.temp(Type.STR);
    out.println("%s = %s;", temp, CNames.newString(expr.value));
    return Value.owned(temp, Type.STR);
  }

  @Override
  public Value visitListLiteralExpr(Expr.ListLiteral expr) {
    String temp = temps.temp(Type.LIST);
    for (Expr element : expr.elements) {
      Value value = emit(element, Type.INT);
      out.println("rt_list_si_append(&%s, %s);", temp, value.code);
    }
    return Value.owned(temp, Type.LIST);
  }

  @Override
  public Value visitDictLiteralExpr(Expr.DictLiteral expr) {
    String temp = temps.temp(Type.DICT);
    for (int i = 0; i < expr.keys.size(); i++) {
      Value key = emit(expr.keys.get(i));
      Value value = emit(expr.values.get(i), Type.INT);
      out.println("rt_dict_ssi_set(&%s, %s, %s);", temp, key.code, value.code);
    }
    return Value.owned(temp, Type.DICT);
  }

  @Override
  public Value visitVariableExpr(Expr.Variable expr) {
    return scope.variable(expr.name);
  }

  @Override
  public Value visitBinaryExpr(Expr.Binary expr) {
    Value left = emit(expr.left);
    Value right = emit(expr.right);
    Type type = arithmeticType(expr, left.type, right.type);

    switch (type.kind) {
    case STR: {
      String temp = temps.temp(Type.STR);
      out.println("%s = rt_str_concat(%s, %s);", temp, left.code, right.code);
      return Value.owned(temp, Type.STR);
    }
    case FLOAT:
      return floatArithmetic(
          expr.operator, coerce(left, Type.FLOAT, expr.line),
          coerce(right, Type.FLOAT, expr.line), expr.line
      );
    case BIGINT:
      return bigArithmetic(
          expr.operator, coerce(left, Type.BIGINT, expr.line),
          coerce(right, Type.BIGINT, expr.line), expr.line
      );
    default:
      return nativeArithmetic(
          expr.operator, coerce(left, Type.INT, expr.line),
          coerce(right, Type.INT, expr.line), expr.line
      );
    }
  }

  // Native results that don't fit in 64 bits raise ValueError: the storage of
  // a name is fixed before the program runs, so there is no fallback to rt_int.
  // C division truncates toward zero: the quotient is corrected down and the
  // remainder takes the sign of the divisor.
  private Value nativeArithmetic(BinaryOp op, Value left, Value right, int line) {
    String result = temps.temp(Type.INT);
    if (!op.isDivision()) {
      out.println(
          "if (%s(%s, %s, &%s)) %s", overflowBuiltin(op), left.code, right.code, result,
          raise(ErrorKind.VALUE, OVERFLOW, line)
      );
      return Value.owned(result, Type.INT);
    }

    String a = scalar(left);
    String b = scalar(right);
    out.println(
        "if (%s == 0) %s", b,
        raise(ErrorKind.ZERO_DIVISION, "integer division or modulo by zero", line)
    );
    if (op == BinaryOp.FLOOR_DIV) {
      out.println(
          "if (%s == LLONG_MIN && %s == -1) %s", a, b,
          raise(ErrorKind.VALUE, OVERFLOW, line)
      );
      out.println("%s = %s / %s;", result, a, b);
      out.println("if (((%s < 0) != (%s < 0)) && %s %% %s != 0) %s -= 1;", a, b, a, b, result);
    } else {
      // LLONG_MIN % -1 traps on some targets; anything modulo -1 is 0
      out.println("%s = %s == -1 ? 0 : %s %% %s;", result, b, a, b);
      out.println("if (%s != 0 && ((%s < 0) != (%s < 0))) %s += %s;", result, result, b, result, b);
    }
    return Value.owned(result, Type.INT);
  }

  private static String overflowBuiltin(BinaryOp op) {
    switch (op) {
    case ADD:
      return "__builtin_add_overflow";
    case SUB:
      return "__builtin_sub_overflow";
    case MUL:
      return "__builtin_mul_overflow";
    default:
      throw new CodegenError("no overflow check for " + op);
    }
  }

  private Value floatArithmetic(BinaryOp op, Value left, Value right, int line) {
    if (!op.isDivision())
      return Value.borrowed(
          String.format("(%s %s %s)", left.code, op.symbol, right.code), Type.FLOAT
      );

    String a = scalar(left);
    String b = scalar(right);
    String message = op == BinaryOp.FLOOR_DIV ? "float floor division by zero"
                                              : "float modulo";
    out.println("if (%s == 0.0) %s", b, raise(ErrorKind.ZERO_DIVISION, message, line));
    String result = temps.temp(Type.FLOAT);
    if (op == BinaryOp.FLOOR_DIV) {
      out.println("%s = floor(%s / %s);", result, a, b);
    } else {
      out.println("%s = fmod(%s, %s);", result, a, b);
      out.println("if (%s != 0.0 && ((%s < 0) != (%s < 0))) %s += %s;", result, result, b, result, b);
    }
    return Value.owned(result, Type.FLOAT);
  }

  private Value bigArithmetic(BinaryOp op, Value left, Value right, int line) {
    String result = temps.temp(Type.BIGINT);
    switch (op) {
    case ADD:
      out.println("rt_int_add(&%s, &%s, &%s);", result, left.code, right.code);
      break;
    case SUB:
      out.println("rt_int_sub(&%s, &%s, &%s);", result, left.code, right.code);
      break;
    case MUL:
      out.println("rt_int_mul(&%s, &%s, &%s);", result, left.code, right.code);
      break;
    case FLOOR_DIV:
    case MOD:
      out.println(
          "if (rt_int_is_zero(&%s)) %s", right.code,
          raise(ErrorKind.ZERO_DIVISION, "integer division or modulo by zero", line)
      );
      out.println(
          "%s(&%s, &%s, &%s);", op == BinaryOp.FLOOR_DIV ? "rt_int_floordiv" : "rt_int_mod",
          result, left.code, right.code
      );
      break;
    default:
      throw new CodegenError("unknown operator " + op);
    }
    return Value.owned(result, Type.BIGINT);
  }

  // a native scalar that can be mentioned more than once
  private String scalar(Value value) {
    if (value.owned || isName(value.code))
      return value.code;
    String temp = temps.temp(value.type);
    out.println("%s = %s;", temp, value.code);
    return temp;
  }

  private static boolean isName(String code) {
    return code.matches("[A-Za-z_][A-Za-z_0-9]*");
  }

  @Override
  public Value visitCompareExpr(Expr.Compare expr) {
    Value left = emit(expr.left);
    Value right = emit(expr.right);
    comparisonType(expr, left.type, right.type);

    if (left.is(Type.Kind.STR)) {
      if (expr.operator == CompareOp.EQ)
        return bool(String.format("rt_str_equals(%s, %s)", left.code, right.code));
      if (expr.operator == CompareOp.NE)
        return bool(String.format("(!rt_str_equals(%s, %s))", left.code, right.code));
      return bool(
          String.format(
              "(rt_str_compare(%s, %s) %s 0)", left.code, right.code,
              expr.operator.symbol
          )
      );
    }

    Type common = rules.join(left.type, right.type);
    Value a = coerce(left, common, expr.line);
    Value b = coerce(right, common, expr.line);
    if (common.is(Type.Kind.BIGINT))
      return bool(
          String.format(
              "(rt_int_cmp(&%s, &%s) %s 0)", a.code, b.code, expr.operator.symbol
          )
      );
    return bool(String.format("(%s %s %s)", a.code, expr.operator.symbol, b.code));
  }

  @Override
  public Value visitLogicalExpr(Expr.Logical expr) {
    Value left = emit(expr.left);
    String result = temps.temp(Type.BOOL);
    out.println("%s = %s;", result, truth(left));

    // the right operand only runs when it decides the result
    out.openBlock(
        String.format(expr.operator == LogicalOp.AND ? "if (%s)" : "if (!%s)", result)
    );
    Value right = emit(expr.right);
    out.println("%s = %s;", result, truth(right));
    out.closeBlock();
    return Value.owned(result, Type.BOOL);
  }

  @Override
  public Value visitUnaryExpr(Expr.Unary expr) {
    Value operand = emit(expr.operand);
    if (expr.operator == UnaryOp.NOT)
      return bool(String.format("(!%s)", truth(operand)));

    Type type = negateType(expr, operand.type);
    Value value = coerce(operand, type, expr.line);
    if (type.is(Type.Kind.INT)) {
      String negated = scalar(value);
      out.println(
          "if (%s == LLONG_MIN) %s", negated, raise(ErrorKind.VALUE, OVERFLOW, expr.line)
      );
      return Value.borrowed(String.format("(-%s)", negated), type);
    }
    if (!type.is(Type.Kind.BIGINT))
      return Value.borrowed(String.format("(-%s)", value.code), type);

    String zero = temps.temp(Type.BIGINT);
    String result = temps.temp(Type.BIGINT);
    out.println("rt_int_set_si(&%s, 0);", zero);
    out.println("rt_int_sub(&%s, &%s, &%s);", result, zero, value.code);
    return Value.owned(result, Type.BIGINT);
  }

  @Override
  public Value visitSubscriptExpr(Expr.Subscript expr) {
    Value receiver = scope.variable(expr.name);
    switch (receiver.type.kind) {
    case LIST: {
      Value index = emit(expr.index, Type.INT);
      String temp = temps.temp(Type.INT);
      out.println("%s = rt_list_si_get(&%s, %s);", temp, receiver.code, index.code);
      return coerce(Value.owned(temp, Type.INT), rules.integer(), expr.line);
    }
    case DICT: {
      Value key = emit(expr.index);
      String temp = temps.temp(Type.INT);
      out.println("%s = rt_dict_ssi_get(&%s, %s);", temp, receiver.code, key.code);
      return coerce(Value.owned(temp, Type.INT), rules.integer(), expr.line);
    }
    case STR: {
      Value index = emit(expr.index, Type.INT);
      String position = temps.temp(Type.INT);
      String length = String.format("((long long)rt_str_len(&%s))", receiver.code);
      out.println("%s = %s;", position, index.code);
      out.println("if (%s < 0) %s += %s;", position, position, length);
      out.println(
          "if (%s < 0 || %s >= %s) %s", position, position, length,
          raise(ErrorKind.INDEX, "string index out of range", expr.line)
      );
      String temp = temps.temp(Type.STR);
      out.println(
          "%s = rt_str_substring(%s, (size_t)%s, 1);", temp, receiver.code, position
      );
      return Value.owned(temp, Type.STR);
    }
    default:
      throw new CodegenError(
          String.format("'%s' is not subscriptable", receiver.type)
      );
    }
  }

  @Override
  public Value visitCallExpr(Expr.Call expr) {
    List<Value> arguments = integerArguments(expr.arguments);
    return invoke(CNames.function(expr.function), null, arguments);
  }

  @Override
  public Value visitAttributeExpr(Expr.Attribute expr) {
    Value object = scope.variable(expr.object);
    String field = String.format("%s->%s", object.code, CNames.field(expr.attribute));
    // copied right away: a later method call in the same expression may
    // change the field
    Type type = rules.integer();
    String temp = temps.temp(type);
    if (type.is(Type.Kind.BIGINT)) {
      out.println("rt_int_copy(&%s, &%s);", temp, field);
    } else {
      out.println("%s = %s;", temp, field);
    }
    return Value.owned(temp, type);
  }

  @Override
  public Value visitMethodCallExpr(Expr.MethodCall expr) {
    Value object = scope.variable(expr.object);
    if (object.is(Type.Kind.LIST)) {
      Value element = emit(expr.arguments.get(0), Type.INT);
      out.println("rt_list_si_append(&%s, %s);", object.code, element.code);
      return Value.none();
    }
    if (!object.is(Type.Kind.OBJECT))
      throw new CodegenError(
          String.format("'%s' object has no method '%s'", object.type, expr.method)
      );
    List<Value> arguments = integerArguments(expr.arguments);
    return invoke(
        CNames.method(object.type.className, expr.method), object.code, arguments
    );
  }

  @Override
  public Value visitConstructorCallExpr(Expr.ConstructorCall expr) {
    ClassDef classDef = scope.types.module.classNamed(expr.className);
    List<Value> arguments = integerArguments(expr.arguments);
    Type type = Type.object(expr.className);
    String temp = temps.temp(type);
    out.println("%s = %s();", temp, CNames.constructor(expr.className));
    if (classDef.initializer() != null)
      invoke(
          CNames.method(expr.className, ClassDef.INITIALIZER), temp, arguments
      );
    return Value.owned(temp, type);
  }

  private List<Value> integerArguments(List<Expr> expressions) {
    List<Value> arguments = new ArrayList<>();
    for (Expr argument : expressions)
      arguments.add(emit(argument, rules.integer()));
    return arguments;
  }

  // Calls a compiled function or method (`self` is null for functions). In
  // the fast backend results are returned; in the precise one they are
  // written through the leading `rt_int*` parameter and arguments are
  // passed by address.
  private Value invoke(String function, String self, List<Value> arguments) {
    Type type = rules.integer();
    String result = temps.temp(type);
    List<String> parameters = new ArrayList<>();
    if (self != null)
      parameters.add(self);

    if (type.is(Type.Kind.BIGINT)) {
      parameters.add("&" + result);
      for (Value argument : arguments)
        parameters.add(argument.address());
      out.println("%s(%s);", function, String.join(", ", parameters));
    } else {
      for (Value argument : arguments)
        parameters.add(argument.code);
      out.println("%s = %s(%s);", result, function, String.join(", ", parameters));
    }
    return Value.owned(result, type);
  }

  @Override
  public Value visitBuiltinCallExpr(Expr.BuiltinCall expr) {
    List<Value> arguments = new ArrayList<>();
    List<Type> types = new ArrayList<>();
    for (Expr argument : expr.arguments) {
      Value value = emit(argument);
      arguments.add(value);
      types.add(value.type);
    }
    Type type = builtinType(expr, types);
    Value first = arguments.get(0);

    switch (expr.builtin) {
    case LEN:
      return coerce(
          Value.borrowed(length(first), Type.INT), rules.integer(), expr.line
      );
    case ABS:
      return abs(coerce(first, type, expr.line), expr.line);
    case MIN:
    case MAX:
      return extreme(expr, arguments, type);
    case POW:
      return pow(expr, arguments, type);
    case STR:
      return str(first);
    case INT:
      return integer(first, type, expr.line);
    default:
      throw new CodegenError("unknown builtin " + expr.builtin);
    }
  }

  private String length(Value value) {
    switch (value.type.kind) {
    case STR:
      return String.format("((long long)rt_str_len(&%s))", value.code);
    case LIST:
      return String.format("((long long)rt_list_si_len(&%s))", value.code);
    case DICT:
      return String.format("((long long)rt_dict_ssi_len(&%s))", value.code);
    default:
      throw new CodegenError(String.format("'%s' has no len()", value.type));
    }
  }

  private Value abs(Value value, int line) {
    switch (value.type.kind) {
    case FLOAT:
      return Value.borrowed(String.format("fabs(%s)", value.code), Type.FLOAT);
    case INT: {
      // rt_math_abs_si saturates at INT64_MAX
      String operand = scalar(value);
      out.println(
          "if (%s == LLONG_MIN) %s", operand, raise(ErrorKind.VALUE, OVERFLOW, line)
      );
      return Value.borrowed(
          String.format("((long long)rt_math_abs_si(%s))", operand), Type.INT
      );
    }
    default: {
      String temp = temps.temp(Type.BIGINT);
      out.println("rt_math_abs(&%s, &%s);", temp, value.code);
      return Value.owned(temp, Type.BIGINT);
    }
    }
  }

  // min()/max(): the first of equal arguments wins
  private Value extreme(Expr.BuiltinCall expr, List<Value> arguments, Type type) {
    String comparison = expr.builtin == Builtin.MIN ? "<" : ">";
    String result = temps.temp(type);
    for (int i = 0; i < arguments.size(); i++) {
      Value value = coerce(arguments.get(i), type, expr.line);
      if (type.is(Type.Kind.BIGINT)) {
        if (i == 0) {
          out.println("rt_int_copy(&%s, &%s);", result, value.code);
        } else {
          out.println(
              "if (rt_int_cmp(&%s, &%s) %s 0) rt_int_copy(&%s, &%s);", value.code,
              result, comparison, result, value.code
          );
        }
      } else if (i == 0) {
        out.println("%s = %s;", result, value.code);
      } else {
        String candidate = scalar(value);
        out.println(
            "if (%s %s %s) %s = %s;", candidate, comparison, result, result,
            candidate
        );
      }
    }
    return Value.owned(result, type);
  }

  private Value pow(Expr.BuiltinCall expr, List<Value> arguments, Type type) {
    if (type.is(Type.Kind.FLOAT)) {
      Value base = coerce(arguments.get(0), Type.FLOAT, expr.line);
      Value exponent = coerce(arguments.get(1), Type.FLOAT, expr.line);
      return Value.borrowed(
          String.format("pow(%s, %s)", base.code, exponent.code), Type.FLOAT
      );
    }

    Value base = coerce(arguments.get(0), Type.BIGINT, expr.line);
    String exponent = scalar(coerce(arguments.get(1), Type.INT, expr.line));
    out.println(
        "if (%s < 0) %s", exponent,
        raise(ErrorKind.VALUE, "negative exponents are not supported for integers", expr.line)
    );
    String power = temps.temp(Type.BIGINT);
    out.println("rt_math_pow(&%s, &%s, %s);", power, base.code, exponent);
    if (arguments.size() < 3)
      return Value.owned(power, Type.BIGINT);

    Value modulus = coerce(arguments.get(2), Type.BIGINT, expr.line);
    out.println(
        "if (rt_int_is_zero(&%s)) %s", modulus.code,
        raise(ErrorKind.VALUE, "pow() 3rd argument cannot be 0", expr.line)
    );
    String result = temps.temp(Type.BIGINT);
    out.println("rt_int_mod(&%s, &%s, &%s);", result, power, modulus.code);
    return Value.owned(result, Type.BIGINT);
  }

  private Value str(Value value) {
    String temp = temps.temp(Type.STR);
    switch (value.type.kind) {
    case INT:
      out.println("%s = rt_str_from_si(%s);", temp, value.code);
      break;
    case BOOL:
      out.println(
          "%s = rt_str_from_cstr(%s ? \"True\" : \"False\");", temp, value.code
      );
      break;
    case BIGINT:
      out.println("%s = rt_str_from_int(&%s);", temp, value.code);
      break;
    case FLOAT:
      scope.state.usesFloats = true;
      out.println("%s = pcc_float_to_str(%s);", temp, value.code);
      break;
    case STR:
      out.println("%s = %s;", temp, CNames.copyString(value.code));
      break;
    default:
      throw new CodegenError(String.format("cannot convert '%s' to str", value.type));
    }
    return Value.owned(temp, Type.STR);
  }

  private Value integer(Value value, Type type, int line) {
    switch (value.type.kind) {
    case INT:
    case BIGINT:
      return value;
    case BOOL:
      return coerce(value, type, line);
    case FLOAT: {
      // truncates toward zero
      Value truncated =
          Value.borrowed(String.format("((long long)%s)", value.code), Type.INT);
      return coerce(truncated, type, line);
    }
    case STR: {
      String invalid = raise(ErrorKind.VALUE, "invalid literal for int()", line);
      if (type.is(Type.Kind.BIGINT)) {
        String temp = temps.temp(Type.BIGINT);
        out.println("if (rt_str_to_int(%s, &%s) != RT_OK) %s", value.code, temp, invalid);
        return Value.owned(temp, Type.BIGINT);
      }
      String temp = temps.raw("int64_t");
      out.println("if (rt_str_to_si(%s, &%s) != RT_OK) %s", value.code, temp, invalid);
      return Value.borrowed(String.format("((long long)%s)", temp), Type.INT);
    }
    default:
      throw new CodegenError(String.format("cannot convert '%s' to int", value.type));
    }
  }

  private static Value bool(String code) { return Value.borrowed(code, Type.BOOL); }

  // The type checker has accepted the program, so the rules cannot fail here.

  private Type arithmeticType(Expr.Binary expr, Type left, Type right) {
    try {
      return rules.arithmetic(expr.operator, left, right, expr.line);
    } catch (TypeError error) {
      throw unchecked(error);
    }
  }

  private void comparisonType(Expr.Compare expr, Type left, Type right) {
    try {
      rules.comparison(expr.operator, left, right, expr.line);
    } catch (TypeError error) {
      throw unchecked(error);
    }
  }

  private Type negateType(Expr.Unary expr, Type operand) {
    try {
      return rules.negate(operand, expr.line);
    } catch (TypeError error) {
      throw unchecked(error);
    }
  }

  private Type builtinType(Expr.BuiltinCall expr, List<Type> arguments) {
    try {
      return rules.builtin(expr.builtin, arguments, expr.line);
    } catch (TypeError error) {
      throw unchecked(error);
    }
  }

  private static CodegenError unchecked(TypeError error) {
    return new CodegenError("unchecked program: " + error.getMessage(), error);
  }
}
