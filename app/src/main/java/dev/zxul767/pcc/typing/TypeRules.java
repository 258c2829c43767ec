package dev.zxul767.pcc.typing;

import dev.zxul767.pcc.Backend;
import dev.zxul767.pcc.ir.BinaryOp;
import dev.zxul767.pcc.ir.Builtin;
import dev.zxul767.pcc.ir.CompareOp;
import java.util.List;

// Result types of operators and builtins. Shared by the type checker (which
// reports violations) and the code generator (which picks lowerings from the
// same answers).
public class TypeRules {
  private final Backend backend;

  public TypeRules(Backend backend) { this.backend = backend; }

  // type of parameters, results, fields, loop counters and container reads
  public Type integer() { return backend.integerType(); }

  // float > bigint > the backend's integer type
  public Type join(Type left, Type right) {
    if (left.is(Type.Kind.FLOAT) || right.is(Type.Kind.FLOAT))
      return Type.FLOAT;
    if (left.is(Type.Kind.BIGINT) || right.is(Type.Kind.BIGINT))
      return Type.BIGINT;
    return integer();
  }

  public Type arithmetic(BinaryOp op, Type left, Type right, int line)
      throws TypeError {
    if (op == BinaryOp.ADD && left.is(Type.Kind.STR) && right.is(Type.Kind.STR))
      return Type.STR;
    if (!left.isNumeric() || !right.isNumeric())
      throw new TypeError(
          String.format(
              "unsupported operand types for %s: '%s' and '%s'", op.symbol,
              left, right
          ),
          line
      );
    return join(left, right);
  }

  public Type comparison(CompareOp op, Type left, Type right, int line)
      throws TypeError {
    boolean numbers = left.isNumeric() && right.isNumeric();
    boolean strings = left.is(Type.Kind.STR) && right.is(Type.Kind.STR);
    if (!numbers && !strings)
      throw new TypeError(
          String.format(
              "'%s' not supported between '%s' and '%s'", op.symbol, left, right
          ),
          line
      );
    return Type.BOOL;
  }

  public void condition(Type type, int line) throws TypeError {
    if (!type.isNumeric() && !type.hasLength())
      throw new TypeError(
          String.format("value of type '%s' cannot be used as a condition", type),
          line
      );
  }

  public Type negate(Type operand, int line) throws TypeError {
    if (!operand.isNumeric())
      throw new TypeError(
          String.format("bad operand type for unary -: '%s'", operand), line
      );
    return operand.is(Type.Kind.BOOL) ? integer() : operand;
  }

  // integer slots accept any integer; a `bigint` stored into a native slot
  // is narrowed with a runtime check
  public void integerSlot(Type value, String what, int line) throws TypeError {
    if (!value.isInteger())
      throw new TypeError(
          String.format("%s must be an int, got '%s'", what, value), line
      );
  }

  public void printable(Type value, int line) throws TypeError {
    if (!value.isNumeric() && !value.is(Type.Kind.STR))
      throw new TypeError(
          String.format("cannot print a value of type '%s'", value), line
      );
  }

  public Type builtin(Builtin builtin, List<Type> arguments, int line)
      throws TypeError {
    Type first = arguments.get(0);
    switch (builtin) {
    case LEN:
      if (!first.hasLength())
        throw new TypeError(
            String.format("object of type '%s' has no len()", first), line
        );
      return integer();

    case ABS:
      return negate(first, line);

    case MIN:
    case MAX: {
      Type result = null;
      for (Type argument : arguments) {
        if (!argument.isNumeric())
          throw new TypeError(
              String.format(
                  "%s() arguments must be numbers, got '%s'", builtin.name,
                  argument
              ),
              line
          );
        result = result == null ? join(argument, argument) : join(result, argument);
      }
      return result;
    }

    case POW: {
      boolean floats = false;
      for (Type argument : arguments) {
        if (!argument.isNumeric())
          throw new TypeError(
              String.format("pow() arguments must be numbers, got '%s'", argument),
              line
          );
        floats |= argument.is(Type.Kind.FLOAT);
      }
      if (floats && arguments.size() == 3)
        throw new TypeError(
            "pow() 3rd argument not allowed unless all arguments are integers",
            line
        );
      // integer powers grow quickly, so they are always arbitrary precision
      return floats ? Type.FLOAT : Type.BIGINT;
    }

    case STR:
      if (!first.isNumeric() && !first.is(Type.Kind.STR))
        throw new TypeError(
            String.format("cannot convert '%s' to str", first), line
        );
      return Type.STR;

    case INT:
      if (first.is(Type.Kind.BIGINT))
        return Type.BIGINT;
      if (!first.isNumeric() && !first.is(Type.Kind.STR))
        throw new TypeError(
            String.format("cannot convert '%s' to int", first), line
        );
      return integer();

    default:
      throw new IllegalStateException("unknown builtin: " + builtin);
    }
  }
}
