package dev.zxul767.pcc.ir;

import java.math.BigInteger;
import java.util.List;
import java.util.Objects;

// All IR classes are simple immutable data structures with no real behavior
// so it's okay for them (and their fields) to be public. Equality is
// structural and ignores source positions.
public abstract class Expr {
  // `E` is the checked error a pass may fail with (`RuntimeException` for
  // passes that cannot fail)
  public interface Visitor<R, E extends Exception> {
    public R visitIntLiteralExpr(IntLiteral expr) throws E;
    public R visitFloatLiteralExpr(FloatLiteral expr) throws E;
    public R visitStrLiteralExpr(StrLiteral expr) throws E;
    public R visitListLiteralExpr(ListLiteral expr) throws E;
    public R visitDictLiteralExpr(DictLiteral expr) throws E;
    public R visitVariableExpr(Variable expr) throws E;
    public R visitBinaryExpr(Binary expr) throws E;
    public R visitCompareExpr(Compare expr) throws E;
    public R visitLogicalExpr(Logical expr) throws E;
    public R visitUnaryExpr(Unary expr) throws E;
    public R visitSubscriptExpr(Subscript expr) throws E;
    public R visitCallExpr(Call expr) throws E;
    public R visitAttributeExpr(Attribute expr) throws E;
    public R visitMethodCallExpr(MethodCall expr) throws E;
    public R visitConstructorCallExpr(ConstructorCall expr) throws E;
    public R visitBuiltinCallExpr(BuiltinCall expr) throws E;
  }

  public final int line;

  protected Expr(int line) { this.line = line; }

  public abstract <R, E extends Exception> R accept(Visitor<R, E> visitor)
      throws E;

  public static class IntLiteral extends Expr {
    public IntLiteral(BigInteger value, int line) {
      super(line);
      this.value = value;
    }

    public IntLiteral(long value, int line) { this(BigInteger.valueOf(value), line); }

    @Override
    public <R, E extends Exception> R accept(Visitor<R, E> visitor)
        throws E {
      return visitor.visitIntLiteralExpr(this);
    }

    public boolean isZero() { return value.signum() == 0; }

    @Override
    public boolean equals(Object other) {
      if (!(other instanceof IntLiteral))
        return false;
      return value.equals(((IntLiteral)other).value);
    }

    @Override
    public int hashCode() { return value.hashCode(); }

    public final BigInteger value;
  }

  public static class FloatLiteral extends Expr {
    public FloatLiteral(double value, int line) {
      super(line);
      this.value = value;
    }

    @Override
    public <R, E extends Exception> R accept(Visitor<R, E> visitor)
        throws E {
      return visitor.visitFloatLiteralExpr(this);
    }

    @Override
    public boolean equals(Object other) {
      if (!(other instanceof FloatLiteral))
        return false;
      return Double.compare(value, ((FloatLiteral)other).value) == 0;
    }

    @Override
    public int hashCode() { return Double.hashCode(value); }

    public final double value;
  }

  public static class StrLiteral extends Expr {
    public StrLiteral(String value, int line) {
      super(line);
      this.value = value;
    }

    @Override
    public <R, E extends Exception> R accept(Visitor<R, E> visitor)
        throws E {
      return visitor.visitStrLiteralExpr(this);
    }

    @Override
    public boolean equals(Object other) {
      if (!(other instanceof StrLiteral))
        return false;
      return value.equals(((StrLiteral)other).value);
    }

    @Override
    public int hashCode() { return value.hashCode(); }

    public final String value;
  }

  public static class ListLiteral extends Expr {
    public ListLiteral(List<Expr> elements, int line) {
      super(line);
      this.elements = List.copyOf(elements);
    }

    @Override
    public <R, E extends Exception> R accept(Visitor<R, E> visitor)
        throws E {
      return visitor.visitListLiteralExpr(this);
    }

    @Override
    public boolean equals(Object other) {
      if (!(other instanceof ListLiteral))
        return false;
      return elements.equals(((ListLiteral)other).elements);
    }

    @Override
    public int hashCode() { return Objects.hash("list", elements); }

    public final List<Expr> elements;
  }

  public static class DictLiteral extends Expr {
    public DictLiteral(List<Expr> keys, List<Expr> values, int line) {
      super(line);
      this.keys = List.copyOf(keys);
      this.values = List.copyOf(values);
    }

    @Override
    public <R, E extends Exception> R accept(Visitor<R, E> visitor)
        throws E {
      return visitor.visitDictLiteralExpr(this);
    }

    @Override
    public boolean equals(Object other) {
      if (!(other instanceof DictLiteral))
        return false;
      DictLiteral that = (DictLiteral)other;
      return keys.equals(that.keys) && values.equals(that.values);
    }

    @Override
    public int hashCode() { return Objects.hash(keys, values); }

    public final List<Expr> keys;
    public final List<Expr> values;
  }

  public static class Variable extends Expr {
    public Variable(String name, int line) {
      super(line);
      this.name = name;
    }

    @Override
    public <R, E extends Exception> R accept(Visitor<R, E> visitor)
        throws E {
      return visitor.visitVariableExpr(this);
    }

    @Override
    public boolean equals(Object other) {
      if (!(other instanceof Variable))
        return false;
      return name.equals(((Variable)other).name);
    }

    @Override
    public int hashCode() { return name.hashCode(); }

    public final String name;
  }

  public static class Binary extends Expr {
    public Binary(Expr left, BinaryOp operator, Expr right, int line) {
      super(line);
      this.left = left;
      this.operator = operator;
      this.right = right;
    }

    @Override
    public <R, E extends Exception> R accept(Visitor<R, E> visitor)
        throws E {
      return visitor.visitBinaryExpr(this);
    }

    @Override
    public boolean equals(Object other) {
      if (!(other instanceof Binary))
        return false;
      Binary that = (Binary)other;
      return operator == that.operator && left.equals(that.left) &&
          right.equals(that.right);
    }

    @Override
    public int hashCode() { return Objects.hash(left, operator, right); }

    public final Expr left;
    public final BinaryOp operator;
    public final Expr right;
  }

  public static class Compare extends Expr {
    public Compare(Expr left, CompareOp operator, Expr right, int line) {
      super(line);
      this.left = left;
      this.operator = operator;
      this.right = right;
    }

    @Override
    public <R, E extends Exception> R accept(Visitor<R, E> visitor)
        throws E {
      return visitor.visitCompareExpr(this);
    }

    @Override
    public boolean equals(Object other) {
      if (!(other instanceof Compare))
        return false;
      Compare that = (Compare)other;
      return operator == that.operator && left.equals(that.left) &&
          right.equals(that.right);
    }

    @Override
    public int hashCode() { return Objects.hash(left, operator, right); }

    public final Expr left;
    public final CompareOp operator;
    public final Expr right;
  }

  public static class Logical extends Expr {
    public Logical(Expr left, LogicalOp operator, Expr right, int line) {
      super(line);
      this.left = left;
      this.operator = operator;
      this.right = right;
    }

    @Override
    public <R, E extends Exception> R accept(Visitor<R, E> visitor)
        throws E {
      return visitor.visitLogicalExpr(this);
    }

    @Override
    public boolean equals(Object other) {
      if (!(other instanceof Logical))
        return false;
      Logical that = (Logical)other;
      return operator == that.operator && left.equals(that.left) &&
          right.equals(that.right);
    }

    @Override
    public int hashCode() { return Objects.hash(left, operator, right); }

    public final Expr left;
    public final LogicalOp operator;
    public final Expr right;
  }

  public static class Unary extends Expr {
    public Unary(UnaryOp operator, Expr operand, int line) {
      super(line);
      this.operator = operator;
      this.operand = operand;
    }

    @Override
    public <R, E extends Exception> R accept(Visitor<R, E> visitor)
        throws E {
      return visitor.visitUnaryExpr(this);
    }

    @Override
    public boolean equals(Object other) {
      if (!(other instanceof Unary))
        return false;
      Unary that = (Unary)other;
      return operator == that.operator && operand.equals(that.operand);
    }

    @Override
    public int hashCode() { return Objects.hash(operator, operand); }

    public final UnaryOp operator;
    public final Expr operand;
  }

  // `name[index]`
  public static class Subscript extends Expr {
    public Subscript(String name, Expr index, int line) {
      super(line);
      this.name = name;
      this.index = index;
    }

    @Override
    public <R, E extends Exception> R accept(Visitor<R, E> visitor)
        throws E {
      return visitor.visitSubscriptExpr(this);
    }

    @Override
    public boolean equals(Object other) {
      if (!(other instanceof Subscript))
        return false;
      Subscript that = (Subscript)other;
      return name.equals(that.name) && index.equals(that.index);
    }

    @Override
    public int hashCode() { return Objects.hash(name, index); }

    public final String name;
    public final Expr index;
  }

  // call of a user-defined function
  public static class Call extends Expr {
    public Call(String function, List<Expr> arguments, int line) {
      super(line);
      this.function = function;
      this.arguments = List.copyOf(arguments);
    }

    @Override
    public <R, E extends Exception> R accept(Visitor<R, E> visitor)
        throws E {
      return visitor.visitCallExpr(this);
    }

    @Override
    public boolean equals(Object other) {
      if (!(other instanceof Call))
        return false;
      Call that = (Call)other;
      return function.equals(that.function) && arguments.equals(that.arguments);
    }

    @Override
    public int hashCode() { return Objects.hash(function, arguments); }

    public final String function;
    public final List<Expr> arguments;
  }

  // `object.attribute`
  public static class Attribute extends Expr {
    public Attribute(String object, String attribute, int line) {
      super(line);
      this.object = object;
      this.attribute = attribute;
    }

    @Override
    public <R, E extends Exception> R accept(Visitor<R, E> visitor)
        throws E {
      return visitor.visitAttributeExpr(this);
    }

    @Override
    public boolean equals(Object other) {
      if (!(other instanceof Attribute))
        return false;
      Attribute that = (Attribute)other;
      return object.equals(that.object) && attribute.equals(that.attribute);
    }

    @Override
    public int hashCode() { return Objects.hash(object, attribute); }

    public final String object;
    public final String attribute;
  }

  // `object.method(arguments...)`
  public static class MethodCall extends Expr {
    public MethodCall(
        String object, String method, List<Expr> arguments, int line
    ) {
      super(line);
      this.object = object;
      this.method = method;
      this.arguments = List.copyOf(arguments);
    }

    @Override
    public <R, E extends Exception> R accept(Visitor<R, E> visitor)
        throws E {
      return visitor.visitMethodCallExpr(this);
    }

    @Override
    public boolean equals(Object other) {
      if (!(other instanceof MethodCall))
        return false;
      MethodCall that = (MethodCall)other;
      return object.equals(that.object) && method.equals(that.method) &&
          arguments.equals(that.arguments);
    }

    @Override
    public int hashCode() { return Objects.hash(object, method, arguments); }

    public final String object;
    public final String method;
    public final List<Expr> arguments;
  }

  public static class ConstructorCall extends Expr {
    public ConstructorCall(String className, List<Expr> arguments, int line) {
      super(line);
      this.className = className;
      this.arguments = List.copyOf(arguments);
    }

    @Override
    public <R, E extends Exception> R accept(Visitor<R, E> visitor)
        throws E {
      return visitor.visitConstructorCallExpr(this);
    }

    @Override
    public boolean equals(Object other) {
      if (!(other instanceof ConstructorCall))
        return false;
      ConstructorCall that = (ConstructorCall)other;
      return className.equals(that.className) &&
          arguments.equals(that.arguments);
    }

    @Override
    public int hashCode() { return Objects.hash(className, arguments); }

    public final String className;
    public final List<Expr> arguments;
  }

  public static class BuiltinCall extends Expr {
    public BuiltinCall(Builtin builtin, List<Expr> arguments, int line) {
      super(line);
      this.builtin = builtin;
      this.arguments = List.copyOf(arguments);
    }

    @Override
    public <R, E extends Exception> R accept(Visitor<R, E> visitor)
        throws E {
      return visitor.visitBuiltinCallExpr(this);
    }

    @Override
    public boolean equals(Object other) {
      if (!(other instanceof BuiltinCall))
        return false;
      BuiltinCall that = (BuiltinCall)other;
      return builtin == that.builtin && arguments.equals(that.arguments);
    }

    @Override
    public int hashCode() { return Objects.hash(builtin, arguments); }

    public final Builtin builtin;
    public final List<Expr> arguments;
  }
}
