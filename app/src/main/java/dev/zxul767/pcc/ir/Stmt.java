package dev.zxul767.pcc.ir;

import java.util.List;
import java.util.Objects;

// See `Expr` for the conventions shared by all IR classes.
public abstract class Stmt {
  public interface Visitor<R, E extends Exception> {
    public R visitAssignStmt(Assign stmt) throws E;
    public R visitAttributeAssignStmt(AttributeAssign stmt) throws E;
    public R visitSubscriptAssignStmt(SubscriptAssign stmt) throws E;
    public R visitExpressionStmt(Expression stmt) throws E;
    public R visitPrintStmt(Print stmt) throws E;
    public R visitIfStmt(If stmt) throws E;
    public R visitWhileStmt(While stmt) throws E;
    public R visitForStmt(For stmt) throws E;
    public R visitTryStmt(Try stmt) throws E;
    public R visitRaiseStmt(Raise stmt) throws E;
    public R visitReturnStmt(Return stmt) throws E;
    public R visitBreakStmt(Break stmt) throws E;
    public R visitContinueStmt(Continue stmt) throws E;
  }

  public final int line;

  protected Stmt(int line) { this.line = line; }

  public abstract <R, E extends Exception> R accept(Visitor<R, E> visitor)
      throws E;

  // `name = value`
  public static class Assign extends Stmt {
    public Assign(String name, Expr value, int line) {
      super(line);
      this.name = name;
      this.value = value;
    }

    @Override
    public <R, E extends Exception> R accept(Visitor<R, E> visitor)
        throws E {
      return visitor.visitAssignStmt(this);
    }

    @Override
    public boolean equals(Object other) {
      if (!(other instanceof Assign))
        return false;
      Assign that = (Assign)other;
      return Objects.equals(name, that.name) &&
          Objects.equals(value, that.value);
    }

    @Override
    public int hashCode() {
      return Objects.hash(name, value);
    }

    public final String name;
    public final Expr value;
  }

  // `object.attribute = value`
  public static class AttributeAssign extends Stmt {
    public AttributeAssign(
        String object, String attribute, Expr value, int line
    ) {
      super(line);
      this.object = object;
      this.attribute = attribute;
      this.value = value;
    }

    @Override
    public <R, E extends Exception> R accept(Visitor<R, E> visitor)
        throws E {
      return visitor.visitAttributeAssignStmt(this);
    }

    @Override
    public boolean equals(Object other) {
      if (!(other instanceof AttributeAssign))
        return false;
      AttributeAssign that = (AttributeAssign)other;
      return Objects.equals(object, that.object) &&
          Objects.equals(attribute, that.attribute) &&
          Objects.equals(value, that.value);
    }

    @Override
    public int hashCode() {
      return Objects.hash(object, attribute, value);
    }

    public final String object;
    public final String attribute;
    public final Expr value;
  }

  // `name[index] = value`
  public static class SubscriptAssign extends Stmt {
    public SubscriptAssign(String name, Expr index, Expr value, int line) {
      super(line);
      this.name = name;
      this.index = index;
      this.value = value;
    }

    @Override
    public <R, E extends Exception> R accept(Visitor<R, E> visitor)
        throws E {
      return visitor.visitSubscriptAssignStmt(this);
    }

    @Override
    public boolean equals(Object other) {
      if (!(other instanceof SubscriptAssign))
        return false;
      SubscriptAssign that = (SubscriptAssign)other;
      return Objects.equals(name, that.name) &&
          Objects.equals(index, that.index) &&
          Objects.equals(value, that.value);
    }

    @Override
    public int hashCode() {
      return Objects.hash(name, index, value);
    }

    public final String name;
    public final Expr index;
    public final Expr value;
  }

  // a call evaluated for its effects only
  public static class Expression extends Stmt {
    public Expression(Expr expression, int line) {
      super(line);
      this.expression = expression;
    }

    @Override
    public <R, E extends Exception> R accept(Visitor<R, E> visitor)
        throws E {
      return visitor.visitExpressionStmt(this);
    }

    @Override
    public boolean equals(Object other) {
      if (!(other instanceof Expression))
        return false;
      Expression that = (Expression)other;
      return Objects.equals(expression, that.expression);
    }

    @Override
    public int hashCode() {
      return Objects.hash(expression);
    }

    public final Expr expression;
  }

  public static class Print extends Stmt {
    public Print(Expr value, int line) {
      super(line);
      this.value = value;
    }

    @Override
    public <R, E extends Exception> R accept(Visitor<R, E> visitor)
        throws E {
      return visitor.visitPrintStmt(this);
    }

    @Override
    public boolean equals(Object other) {
      if (!(other instanceof Print))
        return false;
      Print that = (Print)other;
      return Objects.equals(value, that.value);
    }

    @Override
    public int hashCode() {
      return Objects.hash(value);
    }

    public final Expr value;
  }

  public static class If extends Stmt {
    public If(
        Expr condition, List<Stmt> thenBranch, List<Stmt> elseBranch, int line
    ) {
      super(line);
      this.condition = condition;
      this.thenBranch = List.copyOf(thenBranch);
      this.elseBranch = List.copyOf(elseBranch);
    }

    @Override
    public <R, E extends Exception> R accept(Visitor<R, E> visitor)
        throws E {
      return visitor.visitIfStmt(this);
    }

    @Override
    public boolean equals(Object other) {
      if (!(other instanceof If))
        return false;
      If that = (If)other;
      return Objects.equals(condition, that.condition) &&
          Objects.equals(thenBranch, that.thenBranch) &&
          Objects.equals(elseBranch, that.elseBranch);
    }

    @Override
    public int hashCode() {
      return Objects.hash(condition, thenBranch, elseBranch);
    }

    public final Expr condition;
    public final List<Stmt> thenBranch;
    public final List<Stmt> elseBranch;
  }

  public static class While extends Stmt {
    public While(Expr condition, List<Stmt> body, int line) {
      super(line);
      this.condition = condition;
      this.body = List.copyOf(body);
    }

    @Override
    public <R, E extends Exception> R accept(Visitor<R, E> visitor)
        throws E {
      return visitor.visitWhileStmt(this);
    }

    @Override
    public boolean equals(Object other) {
      if (!(other instanceof While))
        return false;
      While that = (While)other;
      return Objects.equals(condition, that.condition) &&
          Objects.equals(body, that.body);
    }

    @Override
    public int hashCode() {
      return Objects.hash(condition, body);
    }

    public final Expr condition;
    public final List<Stmt> body;
  }

  // `for variable in range(start, stop, step)`
  public static class For extends Stmt {
    public For(
        String variable, Expr start, Expr stop, Expr step, List<Stmt> body, int line
    ) {
      super(line);
      this.variable = variable;
      this.start = start;
      this.stop = stop;
      this.step = step;
      this.body = List.copyOf(body);
    }

    @Override
    public <R, E extends Exception> R accept(Visitor<R, E> visitor)
        throws E {
      return visitor.visitForStmt(this);
    }

    @Override
    public boolean equals(Object other) {
      if (!(other instanceof For))
        return false;
      For that = (For)other;
      return Objects.equals(variable, that.variable) &&
          Objects.equals(start, that.start) &&
          Objects.equals(stop, that.stop) &&
          Objects.equals(step, that.step) &&
          Objects.equals(body, that.body);
    }

    @Override
    public int hashCode() {
      return Objects.hash(variable, start, stop, step, body);
    }

    public final String variable;
    public final Expr start;
    public final Expr stop;
    public final Expr step;
    public final List<Stmt> body;
  }

  public static class Try extends Stmt {
    public Try(List<Stmt> body, List<Handler> handlers, int line) {
      super(line);
      this.body = List.copyOf(body);
      this.handlers = List.copyOf(handlers);
    }

    @Override
    public <R, E extends Exception> R accept(Visitor<R, E> visitor)
        throws E {
      return visitor.visitTryStmt(this);
    }

    @Override
    public boolean equals(Object other) {
      if (!(other instanceof Try))
        return false;
      Try that = (Try)other;
      return Objects.equals(body, that.body) &&
          Objects.equals(handlers, that.handlers);
    }

    @Override
    public int hashCode() {
      return Objects.hash(body, handlers);
    }

    public final List<Stmt> body;
    public final List<Handler> handlers;
  }

  // `message` is null when the source gives none
  public static class Raise extends Stmt {
    public Raise(ErrorKind kind, String message, int line) {
      super(line);
      this.kind = kind;
      this.message = message;
    }

    @Override
    public <R, E extends Exception> R accept(Visitor<R, E> visitor)
        throws E {
      return visitor.visitRaiseStmt(this);
    }

    @Override
    public boolean equals(Object other) {
      if (!(other instanceof Raise))
        return false;
      Raise that = (Raise)other;
      return Objects.equals(kind, that.kind) &&
          Objects.equals(message, that.message);
    }

    @Override
    public int hashCode() {
      return Objects.hash(kind, message);
    }

    public final ErrorKind kind;
    public final String message;
  }

  public static class Return extends Stmt {
    public Return(Expr value, int line) {
      super(line);
      this.value = value;
    }

    @Override
    public <R, E extends Exception> R accept(Visitor<R, E> visitor)
        throws E {
      return visitor.visitReturnStmt(this);
    }

    @Override
    public boolean equals(Object other) {
      if (!(other instanceof Return))
        return false;
      Return that = (Return)other;
      return Objects.equals(value, that.value);
    }

    @Override
    public int hashCode() {
      return Objects.hash(value);
    }

    public final Expr value;
  }

  public static class Break extends Stmt {
    public Break(int line) {
      super(line);
    }

    @Override
    public <R, E extends Exception> R accept(Visitor<R, E> visitor)
        throws E {
      return visitor.visitBreakStmt(this);
    }

    @Override
    public boolean equals(Object other) {
      return other instanceof Break;
    }

    @Override
    public int hashCode() { return Break.class.hashCode(); }
  }

  public static class Continue extends Stmt {
    public Continue(int line) {
      super(line);
    }

    @Override
    public <R, E extends Exception> R accept(Visitor<R, E> visitor)
        throws E {
      return visitor.visitContinueStmt(this);
    }

    @Override
    public boolean equals(Object other) {
      return other instanceof Continue;
    }

    @Override
    public int hashCode() { return Continue.class.hashCode(); }
  }

  // one `except [kind]:` clause of a `try`; a null `kind` catches everything
  public static class Handler {
    public Handler(ErrorKind kind, List<Stmt> body, int line) {
      this.kind = kind;
      this.body = List.copyOf(body);
      this.line = line;
    }

    public boolean catchesAll() { return kind == null; }

    @Override
    public boolean equals(Object other) {
      if (!(other instanceof Handler))
        return false;
      Handler that = (Handler)other;
      return kind == that.kind && body.equals(that.body);
    }

    @Override
    public int hashCode() { return Objects.hash(kind, body); }

    public final ErrorKind kind;
    public final List<Stmt> body;
    public final int line;
  }
}
