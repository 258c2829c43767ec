package dev.zxul767.pcc.ir;

import java.util.ArrayList;
import java.util.List;

// Renders IR as s-expressions (used by tests and the REPL's `:ir` command)
public class AstPrinter
    implements Expr.Visitor<String, RuntimeException>,
               Stmt.Visitor<String, RuntimeException> {
  public String print(Expr expr) { return expr.accept(this); }

  public String print(Stmt stmt) { return stmt.accept(this); }

  public String print(ModuleIR module) {
    StringBuilder builder = new StringBuilder();
    for (ClassDef classDef : module.classes)
      builder.append(print(classDef)).append("\n");
    for (FunctionDef function : module.functions)
      builder.append(print(function)).append("\n");
    for (Stmt stmt : module.mainStatements)
      builder.append(print(stmt)).append("\n");
    return builder.toString();
  }

  public String print(FunctionDef function) {
    return String.format(
        "(def %s (%s) %s)", function.name, String.join(" ", function.params),
        block(function.body)
    );
  }

  public String print(ClassDef classDef) {
    List<String> parts = new ArrayList<>();
    for (FieldDef field : classDef.fields)
      parts.add(field.toString());
    StringBuilder builder = new StringBuilder();
    builder.append("(class ").append(classDef.name);
    builder.append(" (fields");
    for (String part : parts)
      builder.append(" ").append(part);
    builder.append(")");
    for (FunctionDef method : classDef.methods)
      builder.append(" ").append(print(method));
    return builder.append(")").toString();
  }

  @Override
  public String visitIntLiteralExpr(Expr.IntLiteral expr) {
    return expr.value.toString();
  }

  @Override
  public String visitFloatLiteralExpr(Expr.FloatLiteral expr) {
    return Double.toString(expr.value);
  }

  @Override
  public String visitStrLiteralExpr(Expr.StrLiteral expr) {
    return quote(expr.value);
  }

  @Override
  public String visitListLiteralExpr(Expr.ListLiteral expr) {
    return parenthesize("list", expr.elements);
  }

  @Override
  public String visitDictLiteralExpr(Expr.DictLiteral expr) {
    List<Expr> entries = new ArrayList<>();
    for (int i = 0; i < expr.keys.size(); i++) {
      entries.add(expr.keys.get(i));
      entries.add(expr.values.get(i));
    }
    return parenthesize("dict", entries);
  }

  @Override
  public String visitVariableExpr(Expr.Variable expr) {
    return expr.name;
  }

  @Override
  public String visitBinaryExpr(Expr.Binary expr) {
    return parenthesize(expr.operator.symbol, expr.left, expr.right);
  }

  @Override
  public String visitCompareExpr(Expr.Compare expr) {
    return parenthesize(expr.operator.symbol, expr.left, expr.right);
  }

  @Override
  public String visitLogicalExpr(Expr.Logical expr) {
    return parenthesize(expr.operator.symbol, expr.left, expr.right);
  }

  @Override
  public String visitUnaryExpr(Expr.Unary expr) {
    return parenthesize(expr.operator.symbol, expr.operand);
  }

  @Override
  public String visitSubscriptExpr(Expr.Subscript expr) {
    return parenthesize("index " + expr.name, expr.index);
  }

  @Override
  public String visitCallExpr(Expr.Call expr) {
    return parenthesize("call " + expr.function, expr.arguments);
  }

  @Override
  public String visitAttributeExpr(Expr.Attribute expr) {
    return String.format("(get %s %s)", expr.object, expr.attribute);
  }

  @Override
  public String visitMethodCallExpr(Expr.MethodCall expr) {
    return parenthesize(
        String.format("method %s %s", expr.object, expr.method), expr.arguments
    );
  }

  @Override
  public String visitConstructorCallExpr(Expr.ConstructorCall expr) {
    return parenthesize("new " + expr.className, expr.arguments);
  }

  @Override
  public String visitBuiltinCallExpr(Expr.BuiltinCall expr) {
    return parenthesize(expr.builtin.name, expr.arguments);
  }

  @Override
  public String visitAssignStmt(Stmt.Assign stmt) {
    return parenthesize("assign " + stmt.name, stmt.value);
  }

  @Override
  public String visitAttributeAssignStmt(Stmt.AttributeAssign stmt) {
    return parenthesize(
        String.format("set %s %s", stmt.object, stmt.attribute), stmt.value
    );
  }

  @Override
  public String visitSubscriptAssignStmt(Stmt.SubscriptAssign stmt) {
    return parenthesize("setindex " + stmt.name, stmt.index, stmt.value);
  }

  @Override
  public String visitExpressionStmt(Stmt.Expression stmt) {
    return parenthesize("expr", stmt.expression);
  }

  @Override
  public String visitPrintStmt(Stmt.Print stmt) {
    return parenthesize("print", stmt.value);
  }

  @Override
  public String visitIfStmt(Stmt.If stmt) {
    String result =
        String.format("(if %s %s", print(stmt.condition), block(stmt.thenBranch));
    if (!stmt.elseBranch.isEmpty())
      result += " " + block(stmt.elseBranch);
    return result + ")";
  }

  @Override
  public String visitWhileStmt(Stmt.While stmt) {
    return String.format(
        "(while %s %s)", print(stmt.condition), block(stmt.body)
    );
  }

  @Override
  public String visitForStmt(Stmt.For stmt) {
    return String.format(
        "(for %s %s %s %s %s)", stmt.variable, print(stmt.start),
        print(stmt.stop), print(stmt.step), block(stmt.body)
    );
  }

  @Override
  public String visitTryStmt(Stmt.Try stmt) {
    StringBuilder builder = new StringBuilder("(try ");
    builder.append(block(stmt.body));
    for (Stmt.Handler handler : stmt.handlers) {
      builder.append(" (except");
      if (!handler.catchesAll())
        builder.append(" ").append(handler.kind.sourceName);
      builder.append(" ").append(block(handler.body)).append(")");
    }
    return builder.append(")").toString();
  }

  @Override
  public String visitRaiseStmt(Stmt.Raise stmt) {
    if (stmt.message == null)
      return String.format("(raise %s)", stmt.kind.sourceName);
    return String.format(
        "(raise %s %s)", stmt.kind.sourceName, quote(stmt.message)
    );
  }

  @Override
  public String visitReturnStmt(Stmt.Return stmt) {
    return parenthesize("return", stmt.value);
  }

  @Override
  public String visitBreakStmt(Stmt.Break stmt) {
    return "(break)";
  }

  @Override
  public String visitContinueStmt(Stmt.Continue stmt) {
    return "(continue)";
  }

  private String block(List<Stmt> statements) {
    StringBuilder builder = new StringBuilder("(");
    for (int i = 0; i < statements.size(); i++) {
      if (i > 0)
        builder.append(" ");
      builder.append(print(statements.get(i)));
    }
    return builder.append(")").toString();
  }

  private String parenthesize(String name, Expr... exprs) {
    return parenthesize(name, List.of(exprs));
  }

  private String parenthesize(String name, List<Expr> exprs) {
    StringBuilder builder = new StringBuilder();

    builder.append("(").append(name);
    for (Expr expr : exprs) {
      builder.append(" ");
      builder.append(expr.accept(this));
    }
    builder.append(")");

    return builder.toString();
  }

  private static String quote(String value) {
    return "\"" + value.replace("\\", "\\\\").replace("\"", "\\\"").replace("\n", "\\n") +
        "\"";
  }
}
