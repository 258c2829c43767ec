package dev.zxul767.pcc.typing;

import dev.zxul767.pcc.Backend;
import dev.zxul767.pcc.ir.ClassDef;
import dev.zxul767.pcc.ir.Expr;
import dev.zxul767.pcc.ir.FieldDef;
import dev.zxul767.pcc.ir.FunctionDef;
import dev.zxul767.pcc.ir.ModuleIR;
import dev.zxul767.pcc.ir.Stmt;
import dev.zxul767.pcc.ir.UnaryOp;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

// Infers a storage type for every name of every scope and rejects programs
// whose operations don't fit those types. Each scope is walked statement by
// statement: branches are inferred on copies of the environment and merged
// afterwards, and loop bodies are inferred once against the environment
// before the loop.
public class TypeChecker
    implements Stmt.Visitor<Void, TypeError>, Expr.Visitor<Type, TypeError> {
  private static final Logger logger = LoggerFactory.getLogger(TypeChecker.class);

  private final ModuleIR module;
  private final Backend backend;
  private final TypeRules rules;
  private TypeEnv env;
  // name of the receiver parameter of the method being checked
  private String self;

  public TypeChecker(ModuleIR module, Backend backend) {
    this.module = module;
    this.backend = backend;
    this.rules = new TypeRules(backend);
  }

  public static ModuleTypes check(ModuleIR module, Backend backend)
      throws TypeError {
    return new TypeChecker(module, backend).check();
  }

  public ModuleTypes check() throws TypeError {
    ModuleTypes types = new ModuleTypes(module, backend);
    for (ClassDef classDef : module.classes) {
      checkFields(classDef);
      for (FunctionDef method : classDef.methods)
        types.addMethod(
            classDef.name, checkScope(method.name, method.params, classDef, method.body)
        );
    }
    for (FunctionDef function : module.functions)
      types.addFunction(
          checkScope(function.name, function.params, null, function.body)
      );
    types.setMain(checkScope("main", List.of(), null, module.mainStatements));
    return types;
  }

  // fields are integer slots, so in the fast backend their initial values
  // must be native
  private void checkFields(ClassDef classDef) throws TypeError {
    for (FieldDef field : classDef.fields) {
      if (!backend.literalType(field.initialValue).equals(rules.integer()))
        throw new TypeError(
            String.format(
                "initial value of field '%s.%s' does not fit in a native int",
                classDef.name, field.name
            ),
            classDef.sourceLine
        );
    }
  }

  private ScopeTypes checkScope(
      String name, List<String> params, ClassDef owner, List<Stmt> body
  ) throws TypeError {
    Set<String> promoted = new HashSet<>();
    self = owner == null ? null : params.get(0);
    while (true) {
      TypeEnv.Scope scope = new TypeEnv.Scope(backend, promoted);
      env = new TypeEnv(scope);
      for (int i = 0; i < params.size(); i++) {
        if (owner != null && i == 0) {
          env.declareFixed(params.get(i), Type.object(owner.name));
        } else {
          env.declareFixed(params.get(i), rules.integer());
        }
      }
      check(body);

      if (!scope.promotedSomething)
        return new ScopeTypes(name, params, env.declared());
      // the names promoted to bigint were inferred as native ints before
      // their promotion, so the scope is inferred again
      logger.debug("Re-checking '{}' after promoting {} to bigint", name, promoted);
    }
  }

  private void check(List<Stmt> statements) throws TypeError {
    for (Stmt statement : statements)
      statement.accept(this);
  }

  private Type infer(Expr expr) throws TypeError { return expr.accept(this); }

  @Override
  public Void visitAssignStmt(Stmt.Assign stmt) throws TypeError {
    if (stmt.name.equals(self))
      throw new TypeError(
          String.format("cannot assign to '%s'", stmt.name), stmt.line
      );
    Type value = infer(stmt.value);
    if (value.is(Type.Kind.NONE))
      throw new TypeError(
          String.format("cannot assign a call without result to '%s'", stmt.name),
          stmt.line
      );
    if (value.is(Type.Kind.OBJECT) && !(stmt.value instanceof Expr.ConstructorCall))
      throw new TypeError(
          String.format(
              "'%s' must be assigned a new object: objects cannot be shared between names",
              stmt.name
          ),
          stmt.line
      );
    if ((value.is(Type.Kind.LIST) || value.is(Type.Kind.DICT)) &&
        !(stmt.value instanceof Expr.ListLiteral) &&
        !(stmt.value instanceof Expr.DictLiteral))
      throw new TypeError(
          String.format(
              "'%s' must be assigned a %s literal: containers cannot be shared between names",
              stmt.name, value
          ),
          stmt.line
      );
    env.assign(stmt.name, value, stmt.line);
    return null;
  }

  @Override
  public Void visitAttributeAssignStmt(Stmt.AttributeAssign stmt)
      throws TypeError {
    field(stmt.object, stmt.attribute, stmt.line);
    rules.integerSlot(
        infer(stmt.value), String.format("field '%s'", stmt.attribute), stmt.line
    );
    return null;
  }

  @Override
  public Void visitSubscriptAssignStmt(Stmt.SubscriptAssign stmt)
      throws TypeError {
    Type receiver = lookup(stmt.name, stmt.line);
    if (receiver.is(Type.Kind.LIST))
      throw new TypeError("list item assignment is not supported", stmt.line);
    if (!receiver.is(Type.Kind.DICT))
      throw new TypeError(
          String.format("'%s' object does not support item assignment", receiver),
          stmt.line
      );
    dictKey(infer(stmt.index), stmt.line);
    rules.integerSlot(infer(stmt.value), "dict value", stmt.line);
    return null;
  }

  @Override
  public Void visitExpressionStmt(Stmt.Expression stmt) throws TypeError {
    infer(stmt.expression);
    return null;
  }

  @Override
  public Void visitPrintStmt(Stmt.Print stmt) throws TypeError {
    rules.printable(infer(stmt.value), stmt.line);
    return null;
  }

  @Override
  public Void visitIfStmt(Stmt.If stmt) throws TypeError {
    rules.condition(infer(stmt.condition), stmt.line);

    TypeEnv before = env;
    TypeEnv thenEnv = before.copy();
    env = thenEnv;
    check(stmt.thenBranch);

    TypeEnv elseEnv = before.copy();
    env = elseEnv;
    check(stmt.elseBranch);

    env = before;
    before.merge(List.of(thenEnv, elseEnv), stmt.line);
    return null;
  }

  @Override
  public Void visitWhileStmt(Stmt.While stmt) throws TypeError {
    rules.condition(infer(stmt.condition), stmt.line);
    loopBody(stmt.body, null, null, stmt.line);
    return null;
  }

  @Override
  public Void visitForStmt(Stmt.For stmt) throws TypeError {
    Type start = infer(stmt.start);
    Type stop = infer(stmt.stop);
    Type step = infer(stmt.step);
    rules.integerSlot(start, "range() start", stmt.line);
    rules.integerSlot(stop, "range() stop", stmt.line);
    rules.integerSlot(step, "range() step", stmt.line);

    Type counter = rules.join(rules.join(start, stop), step);
    loopBody(stmt.body, stmt.variable, counter, stmt.line);
    return null;
  }

  private void loopBody(
      List<Stmt> body, String variable, Type variableType, int line
  ) throws TypeError {
    TypeEnv before = env;
    TypeEnv skipped = before.copy();
    TypeEnv bodyEnv = before.copy();
    env = bodyEnv;
    if (variable != null)
      bodyEnv.assign(variable, variableType, line);
    check(body);

    env = before;
    before.merge(List.of(skipped, bodyEnv), line);
  }

  @Override
  public Void visitTryStmt(Stmt.Try stmt) throws TypeError {
    TypeEnv before = env;
    List<TypeEnv> branches = new ArrayList<>();

    env = before.copy();
    branches.add(env);
    check(stmt.body);
    for (Stmt.Handler handler : stmt.handlers) {
      env = before.copy();
      branches.add(env);
      check(handler.body);
    }

    env = before;
    before.merge(branches, stmt.line);
    return null;
  }

  @Override
  public Void visitRaiseStmt(Stmt.Raise stmt) {
    return null;
  }

  @Override
  public Void visitReturnStmt(Stmt.Return stmt) throws TypeError {
    rules.integerSlot(infer(stmt.value), "return value", stmt.line);
    return null;
  }

  @Override
  public Void visitBreakStmt(Stmt.Break stmt) {
    return null;
  }

  @Override
  public Void visitContinueStmt(Stmt.Continue stmt) {
    return null;
  }

  @Override
  public Type visitIntLiteralExpr(Expr.IntLiteral expr) {
    return backend.literalType(expr.value);
  }

  @Override
  public Type visitFloatLiteralExpr(Expr.FloatLiteral expr) {
    return Type.FLOAT;
  }

  @Override
  public Type visitStrLiteralExpr(Expr.StrLiteral expr) {
    return Type.STR;
  }

  @Override
  public Type visitListLiteralExpr(Expr.ListLiteral expr) throws TypeError {
    for (Expr element : expr.elements)
      rules.integerSlot(infer(element), "list element", expr.line);
    return Type.LIST;
  }

  @Override
  public Type visitDictLiteralExpr(Expr.DictLiteral expr) throws TypeError {
    for (int i = 0; i < expr.keys.size(); i++) {
      dictKey(infer(expr.keys.get(i)), expr.line);
      rules.integerSlot(infer(expr.values.get(i)), "dict value", expr.line);
    }
    return Type.DICT;
  }

  @Override
  public Type visitVariableExpr(Expr.Variable expr) throws TypeError {
    return lookup(expr.name, expr.line);
  }

  @Override
  public Type visitBinaryExpr(Expr.Binary expr) throws TypeError {
    Type left = infer(expr.left);
    Type right = infer(expr.right);
    return rules.arithmetic(expr.operator, left, right, expr.line);
  }

  @Override
  public Type visitCompareExpr(Expr.Compare expr) throws TypeError {
    Type left = infer(expr.left);
    Type right = infer(expr.right);
    return rules.comparison(expr.operator, left, right, expr.line);
  }

  @Override
  public Type visitLogicalExpr(Expr.Logical expr) throws TypeError {
    rules.condition(infer(expr.left), expr.line);
    rules.condition(infer(expr.right), expr.line);
    return Type.BOOL;
  }

  @Override
  public Type visitUnaryExpr(Expr.Unary expr) throws TypeError {
    Type operand = infer(expr.operand);
    if (expr.operator == UnaryOp.NOT) {
      rules.condition(operand, expr.line);
      return Type.BOOL;
    }
    return rules.negate(operand, expr.line);
  }

  @Override
  public Type visitSubscriptExpr(Expr.Subscript expr) throws TypeError {
    Type receiver = lookup(expr.name, expr.line);
    Type index = infer(expr.index);
    switch (receiver.kind) {
    case LIST:
      rules.integerSlot(index, "list index", expr.line);
      return rules.integer();
    case STR:
      rules.integerSlot(index, "string index", expr.line);
      return Type.STR;
    case DICT:
      dictKey(index, expr.line);
      return rules.integer();
    default:
      throw new TypeError(
          String.format("'%s' object is not subscriptable", receiver), expr.line
      );
    }
  }

  @Override
  public Type visitCallExpr(Expr.Call expr) throws TypeError {
    integerArguments(expr.arguments, expr.function, expr.line);
    return rules.integer();
  }

  @Override
  public Type visitAttributeExpr(Expr.Attribute expr) throws TypeError {
    field(expr.object, expr.attribute, expr.line);
    return rules.integer();
  }

  @Override
  public Type visitMethodCallExpr(Expr.MethodCall expr) throws TypeError {
    Type receiver = lookup(expr.object, expr.line);
    if (receiver.is(Type.Kind.LIST) && expr.method.equals("append")) {
      if (expr.arguments.size() != 1)
        throw new TypeError(
            String.format(
                "append() expects exactly one argument, got %d",
                expr.arguments.size()
            ),
            expr.line
        );
      rules.integerSlot(infer(expr.arguments.get(0)), "list element", expr.line);
      return Type.NONE;
    }
    if (!receiver.is(Type.Kind.OBJECT))
      throw noAttribute(receiver, expr.method, expr.line);

    FunctionDef method = module.classNamed(receiver.className).method(expr.method);
    if (method == null)
      throw noAttribute(receiver, expr.method, expr.line);
    int arity = method.arity() - 1;
    if (arity != expr.arguments.size())
      throw new TypeError(
          String.format(
              "%s.%s() expects %d args, got %d", receiver.className, expr.method,
              arity, expr.arguments.size()
          ),
          expr.line
      );
    integerArguments(expr.arguments, expr.method, expr.line);
    return rules.integer();
  }

  @Override
  public Type visitConstructorCallExpr(Expr.ConstructorCall expr)
      throws TypeError {
    integerArguments(expr.arguments, expr.className, expr.line);
    return Type.object(expr.className);
  }

  @Override
  public Type visitBuiltinCallExpr(Expr.BuiltinCall expr) throws TypeError {
    List<Type> arguments = new ArrayList<>();
    for (Expr argument : expr.arguments)
      arguments.add(infer(argument));
    return rules.builtin(expr.builtin, arguments, expr.line);
  }

  private void integerArguments(List<Expr> arguments, String callee, int line)
      throws TypeError {
    for (int i = 0; i < arguments.size(); i++) {
      rules.integerSlot(
          infer(arguments.get(i)),
          String.format("argument %d of %s()", i + 1, callee), line
      );
    }
  }

  private void field(String object, String attribute, int line)
      throws TypeError {
    Type receiver = lookup(object, line);
    if (!receiver.is(Type.Kind.OBJECT) ||
        !module.classNamed(receiver.className).hasField(attribute))
      throw noAttribute(receiver, attribute, line);
  }

  private void dictKey(Type key, int line) throws TypeError {
    if (!key.is(Type.Kind.STR))
      throw new TypeError(
          String.format("dict keys must be str, got '%s'", key), line
      );
  }

  private Type lookup(String name, int line) throws TypeError {
    Type type = env.lookup(name);
    if (type == null)
      throw new TypeError(
          String.format("variable '%s' used before assignment", name), line
      );
    return type;
  }

  private static TypeError noAttribute(Type receiver, String attribute, int line) {
    return new TypeError(
        String.format("'%s' object has no attribute '%s'", receiver, attribute),
        line
    );
  }
}
