package dev.zxul767.pcc.codegen;

import dev.zxul767.pcc.ir.ErrorKind;
import dev.zxul767.pcc.ir.Expr;
import dev.zxul767.pcc.ir.Stmt;
import dev.zxul767.pcc.typing.Type;
import dev.zxul767.pcc.typing.TypeRules;
import java.util.List;

// Lowers the statements of one C function. The expressions of a statement
// are emitted inside their own C block, together with the temporaries they
// need; conditions are first stored in a hidden `int`, so nested bodies never
// run while a statement's temporaries are alive.
class StatementEmitter implements Stmt.Visitor<Void, RuntimeException> {
  private interface Lowering {
    void emit(ExpressionEmitter expressions, CWriter body, TempScope temps);
  }

  private final FunctionScope scope;
  private final CWriter out;
  private final TypeRules rules;

  StatementEmitter(FunctionScope scope, CWriter out) {
    this.scope = scope;
    this.out = out;
    this.rules = scope.types.rules;
  }

  void emit(List<Stmt> statements) {
    for (Stmt statement : statements)
      statement.accept(this);
  }

  private void withTemps(Lowering lowering) { withTemps(lowering, true); }

  // `releaseAtEnd` is false for statements that release their temporaries
  // themselves before jumping away
  private void withTemps(Lowering lowering, boolean releaseAtEnd) {
    TempScope temps = new TempScope(scope.state);
    CWriter body = out.child();
    body.indent();
    lowering.emit(new ExpressionEmitter(scope, body, temps), body, temps);

    if (temps.isEmpty()) {
      out.appendOutdented(body);
      return;
    }
    out.openBlock();
    temps.declareIn(out);
    out.append(body);
    if (releaseAtEnd)
      temps.releaseIn(out);
    out.closeBlock();
  }

  // stores `value` into the variable or field `target` of type `type`
  private void store(
      ExpressionEmitter expressions, CWriter body, TempScope temps, String target,
      Type type, Value value, int line
  ) {
    Value source = expressions.coerce(value, type, line);
    switch (type.kind) {
    case INT:
    case FLOAT:
    case BOOL:
      body.println("%s = %s;", target, source.code);
      break;
    case BIGINT:
      if (!source.code.equals(target))
        body.println("rt_int_copy(&%s, &%s);", target, source.code);
      break;
    case STR: {
      String moved = source.code;
      if (!source.owned) {
        moved = temps.temp(Type.STR);
        body.println("%s = %s;", moved, CNames.copyString(source.code));
      }
      body.println("rt_str_clear(&%s);", target);
      body.println("%s = %s;", target, moved);
      body.println("%s = rt_str_null();", moved);
      break;
    }
    case LIST:
      move(body, target, source, "rt_list_si_clear(&%s);", "rt_list_si_init(&%s);");
      break;
    case DICT:
      move(body, target, source, "rt_dict_ssi_clear(&%s);", "rt_dict_ssi_init(&%s);");
      break;
    case OBJECT: {
      // the previous instance is released before rebinding
      String release = CNames.destructor(type.className) + "(%s);";
      move(body, target, source, release, "%s = NULL;");
      break;
    }
    default:
      throw new CodegenError(
          String.format("cannot store a value of type %s", value.type)
      );
    }
  }

  // containers and objects are never shared, so they are always moved out
  // of the temporary that built them
  private static void move(
      CWriter body, String target, Value source, String release, String reset
  ) {
    if (!source.owned)
      throw new CodegenError(
          String.format("'%s' would alias '%s'", target, source.code)
      );
    body.println(release, target);
    body.println("%s = %s;", target, source.code);
    body.println(reset, source.code);
  }

  @Override
  public Void visitAssignStmt(Stmt.Assign stmt) {
    withTemps((expressions, body, temps) -> {
      Value value = expressions.emit(stmt.value);
      Value target = scope.variable(stmt.name);
      store(expressions, body, temps, target.code, target.type, value, stmt.line);
    });
    return null;
  }

  @Override
  public Void visitAttributeAssignStmt(Stmt.AttributeAssign stmt) {
    withTemps((expressions, body, temps) -> {
      Value value = expressions.emit(stmt.value);
      Value object = scope.variable(stmt.object);
      String field =
          String.format("%s->%s", object.code, CNames.field(stmt.attribute));
      store(expressions, body, temps, field, rules.integer(), value, stmt.line);
    });
    return null;
  }

  @Override
  public Void visitSubscriptAssignStmt(Stmt.SubscriptAssign stmt) {
    withTemps((expressions, body, temps) -> {
      Value dict = scope.variable(stmt.name);
      Value key = expressions.emit(stmt.index);
      Value value = expressions.emit(stmt.value, Type.INT);
      body.println("rt_dict_ssi_set(&%s, %s, %s);", dict.code, key.code, value.code);
    });
    return null;
  }

  @Override
  public Void visitExpressionStmt(Stmt.Expression stmt) {
    withTemps((expressions, body, temps) -> {
      Value value = expressions.emit(stmt.expression);
      // pure expressions left over (`len(s)`) have no effect
      if (!value.is(Type.Kind.NONE) && !value.owned)
        body.println("(void)%s;", value.code);
    });
    return null;
  }

  @Override
  public Void visitPrintStmt(Stmt.Print stmt) {
    withTemps((expressions, body, temps) -> {
      Value value = expressions.emit(stmt.value);
      switch (value.type.kind) {
      case INT:
        body.println("printf(\"%%lld\\n\", %s);", value.code);
        break;
      case BIGINT:
        body.println("rt_print_int(&%s);", value.code);
        break;
      case BOOL:
        body.println("puts(%s ? \"True\" : \"False\");", value.code);
        break;
      case FLOAT:
        scope.state.usesFloats = true;
        body.println("pcc_print_float(%s);", value.code);
        break;
      case STR:
        body.println("rt_print_str(%s);", value.code);
        break;
      default:
        throw new CodegenError("cannot print a value of type " + value.type);
      }
    });
    return null;
  }

  // hidden `int` holding the truth value of `condition`
  private String condition(Expr condition) {
    String flag = scope.hidden(Type.BOOL);
    withTemps((expressions, body, temps) -> {
      body.println("%s = %s;", flag, expressions.truth(expressions.emit(condition)));
    });
    return flag;
  }

  @Override
  public Void visitIfStmt(Stmt.If stmt) {
    String flag = condition(stmt.condition);
    out.openBlock(String.format("if (%s)", flag));
    emit(stmt.thenBranch);
    if (!stmt.elseBranch.isEmpty()) {
      out.elseBlock("else");
      emit(stmt.elseBranch);
    }
    out.closeBlock();
    return null;
  }

  // whileStatement -> start: cond; if (!cond) goto end; body; goto start; end:
  @Override
  public Void visitWhileStmt(Stmt.While stmt) {
    int id = scope.state.newLabelId();
    String start = CNames.label("while", id);
    String end = CNames.label("while_end", id);

    out.label(start);
    String flag = condition(stmt.condition);
    out.println("if (!%s) goto %s;", flag, end);
    loopBody(stmt.body, end, start);
    out.println("goto %s;", start);
    out.label(end);
    return null;
  }

  private void loopBody(List<Stmt> body, String breakLabel, String continueLabel) {
    scope.enterLoop(breakLabel, continueLabel);
    out.openBlock();
    emit(body);
    out.closeBlock();
    scope.exitLoop();
  }

  // The bounds are evaluated once into hidden locals and the counter is
  // copied into the loop variable on every iteration, so assigning to the
  // variable in the body doesn't change the iteration. The direction depends
  // on the sign of the step, which is only known at runtime.
  @Override
  public Void visitForStmt(Stmt.For stmt) {
    int id = scope.state.newLabelId();
    String head = CNames.label("for", id);
    String next = CNames.label("for_next", id);
    String end = CNames.label("for_end", id);
    Value variable = scope.variable(stmt.variable);
    Type type = variable.type;

    String counter = scope.hidden(type);
    String stop = scope.hidden(type);
    String step = scope.hidden(type);
    withTemps((expressions, body, temps) -> {
      Value startValue = expressions.emit(stmt.start, type);
      Value stopValue = expressions.emit(stmt.stop, type);
      Value stepValue = expressions.emit(stmt.step, type);
      store(expressions, body, temps, counter, type, startValue, stmt.line);
      store(expressions, body, temps, stop, type, stopValue, stmt.line);
      store(expressions, body, temps, step, type, stepValue, stmt.line);
    });
    String zeroStep =
        CNames.raise(ErrorKind.VALUE, "range() arg 3 must not be zero", stmt.line);

    if (type.is(Type.Kind.BIGINT)) {
      String zero = scope.hidden(Type.BIGINT);
      String ascending = scope.hidden(Type.BOOL);
      String sum = scope.hidden(Type.BIGINT);
      out.println("if (rt_int_is_zero(&%s)) %s", step, zeroStep);
      out.println("rt_int_set_si(&%s, 0);", zero);
      out.println("%s = rt_int_cmp(&%s, &%s) > 0;", ascending, step, zero);
      out.label(head);
      out.println(
          "if (%s ? rt_int_cmp(&%s, &%s) >= 0 : rt_int_cmp(&%s, &%s) <= 0) goto %s;",
          ascending, counter, stop, counter, stop, end
      );
      out.println("rt_int_copy(&%s, &%s);", variable.code, counter);
      loopBody(stmt.body, end, next);
      out.label(next);
      out.println("rt_int_add(&%s, &%s, &%s);", sum, counter, step);
      out.println("rt_int_copy(&%s, &%s);", counter, sum);
    } else {
      out.println("if (%s == 0) %s", step, zeroStep);
      out.label(head);
      out.println(
          "if (%s > 0 ? %s >= %s : %s <= %s) goto %s;", step, counter, stop, counter,
          stop, end
      );
      out.println("%s = %s;", variable.code, counter);
      loopBody(stmt.body, end, next);
      out.label(next);
      // a counter that would overflow is past any native stop
      out.println(
          "if (%s > 0 ? %s > LLONG_MAX - %s : %s < LLONG_MIN - %s) goto %s;", step, counter,
          step, counter, step, end
      );
      out.println("%s += %s;", counter, step);
    }
    out.println("goto %s;", head);
    out.label(end);
    return null;
  }

  // tryStatement -> push; if (setjmp(...) == 0) { body; pop } else { pop;
  //                 dispatch on the kind of the exception }
  @Override
  public Void visitTryStmt(Stmt.Try stmt) {
    String context = CNames.label("try", scope.state.newLabelId());
    out.openBlock();
    out.println("rt_try_ctx %s;", context);
    out.println("rt_try_push(&%s);", context);
    out.openBlock(String.format("if (setjmp(%s.env) == 0)", context));
    scope.enterTry(context);
    emit(stmt.body);
    scope.exitTry();
    out.println("rt_try_pop(&%s);", context);
    out.elseBlock("else");
    out.println("rt_try_pop(&%s);", context);
    handlers(stmt.handlers);
    out.closeBlock();
    out.closeBlock();
    return null;
  }

  // `except Exception` catches every kind, like a bare `except`; clauses
  // after it are unreachable
  private void handlers(List<Stmt.Handler> handlers) {
    boolean caughtAll = false;
    for (int i = 0; i < handlers.size(); i++) {
      Stmt.Handler handler = handlers.get(i);
      boolean all = handler.catchesAll() || handler.kind == ErrorKind.GENERIC;
      String header;
      if (all) {
        header = i == 0 ? "" : "else";
      } else {
        header = String.format(
            "%sif (rt_exc_is(%s))", i == 0 ? "" : "else ", handler.kind.runtimeName
        );
      }
      if (i == 0) {
        out.openBlock(header);
      } else {
        out.elseBlock(header);
      }
      out.println("rt_exc_clear();");
      emit(handler.body);
      if (all) {
        caughtAll = true;
        break;
      }
    }
    if (!caughtAll) {
      out.elseBlock("else");
      out.println("rt_reraise();");
    }
    out.closeBlock();
  }

  @Override
  public Void visitRaiseStmt(Stmt.Raise stmt) {
    out.println(CNames.raise(stmt.kind, stmt.message, stmt.line));
    return null;
  }

  @Override
  public Void visitReturnStmt(Stmt.Return stmt) {
    withTemps((expressions, body, temps) -> {
      Value value = expressions.emit(stmt.value, rules.integer());
      if (value.is(Type.Kind.BIGINT)) {
        body.println("rt_int_copy(%s, &%s);", CNames.OUT, value.code);
      } else {
        body.println("%s = %s;", CNames.RESULT, value.code);
      }
      temps.releaseIn(body);
      scope.emitReturn(body);
    }, false);
    return null;
  }

  @Override
  public Void visitBreakStmt(Stmt.Break stmt) {
    scope.emitBreak(out, stmt.line);
    return null;
  }

  @Override
  public Void visitContinueStmt(Stmt.Continue stmt) {
    scope.emitContinue(out, stmt.line);
    return null;
  }
}
