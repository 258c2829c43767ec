package dev.zxul767.pcc.codegen;

import dev.zxul767.pcc.typing.ModuleTypes;
import dev.zxul767.pcc.typing.ScopeTypes;
import dev.zxul767.pcc.typing.Type;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

// Emission state of one C function (a compiled function, method or `main`):
// its typed locals, the hidden locals that loops need, and the loops and
// `try` blocks currently open, which `break`, `continue` and `return` must
// unwind.
class FunctionScope {
  private static class Loop {
    final String breakLabel;
    final String continueLabel;
    // number of open `try` blocks when the loop started
    final int tryDepth;

    Loop(String breakLabel, String continueLabel, int tryDepth) {
      this.breakLabel = breakLabel;
      this.continueLabel = continueLabel;
      this.tryDepth = tryDepth;
    }
  }

  final ModuleTypes types;
  final ScopeTypes locals;
  final GeneratorState state;
  final boolean isMain;
  // locals that must survive a `longjmp` back into this function
  final boolean hasTry;

  private final Deque<Loop> loops = new ArrayDeque<>();
  // innermost last
  private final List<String> tryContexts = new ArrayList<>();
  private final CWriter hiddenDeclarations = new CWriter();
  private final List<String> hiddenReleases = new ArrayList<>();
  private boolean exitUsed = false;

  FunctionScope(
      ModuleTypes types, ScopeTypes locals, GeneratorState state, boolean isMain,
      boolean hasTry
  ) {
    this.types = types;
    this.locals = locals;
    this.state = state;
    this.isMain = isMain;
    this.hasTry = hasTry;
  }

  Value variable(String name) {
    Type type = locals.typeOf(name);
    if (type == null)
      throw new CodegenError(
          String.format("no type for variable '%s' in '%s'", name, locals.name)
      );
    return Value.borrowed(CNames.variable(name), type);
  }

  // A function-level local invisible to the source program (loop bounds and
  // counters). Declared with the other locals so that jumping out of the
  // loop never skips its release.
  String hidden(Type type) {
    String name = state.newTemp();
    CNames.declare(hiddenDeclarations, type, name, hasTry);
    String release = CNames.release(type, name);
    if (release != null)
      hiddenReleases.add(release);
    return name;
  }

  void declareHidden(CWriter out) {
    for (String line : hiddenDeclarations.toString().split("\n")) {
      if (!line.isEmpty())
        out.println(line);
    }
  }

  void releaseHidden(CWriter out) {
    for (String release : hiddenReleases)
      out.println(release);
  }

  void enterLoop(String breakLabel, String continueLabel) {
    loops.push(new Loop(breakLabel, continueLabel, tryContexts.size()));
  }

  void exitLoop() { loops.pop(); }

  void enterTry(String context) { tryContexts.add(context); }

  void exitTry() { tryContexts.remove(tryContexts.size() - 1); }

  void emitBreak(CWriter out, int line) {
    Loop loop = innermostLoop("break", line);
    popTries(out, loop.tryDepth);
    out.println("goto %s;", loop.breakLabel);
  }

  void emitContinue(CWriter out, int line) {
    Loop loop = innermostLoop("continue", line);
    popTries(out, loop.tryDepth);
    out.println("goto %s;", loop.continueLabel);
  }

  void emitReturn(CWriter out) {
    popTries(out, 0);
    exitUsed = true;
    out.println("goto %s;", CNames.EXIT_LABEL);
  }

  boolean exitUsed() { return exitUsed; }

  private Loop innermostLoop(String statement, int line) {
    if (loops.isEmpty())
      throw new CodegenError(
          String.format("'%s' outside loop at line %d", statement, line)
      );
    return loops.peek();
  }

  // pops the `try` contexts opened after the first `depth` ones, innermost
  // first
  private void popTries(CWriter out, int depth) {
    for (int i = tryContexts.size() - 1; i >= depth; i--)
      out.println("rt_try_pop(&%s);", tryContexts.get(i));
  }
}
