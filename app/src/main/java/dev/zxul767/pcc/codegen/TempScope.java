package dev.zxul767.pcc.codegen;

import dev.zxul767.pcc.typing.Type;
import java.util.ArrayList;
import java.util.List;

// Temporaries of a single statement. They are declared (and initialized) at
// the top of the statement's C block and released at its end, in reverse
// order of creation. A statement never outlives a `longjmp` out of it, so its
// temporaries are never volatile.
class TempScope {
  private final GeneratorState state;
  private final CWriter declarations = new CWriter();
  private final List<String> releases = new ArrayList<>();

  TempScope(GeneratorState state) { this.state = state; }

  String temp(Type type) {
    String name = state.newTemp();
    CNames.declare(declarations, type, name, false);
    String release = CNames.release(type, name);
    if (release != null)
      releases.add(release);
    return name;
  }

  // a temporary of a C type with no counterpart in the source language
  // (`int64_t` for checked narrowing)
  String raw(String cType) {
    String name = state.newTemp();
    declarations.println("%s %s = 0;", cType, name);
    return name;
  }

  boolean isEmpty() { return declarations.isEmpty(); }

  // writes the declarations into `out`, which must be at the indentation of
  // the statement's block
  void declareIn(CWriter out) {
    out.append(reindent(declarations, out));
  }

  void releaseIn(CWriter out) {
    for (int i = releases.size() - 1; i >= 0; i--)
      out.println(releases.get(i));
  }

  private static CWriter reindent(CWriter declarations, CWriter out) {
    CWriter copy = out.child();
    for (String line : declarations.toString().split("\n")) {
      if (!line.isEmpty())
        copy.println(line);
    }
    return copy;
  }
}
