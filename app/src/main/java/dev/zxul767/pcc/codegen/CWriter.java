package dev.zxul767.pcc.codegen;

// Accumulates C source with block indentation. Function bodies are written
// into a `child()` first because their declarations can only be emitted once
// the body is known.
class CWriter {
  private static final int INDENT_SIZE = 4;

  private final StringBuilder out = new StringBuilder();
  private int indentation;

  CWriter() { this(0); }

  private CWriter(int indentation) { this.indentation = indentation; }

  CWriter child() { return new CWriter(indentation); }

  void openBlock() { openBlock(""); }

  // prints `header {` (or just `{`) and indents
  void openBlock(String header) {
    println(header.isEmpty() ? "{" : header + " {");
    indent();
  }

  void closeBlock() { closeBlock(""); }

  // prints `} trailer` (`} else {`, `};`) after dedenting
  void closeBlock(String trailer) {
    dedent();
    println(trailer.isEmpty() ? "}" : "} " + trailer);
  }

  // `} else {`
  void elseBlock(String header) {
    dedent();
    println("} " + header + " {");
    indent();
  }

  void newline() { out.append('\n'); }

  void println(String s) {
    printIndentation();
    out.append(s);
    newline();
  }

  void println(String format, Object... args) {
    println(String.format(format, args));
  }

  // labels are outdented one level so they stand out from the statements
  void label(String name) {
    out.append(" ".repeat(Math.max(0, indentation - INDENT_SIZE)));
    out.append(name).append(": ;");
    newline();
  }

  // copies text written by a child writer
  void append(CWriter child) { out.append(child.out); }

  // copies text written by a child one level deeper, as if it had been
  // written at this writer's level
  void appendOutdented(CWriter child) {
    String prefix = " ".repeat(INDENT_SIZE);
    for (String line : child.out.toString().split("\n", -1)) {
      if (line.isEmpty())
        continue;
      out.append(line.startsWith(prefix) ? line.substring(INDENT_SIZE) : line);
      newline();
    }
  }

  void indent() { indentation += INDENT_SIZE; }

  void dedent() { indentation -= INDENT_SIZE; }

  boolean isEmpty() { return out.length() == 0; }

  private void printIndentation() { out.append(" ".repeat(indentation)); }

  @Override
  public String toString() {
    return out.toString();
  }
}
