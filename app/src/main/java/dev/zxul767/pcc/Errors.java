package dev.zxul767.pcc;

import dev.zxul767.pcc.codegen.CodegenError;
import java.io.PrintStream;

// Prints diagnostics for the user. Developer-facing tracing goes through
// SLF4J instead.
public class Errors {
  private final PrintStream out;

  public Errors(PrintStream out) { this.out = out; }

  public Errors() { this(System.err); }

  public void report(String sourceName, CompileError error) {
    out.println(String.format("%s: %s", sourceName, error));
    out.flush();
  }

  public void internal(CodegenError error) {
    out.println(String.format("Internal Error: %s", error.getMessage()));
    out.flush();
  }
}
