package dev.zxul767.pcc;

// Base of every user-facing compile-time failure. Each stage of the pipeline
// declares the subclass it may raise, so a failure stops the whole compilation
// and carries the stage and source position that produced it.
public abstract class CompileError extends Exception {
  public enum Stage {
    LEX("Lexing"),
    PARSE("Parsing"),
    TYPE("Type");

    public final String label;

    Stage(String label) { this.label = label; }
  }

  public final Stage stage;
  // both are 1-based; zero means "unknown"
  public final int line;
  public final int column;

  protected CompileError(Stage stage, String message, int line, int column) {
    super(message);
    this.stage = stage;
    this.line = line;
    this.column = column;
  }

  public String location() {
    if (line <= 0)
      return "";
    if (column <= 0)
      return String.format("[line %d] ", line);
    return String.format("[line %d, column %d] ", line, column);
  }

  @Override
  public String toString() {
    return String.format("%s Error: %s%s", stage.label, location(), getMessage());
  }
}
