package dev.zxul767.pcc.parsing;

import dev.zxul767.pcc.CompileError;

public class LexError extends CompileError {
  public LexError(String message, int line, int column) {
    super(Stage.LEX, message, line, column);
  }
}
