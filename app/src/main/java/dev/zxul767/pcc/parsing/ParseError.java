package dev.zxul767.pcc.parsing;

import dev.zxul767.pcc.CompileError;

public class ParseError extends CompileError {
  public ParseError(String message, int line, int column) {
    super(Stage.PARSE, message, line, column);
  }

  public ParseError(Token token, String message) {
    super(Stage.PARSE, decorate(token, message), token.line, token.column);
  }

  private static String decorate(Token token, String message) {
    switch (token.type) {
    case END:
      return message + " (at end)";
    case NEWLINE:
      return message + " (at end of line)";
    case INDENT:
    case DEDENT:
      return message + " (at indentation)";
    default:
      return String.format("%s (at '%s')", message, token.lexeme);
    }
  }
}
