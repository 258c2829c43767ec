package dev.zxul767.pcc.parsing;

public class Token {
  // `Token` is just a data structure with no behavior so it's okay for
  // its fields to be public
  public final TokenType type;
  public final String lexeme;
  // decoded literal: `BigInteger`, `Double` or `String` (null otherwise)
  public final Object value;
  public final int line;
  public final int column;

  public Token(TokenType type, String lexeme, Object value, int line, int column) {
    this.type = type;
    this.lexeme = lexeme;
    this.value = value;
    this.line = line;
    this.column = column;
  }

  public Token(TokenType type, String lexeme) {
    this(type, lexeme, /*value:*/ null, /*line:*/ 1, /*column:*/ 1);
  }

  public String toString() { return type + " " + lexeme + " " + value; }
}
