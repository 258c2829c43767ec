package dev.zxul767.pcc.parsing;

public enum TokenType {
  // Single-character tokens.
  LEFT_PAREN,
  RIGHT_PAREN,
  LEFT_BRACKET,
  RIGHT_BRACKET,
  LEFT_BRACE,
  RIGHT_BRACE,
  COLON,
  COMMA,
  DOT,
  MINUS,
  PLUS,
  STAR,
  SLASH,
  PERCENT,
  EQUAL,
  LESS,
  GREATER,

  // Two or three character tokens.
  SLASH_SLASH,
  STAR_STAR,
  EQUAL_EQUAL,
  BANG_EQUAL,
  LESS_EQUAL,
  GREATER_EQUAL,
  PLUS_EQUAL,
  MINUS_EQUAL,
  STAR_EQUAL,
  SLASH_SLASH_EQUAL,
  PERCENT_EQUAL,

  // Literals.
  IDENTIFIER,
  STRING,
  NUMBER,

  // Keywords.
  AND,
  BREAK,
  CLASS,
  CONTINUE,
  DEF,
  ELIF,
  ELSE,
  EXCEPT,
  FALSE,
  FOR,
  IF,
  IN,
  NONE,
  NOT,
  OR,
  PASS,
  PRINT,
  RAISE,
  RETURN,
  TRUE,
  TRY,
  WHILE,

  // Layout.
  NEWLINE,
  INDENT,
  DEDENT,

  END
}
