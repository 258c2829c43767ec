package dev.zxul767.pcc.parsing;

import static dev.zxul767.pcc.parsing.TokenType.*;

import java.math.BigInteger;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

// Turns source text into tokens, including the NEWLINE / INDENT / DEDENT
// tokens that encode the block structure of the program.
public class Lexer {
  public static final Map<String, TokenType> keywords;
  static {
    keywords = new HashMap<>();
    keywords.put("and", AND);
    keywords.put("break", BREAK);
    keywords.put("class", CLASS);
    keywords.put("continue", CONTINUE);
    keywords.put("def", DEF);
    keywords.put("elif", ELIF);
    keywords.put("else", ELSE);
    keywords.put("except", EXCEPT);
    keywords.put("False", FALSE);
    keywords.put("for", FOR);
    keywords.put("if", IF);
    keywords.put("in", IN);
    keywords.put("None", NONE);
    keywords.put("not", NOT);
    keywords.put("or", OR);
    keywords.put("pass", PASS);
    keywords.put("print", PRINT);
    keywords.put("raise", RAISE);
    keywords.put("return", RETURN);
    keywords.put("True", TRUE);
    keywords.put("try", TRY);
    keywords.put("while", WHILE);
  }

  private static final int TAB_SIZE = 8;

  private final String sourceCode;
  private final List<Token> tokens = new ArrayList<>();
  // columns of the enclosing blocks; the bottom is always 0
  private final Deque<Integer> indents = new ArrayDeque<>();
  // `start` & `current` are meant to index `sourceCode` and they
  // represent the bounds of the token currently under examination.
  private int start = 0;
  private int current = 0;
  // `line` starts at 1 (and not 0) to be user friendly
  private int line = 1;
  // index of the first character of the current line
  private int lineStart = 0;
  // position of the token under examination (strings may span lines)
  private int tokenLine = 1;
  private int tokenColumn = 1;
  // number of open (, [ and {: newlines inside them are not significant
  private int nesting = 0;
  private boolean atLineStart = true;

  public Lexer(String sourceCode) { this.sourceCode = sourceCode; }

  public List<Token> tokenize() throws LexError {
    indents.push(0);
    while (!isAtEnd()) {
      if (atLineStart && nesting == 0 && !indentation())
        continue;

      start = current;
      tokenLine = line;
      tokenColumn = column();
      scanToken();
    }
    // the last line may not end with a newline character
    if (!tokens.isEmpty() && tokens.get(tokens.size() - 1).type != NEWLINE)
      addLayout(NEWLINE);
    while (indents.peek() > 0) {
      indents.pop();
      addLayout(DEDENT);
    }
    addLayout(END);
    return tokens;
  }

  // Measures the indentation of a new line and emits INDENT / DEDENT tokens.
  //
  // pre-condition: `current` is at the first character of a line
  // post-condition: returns false if the line was blank (or comment-only) and
  //    has been consumed entirely; otherwise `current` is at the line's first
  //    significant character.
  private boolean indentation() throws LexError {
    int width = 0;
    while (!isAtEnd()) {
      char c = peek();
      if (c == ' ') {
        width++;
      } else if (c == '\t') {
        width = (width / TAB_SIZE + 1) * TAB_SIZE;
      } else if (c == '\f') {
        width = 0;
      } else {
        break;
      }
      advance();
    }

    if (isAtEnd())
      return false;
    if (peek() == '#' || peek() == '\n' || peek() == '\r') {
      skipComment();
      if (match('\r'))
        match('\n');
      else
        match('\n');
      newLine();
      return false;
    }

    atLineStart = false;
    tokenLine = line;
    tokenColumn = column();
    if (width > indents.peek()) {
      indents.push(width);
      addLayout(INDENT);
    } else {
      while (width < indents.peek()) {
        indents.pop();
        addLayout(DEDENT);
      }
      if (width != indents.peek()) {
        throw new LexError(
            "unindent does not match any outer indentation level", line,
            column()
        );
      }
    }
    return true;
  }

  private void scanToken() throws LexError {
    char c = advance();
    switch (c) {
    case '(':
      nesting++;
      addToken(LEFT_PAREN);
      break;
    case ')':
      closeBracket();
      addToken(RIGHT_PAREN);
      break;
    case '[':
      nesting++;
      addToken(LEFT_BRACKET);
      break;
    case ']':
      closeBracket();
      addToken(RIGHT_BRACKET);
      break;
    case '{':
      nesting++;
      addToken(LEFT_BRACE);
      break;
    case '}':
      closeBracket();
      addToken(RIGHT_BRACE);
      break;
    case ':':
      addToken(COLON);
      break;
    case ',':
      addToken(COMMA);
      break;
    case '.':
      if (isDigit(peek())) {
        number(c);
      } else {
        addToken(DOT);
      }
      break;
    case '-':
      addToken(match('=') ? MINUS_EQUAL : MINUS);
      break;
    case '+':
      addToken(match('=') ? PLUS_EQUAL : PLUS);
      break;
    case '%':
      addToken(match('=') ? PERCENT_EQUAL : PERCENT);
      break;
    case '*':
      if (match('*')) {
        addToken(STAR_STAR);
      } else {
        addToken(match('=') ? STAR_EQUAL : STAR);
      }
      break;
    case '/':
      if (match('/')) {
        addToken(match('=') ? SLASH_SLASH_EQUAL : SLASH_SLASH);
      } else {
        addToken(SLASH);
      }
      break;
    case '!':
      if (!match('='))
        throw unexpected(c);
      addToken(BANG_EQUAL);
      break;
    case '=':
      addToken(match('=') ? EQUAL_EQUAL : EQUAL);
      break;
    case '<':
      addToken(match('=') ? LESS_EQUAL : LESS);
      break;
    case '>':
      addToken(match('=') ? GREATER_EQUAL : GREATER);
      break;

    case '#':
      skipComment();
      break;

    case ' ':
    case '\r':
    case '\t':
    case '\f':
      // ignore whitespace;
      break;

    case '\\':
      // explicit line joining
      match('\r');
      if (!match('\n'))
        throw unexpected(c);
      newLine();
      break;

    case '\n':
      if (nesting == 0) {
        addToken(NEWLINE);
        atLineStart = true;
      }
      newLine();
      break;

    case '"':
    case '\'':
      string(c);
      break;

    default:
      if (isDigit(c)) {
        number(c);
      } else if (isAlpha(c)) {
        identifier();
      } else {
        throw unexpected(c);
      }
    }
  }

  // pre-condition: a closing bracket has just been consumed
  private void closeBracket() {
    // unbalanced brackets are the parser's business
    if (nesting > 0)
      nesting--;
  }

  // post-condition: all characters up to a newline (or EOF) have been consumed.
  private void skipComment() {
    while (peek() != '\n' && !isAtEnd())
      advance();
  }

  private void identifier() {
    while (isAlphaNumeric(peek()))
      advance();

    String text = sourceCode.substring(start, current);
    TokenType type = keywords.get(text);
    if (type == null)
      type = IDENTIFIER;

    addToken(type);
  }

  // Scans a quoted string, decoding escape sequences.
  //
  // pre-condition: the opening quote has just been consumed
  // post-condition: the closing quote (or quotes) have been consumed
  private void string(char quote) throws LexError {
    boolean triple = false;
    if (peek() == quote && peekAhead(1) == quote) {
      advance(2);
      triple = true;
    }

    StringBuilder value = new StringBuilder();
    while (true) {
      if (isAtEnd())
        throw new LexError("unterminated string literal", tokenLine, tokenColumn);

      char c = advance();
      if (c == '\\') {
        if (isAtEnd())
          throw new LexError("unterminated string literal", tokenLine, tokenColumn);
        escape(advance(), value);
      } else if (c == quote) {
        if (!triple)
          break;
        if (peek() == quote && peekAhead(1) == quote) {
          advance(2);
          break;
        }
        value.append(c);
      } else if (c == '\n') {
        if (!triple)
          throw new LexError("unterminated string literal", tokenLine, tokenColumn);
        value.append(c);
        newLine();
      } else {
        value.append(c);
      }
    }
    addToken(STRING, value.toString());
  }

  private void escape(char c, StringBuilder value) {
    switch (c) {
    case 'n':
      value.append('\n');
      break;
    case 't':
      value.append('\t');
      break;
    case 'r':
      value.append('\r');
      break;
    case '0':
      value.append('\0');
      break;
    case '\\':
    case '\'':
    case '"':
      value.append(c);
      break;
    case '\n':
      // a backslash at the end of a line continues the string
      newLine();
      break;
    default:
      // unknown escapes are kept as written
      value.append('\\').append(c);
    }
  }

  // integers are arbitrary precision: the backend decides how to store them
  //
  // pre-condition: `first` (a digit or a '.' followed by a digit) has just
  //    been consumed
  private void number(char first) throws LexError {
    boolean isFloat = first == '.';
    while (isDigit(peek()))
      advance();

    // as in Python, a '.' after the digits always belongs to the literal
    // (`1.e5`, `7.`)
    if (!isFloat && peek() == '.') {
      isFloat = true;
      advance();
      while (isDigit(peek()))
        advance();
    }

    if ((peek() == 'e' || peek() == 'E') &&
        (isDigit(peekAhead(1)) ||
         ((peekAhead(1) == '+' || peekAhead(1) == '-') &&
          isDigit(peekAhead(2))))) {
      isFloat = true;
      advance(2);
      while (isDigit(peek()))
        advance();
    }

    if (isAlpha(peek())) {
      throw new LexError(
          String.format(
              "invalid numeric literal '%s%c'",
              sourceCode.substring(start, current), peek()
          ),
          tokenLine, tokenColumn
      );
    }

    String text = sourceCode.substring(start, current);
    if (!isFloat && text.length() > 1 && text.startsWith("0") &&
        !text.matches("0+")) {
      throw new LexError(
          String.format(
              "leading zeros in decimal integer literals are not permitted: '%s'", text
          ),
          tokenLine, tokenColumn
      );
    }
    if (isFloat) {
      addToken(NUMBER, Double.valueOf(text));
    } else {
      addToken(NUMBER, new BigInteger(text));
    }
  }

  private LexError unexpected(char c) {
    return new LexError(
        String.format("unexpected character '%c'", c), tokenLine, tokenColumn
    );
  }

  private void newLine() {
    line++;
    lineStart = current;
  }

  private int column() { return current - lineStart + 1; }

  private boolean match(char expected) {
    if (isAtEnd())
      return false;
    if (sourceCode.charAt(current) != expected)
      return false;
    current++;
    return true;
  }

  // returns the next character to be consumed
  private char peek() { return peekAhead(0); }

  // returns the character to be consumed `distance` chars ahead
  private char peekAhead(int distance) {
    if (current + distance >= sourceCode.length())
      return '\0';
    return sourceCode.charAt(current + distance);
  }

  private boolean isAlpha(char c) {
    return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
  }

  private boolean isAlphaNumeric(char c) { return isAlpha(c) || isDigit(c); }

  private boolean isDigit(char c) { return c >= '0' && c <= '9'; }

  private boolean isAtEnd() { return current >= sourceCode.length(); }

  // returns the previously current character and advances one char forward
  private char advance() { return sourceCode.charAt(current++); }

  // returns the previously current character and advances `count` chars forward
  private char advance(int count) {
    char currentChar = sourceCode.charAt(current);
    current = Math.min(current + count, sourceCode.length());
    return currentChar;
  }

  private void addToken(TokenType type) { addToken(type, /* value: */ null); }

  private void addToken(TokenType type, Object value) {
    String text = sourceCode.substring(start, current);
    tokens.add(new Token(type, text, value, tokenLine, tokenColumn));
  }

  // structural tokens have no text of their own
  private void addLayout(TokenType type) {
    tokens.add(new Token(type, "", null, tokenLine, tokenColumn));
  }
}
