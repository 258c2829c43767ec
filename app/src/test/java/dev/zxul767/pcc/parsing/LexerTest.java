package dev.zxul767.pcc.parsing;

import static dev.zxul767.pcc.parsing.TokenType.*;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.*;
import static org.junit.jupiter.api.Assertions.*;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class LexerTest {
  static List<TokenType> scan(String source) throws LexError {
    List<TokenType> types = new ArrayList<>();
    for (Token token : new Lexer(source).tokenize())
      types.add(token.type);
    return types;
  }

  static Token first(String source) throws LexError {
    return new Lexer(source).tokenize().get(0);
  }

  @Test
  void canScanSimpleStatement() throws LexError {
    assertEquals(
        List.of(IDENTIFIER, EQUAL, NUMBER, PLUS, NUMBER, NEWLINE, END),
        scan("x = 1 + 2\n")
    );
  }

  @Test
  void canEmitIndentAndDedent() throws LexError {
    assertEquals(
        List.of(
            IF, IDENTIFIER, COLON, NEWLINE, INDENT, IDENTIFIER, EQUAL, NUMBER,
            NEWLINE, DEDENT, IDENTIFIER, EQUAL, NUMBER, NEWLINE, END
        ),
        scan("if x:\n    y = 1\nz = 2\n")
    );
  }

  @Test
  void canCloseOpenBlocksAtEndOfInput() throws LexError {
    assertEquals(
        List.of(
            WHILE, IDENTIFIER, COLON, NEWLINE, INDENT, IF, IDENTIFIER, COLON,
            NEWLINE, INDENT, BREAK, NEWLINE, DEDENT, DEDENT, END
        ),
        scan("while x:\n  if y:\n    break")
    );
  }

  @Test
  void canIgnoreBlankAndCommentLines() throws LexError {
    assertEquals(
        List.of(
            IDENTIFIER, EQUAL, NUMBER, NEWLINE, IDENTIFIER, EQUAL, NUMBER,
            NEWLINE, END
        ),
        scan("x = 1\n\n    # indented comment\ny = 2  # trailing\n")
    );
  }

  @Test
  void canJoinLinesInsideBrackets() throws LexError {
    assertEquals(
        List.of(
            IDENTIFIER, EQUAL, LEFT_BRACKET, NUMBER, COMMA, NUMBER,
            RIGHT_BRACKET, NEWLINE, END
        ),
        scan("x = [1,\n        2]\n")
    );
  }

  @Test
  void canJoinLinesWithBackslash() throws LexError {
    assertEquals(
        List.of(IDENTIFIER, EQUAL, NUMBER, PLUS, NUMBER, NEWLINE, END),
        scan("x = 1 + \\\n    2\n")
    );
  }

  @Test
  void canRejectInconsistentDedent() {
    LexError error = assertThrows(
        LexError.class, () -> scan("if x:\n    y = 1\n  z = 2\n")
    );
    assertThat(
        error.getMessage(),
        containsString("unindent does not match any outer indentation level")
    );
    assertEquals(3, error.line);
  }

  @Test
  void canRejectUnknownCharacter() {
    LexError error = assertThrows(LexError.class, () -> scan("x = $\n"));
    assertEquals("unexpected character '$'", error.getMessage());
    assertEquals(1, error.line);
    assertEquals(5, error.column);
    assertEquals(
        "Lexing Error: [line 1, column 5] unexpected character '$'",
        error.toString()
    );
  }

  @Test
  void canRejectUnterminatedString() {
    LexError error = assertThrows(LexError.class, () -> scan("s = 'abc\n"));
    assertEquals("unterminated string literal", error.getMessage());
  }

  @Test
  void canDecodeEscapes() throws LexError {
    assertEquals("a\tb\n'c'\\", first("'a\\tb\\n\\'c\\'\\\\'").value);
    assertEquals("it's", first("\"it's\"").value);
  }

  @Test
  void canScanTripleQuotedStrings() throws LexError {
    Token token = first("\"\"\"one\ntwo\"\"\"\nx = 1\n");
    assertEquals(STRING, token.type);
    assertEquals("one\ntwo", token.value);
  }

  @Test
  void canScanNumbers() throws LexError {
    assertEquals(new BigInteger("42"), first("42").value);
    assertEquals(
        new BigInteger("123456789012345678901234567890"),
        first("123456789012345678901234567890").value
    );
    assertEquals(1.5, first("1.5").value);
    assertEquals(2000.0, first("2e3").value);
    assertEquals(0.25, first(".25").value);
    assertThat(first("7.").value, instanceOf(Double.class));
  }

  @Test
  void canRejectMalformedNumbers() {
    LexError error = assertThrows(LexError.class, () -> scan("x = 12abc\n"));
    assertThat(error.getMessage(), startsWith("invalid numeric literal"));
  }

  @Test
  void canScanFloatsWithTrailingDot() throws LexError {
    assertEquals(100000.0, first("1.e5").value);
    assertEquals(List.of(NUMBER, NEWLINE, END), scan("1.e5"));
    assertEquals(List.of(NUMBER, DOT, IDENTIFIER, NEWLINE, END), scan("1..x"));
  }

  @Test
  void canRejectLeadingZeros() throws LexError {
    LexError error = assertThrows(LexError.class, () -> scan("x = 0123\n"));
    assertEquals(
        "leading zeros in decimal integer literals are not permitted: '0123'",
        error.getMessage()
    );
    assertEquals(5, error.column);
    assertEquals(BigInteger.ZERO, first("000").value);
    assertEquals(12.5, first("012.5").value);
  }

  @Test
  void canRecognizeKeywords() throws LexError {
    assertEquals(
        List.of(NOT, TRUE, AND, FALSE, OR, NONE, NEWLINE, END),
        scan("not True and False or None")
    );
  }

  @Test
  void canTrackPositions() throws LexError {
    List<Token> tokens = new Lexer("x = 1\nif x:\n    y = 2\n").tokenize();
    Token y = tokens.get(9);
    assertEquals("y", y.lexeme);
    assertEquals(3, y.line);
    assertEquals(5, y.column);
  }
}
