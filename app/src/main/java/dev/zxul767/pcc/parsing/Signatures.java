package dev.zxul767.pcc.parsing;

import static dev.zxul767.pcc.parsing.TokenType.*;

import dev.zxul767.pcc.ir.Builtin;
import dev.zxul767.pcc.ir.ClassDef;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

// Tables of the top-level functions and classes of a program, built by a
// quick scan over the headers (`def name(...)` / `class Name`) before the
// real parse. They let a function call another one defined further down.
public class Signatures {
  public static class ClassSignature {
    public final String name;
    // arity of every method, not counting `self`
    public final Map<String, Integer> methods = new LinkedHashMap<>();

    ClassSignature(String name) { this.name = name; }

    // number of arguments the constructor takes
    public int initializerArity() {
      return methods.getOrDefault(ClassDef.INITIALIZER, 0);
    }
  }

  private final Map<String, Integer> functions = new LinkedHashMap<>();
  private final Map<String, ClassSignature> classes = new LinkedHashMap<>();

  public boolean isFunction(String name) { return functions.containsKey(name); }

  public int functionArity(String name) { return functions.get(name); }

  public boolean isClass(String name) { return classes.containsKey(name); }

  public ClassSignature classSignature(String name) { return classes.get(name); }

  // pass 1: only headers at the top level (functions and classes) and at the
  // first level of a class body (methods) are collected. Malformed headers are
  // skipped here and reported by the full parse.
  public static Signatures collect(List<Token> tokens) throws ParseError {
    Signatures signatures = new Signatures();
    ClassSignature currentClass = null;
    int depth = 0;

    for (int i = 0; i < tokens.size(); i++) {
      Token token = tokens.get(i);
      switch (token.type) {
      case INDENT:
        depth++;
        break;
      case DEDENT:
        depth--;
        if (depth == 0)
          currentClass = null;
        break;
      case CLASS:
        if (depth == 0 && isName(tokens, i + 1)) {
          Token name = tokens.get(i + 1);
          currentClass = signatures.declareClass(name);
        }
        break;
      case DEF:
        if (!isName(tokens, i + 1))
          break;
        Token name = tokens.get(i + 1);
        int arity = countParameters(tokens, i + 2);
        if (depth == 0) {
          currentClass = null;
          signatures.declareFunction(name, arity);
        } else if (depth == 1 && currentClass != null) {
          declareMethod(currentClass, name, Math.max(0, arity - 1));
        }
        break;
      default:
        break;
      }
    }
    return signatures;
  }

  private void declareFunction(Token name, int arity) throws ParseError {
    checkNotBuiltin(name);
    if (functions.containsKey(name.lexeme))
      throw new ParseError(
          name, String.format("duplicate definition of function '%s'", name.lexeme)
      );
    if (classes.containsKey(name.lexeme))
      throw new ParseError(
          name,
          String.format("'%s' is already defined as a class", name.lexeme)
      );
    functions.put(name.lexeme, arity);
  }

  private ClassSignature declareClass(Token name) throws ParseError {
    checkNotBuiltin(name);
    if (classes.containsKey(name.lexeme))
      throw new ParseError(
          name, String.format("duplicate definition of class '%s'", name.lexeme)
      );
    if (functions.containsKey(name.lexeme))
      throw new ParseError(
          name,
          String.format("'%s' is already defined as a function", name.lexeme)
      );
    ClassSignature signature = new ClassSignature(name.lexeme);
    classes.put(name.lexeme, signature);
    return signature;
  }

  private static void
  declareMethod(ClassSignature owner, Token name, int arity) throws ParseError {
    if (owner.methods.containsKey(name.lexeme))
      throw new ParseError(
          name,
          String.format(
              "duplicate definition of method '%s' in class '%s'", name.lexeme,
              owner.name
          )
      );
    owner.methods.put(name.lexeme, arity);
  }

  private static void checkNotBuiltin(Token name) throws ParseError {
    if (Builtin.lookup(name.lexeme) != null || name.lexeme.equals("range"))
      throw new ParseError(
          name, String.format("cannot redefine builtin '%s'", name.lexeme)
      );
  }

  private static boolean isName(List<Token> tokens, int index) {
    return index < tokens.size() && tokens.get(index).type == IDENTIFIER;
  }

  // counts the parameters of `( a, b, c )` starting at `index`
  private static int countParameters(List<Token> tokens, int index) {
    if (index >= tokens.size() || tokens.get(index).type != LEFT_PAREN)
      return 0;
    int count = 0;
    for (int i = index + 1; i < tokens.size(); i++) {
      TokenType type = tokens.get(i).type;
      if (type == RIGHT_PAREN || type == NEWLINE || type == END)
        break;
      if (type == IDENTIFIER)
        count++;
    }
    return count;
  }
}
