package dev.zxul767.pcc.parsing;

import static dev.zxul767.pcc.parsing.TokenType.*;

import dev.zxul767.pcc.ir.BinaryOp;
import dev.zxul767.pcc.ir.Builtin;
import dev.zxul767.pcc.ir.ClassDef;
import dev.zxul767.pcc.ir.CompareOp;
import dev.zxul767.pcc.ir.ErrorKind;
import dev.zxul767.pcc.ir.Expr;
import dev.zxul767.pcc.ir.FieldDef;
import dev.zxul767.pcc.ir.FunctionDef;
import dev.zxul767.pcc.ir.LogicalOp;
import dev.zxul767.pcc.ir.ModuleIR;
import dev.zxul767.pcc.ir.Stmt;
import dev.zxul767.pcc.ir.UnaryOp;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

// Recursive-descent parser producing the IR. Besides checking the grammar it
// tracks which names have been assigned at each point of the program (the
// "defined set"), so reading a variable before any assignment to it is
// rejected here, together with call arities and misplaced break / continue /
// return statements.
public class Parser {
  private enum FunctionType { NONE, FUNCTION, METHOD }

  // Python keywords outside of the supported subset
  private static final Set<String> unsupported = Set.of(
      "import", "from", "as", "lambda", "yield", "global", "nonlocal", "with",
      "del", "assert", "async", "await", "finally", "is"
  );
  private static final String RANGE = "range";
  private static final String SELF = "self";

  private final List<Token> tokens;
  // indexes the token currently being looked at
  private int current = 0;

  private Signatures signatures;
  // names that may be read at the current point of the current scope
  private Set<String> defined = new HashSet<>();
  // number of loops enclosing the current statement (in the current function)
  private int loopDepth = 0;
  private FunctionType currentFunction = FunctionType.NONE;
  // fields introduced through `self.<name> = ...` in the current class
  private Set<String> selfFields = null;

  public Parser(List<Token> tokens) { this.tokens = tokens; }

  public static ModuleIR parse(String source) throws LexError, ParseError {
    return new Parser(new Lexer(source).tokenize()).parse();
  }

  // module -> ( functionDeclaration | classDeclaration | statement )* END
  public ModuleIR parse() throws ParseError {
    signatures = Signatures.collect(tokens);

    List<FunctionDef> functions = new ArrayList<>();
    List<ClassDef> classes = new ArrayList<>();
    List<Stmt> main = new ArrayList<>();
    while (!isAtEnd()) {
      if (match(NEWLINE))
        continue;
      if (check(INDENT))
        throw error(peek(), "unexpected indent");

      if (match(DEF)) {
        functions.add(functionDeclaration(FunctionType.FUNCTION));
      } else if (match(CLASS)) {
        classes.add(classDeclaration());
      } else {
        Stmt statement = statement();
        if (statement != null)
          main.add(statement);
      }
    }
    return new ModuleIR(functions, classes, main);
  }

  // classDeclaration -> "class" IDENTIFIER ( "(" ")" )? ":" NEWLINE
  //                     INDENT classMember+ DEDENT
  // classMember -> IDENTIFIER "=" "-"? NUMBER NEWLINE
  //              | functionDeclaration
  //              | "pass" NEWLINE
  //              | STRING NEWLINE
  private ClassDef classDeclaration() throws ParseError {
    Token keyword = previous();
    Token name = consume(IDENTIFIER, "Expected class name.");
    if (match(LEFT_PAREN)) {
      if (!check(RIGHT_PAREN))
        throw error(peek(), "class inheritance is not supported");
      advance();
    }
    consume(COLON, "Expected ':' after class name.");

    Map<String, FieldDef> fields = new LinkedHashMap<>();
    List<FunctionDef> methods = new ArrayList<>();
    selfFields = new HashSet<>();
    try {
      if (match(PASS)) {
        consumeEndOfLine();
        return new ClassDef(name.lexeme, List.of(), List.of(), keyword.line);
      }
      consume(NEWLINE, "Expected newline after ':'.");
      consume(INDENT, "Expected an indented class body.");
      while (!check(DEDENT) && !isAtEnd()) {
        if (match(DEF)) {
          methods.add(functionDeclaration(FunctionType.METHOD));
        } else if (match(PASS)) {
          consumeEndOfLine();
        } else if (match(STRING)) {
          consumeEndOfLine();
        } else if (check(IDENTIFIER) && checkNext(EQUAL)) {
          FieldDef field = fieldDeclaration();
          if (fields.containsKey(field.name))
            throw error(
                previous(),
                String.format("duplicate field '%s' in class '%s'", field.name, name.lexeme)
            );
          fields.put(field.name, field);
        } else {
          throw error(peek(), "Expected a field or a method in class body.");
        }
      }
      consume(DEDENT, "Expected end of class body.");

      for (String field : selfFields) {
        if (!fields.containsKey(field))
          fields.put(field, new FieldDef(field, BigInteger.ZERO));
      }
      return new ClassDef(
          name.lexeme, new ArrayList<>(fields.values()), methods, keyword.line
      );
    } finally {
      selfFields = null;
    }
  }

  private FieldDef fieldDeclaration() throws ParseError {
    Token name = advance();
    advance(); // "="
    boolean negative = match(MINUS);
    BigInteger value;
    if (match(TRUE)) {
      value = BigInteger.ONE;
    } else if (match(FALSE)) {
      value = BigInteger.ZERO;
    } else if (check(NUMBER) && peek().value instanceof BigInteger) {
      value = (BigInteger)advance().value;
    } else {
      throw error(
          name,
          String.format(
              "class field '%s' must be initialized with an integer literal",
              name.lexeme
          )
      );
    }
    consumeEndOfLine();
    return new FieldDef(name.lexeme, negative ? value.negate() : value);
  }

  // functionDeclaration -> "def" IDENTIFIER "(" parameters? ")" ":" block
  // parameters -> IDENTIFIER ( "," IDENTIFIER )*
  private FunctionDef functionDeclaration(FunctionType type) throws ParseError {
    if (currentFunction != FunctionType.NONE)
      throw error(previous(), "nested functions are not supported");

    Token keyword = previous();
    String kind = type == FunctionType.METHOD ? "method" : "function";
    Token name = consume(IDENTIFIER, String.format("Expected %s name.", kind));
    consume(LEFT_PAREN, String.format("Expected '(' after %s name.", kind));
    List<String> parameters = new ArrayList<>();
    if (!check(RIGHT_PAREN)) {
      do {
        Token parameter = consume(IDENTIFIER, "Expected parameter name.");
        if (parameters.contains(parameter.lexeme))
          throw error(
              parameter,
              String.format("duplicate parameter '%s'", parameter.lexeme)
          );
        parameters.add(parameter.lexeme);
      } while (match(COMMA));
    }
    consume(RIGHT_PAREN, "Expected ')' after parameters.");

    if (type == FunctionType.METHOD &&
        (parameters.isEmpty() || !parameters.get(0).equals(SELF))) {
      throw error(
          name,
          String.format(
              "method '%s' must take 'self' as its first parameter", name.lexeme
          )
      );
    }

    // functions only see their own parameters (and the global tables)
    Set<String> enclosingDefined = defined;
    int enclosingLoopDepth = loopDepth;
    defined = new HashSet<>(parameters);
    loopDepth = 0;
    currentFunction = type;
    try {
      List<Stmt> body = block();
      return new FunctionDef(name.lexeme, parameters, body, keyword.line);
    } finally {
      defined = enclosingDefined;
      loopDepth = enclosingLoopDepth;
      currentFunction = FunctionType.NONE;
    }
  }

  // block -> ":" ( simpleStatement | NEWLINE INDENT statement+ DEDENT )
  private List<Stmt> block() throws ParseError {
    consume(COLON, "Expected ':' before block.");
    List<Stmt> statements = new ArrayList<>();
    if (!match(NEWLINE)) {
      // a single statement on the same line, e.g. `if x: break`
      Stmt statement = simpleStatement();
      if (statement != null)
        statements.add(statement);
      return statements;
    }

    consume(INDENT, "Expected an indented block.");
    while (!check(DEDENT) && !isAtEnd()) {
      if (match(NEWLINE))
        continue;
      Stmt statement = statement();
      if (statement != null)
        statements.add(statement);
    }
    consume(DEDENT, "Expected end of block.");
    return statements;
  }

  // statement -> ifStatement
  //            | whileStatement
  //            | forStatement
  //            | tryStatement
  //            | simpleStatement
  //
  // returns null for statements that produce no IR (`pass`, docstrings)
  private Stmt statement() throws ParseError {
    if (match(IF))
      return ifStatement();
    if (match(WHILE))
      return whileStatement();
    if (match(FOR))
      return forStatement();
    if (match(TRY))
      return tryStatement();
    if (match(DEF))
      throw error(previous(), "nested functions are not supported");
    if (match(CLASS))
      throw error(previous(), "classes must be defined at the top level");
    return simpleStatement();
  }

  // ifStatement -> "if" expression block
  //                ( "elif" expression block )*
  //                ( "else" block )?
  //
  // NOTE: `elif` chains are desugared into nested `if` statements
  private Stmt ifStatement() throws ParseError {
    Token keyword = previous();
    Expr condition = expression();

    Set<String> before = defined;
    defined = new HashSet<>(before);
    List<Stmt> thenBranch = block();
    Set<String> afterThen = defined;

    defined = new HashSet<>(before);
    List<Stmt> elseBranch = List.of();
    if (match(ELIF)) {
      elseBranch = List.of(ifStatement());
    } else if (match(ELSE)) {
      elseBranch = block();
    }
    Set<String> afterElse = defined;

    // a name assigned in either branch is considered defined afterwards
    defined = before;
    defined.addAll(afterThen);
    defined.addAll(afterElse);
    return new Stmt.If(condition, thenBranch, elseBranch, keyword.line);
  }

  // whileStatement -> "while" expression block
  private Stmt whileStatement() throws ParseError {
    Token keyword = previous();
    Expr condition = expression();
    List<Stmt> body = loopBody(null);
    return new Stmt.While(condition, body, keyword.line);
  }

  // forStatement -> "for" IDENTIFIER "in" "range" "(" arguments ")" block
  private Stmt forStatement() throws ParseError {
    Token keyword = previous();
    Token variable = consume(IDENTIFIER, "Expected loop variable after 'for'.");
    if (check(COMMA))
      throw error(peek(), "multiple loop variables are not supported");
    consume(IN, "Expected 'in' after loop variable.");
    Token range = consume(IDENTIFIER, "Expected 'range' after 'in'.");
    if (!range.lexeme.equals(RANGE))
      throw error(range, "only 'for ... in range(...)' loops are supported");
    consume(LEFT_PAREN, "Expected '(' after 'range'.");
    List<Expr> arguments = arguments();
    Token paren = previous();

    Expr start;
    Expr stop;
    Expr step;
    switch (arguments.size()) {
    case 1:
      start = new Expr.IntLiteral(0, keyword.line);
      stop = arguments.get(0);
      step = new Expr.IntLiteral(1, keyword.line);
      break;
    case 2:
      start = arguments.get(0);
      stop = arguments.get(1);
      step = new Expr.IntLiteral(1, keyword.line);
      break;
    case 3:
      start = arguments.get(0);
      stop = arguments.get(1);
      step = arguments.get(2);
      break;
    default:
      throw error(
          paren,
          String.format(
              "range() expects 1 to 3 arguments, got %d", arguments.size()
          )
      );
    }
    if (step instanceof Expr.IntLiteral && ((Expr.IntLiteral)step).isZero())
      throw error(paren, "range() arg 3 must not be zero");

    List<Stmt> body = loopBody(variable.lexeme);
    return new Stmt.For(variable.lexeme, start, stop, step, body, keyword.line);
  }

  // Parses a loop body with a copy of the defined set (plus the loop variable,
  // if any) and merges back what the body defines.
  private List<Stmt> loopBody(String loopVariable) throws ParseError {
    Set<String> before = defined;
    defined = new HashSet<>(before);
    if (loopVariable != null)
      defined.add(loopVariable);

    loopDepth++;
    try {
      List<Stmt> body = block();
      before.addAll(defined);
      return body;
    } finally {
      loopDepth--;
      defined = before;
    }
  }

  // tryStatement -> "try" block
  //                 ( "except" IDENTIFIER? block )+
  private Stmt tryStatement() throws ParseError {
    Token keyword = previous();
    Set<String> before = defined;
    List<Set<String>> branches = new ArrayList<>();

    defined = new HashSet<>(before);
    List<Stmt> body = block();
    branches.add(defined);

    List<Stmt.Handler> handlers = new ArrayList<>();
    while (match(EXCEPT)) {
      Token except = previous();
      if (!handlers.isEmpty() && handlers.get(handlers.size() - 1).catchesAll())
        throw error(except, "default 'except:' must be last");

      ErrorKind kind = null;
      if (!check(COLON))
        kind = exceptionKind();
      if (check(IDENTIFIER) && peek().lexeme.equals("as"))
        throw error(peek(), "'except ... as name' is not supported");

      defined = new HashSet<>(before);
      handlers.add(new Stmt.Handler(kind, block(), except.line));
      branches.add(defined);
    }
    if (handlers.isEmpty())
      throw error(peek(), "Expected 'except' after 'try' block.");
    if (check(IDENTIFIER) && peek().lexeme.equals("finally"))
      throw error(peek(), "'finally' is not supported");
    if (check(ELSE))
      throw error(peek(), "'else' after 'except' is not supported");

    defined = before;
    for (Set<String> branch : branches)
      defined.addAll(branch);
    return new Stmt.Try(body, handlers, keyword.line);
  }

  private ErrorKind exceptionKind() throws ParseError {
    Token name = consume(IDENTIFIER, "Expected exception name.");
    ErrorKind kind = ErrorKind.lookup(name.lexeme);
    if (kind == null)
      throw error(
          name, String.format("unknown exception type '%s'", name.lexeme)
      );
    return kind;
  }

  // simpleStatement -> ( "pass" | "break" | "continue"
  //                    | "return" expression?
  //                    | "raise" IDENTIFIER ( "(" STRING? ")" )?
  //                    | "print" "(" expression ")"
  //                    | assignment
  //                    | expression ) NEWLINE
  private Stmt simpleStatement() throws ParseError {
    Stmt statement;
    if (match(PASS)) {
      statement = null;
    } else if (match(BREAK, CONTINUE)) {
      statement = loopControl();
    } else if (match(RETURN)) {
      statement = returnStatement();
    } else if (match(RAISE)) {
      statement = raiseStatement();
    } else if (match(PRINT)) {
      statement = printStatement();
    } else {
      statement = assignmentOrExpression();
    }
    consumeEndOfLine();
    return statement;
  }

  private Stmt loopControl() throws ParseError {
    Token keyword = previous();
    if (loopDepth == 0)
      throw error(
          keyword, String.format("'%s' outside loop", keyword.lexeme)
      );
    if (keyword.type == BREAK)
      return new Stmt.Break(keyword.line);
    return new Stmt.Continue(keyword.line);
  }

  // returnStatement -> "return" expression?
  private Stmt returnStatement() throws ParseError {
    Token keyword = previous();
    if (currentFunction == FunctionType.NONE)
      throw error(keyword, "'return' outside function");

    Expr value;
    if (check(NEWLINE)) {
      value = new Expr.IntLiteral(0, keyword.line);
    } else {
      value = expression();
    }
    return new Stmt.Return(value, keyword.line);
  }

  // raiseStatement -> "raise" IDENTIFIER ( "(" STRING? ")" )?
  private Stmt raiseStatement() throws ParseError {
    Token keyword = previous();
    if (check(NEWLINE))
      throw error(keyword, "bare 'raise' is not supported");
    ErrorKind kind = exceptionKind();
    String message = null;
    if (match(LEFT_PAREN)) {
      if (match(STRING))
        message = (String)previous().value;
      consume(
          RIGHT_PAREN, "Expected ')' (exception messages must be string literals)."
      );
    }
    return new Stmt.Raise(kind, message, keyword.line);
  }

  // printStatement -> "print" "(" expression ")"
  private Stmt printStatement() throws ParseError {
    Token keyword = previous();
    consume(LEFT_PAREN, "Expected '(' after 'print'.");
    List<Expr> arguments = arguments();
    if (arguments.size() != 1)
      throw error(
          keyword,
          String.format(
              "print() expects exactly one argument, got %d", arguments.size()
          )
      );
    return new Stmt.Print(arguments.get(0), keyword.line);
  }

  // assignment -> IDENTIFIER ( "=" | AUGMENTED ) expression
  //             | IDENTIFIER "." IDENTIFIER ( "=" | AUGMENTED ) expression
  //             | IDENTIFIER "[" expression "]" ( "=" | AUGMENTED ) expression
  private Stmt assignmentOrExpression() throws ParseError {
    if (check(IDENTIFIER)) {
      if (checkNext(COMMA))
        throw error(peekNext(), "multiple assignment targets are not supported");
      if (checkNext(EQUAL)) {
        Token name = advance();
        checkSupported(name);
        advance(); // "="
        Expr value = expression();
        if (check(EQUAL))
          throw error(peek(), "chained assignment is not supported");
        // the name only becomes visible after its value has been parsed
        defined.add(name.lexeme);
        return new Stmt.Assign(name.lexeme, value, name.line);
      }
    }

    Token start = peek();
    Expr expr = expression();

    if (match(EQUAL)) {
      Token equals = previous();
      Expr value = expression();
      if (check(EQUAL))
        throw error(peek(), "chained assignment is not supported");
      return assignTo(expr, value, equals);
    }
    if (match(PLUS_EQUAL, MINUS_EQUAL, STAR_EQUAL, SLASH_SLASH_EQUAL, PERCENT_EQUAL)) {
      Token operator = previous();
      Expr right = expression();
      BinaryOp op = augmentedOperator(operator.type);
      checkDivisor(op, right, operator);
      return assignTo(
          expr, new Expr.Binary(expr, op, right, operator.line), operator
      );
    }

    if (expr instanceof Expr.StrLiteral)
      return null; // docstring
    if (expr instanceof Expr.Call || expr instanceof Expr.MethodCall ||
        expr instanceof Expr.BuiltinCall || expr instanceof Expr.ConstructorCall)
      return new Stmt.Expression(expr, start.line);
    throw error(start, "expression statement has no effect");
  }

  private Stmt assignTo(Expr target, Expr value, Token equals) throws ParseError {
    if (target instanceof Expr.Variable) {
      // only reachable for augmented assignments: plain ones are handled
      // before the target is parsed as an expression
      Expr.Variable variable = (Expr.Variable)target;
      return new Stmt.Assign(variable.name, value, variable.line);
    }
    if (target instanceof Expr.Attribute) {
      Expr.Attribute attribute = (Expr.Attribute)target;
      if (selfFields != null && attribute.object.equals(SELF))
        selfFields.add(attribute.attribute);
      return new Stmt.AttributeAssign(
          attribute.object, attribute.attribute, value, attribute.line
      );
    }
    if (target instanceof Expr.Subscript) {
      Expr.Subscript subscript = (Expr.Subscript)target;
      return new Stmt.SubscriptAssign(
          subscript.name, subscript.index, value, subscript.line
      );
    }
    throw error(equals, "Invalid assignment target.");
  }

  private static BinaryOp augmentedOperator(TokenType type) {
    switch (type) {
    case PLUS_EQUAL:
      return BinaryOp.ADD;
    case MINUS_EQUAL:
      return BinaryOp.SUB;
    case STAR_EQUAL:
      return BinaryOp.MUL;
    case SLASH_SLASH_EQUAL:
      return BinaryOp.FLOOR_DIV;
    default:
      return BinaryOp.MOD;
    }
  }

  // expression -> or
  private Expr expression() throws ParseError { return or(); }

  // or -> and ( "or" and )*
  private Expr or() throws ParseError {
    Expr expr = and();
    while (match(OR)) {
      Token operator = previous();
      Expr right = and();
      expr = new Expr.Logical(expr, LogicalOp.OR, right, operator.line);
    }
    return expr;
  }

  // and -> not ( "and" not )*
  private Expr and() throws ParseError {
    Expr expr = not();
    while (match(AND)) {
      Token operator = previous();
      Expr right = not();
      expr = new Expr.Logical(expr, LogicalOp.AND, right, operator.line);
    }
    return expr;
  }

  // not -> "not" not
  //      | comparison
  private Expr not() throws ParseError {
    if (match(NOT)) {
      Token operator = previous();
      return new Expr.Unary(UnaryOp.NOT, not(), operator.line);
    }
    return comparison();
  }

  // comparison -> additive ( ( "==" | "!=" | "<" | "<=" | ">" | ">=" ) additive )?
  private Expr comparison() throws ParseError {
    Expr expr = additive();
    if (match(EQUAL_EQUAL, BANG_EQUAL, LESS, LESS_EQUAL, GREATER, GREATER_EQUAL)) {
      Token operator = previous();
      Expr right = additive();
      expr = new Expr.Compare(
          expr, compareOperator(operator.type), right, operator.line
      );
      if (check(EQUAL_EQUAL) || check(BANG_EQUAL) || check(LESS) ||
          check(LESS_EQUAL) || check(GREATER) || check(GREATER_EQUAL))
        throw error(peek(), "chained comparisons are not supported");
    }
    return expr;
  }

  private static CompareOp compareOperator(TokenType type) {
    switch (type) {
    case EQUAL_EQUAL:
      return CompareOp.EQ;
    case BANG_EQUAL:
      return CompareOp.NE;
    case LESS:
      return CompareOp.LT;
    case LESS_EQUAL:
      return CompareOp.LE;
    case GREATER:
      return CompareOp.GT;
    default:
      return CompareOp.GE;
    }
  }

  // additive -> additive ( "-" | "+" ) multiplicative
  //           | multiplicative
  private Expr additive() throws ParseError {
    return binary(() -> multiplicative(), MINUS, PLUS);
  }

  // multiplicative -> multiplicative ( "*" | "//" | "%" ) unary
  //                 | unary
  private Expr multiplicative() throws ParseError {
    Expr expr = unary();
    while (true) {
      if (check(SLASH))
        throw error(peek(), "true division '/' is not supported; use '//'");
      if (check(STAR_STAR))
        throw error(peek(), "'**' is not supported; use pow()");
      if (!match(STAR, SLASH_SLASH, PERCENT))
        break;

      Token operator = previous();
      Expr right = unary();
      BinaryOp op = binaryOperator(operator.type);
      checkDivisor(op, right, operator);
      expr = new Expr.Binary(expr, op, right, operator.line);
    }
    return expr;
  }

  // unary -> "-" unary
  //        | postfix
  private Expr unary() throws ParseError {
    if (match(MINUS)) {
      Token operator = previous();
      Expr operand = unary();
      // fold negative literals so `-9223372036854775808` stays native
      if (operand instanceof Expr.IntLiteral)
        return new Expr.IntLiteral(
            ((Expr.IntLiteral)operand).value.negate(), operator.line
        );
      if (operand instanceof Expr.FloatLiteral)
        return new Expr.FloatLiteral(
            -((Expr.FloatLiteral)operand).value, operator.line
        );
      return new Expr.Unary(UnaryOp.NEGATE, operand, operator.line);
    }
    if (match(PLUS))
      return unary();
    return postfix();
  }

  // postfix -> IDENTIFIER "(" arguments? ")"
  //          | IDENTIFIER "." IDENTIFIER ( "(" arguments? ")" )?
  //          | IDENTIFIER "[" expression "]"
  //          | primary
  //
  // Only a single level of postfix access is supported (no `a.b.c`, `f()()`)
  private Expr postfix() throws ParseError {
    if (!check(IDENTIFIER))
      return primary();

    Token name = advance();
    checkSupported(name);
    Expr expr;
    if (match(LEFT_PAREN)) {
      expr = call(name);
    } else if (match(DOT)) {
      requireDefined(name);
      Token member = consume(IDENTIFIER, "Expected attribute name after '.'.");
      if (match(LEFT_PAREN)) {
        List<Expr> arguments = arguments();
        expr = new Expr.MethodCall(name.lexeme, member.lexeme, arguments, member.line);
      } else {
        expr = new Expr.Attribute(name.lexeme, member.lexeme, member.line);
      }
    } else if (match(LEFT_BRACKET)) {
      requireDefined(name);
      Expr index = expression();
      consume(RIGHT_BRACKET, "Expected ']' after index.");
      expr = new Expr.Subscript(name.lexeme, index, name.line);
    } else {
      requireDefined(name);
      return new Expr.Variable(name.lexeme, name.line);
    }

    if (check(DOT))
      throw error(peek(), "chained attribute access is not supported");
    if (check(LEFT_BRACKET) || check(LEFT_PAREN))
      throw error(peek(), "chained calls and subscripts are not supported");
    return expr;
  }

  // Resolves a call by name: builtins first, then constructors of known
  // classes, then user-defined functions.
  //
  // pre-condition: the LEFT_PAREN after `name` has just been consumed
  private Expr call(Token name) throws ParseError {
    List<Expr> arguments = arguments();
    int count = arguments.size();

    Builtin builtin = Builtin.lookup(name.lexeme);
    if (builtin != null) {
      if (!builtin.accepts(count))
        throw error(
            name,
            String.format(
                "%s() expects %s, got %d", builtin.name,
                builtin.describeArity(), count
            )
        );
      return new Expr.BuiltinCall(builtin, arguments, name.line);
    }

    if (signatures.isClass(name.lexeme)) {
      int arity = signatures.classSignature(name.lexeme).initializerArity();
      if (arity != count)
        throw error(
            name,
            String.format(
                "%s() expects %d args, got %d", name.lexeme, arity, count
            )
        );
      return new Expr.ConstructorCall(name.lexeme, arguments, name.line);
    }

    if (signatures.isFunction(name.lexeme)) {
      int arity = signatures.functionArity(name.lexeme);
      if (arity != count)
        throw error(
            name,
            String.format(
                "Function '%s' expects %d args, got %d", name.lexeme, arity,
                count
            )
        );
      return new Expr.Call(name.lexeme, arguments, name.line);
    }

    if (name.lexeme.equals(RANGE))
      throw error(name, "range() is only supported in 'for' loops");
    throw error(
        name, String.format("unknown function or class: '%s'", name.lexeme)
    );
  }

  // arguments -> ( expression ( "," expression )* ","? )? ")"
  //
  // pre-condition: a LEFT_PAREN has just been consumed
  // post-condition: a RIGHT_PAREN is the last consumed token
  private List<Expr> arguments() throws ParseError {
    List<Expr> arguments = new ArrayList<>();
    while (!check(RIGHT_PAREN)) {
      arguments.add(expression());
      if (!match(COMMA))
        break;
    }
    consume(RIGHT_PAREN, "Expected ')' after arguments.");
    return arguments;
  }

  // primary -> NUMBER | STRING+ | "True" | "False"
  //          | "(" expression ")"
  //          | "[" ( expression ( "," expression )* ","? )? "]"
  //          | "{" ( expression ":" expression ( "," ... )* ","? )? "}"
  private Expr primary() throws ParseError {
    if (match(TRUE))
      return new Expr.IntLiteral(1, previous().line);
    if (match(FALSE))
      return new Expr.IntLiteral(0, previous().line);
    if (match(NONE))
      throw error(previous(), "'None' is not supported");
    if (match(NUMBER)) {
      Token number = previous();
      if (number.value instanceof BigInteger)
        return new Expr.IntLiteral((BigInteger)number.value, number.line);
      return new Expr.FloatLiteral((Double)number.value, number.line);
    }
    if (match(STRING)) {
      Token first = previous();
      // adjacent literals are concatenated: "a" "b" == "ab"
      StringBuilder value = new StringBuilder((String)first.value);
      while (match(STRING))
        value.append((String)previous().value);
      return new Expr.StrLiteral(value.toString(), first.line);
    }
    if (match(LEFT_PAREN)) {
      Expr expr = expression();
      if (check(COMMA))
        throw error(peek(), "tuples are not supported");
      consume(RIGHT_PAREN, "Expected ')' after expression.");
      return expr;
    }
    if (match(LEFT_BRACKET))
      return listLiteral();
    if (match(LEFT_BRACE))
      return dictLiteral();
    throw error(peek(), "Expected expression.");
  }

  private Expr listLiteral() throws ParseError {
    Token bracket = previous();
    List<Expr> elements = new ArrayList<>();
    while (!check(RIGHT_BRACKET)) {
      elements.add(expression());
      if (!match(COMMA))
        break;
    }
    consume(RIGHT_BRACKET, "Expected ']' after list elements.");
    return new Expr.ListLiteral(elements, bracket.line);
  }

  private Expr dictLiteral() throws ParseError {
    Token brace = previous();
    List<Expr> keys = new ArrayList<>();
    List<Expr> values = new ArrayList<>();
    while (!check(RIGHT_BRACE)) {
      keys.add(expression());
      consume(COLON, "Expected ':' after dict key.");
      values.add(expression());
      if (!match(COMMA))
        break;
    }
    consume(RIGHT_BRACE, "Expected '}' after dict entries.");
    return new Expr.DictLiteral(keys, values, brace.line);
  }

  // binary -> binary ONE_OF<tokenTypes> subunit
  //         | subunit
  private Expr binary(SubunitParser subunitParser, TokenType... tokenTypes)
      throws ParseError {
    Expr expr = subunitParser.parse();
    while (match(tokenTypes)) {
      Token operator = previous();
      Expr right = subunitParser.parse();
      expr = new Expr.Binary(
          expr, binaryOperator(operator.type), right, operator.line
      );
    }
    return expr;
  }

  @FunctionalInterface
  private interface SubunitParser {
    Expr parse() throws ParseError;
  }

  private static BinaryOp binaryOperator(TokenType type) {
    switch (type) {
    case PLUS:
      return BinaryOp.ADD;
    case MINUS:
      return BinaryOp.SUB;
    case STAR:
      return BinaryOp.MUL;
    case SLASH_SLASH:
      return BinaryOp.FLOOR_DIV;
    default:
      return BinaryOp.MOD;
    }
  }

  // a literal zero divisor can never succeed, so it is rejected right away;
  // any other divisor is checked when the program runs
  private void checkDivisor(BinaryOp op, Expr divisor, Token operator)
      throws ParseError {
    if (!op.isDivision())
      return;
    boolean zero =
        (divisor instanceof Expr.IntLiteral &&
         ((Expr.IntLiteral)divisor).isZero()) ||
        (divisor instanceof Expr.FloatLiteral &&
         ((Expr.FloatLiteral)divisor).value == 0.0);
    if (zero)
      throw error(
          operator,
          op == BinaryOp.MOD ? "modulo by zero" : "division by zero"
      );
  }

  private void requireDefined(Token name) throws ParseError {
    if (!defined.contains(name.lexeme))
      throw error(
          name,
          String.format("variable '%s' used before assignment", name.lexeme)
      );
  }

  private void checkSupported(Token name) throws ParseError {
    if (unsupported.contains(name.lexeme))
      throw error(
          name, String.format("unsupported syntax: '%s'", name.lexeme)
      );
  }

  private void consumeEndOfLine() throws ParseError {
    consume(NEWLINE, "Expected end of line.");
  }

  // returns true if it was able to consume the next token
  // consumes the next token if it matches one of `expectedTypes`
  private boolean match(TokenType... expectedTypes) {
    for (TokenType type : expectedTypes) {
      if (check(type)) {
        advance();
        return true;
      }
    }
    return false;
  }

  private Token consume(TokenType type, String message) throws ParseError {
    if (check(type))
      return advance();
    throw error(peek(), message);
  }

  private boolean check(TokenType expectedType) {
    if (isAtEnd())
      return expectedType == END;
    return peek().type == expectedType;
  }

  private boolean checkNext(TokenType expectedType) {
    return current + 1 < tokens.size() && peekNext().type == expectedType;
  }

  private Token advance() {
    if (!isAtEnd())
      current++;
    return previous();
  }

  private boolean isAtEnd() { return peek().type == END; }

  private Token peek() { return tokens.get(current); }

  private Token peekNext() { return tokens.get(current + 1); }

  private Token previous() { return tokens.get(current - 1); }

  private ParseError error(Token token, String message) {
    return new ParseError(token, message);
  }
}
