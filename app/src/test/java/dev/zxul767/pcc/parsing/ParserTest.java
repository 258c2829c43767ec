package dev.zxul767.pcc.parsing;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.*;
import static org.junit.jupiter.api.Assertions.*;

import dev.zxul767.pcc.ir.AstPrinter;
import dev.zxul767.pcc.ir.ClassDef;
import dev.zxul767.pcc.ir.FieldDef;
import dev.zxul767.pcc.ir.ModuleIR;
import java.math.BigInteger;
import java.util.List;
import org.junit.jupiter.api.Test;

class ParserTest {
  static String parse(String source) throws LexError, ParseError {
    return new AstPrinter().print(Parser.parse(source));
  }

  static String failure(String source) {
    ParseError error = assertThrows(ParseError.class, () -> Parser.parse(source));
    return error.getMessage();
  }

  @Test
  void canParseAssignmentAndPrint() throws Exception {
    assertEquals(
        "(assign x 1)\n(print (+ x (* 2 3)))\n",
        parse("x = 1\nprint(x + 2 * 3)\n")
    );
  }

  @Test
  void canParseOperatorPrecedence() throws Exception {
    assertEquals(
        "(assign a 1)\n(print (or (and (< a 2) (not (== a 3))) (>= (- a) 0)))\n",
        parse("a = 1\nprint(a < 2 and not a == 3 or -a >= 0)\n")
    );
  }

  @Test
  void canFoldNegativeLiterals() throws Exception {
    assertEquals(
        "(assign x -9223372036854775808)\n(assign y -1.5)\n",
        parse("x = -9223372036854775808\ny = -1.5\n")
    );
  }

  @Test
  void canParseBooleansAsIntegers() throws Exception {
    assertEquals("(assign t 1)\n(assign f 0)\n", parse("t = True\nf = False\n"));
  }

  @Test
  void canDesugarAugmentedAssignment() throws Exception {
    assertEquals(
        "(assign x 10)\n(assign x (// x 3))\n(assign x (% x 4))\n",
        parse("x = 10\nx //= 3\nx %= 4\n")
    );
  }

  @Test
  void canParseContainers() throws Exception {
    assertEquals(
        "(assign xs (list 1 2))\n(expr (method xs append 3))\n" +
            "(assign d (dict \"a\" 1))\n(setindex d \"b\" (index xs 0))\n",
        parse("xs = [1, 2]\nxs.append(3)\nd = {\"a\": 1}\nd[\"b\"] = xs[0]\n")
    );
  }

  @Test
  void canConcatenateAdjacentStrings() throws Exception {
    assertEquals("(assign s \"ab\")\n", parse("s = \"a\" 'b'\n"));
  }

  @Test
  void canDesugarElifChains() throws Exception {
    assertEquals(
        "(assign a 1)\n" +
            "(if (== a 1) ((print 1)) ((if (== a 2) ((print 2)) ((print 3)))))\n",
        parse(
            "a = 1\nif a == 1:\n    print(1)\nelif a == 2:\n    print(2)\n" +
            "else:\n    print(3)\n"
        )
    );
  }

  @Test
  void canParseRangeForms() throws Exception {
    assertEquals(
        "(for i 0 3 1 ((print i)))\n(for j 1 5 1 ((print j)))\n" +
            "(for k 5 0 -1 ((print k)))\n",
        parse(
            "for i in range(3):\n    print(i)\n" +
            "for j in range(1, 5):\n    print(j)\n" +
            "for k in range(5, 0, -1):\n    print(k)\n"
        )
    );
  }

  @Test
  void canParseSingleLineBlocks() throws Exception {
    assertEquals(
        "(assign n 3)\n(while (> n 0) ((assign n (- n 1))))\n",
        parse("n = 3\nwhile n > 0: n -= 1\n")
    );
  }

  @Test
  void canSkipPassAndDocstrings() throws Exception {
    assertEquals(
        "(def f () ((return 0)))\n",
        parse("def f():\n    \"\"\"Does nothing.\"\"\"\n    pass\n    return\n")
    );
  }

  @Test
  void canRejectNameUsedBeforeAssignment() {
    assertEquals(
        "variable 'y' used before assignment (at 'y')", failure("print(y)\n")
    );
    assertThat(
        failure("x = x + 1\n"), startsWith("variable 'x' used before assignment")
    );
  }

  @Test
  void canReportPositionOfParseErrors() {
    ParseError error =
        assertThrows(ParseError.class, () -> Parser.parse("x = 1\nprint(y)\n"));
    assertEquals(
        "Parsing Error: [line 2, column 7] variable 'y' used before assignment (at 'y')",
        error.toString()
    );
  }

  @Test
  void canTreatNamesAssignedInAnyBranchAsDefined() throws Exception {
    String source = "c = 1\nif c:\n    x = 1\nelse:\n    pass\nprint(x)\n";
    assertThat(parse(source), endsWith("(print x)\n"));
    assertThat(
        parse("c = 0\nwhile c:\n    y = 2\n    c = 0\nprint(y)\n"),
        endsWith("(print y)\n")
    );
    assertThat(
        parse("for i in range(2):\n    z = i\nprint(z)\nprint(i)\n"),
        endsWith("(print z)\n(print i)\n")
    );
    assertThat(
        parse("try:\n    w = 1\nexcept ValueError:\n    pass\nprint(w)\n"),
        endsWith("(print w)\n")
    );
  }

  @Test
  void canKeepFunctionScopesApartFromTopLevel() {
    assertEquals(
        "variable 'x' used before assignment (at 'x')",
        failure("x = 1\ndef f():\n    return x\n")
    );
  }

  @Test
  void canRejectLoopControlOutsideLoops() {
    assertEquals(
        "'break' outside loop (at 'break')",
        failure("c = 1\nif c:\n    if c:\n        break\n")
    );
    assertEquals(
        "'continue' outside loop (at 'continue')", failure("continue\n")
    );
    assertEquals(
        "'return' outside function (at 'return')", failure("return 1\n")
    );
  }

  @Test
  void canAllowLoopControlInsideNestedIfs() throws Exception {
    assertEquals(
        "(assign c 1)\n(while c ((if c ((if c ((break)) ((continue)))))))\n",
        parse(
            "c = 1\nwhile c:\n    if c:\n        if c:\n            break\n" +
            "        else:\n            continue\n"
        )
    );
  }

  @Test
  void canResolveForwardReferences() throws Exception {
    assertEquals(
        "(def f () ((return (call g))))\n(def g () ((return 1)))\n(print (call f))\n",
        parse(
            "def f():\n    return g()\ndef g():\n    return 1\nprint(f())\n"
        )
    );
  }

  @Test
  void canCheckArities() {
    assertEquals(
        "Function 'f' expects 2 args, got 1 (at 'f')",
        failure("def f(a, b):\n    return a\nprint(f(1))\n")
    );
    assertEquals(
        "len() expects exactly 1 argument, got 2 (at 'len')",
        failure("print(len(\"a\", \"b\"))\n")
    );
    assertEquals(
        "pow() expects 2 to 3 arguments, got 1 (at 'pow')", failure("print(pow(2))\n")
    );
    assertThat(
        failure("for i in range(1, 2, 3, 4):\n    pass\n"),
        startsWith("range() expects 1 to 3 arguments, got 4")
    );
    assertThat(failure("print(g())\n"), startsWith("unknown function or class: 'g'"));
  }

  @Test
  void canRejectLiteralZeroStepAndDivisor() {
    assertThat(
        failure("for i in range(0, 5, 0):\n    pass\n"),
        startsWith("range() arg 3 must not be zero")
    );
    assertEquals("division by zero (at '//')", failure("x = 1 // 0\n"));
    assertEquals("modulo by zero (at '%')", failure("x = 1 % 0\n"));
    assertEquals("division by zero (at '//=')", failure("x = 1\nx //= 0\n"));
  }

  @Test
  void canRejectUnsupportedSyntax() {
    assertThat(failure("x = 1 / 2\n"), startsWith("true division '/' is not supported"));
    assertThat(failure("x = 2 ** 3\n"), startsWith("'**' is not supported"));
    assertThat(failure("x = None\n"), startsWith("'None' is not supported"));
    assertThat(failure("x = (1, 2)\n"), startsWith("tuples are not supported"));
    assertThat(failure("y = 0\nx = y = 1\n"), startsWith("chained assignment is not supported"));
    assertThat(
        failure("x = 1\nprint(1 < x < 3)\n"),
        startsWith("chained comparisons are not supported")
    );
    assertThat(failure("x = 1\nx\n"), startsWith("expression statement has no effect"));
    assertThat(failure("import os\n"), startsWith("unsupported syntax: 'import'"));
    assertThat(
        failure("def f():\n    def g():\n        return 1\n    return 2\n"),
        startsWith("nested functions are not supported")
    );
  }

  @Test
  void canParseClasses() throws Exception {
    String source = "class Point:\n" +
                    "    x = 0\n" +
                    "    def __init__(self, a):\n" +
                    "        self.y = a\n" +
                    "    def sum(self):\n" +
                    "        return self.x + self.y\n" +
                    "p = Point(1)\n" +
                    "print(p.sum())\n";
    assertEquals(
        "(class Point (fields x=0 y=0) (def __init__ (self a) ((set self y a))) " +
            "(def sum (self) ((return (+ (get self x) (get self y))))))\n" +
            "(assign p (new Point 1))\n(print (method p sum))\n",
        parse(source)
    );

    ModuleIR module = Parser.parse(source);
    ClassDef point = module.classes.get(0);
    assertEquals(
        List.of(
            new FieldDef("x", BigInteger.ZERO), new FieldDef("y", BigInteger.ZERO)
        ),
        point.fields
    );
    assertNotNull(point.initializer());
  }

  @Test
  void canRejectMalformedClasses() {
    assertThat(
        failure("class A(B):\n    pass\n"),
        startsWith("class inheritance is not supported")
    );
    assertThat(
        failure("class A:\n    def f(x):\n        return x\n"),
        startsWith("method 'f' must take 'self' as its first parameter")
    );
    assertThat(
        failure("class A:\n    x = \"s\"\n"),
        startsWith("class field 'x' must be initialized with an integer literal")
    );
    assertThat(
        failure("class A:\n    def __init__(self, v):\n        self.v = v\na = A()\n"),
        startsWith("A() expects 1 args, got 0")
    );
    assertThat(
        failure("class A:\n    pass\nclass A:\n    pass\n"),
        startsWith("duplicate definition of class 'A'")
    );
    assertThat(
        failure("def len(x):\n    return x\n"), startsWith("cannot redefine builtin 'len'")
    );
  }

  @Test
  void canParseTryStatements() throws Exception {
    assertEquals(
        "(try ((raise ValueError \"bad\")) (except ValueError ((print 1))) " +
            "(except ((print 2))))\n",
        parse(
            "try:\n    raise ValueError(\"bad\")\nexcept ValueError:\n    print(1)\n" +
            "except:\n    print(2)\n"
        )
    );
    assertEquals(
        "(try ((raise KeyError)) (except Exception ((print 0))))\n",
        parse("try:\n    raise KeyError\nexcept Exception:\n    print(0)\n")
    );
  }

  @Test
  void canRejectMalformedTryStatements() {
    assertThat(
        failure("try:\n    pass\nexcept:\n    pass\nexcept ValueError:\n    pass\n"),
        startsWith("default 'except:' must be last")
    );
    assertThat(
        failure("try:\n    pass\nprint(1)\n"),
        startsWith("Expected 'except' after 'try' block.")
    );
    assertThat(failure("raise Oops\n"), startsWith("unknown exception type 'Oops'"));
    assertThat(failure("raise\n"), startsWith("bare 'raise' is not supported"));
  }

  @Test
  void canRejectUnexpectedIndent() {
    assertThat(failure("x = 1\n    y = 2\n"), startsWith("unexpected indent"));
  }
}
