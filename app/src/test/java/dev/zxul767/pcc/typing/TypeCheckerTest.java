package dev.zxul767.pcc.typing;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.*;
import static org.junit.jupiter.api.Assertions.*;

import dev.zxul767.pcc.Backend;
import dev.zxul767.pcc.CompileError;
import dev.zxul767.pcc.parsing.Parser;
import org.junit.jupiter.api.Test;

class TypeCheckerTest {
  static final String BIG = "99999999999999999999";

  static ModuleTypes check(String source, Backend backend) throws CompileError {
    return TypeChecker.check(Parser.parse(source), backend);
  }

  static ModuleTypes check(String source) throws CompileError {
    return check(source, Backend.FAST);
  }

  static ScopeTypes main(String source) throws CompileError {
    return check(source).main();
  }

  static TypeError failure(String source, Backend backend) {
    return assertThrows(TypeError.class, () -> check(source, backend));
  }

  static String failure(String source) {
    return failure(source, Backend.FAST).getMessage();
  }

  @Test
  void canInferScalarTypes() throws CompileError {
    ScopeTypes main = main(
        "i = 1\nf = 1.5\ns = \"a\" + \"b\"\nb = i < 2\n" +
        "xs = [1, 2]\nd = {\"k\": 1}\nc = s[0]\nn = len(xs)\n"
    );
    assertEquals(Type.INT, main.typeOf("i"));
    assertEquals(Type.FLOAT, main.typeOf("f"));
    assertEquals(Type.STR, main.typeOf("s"));
    assertEquals(Type.BOOL, main.typeOf("b"));
    assertEquals(Type.LIST, main.typeOf("xs"));
    assertEquals(Type.DICT, main.typeOf("d"));
    assertEquals(Type.STR, main.typeOf("c"));
    assertEquals(Type.INT, main.typeOf("n"));
  }

  @Test
  void canUseArbitraryPrecisionEverywhereInPreciseBackend() throws CompileError {
    ModuleTypes types = check(
        "def f(a):\n    return a + 1\nx = 1\ny = f(x)\n", Backend.PRECISE
    );
    assertEquals(Type.BIGINT, types.main().typeOf("x"));
    assertEquals(Type.BIGINT, types.main().typeOf("y"));
    assertEquals(Type.BIGINT, types.function("f").typeOf("a"));
  }

  @Test
  void canTypeOutOfRangeLiteralsAsBigint() throws CompileError {
    ScopeTypes main = main("x = " + BIG + "\ny = x + 1\n");
    assertEquals(Type.BIGINT, main.typeOf("x"));
    assertEquals(Type.BIGINT, main.typeOf("y"));
  }

  @Test
  void canPromoteNativeIntsThatReceiveBigints() throws CompileError {
    assertEquals(
        Type.BIGINT, main("x = 1\nx = " + BIG + "\nprint(x)\n").typeOf("x")
    );
    assertEquals(
        Type.BIGINT,
        main("x = 1\nfor i in range(3):\n    x = x * " + BIG + "\nprint(x)\n")
            .typeOf("x")
    );
    assertEquals(
        Type.BIGINT,
        main("c = 1\nif c:\n    x = 1\nelse:\n    x = " + BIG + "\n").typeOf("x")
    );
  }

  @Test
  void canTypeLoopCountersFromTheirBounds() throws CompileError {
    ScopeTypes main = main(
        "for i in range(3):\n    pass\nfor j in range(" + BIG + ", " + BIG +
        " + 2):\n    pass\n"
    );
    assertEquals(Type.INT, main.typeOf("i"));
    assertEquals(Type.BIGINT, main.typeOf("j"));
  }

  @Test
  void canTypeMethodReceivers() throws CompileError {
    ModuleTypes types = check(
        "class P:\n    x = 1\n    def get(self, k):\n        return self.x + k\n" +
        "p = P()\nprint(p.get(2))\n"
    );
    ScopeTypes get = types.method("P", "get");
    assertEquals(Type.object("P"), get.typeOf("self"));
    assertEquals(Type.INT, get.typeOf("k"));
    assertTrue(get.isParam("k"));
    assertEquals(Type.object("P"), types.main().typeOf("p"));
  }

  @Test
  void canTypePowersAndConversions() throws CompileError {
    ScopeTypes main = main(
        "a = pow(2, 10)\nb = pow(2.0, 3)\nc = str(12)\nd = int(\"7\")\n" +
        "e = abs(-3)\nf = max(1, 2.5)\n"
    );
    assertEquals(Type.BIGINT, main.typeOf("a"));
    assertEquals(Type.FLOAT, main.typeOf("b"));
    assertEquals(Type.STR, main.typeOf("c"));
    assertEquals(Type.INT, main.typeOf("d"));
    assertEquals(Type.INT, main.typeOf("e"));
    assertEquals(Type.FLOAT, main.typeOf("f"));
  }

  @Test
  void canRejectMixingStrAndInt() {
    TypeError error = failure("s = \"a\"\nprint(s + 1)\n", Backend.FAST);
    assertEquals("unsupported operand types for +: 'str' and 'int'", error.getMessage());
    assertEquals(
        "Type Error: [line 2] unsupported operand types for +: 'str' and 'int'",
        error.toString()
    );
    assertEquals(
        "'<' not supported between 'str' and 'int'",
        failure("s = \"a\"\nprint(s < 1)\n")
    );
  }

  @Test
  void canRejectReassignmentWithAnotherType() {
    assertEquals(
        "variable 'x' reassigned from int to str", failure("x = 1\nx = \"a\"\n")
    );
  }

  @Test
  void canRejectConflictingBranches() {
    assertEquals(
        "variable 'x' assigned incompatible types in branches (int vs str)",
        failure("c = 1\nif c:\n    x = 1\nelse:\n    x = \"s\"\n")
    );
  }

  @Test
  void canRejectAliasing() {
    assertEquals(
        "'b' must be assigned a list literal: containers cannot be shared between names",
        failure("a = [1]\nb = a\n")
    );
    assertEquals(
        "'q' must be assigned a new object: objects cannot be shared between names",
        failure("class P:\n    pass\np = P()\nq = p\n")
    );
  }

  @Test
  void canRejectAssigningSelf() {
    assertEquals(
        "cannot assign to 'self'",
        failure("class P:\n    def m(self):\n        self = 1\n        return 0\n")
    );
  }

  @Test
  void canRejectUnsupportedItemAssignment() {
    assertEquals(
        "list item assignment is not supported", failure("xs = [1]\nxs[0] = 2\n")
    );
    assertEquals(
        "'str' object does not support item assignment",
        failure("s = \"ab\"\ns[0] = 1\n")
    );
    assertEquals("dict keys must be str, got 'int'", failure("d = {}\nd[1] = 2\n"));
  }

  @Test
  void canRejectBadAttributesAndMethods() {
    assertEquals(
        "'P' object has no attribute 'y'",
        failure("class P:\n    x = 0\np = P()\nprint(p.y)\n")
    );
    assertEquals(
        "P.m() expects 1 args, got 0",
        failure(
            "class P:\n    def m(self, a):\n        return a\np = P()\nprint(p.m())\n"
        )
    );
    assertEquals(
        "'int' object has no attribute 'append'", failure("x = 1\nx.append(2)\n")
    );
  }

  @Test
  void canRejectUsingResultOfAppend() {
    assertEquals(
        "cannot assign a call without result to 'y'",
        failure("xs = []\ny = xs.append(1)\n")
    );
  }

  @Test
  void canRejectValuesThatDoNotFitTheirSlots() {
    assertEquals(
        "cannot print a value of type 'list'", failure("xs = [1]\nprint(xs)\n")
    );
    assertEquals(
        "list element must be an int, got 'str'", failure("xs = [\"a\"]\n")
    );
    assertEquals(
        "return value must be an int, got 'float'",
        failure("def f():\n    return 1.5\n")
    );
    assertEquals(
        "'int' object is not subscriptable", failure("x = 1\nprint(x[0])\n")
    );
    assertEquals(
        "object of type 'int' has no len()", failure("x = 1\nprint(len(x))\n")
    );
  }

  @Test
  void canRejectFieldsThatDoNotFitNativeInts() throws CompileError {
    String source = "class P:\n    x = " + BIG + "\n";
    assertThat(
        failure(source), startsWith("initial value of field 'P.x' does not fit")
    );
    assertNotNull(check(source, Backend.PRECISE));
  }
}
