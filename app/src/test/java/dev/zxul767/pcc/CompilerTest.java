package dev.zxul767.pcc;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.*;
import static org.junit.jupiter.api.Assertions.*;

import dev.zxul767.pcc.codegen.CodegenError;
import dev.zxul767.pcc.parsing.LexError;
import dev.zxul767.pcc.parsing.ParseError;
import dev.zxul767.pcc.typing.TypeError;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.Test;

class CompilerTest {
  static String compile(String source, Backend backend) throws CompileError {
    return new Compiler(new CompilerOptions(backend, "main.py")).compile(source);
  }

  @Test
  void canCompileWholeProgram() throws CompileError {
    String source = "def fib(n):\n" +
                    "    a = 0\n" +
                    "    b = 1\n" +
                    "    for i in range(n):\n" +
                    "        t = a + b\n" +
                    "        a = b\n" +
                    "        b = t\n" +
                    "    return a\n" +
                    "print(fib(90))\n";
    String fast = compile(source, Backend.FAST);
    assertThat(fast, containsString("static long long pcc_fn_fib(long long v_n)"));
    assertThat(fast, containsString("pcc_source = \"main.py\";"));

    String precise = compile(source, Backend.PRECISE);
    assertThat(precise, containsString("static void pcc_fn_fib(rt_int* pcc_out, const rt_int* pcc_arg_n)"));
  }

  @Test
  void canStopAtFirstErrorOfEachStage() {
    assertThrows(LexError.class, () -> compile("x = 1 $ 2\n", Backend.FAST));
    assertThrows(ParseError.class, () -> compile("print(x)\n", Backend.FAST));
    TypeError error =
        assertThrows(TypeError.class, () -> compile("x = 1\nx = \"s\"\n", Backend.FAST));
    assertEquals(CompileError.Stage.TYPE, error.stage);
    assertEquals(2, error.line);
  }

  @Test
  void canParseWithoutTypeChecking() throws CompileError {
    Compiler compiler = new Compiler(CompilerOptions.defaults());
    // ill-typed but well-formed
    assertEquals(2, compiler.parse("x = 1\nx = \"s\"\n").mainStatements.size());
    assertEquals(Backend.FAST, compiler.options().backend);
  }

  @Test
  void canSelectBackendByName() {
    assertEquals(Backend.FAST, Backend.parse("fast"));
    assertEquals(Backend.PRECISE, Backend.parse(" Precise "));
    assertEquals(Backend.PRECISE, Backend.parse("safe"));
    assertThrows(IllegalArgumentException.class, () -> Backend.parse("turbo"));
  }

  @Test
  void canDeriveOptions() {
    CompilerOptions options = CompilerOptions.defaults();
    assertEquals(CompilerOptions.DEFAULT_SOURCE_NAME, options.sourceName);

    CompilerOptions derived = options.withBackend(Backend.PRECISE).withSourceName("a.py");
    assertEquals(Backend.PRECISE, derived.backend);
    assertEquals("a.py", derived.sourceName);
    assertEquals(Backend.FAST, options.backend);
  }

  @Test
  void canFormatDiagnostics() {
    ByteArrayOutputStream bytes = new ByteArrayOutputStream();
    Errors errors = new Errors(new PrintStream(bytes, true, StandardCharsets.UTF_8));
    errors.report("a.py", new ParseError("Expected expression.", 3, 9));
    errors.report("b.py", new TypeError("variable 'x' reassigned from int to str", 4));
    errors.internal(new CodegenError("'break' outside loop"));

    String[] lines = bytes.toString(StandardCharsets.UTF_8).split("\\R");
    assertEquals("a.py: Parsing Error: [line 3, column 9] Expected expression.", lines[0]);
    assertEquals(
        "b.py: Type Error: [line 4] variable 'x' reassigned from int to str", lines[1]
    );
    assertEquals("Internal Error: 'break' outside loop", lines[2]);
  }
}
