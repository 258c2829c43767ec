package dev.zxul767.pcc;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.*;
import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class PccTest {
  static Pcc.ReplSession session() {
    return new Pcc.ReplSession(CompilerOptions.defaults());
  }

  @Test
  void canAccumulateReplEntries() {
    Pcc.ReplSession session = session();
    assertThat(session.submit("x = 1\n"), containsString("v_x = 1LL;"));

    String code = session.submit("print(x + 1)\n");
    assertThat(code, containsString("__builtin_add_overflow(v_x, 1LL, &pcc_tmp_"));
    assertThat(code, containsString("pcc_source = \"<repl>\";"));
    assertEquals("x = 1\nprint(x + 1)\n", session.program());
  }

  @Test
  void canDropRejectedReplEntries() {
    Pcc.ReplSession session = session();
    session.submit("x = 1\n");
    assertEquals(
        "Parsing Error: [line 2, column 7] variable 'y' used before assignment (at 'y')\n",
        session.submit("print(y)\n")
    );
    assertEquals(
        "Type Error: [line 2] variable 'x' reassigned from int to str\n",
        session.submit("x = \"s\"\n")
    );
    assertEquals("x = 1\n", session.program());
  }

  @Test
  void canSwitchBackendsInRepl() {
    Pcc.ReplSession session = session();
    session.submit("x = 1\n");
    assertEquals("backend: precise", session.command(":precise"));
    assertEquals(Backend.PRECISE, session.backend());
    assertThat(session.submit("print(x)\n"), containsString("rt_print_int(&v_x);"));

    assertEquals("backend: fast", session.command(":fast"));
    assertThat(session.submit("print(x)\n"), containsString("printf(\"%lld\\n\", v_x);"));
  }

  @Test
  void canShowAndResetReplProgram() {
    Pcc.ReplSession session = session();
    session.submit("x = 1\n");
    session.submit("if x:\n    print(x)\n");
    assertEquals("(assign x 1)\n(if x ((print x)))\n", session.command(":ir"));

    assertEquals("session cleared", session.command(":reset"));
    assertEquals("", session.program());
    assertThat(session.submit("print(x)\n"), startsWith("Parsing Error"));
    assertEquals("Unknown command: :quit", session.command(":quit"));
  }

  @Test
  void canCompileFileToOutput(@TempDir Path directory) throws IOException {
    Path script = directory.resolve("squares.py");
    Files.writeString(
        script, "for i in range(4):\n    print(i * i)\n", StandardCharsets.UTF_8
    );
    Path output = directory.resolve("squares.c");

    int status = Pcc.compileFile(
        CompilerOptions.defaults(), script.toString(), output.toString()
    );
    assertEquals(0, status);
    String code = Files.readString(output, StandardCharsets.UTF_8);
    assertThat(code, startsWith("/* Generated by pcc from "));
    assertThat(code, containsString("__builtin_mul_overflow(v_i, v_i, &pcc_tmp_"));
  }

  @Test
  void canReportExitCodes(@TempDir Path directory) throws IOException {
    Path broken = directory.resolve("broken.py");
    Files.writeString(broken, "print(1 // 0)\n", StandardCharsets.UTF_8);
    Path output = directory.resolve("broken.c");

    assertEquals(
        Pcc.EXIT_COMPILE_ERROR,
        Pcc.compileFile(CompilerOptions.defaults(), broken.toString(), output.toString())
    );
    assertFalse(Files.exists(output));
    assertEquals(
        Pcc.EXIT_NO_INPUT,
        Pcc.compileFile(
            CompilerOptions.defaults(), directory.resolve("missing.py").toString(), null
        )
    );
  }
}
