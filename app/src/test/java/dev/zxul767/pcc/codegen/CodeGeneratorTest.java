package dev.zxul767.pcc.codegen;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.*;
import static org.junit.jupiter.api.Assertions.*;

import dev.zxul767.pcc.Backend;
import dev.zxul767.pcc.CompileError;
import dev.zxul767.pcc.parsing.Parser;
import dev.zxul767.pcc.typing.TypeChecker;
import org.junit.jupiter.api.Test;

class CodeGeneratorTest {
  static String generate(String source, Backend backend) throws CompileError {
    return CodeGenerator.generate(
        TypeChecker.check(Parser.parse(source), backend), "test.py"
    );
  }

  static String fast(String source) throws CompileError {
    return generate(source, Backend.FAST);
  }

  static String precise(String source) throws CompileError {
    return generate(source, Backend.PRECISE);
  }

  static int occurrences(String text, String fragment) {
    int count = 0;
    for (int i = text.indexOf(fragment); i >= 0; i = text.indexOf(fragment, i + 1))
      count++;
    return count;
  }

  @Test
  void canWritePreamble() throws CompileError {
    String code = fast("print(1)\n");
    assertThat(
        code, startsWith("/* Generated by pcc from test.py (fast backend). Do not edit. */")
    );
    assertThat(code, containsString("#include <setjmp.h>"));
    assertThat(code, containsString("#include \"rt_bigint.h\""));
    assertThat(code, containsString("static const char* pcc_source = \"test.py\";"));
    assertThat(code, containsString("int main(void) {"));
    assertThat(code, containsString("return 0;"));
    assertThat(precise("print(1)\n"), containsString("(precise backend)"));
  }

  @Test
  void canUseNativeIntegersInFastBackend() throws CompileError {
    String code = fast("x = 1\nprint(x + 2)\n");
    assertThat(code, containsString("long long v_x = 0;"));
    assertThat(code, containsString("v_x = 1LL;"));
    assertThat(code, containsString("if (__builtin_add_overflow(v_x, 2LL, &pcc_tmp_"));
    assertThat(code, containsString("printf(\"%lld\\n\", pcc_tmp_"));
    assertThat(code, not(containsString("rt_int_add")));
  }

  @Test
  void canUseArbitraryPrecisionInPreciseBackend() throws CompileError {
    String code = precise("x = 1\nprint(x + 2)\n");
    assertThat(code, containsString("rt_int v_x;"));
    assertThat(code, containsString("rt_int_init(&v_x);"));
    assertThat(code, containsString("rt_int_add(&"));
    assertThat(code, containsString("rt_print_int(&"));
    assertThat(code, containsString("rt_int_clear(&v_x);"));
    assertThat(code, not(containsString("printf(\"%lld")));
  }

  @Test
  void canFallBackToBigintForLargeLiterals() throws CompileError {
    String code = fast("x = 99999999999999999999\nprint(x)\n");
    assertThat(code, containsString("rt_int_from_dec(&"));
    assertThat(code, containsString("\"99999999999999999999\""));
    assertThat(code, containsString("rt_print_int(&v_x);"));
  }

  @Test
  void canCheckDivisorBeforeFloorDivision() throws CompileError {
    String code = fast("a = 7\nb = 2\nprint(a // b)\nprint(a % b)\n");
    String zeroCheck =
        "if (v_b == 0) rt_raise(RT_EXC_ZeroDivisionError, " +
        "\"integer division or modulo by zero\", pcc_source, 3);";
    assertThat(code, containsString(zeroCheck));
    assertThat(code, containsString(" = v_a / v_b;"));
    assertThat(code, containsString("if (((v_a < 0) != (v_b < 0)) && v_a % v_b != 0)"));
    assertThat(code.indexOf(zeroCheck), lessThan(code.indexOf(" = v_a / v_b;")));
    assertThat(code, containsString(" = v_b == -1 ? 0 : v_a % v_b;"));
  }

  @Test
  void canRaiseOnNativeOverflow() throws CompileError {
    String overflow =
        "rt_raise(RT_EXC_ValueError, \"integer overflow (native int out of range)\", " +
        "pcc_source, 2);";
    String code = fast("a = 9223372036854775807\nprint(a + 1)\nprint(a - 1)\nprint(a * 2)\n");
    assertThat(code, containsString("#include <limits.h>"));
    assertThat(code, containsString("if (__builtin_add_overflow(v_a, 1LL, &pcc_tmp_"));
    assertThat(code, containsString(overflow));
    assertThat(code, containsString("if (__builtin_sub_overflow(v_a, 1LL, &pcc_tmp_"));
    assertThat(code, containsString("if (__builtin_mul_overflow(v_a, 2LL, &pcc_tmp_"));
    assertThat(code, not(containsString("(v_a + 1LL)")));

    String doubling = "x = 1\nfor i in range(70):\n    x = x * 2\nprint(x)\n";
    assertThat(fast(doubling), containsString("if (__builtin_mul_overflow(v_x, 2LL, &pcc_tmp_"));
    assertThat(precise(doubling), containsString("rt_int_mul(&"));
    assertThat(precise(doubling), not(containsString("__builtin_mul_overflow")));
  }

  @Test
  void canGuardMostNegativeFloorDivision() throws CompileError {
    String code = fast("a = -9223372036854775808\nb = -1\nprint(a // b)\nprint(-a)\nprint(abs(a))\n");
    String guard =
        "if (v_a == LLONG_MIN && v_b == -1) rt_raise(RT_EXC_ValueError, " +
        "\"integer overflow (native int out of range)\", pcc_source, 3);";
    assertThat(code, containsString(guard));
    assertThat(code.indexOf(guard), lessThan(code.indexOf(" = v_a / v_b;")));
    assertThat(code, containsString("if (v_a == LLONG_MIN) rt_raise(RT_EXC_ValueError, "));
    assertEquals(2, occurrences(code, "if (v_a == LLONG_MIN) rt_raise("));
  }

  @Test
  void canStopRangeLoopsBeforeCounterOverflows() throws CompileError {
    String code = fast("for i in range(0, 9223372036854775807, 4611686018427387904):\n    print(i)\n");
    assertThat(code, containsString(" > LLONG_MAX - "));
    assertThat(code, containsString(" < LLONG_MIN - "));
  }

  @Test
  void canCheckDivisorOfBigints() throws CompileError {
    String code = precise("a = 7\nb = 2\nprint(a // b)\n");
    assertThat(code, containsString("if (rt_int_is_zero(&v_b)) rt_raise(RT_EXC_ZeroDivisionError"));
    assertThat(code, containsString("rt_int_floordiv(&"));
  }

  @Test
  void canLowerWhileLoopsToLabels() throws CompileError {
    String code = fast("n = 3\nwhile n > 0:\n    n -= 1\n    if n == 1:\n        break\n");
    assertThat(code, containsString("pcc_while_1: ;"));
    assertThat(code, containsString("goto pcc_while_end_1;"));
    assertThat(code, containsString("goto pcc_while_1;"));
    assertThat(code, containsString("pcc_while_end_1: ;"));
  }

  @Test
  void canLowerForLoopsOverRanges() throws CompileError {
    String code = fast("for i in range(10, 0, -2):\n    if i == 4:\n        continue\n    print(i)\n");
    assertThat(code, containsString("rt_raise(RT_EXC_ValueError, \"range() arg 3 must not be zero\""));
    assertThat(code, containsString("pcc_for_1: ;"));
    assertThat(code, containsString("goto pcc_for_next_1;"));
    assertThat(code, containsString("pcc_for_end_1: ;"));
    assertThat(code, containsString("printf(\"%lld\\n\", v_i);"));
  }

  @Test
  void canLowerForLoopsOverBigRanges() throws CompileError {
    String code = precise("for i in range(3):\n    print(i)\n");
    assertThat(code, containsString("rt_int_copy(&v_i, &"));
    assertThat(code, containsString("rt_int_cmp(&"));
    assertThat(code, containsString("rt_int_add(&"));
  }

  @Test
  void canLowerTryStatements() throws CompileError {
    String code = fast(
        "try:\n    raise ValueError(\"bad\")\nexcept ValueError:\n    print(1)\n" +
        "except KeyError:\n    print(2)\n"
    );
    assertThat(code, containsString("rt_try_ctx pcc_try_1;"));
    assertThat(code, containsString("rt_try_push(&pcc_try_1);"));
    assertThat(code, containsString("if (setjmp(pcc_try_1.env) == 0) {"));
    assertThat(code, containsString("rt_raise(RT_EXC_ValueError, \"bad\", pcc_source, 2);"));
    assertThat(code, containsString("if (rt_exc_is(RT_EXC_ValueError)) {"));
    assertThat(code, containsString("} else if (rt_exc_is(RT_EXC_KeyError)) {"));
    assertThat(code, containsString("rt_exc_clear();"));
    assertThat(code, containsString("rt_reraise();"));
  }

  @Test
  void canCatchEverythingWithDefaultHandler() throws CompileError {
    String code = fast("try:\n    raise KeyError\nexcept:\n    print(0)\n");
    assertThat(code, containsString("rt_raise(RT_EXC_KeyError, NULL, pcc_source, 2);"));
    assertThat(code, not(containsString("rt_reraise();")));
  }

  @Test
  void canKeepScalarsVolatileAcrossLongjmp() throws CompileError {
    String code = fast("x = 0\ntry:\n    x = 1\nexcept:\n    pass\nprint(x)\n");
    assertThat(code, containsString("volatile long long v_x = 0;"));
    assertThat(
        fast(
            "def f(a):\n    try:\n        raise ValueError\n    except ValueError:\n" +
            "        return a\n    return 0\n"
        ),
        containsString("static long long pcc_fn_f(volatile long long v_a)")
    );
  }

  @Test
  void canPopTryContextsWhenLeavingLoops() throws CompileError {
    String code = fast("for i in range(3):\n    try:\n        break\n    except:\n        pass\n");
    // break, normal completion and the handler path
    assertEquals(3, occurrences(code, "rt_try_pop(&pcc_try_2);"));
  }

  @Test
  void canLowerFunctions() throws CompileError {
    String code = fast("def add(a, b):\n    return a + b\nprint(add(1, 2))\n");
    assertThat(code, containsString("static long long pcc_fn_add(long long v_a, long long v_b);"));
    assertThat(code, containsString("long long pcc_ret = 0;"));
    assertThat(code, containsString("pcc_ret = (v_a + v_b);"));
    assertThat(code, containsString("goto pcc_exit;"));
    assertThat(code, containsString("pcc_exit: ;"));
    assertThat(code, containsString("return pcc_ret;"));
    assertThat(code, containsString(" = pcc_fn_add(1LL, 2LL);"));
  }

  @Test
  void canPassBigintsByAddress() throws CompileError {
    String code = precise("def add(a, b):\n    return a + b\nprint(add(1, 2))\n");
    assertThat(
        code,
        containsString(
            "static void pcc_fn_add(rt_int* pcc_out, const rt_int* pcc_arg_a, " +
            "const rt_int* pcc_arg_b)"
        )
    );
    assertThat(code, containsString("rt_int_set_si(pcc_out, 0);"));
    assertThat(code, containsString("rt_int_copy(&v_a, pcc_arg_a);"));
    assertThat(code, containsString("rt_int_copy(pcc_out, &"));
  }

  @Test
  void canLowerClasses() throws CompileError {
    String code = fast(
        "class Counter:\n    count = 0\n    def add(self, n):\n" +
        "        self.count = self.count + n\n        return self.count\n" +
        "c = Counter()\nc.add(2)\nc = Counter()\n"
    );
    assertThat(code, containsString("typedef struct pcc_class_Counter {"));
    assertThat(code, containsString("long long f_count;"));
    assertThat(code, containsString("} pcc_class_Counter;"));
    assertThat(code, containsString("static pcc_class_Counter* pcc_new_Counter(void)"));
    assertThat(code, containsString("self->f_count = 0LL;"));
    assertThat(code, containsString("static void pcc_delete_Counter(pcc_class_Counter* self)"));
    assertThat(
        code,
        containsString(
            "static long long pcc_method_Counter_add(pcc_class_Counter* v_self, long long v_n);"
        )
    );
    assertThat(code, containsString("v_self->f_count = "));
    // rebinding releases the previous instance
    assertThat(code, containsString("pcc_delete_Counter(v_c);"));
  }

  @Test
  void canLowerStringsAndContainers() throws CompileError {
    String code = fast(
        "s = \"hi\"\nprint(s + \"!\")\nxs = [1, 2]\nxs.append(3)\nprint(xs[0])\n" +
        "d = {\"a\": 1}\nd[\"b\"] = 2\nprint(d[\"a\"])\nprint(len(s))\n"
    );
    assertThat(code, containsString("rt_str_from_cstr(\"hi\");"));
    assertThat(code, containsString("rt_str_concat("));
    assertThat(code, containsString("rt_print_str("));
    assertThat(code, containsString("rt_list_si_append(&v_xs, 3LL);"));
    assertThat(code, containsString("rt_list_si_get(&v_xs, 0LL);"));
    assertThat(code, containsString("rt_dict_ssi_set(&v_d, "));
    assertThat(code, containsString("rt_dict_ssi_get(&v_d, "));
    assertThat(code, containsString("((long long)rt_str_len(&v_s))"));
    assertThat(code, containsString("rt_str_clear(&v_s);"));
    assertThat(code, containsString("rt_list_si_clear(&v_xs);"));
  }

  @Test
  void canKeepEmbeddedNulsInStrings() throws CompileError {
    String code = fast("s = \"a\\0b\"\nt = s\nprint(str(t))\n");
    assertThat(
        code, containsString("rt_str_concat(((rt_str){3, 0, (char*)\"a\\000b\"}), rt_str_null());")
    );
    assertThat(code, containsString(" = rt_str_concat(v_s, rt_str_null());"));
    assertThat(code, containsString(" = rt_str_concat(v_t, rt_str_null());"));
    assertThat(code, not(containsString(".data)")));
    assertEquals("rt_str_from_cstr(\"ab\")", CNames.newString("ab"));
  }

  @Test
  void canIndexStringsWithBoundsCheck() throws CompileError {
    String code = fast("s = \"abc\"\nprint(s[-1])\n");
    assertThat(code, containsString("\"string index out of range\""));
    assertThat(code, containsString("rt_str_substring(v_s, (size_t)"));
  }

  @Test
  void canEmitFloatHelpersOnlyWhenNeeded() throws CompileError {
    String code = fast("x = 1.5\nprint(x * 2)\n");
    assertThat(code, containsString("static void pcc_format_float(char* buffer, size_t size, double x)"));
    assertThat(code, containsString("snprintf(buffer, size, \"%.*g\", precision, x);"));
    assertThat(code, not(containsString("%%")));
    assertThat(code, containsString("pcc_print_float((v_x * ((double)2LL)));"));
    assertThat(fast("print(1)\n"), not(containsString("pcc_format_float")));
  }

  @Test
  void canShortCircuitLogicalOperators() throws CompileError {
    String code = fast("a = 1\nb = 0\nprint(a and b)\n");
    assertThat(code, containsString(" = (v_a != 0);"));
    assertThat(code, containsString("puts("));
  }

  @Test
  void canEscapeStringLiterals() {
    assertEquals("\"a\\\"b\\\\c\\n\"", CNames.cString("a\"b\\c\n"));
    assertEquals("\"\\303\\251\"", CNames.cString("é"));
    assertEquals("\"\\?\\?=\"", CNames.cString("??="));
  }

  @Test
  void canSpellExtremeLiterals() {
    assertEquals("(-9223372036854775807LL - 1)", CNames.intLiteral(Long.MIN_VALUE));
    assertEquals("(-5LL)", CNames.intLiteral(-5));
    assertEquals("NAN", CNames.floatLiteral(Double.NaN));
    assertEquals("(-HUGE_VAL)", CNames.floatLiteral(Double.NEGATIVE_INFINITY));
  }

  @Test
  void canGenerateDeterministicOutput() throws CompileError {
    String source = "def f(n):\n    return n * 2\nfor i in range(3):\n    print(f(i))\n";
    assertEquals(fast(source), fast(source));
  }
}
