package dev.zxul767.pcc.codegen;

import dev.zxul767.pcc.Backend;
import dev.zxul767.pcc.ir.ClassDef;
import dev.zxul767.pcc.ir.FieldDef;
import dev.zxul767.pcc.ir.FunctionDef;
import dev.zxul767.pcc.ir.ModuleIR;
import dev.zxul767.pcc.ir.Stmt;
import dev.zxul767.pcc.typing.ModuleTypes;
import dev.zxul767.pcc.typing.ScopeTypes;
import dev.zxul767.pcc.typing.Type;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

// Lowers a type-checked module to a single C translation unit that links
// against the runtime library.
//
// Layout: banner, includes, source name, float helpers (only when floats are
// printed or converted), class structs, constructors and destructors,
// prototypes, methods, functions and `main`.
public class CodeGenerator {
  private static final Logger logger = LoggerFactory.getLogger(CodeGenerator.class);

  private static final String[] SYSTEM_HEADERS = {
      "limits.h", "math.h", "setjmp.h", "stdint.h", "stdio.h", "stdlib.h", "string.h"};
  private static final String[] RUNTIME_HEADERS = {
      "rt_bigint.h", "rt_dict.h",  "rt_error.h",  "rt_exc.h",
      "rt_list.h",   "rt_math.h",  "rt_string.h", "rt_string_ex.h"};

  private final ModuleTypes types;
  private final ModuleIR module;
  private final Backend backend;
  private final String sourceName;
  private final GeneratorState state = new GeneratorState();

  public CodeGenerator(ModuleTypes types, String sourceName) {
    this.types = types;
    this.module = types.module;
    this.backend = types.backend;
    this.sourceName = sourceName;
  }

  public static String generate(ModuleTypes types, String sourceName) {
    return new CodeGenerator(types, sourceName).generate();
  }

  public String generate() {
    CWriter classes = new CWriter();
    CWriter prototypes = new CWriter();
    CWriter definitions = new CWriter();

    for (ClassDef classDef : module.classes) {
      struct(classes, classDef);
      lifecycle(classes, classDef);
      for (FunctionDef method : classDef.methods) {
        String header = methodHeader(classDef, method);
        prototypes.println("%s;", header);
        function(
            definitions, header, types.method(classDef.name, method.name),
            method.body, false
        );
      }
    }
    for (FunctionDef function : module.functions) {
      String header = functionHeader(function);
      prototypes.println("%s;", header);
      function(definitions, header, types.function(function.name), function.body, false);
    }
    function(definitions, "int main(void)", types.main(), module.mainStatements, true);

    CWriter out = new CWriter();
    preamble(out);
    if (state.usesFloats)
      floatHelpers(out);
    section(out, classes);
    section(out, prototypes);
    section(out, definitions);

    String source = out.toString();
    logger.debug(
        "Generated {} characters of C ({} backend, {} temporaries, {} label groups)",
        source.length(), backend, state.tempCount(), state.labelCount()
    );
    return source;
  }

  private static void section(CWriter out, CWriter section) {
    if (section.isEmpty())
      return;
    out.append(section);
    out.newline();
  }

  private void preamble(CWriter out) {
    out.println(
        "/* Generated by pcc from %s (%s backend). Do not edit. */",
        sourceName.replace("*/", "* /"), backend.name().toLowerCase()
    );
    out.newline();
    for (String header : SYSTEM_HEADERS)
      out.println("#include <%s>", header);
    out.newline();
    for (String header : RUNTIME_HEADERS)
      out.println("#include \"%s\"", header);
    out.newline();
    out.println(
        "static const char* %s = %s;", CNames.SOURCE_NAME, CNames.cString(sourceName)
    );
    out.newline();
  }

  // Python's repr of floats: the shortest of %.15g, %.16g and %.17g that reads
  // back as the same double, with ".0" added to integral values
  private static void floatHelpers(CWriter out) {
    out.openBlock("static void pcc_format_float(char* buffer, size_t size, double x)");
    out.println("int precision;");
    out.openBlock("if (isnan(x))");
    out.println("snprintf(buffer, size, \"nan\");");
    out.println("return;");
    out.closeBlock();
    out.openBlock("if (isinf(x))");
    out.println("snprintf(buffer, size, x > 0 ? \"inf\" : \"-inf\");");
    out.println("return;");
    out.closeBlock();
    out.openBlock("for (precision = 15; precision <= 17; precision++)");
    out.println("snprintf(buffer, size, \"%.*g\", precision, x);");
    out.println("if (strtod(buffer, NULL) == x) break;");
    out.closeBlock();
    out.openBlock("if (strspn(buffer, \"-0123456789\") == strlen(buffer))");
    out.println("strncat(buffer, \".0\", size - strlen(buffer) - 1);");
    out.closeBlock();
    out.closeBlock();
    out.newline();
    out.openBlock("static void pcc_print_float(double x)");
    out.println("char buffer[64];");
    out.println("pcc_format_float(buffer, sizeof buffer, x);");
    out.println("puts(buffer);");
    out.closeBlock();
    out.newline();
    out.openBlock("static rt_str pcc_float_to_str(double x)");
    out.println("char buffer[64];");
    out.println("pcc_format_float(buffer, sizeof buffer, x);");
    out.println("return rt_str_from_cstr(buffer);");
    out.closeBlock();
    out.newline();
  }

  private Type fieldType() { return backend.integerType(); }

  private void struct(CWriter out, ClassDef classDef) {
    String name = CNames.classStruct(classDef.name);
    out.openBlock("typedef struct " + name);
    // C has no empty structs
    if (classDef.fields.isEmpty())
      out.println("char pcc_unused;");
    for (FieldDef field : classDef.fields)
      out.println("%s %s;", CNames.cType(fieldType()), CNames.field(field.name));
    out.closeBlock(name + ";");
    out.newline();
  }

  // pcc_new_C allocates and sets every field to its initial value;
  // pcc_delete_C accepts NULL
  private void lifecycle(CWriter out, ClassDef classDef) {
    String name = CNames.classStruct(classDef.name);
    out.openBlock(
        String.format("static %s* %s(void)", name, CNames.constructor(classDef.name))
    );
    out.println("%s* self = (%s*)malloc(sizeof(%s));", name, name, name);
    out.openBlock("if (self == NULL)");
    out.println("fprintf(stderr, \"pcc: out of memory\\n\");");
    out.println("exit(1);");
    out.closeBlock();
    for (FieldDef field : classDef.fields) {
      String target = "self->" + CNames.field(field.name);
      if (fieldType().is(Type.Kind.BIGINT)) {
        out.println("rt_int_init(&%s);", target);
        if (Backend.fitsNative(field.initialValue)) {
          out.println(
              "rt_int_set_si(&%s, %s);", target,
              CNames.intLiteral(field.initialValue.longValueExact())
          );
        } else {
          out.println(
              "rt_int_from_dec(&%s, \"%s\");", target, field.initialValue.toString()
          );
        }
      } else {
        out.println(
            "%s = %s;", target, CNames.intLiteral(field.initialValue.longValueExact())
        );
      }
    }
    out.println("return self;");
    out.closeBlock();
    out.newline();

    out.openBlock(
        String.format("static void %s(%s* self)", CNames.destructor(classDef.name), name)
    );
    out.println("if (self == NULL) return;");
    for (FieldDef field : classDef.fields) {
      String release = CNames.release(fieldType(), "self->" + CNames.field(field.name));
      if (release != null)
        out.println(release);
    }
    out.println("free(self);");
    out.closeBlock();
    out.newline();
  }

  private String functionHeader(FunctionDef function) {
    return header(
        CNames.function(function.name), null, function.params,
        containsTry(function.body)
    );
  }

  private String methodHeader(ClassDef classDef, FunctionDef method) {
    // the first parameter is `self`
    String self = String.format(
        "%s* %s", CNames.classStruct(classDef.name), CNames.variable(method.params.get(0))
    );
    return header(
        CNames.method(classDef.name, method.name), self,
        method.params.subList(1, method.params.size()), containsTry(method.body)
    );
  }

  // fast:    static long long f(long long v_a, ...)
  // precise: static void f(rt_int* pcc_out, const rt_int* pcc_arg_a, ...)
  private String header(
      String name, String self, List<String> params, boolean hasTry
  ) {
    List<String> parameters = new ArrayList<>();
    if (self != null)
      parameters.add(self);
    boolean precise = backend.integerType().is(Type.Kind.BIGINT);
    if (precise)
      parameters.add("rt_int* " + CNames.OUT);
    for (String param : params) {
      if (precise) {
        parameters.add("const rt_int* " + CNames.argument(param));
      } else {
        parameters.add(
            String.format("%slong long %s", hasTry ? "volatile " : "", CNames.variable(param))
        );
      }
    }
    return String.format(
        "static %s %s(%s)", precise ? "void" : "long long", name,
        parameters.isEmpty() ? "void" : String.join(", ", parameters)
    );
  }

  private void function(
      CWriter out, String header, ScopeTypes locals, List<Stmt> statements,
      boolean isMain
  ) {
    boolean hasTry = containsTry(statements);
    FunctionScope scope = new FunctionScope(types, locals, state, isMain, hasTry);
    boolean precise = backend.integerType().is(Type.Kind.BIGINT);

    CWriter body = out.child();
    body.indent();
    new StatementEmitter(scope, body).emit(statements);

    out.openBlock(header);
    if (!isMain) {
      if (precise) {
        out.println("rt_int_set_si(%s, 0);", CNames.OUT);
      } else {
        out.println("long long %s = 0;", CNames.RESULT);
      }
    }
    List<String> releases = new ArrayList<>();
    for (Map.Entry<String, Type> local : locals.variables.entrySet()) {
      String name = CNames.variable(local.getKey());
      Type type = local.getValue();
      if (locals.isParam(local.getKey())) {
        // parameters are copied so the function may reassign them
        if (precise && type.is(Type.Kind.BIGINT)) {
          CNames.declare(out, type, name, hasTry);
          out.println("rt_int_copy(&%s, %s);", name, CNames.argument(local.getKey()));
          releases.add(CNames.release(type, name));
        }
        continue;
      }
      CNames.declare(out, type, name, hasTry);
      String release = CNames.release(type, name);
      // objects still bound when the program ends are reclaimed by the OS
      if (release != null && !(isMain && type.is(Type.Kind.OBJECT)))
        releases.add(release);
    }
    scope.declareHidden(out);
    out.append(body);

    if (scope.exitUsed())
      out.label(CNames.EXIT_LABEL);
    for (String release : releases)
      out.println(release);
    scope.releaseHidden(out);
    if (isMain) {
      out.println("return 0;");
    } else if (!precise) {
      out.println("return %s;", CNames.RESULT);
    }
    out.closeBlock();
    out.newline();
  }

  static boolean containsTry(List<Stmt> statements) {
    for (Stmt statement : statements) {
      if (statement instanceof Stmt.Try)
        return true;
      if (statement instanceof Stmt.If) {
        Stmt.If ifStmt = (Stmt.If)statement;
        if (containsTry(ifStmt.thenBranch) || containsTry(ifStmt.elseBranch))
          return true;
      } else if (statement instanceof Stmt.While) {
        if (containsTry(((Stmt.While)statement).body))
          return true;
      } else if (statement instanceof Stmt.For) {
        if (containsTry(((Stmt.For)statement).body))
          return true;
      }
    }
    return false;
  }
}
