package dev.zxul767.pcc;

import dev.zxul767.pcc.codegen.CodeGenerator;
import dev.zxul767.pcc.ir.ModuleIR;
import dev.zxul767.pcc.parsing.LexError;
import dev.zxul767.pcc.parsing.Lexer;
import dev.zxul767.pcc.parsing.ParseError;
import dev.zxul767.pcc.parsing.Parser;
import dev.zxul767.pcc.parsing.Token;
import dev.zxul767.pcc.typing.ModuleTypes;
import dev.zxul767.pcc.typing.TypeChecker;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

// The whole pipeline: source text -> tokens -> IR -> types -> C source.
// Every stage stops at its first error. A `Compiler` holds no state besides
// its options, so independent compilations can share one.
public class Compiler {
  private static final Logger logger = LoggerFactory.getLogger(Compiler.class);

  private final CompilerOptions options;

  public Compiler(CompilerOptions options) { this.options = options; }

  public CompilerOptions options() { return options; }

  public ModuleIR parse(String source) throws LexError, ParseError {
    List<Token> tokens = new Lexer(source).tokenize();
    logger.debug("{}: {} tokens", options.sourceName, tokens.size());

    ModuleIR module = new Parser(tokens).parse();
    logger.debug(
        "{}: {} functions, {} classes, {} top-level statements",
        options.sourceName, module.functions.size(), module.classes.size(),
        module.mainStatements.size()
    );
    return module;
  }

  public ModuleTypes check(ModuleIR module) throws CompileError {
    ModuleTypes types = TypeChecker.check(module, options.backend);
    logger.debug("{}: type check passed ({} backend)", options.sourceName, options.backend);
    return types;
  }

  public String compile(String source) throws CompileError {
    ModuleIR module = parse(source);
    return CodeGenerator.generate(check(module), options.sourceName);
  }
}
