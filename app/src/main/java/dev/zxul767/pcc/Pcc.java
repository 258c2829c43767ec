package dev.zxul767.pcc;

import dev.zxul767.pcc.codegen.CodegenError;
import dev.zxul767.pcc.ir.AstPrinter;
import dev.zxul767.pcc.ir.Builtin;
import dev.zxul767.pcc.parsing.Lexer;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import org.jline.reader.Completer;
import org.jline.reader.EndOfFileException;
import org.jline.reader.LineReader;
import org.jline.reader.LineReaderBuilder;
import org.jline.reader.UserInterruptException;
import org.jline.reader.impl.DefaultParser;
import org.jline.reader.impl.completer.AggregateCompleter;
import org.jline.reader.impl.completer.StringsCompleter;
import org.jline.terminal.Terminal;
import org.jline.terminal.TerminalBuilder;
import org.jline.utils.AttributedStringBuilder;
import org.jline.utils.AttributedStyle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class Pcc {
  private static final Logger logger = LoggerFactory.getLogger(Pcc.class);

  static final int EXIT_USAGE = 64;
  static final int EXIT_COMPILE_ERROR = 65;
  static final int EXIT_NO_INPUT = 66;
  static final int EXIT_INTERNAL_ERROR = 70;

  private static final String USAGE =
      "Usage: pcc [--fast|--precise] [-o output.c] [script.py]";

  private static final Errors errors = new Errors();

  public static void main(String[] args) throws IOException {
    CompilerOptions options = CompilerOptions.load();
    String script = null;
    String output = null;

    for (int i = 0; i < args.length; i++) {
      switch (args[i]) {
      case "--fast":
        options = options.withBackend(Backend.FAST);
        break;
      case "--precise":
        options = options.withBackend(Backend.PRECISE);
        break;
      case "-o":
        if (i + 1 >= args.length)
          usage();
        output = args[++i];
        break;
      default:
        if (args[i].startsWith("-") || script != null)
          usage();
        script = args[i];
      }
    }
    logger.debug("Options: {}", options);

    if (script != null) {
      System.exit(compileFile(options, script, output));
    } else {
      runPrompt(options);
    }
  }

  private static void usage() {
    System.err.println(USAGE);
    System.exit(EXIT_USAGE);
  }

  static int compileFile(CompilerOptions options, String path, String output) {
    String source;
    try {
      source = Files.readString(Paths.get(path), StandardCharsets.UTF_8);
    } catch (IOException e) {
      System.err.println(String.format("Could not read '%s': %s", path, e.getMessage()));
      return EXIT_NO_INPUT;
    }
    Compiler compiler = new Compiler(options.withSourceName(path));
    String code;
    try {
      code = compiler.compile(source);
    } catch (CompileError error) {
      errors.report(path, error);
      return EXIT_COMPILE_ERROR;
    } catch (CodegenError error) {
      errors.internal(error);
      return EXIT_INTERNAL_ERROR;
    }

    if (output == null) {
      System.out.print(code);
      return 0;
    }
    try {
      Path target = Paths.get(output);
      Files.writeString(target, code, StandardCharsets.UTF_8);
      logger.debug("Wrote {}", target.toAbsolutePath());
    } catch (IOException e) {
      System.err.println(String.format("Could not write '%s': %s", output, e.getMessage()));
      return EXIT_INTERNAL_ERROR;
    }
    return 0;
  }

  // Every accepted entry is appended to the session program, and the C code
  // of the whole session is printed. Entries that fail to compile are
  // reported and dropped.
  private static void runPrompt(CompilerOptions initialOptions) throws IOException {
    Terminal terminal = TerminalBuilder.builder().build();
    showBannerAndHelp(terminal);
    // keeps diagnostics and output in order on the terminal
    System.setErr(System.out);

    ReplSession session = new ReplSession(initialOptions);
    LineReader reader = createReplReader(terminal);
    while (true) {
      try {
        String line = reader.readLine(">>> ");
        if (line == null || line.trim().equals("quit"))
          break;
        if (line.trim().isEmpty())
          continue;

        if (line.trim().startsWith(":")) {
          terminal.writer().println(session.command(line.trim()));
          continue;
        }

        // blocks continue until an empty line
        StringBuilder entry = new StringBuilder(line).append("\n");
        if (line.trim().endsWith(":")) {
          while (true) {
            String next = reader.readLine("... ");
            if (next == null || next.trim().isEmpty())
              break;
            entry.append(next).append("\n");
          }
        }
        terminal.writer().print(session.submit(entry.toString()));
        terminal.writer().flush();

      } catch (UserInterruptException e) {
        break;
      } catch (EndOfFileException e) {
        break;
      }
    }
  }

  private static void showBannerAndHelp(Terminal terminal) {
    String logo = new AttributedStringBuilder()
                      .style(AttributedStyle.DEFAULT.foreground(AttributedStyle.YELLOW))
                      .style(AttributedStyle.BOLD)
                      .append("pcc: Python subset to C compiler")
                      .style(AttributedStyle.DEFAULT)
                      .toAnsi();
    terminal.writer().println(logo);

    terminal.writer().println("- Type \"quit\" to quit. (or use «ctrl-d»)");
    terminal.writer().println("- End a block (a line ending in ':') with an empty line");
    terminal.writer().println("- :fast / :precise switch the backend, :ir shows the IR,");
    terminal.writer().println("  :reset starts over");
    terminal.writer().println("- Use «tab» for word completion");
    terminal.writer().println();

    terminal.writer().flush();
  }

  private static LineReader createReplReader(Terminal terminal) {
    List<String> builtins = new ArrayList<>();
    for (Builtin builtin : Builtin.values())
      builtins.add(builtin.name);

    // provide completions (triggered via TAB) for all keywords
    Completer completer = new AggregateCompleter(
        new StringsCompleter("quit", ":fast", ":precise", ":ir", ":reset"),
        new StringsCompleter(builtins), new StringsCompleter("range"),
        new StringsCompleter(Lexer.keywords.keySet())
    );

    DefaultParser parser = new DefaultParser();

    return LineReaderBuilder.builder()
        .terminal(terminal)
        .parser(parser)
        .completer(completer)
        .build();
  }

  // State of an interactive session, kept apart from the terminal so it can
  // be driven by tests.
  static class ReplSession {
    private final StringBuilder program = new StringBuilder();
    private CompilerOptions options;

    ReplSession(CompilerOptions options) {
      this.options = options.withSourceName("<repl>");
    }

    Backend backend() { return options.backend; }

    String program() { return program.toString(); }

    String command(String command) {
      switch (command) {
      case ":fast":
        options = options.withBackend(Backend.FAST);
        return "backend: fast";
      case ":precise":
        options = options.withBackend(Backend.PRECISE);
        return "backend: precise";
      case ":reset":
        program.setLength(0);
        logger.debug("Session reset");
        return "session cleared";
      case ":ir":
        try {
          return new AstPrinter().print(new Compiler(options).parse(program()));
        } catch (CompileError error) {
          return error.toString();
        }
      default:
        return String.format("Unknown command: %s", command);
      }
    }

    // returns the C code of the session including `entry`, or the
    // diagnostic that rejected it
    String submit(String entry) {
      String candidate = program + entry;
      try {
        String code = new Compiler(options).compile(candidate);
        program.append(entry);
        return code;
      } catch (CompileError error) {
        return error.toString() + "\n";
      } catch (CodegenError error) {
        return String.format("Internal Error: %s\n", error.getMessage());
      }
    }
  }
}
