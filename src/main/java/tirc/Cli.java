package tirc;

import static org.jooq.lambda.Seq.seq;

import com.beust.jcommander.JCommander;
import com.beust.jcommander.Parameter;
import com.beust.jcommander.ParameterException;
import com.google.common.base.Joiner;
import com.google.common.io.ByteStreams;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.AccessDeniedException;
import java.nio.file.FileSystem;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.event.Level;
import org.slf4j.impl.SimpleLogger;
import tirc.ast.Program;
import tirc.tir.TirProgram;
import tirc.token.Token;

/** Command line driver. Reads one source file and runs the pipeline up to the requested stage. */
public class Cli {

  /** Pipeline stages the driver can stop after, in pipeline order. */
  enum Mode {
    ECHO("--echo", "write file's content to stdout"),
    LEXTEST("--lextest", "run lexical analysis on file's content and print tokens to stdout"),
    PARSETEST("--parsetest", "run syntactical analysis on file's content"),
    PRINT_AST("--print-ast", "pretty-print abstract syntax tree to stdout"),
    PRINT_TV(
        "--print-tv", "lower the file and print the translation vector before block construction"),
    PRINT_TIR("--print-tir", "lower the file and print the resulting three-address code");

    final String flag;
    final String description;

    Mode(String flag, String description) {
      this.flag = flag;
      this.description = description;
    }
  }

  static final String usage = buildUsage();

  private final PrintStream out;
  private final PrintStream err;
  private final FileSystem fileSystem;
  private final Function<String, String> environment;

  // replaced in tests to check when verification runs
  Consumer<TirProgram> verifier = Compiler::verify;

  Cli(OutputStream out, OutputStream err, FileSystem fileSystem) {
    this(out, err, fileSystem, System::getenv);
  }

  Cli(
      OutputStream out,
      OutputStream err,
      FileSystem fileSystem,
      Function<String, String> environment) {
    this.out = new PrintStream(out);
    this.err = new PrintStream(err);
    this.fileSystem = fileSystem;
    this.environment = environment;
  }

  private static String buildUsage() {
    List<String> lines = new ArrayList<>();
    lines.add(
        "Usage: tirc ["
            + seq(Mode.values()).map(m -> m.flag).toString("|")
            + "] [--help] [--verbosity n] file");
    lines.add("");
    for (Mode mode : Mode.values()) {
      lines.add(String.format("  %-15s %s", mode.flag, mode.description));
    }
    lines.add(String.format("  %-15s %s", "--verbosity|-v", "Crank this up for more debug output"));
    lines.add(String.format("  %-15s %s", "--help", "display this help and exit"));
    lines.add("");
    lines.add("  If no flag is given, " + Mode.PRINT_TIR.flag + " is assumed.");
    lines.add("");
    lines.add("Environment variables:");
    lines.addAll(EnvVar.getAllEnvVarDescriptions());
    return Joiner.on(System.lineSeparator()).join(lines);
  }

  int run(String... args) {
    Parameters params = Parameters.parse(args);
    setLogLevel(params.verbosity);
    if (!params.valid()) {
      err.println("Called as: " + String.join(" ", args));
      err.println(usage);
      return 1;
    }
    if (params.help) {
      out.println(usage);
      return 0;
    }
    Path path = fileSystem.getPath(params.file());
    try (InputStream in = Files.newInputStream(path)) {
      runMode(params.mode(), in);
      return 0;
    } catch (TircError e) {
      err.println("error: " + describe(e, path));
    } catch (NoSuchFileException e) {
      err.println("error: file '" + path + "' doesn't exist");
    } catch (AccessDeniedException e) {
      err.println("error: access to file '" + path + "' was denied");
    } catch (Throwable t) {
      // anything else is a bug, the stack trace is more helpful than a message
      t.printStackTrace(err);
    }
    return 1;
  }

  private void runMode(Mode mode, InputStream in) throws IOException {
    switch (mode) {
      case ECHO:
        ByteStreams.copy(in, out);
        return;
      case LEXTEST:
        seq(Compiler.lex(in)).map(Token::toString).forEach(out::println);
        return;
      case PARSETEST:
        Compiler.lexAndParse(in);
        return;
      case PRINT_AST:
        emit(Compiler.prettyPrint(Compiler.lexAndParse(in)));
        return;
      case PRINT_TV:
        emit(Compiler.translate(Compiler.lexAndParse(in)).toString());
        return;
      case PRINT_TIR:
        emit(Compiler.print(lowerAndVerify(Compiler.lexAndParse(in))));
        return;
      default:
        throw new AssertionError("unhandled mode " + mode);
    }
  }

  private TirProgram lowerAndVerify(Program ast) {
    TirProgram program = Compiler.lower(ast);
    if (EnvVar.TIRC_VERIFY.isSetToZero(environment)) {
      // not a static field, the log level is only known once run() was called
      Logger logger = LoggerFactory.getLogger("Cli");
      logger.info("{} is 0, skipping verification", EnvVar.TIRC_VERIFY);
    } else {
      verifier.accept(program);
    }
    return program;
  }

  /** The error message, followed by an excerpt of the source if it can still be read. */
  private static String describe(TircError e, Path path) {
    try {
      return e.getSourceReferencingMessage(Files.readAllLines(path, StandardCharsets.US_ASCII));
    } catch (IOException io) {
      return e.getMessage();
    }
  }

  private static void setLogLevel(int verbosity) {
    int index = Math.max(0, Math.min(Level.values().length - 1, verbosity));
    // only has an effect if no logger was created before
    System.setProperty(SimpleLogger.DEFAULT_LOG_LEVEL_KEY, Level.values()[index].toString());
  }

  /** Writes to stdout, or to the file named by {@link EnvVar#TIRC_OUTPUTFILENAME}. */
  private void emit(CharSequence text) throws IOException {
    if (EnvVar.TIRC_OUTPUTFILENAME.isAvailable(environment)) {
      Path target = fileSystem.getPath(EnvVar.TIRC_OUTPUTFILENAME.value(environment));
      Files.write(target, text.toString().getBytes(StandardCharsets.UTF_8));
    } else {
      out.print(text);
    }
  }

  private static class Parameters {
    @Parameter(names = "--echo")
    boolean echo;

    @Parameter(names = "--lextest")
    boolean lextest;

    @Parameter(names = "--parsetest")
    boolean parsetest;

    @Parameter(names = "--print-ast")
    boolean printAst;

    @Parameter(names = "--print-tv")
    boolean printTv;

    @Parameter(names = "--print-tir")
    boolean printTir;

    @Parameter(names = {"--verbosity", "-v"})
    int verbosity = 0;

    @Parameter(names = "--help", help = true)
    boolean help;

    /** Everything that is not an option; exactly one file is expected. */
    @Parameter private List<String> files = new ArrayList<>();

    // set if JCommander rejected the arguments
    private boolean unparseable;

    private Parameters() {}

    static Parameters parse(String... args) {
      Parameters params = new Parameters();
      try {
        JCommander.newBuilder().addObject(params).build().parse(args);
      } catch (ParameterException e) {
        params.unparseable = true;
      }
      return params;
    }

    private List<Mode> selectedModes() {
      // in Mode order
      boolean[] flags = {echo, lextest, parsetest, printAst, printTv, printTir};
      List<Mode> modes = new ArrayList<>();
      for (Mode mode : Mode.values()) {
        if (flags[mode.ordinal()]) {
          modes.add(mode);
        }
      }
      return modes;
    }

    boolean valid() {
      if (unparseable) {
        return false;
      }
      return help || (selectedModes().size() <= 1 && files.size() == 1);
    }

    Mode mode() {
      List<Mode> modes = selectedModes();
      return modes.isEmpty() ? Mode.PRINT_TIR : modes.get(0);
    }

    String file() {
      return files.get(0);
    }
  }
}
