package argumentation.cli;

import argumentation.enumerate.EnumerationTimeoutException;
import java.io.IOException;
import java.io.PrintStream;
import java.util.Arrays;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Command-line entrypoint of the abstract argumentation solver.
 *
 * <p>Usage:
 *
 * <ul>
 *   <li>{@code Main -f af.apx -p DC-CO -a a}: prints YES or NO
 *   <li>{@code Main extensions -f af.apx -s stable}: prints every stable extension
 * </ul>
 */
public final class Main {
  private static final Logger LOG = LoggerFactory.getLogger(Main.class);

  static final int EXIT_OK = 0;
  static final int EXIT_ERROR = 1;
  static final int EXIT_TIMEOUT = 2;

  private static final String USAGE =
      String.join(
          System.lineSeparator(),
          "Abstract Argumentation Solver - solves VE-CO, DC-CO, DS-CO, VE-ST, DC-ST and DS-ST"
              + " problems.",
          "",
          "Usage:",
          "  solve -f FILE -p PROBLEM [-a ARG1,ARG2,...] [--json] [--parallel] [--cache]"
              + " [--time-budget-ms MS]",
          "  extensions -f FILE -s complete|stable [--json] [--parallel] [--time-budget-ms MS]",
          "  help",
          "",
          "  -f, --file        the .apx file describing the argumentation framework",
          "  -p, --problem     VE-CO, DC-CO, DS-CO, VE-ST, DC-ST or DS-ST",
          "  -a, --arguments   the query set E (VE-XX) or the single argument (DC-XX, DS-XX);",
          "                    omit the value to test the empty set",
          "  -s, --semantics   complete or stable",
          "",
          "The 'solve' command name may be omitted.");

  private Main() {}

  public static void main(String[] args) {
    System.exit(run(args, System.out, System.err));
  }

  static int run(String[] args, PrintStream out, PrintStream err) {
    String[] effectiveArgs = args == null ? new String[0] : args;
    String command = effectiveArgs.length > 0 ? effectiveArgs[0].toLowerCase(Locale.ROOT) : "";
    try {
      return switch (command) {
        case "help", "--help", "-h" -> {
          out.println(USAGE);
          yield EXIT_OK;
        }
        case "extensions" -> new ExtensionsCommand(out).execute(stripCommand(effectiveArgs));
        case "solve" -> new SolveCommand(out).execute(stripCommand(effectiveArgs));
        default -> new SolveCommand(out).execute(effectiveArgs);
      };
    } catch (EnumerationTimeoutException ex) {
      LOG.debug("Gave up after {} subsets", ex.subsetsExamined());
      err.println("Error: " + ex.getMessage());
      return EXIT_TIMEOUT;
    } catch (IllegalArgumentException | IOException ex) {
      LOG.debug("Command failed", ex);
      err.println("Error: " + ex.getMessage());
      return EXIT_ERROR;
    }
  }

  private static String[] stripCommand(String[] args) {
    return Arrays.copyOfRange(args, 1, args.length);
  }
}
