package argumentation.cli;

import argumentation.io.ApxParser;
import argumentation.model.ArgumentationFramework;
import argumentation.solver.Solver;
import argumentation.util.Timing;
import java.io.IOException;
import java.io.PrintStream;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Handles the primary {@code solve} command: prints YES or NO for one reasoning problem. */
final class SolveCommand {
  private static final Logger LOG = LoggerFactory.getLogger(SolveCommand.class);

  private final PrintStream out;

  SolveCommand(PrintStream out) {
    this.out = out;
  }

  int execute(String[] args) throws IOException {
    CliOptions.Builder builder = CliOptions.builder();
    CliParsers.applyOptions(args, optionSpecs(), builder);
    CliOptions options = builder.buildForSolve();

    ArgumentationFramework af = ApxParser.parse(options.file());
    Solver solver = Solver.create(options.solverOptions());

    Timing timing = Timing.start();
    boolean answer = solver.solve(options.problem(), af, options.arguments());
    long elapsed = timing.elapsedMillis();
    LOG.info(
        "{} for {} on {} ({} arguments) took {} ms",
        options.problem(),
        options.arguments(),
        options.file(),
        af.size(),
        elapsed);

    if (options.json()) {
      out.println(new JsonReportBuilder().solveReport(options, af, answer, elapsed));
    } else {
      out.println(ResultFormatter.yesNo(answer));
    }
    return 0;
  }

  private Map<String, CliParsers.OptionSpec<CliOptions.Builder>> optionSpecs() {
    Map<String, CliParsers.OptionSpec<CliOptions.Builder>> specs = new LinkedHashMap<>();
    CliParsers.OptionSpec<CliOptions.Builder> file =
        CliParsers.OptionSpec.withValue((b, raw) -> b.file(raw));
    CliParsers.OptionSpec<CliOptions.Builder> problem =
        CliParsers.OptionSpec.withValue((b, raw) -> b.problem(raw));
    CliParsers.OptionSpec<CliOptions.Builder> arguments =
        CliParsers.OptionSpec.optionalValue((b, raw) -> b.arguments(raw));
    specs.put("-f", file);
    specs.put("--file", file);
    specs.put("-p", problem);
    specs.put("--problem", problem);
    specs.put("-a", arguments);
    specs.put("--arguments", arguments);
    specs.put("--json", CliParsers.OptionSpec.flag(b -> b.json(true)));
    specs.put("--parallel", CliParsers.OptionSpec.flag(b -> b.parallel(true)));
    specs.put("--cache", CliParsers.OptionSpec.flag(b -> b.cache(true)));
    specs.put(
        "--time-budget-ms",
        CliParsers.OptionSpec.withValue(
            (b, raw) -> b.timeBudgetMs(CliParsers.parseLong(raw, 0, "--time-budget-ms"))));
    return specs;
  }
}
