package argumentation.cli;

import argumentation.enumerate.EnumerationResult;
import argumentation.enumerate.ExtensionEnumerator;
import argumentation.io.ApxParser;
import argumentation.model.ArgumentationFramework;
import argumentation.model.Extension;
import java.io.IOException;
import java.io.PrintStream;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Lists every extension of a framework under one semantics. */
final class ExtensionsCommand {
  private static final Logger LOG = LoggerFactory.getLogger(ExtensionsCommand.class);

  private final PrintStream out;

  ExtensionsCommand(PrintStream out) {
    this.out = out;
  }

  int execute(String[] args) throws IOException {
    CliOptions.Builder builder = CliOptions.builder();
    CliParsers.applyOptions(args, optionSpecs(), builder);
    CliOptions options = builder.buildForExtensions();

    ArgumentationFramework af = ApxParser.parse(options.file());
    EnumerationResult result =
        ExtensionEnumerator.enumerate(
            af, options.semantics(), options.solverOptions().enumeratorConfig());
    LOG.info(
        "{} {} extension(s) of {} in {} ms",
        result.size(),
        result.semantics(),
        options.file(),
        result.elapsedMillis());

    if (options.json()) {
      out.println(new JsonReportBuilder().extensionsReport(options, af, result));
    } else {
      for (Extension extension : result.extensions()) {
        out.println(extension);
      }
    }
    return 0;
  }

  private Map<String, CliParsers.OptionSpec<CliOptions.Builder>> optionSpecs() {
    Map<String, CliParsers.OptionSpec<CliOptions.Builder>> specs = new LinkedHashMap<>();
    CliParsers.OptionSpec<CliOptions.Builder> file =
        CliParsers.OptionSpec.withValue((b, raw) -> b.file(raw));
    CliParsers.OptionSpec<CliOptions.Builder> semantics =
        CliParsers.OptionSpec.withValue((b, raw) -> b.semantics(raw));
    specs.put("-f", file);
    specs.put("--file", file);
    specs.put("-s", semantics);
    specs.put("--semantics", semantics);
    specs.put("--json", CliParsers.OptionSpec.flag(b -> b.json(true)));
    specs.put("--parallel", CliParsers.OptionSpec.flag(b -> b.parallel(true)));
    specs.put(
        "--time-budget-ms",
        CliParsers.OptionSpec.withValue(
            (b, raw) -> b.timeBudgetMs(CliParsers.parseLong(raw, 0, "--time-budget-ms"))));
    return specs;
  }
}
