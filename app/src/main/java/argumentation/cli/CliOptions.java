package argumentation.cli;

import argumentation.semantics.Semantics;
import argumentation.solver.ProblemCode;
import argumentation.solver.SolverOptions;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Set;

record CliOptions(
    Path file,
    ProblemCode problem,
    Set<String> arguments,
    Semantics semantics,
    boolean json,
    SolverOptions solverOptions) {

  CliOptions {
    Objects.requireNonNull(file, "file");
    arguments = arguments == null ? Set.of() : Set.copyOf(arguments);
    solverOptions = SolverOptions.normalize(solverOptions);
  }

  static Builder builder() {
    return new Builder();
  }

  static final class Builder {
    private Path file;
    private String problem;
    private String rawArguments;
    private String semantics;
    private boolean json;
    private SolverOptions solverOptions = SolverOptions.fromSystemProperties();

    Builder file(String file) {
      this.file = Path.of(file);
      return this;
    }

    Builder problem(String problem) {
      this.problem = problem;
      return this;
    }

    Builder arguments(String rawArguments) {
      this.rawArguments = rawArguments;
      return this;
    }

    Builder semantics(String semantics) {
      this.semantics = semantics;
      return this;
    }

    Builder json(boolean json) {
      this.json = json;
      return this;
    }

    Builder parallel(boolean parallel) {
      this.solverOptions = solverOptions.withParallel(parallel);
      return this;
    }

    Builder timeBudgetMs(long timeBudgetMs) {
      this.solverOptions = solverOptions.withTimeBudgetMs(timeBudgetMs);
      return this;
    }

    Builder cache(boolean cache) {
      this.solverOptions = solverOptions.withCacheExtensions(cache);
      return this;
    }

    /** Options of the {@code solve} command: a file, a problem code and its argument set. */
    CliOptions buildForSolve() {
      requireFile();
      if (problem == null || problem.isBlank()) {
        throw new IllegalArgumentException("Missing problem: provide -p/--problem");
      }
      ProblemCode code = ProblemCode.parse(problem.trim());
      Set<String> arguments = CliParsers.parseArgumentList(rawArguments);
      CliParsers.requireArity(code, arguments);
      return new CliOptions(file, code, arguments, code.semantics(), json, solverOptions);
    }

    /** Options of the {@code extensions} command: a file and a semantics. */
    CliOptions buildForExtensions() {
      requireFile();
      return new CliOptions(
          file, null, Set.of(), Semantics.parse(semantics), json, solverOptions);
    }

    private void requireFile() {
      if (file == null) {
        throw new IllegalArgumentException("Missing framework file: provide -f/--file");
      }
    }
  }
}
