package argumentation.solver;

import argumentation.acceptance.AcceptanceEngine;
import argumentation.enumerate.ExtensionCache;
import argumentation.enumerate.ExtensionProvider;
import argumentation.model.ArgumentationFramework;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Answers one of the six reasoning problems for a framework and a candidate set.
 *
 * <p>A candidate mentioning an argument the framework does not declare is answered with {@code
 * false} for every problem. An unrecognised problem code is a caller error and raises {@link
 * UnknownProblemException} instead.
 */
public final class Solver {
  private static final Logger LOG = LoggerFactory.getLogger(Solver.class);

  private final AcceptanceEngine acceptance;

  public Solver() {
    this(new AcceptanceEngine());
  }

  public Solver(AcceptanceEngine acceptance) {
    this.acceptance = Objects.requireNonNull(acceptance, "acceptance");
  }

  /** Wires the enumerator configuration and the optional extension cache. */
  public static Solver create(SolverOptions options) {
    SolverOptions effective = SolverOptions.normalize(options);
    ExtensionProvider provider = ExtensionProvider.enumerating(effective.enumeratorConfig());
    if (effective.cacheExtensions()) {
      provider = new ExtensionCache(provider);
    }
    return new Solver(new AcceptanceEngine(provider));
  }

  public boolean solve(String problemCode, ArgumentationFramework af, Set<String> candidate) {
    return solve(ProblemCode.parse(problemCode), af, candidate);
  }

  public boolean solve(ProblemCode problem, ArgumentationFramework af, Set<String> candidate) {
    Objects.requireNonNull(problem, "problem");
    Objects.requireNonNull(af, "af");
    Objects.requireNonNull(candidate, "candidate");

    if (!af.containsAll(candidate)) {
      LOG.debug("{}: candidate {} is not part of the framework", problem, candidate);
      return false;
    }

    boolean answer =
        switch (problem.task()) {
          case VERIFY -> problem.semantics().isExtension(af, candidate);
          case CREDULOUS -> acceptance.credulouslyAccepted(
              af, problem.semantics(), singleArgument(problem, candidate));
          case SKEPTICAL -> acceptance.skepticallyAccepted(
              af, problem.semantics(), singleArgument(problem, candidate));
        };
    LOG.debug("{} {} -> {}", problem, candidate, answer);
    return answer;
  }

  private static String singleArgument(ProblemCode problem, Set<String> candidate) {
    if (candidate.size() != 1) {
      throw new IllegalArgumentException(
          problem + " expects exactly one argument, got " + candidate.size());
    }
    return candidate.iterator().next();
  }
}
