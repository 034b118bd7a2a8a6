package argumentation.solver;

import argumentation.enumerate.ExtensionEnumerator;

/** Configuration for the solver's extension enumeration. */
public record SolverOptions(
    boolean parallel, int parallelism, long timeBudgetMs, boolean cacheExtensions) {

  public static final String PARALLEL_PROPERTY = "argumentation.parallel";
  public static final String PARALLELISM_PROPERTY = "argumentation.parallelism";
  public static final String TIME_BUDGET_PROPERTY = "argumentation.timeBudgetMs";
  public static final String CACHE_PROPERTY = "argumentation.cache";

  public static SolverOptions defaults() {
    return new SolverOptions(false, Runtime.getRuntime().availableProcessors(), 0, false);
  }

  /**
   * Defaults overridden by the system properties {@code argumentation.parallel}, {@code
   * argumentation.parallelism}, {@code argumentation.timeBudgetMs} and {@code argumentation.cache}.
   */
  public static SolverOptions fromSystemProperties() {
    SolverOptions defaults = defaults();
    String parallel = System.getProperty(PARALLEL_PROPERTY);
    String cache = System.getProperty(CACHE_PROPERTY);
    return normalize(
        new SolverOptions(
            parallel != null ? Boolean.parseBoolean(parallel) : defaults.parallel(),
            Integer.getInteger(PARALLELISM_PROPERTY, defaults.parallelism()),
            Long.getLong(TIME_BUDGET_PROPERTY, defaults.timeBudgetMs()),
            cache != null ? Boolean.parseBoolean(cache) : defaults.cacheExtensions()));
  }

  public static SolverOptions normalize(SolverOptions options) {
    if (options == null) {
      return defaults();
    }
    int parallelism =
        options.parallelism() > 0 ? options.parallelism() : defaults().parallelism();
    long timeBudgetMs = Math.max(0, options.timeBudgetMs());
    return new SolverOptions(
        options.parallel(), parallelism, timeBudgetMs, options.cacheExtensions());
  }

  public SolverOptions withParallel(boolean parallel) {
    return new SolverOptions(parallel, parallelism, timeBudgetMs, cacheExtensions);
  }

  public SolverOptions withTimeBudgetMs(long timeBudgetMs) {
    return new SolverOptions(parallel, parallelism, timeBudgetMs, cacheExtensions);
  }

  public SolverOptions withCacheExtensions(boolean cacheExtensions) {
    return new SolverOptions(parallel, parallelism, timeBudgetMs, cacheExtensions);
  }

  public ExtensionEnumerator.Config enumeratorConfig() {
    ExtensionEnumerator.Config config =
        parallel
            ? ExtensionEnumerator.Config.parallel(Math.max(1, parallelism))
            : ExtensionEnumerator.Config.sequential();
    return config.withTimeBudgetMs(timeBudgetMs);
  }
}
