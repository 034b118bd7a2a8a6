package argumentation.enumerate;

import argumentation.model.ArgumentationFramework;
import argumentation.model.Extension;
import argumentation.semantics.ExtensionVerifier;
import argumentation.semantics.Semantics;
import argumentation.util.BitsetUtils;
import argumentation.util.Timing;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;
import java.util.stream.LongStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Exhaustive enumeration of the extensions of an argumentation framework.
 *
 * <p>Implementation details:
 *
 * <ul>
 *   <li>Every subset of the sorted argument universe is encoded as a {@code long} mask.
 *   <li>Each mask is checked by the verifier of the requested semantics; no pruning.
 *   <li>Parallel processing is available through a ForkJoinPool and yields the same set.
 *   <li>A time budget aborts the run with {@link EnumerationTimeoutException}.
 * </ul>
 */
public final class ExtensionEnumerator {
  private static final Logger LOG = LoggerFactory.getLogger(ExtensionEnumerator.class);

  /** Masks processed between two budget checks. */
  private static final long BUDGET_CHECK_INTERVAL = 1L << 10;

  private ExtensionEnumerator() {}

  /** Configuration for the enumerator. */
  public static final class Config {
    boolean parallel = false;
    int parallelism = Runtime.getRuntime().availableProcessors();
    long timeBudgetMs = 0;

    public static Config sequential() {
      return new Config();
    }

    public static Config parallel() {
      Config c = new Config();
      c.parallel = true;
      return c;
    }

    public static Config parallel(int parallelism) {
      if (parallelism < 1) {
        throw new IllegalArgumentException("parallelism must be at least 1");
      }
      Config c = new Config();
      c.parallel = true;
      c.parallelism = parallelism;
      return c;
    }

    /** Aborts enumeration after {@code timeBudgetMs} milliseconds; 0 disables the budget. */
    public Config withTimeBudgetMs(long timeBudgetMs) {
      Config c = new Config();
      c.parallel = parallel;
      c.parallelism = parallelism;
      c.timeBudgetMs = Math.max(0, timeBudgetMs);
      return c;
    }

    public boolean isParallel() {
      return parallel;
    }

    public int parallelism() {
      return parallelism;
    }

    public long timeBudgetMs() {
      return timeBudgetMs;
    }

    @Override
    public String toString() {
      return parallel
          ? "parallel(" + parallelism + ", budget=" + timeBudgetMs + "ms)"
          : "sequential(budget=" + timeBudgetMs + "ms)";
    }
  }

  public static EnumerationResult enumerate(ArgumentationFramework af, Semantics semantics) {
    return enumerate(af, semantics, Config.sequential());
  }

  public static EnumerationResult enumerate(
      ArgumentationFramework af, Semantics semantics, Config config) {
    Objects.requireNonNull(af, "af");
    Objects.requireNonNull(semantics, "semantics");
    Objects.requireNonNull(config, "config");

    List<String> universe = af.sortedArguments();
    long total = BitsetUtils.subsetCount(universe.size());
    ExtensionVerifier verifier = semantics.verifier();
    Timing timing = Timing.withBudget(config.timeBudgetMs);
    BudgetGuard guard = new BudgetGuard(semantics, timing);
    AtomicLong examined = new AtomicLong();

    LOG.debug(
        "Enumerating {} extensions over {} subsets ({})", semantics, total, config);

    List<Extension> found =
        config.parallel
            ? enumerateParallel(af, verifier, universe, total, guard, examined, config)
            : enumerateSequential(af, verifier, universe, total, guard, examined);

    Set<Extension> extensions = new TreeSet<>(found);
    long elapsed = timing.elapsedMillis();
    LOG.debug(
        "Found {} {} extension(s) in {} ms ({} subsets)",
        extensions.size(),
        semantics,
        elapsed,
        examined.get());
    return new EnumerationResult(semantics, extensions, examined.get(), elapsed);
  }

  private static List<Extension> enumerateSequential(
      ArgumentationFramework af,
      ExtensionVerifier verifier,
      List<String> universe,
      long total,
      BudgetGuard guard,
      AtomicLong examined) {
    List<Extension> found = new ArrayList<>();
    for (long mask = 0; mask < total; mask++) {
      if ((mask & (BUDGET_CHECK_INTERVAL - 1)) == 0) {
        guard.check(mask);
      }
      Set<String> candidate = BitsetUtils.select(mask, universe);
      if (verifier.verify(af, candidate)) {
        found.add(Extension.of(candidate));
      }
    }
    examined.set(total);
    return found;
  }

  private static List<Extension> enumerateParallel(
      ArgumentationFramework af,
      ExtensionVerifier verifier,
      List<String> universe,
      long total,
      BudgetGuard guard,
      AtomicLong examined,
      Config config) {
    ForkJoinPool pool =
        config.parallelism == ForkJoinPool.getCommonPoolParallelism()
            ? ForkJoinPool.commonPool()
            : new ForkJoinPool(config.parallelism);
    try {
      return pool.submit(
              () ->
                  LongStream.range(0, total)
                      .parallel()
                      .filter(
                          mask -> {
                            if (guard.aborted()) {
                              return false;
                            }
                            long seen = examined.incrementAndGet();
                            if ((mask & (BUDGET_CHECK_INTERVAL - 1)) == 0 && guard.check(seen)) {
                              return false;
                            }
                            return verifier.verify(af, BitsetUtils.select(mask, universe));
                          })
                      .mapToObj(mask -> Extension.of(BitsetUtils.select(mask, universe)))
                      .collect(Collectors.toList()))
          .join();
    } finally {
      if (pool != ForkJoinPool.commonPool()) {
        pool.shutdown();
      }
    }
  }
}
