package argumentation.enumerate;

import argumentation.semantics.Semantics;
import argumentation.util.Timing;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Time budget shared by every worker of one enumeration run. Exactly one caller observes the
 * timeout; the others see {@link #aborted()} and stop quietly.
 */
final class BudgetGuard {
  private static final Logger LOG = LoggerFactory.getLogger(ExtensionEnumerator.class);

  private final Semantics semantics;
  private final Timing timing;
  private final AtomicBoolean aborted = new AtomicBoolean();

  BudgetGuard(Semantics semantics, Timing timing) {
    this.semantics = semantics;
    this.timing = timing;
  }

  boolean aborted() {
    return aborted.get();
  }

  /**
   * Returns {@code true} when the run was already aborted by another caller. The first caller to
   * find the budget exhausted logs once and throws.
   */
  boolean check(long examined) {
    if (aborted.get()) {
      return true;
    }
    if (!timing.overBudget()) {
      return false;
    }
    if (!aborted.compareAndSet(false, true)) {
      return true;
    }
    LOG.warn(
        "Aborting {} enumeration after {} ms ({} subsets examined)",
        semantics,
        timing.elapsedMillis(),
        examined);
    throw new EnumerationTimeoutException(semantics, timing.budgetMs(), examined);
  }
}
