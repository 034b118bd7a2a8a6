package argumentation.util;

/** Lightweight timer with an optional millisecond budget. */
public final class Timing {
  private final long startedAt;
  private final long budgetMs;

  private Timing(long startedAt, long budgetMs) {
    this.startedAt = startedAt;
    this.budgetMs = budgetMs;
  }

  public static Timing start() {
    return new Timing(System.nanoTime(), 0);
  }

  /** Starts a timer that reports {@link #overBudget()} once {@code budgetMs} elapsed; 0 = never. */
  public static Timing withBudget(long budgetMs) {
    return new Timing(System.nanoTime(), Math.max(0, budgetMs));
  }

  public long elapsedMillis() {
    return (System.nanoTime() - startedAt) / 1_000_000L;
  }

  public long budgetMs() {
    return budgetMs;
  }

  public boolean overBudget() {
    return budgetMs > 0 && elapsedMillis() >= budgetMs;
  }
}
