package argumentation.enumerate;

import argumentation.semantics.Semantics;

/** Raised when extension enumeration exceeds its time budget; no partial result is returned. */
public final class EnumerationTimeoutException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  private final Semantics semantics;
  private final long budgetMs;
  private final long subsetsExamined;

  EnumerationTimeoutException(Semantics semantics, long budgetMs, long subsetsExamined) {
    super(
        "Enumeration of "
            + semantics
            + " extensions exceeded the time budget of "
            + budgetMs
            + " ms after "
            + subsetsExamined
            + " subsets");
    this.semantics = semantics;
    this.budgetMs = budgetMs;
    this.subsetsExamined = subsetsExamined;
  }

  public Semantics semantics() {
    return semantics;
  }

  public long budgetMs() {
    return budgetMs;
  }

  public long subsetsExamined() {
    return subsetsExamined;
  }
}
