package argumentation.solver;

import argumentation.semantics.Semantics;
import java.util.Optional;

/** The six reasoning problems: verification, credulous and skeptical decision per semantics. */
public enum ProblemCode {
  VE_CO(Task.VERIFY, Semantics.COMPLETE),
  DC_CO(Task.CREDULOUS, Semantics.COMPLETE),
  DS_CO(Task.SKEPTICAL, Semantics.COMPLETE),
  VE_ST(Task.VERIFY, Semantics.STABLE),
  DC_ST(Task.CREDULOUS, Semantics.STABLE),
  DS_ST(Task.SKEPTICAL, Semantics.STABLE);

  /** What the problem asks about the candidate. */
  public enum Task {
    /** Is the candidate set an extension? */
    VERIFY("VE"),
    /** Is the single argument in some extension? */
    CREDULOUS("DC"),
    /** Is the single argument in every extension? */
    SKEPTICAL("DS");

    private final String prefix;

    Task(String prefix) {
      this.prefix = prefix;
    }

    public String prefix() {
      return prefix;
    }
  }

  private final Task task;
  private final Semantics semantics;

  ProblemCode(Task task, Semantics semantics) {
    this.task = task;
    this.semantics = semantics;
  }

  public Task task() {
    return task;
  }

  public Semantics semantics() {
    return semantics;
  }

  /** Wire form, e.g. {@code DC-CO}. */
  public String code() {
    return task.prefix() + "-" + semantics.abbreviation();
  }

  /** True for DC-* and DS-* problems, which take exactly one argument. */
  public boolean isDecision() {
    return task != Task.VERIFY;
  }

  public static Optional<ProblemCode> lookup(String code) {
    if (code == null) {
      return Optional.empty();
    }
    for (ProblemCode problem : values()) {
      if (problem.code().equals(code)) {
        return Optional.of(problem);
      }
    }
    return Optional.empty();
  }

  public static ProblemCode parse(String code) {
    return lookup(code).orElseThrow(() -> new UnknownProblemException(code));
  }

  @Override
  public String toString() {
    return code();
  }
}
