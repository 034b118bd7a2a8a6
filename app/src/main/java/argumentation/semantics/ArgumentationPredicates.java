package argumentation.semantics;

import argumentation.model.ArgumentationFramework;
import java.util.Objects;
import java.util.Set;

/** Set-level predicates shared by the semantics verifiers. */
public final class ArgumentationPredicates {
  private ArgumentationPredicates() {}

  /** True unless some member of {@code candidate} attacks a member (itself included). */
  public static boolean conflictFree(ArgumentationFramework af, Set<String> candidate) {
    Objects.requireNonNull(af, "af");
    Objects.requireNonNull(candidate, "candidate");
    for (String argument : candidate) {
      for (String attacked : af.attacksOf(argument)) {
        if (candidate.contains(attacked)) {
          return false;
        }
      }
    }
    return true;
  }

  /**
   * True if every attacker of {@code argument} is itself attacked by some member of {@code
   * candidate}. An unattacked argument is defended by any set, the empty set included.
   */
  public static boolean isDefended(
      ArgumentationFramework af, Set<String> candidate, String argument) {
    Objects.requireNonNull(af, "af");
    Objects.requireNonNull(candidate, "candidate");
    for (String attacker : af.attackersOf(argument)) {
      if (!attacksAny(af, candidate, attacker)) {
        return false;
      }
    }
    return true;
  }

  /** The empty set is admissible; otherwise conflict-free with every member defended. */
  public static boolean isAdmissible(ArgumentationFramework af, Set<String> candidate) {
    if (candidate.isEmpty()) {
      return true;
    }
    if (!conflictFree(af, candidate)) {
      return false;
    }
    for (String member : candidate) {
      if (!isDefended(af, candidate, member)) {
        return false;
      }
    }
    return true;
  }

  /** True if some member of {@code candidate} attacks {@code target}. */
  public static boolean attacksAny(
      ArgumentationFramework af, Set<String> candidate, String target) {
    for (String attacker : af.attackersOf(target)) {
      if (candidate.contains(attacker)) {
        return true;
      }
    }
    return false;
  }
}
