package argumentation.semantics;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import argumentation.model.ArgumentationFramework;
import argumentation.testing.Frameworks;
import argumentation.util.BitsetUtils;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;

final class ArgumentationPredicatesTest {

  @Test
  void emptySetIsAlwaysAdmissible() {
    for (ArgumentationFramework af :
        List.of(
            ArgumentationFramework.empty(),
            Frameworks.selfAttack(),
            Frameworks.oddCycle(),
            Frameworks.floatingDefeat())) {
      assertTrue(ArgumentationPredicates.isAdmissible(af, Set.of()), af.toString());
    }
  }

  @Test
  void conflictFreeMatchesPairwiseAttackCheck() {
    ArgumentationFramework af = Frameworks.floatingDefeat();
    List<String> universe = af.sortedArguments();

    for (long mask = 0; mask < BitsetUtils.subsetCount(universe.size()); mask++) {
      Set<String> candidate = BitsetUtils.select(mask, universe);
      boolean expected = true;
      for (String x : candidate) {
        for (String y : candidate) {
          if (af.attacksOf(x).contains(y)) {
            expected = false;
          }
        }
      }
      assertEquals(
          expected, ArgumentationPredicates.conflictFree(af, candidate), candidate.toString());
    }
  }

  @Test
  void selfAttackingArgumentIsNotConflictFree() {
    assertFalse(ArgumentationPredicates.conflictFree(Frameworks.selfAttack(), Set.of("a")));
  }

  @Test
  void unattackedArgumentIsDefendedByEmptySet() {
    ArgumentationFramework af = Frameworks.oneWayAttack();

    assertTrue(ArgumentationPredicates.isDefended(af, Set.of(), "a"));
    assertFalse(ArgumentationPredicates.isDefended(af, Set.of(), "b"));
  }

  @Test
  void defenceRequiresCounterAttackOnEveryAttacker() {
    ArgumentationFramework af = Frameworks.floatingDefeat();

    assertTrue(ArgumentationPredicates.isDefended(af, Set.of("a"), "d"));
    assertTrue(ArgumentationPredicates.isDefended(af, Set.of("a"), "a"));
    assertFalse(ArgumentationPredicates.isDefended(af, Set.of("a"), "c"));
    assertFalse(ArgumentationPredicates.isDefended(af, Set.of("d"), "d"));
  }

  @Test
  void admissibleSetsDefendThemselves() {
    ArgumentationFramework af = Frameworks.mutualAttack();

    assertTrue(ArgumentationPredicates.isAdmissible(af, Set.of("a")));
    assertFalse(ArgumentationPredicates.isAdmissible(af, Set.of("a", "b")));
    assertFalse(ArgumentationPredicates.isAdmissible(Frameworks.oneWayAttack(), Set.of("b")));
  }
}
