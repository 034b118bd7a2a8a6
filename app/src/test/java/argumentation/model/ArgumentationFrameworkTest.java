package argumentation.model;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.Test;

final class ArgumentationFrameworkTest {

  @Test
  void indexesAttacksInBothDirections() {
    ArgumentationFramework af =
        ArgumentationFramework.builder()
            .addArguments("b", "a", "c")
            .addAttack("a", "b")
            .addAttack("c", "b")
            .addAttack("a", "b")
            .build();

    assertEquals(Set.of("b"), af.attacksOf("a"));
    assertEquals(Set.of("a", "c"), af.attackersOf("b"));
    assertEquals(Set.of(), af.attackersOf("a"));
    assertEquals(2, af.attackCount(), "Duplicate attacks collapse");
    assertEquals(List.of("b", "a", "c"), List.copyOf(af.arguments()));
    assertEquals(List.of("a", "b", "c"), af.sortedArguments());
  }

  @Test
  void allowsSelfAttack() {
    ArgumentationFramework af =
        ArgumentationFramework.builder().addArgument("a").addAttack("a", "a").build();

    assertTrue(af.attacks("a", "a"));
    assertEquals(Set.of("a"), af.attackersOf("a"));
  }

  @Test
  void rejectsAttacksOnUndeclaredArguments() {
    ArgumentationFramework.Builder builder = ArgumentationFramework.builder().addArgument("a");

    assertThrows(IllegalArgumentException.class, () -> builder.addAttack("a", "ghost"));
    assertThrows(IllegalArgumentException.class, () -> builder.addAttack("ghost", "a"));

    Map<String, Set<String>> dangling = new LinkedHashMap<>();
    dangling.put("a", Set.of("ghost"));
    assertThrows(IllegalArgumentException.class, () -> ArgumentationFramework.of(dangling));
  }

  @Test
  void unknownArgumentLookupFailsWithDescriptiveError() {
    ArgumentationFramework af = ArgumentationFramework.builder().addArgument("a").build();

    IllegalArgumentException ex =
        assertThrows(IllegalArgumentException.class, () -> af.attacksOf("zz"));
    assertTrue(ex.getMessage().contains("zz"));
  }

  @Test
  void buildsFromMapIndependentOfDeclarationOrder() {
    Map<String, Set<String>> first = new LinkedHashMap<>();
    first.put("a", Set.of("b"));
    first.put("b", Set.of());
    Map<String, Set<String>> second = new LinkedHashMap<>();
    second.put("b", Set.of());
    second.put("a", Set.of("b"));

    ArgumentationFramework left = ArgumentationFramework.of(first);
    ArgumentationFramework right = ArgumentationFramework.of(second);

    assertEquals(left, right);
    assertEquals(Map.of("a", Set.of("b"), "b", Set.of()), left.asMap());
    assertEquals(left.sortedArguments(), right.sortedArguments());
  }

  @Test
  void containsAllChecksMembership() {
    ArgumentationFramework af = ArgumentationFramework.builder().addArguments("a", "b").build();

    assertTrue(af.containsAll(Set.of()));
    assertTrue(af.containsAll(Set.of("a", "b")));
    assertFalse(af.containsAll(Set.of("a", "c")));
  }

  @Test
  void emptyFrameworkHasNoArguments() {
    ArgumentationFramework af = ArgumentationFramework.empty();

    assertEquals(0, af.size());
    assertTrue(af.sortedArguments().isEmpty());
  }
}
