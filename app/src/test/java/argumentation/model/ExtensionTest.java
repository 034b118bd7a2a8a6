package argumentation.model;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import org.junit.jupiter.api.Test;

final class ExtensionTest {

  @Test
  void equalityIgnoresInsertionOrderAndDuplicates() {
    Extension first = Extension.of("b", "a");
    Extension second = Extension.of(List.of("a", "b", "a"));

    assertEquals(first, second);
    assertEquals(first.hashCode(), second.hashCode());
    assertEquals(List.of("a", "b"), first.members());
    assertEquals("{a,b}", first.toString());
  }

  @Test
  void membershipUsesSortedMembers() {
    Extension extension = Extension.of(Set.of("x", "c", "m"));

    assertTrue(extension.contains("m"));
    assertFalse(extension.contains("d"));
    assertFalse(extension.contains(null));
    assertFalse(Extension.empty().contains("a"));
  }

  @Test
  void ordersBySizeThenMembers() {
    List<Extension> extensions =
        new ArrayList<>(
            List.of(
                Extension.of("b", "d"),
                Extension.of("a"),
                Extension.empty(),
                Extension.of("a", "d")));

    TreeSet<Extension> sorted = new TreeSet<>(extensions);

    assertEquals(
        List.of(
            Extension.empty(),
            Extension.of("a"),
            Extension.of("a", "d"),
            Extension.of("b", "d")),
        List.copyOf(sorted));
  }

  @Test
  void membersAreImmutable() {
    List<String> source = new ArrayList<>(List.of("a"));
    Extension extension = Extension.of(source);
    source.add("b");

    assertEquals(1, extension.size());
  }
}
