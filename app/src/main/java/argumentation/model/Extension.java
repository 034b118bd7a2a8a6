package argumentation.model;

import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Canonical set of arguments: members are kept sorted and duplicate-free, so two extensions with
 * the same members are equal regardless of insertion order.
 */
public record Extension(List<String> members) implements Comparable<Extension> {
  private static final Extension EMPTY = new Extension(List.of());

  public Extension {
    Objects.requireNonNull(members, "members");
    members = List.copyOf(new TreeSet<>(members));
  }

  public static Extension of(Collection<String> members) {
    return members.isEmpty() ? EMPTY : new Extension(List.copyOf(members));
  }

  public static Extension of(String... members) {
    return of(List.of(members));
  }

  public static Extension empty() {
    return EMPTY;
  }

  public boolean contains(String argument) {
    return argument != null && Collections.binarySearch(members, argument) >= 0;
  }

  public int size() {
    return members.size();
  }

  public boolean isEmpty() {
    return members.isEmpty();
  }

  public Set<String> asSet() {
    return Set.copyOf(members);
  }

  /** Orders by size, then lexicographically by members. */
  @Override
  public int compareTo(Extension other) {
    int bySize = Integer.compare(members.size(), other.members.size());
    if (bySize != 0) {
      return bySize;
    }
    for (int i = 0; i < members.size(); i++) {
      int cmp = members.get(i).compareTo(other.members.get(i));
      if (cmp != 0) {
        return cmp;
      }
    }
    return 0;
  }

  @Override
  public String toString() {
    return "{" + String.join(",", members) + "}";
  }
}
