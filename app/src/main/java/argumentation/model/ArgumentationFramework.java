package argumentation.model;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable abstract argumentation framework: every declared argument mapped to the set of
 * arguments it attacks.
 *
 * <p>Self-attacks and cycles are allowed. Both endpoints of an attack must be declared; the
 * constructor rejects dangling references instead of leaving them to the predicate layer.
 */
public final class ArgumentationFramework {
  private final Map<String, Set<String>> attacks;
  private final Map<String, Set<String>> attackers;
  private final List<String> sortedArguments;
  private final int attackCount;

  private ArgumentationFramework(Map<String, Set<String>> declared) {
    Map<String, Set<String>> attackMap = new LinkedHashMap<>();
    Map<String, Set<String>> reverse = new LinkedHashMap<>();
    for (String argument : declared.keySet()) {
      reverse.put(argument, new LinkedHashSet<>());
    }
    int edges = 0;
    for (Map.Entry<String, Set<String>> entry : declared.entrySet()) {
      String attacker = Objects.requireNonNull(entry.getKey(), "argument");
      Set<String> targets = entry.getValue() == null ? Set.of() : entry.getValue();
      for (String target : targets) {
        Set<String> incoming = reverse.get(target);
        if (incoming == null) {
          throw new IllegalArgumentException(
              "Attack " + attacker + " -> " + target + " references undeclared argument " + target);
        }
        incoming.add(attacker);
        edges++;
      }
      attackMap.put(attacker, Set.copyOf(targets));
    }
    Map<String, Set<String>> frozenReverse = new LinkedHashMap<>();
    reverse.forEach((argument, incoming) -> frozenReverse.put(argument, Set.copyOf(incoming)));

    this.attacks = Collections.unmodifiableMap(attackMap);
    this.attackers = Collections.unmodifiableMap(frozenReverse);
    this.sortedArguments = attackMap.keySet().stream().sorted().toList();
    this.attackCount = edges;
  }

  /** Builds a framework from an argument to attacked-arguments mapping. */
  public static ArgumentationFramework of(Map<String, ? extends Collection<String>> attackMap) {
    Objects.requireNonNull(attackMap, "attackMap");
    Builder builder = builder();
    attackMap.keySet().forEach(builder::addArgument);
    attackMap.forEach(
        (attacker, targets) -> {
          if (targets != null) {
            targets.forEach(target -> builder.addAttack(attacker, target));
          }
        });
    return builder.build();
  }

  public static ArgumentationFramework empty() {
    return builder().build();
  }

  public static Builder builder() {
    return new Builder();
  }

  /** Arguments in declaration order. */
  public Set<String> arguments() {
    return attacks.keySet();
  }

  /** Arguments in lexicographic order; the index of an argument here is its enumeration bit. */
  public List<String> sortedArguments() {
    return sortedArguments;
  }

  public int size() {
    return attacks.size();
  }

  public int attackCount() {
    return attackCount;
  }

  public boolean contains(String argument) {
    return attacks.containsKey(argument);
  }

  public boolean containsAll(Collection<String> candidate) {
    for (String argument : candidate) {
      if (!contains(argument)) {
        return false;
      }
    }
    return true;
  }

  /** Arguments attacked by {@code argument}. */
  public Set<String> attacksOf(String argument) {
    return lookup(attacks, argument);
  }

  /** Arguments attacking {@code argument}. */
  public Set<String> attackersOf(String argument) {
    return lookup(attackers, argument);
  }

  public boolean attacks(String attacker, String attacked) {
    return attacksOf(attacker).contains(attacked);
  }

  public Map<String, Set<String>> asMap() {
    return attacks;
  }

  private static Set<String> lookup(Map<String, Set<String>> index, String argument) {
    Set<String> result = index.get(argument);
    if (result == null) {
      throw new IllegalArgumentException("Unknown argument: " + argument);
    }
    return result;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof ArgumentationFramework other)) {
      return false;
    }
    return attacks.equals(other.attacks);
  }

  @Override
  public int hashCode() {
    return attacks.hashCode();
  }

  @Override
  public String toString() {
    return "ArgumentationFramework{arguments=" + size() + ", attacks=" + attackCount + "}";
  }

  /** Incremental builder; arguments must be declared before an attack references them. */
  public static final class Builder {
    private final Map<String, Set<String>> declared = new LinkedHashMap<>();

    private Builder() {}

    public Builder addArgument(String argument) {
      Objects.requireNonNull(argument, "argument");
      declared.putIfAbsent(argument, new LinkedHashSet<>());
      return this;
    }

    public Builder addArguments(String... arguments) {
      for (String argument : arguments) {
        addArgument(argument);
      }
      return this;
    }

    public Builder addAttack(String attacker, String attacked) {
      Objects.requireNonNull(attacker, "attacker");
      Objects.requireNonNull(attacked, "attacked");
      Set<String> targets = declared.get(attacker);
      if (targets == null) {
        throw new IllegalArgumentException("Attacker " + attacker + " is not a declared argument");
      }
      if (!declared.containsKey(attacked)) {
        throw new IllegalArgumentException("Attacked " + attacked + " is not a declared argument");
      }
      targets.add(attacked);
      return this;
    }

    public boolean isDeclared(String argument) {
      return declared.containsKey(argument);
    }

    public ArgumentationFramework build() {
      Map<String, Set<String>> snapshot = new LinkedHashMap<>();
      declared.forEach((argument, targets) -> snapshot.put(argument, new LinkedHashSet<>(targets)));
      return new ArgumentationFramework(snapshot);
    }
  }
}
