package argumentation.semantics;

import argumentation.model.ArgumentationFramework;
import java.util.Locale;
import java.util.Set;

/** Supported extension semantics, each backed by its verifier. */
public enum Semantics {
  COMPLETE("CO", new CompleteVerifier()),
  STABLE("ST", new StableVerifier());

  private final String abbreviation;
  private final ExtensionVerifier verifier;

  Semantics(String abbreviation, ExtensionVerifier verifier) {
    this.abbreviation = abbreviation;
    this.verifier = verifier;
  }

  /** Two-letter suffix used in problem codes, e.g. {@code CO} in {@code DC-CO}. */
  public String abbreviation() {
    return abbreviation;
  }

  public ExtensionVerifier verifier() {
    return verifier;
  }

  public boolean isExtension(ArgumentationFramework af, Set<String> candidate) {
    return verifier.verify(af, candidate);
  }

  public static Semantics parse(String raw) {
    if (raw == null || raw.isBlank()) {
      throw new IllegalArgumentException("Missing semantics");
    }
    return switch (raw.trim().toLowerCase(Locale.ROOT)) {
      case "complete", "co" -> COMPLETE;
      case "stable", "st" -> STABLE;
      default -> throw new IllegalArgumentException("Invalid semantics: " + raw);
    };
  }
}
