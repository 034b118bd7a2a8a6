package argumentation.acceptance;

import argumentation.enumerate.ExtensionEnumerator;
import argumentation.enumerate.ExtensionProvider;
import argumentation.model.ArgumentationFramework;
import argumentation.model.Extension;
import argumentation.semantics.Semantics;
import java.util.Objects;
import java.util.Set;

/** Credulous and skeptical acceptance of single arguments over all extensions. */
public final class AcceptanceEngine {
  private final ExtensionProvider provider;

  /** Engine that enumerates the extensions sequentially on every query. */
  public AcceptanceEngine() {
    this(ExtensionProvider.enumerating(ExtensionEnumerator.Config.sequential()));
  }

  public AcceptanceEngine(ExtensionProvider provider) {
    this.provider = Objects.requireNonNull(provider, "provider");
  }

  /** True iff {@code argument} belongs to at least one extension. */
  public boolean credulouslyAccepted(
      ArgumentationFramework af, Semantics semantics, String argument) {
    Objects.requireNonNull(argument, "argument");
    for (Extension extension : provider.extensions(af, semantics)) {
      if (extension.contains(argument)) {
        return true;
      }
    }
    return false;
  }

  /**
   * True iff {@code argument} belongs to every extension.
   *
   * <p>Vacuously true when the semantics admits no extension at all.
   */
  public boolean skepticallyAccepted(
      ArgumentationFramework af, Semantics semantics, String argument) {
    Objects.requireNonNull(argument, "argument");
    for (Extension extension : provider.extensions(af, semantics)) {
      if (!extension.contains(argument)) {
        return false;
      }
    }
    return true;
  }

  public Set<Extension> extensions(ArgumentationFramework af, Semantics semantics) {
    return provider.extensions(af, semantics);
  }
}
