package argumentation.enumerate;

import argumentation.model.ArgumentationFramework;
import argumentation.model.Extension;
import argumentation.semantics.Semantics;
import java.util.Set;

/** Source of the full extension set of a framework under a semantics. */
@FunctionalInterface
public interface ExtensionProvider {

  Set<Extension> extensions(ArgumentationFramework af, Semantics semantics);

  /** Provider that enumerates afresh on every call. */
  static ExtensionProvider enumerating(ExtensionEnumerator.Config config) {
    return (af, semantics) -> ExtensionEnumerator.enumerate(af, semantics, config).extensions();
  }
}
