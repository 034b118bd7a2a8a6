package argumentation.semantics;

import argumentation.model.ArgumentationFramework;
import java.util.Set;

/** Decides whether a candidate set is an extension of a framework under one semantics. */
@FunctionalInterface
public interface ExtensionVerifier {

  boolean verify(ArgumentationFramework af, Set<String> candidate);
}
