package argumentation.semantics;

import argumentation.model.ArgumentationFramework;
import java.util.Set;

/**
 * Complete semantics: the candidate is admissible and contains every argument it defends.
 */
final class CompleteVerifier implements ExtensionVerifier {

  @Override
  public boolean verify(ArgumentationFramework af, Set<String> candidate) {
    if (!ArgumentationPredicates.isAdmissible(af, candidate)) {
      return false;
    }
    for (String argument : af.arguments()) {
      if (!candidate.contains(argument)
          && ArgumentationPredicates.isDefended(af, candidate, argument)) {
        return false;
      }
    }
    return true;
  }
}
