package argumentation.semantics;

import argumentation.model.ArgumentationFramework;
import java.util.Set;

/** Stable semantics: the candidate is conflict-free and attacks every argument outside it. */
final class StableVerifier implements ExtensionVerifier {

  @Override
  public boolean verify(ArgumentationFramework af, Set<String> candidate) {
    if (!ArgumentationPredicates.conflictFree(af, candidate)) {
      return false;
    }
    for (String argument : af.arguments()) {
      if (!candidate.contains(argument)
          && !ArgumentationPredicates.attacksAny(af, candidate, argument)) {
        return false;
      }
    }
    return true;
  }
}
