package argumentation.enumerate;

import argumentation.model.Extension;
import argumentation.semantics.Semantics;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/** All extensions of one semantics, with the counters of the run that produced them. */
public record EnumerationResult(
    Semantics semantics, Set<Extension> extensions, long subsetsExamined, long elapsedMillis) {

  public EnumerationResult {
    Objects.requireNonNull(semantics, "semantics");
    Objects.requireNonNull(extensions, "extensions");
    extensions = Collections.unmodifiableSet(new LinkedHashSet<>(extensions));
  }

  public int size() {
    return extensions.size();
  }

  public boolean isEmpty() {
    return extensions.isEmpty();
  }
}
