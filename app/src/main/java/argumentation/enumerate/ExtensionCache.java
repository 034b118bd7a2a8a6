package argumentation.enumerate;

import argumentation.model.ArgumentationFramework;
import argumentation.model.Extension;
import argumentation.semantics.Semantics;
import java.util.Collections;
import java.util.EnumMap;
import java.util.IdentityHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Memoizing {@link ExtensionProvider} keyed by framework object identity and semantics.
 *
 * <p>Two equal but separately built frameworks are distinct keys, so rebuilding a framework never
 * observes stale results. Entries live until {@link #invalidate} or {@link #clear} is called.
 */
public final class ExtensionCache implements ExtensionProvider {
  private static final Logger LOG = LoggerFactory.getLogger(ExtensionCache.class);

  private final ExtensionProvider delegate;
  private final Map<ArgumentationFramework, Map<Semantics, Set<Extension>>> entries =
      new IdentityHashMap<>();
  private final CacheStats stats;

  public ExtensionCache(ExtensionProvider delegate) {
    this(delegate, new CacheStats());
  }

  public ExtensionCache(ExtensionProvider delegate, CacheStats stats) {
    this.delegate = Objects.requireNonNull(delegate, "delegate");
    this.stats = Objects.requireNonNull(stats, "stats");
  }

  @Override
  public Set<Extension> extensions(ArgumentationFramework af, Semantics semantics) {
    Objects.requireNonNull(af, "af");
    Objects.requireNonNull(semantics, "semantics");
    synchronized (entries) {
      Set<Extension> cached = entries.getOrDefault(af, Map.of()).get(semantics);
      if (cached != null) {
        stats.recordHit();
        return cached;
      }
    }
    stats.recordMiss();
    // Computed outside the lock; a concurrent miss on the same key only repeats the work.
    Set<Extension> computed =
        Collections.unmodifiableSet(new LinkedHashSet<>(delegate.extensions(af, semantics)));
    synchronized (entries) {
      Map<Semantics, Set<Extension>> perSemantics =
          entries.computeIfAbsent(af, k -> new EnumMap<>(Semantics.class));
      Set<Extension> previous = perSemantics.putIfAbsent(semantics, computed);
      return previous != null ? previous : computed;
    }
  }

  /** Drops every entry computed for {@code af}. */
  public void invalidate(ArgumentationFramework af) {
    synchronized (entries) {
      if (entries.remove(af) != null) {
        LOG.debug("Invalidated cached extensions for {}", af);
      }
    }
  }

  public void clear() {
    synchronized (entries) {
      entries.clear();
    }
  }

  public int size() {
    synchronized (entries) {
      return entries.values().stream().mapToInt(Map::size).sum();
    }
  }

  public CacheStats stats() {
    return stats;
  }
}
