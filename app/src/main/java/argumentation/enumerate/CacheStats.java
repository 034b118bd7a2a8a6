package argumentation.enumerate;

/** Hit/miss counters of an {@link ExtensionCache}. */
public final class CacheStats {
  private long hits;
  private long misses;

  public CacheStats() {}

  private CacheStats(long hits, long misses) {
    this.hits = hits;
    this.misses = misses;
  }

  public static CacheStats of(long hits, long misses) {
    return new CacheStats(hits, misses);
  }

  public synchronized void recordHit() {
    hits++;
  }

  public synchronized void recordMiss() {
    misses++;
  }

  public synchronized long hits() {
    return hits;
  }

  public synchronized long misses() {
    return misses;
  }

  public synchronized CacheStats snapshot() {
    return CacheStats.of(hits, misses);
  }

  @Override
  public synchronized String toString() {
    return "CacheStats{hits=" + hits + ", misses=" + misses + "}";
  }
}
