package argumentation.util;

import java.util.BitSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.IntStream;

/** Helpers for turning subset masks into argument sets. */
public final class BitsetUtils {
  /** Widest universe a {@code long} subset mask can enumerate without overflow. */
  public static final int MAX_MASK_WIDTH = Long.SIZE - 2;

  private BitsetUtils() {}

  public static BitSet fromMask(long mask, int size) {
    BitSet bitSet = new BitSet(size);
    for (int i = 0; i < size; i++) {
      if (((mask >>> i) & 1L) != 0) {
        bitSet.set(i);
      }
    }
    return bitSet;
  }

  /** Members of {@code universe} selected by the set bits of {@code mask}. */
  public static Set<String> select(long mask, List<String> universe) {
    Set<String> selected = new LinkedHashSet<>(Long.bitCount(mask) * 2);
    stream(fromMask(mask, universe.size())).forEach(i -> selected.add(universe.get(i)));
    return selected;
  }

  /** Number of subsets of a universe with {@code size} elements. */
  public static long subsetCount(int size) {
    if (size < 0 || size > MAX_MASK_WIDTH) {
      throw new IllegalArgumentException(
          "Cannot enumerate subsets of " + size + " elements (limit " + MAX_MASK_WIDTH + ")");
    }
    return 1L << size;
  }

  public static IntStream stream(BitSet bitSet) {
    return IntStream.iterate(bitSet.nextSetBit(0), i -> i >= 0, i -> bitSet.nextSetBit(i + 1));
  }
}
