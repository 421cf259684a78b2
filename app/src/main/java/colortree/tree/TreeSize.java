package colortree.tree;

import colortree.core.ColoringException;
import colortree.core.ErrorKind;

/** Size arithmetic for complete k-ary trees, saturating at {@link Long#MAX_VALUE}. */
public final class TreeSize {

  private TreeSize() {}

  /** Number of complete assignments, {@code k^n}. */
  public static long leafCount(int nodes, int labels) {
    long count = 1;
    for (int i = 0; i < nodes; i++) {
      count = saturatingMultiply(count, labels);
    }
    return count;
  }

  /** Number of tree nodes, {@code sum_{d=0..n} k^d}. */
  public static long nodeCount(int nodes, int labels) {
    long total = 0;
    long level = 1;
    for (int d = 0; d <= nodes; d++) {
      total = saturatingAdd(total, level);
      level = saturatingMultiply(level, labels);
    }
    return total;
  }

  /** Throws {@code kind} when {@code labels^nodes} exceeds {@code ceiling}. */
  public static void requireWithinCeiling(ErrorKind kind, int nodes, int labels, long ceiling) {
    long leaves = leafCount(nodes, labels);
    if (leaves > ceiling) {
      throw ColoringException.tooLarge(kind, nodes, labels, leaves, ceiling);
    }
  }

  private static long saturatingMultiply(long a, long b) {
    try {
      return Math.multiplyExact(a, b);
    } catch (ArithmeticException ex) {
      return Long.MAX_VALUE;
    }
  }

  private static long saturatingAdd(long a, long b) {
    try {
      return Math.addExact(a, b);
    } catch (ArithmeticException ex) {
      return Long.MAX_VALUE;
    }
  }
}
