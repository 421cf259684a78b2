package colortree.layout;

import colortree.core.model.TreeNode;

/**
 * Coordinates for every node of a laid-out tree, indexed by node id.
 *
 * <p>Besides each node's centre, the horizontal span reserved for its subtree is kept so callers
 * can hit-test or check spacing without walking the tree.
 */
public final class LayoutResult {
  private final double[] xs;
  private final double[] ys;
  private final double[] spanLeft;
  private final double[] spanRight;
  private final double levelHeight;

  LayoutResult(double[] xs, double[] ys, double[] spanLeft, double[] spanRight, double levelHeight) {
    this.xs = xs;
    this.ys = ys;
    this.spanLeft = spanLeft;
    this.spanRight = spanRight;
    this.levelHeight = levelHeight;
  }

  public int size() {
    return xs.length;
  }

  public Point positionOf(TreeNode node) {
    return positionOf(node.id());
  }

  public Point positionOf(long nodeId) {
    int index = index(nodeId);
    return new Point(xs[index], ys[index]);
  }

  /** Left edge of the horizontal range reserved for the subtree of {@code node}. */
  public double spanLeft(TreeNode node) {
    return spanLeft[index(node.id())];
  }

  /** Right edge (exclusive) of the horizontal range reserved for the subtree of {@code node}. */
  public double spanRight(TreeNode node) {
    return spanRight[index(node.id())];
  }

  public double minX() {
    return xs.length == 0 ? 0 : spanLeft[0];
  }

  public double maxX() {
    return xs.length == 0 ? 0 : spanRight[0];
  }

  public double width() {
    return maxX() - minX();
  }

  public double height() {
    double max = 0;
    for (double y : ys) {
      max = Math.max(max, y);
    }
    return max + levelHeight;
  }

  private int index(long nodeId) {
    if (nodeId < 0 || nodeId >= xs.length) {
      throw new IllegalArgumentException("Unknown node id " + nodeId);
    }
    return (int) nodeId;
  }
}
