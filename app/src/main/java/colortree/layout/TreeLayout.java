package colortree.layout;

import colortree.core.ColoringOptions;
import colortree.core.ErrorKind;
import colortree.core.model.TreeNode;
import colortree.tree.SearchTree;
import colortree.tree.TreeSize;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Two-pass subtree-width layout.
 *
 * <p>Pass one (post-order) gives every leaf width 1 and every internal node the sum of its
 * children's widths. Pass two (pre-order) lays children out left to right from their parent's
 * left edge, in increasing label order, and centres each node over its own span. The root sits at
 * {@code x = 0}; {@code y = topMargin + depth * levelHeight}.
 */
public final class TreeLayout {
  private static final Logger LOG = LoggerFactory.getLogger(TreeLayout.class);

  private final ColoringOptions options;

  public TreeLayout() {
    this(ColoringOptions.defaults());
  }

  public TreeLayout(ColoringOptions options) {
    this.options = ColoringOptions.normalize(options);
  }

  public LayoutResult layout(SearchTree tree) {
    Objects.requireNonNull(tree, "tree");
    TreeSize.requireWithinCeiling(
        ErrorKind.LAYOUT_TOO_LARGE, tree.depth(), tree.labelCount(), options.maxLeaves());

    int size = Math.toIntExact(tree.nodeCount());
    long[] widths = new long[size];
    long rootWidth = measure(tree.root(), widths);

    Placement placement = new Placement(size, rootWidth);
    placement.place(tree.root(), 0L, widths);
    LOG.debug("Laid out {} nodes, {} leaf units wide", size, rootWidth);
    return new LayoutResult(
        placement.xs, placement.ys, placement.left, placement.right, options.levelHeight());
  }

  private static long measure(TreeNode node, long[] widths) {
    List<TreeNode> children = node.children();
    long width;
    if (children.isEmpty()) {
      width = 1;
    } else {
      width = 0;
      for (TreeNode child : children) {
        width += measure(child, widths);
      }
    }
    widths[(int) node.id()] = width;
    return width;
  }

  private final class Placement {
    final double[] xs;
    final double[] ys;
    final double[] left;
    final double[] right;
    final double offset;

    Placement(int size, long rootWidth) {
      this.xs = new double[size];
      this.ys = new double[size];
      this.left = new double[size];
      this.right = new double[size];
      this.offset = rootWidth / 2.0;
    }

    void place(TreeNode node, long leftEdge, long[] widths) {
      int index = (int) node.id();
      long width = widths[index];
      double gap = options.horizontalGap();
      left[index] = (leftEdge - offset) * gap;
      right[index] = (leftEdge + width - offset) * gap;
      xs[index] = (leftEdge + width / 2.0 - offset) * gap;
      ys[index] = options.topMargin() + node.depth() * options.levelHeight();

      long childLeft = leftEdge;
      for (TreeNode child : node.children()) {
        place(child, childLeft, widths);
        childLeft += widths[(int) child.id()];
      }
    }
  }
}
