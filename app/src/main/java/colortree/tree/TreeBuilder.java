package colortree.tree;

import colortree.core.ColoringException;
import colortree.core.ColoringOptions;
import colortree.core.ErrorKind;
import colortree.core.model.Edge;
import colortree.core.model.Graph;
import colortree.core.model.LabelAssignment;
import colortree.core.model.TreeNode;
import colortree.util.Timing;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the complete, unpruned coloring decision tree.
 *
 * <p>Depth {@code d} fixes the label of node {@code d-1}; every internal node has exactly one
 * child per label. Leaves are classified with {@link LeafClassifier}. Internal nodes are never
 * evaluated, even when their prefix already contains a conflict.
 */
public final class TreeBuilder {
  private static final Logger LOG = LoggerFactory.getLogger(TreeBuilder.class);

  private final ColoringOptions options;

  public TreeBuilder() {
    this(ColoringOptions.defaults());
  }

  public TreeBuilder(ColoringOptions options) {
    this.options = ColoringOptions.normalize(options);
  }

  public SearchTree build(Graph graph, int labelCount) {
    Objects.requireNonNull(graph, "graph");
    int n = graph.nodeCount();
    if (labelCount < 1) {
      throw ColoringException.invalidConfiguration(
          "label count must be at least 1 (got " + labelCount + ")", n, labelCount);
    }
    for (Edge edge : graph.edges()) {
      if (edge.v() >= n) {
        throw ColoringException.invalidConfiguration(
            "edge " + edge + " references a missing node", n, labelCount);
      }
    }
    TreeSize.requireWithinCeiling(ErrorKind.TREE_TOO_LARGE, n, labelCount, options.maxLeaves());

    Timing timer = Timing.start();
    Expansion expansion = new Expansion(graph, labelCount);
    TreeNode root = expansion.expand(0, 0L, LabelAssignment.empty());
    SearchTree tree =
        new SearchTree(graph, labelCount, root, expansion.leaves, TreeSize.nodeCount(n, labelCount));
    LOG.info(
        "Built search tree for n={} k={}: {} nodes, {} leaves ({} valid) in {} ms",
        n,
        labelCount,
        tree.nodeCount(),
        tree.leafCount(),
        expansion.validLeaves,
        timer.elapsedMillis());
    return tree;
  }

  private static final class Expansion {
    private final Graph graph;
    private final int k;
    private final long[] firstIds;
    private final List<TreeNode> leaves = new ArrayList<>();
    private int validLeaves;

    Expansion(Graph graph, int k) {
      this.graph = graph;
      this.k = k;
      this.firstIds = new long[graph.nodeCount() + 1];
      for (int d = 0; d <= graph.nodeCount(); d++) {
        firstIds[d] = TreeNode.firstIdAtDepth(d, k);
      }
    }

    TreeNode expand(int depth, long indexInLevel, LabelAssignment path) {
      long id = firstIds[depth] + indexInLevel;
      if (depth == graph.nodeCount()) {
        LeafClassifier.Classification classification =
            LeafClassifier.classify(path, graph.edges());
        TreeNode leaf = TreeNode.leaf(id, depth, indexInLevel, path, classification.violatedEdges());
        if (classification.valid()) {
          validLeaves++;
        }
        leaves.add(leaf);
        return leaf;
      }
      List<TreeNode> children = new ArrayList<>(k);
      for (int label = 0; label < k; label++) {
        children.add(expand(depth + 1, indexInLevel * k + label, path.append(label)));
      }
      return TreeNode.branch(id, depth, indexInLevel, path, children);
    }
  }
}
