package colortree.tree;

import colortree.core.model.Graph;
import colortree.core.model.LabelAssignment;
import colortree.core.model.Provenance;
import colortree.core.model.TreeNode;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Consumer;

/**
 * A fully built, classified decision tree for one graph and label count.
 *
 * <p>The node structure never changes after construction. Provenance of valid leaves is kept as
 * an immutable snapshot that {@link #publishConfirmed(Set)} replaces in a single write.
 */
public final class SearchTree {
  private final Graph graph;
  private final int labelCount;
  private final TreeNode root;
  private final List<TreeNode> leaves;
  private final long nodeCount;
  private volatile Set<Long> confirmedLeafIds = Set.of();

  SearchTree(Graph graph, int labelCount, TreeNode root, List<TreeNode> leaves, long nodeCount) {
    this.graph = Objects.requireNonNull(graph, "graph");
    this.labelCount = labelCount;
    this.root = Objects.requireNonNull(root, "root");
    this.leaves = List.copyOf(leaves);
    this.nodeCount = nodeCount;
  }

  public Graph graph() {
    return graph;
  }

  public int labelCount() {
    return labelCount;
  }

  public int depth() {
    return graph.nodeCount();
  }

  public TreeNode root() {
    return root;
  }

  /** Leaves in label-lexicographic order, i.e. by {@link TreeNode#indexInLevel()}. */
  public List<TreeNode> leaves() {
    return leaves;
  }

  public List<TreeNode> validLeaves() {
    return leaves.stream().filter(TreeNode::isValidLeaf).toList();
  }

  public List<TreeNode> invalidLeaves() {
    return leaves.stream().filter(leaf -> !leaf.isValidLeaf()).toList();
  }

  public long nodeCount() {
    return nodeCount;
  }

  public int leafCount() {
    return leaves.size();
  }

  /** Finds the leaf reached by {@code assignment}, if it is a complete in-domain coloring. */
  public Optional<TreeNode> leafFor(LabelAssignment assignment) {
    if (!assignment.isCompleteFor(depth()) || !assignment.withinDomain(labelCount)) {
      return Optional.empty();
    }
    long index = 0;
    for (int node = 0; node < assignment.length(); node++) {
      index = index * labelCount + assignment.get(node);
    }
    return Optional.of(leaves.get((int) index));
  }

  /** Visits every node in pre-order, children in label order. */
  public void forEachNode(Consumer<TreeNode> visitor) {
    Deque<TreeNode> stack = new ArrayDeque<>();
    stack.push(root);
    while (!stack.isEmpty()) {
      TreeNode node = stack.pop();
      visitor.accept(node);
      List<TreeNode> children = node.children();
      for (int i = children.size() - 1; i >= 0; i--) {
        stack.push(children.get(i));
      }
    }
  }

  /** Provenance of a valid leaf; empty for every other node. */
  public Optional<Provenance> provenanceOf(TreeNode node) {
    if (!node.isValidLeaf()) {
      return Optional.empty();
    }
    return Optional.of(
        confirmedLeafIds.contains(node.id()) ? Provenance.SOLVER_CONFIRMED : Provenance.LOCAL_ONLY);
  }

  /** Replaces the set of solver-confirmed leaf ids. */
  public void publishConfirmed(Set<Long> leafIds) {
    confirmedLeafIds = Set.copyOf(leafIds);
  }

  public long confirmedCount() {
    return confirmedLeafIds.size();
  }
}
