package colortree.core.model;

import java.util.List;
import java.util.Objects;

/**
 * One node of the complete coloring decision tree.
 *
 * <p>Nodes are numbered level by level: the root is 0, and the node at {@code indexInLevel} of
 * depth {@code d} has id {@code firstId(d) + indexInLevel}. Instances are immutable.
 */
public final class TreeNode {
  private final long id;
  private final int depth;
  private final long indexInLevel;
  private final LabelAssignment path;
  private final NodeKind kind;
  private final List<TreeNode> children;
  private final List<ViolatedEdge> violatedEdges;

  private TreeNode(
      long id,
      int depth,
      long indexInLevel,
      LabelAssignment path,
      NodeKind kind,
      List<TreeNode> children,
      List<ViolatedEdge> violatedEdges) {
    this.id = id;
    this.depth = depth;
    this.indexInLevel = indexInLevel;
    this.path = Objects.requireNonNull(path, "path");
    this.kind = Objects.requireNonNull(kind, "kind");
    this.children = List.copyOf(children);
    this.violatedEdges = List.copyOf(violatedEdges);
  }

  /** Creates the root or an internal node; children are indexed by label. */
  public static TreeNode branch(
      long id, int depth, long indexInLevel, LabelAssignment path, List<TreeNode> children) {
    if (children.isEmpty()) {
      throw new IllegalArgumentException("branch node needs children");
    }
    NodeKind kind = depth == 0 ? NodeKind.ROOT : NodeKind.INTERNAL;
    return new TreeNode(id, depth, indexInLevel, path, kind, children, List.of());
  }

  /** Creates a leaf; the leaf is valid exactly when {@code violatedEdges} is empty. */
  public static TreeNode leaf(
      long id, int depth, long indexInLevel, LabelAssignment path, List<ViolatedEdge> violatedEdges) {
    NodeKind kind = violatedEdges.isEmpty() ? NodeKind.VALID_LEAF : NodeKind.INVALID_LEAF;
    return new TreeNode(id, depth, indexInLevel, path, kind, List.of(), violatedEdges);
  }

  /**
   * Id of the first node at {@code depth} in a complete tree with branching factor {@code k}.
   * For {@code k == 1} every level holds a single node.
   */
  public static long firstIdAtDepth(int depth, int k) {
    if (depth < 0) {
      throw new IllegalArgumentException("depth must be >= 0");
    }
    if (k < 1) {
      throw new IllegalArgumentException("k must be >= 1");
    }
    if (k == 1) {
      return depth;
    }
    long power = 1;
    for (int d = 0; d < depth; d++) {
      power *= k;
    }
    return (power - 1) / (k - 1);
  }

  public long id() {
    return id;
  }

  public int depth() {
    return depth;
  }

  public long indexInLevel() {
    return indexInLevel;
  }

  public LabelAssignment pathAssignment() {
    return path;
  }

  public NodeKind kind() {
    return kind;
  }

  public boolean isLeaf() {
    return kind.isLeaf();
  }

  public boolean isValidLeaf() {
    return kind == NodeKind.VALID_LEAF;
  }

  /** Children ordered by label value; empty for leaves. */
  public List<TreeNode> children() {
    return children;
  }

  public TreeNode child(int label) {
    return children.get(label);
  }

  /** All violated edges of a leaf; empty for valid leaves and non-leaves. */
  public List<ViolatedEdge> violatedEdges() {
    return violatedEdges;
  }

  @Override
  public String toString() {
    return "TreeNode{id=" + id + ", depth=" + depth + ", kind=" + kind + ", path=" + path + "}";
  }
}
