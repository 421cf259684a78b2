package colortree.core.model;

/** Position of a node in the decision tree. */
public enum NodeKind {
  ROOT,
  INTERNAL,
  VALID_LEAF,
  INVALID_LEAF;

  public boolean isLeaf() {
    return this == VALID_LEAF || this == INVALID_LEAF;
  }
}
