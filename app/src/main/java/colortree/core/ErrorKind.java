package colortree.core;

/** Categories of failures surfaced to callers as {@link ColoringException}. */
public enum ErrorKind {
  INVALID_CONFIGURATION,
  TREE_TOO_LARGE,
  LAYOUT_TOO_LARGE,
  RECONCILIATION_MISMATCH;
}
