package colortree.core.model;

/** Who vouched for a valid leaf. */
public enum Provenance {
  /** The external solver reported this coloring. */
  SOLVER_CONFIRMED,
  /** Only the local edge check accepted it. */
  LOCAL_ONLY
}
