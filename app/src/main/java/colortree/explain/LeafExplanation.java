package colortree.explain;

import colortree.core.model.Provenance;
import java.util.List;

/**
 * Presentation data for one leaf: the coloring per node and, for invalid leaves, every conflict.
 *
 * @param provenance {@code null} for invalid leaves
 */
public record LeafExplanation(
    long leafId,
    boolean valid,
    Provenance provenance,
    List<NodeColor> coloring,
    List<Conflict> conflicts) {

  public LeafExplanation {
    coloring = List.copyOf(coloring);
    conflicts = List.copyOf(conflicts);
  }

  public record NodeColor(int node, int label, String colorName) {}

  public record Conflict(int u, int v, int label, String colorName) {}

  /** One-line summary, e.g. {@code "Invalid: node 0 and node 1 are both RED"}. */
  public String summary() {
    if (valid) {
      StringBuilder sb = new StringBuilder("Valid:");
      for (NodeColor color : coloring) {
        sb.append(" node ").append(color.node()).append('=').append(color.colorName());
      }
      return sb.toString();
    }
    StringBuilder sb = new StringBuilder("Invalid:");
    for (int i = 0; i < conflicts.size(); i++) {
      Conflict conflict = conflicts.get(i);
      sb.append(i == 0 ? " " : "; ")
          .append("node ")
          .append(conflict.u())
          .append(" and node ")
          .append(conflict.v())
          .append(" are both ")
          .append(conflict.colorName());
    }
    return sb.toString();
  }
}
