package colortree.tree;

import colortree.core.model.Edge;
import colortree.core.model.LabelAssignment;
import colortree.core.model.ViolatedEdge;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Checks a complete coloring against an edge set.
 *
 * <p>Used for every leaf of the tree and to re-validate each coloring the solver reports before
 * it is trusted.
 */
public final class LeafClassifier {

  private LeafClassifier() {}

  /** Outcome of classifying one complete assignment. */
  public record Classification(boolean valid, List<ViolatedEdge> violatedEdges) {
    public Classification {
      violatedEdges = List.copyOf(violatedEdges);
    }
  }

  /**
   * Returns every edge of {@code edges} whose endpoints share a label, in edge-list order.
   *
   * @throws IllegalArgumentException if an edge endpoint has no label in {@code assignment}
   */
  public static Classification classify(LabelAssignment assignment, List<Edge> edges) {
    Objects.requireNonNull(assignment, "assignment");
    List<ViolatedEdge> violated = new ArrayList<>();
    for (Edge edge : edges) {
      if (edge.v() >= assignment.length()) {
        throw new IllegalArgumentException(
            "assignment " + assignment + " does not cover edge " + edge);
      }
      int label = assignment.get(edge.u());
      if (label == assignment.get(edge.v())) {
        violated.add(new ViolatedEdge(edge, label));
      }
    }
    return new Classification(violated.isEmpty(), violated);
  }
}
