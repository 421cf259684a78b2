package colortree.solver;

import colortree.core.model.LabelAssignment;
import java.util.List;
import java.util.Map;

/**
 * Maps a solver result back to a complete assignment by variable name.
 *
 * <p>Prefers one object per node ({@code color_0}, {@code color_1}, ...); falls back to a single
 * {@code color} array object. Object order inside the result is irrelevant.
 */
public final class ResultDecoder {
  private static final String ARRAY_OBJECT = "color";

  private ResultDecoder() {}

  /** Either a decoded assignment or the reason decoding failed. */
  public record Decoded(LabelAssignment assignment, String problem) {
    static Decoded ok(LabelAssignment assignment) {
      return new Decoded(assignment, null);
    }

    static Decoded malformed(String problem) {
      return new Decoded(null, problem);
    }

    public boolean isOk() {
      return assignment != null;
    }
  }

  public static Decoded decode(SolverResultFile result, int nodeCount, int labelCount) {
    Map<String, List<Integer>> objects = result.objects();
    int[] labels = new int[nodeCount];
    int found = 0;
    String firstMissing = null;
    for (int node = 0; node < nodeCount; node++) {
      List<Integer> values = objects.get(SolverProgramGenerator.variableName(node));
      if (values == null || values.isEmpty()) {
        if (firstMissing == null) {
          firstMissing = SolverProgramGenerator.variableName(node);
        }
        continue;
      }
      labels[node] = values.get(0);
      found++;
    }

    if (found != nodeCount) {
      List<Integer> array = objects.get(ARRAY_OBJECT);
      if (array == null || array.size() < nodeCount) {
        return Decoded.malformed("missing value for " + firstMissing);
      }
      for (int node = 0; node < nodeCount; node++) {
        labels[node] = array.get(node);
      }
    }

    for (int node = 0; node < nodeCount; node++) {
      if (labels[node] < 0 || labels[node] >= labelCount) {
        return Decoded.malformed(
            "label " + labels[node] + " of node " + node + " outside [0, " + labelCount + ")");
      }
    }
    return Decoded.ok(LabelAssignment.of(labels));
  }
}
