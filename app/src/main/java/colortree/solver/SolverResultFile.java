package colortree.solver;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One concrete result reported by the solver: named objects with their integer values.
 *
 * @param source where the result came from (file name), used in diagnostics
 * @param objects object name to values, in the order the solver listed them
 */
public record SolverResultFile(String source, Map<String, List<Integer>> objects) {

  public SolverResultFile {
    Objects.requireNonNull(source, "source");
    objects = Map.copyOf(objects);
  }
}
