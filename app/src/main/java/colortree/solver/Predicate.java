package colortree.solver;

import java.util.List;

/**
 * Solver-independent constraint over symbolic node variables.
 *
 * <p>Each {@link ProgramEmitter} decides how to render the concrete implementations.
 */
public interface Predicate {

  /** {@code 0 <= variable < labelCount}. */
  record Domain(String variable, int labelCount) implements Predicate {}

  /** {@code left != right}, one per graph edge. */
  record Distinct(String left, String right) implements Predicate {}

  /**
   * Forbids one exact assignment: at least one variable must differ from its excluded value.
   */
  record Exclusion(List<String> variables, List<Integer> values)
      implements Predicate {
    public Exclusion {
      variables = List.copyOf(variables);
      values = List.copyOf(values);
      if (variables.size() != values.size()) {
        throw new IllegalArgumentException("variables and values differ in length");
      }
    }
  }
}
