package colortree.solver;

import java.util.List;

/**
 * Everything one solver invocation reported.
 *
 * @param results concrete results, possibly empty
 * @param infeasible whether the solver itself signalled that no satisfying assignment exists
 */
public record SolverResponse(List<SolverResultFile> results, boolean infeasible) {

  public SolverResponse {
    results = List.copyOf(results);
  }

  public static SolverResponse of(List<SolverResultFile> results) {
    return new SolverResponse(results, false);
  }

  public static SolverResponse infeasibleResponse() {
    return new SolverResponse(List.of(), true);
  }
}
