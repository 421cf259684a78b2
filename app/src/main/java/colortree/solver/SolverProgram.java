package colortree.solver;

import java.util.List;
import java.util.Objects;

/** Generated solver input plus the facts needed to decode its results. */
public record SolverProgram(
    String source, List<String> variables, int labelCount, int exclusionCount) {

  public SolverProgram {
    Objects.requireNonNull(source, "source");
    variables = List.copyOf(variables);
  }

  public int nodeCount() {
    return variables.size();
  }
}
