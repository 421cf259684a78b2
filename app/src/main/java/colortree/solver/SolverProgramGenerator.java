package colortree.solver;

import colortree.core.model.Edge;
import colortree.core.model.ExclusionSet;
import colortree.core.model.Graph;
import colortree.core.model.LabelAssignment;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;

/**
 * Encodes a coloring problem as a solver program: one symbolic variable per node, a domain
 * assumption per node, an inequality per edge and one exclusion per already-found coloring.
 */
public final class SolverProgramGenerator {
  private static final String VARIABLE_PREFIX = "color_";

  private final Supplier<ProgramEmitter> emitters;

  public SolverProgramGenerator() {
    this(KleeProgramEmitter::new);
  }

  public SolverProgramGenerator(Supplier<ProgramEmitter> emitters) {
    this.emitters = emitters;
  }

  public static String variableName(int node) {
    return VARIABLE_PREFIX + node;
  }

  /** Inverse of {@link #variableName(int)}; returns -1 for names that are not node variables. */
  public static int nodeOf(String variable) {
    if (variable == null || !variable.startsWith(VARIABLE_PREFIX)) {
      return -1;
    }
    try {
      return Integer.parseInt(variable.substring(VARIABLE_PREFIX.length()));
    } catch (NumberFormatException ex) {
      return -1;
    }
  }

  public SolverProgram generate(Graph graph, int labelCount, ExclusionSet exclusions) {
    ProgramEmitter emitter = emitters.get();
    List<String> variables = new ArrayList<>(graph.nodeCount());
    for (int node = 0; node < graph.nodeCount(); node++) {
      variables.add(variableName(node));
    }

    variables.forEach(emitter::declareSymbolic);
    for (String variable : variables) {
      emitter.assume(new Predicate.Domain(variable, labelCount));
    }
    for (Edge edge : graph.edges()) {
      emitter.assume(new Predicate.Distinct(variables.get(edge.u()), variables.get(edge.v())));
    }
    for (LabelAssignment excluded : exclusions) {
      emitter.assume(new Predicate.Exclusion(variables, excluded.toList()));
    }
    emitter.recordValues(variables);
    return new SolverProgram(emitter.finish(), variables, labelCount, exclusions.size());
  }
}
