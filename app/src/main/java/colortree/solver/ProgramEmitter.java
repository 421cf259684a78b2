package colortree.solver;

import java.util.List;

/** Renders the abstract solver program primitives into one concrete solver's input language. */
public interface ProgramEmitter {

  void declareSymbolic(String variable);

  void assume(Predicate predicate);

  /**
   * Marks the variables whose concrete values each result must report.
   *
   * <p>Backends whose results already carry every symbolic variable may treat this as
   * informational. KLEE writes the value of each {@code klee_make_symbolic} object into every
   * {@code .ktest} file, so {@link KleeProgramEmitter} only lists the names in a comment.
   */
  void recordValues(List<String> variables);

  /** Returns the complete program text. The emitter must not be reused afterwards. */
  String finish();
}
