package colortree.solver;

import java.time.Duration;

/**
 * Opaque, stateless-per-call constraint solver.
 *
 * <p>Each call receives the complete program, including all exclusions, and may report zero,
 * one or many satisfying assignments.
 */
public interface SolverOracle {

  /**
   * Runs the solver on {@code program}.
   *
   * @throws SolverProcessException if the solver crashed, timed out or could not be started
   * @throws InterruptedException if the calling thread was interrupted; any external process has
   *     been terminated by the time this is thrown
   */
  SolverResponse solve(SolverProgram program, Duration timeout)
      throws SolverProcessException, InterruptedException;
}
