package colortree.solver;

/** The external solver failed, as opposed to reporting that no coloring exists. */
public final class SolverProcessException extends Exception {

  public enum Failure {
    TOOL_MISSING,
    TIMEOUT,
    ABNORMAL_EXIT,
    IO
  }

  private final Failure failure;

  public SolverProcessException(Failure failure, String message) {
    super(message);
    this.failure = failure;
  }

  public SolverProcessException(Failure failure, String message, Throwable cause) {
    super(message, cause);
    this.failure = failure;
  }

  public Failure failure() {
    return failure;
  }
}
