package colortree.enumerate;

/** Why an enumeration stopped. */
public enum TerminationReason {
  /** An invocation produced no new coloring. */
  FIXED_POINT(true),
  /** The solver reported that no satisfying assignment remains. */
  SOLVER_INFEASIBLE(true),
  ITERATION_BUDGET_EXCEEDED(false),
  TIME_BUDGET_EXCEEDED(false),
  /** The solver process kept crashing or timing out after all retries. */
  SOLVER_PROCESS_FAILURE(false),
  CANCELLED(false);

  private final boolean exhaustive;

  TerminationReason(boolean exhaustive) {
    this.exhaustive = exhaustive;
  }

  /** True when every satisfying coloring is presumed found. */
  public boolean isExhaustive() {
    return exhaustive;
  }

  /** True when a budget (iterations, time, or process retries) ran out before the fixed point. */
  public boolean isBudgetExceeded() {
    return this == ITERATION_BUDGET_EXCEEDED
        || this == TIME_BUDGET_EXCEEDED
        || this == SOLVER_PROCESS_FAILURE;
  }
}
