package colortree.core.diagnostics;

/** Enumerates structured reasons recorded while driving the solver. */
public enum DiagnosticReason {
  MALFORMED_SOLVER_RESULT,
  SOLVER_PROCESS_FAILURE,
  RECONCILIATION_MISMATCH;
}
