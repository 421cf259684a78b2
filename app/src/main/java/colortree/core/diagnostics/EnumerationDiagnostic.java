package colortree.core.diagnostics;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/** Structured diagnostic entry describing something the enumeration discarded or flagged. */
public record EnumerationDiagnostic(
    int iteration, DiagnosticReason reason, String message, Map<String, Object> attributes) {

  public static final String ATTR_SOURCE = "source";
  public static final String ATTR_ASSIGNMENT = "assignment";
  public static final String ATTR_FAILURE = "failure";
  public static final String ATTR_ATTEMPT = "attempt";
  public static final String ATTR_LEAF_ID = "leafId";

  public EnumerationDiagnostic {
    Objects.requireNonNull(reason, "reason");
    message = message == null ? "" : message;
    attributes = (attributes == null || attributes.isEmpty()) ? Map.of() : Map.copyOf(attributes);
  }

  public static EnumerationDiagnostic malformedResult(
      int iteration, String source, String message, String assignment) {
    Map<String, Object> attributes = new LinkedHashMap<>();
    attributes.put(ATTR_SOURCE, source);
    if (assignment != null) {
      attributes.put(ATTR_ASSIGNMENT, assignment);
    }
    return new EnumerationDiagnostic(
        iteration, DiagnosticReason.MALFORMED_SOLVER_RESULT, message, attributes);
  }

  public static EnumerationDiagnostic processFailure(
      int iteration, int attempt, String failure, String message) {
    return new EnumerationDiagnostic(
        iteration,
        DiagnosticReason.SOLVER_PROCESS_FAILURE,
        message,
        Map.of(ATTR_ATTEMPT, attempt, ATTR_FAILURE, failure));
  }

  public static EnumerationDiagnostic localOnlyValidLeaf(long leafId, String assignment) {
    return new EnumerationDiagnostic(
        -1,
        DiagnosticReason.RECONCILIATION_MISMATCH,
        "valid coloring " + assignment + " was never reported by the solver",
        Map.of(ATTR_LEAF_ID, leafId, ATTR_ASSIGNMENT, assignment));
  }

  public static EnumerationDiagnostic solverOnlyAssignment(String assignment) {
    return new EnumerationDiagnostic(
        -1,
        DiagnosticReason.RECONCILIATION_MISMATCH,
        "solver coloring " + assignment + " has no matching valid leaf",
        Map.of(ATTR_ASSIGNMENT, assignment));
  }
}
