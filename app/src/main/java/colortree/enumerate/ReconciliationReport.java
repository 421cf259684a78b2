package colortree.enumerate;

import colortree.core.diagnostics.EnumerationDiagnostic;
import java.util.List;

/**
 * Outcome of comparing solver colorings with the locally classified tree.
 *
 * @param confirmed valid leaves the solver reported
 * @param localOnly valid leaves the solver never reported
 * @param checked whether {@code localOnly} leaves count as mismatches (only after a fixed point)
 * @param mismatches one entry per inconsistency found
 */
public record ReconciliationReport(
    int confirmed, int localOnly, boolean checked, List<EnumerationDiagnostic> mismatches) {

  public ReconciliationReport {
    mismatches = List.copyOf(mismatches);
  }

  public boolean consistent() {
    return mismatches.isEmpty();
  }
}
