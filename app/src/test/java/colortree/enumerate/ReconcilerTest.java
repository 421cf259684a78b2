package colortree.enumerate;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import colortree.core.diagnostics.DiagnosticReason;
import colortree.core.diagnostics.EnumerationDiagnostic;
import colortree.core.model.Graph;
import colortree.core.model.LabelAssignment;
import colortree.tree.SearchTree;
import colortree.tree.TreeBuilder;
import java.util.List;
import org.junit.jupiter.api.Test;

final class ReconcilerTest {
  private final SearchTree tree =
      new TreeBuilder().build(Graph.fromPairs(2, List.<int[]>of(new int[] {0, 1})), 2);

  @Test
  void coloringWithoutAValidLeafIsAMismatch() {
    EnumerationState state =
        EnumerationState.initial()
            .advance(List.of(LabelAssignment.of(0, 1), LabelAssignment.of(1, 1)), List.of())
            .terminate(TerminationReason.ITERATION_BUDGET_EXCEEDED);

    ReconciliationReport report = new Reconciler().reconcile(tree, state);

    assertFalse(report.consistent());
    assertFalse(report.checked());
    assertEquals(1, report.confirmed());
    assertEquals(1, report.localOnly());
    EnumerationDiagnostic mismatch = report.mismatches().get(0);
    assertEquals(DiagnosticReason.RECONCILIATION_MISMATCH, mismatch.reason());
    assertEquals("(1, 1)", mismatch.attributes().get(EnumerationDiagnostic.ATTR_ASSIGNMENT));
  }

  @Test
  void localOnlyLeavesCountOnlyAfterAnExhaustiveRun() {
    EnumerationState partial =
        EnumerationState.initial().advance(List.of(LabelAssignment.of(1, 0)), List.of());

    assertTrue(
        new Reconciler()
            .reconcile(tree, partial.terminate(TerminationReason.CANCELLED))
            .consistent());

    ReconciliationReport exhaustive =
        new Reconciler().reconcile(tree, partial.terminate(TerminationReason.FIXED_POINT));
    assertTrue(exhaustive.checked());
    assertEquals(1, exhaustive.mismatches().size());
    assertEquals(1L, tree.confirmedCount());
  }
}
