package colortree.enumerate;

import colortree.core.diagnostics.EnumerationDiagnostic;
import colortree.core.model.LabelAssignment;
import colortree.core.model.TreeNode;
import colortree.tree.SearchTree;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Annotates valid leaves with their provenance and checks that local classification and solver
 * enumeration agree.
 *
 * <p>Local edge checking is sound and complete, so after a fixed point every valid leaf must have
 * been reported by the solver. A valid leaf that was not is a mismatch, as is a solver coloring
 * with no valid leaf.
 */
public final class Reconciler {
  private static final Logger LOG = LoggerFactory.getLogger(Reconciler.class);

  public ReconciliationReport reconcile(SearchTree tree, EnumerationState state) {
    List<EnumerationDiagnostic> mismatches = new ArrayList<>();
    Set<Long> confirmed = new HashSet<>();
    for (LabelAssignment coloring : state.exclusions()) {
      Optional<TreeNode> leaf = tree.leafFor(coloring);
      if (leaf.isPresent() && leaf.get().isValidLeaf()) {
        confirmed.add(leaf.get().id());
      } else {
        mismatches.add(EnumerationDiagnostic.solverOnlyAssignment(coloring.toString()));
      }
    }
    tree.publishConfirmed(confirmed);

    List<TreeNode> validLeaves = tree.validLeaves();
    int localOnly = validLeaves.size() - confirmed.size();
    boolean checked = state.termination() != null && state.termination().isExhaustive();
    if (checked) {
      for (TreeNode leaf : validLeaves) {
        if (!confirmed.contains(leaf.id())) {
          mismatches.add(
              EnumerationDiagnostic.localOnlyValidLeaf(
                  leaf.id(), leaf.pathAssignment().toString()));
        }
      }
    }

    if (!mismatches.isEmpty()) {
      LOG.error(
          "Reconciliation mismatch: {} inconsistenc{} between solver and local classification",
          mismatches.size(),
          mismatches.size() == 1 ? "y" : "ies");
      for (EnumerationDiagnostic mismatch : mismatches) {
        LOG.error("  {}", mismatch.message());
      }
    } else {
      LOG.info(
          "Reconciled {} valid coloring(s): {} solver-confirmed, {} local-only",
          validLeaves.size(),
          confirmed.size(),
          localOnly);
    }
    return new ReconciliationReport(confirmed.size(), localOnly, checked, mismatches);
  }
}
