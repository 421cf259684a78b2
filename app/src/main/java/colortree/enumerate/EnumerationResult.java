package colortree.enumerate;

import colortree.core.ColoringException;
import colortree.core.diagnostics.EnumerationDiagnostic;
import colortree.core.model.ExclusionSet;
import colortree.tree.SearchTree;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/** Final outcome of one enumeration run, including the annotated tree. */
public record EnumerationResult(
    SearchTree tree,
    EnumerationState state,
    ReconciliationReport reconciliation,
    long elapsedMillis) {

  public EnumerationResult {
    Objects.requireNonNull(tree, "tree");
    Objects.requireNonNull(state, "state");
    Objects.requireNonNull(reconciliation, "reconciliation");
  }

  public ExclusionSet exclusions() {
    return state.exclusions();
  }

  public int iterations() {
    return state.iterations();
  }

  public TerminationReason termination() {
    return state.termination();
  }

  /** True only when enumeration reached a fixed point. */
  public boolean isComplete() {
    return state.termination().isExhaustive();
  }

  public boolean hasMismatch() {
    return !reconciliation.consistent();
  }

  /** Solver-side diagnostics followed by reconciliation mismatches. */
  public List<EnumerationDiagnostic> diagnostics() {
    List<EnumerationDiagnostic> all = new ArrayList<>(state.diagnostics());
    all.addAll(reconciliation.mismatches());
    return List.copyOf(all);
  }

  /** Throws when the solver and the local classification disagree. */
  public EnumerationResult requireConsistent() {
    if (hasMismatch()) {
      throw ColoringException.reconciliationMismatch(reconciliation.mismatches().size());
    }
    return this;
  }
}
