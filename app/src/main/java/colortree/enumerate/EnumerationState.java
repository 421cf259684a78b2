package colortree.enumerate;

import colortree.core.diagnostics.EnumerationDiagnostic;
import colortree.core.model.ExclusionSet;
import colortree.core.model.LabelAssignment;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * Immutable snapshot of an enumeration: the colorings excluded so far, the number of solver
 * invocations, and, once stopped, why.
 */
public record EnumerationState(
    ExclusionSet exclusions,
    int iterations,
    TerminationReason termination,
    List<EnumerationDiagnostic> diagnostics) {

  public EnumerationState {
    Objects.requireNonNull(exclusions, "exclusions");
    diagnostics = List.copyOf(diagnostics);
  }

  public static EnumerationState initial() {
    return new EnumerationState(ExclusionSet.empty(), 0, null, List.of());
  }

  /** Records one finished solver invocation and the new colorings it produced. */
  EnumerationState advance(
      Collection<LabelAssignment> found, Collection<EnumerationDiagnostic> newDiagnostics) {
    return new EnumerationState(
        exclusions.plus(found), iterations + 1, null, concat(newDiagnostics));
  }

  EnumerationState withDiagnostics(Collection<EnumerationDiagnostic> newDiagnostics) {
    return new EnumerationState(exclusions, iterations, termination, concat(newDiagnostics));
  }

  EnumerationState terminate(TerminationReason reason) {
    return new EnumerationState(exclusions, iterations, Objects.requireNonNull(reason), diagnostics);
  }

  public boolean isTerminated() {
    return termination != null;
  }

  private List<EnumerationDiagnostic> concat(Collection<EnumerationDiagnostic> more) {
    if (more.isEmpty()) {
      return diagnostics;
    }
    List<EnumerationDiagnostic> all = new ArrayList<>(diagnostics);
    all.addAll(more);
    return all;
  }
}
