package colortree.core.model;

import java.util.Collection;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Insertion-ordered, duplicate-free set of complete assignments already reported by the solver.
 *
 * <p>Instances are immutable; {@link #plus(Collection)} returns a grown copy so a published set
 * never changes under a reader.
 */
public final class ExclusionSet implements Iterable<LabelAssignment> {
  private static final ExclusionSet EMPTY = new ExclusionSet(new LinkedHashSet<>());

  private final Set<LabelAssignment> members;

  private ExclusionSet(LinkedHashSet<LabelAssignment> members) {
    this.members = members;
  }

  public static ExclusionSet empty() {
    return EMPTY;
  }

  public ExclusionSet plus(Collection<LabelAssignment> assignments) {
    LinkedHashSet<LabelAssignment> grown = new LinkedHashSet<>(members);
    boolean changed = grown.addAll(assignments);
    return changed ? new ExclusionSet(grown) : this;
  }

  public boolean contains(LabelAssignment assignment) {
    return members.contains(assignment);
  }

  public int size() {
    return members.size();
  }

  public boolean isEmpty() {
    return members.isEmpty();
  }

  public List<LabelAssignment> asList() {
    return List.copyOf(members);
  }

  @Override
  public Iterator<LabelAssignment> iterator() {
    return asList().iterator();
  }

  @Override
  public String toString() {
    return "ExclusionSet" + members;
  }
}
