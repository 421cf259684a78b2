package colortree.core.model;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;

final class ExclusionSetTest {

  @Test
  void growsWithoutMutatingEarlierSnapshots() {
    ExclusionSet first = ExclusionSet.empty().plus(List.of(LabelAssignment.of(0, 1)));
    ExclusionSet second =
        first.plus(List.of(LabelAssignment.of(1, 0), LabelAssignment.of(0, 1)));

    assertEquals(1, first.size());
    assertEquals(2, second.size());
    assertFalse(first.contains(LabelAssignment.of(1, 0)));
    assertTrue(second.contains(LabelAssignment.of(1, 0)));
    assertEquals(List.of(LabelAssignment.of(0, 1), LabelAssignment.of(1, 0)), second.asList());
  }

  @Test
  void addingOnlyKnownAssignmentsKeepsTheSameInstance() {
    ExclusionSet set = ExclusionSet.empty().plus(List.of(LabelAssignment.of(2, 1, 0)));

    assertSame(set, set.plus(List.of(LabelAssignment.of(2, 1, 0))));
    assertTrue(ExclusionSet.empty().isEmpty());
  }

  @Test
  void assignmentsCompareByValue() {
    LabelAssignment built = LabelAssignment.empty().append(1).append(2);

    assertEquals(LabelAssignment.of(1, 2), built);
    assertEquals("(1, 2)", built.toString());
    assertTrue(built.withinDomain(3));
    assertFalse(built.withinDomain(2));
  }
}
