package colortree.explain;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

import colortree.core.model.Graph;
import colortree.core.model.LabelAssignment;
import colortree.core.model.Provenance;
import colortree.core.model.TreeNode;
import colortree.tree.SearchTree;
import colortree.tree.TreeBuilder;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;

final class LeafExplainerTest {
  private final SearchTree tree =
      new TreeBuilder()
          .build(Graph.fromPairs(3, List.of(new int[] {0, 1}, new int[] {1, 2})), 3);

  @Test
  void invalidLeafListsEveryConflict() {
    TreeNode leaf = tree.leafFor(LabelAssignment.of(0, 0, 0)).orElseThrow();
    LeafExplanation explanation = LeafExplainer.explain(tree, leaf);

    assertEquals(2, explanation.conflicts().size());
    assertNull(explanation.provenance());
    assertEquals(
        "Invalid: node 0 and node 1 are both RED; node 1 and node 2 are both RED",
        explanation.summary());
  }

  @Test
  void validLeafNamesEveryColor() {
    TreeNode leaf = tree.leafFor(LabelAssignment.of(2, 1, 0)).orElseThrow();
    LeafExplanation explanation = LeafExplainer.explain(tree, leaf);

    assertEquals("Valid: node 0=GREEN node 1=BLUE node 2=RED", explanation.summary());
    assertEquals(Provenance.LOCAL_ONLY, explanation.provenance());

    tree.publishConfirmed(Set.of(leaf.id()));
    assertEquals(Provenance.SOLVER_CONFIRMED, LeafExplainer.explain(tree, leaf).provenance());
  }

  @Test
  void explainsOnlyLeaves() {
    assertThrows(IllegalArgumentException.class, () -> LeafExplainer.explain(tree, tree.root()));
    assertEquals(tree.leafCount(), LeafExplainer.explainAll(tree).size());
  }

  @Test
  void labelsPastThePaletteGetGenericNames() {
    assertEquals("RED", ColorNames.nameOf(0));
    assertEquals("PINK", ColorNames.nameOf(9));
    assertEquals("COLOR_10", ColorNames.nameOf(10));
  }
}
