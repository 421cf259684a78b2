package colortree.layout;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import colortree.core.ColoringException;
import colortree.core.ColoringOptions;
import colortree.core.ErrorKind;
import colortree.core.model.Graph;
import colortree.core.model.TreeNode;
import colortree.tree.SearchTree;
import colortree.tree.TreeBuilder;
import java.util.List;
import org.junit.jupiter.api.Test;

final class TreeLayoutTest {
  private static final double EPS = 1e-9;

  private static SearchTree tree(int n, int k) {
    return new TreeBuilder().build(Graph.fromPairs(n, List.<int[]>of(new int[] {0, 1})), k);
  }

  @Test
  void siblingSpansDoNotOverlapAndParentsAreCentred() {
    SearchTree tree = tree(3, 3);
    LayoutResult layout = new TreeLayout().layout(tree);

    tree.forEachNode(
        node -> {
          List<TreeNode> children = node.children();
          for (int i = 1; i < children.size(); i++) {
            TreeNode previous = children.get(i - 1);
            TreeNode current = children.get(i);
            assertTrue(layout.spanRight(previous) <= layout.spanLeft(current) + EPS);
            assertTrue(layout.positionOf(previous).x() < layout.positionOf(current).x());
          }
          if (!children.isEmpty()) {
            double x = layout.positionOf(node).x();
            double minChild = layout.positionOf(children.get(0)).x();
            double maxChild = layout.positionOf(children.get(children.size() - 1)).x();
            assertTrue(minChild - EPS <= x && x <= maxChild + EPS, "parent outside children");
          }
        });
  }

  @Test
  void rootIsCentredAndLevelsAreEvenlySpaced() {
    SearchTree tree = tree(2, 2);
    LayoutResult layout = new TreeLayout().layout(tree);

    assertEquals(0.0, layout.positionOf(tree.root()).x(), EPS);
    assertEquals(0.0, layout.positionOf(tree.root()).y(), EPS);
    for (TreeNode leaf : tree.leaves()) {
      assertEquals(140.0, layout.positionOf(leaf).y(), EPS);
    }
    assertEquals(-75.0, layout.positionOf(tree.leaves().get(0)).x(), EPS);
    assertEquals(75.0, layout.positionOf(tree.leaves().get(3)).x(), EPS);
    assertEquals(tree.nodeCount(), layout.size());
  }

  @Test
  void layoutIsDeterministic() {
    SearchTree tree = tree(3, 2);
    LayoutResult first = new TreeLayout().layout(tree);
    LayoutResult second = new TreeLayout().layout(tree);

    for (long id = 0; id < tree.nodeCount(); id++) {
      assertEquals(first.positionOf(id), second.positionOf(id));
    }
  }

  @Test
  void refusesLayoutsAboveTheCeiling() {
    SearchTree tree = tree(3, 3);
    TreeLayout small = new TreeLayout(ColoringOptions.defaults().withMaxLeaves(10));

    ColoringException ex = assertThrows(ColoringException.class, () -> small.layout(tree));
    assertEquals(ErrorKind.LAYOUT_TOO_LARGE, ex.kind());
  }
}
