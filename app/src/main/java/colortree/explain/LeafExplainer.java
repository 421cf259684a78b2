package colortree.explain;

import colortree.core.model.LabelAssignment;
import colortree.core.model.TreeNode;
import colortree.core.model.ViolatedEdge;
import colortree.tree.SearchTree;
import java.util.ArrayList;
import java.util.List;

/** Builds {@link LeafExplanation}s for the leaves of a search tree. */
public final class LeafExplainer {

  private LeafExplainer() {}

  public static LeafExplanation explain(SearchTree tree, TreeNode leaf) {
    if (!leaf.isLeaf()) {
      throw new IllegalArgumentException("Only leaves can be explained: " + leaf);
    }
    LabelAssignment path = leaf.pathAssignment();
    List<LeafExplanation.NodeColor> coloring = new ArrayList<>(path.length());
    for (int node = 0; node < path.length(); node++) {
      int label = path.get(node);
      coloring.add(new LeafExplanation.NodeColor(node, label, ColorNames.nameOf(label)));
    }
    List<LeafExplanation.Conflict> conflicts = new ArrayList<>();
    for (ViolatedEdge violated : leaf.violatedEdges()) {
      conflicts.add(
          new LeafExplanation.Conflict(
              violated.u(), violated.v(), violated.label(), ColorNames.nameOf(violated.label())));
    }
    return new LeafExplanation(
        leaf.id(),
        leaf.isValidLeaf(),
        tree.provenanceOf(leaf).orElse(null),
        coloring,
        conflicts);
  }

  public static List<LeafExplanation> explainAll(SearchTree tree) {
    List<LeafExplanation> explanations = new ArrayList<>(tree.leafCount());
    for (TreeNode leaf : tree.leaves()) {
      explanations.add(explain(tree, leaf));
    }
    return explanations;
  }
}
