package colortree.util;

import colortree.core.model.LabelAssignment;
import colortree.core.model.TreeNode;
import colortree.enumerate.EnumerationResult;
import colortree.explain.LeafExplainer;
import colortree.explain.LeafExplanation;
import colortree.layout.LayoutResult;
import colortree.layout.Point;
import colortree.tree.SearchTree;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Writes the laid-out tree, per-leaf explanations and solver colorings as JSON for an external
 * viewer. Files are staged in a sibling temporary directory and moved into place at the end, so
 * the target directory is either fully written or left untouched.
 */
public final class TreeExporter {
  private static final Gson GSON = new GsonBuilder().setPrettyPrinting().create();

  private TreeExporter() {}

  public static void export(
      Path baseDir, SearchTree tree, LayoutResult layout, EnumerationResult enumeration)
      throws IOException {
    if (baseDir == null) {
      return;
    }
    Path targetDir = baseDir.toAbsolutePath().normalize();
    Path parent = targetDir.getParent();
    if (parent == null) {
      parent = targetDir;
    }
    Files.createDirectories(parent);
    String prefix =
        targetDir.getFileName() != null ? targetDir.getFileName().toString() + "-" : "tree-";
    Path tempDir = Files.createTempDirectory(parent, prefix);
    boolean success = false;
    try {
      Files.writeString(tempDir.resolve("tree.json"), GSON.toJson(treePayload(tree, layout)));
      Files.writeString(
          tempDir.resolve("explanations.json"), GSON.toJson(explanationPayload(tree)));
      if (enumeration != null) {
        Files.writeString(
            tempDir.resolve("colorings.json"), GSON.toJson(coloringPayload(enumeration)));
      }
      PathUtils.moveIntoPlace(tempDir, targetDir);
      success = true;
    } finally {
      if (!success) {
        PathUtils.deleteRecursively(tempDir);
      }
    }
  }

  private static Map<String, Object> treePayload(SearchTree tree, LayoutResult layout) {
    Map<String, Object> root = new LinkedHashMap<>();
    root.put("nodes", tree.depth());
    root.put("labels", tree.labelCount());
    root.put("edges", tree.graph().edges().stream().map(e -> List.of(e.u(), e.v())).toList());
    List<Map<String, Object>> nodes = new ArrayList<>();
    tree.forEachNode(
        node -> {
          Map<String, Object> entry = new LinkedHashMap<>();
          entry.put("id", node.id());
          entry.put("depth", node.depth());
          entry.put("kind", node.kind().name().toLowerCase(Locale.ROOT));
          entry.put("path", node.pathAssignment().toList());
          if (layout != null) {
            Point point = layout.positionOf(node);
            entry.put("x", point.x());
            entry.put("y", point.y());
          }
          if (!node.children().isEmpty()) {
            entry.put("children", node.children().stream().map(TreeNode::id).toList());
          }
          tree.provenanceOf(node)
              .ifPresent(p -> entry.put("provenance", p.name().toLowerCase(Locale.ROOT)));
          nodes.add(entry);
        });
    root.put("tree", nodes);
    return root;
  }

  private static List<Map<String, Object>> explanationPayload(SearchTree tree) {
    List<Map<String, Object>> list = new ArrayList<>();
    for (LeafExplanation explanation : LeafExplainer.explainAll(tree)) {
      Map<String, Object> entry = new LinkedHashMap<>();
      entry.put("leaf", explanation.leafId());
      entry.put("valid", explanation.valid());
      entry.put("summary", explanation.summary());
      entry.put("coloring", explanation.coloring());
      if (!explanation.conflicts().isEmpty()) {
        entry.put("conflicts", explanation.conflicts());
      }
      list.add(entry);
    }
    return list;
  }

  private static Map<String, Object> coloringPayload(EnumerationResult enumeration) {
    Map<String, Object> payload = new LinkedHashMap<>();
    payload.put("termination", enumeration.termination().name().toLowerCase(Locale.ROOT));
    payload.put("complete", enumeration.isComplete());
    payload.put("iterations", enumeration.iterations());
    List<List<Integer>> colorings = new ArrayList<>();
    for (LabelAssignment coloring : enumeration.exclusions()) {
      colorings.add(coloring.toList());
    }
    payload.put("colorings", colorings);
    return payload;
  }
}
