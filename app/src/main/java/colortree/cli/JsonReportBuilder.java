package colortree.cli;

import colortree.core.diagnostics.EnumerationDiagnostic;
import colortree.core.model.TreeNode;
import colortree.enumerate.EnumerationResult;
import colortree.layout.LayoutResult;
import colortree.tree.SearchTree;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

final class JsonReportBuilder {
  private static final String VERSION = "1.0.0";
  private final Gson gson = new GsonBuilder().setPrettyPrinting().create();

  String build(
      SearchTree tree, LayoutResult layout, EnumerationResult enumeration, long elapsedMillis) {
    Map<String, Object> root = new LinkedHashMap<>();
    root.put("meta", meta(tree, elapsedMillis));
    root.put("classification", classification(tree));
    root.put("valid_colorings", validColorings(tree));
    if (layout != null) {
      Map<String, Object> bounds = new LinkedHashMap<>();
      bounds.put("width", layout.width());
      bounds.put("height", layout.height());
      root.put("layout", bounds);
    }
    if (enumeration != null) {
      root.put("enumeration", enumeration(enumeration));
      if (!enumeration.diagnostics().isEmpty()) {
        root.put("diagnostics", diagnostics(enumeration.diagnostics()));
      }
    }
    return gson.toJson(root);
  }

  private Map<String, Object> meta(SearchTree tree, long elapsedMillis) {
    Map<String, Object> meta = new LinkedHashMap<>();
    meta.put("version", VERSION);
    meta.put("time_ms", elapsedMillis);
    meta.put("node_count", tree.depth());
    meta.put("edge_count", tree.graph().edgeCount());
    meta.put("label_count", tree.labelCount());
    meta.put("tree_nodes", tree.nodeCount());
    return meta;
  }

  private Map<String, Object> classification(SearchTree tree) {
    int valid = tree.validLeaves().size();
    Map<String, Object> classification = new LinkedHashMap<>();
    classification.put("leaves", tree.leafCount());
    classification.put("valid", valid);
    classification.put("invalid", tree.leafCount() - valid);
    return classification;
  }

  private List<Map<String, Object>> validColorings(SearchTree tree) {
    List<Map<String, Object>> list = new ArrayList<>();
    for (TreeNode leaf : tree.validLeaves()) {
      Map<String, Object> entry = new LinkedHashMap<>();
      entry.put("leaf", leaf.id());
      entry.put("coloring", leaf.pathAssignment().toList());
      tree.provenanceOf(leaf)
          .ifPresent(p -> entry.put("provenance", p.name().toLowerCase(Locale.ROOT)));
      list.add(entry);
    }
    return list;
  }

  private Map<String, Object> enumeration(EnumerationResult result) {
    Map<String, Object> map = new LinkedHashMap<>();
    map.put("termination", result.termination().name().toLowerCase(Locale.ROOT));
    map.put("complete", result.isComplete());
    map.put("iterations", result.iterations());
    map.put("solver_colorings", result.exclusions().size());
    map.put("confirmed", result.reconciliation().confirmed());
    map.put("local_only", result.reconciliation().localOnly());
    map.put("consistent", result.reconciliation().consistent());
    map.put("time_ms", result.elapsedMillis());
    return map;
  }

  private List<Map<String, Object>> diagnostics(List<EnumerationDiagnostic> diagnostics) {
    List<Map<String, Object>> list = new ArrayList<>();
    for (EnumerationDiagnostic diagnostic : diagnostics) {
      Map<String, Object> entry = new LinkedHashMap<>();
      entry.put("reason", diagnostic.reason().name().toLowerCase(Locale.ROOT));
      if (diagnostic.iteration() > 0) {
        entry.put("iteration", diagnostic.iteration());
      }
      entry.put("message", diagnostic.message());
      if (!diagnostic.attributes().isEmpty()) {
        entry.put("attributes", diagnostic.attributes());
      }
      list.add(entry);
    }
    return list;
  }
}
