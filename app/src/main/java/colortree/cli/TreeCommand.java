package colortree.cli;

import colortree.core.model.Graph;
import colortree.explain.LeafExplainer;
import colortree.layout.LayoutResult;
import colortree.layout.TreeLayout;
import colortree.tree.SearchTree;
import colortree.tree.TreeBuilder;
import colortree.util.Timing;
import colortree.util.TreeExporter;
import java.io.IOException;
import java.nio.file.Files;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Handles the `tree` command: build, classify and lay out the tree without the solver. */
final class TreeCommand {
  private static final Logger LOG = LoggerFactory.getLogger(TreeCommand.class);
  static final int DEFAULT_COLORS = 3;

  int execute(String[] args) throws IOException {
    CliOptions options = CliParsers.parse(args);
    CliParsers.GraphInput input = CliParsers.loadGraph(options);
    Graph graph = input.graph();
    int colors = CliParsers.resolveColors(options, input, DEFAULT_COLORS);

    Timing timer = Timing.start();
    SearchTree tree = new TreeBuilder(options.coloring()).build(graph, colors);
    LayoutResult layout = new TreeLayout(options.coloring()).layout(tree);

    int valid = tree.validLeaves().size();
    LOG.info("Leaves: {} ({} valid, {} invalid)", tree.leafCount(), valid, tree.leafCount() - valid);
    tree.validLeaves().stream()
        .limit(20)
        .forEach(leaf -> LOG.info("  {}", LeafExplainer.explain(tree, leaf).summary()));
    if (valid > 20) {
      LOG.info("  ... {} more", valid - 20);
    }

    if (options.output() != null) {
      Files.writeString(
          options.output(),
          new JsonReportBuilder().build(tree, layout, null, timer.elapsedMillis()));
      LOG.info("Report written to {}", options.output());
    }
    if (options.exportDir() != null) {
      TreeExporter.export(options.exportDir(), tree, layout, null);
      LOG.info("Tree exported to {}", options.exportDir());
    }
    return Main.EXIT_OK;
  }
}
