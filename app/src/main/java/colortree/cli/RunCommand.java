package colortree.cli;

import colortree.core.model.Graph;
import colortree.core.model.LabelAssignment;
import colortree.enumerate.AsyncEnumeration;
import colortree.enumerate.EnumerationDriver;
import colortree.enumerate.EnumerationListener;
import colortree.enumerate.EnumerationResult;
import colortree.layout.LayoutResult;
import colortree.layout.TreeLayout;
import colortree.solver.KleeSettings;
import colortree.solver.KleeSolverOracle;
import colortree.tree.SearchTree;
import colortree.tree.TreeBuilder;
import colortree.util.Timing;
import colortree.util.TreeExporter;
import java.io.IOException;
import java.nio.file.Files;
import java.util.concurrent.ExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Handles the primary `run` command: build the tree, enumerate with KLEE, reconcile. */
final class RunCommand {
  private static final Logger LOG = LoggerFactory.getLogger(RunCommand.class);

  int execute(String[] args) throws IOException {
    CliOptions options = CliParsers.parse(args);
    CliParsers.GraphInput input = CliParsers.loadGraph(options);
    Graph graph = input.graph();
    int colors = CliParsers.resolveColors(options, input, TreeCommand.DEFAULT_COLORS);

    Timing timer = Timing.start();
    SearchTree tree = new TreeBuilder(options.coloring()).build(graph, colors);
    LayoutResult layout = new TreeLayout(options.coloring()).layout(tree);

    KleeSettings settings = KleeSettings.defaults().withIncludeDir(options.kleeInclude());
    EnumerationDriver driver =
        new EnumerationDriver(new KleeSolverOracle(settings), options.coloring());
    EnumerationListener listener =
        new EnumerationListener() {
          @Override
          public void onColoringFound(LabelAssignment coloring, int iteration) {
            LOG.info("Found coloring {} (iteration {})", coloring, iteration);
          }
        };

    EnumerationResult result;
    try (AsyncEnumeration run = AsyncEnumeration.start(driver, graph, colors, tree, listener)) {
      Runtime.getRuntime().addShutdownHook(new Thread(run::cancel, "colortree-cancel"));
      result = run.result().get();
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      LOG.warn("Interrupted while waiting for enumeration");
      return Main.EXIT_FAILURE;
    } catch (ExecutionException ex) {
      Throwable cause = ex.getCause() != null ? ex.getCause() : ex;
      LOG.error("Enumeration failed: {}", cause.getMessage(), cause);
      return Main.EXIT_FAILURE;
    }

    logSummary(tree, result);
    if (options.output() != null) {
      Files.writeString(
          options.output(),
          new JsonReportBuilder().build(tree, layout, result, timer.elapsedMillis()));
      LOG.info("Report written to {}", options.output());
    }
    if (options.exportDir() != null) {
      TreeExporter.export(options.exportDir(), tree, layout, result);
      LOG.info("Tree exported to {}", options.exportDir());
    }

    if (result.hasMismatch()) {
      return Main.EXIT_MISMATCH;
    }
    return result.isComplete() ? Main.EXIT_OK : Main.EXIT_INCOMPLETE;
  }

  private void logSummary(SearchTree tree, EnumerationResult result) {
    int valid = tree.validLeaves().size();
    LOG.info("Tree: {} nodes, {} leaves, {} valid", tree.nodeCount(), tree.leafCount(), valid);
    LOG.info(
        "Solver: {} coloring(s) in {} iteration(s), termination {}",
        result.exclusions().size(),
        result.iterations(),
        result.termination());
    if (!result.isComplete()) {
      LOG.warn("Enumeration incomplete: solver results cover only part of the valid colorings");
    }
    LOG.info(
        "Provenance: {} solver-confirmed, {} local-only",
        result.reconciliation().confirmed(),
        result.reconciliation().localOnly());
  }
}
