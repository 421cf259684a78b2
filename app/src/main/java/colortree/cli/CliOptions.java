package colortree.cli;

import colortree.core.ColoringOptions;
import java.nio.file.Path;

record CliOptions(
    Integer nodes,
    String edges,
    Integer colors,
    Path graphFile,
    ColoringOptions coloring,
    Path kleeInclude,
    Path output,
    Path exportDir,
    Path save) {

  CliOptions {
    coloring = ColoringOptions.normalize(coloring);
    if (colors != null && colors < 1) {
      throw new IllegalArgumentException("--colors must be at least 1");
    }
  }

  boolean hasGraphFile() {
    return graphFile != null;
  }

  static Builder builder() {
    return new Builder();
  }

  static final class Builder {
    private Integer nodes;
    private String edges;
    private Integer colors;
    private Path graphFile;
    private long maxLeaves = ColoringOptions.defaults().maxLeaves();
    private int maxIterations = ColoringOptions.defaults().maxIterations();
    private long solverTimeoutMs = ColoringOptions.defaults().solverTimeoutMs();
    private int retries = ColoringOptions.defaults().solverRetries();
    private long timeBudgetMs = ColoringOptions.defaults().timeBudgetMs();
    private Path kleeInclude;
    private Path output;
    private Path exportDir;
    private Path save;

    Builder nodes(int nodes) {
      this.nodes = nodes;
      return this;
    }

    Builder edges(String edges) {
      this.edges = edges;
      return this;
    }

    Builder colors(int colors) {
      this.colors = colors;
      return this;
    }

    Builder graphFile(Path graphFile) {
      this.graphFile = graphFile;
      return this;
    }

    Builder maxLeaves(long maxLeaves) {
      this.maxLeaves = maxLeaves;
      return this;
    }

    Builder maxIterations(int maxIterations) {
      this.maxIterations = maxIterations;
      return this;
    }

    Builder solverTimeoutMs(long solverTimeoutMs) {
      this.solverTimeoutMs = solverTimeoutMs;
      return this;
    }

    Builder retries(int retries) {
      this.retries = retries;
      return this;
    }

    Builder timeBudgetMs(long timeBudgetMs) {
      this.timeBudgetMs = timeBudgetMs;
      return this;
    }

    Builder kleeInclude(Path kleeInclude) {
      this.kleeInclude = kleeInclude;
      return this;
    }

    Builder output(Path output) {
      this.output = output;
      return this;
    }

    Builder exportDir(Path exportDir) {
      this.exportDir = exportDir;
      return this;
    }

    Builder save(Path save) {
      this.save = save;
      return this;
    }

    CliOptions build() {
      if (graphFile != null && (nodes != null || edges != null)) {
        throw new IllegalArgumentException("Provide either --graph or --nodes/--edges, not both");
      }
      if (graphFile == null && nodes == null) {
        throw new IllegalArgumentException("Provide --graph or --nodes");
      }
      ColoringOptions defaults = ColoringOptions.defaults();
      ColoringOptions coloring =
          new ColoringOptions(
              maxLeaves,
              maxIterations,
              solverTimeoutMs,
              retries,
              timeBudgetMs,
              defaults.horizontalGap(),
              defaults.levelHeight(),
              defaults.topMargin());
      return new CliOptions(
          nodes, edges, colors, graphFile, coloring, kleeInclude, output, exportDir, save);
    }
  }
}
