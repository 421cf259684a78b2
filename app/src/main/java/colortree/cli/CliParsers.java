package colortree.cli;

import colortree.core.model.Graph;
import com.google.common.base.Splitter;
import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Shared helpers for CLI argument parsing and graph loading. */
final class CliParsers {
  private static final Splitter EDGE_LIST = Splitter.on(',').trimResults().omitEmptyStrings();
  private static final Splitter ENDPOINTS = Splitter.on('-').trimResults();
  private static final Gson GSON = new Gson();

  private CliParsers() {}

  /** Graph plus the label count read from a graph file, when it declares one. */
  record GraphInput(Graph graph, Integer colors) {}

  /** Shape of a {@code --graph} JSON file: {@code {"nodes": 3, "edges": [[0,1]], "colors": 3}}. */
  private static final class GraphFile {
    Integer nodes;
    List<List<Integer>> edges;
    Integer colors;
  }

  static CliOptions parse(String[] args) {
    CliOptions.Builder builder = CliOptions.builder();
    Map<String, OptionSpec> specs = optionSpecs();
    for (int i = 0; i < args.length; i++) {
      ParsedArg parsed = ParsedArg.parse(args[i]);
      OptionSpec spec = specs.get(parsed.option());
      if (spec == null) {
        throw new IllegalArgumentException("Unknown option: " + args[i]);
      }
      String value = parsed.value();
      if (spec.requiresValue() && (value == null || value.isBlank())) {
        if (i + 1 >= args.length) {
          throw new IllegalArgumentException("Missing value for " + parsed.option());
        }
        value = args[++i];
      }
      spec.apply(builder, value);
    }
    return builder.build();
  }

  private static Map<String, OptionSpec> optionSpecs() {
    Map<String, OptionSpec> specs = new LinkedHashMap<>();
    specs.put("--nodes", OptionSpec.withValue((b, raw) -> b.nodes(parseInt(raw, "--nodes"))));
    specs.put("--edges", OptionSpec.withValue(CliOptions.Builder::edges));
    specs.put("--colors", OptionSpec.withValue((b, raw) -> b.colors(parseInt(raw, "--colors"))));
    specs.put("--graph", OptionSpec.withValue((b, raw) -> b.graphFile(Path.of(raw))));
    specs.put(
        "--max-leaves",
        OptionSpec.withValue((b, raw) -> b.maxLeaves(parseLong(raw, "--max-leaves"))));
    specs.put(
        "--max-iterations",
        OptionSpec.withValue((b, raw) -> b.maxIterations(parseInt(raw, "--max-iterations"))));
    specs.put(
        "--solver-timeout-ms",
        OptionSpec.withValue(
            (b, raw) -> b.solverTimeoutMs(parseLong(raw, "--solver-timeout-ms"))));
    specs.put("--retries", OptionSpec.withValue((b, raw) -> b.retries(parseInt(raw, "--retries"))));
    specs.put(
        "--time-budget-ms",
        OptionSpec.withValue((b, raw) -> b.timeBudgetMs(parseLong(raw, "--time-budget-ms"))));
    specs.put("--klee-include", OptionSpec.withValue((b, raw) -> b.kleeInclude(Path.of(raw))));
    specs.put("--output", OptionSpec.withValue((b, raw) -> b.output(Path.of(raw))));
    specs.put("--export-dir", OptionSpec.withValue((b, raw) -> b.exportDir(Path.of(raw))));
    specs.put("--save", OptionSpec.withValue((b, raw) -> b.save(Path.of(raw))));
    return specs;
  }

  static int parseInt(String raw, String optionName) {
    try {
      return Integer.parseInt(raw.trim());
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException("Invalid integer for " + optionName + ": " + raw);
    }
  }

  static long parseLong(String raw, String optionName) {
    try {
      return Long.parseLong(raw.trim());
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException("Invalid long for " + optionName + ": " + raw);
    }
  }

  /** Parses {@code "0-1, 1-2"} into endpoint pairs. */
  static List<int[]> parseEdges(String raw) {
    List<int[]> pairs = new ArrayList<>();
    if (raw == null) {
      return pairs;
    }
    for (String token : EDGE_LIST.split(raw)) {
      List<String> ends = ENDPOINTS.splitToList(token);
      if (ends.size() != 2) {
        throw new IllegalArgumentException("Invalid edge '" + token + "', expected u-v");
      }
      pairs.add(new int[] {parseInt(ends.get(0), "--edges"), parseInt(ends.get(1), "--edges")});
    }
    return pairs;
  }

  static GraphInput loadGraph(CliOptions options) throws IOException {
    if (!options.hasGraphFile()) {
      return new GraphInput(Graph.fromPairs(options.nodes(), parseEdges(options.edges())), null);
    }
    Path path = options.graphFile();
    if (!Files.exists(path)) {
      throw new IllegalArgumentException("Graph file not found: " + path);
    }
    GraphFile file;
    try {
      file = GSON.fromJson(Files.readString(path), GraphFile.class);
    } catch (JsonParseException ex) {
      throw new IllegalArgumentException("Graph file " + path + " is not valid JSON: " + ex.getMessage());
    }
    if (file == null || file.nodes == null) {
      throw new IllegalArgumentException("Graph file " + path + " must declare \"nodes\"");
    }
    List<int[]> pairs = new ArrayList<>();
    if (file.edges != null) {
      for (List<Integer> edge : file.edges) {
        if (edge == null || edge.size() != 2 || edge.contains(null)) {
          throw new IllegalArgumentException("Graph file edge must be a [u, v] pair: " + edge);
        }
        pairs.add(new int[] {edge.get(0), edge.get(1)});
      }
    }
    return new GraphInput(Graph.fromPairs(file.nodes, pairs), file.colors);
  }

  /** Label count from {@code --colors}, else from the graph file, else {@code fallback}. */
  static int resolveColors(CliOptions options, GraphInput input, int fallback) {
    if (options.colors() != null) {
      return options.colors();
    }
    if (input.colors() != null) {
      return input.colors();
    }
    return fallback;
  }

  private record ParsedArg(String option, String value) {
    static ParsedArg parse(String raw) {
      if (raw == null || raw.isBlank()) {
        throw new IllegalArgumentException("Unknown option: " + raw);
      }
      if (raw.startsWith("--")) {
        int equalsIndex = raw.indexOf('=');
        if (equalsIndex > 0) {
          String option = raw.substring(0, equalsIndex);
          String value = raw.substring(equalsIndex + 1);
          return new ParsedArg(option, value.isEmpty() ? null : value);
        }
      }
      return new ParsedArg(raw, null);
    }
  }
}
