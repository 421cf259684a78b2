package colortree.cli;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import colortree.core.model.Edge;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

final class CliParsersTest {

  @Test
  void parsesInlineGraphAndBudgets() throws IOException {
    CliOptions options =
        CliParsers.parse(
            new String[] {
              "--nodes", "3", "--edges=0-1, 1-2", "--colors", "2", "--max-iterations=5",
              "--retries", "0", "--time-budget-ms", "2500"
            });

    assertEquals(3, options.nodes());
    assertEquals(2, options.colors());
    assertEquals(5, options.coloring().maxIterations());
    assertEquals(0, options.coloring().solverRetries());
    assertEquals(2500L, options.coloring().timeBudgetMs());

    CliParsers.GraphInput input = CliParsers.loadGraph(options);
    assertEquals(List.of(Edge.of(0, 1), Edge.of(1, 2)), input.graph().edges());
    assertEquals(2, CliParsers.resolveColors(options, input, 3));
  }

  @Test
  void parsesEdgeLists() {
    List<int[]> edges = CliParsers.parseEdges(" 0-1,,2 - 3 ");

    assertEquals(2, edges.size());
    assertArrayEquals(new int[] {2, 3}, edges.get(1));
    assertTrue(CliParsers.parseEdges(null).isEmpty());
    assertThrows(IllegalArgumentException.class, () -> CliParsers.parseEdges("0-1-2"));
    assertThrows(IllegalArgumentException.class, () -> CliParsers.parseEdges("a-b"));
  }

  @Test
  void readsGraphFiles(@TempDir Path temp) throws IOException {
    Path file = temp.resolve("graph.json");
    Files.writeString(file, "{\"nodes\": 3, \"edges\": [[0, 1], [0, 2]], \"colors\": 4}");
    CliOptions options = CliParsers.parse(new String[] {"--graph", file.toString()});

    CliParsers.GraphInput input = CliParsers.loadGraph(options);

    assertEquals(3, input.graph().nodeCount());
    assertEquals(2, input.graph().edgeCount());
    assertEquals(4, CliParsers.resolveColors(options, input, 3));
  }

  @Test
  void fallsBackToDefaultColors() throws IOException {
    CliOptions options = CliParsers.parse(new String[] {"--nodes", "2"});
    CliParsers.GraphInput input = CliParsers.loadGraph(options);

    assertNull(input.colors());
    assertEquals(3, CliParsers.resolveColors(options, input, 3));
  }

  @Test
  void rejectsBadArguments(@TempDir Path temp) throws IOException {
    assertThrows(IllegalArgumentException.class, () -> CliParsers.parse(new String[] {"--bogus"}));
    assertThrows(
        IllegalArgumentException.class, () -> CliParsers.parse(new String[] {"--nodes"}));
    assertThrows(
        IllegalArgumentException.class, () -> CliParsers.parse(new String[] {"--nodes", "x"}));
    assertThrows(IllegalArgumentException.class, () -> CliParsers.parse(new String[] {}));
    assertThrows(
        IllegalArgumentException.class,
        () -> CliParsers.parse(new String[] {"--nodes", "2", "--colors", "0"}));

    Path broken = temp.resolve("broken.json");
    Files.writeString(broken, "{\"edges\": [[0, 1]]}");
    CliOptions options = CliParsers.parse(new String[] {"--graph", broken.toString()});
    assertThrows(IllegalArgumentException.class, () -> CliParsers.loadGraph(options));
  }
}
