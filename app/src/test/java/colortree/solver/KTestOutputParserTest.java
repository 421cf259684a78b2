package colortree.solver;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import colortree.core.model.LabelAssignment;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

final class KTestOutputParserTest {
  private static final String OUTPUT =
      String.join(
          "\n",
          "ktest file : 'klee-out/test000002.ktest'",
          "args       : ['coloring.bc']",
          "num objects: 3",
          "object 0: name: 'color_0'",
          "object 0: size: 4",
          "object 0: data: b'\\x02\\x00\\x00\\x00'",
          "object 0: hex : 0x02000000",
          "object 0: int : 2",
          "object 0: uint: 2",
          "object 0: text: ....",
          "object 1: name: 'color_1'",
          "object 1: size: 4",
          "object 1: int : 0",
          "object 2: name: 'color_2'",
          "object 2: size: 4",
          "object 2: int : 1");

  @Test
  void readsNamedIntegerObjects() {
    SolverResultFile result = KTestOutputParser.parse("test000002.ktest", OUTPUT);

    assertEquals("test000002.ktest", result.source());
    assertEquals(
        Map.of("color_0", List.of(2), "color_1", List.of(0), "color_2", List.of(1)),
        result.objects());
  }

  @Test
  void decodesParsedObjectsInNodeOrder() {
    SolverResultFile result = KTestOutputParser.parse("t", OUTPUT);
    ResultDecoder.Decoded decoded = ResultDecoder.decode(result, 3, 3);

    assertTrue(decoded.isOk());
    assertEquals(LabelAssignment.of(2, 0, 1), decoded.assignment());
  }

  @Test
  void acceptsASingleArrayObject() {
    String output =
        String.join(
            "\n",
            "num objects: 1",
            "object 0: name: 'color'",
            "object 0: size: 12",
            "object 0: int : 1, 0, 1");
    ResultDecoder.Decoded decoded =
        ResultDecoder.decode(KTestOutputParser.parse("array", output), 3, 2);

    assertEquals(LabelAssignment.of(1, 0, 1), decoded.assignment());
  }

  @Test
  void flagsMissingAndOutOfDomainValues() {
    SolverResultFile missing =
        new SolverResultFile("missing", Map.of("color_0", List.of(0)));
    ResultDecoder.Decoded incomplete = ResultDecoder.decode(missing, 2, 2);
    assertFalse(incomplete.isOk());
    assertTrue(incomplete.problem().contains("color_1"));

    SolverResultFile outside =
        new SolverResultFile("outside", Map.of("color_0", List.of(0), "color_1", List.of(5)));
    ResultDecoder.Decoded outOfDomain = ResultDecoder.decode(outside, 2, 3);
    assertFalse(outOfDomain.isOk());
    assertTrue(outOfDomain.problem().contains("outside [0, 3)"));
  }

  @Test
  void ignoresObjectsWithoutIntegerValues() {
    String output =
        String.join(
            "\n",
            "object 0: name: 'color_0'",
            "object 0: int : garbage",
            "object 1: name: 'color_1'",
            "object 1: int : 1");

    assertEquals(Map.of("color_1", List.of(1)), KTestOutputParser.parse("x", output).objects());
  }
}
