package colortree.solver;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import colortree.core.model.ExclusionSet;
import colortree.core.model.Graph;
import colortree.core.model.LabelAssignment;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

final class SolverProgramGeneratorTest {
  private static final Graph EDGE = Graph.fromPairs(2, List.<int[]>of(new int[] {0, 1}));

  @Test
  void emitsDomainEdgeAndExclusionAssumptions() {
    ExclusionSet exclusions = ExclusionSet.empty().plus(List.of(LabelAssignment.of(0, 1)));
    SolverProgram program = new SolverProgramGenerator().generate(EDGE, 2, exclusions);
    String source = program.source();

    assertTrue(source.startsWith("#include <klee/klee.h>"));
    assertTrue(source.contains("klee_make_symbolic(&color_0, sizeof(int), \"color_0\");"));
    assertTrue(source.contains("klee_assume((color_1 >= 0) & (color_1 < 2));"));
    assertTrue(source.contains("klee_assume(color_0 != color_1);"));
    assertTrue(source.contains("klee_assume((color_0 != 0) | (color_1 != 1));"));
    assertEquals(List.of("color_0", "color_1"), program.variables());
    assertEquals(1, program.exclusionCount());
    assertEquals(2, program.nodeCount());
  }

  @Test
  void variableNamesRoundTrip() {
    assertEquals("color_7", SolverProgramGenerator.variableName(7));
    assertEquals(7, SolverProgramGenerator.nodeOf("color_7"));
    assertEquals(-1, SolverProgramGenerator.nodeOf("colour_7"));
    assertEquals(-1, SolverProgramGenerator.nodeOf("color_x"));
  }

  @Test
  void generatorIsBackendAgnostic() {
    List<Predicate> seen = new ArrayList<>();
    ProgramEmitter recording =
        new ProgramEmitter() {
          @Override
          public void declareSymbolic(String variable) {}

          @Override
          public void assume(Predicate predicate) {
            seen.add(predicate);
          }

          @Override
          public void recordValues(List<String> variables) {}

          @Override
          public String finish() {
            return "recorded " + seen.size();
          }
        };

    SolverProgram program =
        new SolverProgramGenerator(() -> recording).generate(EDGE, 3, ExclusionSet.empty());

    assertEquals("recorded 3", program.source());
    assertEquals(new Predicate.Distinct("color_0", "color_1"), seen.get(2));
  }

  @Test
  void emitterCannotBeReusedAfterFinish() {
    KleeProgramEmitter emitter = new KleeProgramEmitter();
    emitter.finish();

    assertThrows(IllegalStateException.class, () -> emitter.declareSymbolic("color_0"));
  }
}
