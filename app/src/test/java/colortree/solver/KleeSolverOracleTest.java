package colortree.solver;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

import colortree.core.model.ExclusionSet;
import colortree.core.model.Graph;
import java.io.IOException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;
import java.time.Duration;
import java.util.List;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.junit.jupiter.api.io.TempDir;

final class KleeSolverOracleTest {

  @Test
  void missingToolchainIsReportedAndWorkDirectoryRemoved(@TempDir Path temp) throws IOException {
    Path workRoot = temp.resolve("work");
    KleeSettings settings =
        new KleeSettings(
            temp.resolve("no-such-clang").toString(), null, null, temp, List.of(), workRoot);

    SolverProcessException ex =
        assertThrows(
            SolverProcessException.class,
            () -> new KleeSolverOracle(settings).solve(edgeProgram(), Duration.ofSeconds(5)));

    assertEquals(SolverProcessException.Failure.TOOL_MISSING, ex.failure());
    try (Stream<Path> left = Files.list(workRoot)) {
      assertTrue(left.findAny().isEmpty(), "work directory should be deleted");
    }
  }

  @Test
  @Timeout(20)
  void hungToolIsKilledAndWorkDirectoryRemoved(@TempDir Path temp) throws IOException {
    assumeTrue(FileSystems.getDefault().supportedFileAttributeViews().contains("posix"));
    Path hanging = temp.resolve("hanging-clang.sh");
    Files.writeString(hanging, "#!/bin/sh\nexec sleep 30\n");
    Files.setPosixFilePermissions(hanging, PosixFilePermissions.fromString("rwxr-xr-x"));
    Path workRoot = temp.resolve("work");
    KleeSettings settings =
        new KleeSettings(hanging.toString(), null, null, temp, List.of(), workRoot);

    SolverProcessException ex =
        assertThrows(
            SolverProcessException.class,
            () -> new KleeSolverOracle(settings).solve(edgeProgram(), Duration.ofMillis(300)));

    assertEquals(SolverProcessException.Failure.TIMEOUT, ex.failure());
    try (Stream<Path> left = Files.list(workRoot)) {
      assertTrue(left.findAny().isEmpty(), "work directory should be deleted");
    }
  }

  @Test
  void blankToolNamesFallBackToDefaults() {
    KleeSettings settings = new KleeSettings(" ", null, "", null, null, null);

    assertEquals("clang", settings.clang());
    assertEquals("klee", settings.klee());
    assertEquals("ktest-tool", settings.ktestTool());
    assertTrue(settings.kleeArgs().isEmpty());
  }

  private static SolverProgram edgeProgram() {
    return new SolverProgramGenerator()
        .generate(Graph.fromPairs(2, List.<int[]>of(new int[] {0, 1})), 2, ExclusionSet.empty());
  }
}
