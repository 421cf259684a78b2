package colortree.util;

import colortree.solver.SolverProgram;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/** Saves a generated solver program so it can be inspected or run by hand. */
public final class ProgramExporter {

  private ProgramExporter() {}

  /** Writes {@code program} to {@code target}, appending {@code .c} when missing. */
  public static Path save(SolverProgram program, Path target) throws IOException {
    Path file = target;
    String name = target.getFileName() == null ? "" : target.getFileName().toString();
    if (!name.endsWith(".c")) {
      file = target.resolveSibling(name + ".c");
    }
    Path parent = file.toAbsolutePath().getParent();
    if (parent != null) {
      Files.createDirectories(parent);
    }
    Files.writeString(file, program.source(), StandardCharsets.UTF_8);
    return file;
  }
}
