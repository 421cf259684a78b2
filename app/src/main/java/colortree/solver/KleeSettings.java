package colortree.solver;

import java.nio.file.Path;
import java.util.List;

/**
 * Tool locations and arguments for {@link KleeSolverOracle}.
 *
 * @param clang compiler used to produce LLVM bitcode
 * @param klee symbolic execution engine
 * @param ktestTool tool that prints {@code .ktest} files
 * @param includeDir directory containing {@code klee/klee.h}, or {@code null} to detect it
 * @param kleeArgs extra arguments passed to {@code klee} before the bitcode file
 * @param workRoot parent for scoped work directories, or {@code null} for the system temp dir
 */
public record KleeSettings(
    String clang,
    String klee,
    String ktestTool,
    Path includeDir,
    List<String> kleeArgs,
    Path workRoot) {

  static final List<Path> INCLUDE_CANDIDATES =
      List.of(
          Path.of("/snap/klee/current/usr/local/include"),
          Path.of("/snap/klee/17/usr/local/include"),
          Path.of("/usr/local/include"),
          Path.of("/usr/include"));

  public KleeSettings {
    clang = clang == null || clang.isBlank() ? "clang" : clang;
    klee = klee == null || klee.isBlank() ? "klee" : klee;
    ktestTool = ktestTool == null || ktestTool.isBlank() ? "ktest-tool" : ktestTool;
    kleeArgs = kleeArgs == null ? List.of() : List.copyOf(kleeArgs);
  }

  public static KleeSettings defaults() {
    return new KleeSettings("clang", "klee", "ktest-tool", null, List.of(), null);
  }

  public KleeSettings withIncludeDir(Path dir) {
    return new KleeSettings(clang, klee, ktestTool, dir, kleeArgs, workRoot);
  }
}
