package colortree.solver;

import colortree.solver.SolverProcessException.Failure;
import colortree.util.PathUtils;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs KLEE as the solver: compile the program to bitcode with clang, execute it symbolically,
 * and read back every test case KLEE generated for a successfully completed path.
 *
 * <p>Each call owns a fresh temporary work directory which is deleted on every exit path. All
 * external processes share the call's deadline and are destroyed on timeout or interruption.
 */
public final class KleeSolverOracle implements SolverOracle {
  private static final Logger LOG = LoggerFactory.getLogger(KleeSolverOracle.class);
  private static final String SOURCE_FILE = "coloring.c";
  private static final String BITCODE_FILE = "coloring.bc";
  private static final String OUTPUT_DIR = "klee-out";
  private static final int STDERR_TAIL_CHARS = 2_000;
  private static final long DESTROY_WAIT_SECONDS = 5;

  private final KleeSettings settings;

  public KleeSolverOracle() {
    this(KleeSettings.defaults());
  }

  public KleeSolverOracle(KleeSettings settings) {
    this.settings = Objects.requireNonNull(settings, "settings");
  }

  @Override
  public SolverResponse solve(SolverProgram program, Duration timeout)
      throws SolverProcessException, InterruptedException {
    long deadline = System.nanoTime() + timeout.toNanos();
    Path workDir = createWorkDir();
    try {
      Files.writeString(workDir.resolve(SOURCE_FILE), program.source(), StandardCharsets.UTF_8);

      Path include = resolveIncludeDir();
      run(
          "clang",
          List.of(
              settings.clang(), "-I", include.toString(), "-O0", "-g", "-emit-llvm", "-c",
              SOURCE_FILE, "-o", BITCODE_FILE),
          workDir,
          deadline);
      if (!Files.exists(workDir.resolve(BITCODE_FILE))) {
        throw new SolverProcessException(Failure.ABNORMAL_EXIT, "clang produced no bitcode");
      }

      List<String> kleeCommand = new ArrayList<>();
      kleeCommand.add(settings.klee());
      kleeCommand.add("--output-dir=" + OUTPUT_DIR);
      kleeCommand.addAll(settings.kleeArgs());
      kleeCommand.add(BITCODE_FILE);
      run("klee", kleeCommand, workDir, deadline);

      Path outputDir = workDir.resolve(OUTPUT_DIR);
      if (!Files.isDirectory(outputDir)) {
        throw new SolverProcessException(
            Failure.ABNORMAL_EXIT, "KLEE did not create its output directory");
      }
      return readResults(outputDir, workDir, deadline);
    } catch (IOException ex) {
      throw new SolverProcessException(Failure.IO, "KLEE work directory I/O failed", ex);
    } finally {
      cleanup(workDir);
    }
  }

  private SolverResponse readResults(Path outputDir, Path workDir, long deadline)
      throws IOException, SolverProcessException, InterruptedException {
    List<Path> ktests = new ArrayList<>();
    Set<String> errorStems = new HashSet<>();
    try (DirectoryStream<Path> entries = Files.newDirectoryStream(outputDir)) {
      for (Path entry : entries) {
        String name = entry.getFileName().toString();
        if (name.endsWith(".ktest")) {
          ktests.add(entry);
        } else if (name.endsWith(".err")) {
          errorStems.add(name.substring(0, name.indexOf('.')));
        }
      }
    }
    ktests.sort(null);

    List<SolverResultFile> results = new ArrayList<>();
    int errorPaths = 0;
    for (Path ktest : ktests) {
      String name = ktest.getFileName().toString();
      String stem = name.substring(0, name.indexOf('.'));
      if (errorStems.contains(stem)) {
        // test cases for error paths (e.g. provably false assumptions) are not solutions
        errorPaths++;
        LOG.debug("Skipping {}: error path", name);
        continue;
      }
      String output =
          run("ktest-tool", List.of(settings.ktestTool(), ktest.toString()), workDir, deadline);
      results.add(KTestOutputParser.parse(name, output));
    }
    LOG.debug("KLEE produced {} result(s), {} error path(s)", results.size(), errorPaths);
    if (results.isEmpty()) {
      return SolverResponse.infeasibleResponse();
    }
    return SolverResponse.of(results);
  }

  /** Runs one tool to completion and returns its standard output. */
  private String run(String step, List<String> command, Path workDir, long deadline)
      throws SolverProcessException, InterruptedException, IOException {
    long remainingNanos = deadline - System.nanoTime();
    if (remainingNanos <= 0) {
      throw new SolverProcessException(Failure.TIMEOUT, step + " not started: time limit reached");
    }
    Path stdout = Files.createTempFile(workDir, step, ".stdout");
    Path stderr = Files.createTempFile(workDir, step, ".stderr");
    ProcessBuilder builder =
        new ProcessBuilder(command)
            .directory(workDir.toFile())
            .redirectOutput(stdout.toFile())
            .redirectError(stderr.toFile());
    LOG.debug("[{}] {}", step, String.join(" ", command));

    Process process;
    try {
      process = builder.start();
    } catch (IOException ex) {
      throw new SolverProcessException(
          Failure.TOOL_MISSING, command.get(0) + " could not be started: " + ex.getMessage(), ex);
    }
    try {
      if (!process.waitFor(remainingNanos, TimeUnit.NANOSECONDS)) {
        throw new SolverProcessException(
            Failure.TIMEOUT, step + " exceeded its time limit and was terminated");
      }
      int exit = process.exitValue();
      if (exit != 0) {
        throw new SolverProcessException(
            Failure.ABNORMAL_EXIT, step + " exited with code " + exit + ":\n" + tail(stderr));
      }
      return Files.readString(stdout, StandardCharsets.UTF_8);
    } finally {
      terminate(process, step);
    }
  }

  /** Kills {@code process} if still running and waits briefly so it releases the work dir. */
  private static void terminate(Process process, String step) {
    if (!process.isAlive()) {
      return;
    }
    process.destroyForcibly();
    try {
      if (!process.waitFor(DESTROY_WAIT_SECONDS, TimeUnit.SECONDS)) {
        LOG.warn("{} did not exit within {}s of being killed", step, DESTROY_WAIT_SECONDS);
      }
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      LOG.warn("Interrupted while waiting for {} to exit", step);
    }
  }

  private Path resolveIncludeDir() throws SolverProcessException {
    if (settings.includeDir() != null) {
      return settings.includeDir();
    }
    for (Path candidate : KleeSettings.INCLUDE_CANDIDATES) {
      if (Files.exists(candidate.resolve("klee").resolve("klee.h"))) {
        return candidate;
      }
    }
    throw new SolverProcessException(
        Failure.TOOL_MISSING, "Cannot find klee/klee.h; configure the KLEE include directory");
  }

  private Path createWorkDir() throws SolverProcessException {
    try {
      if (settings.workRoot() != null) {
        Files.createDirectories(settings.workRoot());
        return Files.createTempDirectory(settings.workRoot(), "colortree-klee-");
      }
      return Files.createTempDirectory("colortree-klee-");
    } catch (IOException ex) {
      throw new SolverProcessException(Failure.IO, "Cannot create KLEE work directory", ex);
    }
  }

  private static void cleanup(Path workDir) {
    try {
      PathUtils.deleteRecursively(workDir);
    } catch (IOException ex) {
      LOG.warn("Failed to delete KLEE work directory {}: {}", workDir, ex.getMessage());
    }
  }

  private static String tail(Path file) throws IOException {
    String text = Files.readString(file, StandardCharsets.UTF_8);
    return text.length() <= STDERR_TAIL_CHARS
        ? text
        : text.substring(text.length() - STDERR_TAIL_CHARS);
  }
}
