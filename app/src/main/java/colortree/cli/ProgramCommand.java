package colortree.cli;

import colortree.core.model.ExclusionSet;
import colortree.solver.SolverProgram;
import colortree.solver.SolverProgramGenerator;
import colortree.util.ProgramExporter;
import java.io.IOException;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Handles the `program` command: print or save the KLEE program for a graph. */
final class ProgramCommand {
  private static final Logger LOG = LoggerFactory.getLogger(ProgramCommand.class);

  int execute(String[] args) throws IOException {
    CliOptions options = CliParsers.parse(args);
    CliParsers.GraphInput input = CliParsers.loadGraph(options);
    int colors = CliParsers.resolveColors(options, input, TreeCommand.DEFAULT_COLORS);

    SolverProgram program =
        new SolverProgramGenerator().generate(input.graph(), colors, ExclusionSet.empty());
    if (options.save() != null) {
      Path saved = ProgramExporter.save(program, options.save());
      LOG.info("Program written to {}", saved);
    } else {
      System.out.print(program.source());
    }
    return Main.EXIT_OK;
  }
}
