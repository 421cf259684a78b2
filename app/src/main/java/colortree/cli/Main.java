package colortree.cli;

import colortree.core.ColoringException;
import java.io.IOException;
import java.util.Arrays;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Command-line entry point.
 *
 * <p>Usage:
 *
 * <ul>
 *   <li>{@code run --nodes 3 --edges 0-1,1-2,0-2 --colors 3}: build, enumerate with KLEE and
 *       reconcile
 *   <li>{@code tree --graph graph.json --export-dir out}: build and lay out only
 *   <li>{@code program --nodes 2 --edges 0-1 --colors 2 --save coloring.c}: emit the KLEE
 *       program
 * </ul>
 */
public final class Main {
  private static final Logger LOG = LoggerFactory.getLogger(Main.class);

  static final int EXIT_OK = 0;
  static final int EXIT_FAILURE = 1;
  static final int EXIT_USAGE = 2;
  static final int EXIT_INCOMPLETE = 3;
  static final int EXIT_MISMATCH = 4;

  private Main() {}

  public static void main(String[] args) {
    System.exit(run(args));
  }

  static int run(String[] args) {
    String command = args.length > 0 ? args[0].toLowerCase(Locale.ROOT) : "help";
    String[] rest = args.length > 0 ? Arrays.copyOfRange(args, 1, args.length) : args;
    try {
      return switch (command) {
        case "run" -> new RunCommand().execute(rest);
        case "tree" -> new TreeCommand().execute(rest);
        case "program" -> new ProgramCommand().execute(rest);
        case "help", "--help", "-h" -> {
          printUsage();
          yield EXIT_OK;
        }
        default -> {
          LOG.error("Unknown command: {}", args[0]);
          printUsage();
          yield EXIT_USAGE;
        }
      };
    } catch (IllegalArgumentException ex) {
      LOG.error("{}", ex.getMessage());
      return EXIT_USAGE;
    } catch (ColoringException ex) {
      LOG.error("{} {}", ex.getMessage(), ex.attributes());
      return EXIT_FAILURE;
    } catch (IOException ex) {
      LOG.error("I/O failure: {}", ex.getMessage(), ex);
      return EXIT_FAILURE;
    }
  }

  private static void printUsage() {
    System.out.println("Usage: colortree <run|tree|program> [options]");
    System.out.println("  --nodes N --edges 0-1,1-2   graph given inline");
    System.out.println("  --graph FILE                graph as JSON {nodes, edges, colors}");
    System.out.println("  --colors K                  number of labels (default 3)");
    System.out.println("  --max-leaves N              refuse trees with more than N leaves");
    System.out.println("  --max-iterations N          solver invocation budget");
    System.out.println("  --solver-timeout-ms MS      limit per solver invocation");
    System.out.println("  --retries N                 retries after a solver process failure");
    System.out.println("  --time-budget-ms MS         overall enumeration budget");
    System.out.println("  --klee-include DIR          directory containing klee/klee.h");
    System.out.println("  --output FILE               write a JSON report");
    System.out.println("  --export-dir DIR            export tree, layout and explanations");
    System.out.println("  --save FILE                 (program) write the program to FILE");
  }
}
