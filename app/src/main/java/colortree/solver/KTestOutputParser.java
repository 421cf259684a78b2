package colortree.solver;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Parses the text printed by {@code ktest-tool}.
 *
 * <pre>
 * ktest file : 'klee-out/test000001.ktest'
 * num objects: 2
 * object 0: name: 'color_0'
 * object 0: size: 4
 * object 0: int : 2
 * object 1: name: 'color_1'
 * ...
 * </pre>
 *
 * Only the {@code name} and {@code int} lines are used; an {@code int} line may hold a
 * comma-separated list when the object is an array.
 */
public final class KTestOutputParser {
  private static final Logger LOG = LoggerFactory.getLogger(KTestOutputParser.class);
  private static final Pattern NAME = Pattern.compile("object\\s+\\d+:\\s+name:\\s+'([^']+)'");
  private static final Pattern INT = Pattern.compile("object\\s+\\d+:\\s+int\\s*:\\s*(.+)");
  private static final Pattern NUM_OBJECTS = Pattern.compile("num objects:\\s*(\\d+)");

  private KTestOutputParser() {}

  public static SolverResultFile parse(String source, String output) {
    Map<String, List<Integer>> objects = new LinkedHashMap<>();
    String currentName = null;
    for (String line : output.strip().split("\\R")) {
      Matcher name = NAME.matcher(line);
      if (name.find()) {
        currentName = name.group(1);
        continue;
      }
      Matcher ints = INT.matcher(line);
      if (ints.find() && currentName != null) {
        List<Integer> values = parseValues(ints.group(1));
        if (values != null) {
          objects.put(currentName, values);
        } else {
          LOG.debug("Ignoring non-integer values for {} in {}", currentName, source);
        }
        currentName = null;
      }
    }
    Matcher count = NUM_OBJECTS.matcher(output);
    if (count.find() && Integer.parseInt(count.group(1)) != objects.size()) {
      LOG.debug(
          "{} declares {} objects but {} had integer values",
          source,
          count.group(1),
          objects.size());
    }
    return new SolverResultFile(source, objects);
  }

  private static List<Integer> parseValues(String raw) {
    List<Integer> values = new ArrayList<>();
    for (String part : raw.split(",")) {
      try {
        values.add(Integer.parseInt(part.trim()));
      } catch (NumberFormatException ex) {
        return null;
      }
    }
    return values;
  }
}
