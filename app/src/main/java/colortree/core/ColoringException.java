package colortree.core;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Failure of a tree, layout or reconciliation operation.
 *
 * <p>Carries a {@link ErrorKind} and the numbers a caller needs to act on it (node count, label
 * count, leaf count, ceiling) as attributes.
 */
public final class ColoringException extends RuntimeException {
  public static final String ATTR_NODES = "nodes";
  public static final String ATTR_LABELS = "labels";
  public static final String ATTR_LEAVES = "leaves";
  public static final String ATTR_CEILING = "ceiling";
  public static final String ATTR_MISMATCHES = "mismatches";

  private final ErrorKind kind;
  private final Map<String, Object> attributes;

  public ColoringException(ErrorKind kind, String message, Map<String, Object> attributes) {
    super(message);
    this.kind = Objects.requireNonNull(kind, "kind");
    this.attributes =
        (attributes == null || attributes.isEmpty()) ? Map.of() : Map.copyOf(attributes);
  }

  public static ColoringException invalidConfiguration(String reason, int nodes, int labels) {
    Map<String, Object> attributes = new LinkedHashMap<>();
    attributes.put(ATTR_NODES, nodes);
    if (labels >= 0) {
      attributes.put(ATTR_LABELS, labels);
    }
    return new ColoringException(
        ErrorKind.INVALID_CONFIGURATION, "Invalid configuration: " + reason, attributes);
  }

  public static ColoringException tooLarge(
      ErrorKind kind, int nodes, int labels, long leaves, long ceiling) {
    String what = kind == ErrorKind.LAYOUT_TOO_LARGE ? "Layout" : "Tree";
    String leafText = leaves == Long.MAX_VALUE ? "more than " + Long.MAX_VALUE : String.valueOf(leaves);
    return new ColoringException(
        kind,
        String.format(
            "%s too large: %d^%d = %s leaves exceeds the ceiling of %d",
            what, labels, nodes, leafText, ceiling),
        Map.of(ATTR_NODES, nodes, ATTR_LABELS, labels, ATTR_LEAVES, leaves, ATTR_CEILING, ceiling));
  }

  public static ColoringException reconciliationMismatch(int mismatches) {
    return new ColoringException(
        ErrorKind.RECONCILIATION_MISMATCH,
        mismatches
            + " valid coloring(s) were not confirmed by the solver even though enumeration"
            + " reached a fixed point",
        Map.of(ATTR_MISMATCHES, mismatches));
  }

  public ErrorKind kind() {
    return kind;
  }

  public Map<String, Object> attributes() {
    return attributes;
  }
}
