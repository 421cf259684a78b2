package colortree.explain;

import java.util.List;

/** Human-readable names for label values. */
public final class ColorNames {
  private static final List<String> NAMES =
      List.of(
          "RED", "BLUE", "GREEN", "ORANGE", "PURPLE", "CYAN", "AMBER", "BROWN", "BLUE GREY",
          "PINK");

  private ColorNames() {}

  /** Name of {@code label}; labels past the palette are named {@code COLOR_<label>}. */
  public static String nameOf(int label) {
    if (label >= 0 && label < NAMES.size()) {
      return NAMES.get(label);
    }
    return "COLOR_" + label;
  }
}
