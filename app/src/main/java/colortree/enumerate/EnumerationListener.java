package colortree.enumerate;

import colortree.core.model.LabelAssignment;

/** Progress callbacks, invoked on the enumerating thread. */
public interface EnumerationListener {
  EnumerationListener NONE = new EnumerationListener() {};

  default void onColoringFound(LabelAssignment coloring, int iteration) {}

  default void onIterationCompleted(EnumerationState state) {}
}
