package colortree.core.model;

import java.util.Objects;

/** An edge whose two endpoints received the same label. */
public record ViolatedEdge(Edge edge, int label) {

  public ViolatedEdge {
    Objects.requireNonNull(edge, "edge");
  }

  public int u() {
    return edge.u();
  }

  public int v() {
    return edge.v();
  }
}
