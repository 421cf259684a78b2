package colortree.layout;

/** A 2-D position assigned to a tree node. */
public record Point(double x, double y) {}
