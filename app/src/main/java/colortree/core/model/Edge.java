package colortree.core.model;

/**
 * Immutable undirected edge between two distinct graph nodes.
 *
 * <p>Endpoints are normalized so that {@code u() < v()}; {@code new Edge(2, 0)} and
 * {@code new Edge(0, 2)} are equal.
 */
public final class Edge {
    private final int u;
    private final int v;

    public Edge(int a, int b) {
        if (a == b) {
            throw new IllegalArgumentException("self-loop on node " + a);
        }
        if (a < 0 || b < 0) {
            throw new IllegalArgumentException("negative node id in edge " + a + "-" + b);
        }
        this.u = Math.min(a, b);
        this.v = Math.max(a, b);
    }

    public static Edge of(int a, int b) {
        return new Edge(a, b);
    }

    public int u() {
        return u;
    }

    public int v() {
        return v;
    }

    /** Returns the endpoint opposite to {@code node}. */
    public int otherEnd(int node) {
        if (node == u) {
            return v;
        }
        if (node == v) {
            return u;
        }
        throw new IllegalArgumentException("Node " + node + " is not an endpoint of " + this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Edge other)) {
            return false;
        }
        return u == other.u && v == other.v;
    }

    @Override
    public int hashCode() {
        return 31 * u + v;
    }

    @Override
    public String toString() {
        return u + "-" + v;
    }
}
