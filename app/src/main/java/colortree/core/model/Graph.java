package colortree.core.model;

import colortree.core.ColoringException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Undirected simple graph over node ids {@code 0..nodeCount-1}.
 *
 * <p>Edges keep their insertion order (duplicates collapse), which is the order violated edges
 * are reported in.
 */
public final class Graph {
    private final int nodeCount;
    private final List<Edge> edges;

    private Graph(int nodeCount, List<Edge> edges) {
        this.nodeCount = nodeCount;
        this.edges = List.copyOf(edges);
    }

    public static Graph of(int nodeCount, Collection<Edge> edges) {
        if (nodeCount < 1) {
            throw ColoringException.invalidConfiguration(
                    "graph needs at least one node (got " + nodeCount + ")", nodeCount, -1);
        }
        Set<Edge> unique = new LinkedHashSet<>();
        for (Edge edge : edges) {
            if (edge.v() >= nodeCount) {
                throw ColoringException.invalidConfiguration(
                        "edge " + edge + " references a node outside 0.." + (nodeCount - 1),
                        nodeCount,
                        -1);
            }
            unique.add(edge);
        }
        return new Graph(nodeCount, new ArrayList<>(unique));
    }

    /** Builds a graph from {@code [u, v]} pairs; self-loops are rejected as invalid input. */
    public static Graph fromPairs(int nodeCount, List<int[]> pairs) {
        List<Edge> edges = new ArrayList<>(pairs.size());
        for (int[] pair : pairs) {
            if (pair.length != 2) {
                throw ColoringException.invalidConfiguration(
                        "edge must have exactly two endpoints", nodeCount, -1);
            }
            try {
                edges.add(new Edge(pair[0], pair[1]));
            } catch (IllegalArgumentException ex) {
                throw ColoringException.invalidConfiguration(ex.getMessage(), nodeCount, -1);
            }
        }
        return of(nodeCount, edges);
    }

    public int nodeCount() {
        return nodeCount;
    }

    public List<Edge> edges() {
        return edges;
    }

    public int edgeCount() {
        return edges.size();
    }

    public boolean hasEdge(int a, int b) {
        return a != b && edges.contains(new Edge(a, b));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Graph other)) {
            return false;
        }
        return nodeCount == other.nodeCount && Set.copyOf(edges).equals(Set.copyOf(other.edges));
    }

    @Override
    public int hashCode() {
        return 31 * nodeCount + Set.copyOf(edges).hashCode();
    }

    @Override
    public String toString() {
        return "Graph{nodes=" + nodeCount + ", edges=" + edges + "}";
    }
}
