package colortree.core.model;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Immutable sequence of labels, one per node in node-id order.
 *
 * <p>An assignment shorter than the graph's node count is partial (a path prefix in the search
 * tree); one of full length is complete (a leaf).
 */
public final class LabelAssignment {
    private static final LabelAssignment EMPTY = new LabelAssignment(new int[0]);

    private final int[] labels;

    private LabelAssignment(int[] labels) {
        this.labels = labels;
    }

    public static LabelAssignment empty() {
        return EMPTY;
    }

    public static LabelAssignment of(int... labels) {
        for (int label : labels) {
            if (label < 0) {
                throw new IllegalArgumentException("labels must be non-negative: " + Arrays.toString(labels));
            }
        }
        return new LabelAssignment(labels.clone());
    }

    public static LabelAssignment of(List<Integer> labels) {
        int[] values = new int[labels.size()];
        for (int i = 0; i < values.length; i++) {
            values[i] = labels.get(i);
        }
        return of(values);
    }

    /** Returns a new assignment with {@code label} chosen for the next node. */
    public LabelAssignment append(int label) {
        if (label < 0) {
            throw new IllegalArgumentException("label must be non-negative: " + label);
        }
        int[] next = Arrays.copyOf(labels, labels.length + 1);
        next[labels.length] = label;
        return new LabelAssignment(next);
    }

    public int length() {
        return labels.length;
    }

    public int get(int node) {
        return labels[node];
    }

    public boolean isCompleteFor(int nodeCount) {
        return labels.length == nodeCount;
    }

    /** True when every label lies in {@code [0, labelCount)}. */
    public boolean withinDomain(int labelCount) {
        for (int label : labels) {
            if (label >= labelCount) {
                return false;
            }
        }
        return true;
    }

    public List<Integer> toList() {
        List<Integer> list = new ArrayList<>(labels.length);
        for (int label : labels) {
            list.add(label);
        }
        return list;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof LabelAssignment other)) {
            return false;
        }
        return Arrays.equals(labels, other.labels);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(labels);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("(");
        for (int i = 0; i < labels.length; i++) {
            if (i > 0) {
                sb.append(", ");
            }
            sb.append(labels[i]);
        }
        return sb.append(')').toString();
    }
}
