package sanalysis;

import java.util.Objects;

/** Directed edge between two blocks, referenced by index. */
public final class Edge {
    private final int from;
    private final int to;
    private final EdgeLabel label;

    public Edge(int from, int to, EdgeLabel label) {
        this.from = from;
        this.to = to;
        this.label = Objects.requireNonNull(label, "label");
    }

    public int getFrom() {
        return from;
    }

    public int getTo() {
        return to;
    }

    public EdgeLabel getLabel() {
        return label;
    }

    Edge withFrom(int newFrom) {
        return new Edge(newFrom, to, label);
    }

    Edge withTo(int newTo) {
        return new Edge(from, newTo, label);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Edge)) return false;
        Edge other = (Edge) obj;
        return from == other.from && to == other.to && label.equals(other.label);
    }

    @Override
    public int hashCode() {
        return Objects.hash(from, to, label);
    }

    @Override
    public String toString() {
        return from + " --" + label + "--> " + to;
    }
}
