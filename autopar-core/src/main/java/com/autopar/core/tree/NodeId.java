package com.autopar.core.tree;

/**
 * Address of a node slot in a {@link SyntaxTree} arena.
 * {@link #NONE} stands for an absent optional child.
 */
public record NodeId(int index) implements Comparable<NodeId> {

    public static final NodeId NONE = new NodeId(-1);

    public boolean isNone() { return index < 0; }

    public boolean isPresent() { return index >= 0; }

    @Override
    public int compareTo(NodeId other) {
        return Integer.compare(index, other.index);
    }

    @Override
    public String toString() {
        return isNone() ? "#none" : "#" + index;
    }
}
