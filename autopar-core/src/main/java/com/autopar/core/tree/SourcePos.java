package com.autopar.core.tree;

import java.util.Comparator;

/**
 * Line/column of a node in the analyzed source. Lines are 1-based; 0 means unknown.
 */
public record SourcePos(int line, int column) implements Comparable<SourcePos> {

    public static final SourcePos UNKNOWN = new SourcePos(0, 0);

    private static final Comparator<SourcePos> ORDER =
        Comparator.comparingInt(SourcePos::line).thenComparingInt(SourcePos::column);

    public static SourcePos of(int line, int column) {
        return new SourcePos(line, column);
    }

    @Override
    public int compareTo(SourcePos other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return line + ":" + column;
    }
}
