package com.autopar.core.dependence;

/**
 * Symbolic reference to an iteration: the loop variable plus a constant offset, so
 * {@code (i, 1)} reads as "iteration i+1". Iterations are never materialized.
 */
public record IterationRef(String variable, int offset) {

    public static IterationRef current(String variable) {
        return new IterationRef(variable, 0);
    }

    public IterationRef next() {
        return new IterationRef(variable, offset + 1);
    }

    @Override
    public String toString() {
        if (offset == 0) return variable;
        return offset > 0 ? variable + "+" + offset : variable + offset;
    }
}
