package com.autopar.runtime;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

/**
 * The order in which work units are handed to workers. Combination is always by unit
 * index, so any order must give the same result; the non-sequential orders exist to
 * exercise that.
 */
public final class SubmissionOrder {

    private enum Kind { SEQUENTIAL, REVERSED, SHUFFLED }

    private final Kind kind;
    private final long seed;

    private SubmissionOrder(Kind kind, long seed) {
        this.kind = kind;
        this.seed = seed;
    }

    public static SubmissionOrder sequential() {
        return new SubmissionOrder(Kind.SEQUENTIAL, 0L);
    }

    public static SubmissionOrder reversed() {
        return new SubmissionOrder(Kind.REVERSED, 0L);
    }

    public static SubmissionOrder shuffled(long seed) {
        return new SubmissionOrder(Kind.SHUFFLED, seed);
    }

    /** Unit indexes {@code 0..units-1} in submission order. */
    int[] permutation(int units) {
        List<Integer> order = new ArrayList<>(units);
        for (int k = 0; k < units; k++) order.add(k);
        switch (kind) {
            case REVERSED -> Collections.reverse(order);
            case SHUFFLED -> Collections.shuffle(order, new Random(seed));
            default -> { }
        }
        int[] out = new int[units];
        for (int k = 0; k < units; k++) out[k] = order.get(k);
        return out;
    }

    @Override
    public String toString() {
        return kind == Kind.SHUFFLED ? "SHUFFLED(" + seed + ")" : kind.name();
    }
}
