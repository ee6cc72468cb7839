package com.autopar.runtime;

/**
 * What one work unit produced. A unit is {@code skipped} when a lower-index unit had
 * already failed before it started; its result would be discarded anyway.
 */
public record UnitOutcome<T>(int index, T value, RuntimeException failure, boolean skipped) {

    static <T> UnitOutcome<T> done(int index, T value) {
        return new UnitOutcome<>(index, value, null, false);
    }

    static <T> UnitOutcome<T> failed(int index, T partial, RuntimeException failure) {
        return new UnitOutcome<>(index, partial, failure, false);
    }

    static <T> UnitOutcome<T> skip(int index) {
        return new UnitOutcome<>(index, null, null, true);
    }

    public boolean isFailure() {
        return failure != null;
    }
}
