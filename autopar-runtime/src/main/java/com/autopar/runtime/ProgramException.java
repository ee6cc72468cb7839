package com.autopar.runtime;

import com.autopar.core.tree.SourcePos;

/**
 * An error raised by the interpreted program, either by an explicit {@code raise} or by
 * a failing operation (division by zero, index out of range, unknown function).
 * A {@code try} in the program catches it and binds {@link #value()}.
 */
public class ProgramException extends RuntimeException {

    private final transient Object value;
    private final SourcePos pos;

    public ProgramException(Object value, SourcePos pos) {
        super(Values.display(value) + (pos == null || pos.equals(SourcePos.UNKNOWN) ? "" : " at " + pos));
        this.value = value;
        this.pos = pos == null ? SourcePos.UNKNOWN : pos;
    }

    public Object value() {
        return value;
    }

    public SourcePos pos() {
        return pos;
    }
}
