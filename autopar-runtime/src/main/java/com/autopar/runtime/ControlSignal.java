package com.autopar.runtime;

/** Non-local exits of the interpreted program. Never escape {@link TreeInterpreter}. */
abstract class ControlSignal extends RuntimeException {

    ControlSignal() {
        super(null, null, false, false);
    }

    static final class Return extends ControlSignal {
        final Object value;

        Return(Object value) {
            this.value = value;
        }
    }

    static final class Break extends ControlSignal {}

    static final class Continue extends ControlSignal {}
}
