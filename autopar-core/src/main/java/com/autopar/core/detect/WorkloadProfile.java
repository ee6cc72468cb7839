package com.autopar.core.detect;

/** Advice for the backend generator; never affects the safety verdict. */
public enum WorkloadProfile {
    CPU_BOUND("process-pool"),
    IO_BOUND("thread-pool");

    private final String suggestedBackend;

    WorkloadProfile(String suggestedBackend) {
        this.suggestedBackend = suggestedBackend;
    }

    public String suggestedBackend() {
        return suggestedBackend;
    }
}
