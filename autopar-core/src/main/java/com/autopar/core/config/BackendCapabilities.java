package com.autopar.core.config;

/**
 * What the target execution backend can express. Checked by the transformation engine
 * before any rewrite is staged.
 */
public record BackendCapabilities(boolean supportsOrderedMap, boolean supportsReduce, int maxWorkers) {

    public BackendCapabilities {
        if (maxWorkers < 1) {
            throw new IllegalArgumentException("max_workers must be >= 1, got " + maxWorkers);
        }
    }

    public static BackendCapabilities defaults() {
        return new BackendCapabilities(true, true, Runtime.getRuntime().availableProcessors());
    }

    public BackendCapabilities withMaxWorkers(int workers) {
        return new BackendCapabilities(supportsOrderedMap, supportsReduce, workers);
    }
}
