package com.autopar.core.config;

import java.util.Set;
import java.util.TreeSet;
import java.util.Collections;

/**
 * Options every analysis run honors.
 *
 * @param minIterations      loops estimated below this trip count are rejected as too small
 * @param allowPureCalls     callee names (plain or {@code Owner.method}) trusted to be pure
 * @param backend            capabilities of the target backend
 * @param nestedParallelism  whether regions inside an accepted region may also be accepted
 * @param defaultTripCount   trip estimate used when a loop's bounds are not literal
 */
public record AnalysisConfig(int minIterations,
                             Set<String> allowPureCalls,
                             BackendCapabilities backend,
                             boolean nestedParallelism,
                             int defaultTripCount) {

    public static final int DEFAULT_MIN_ITERATIONS = 2;
    public static final int DEFAULT_TRIP_COUNT = 64;

    public AnalysisConfig {
        if (minIterations < 1) {
            throw new IllegalArgumentException("min_iterations must be >= 1, got " + minIterations);
        }
        if (defaultTripCount < 1) {
            throw new IllegalArgumentException("default_trip_count must be >= 1, got " + defaultTripCount);
        }
        if (backend == null) {
            throw new IllegalArgumentException("target_backend_capabilities is required");
        }
        allowPureCalls = allowPureCalls == null
            ? Set.of()
            : Collections.unmodifiableSet(new TreeSet<>(allowPureCalls));
    }

    public static AnalysisConfig defaults() {
        return new AnalysisConfig(DEFAULT_MIN_ITERATIONS, Set.of(), BackendCapabilities.defaults(),
            false, DEFAULT_TRIP_COUNT);
    }

    public AnalysisConfig withMinIterations(int value) {
        return new AnalysisConfig(value, allowPureCalls, backend, nestedParallelism, defaultTripCount);
    }

    public AnalysisConfig withAllowPureCalls(Set<String> value) {
        return new AnalysisConfig(minIterations, value, backend, nestedParallelism, defaultTripCount);
    }

    public AnalysisConfig withBackend(BackendCapabilities value) {
        return new AnalysisConfig(minIterations, allowPureCalls, value, nestedParallelism, defaultTripCount);
    }

    public AnalysisConfig withNestedParallelism(boolean value) {
        return new AnalysisConfig(minIterations, allowPureCalls, backend, value, defaultTripCount);
    }

    public AnalysisConfig withDefaultTripCount(int value) {
        return new AnalysisConfig(minIterations, allowPureCalls, backend, nestedParallelism, value);
    }

    public boolean isAllowListed(String callee) {
        return allowPureCalls.contains(callee);
    }
}
