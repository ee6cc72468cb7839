package com.autopar.adapter.manifest;

import com.autopar.core.config.AnalysisConfig;
import com.autopar.core.config.BackendCapabilities;
import com.google.gson.annotations.SerializedName;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Deserialized form of {@code autopar.json}. Every key is optional; absent keys fall back
 * to the {@link AnalysisConfig#defaults()} values.
 */
public class ManifestConfig {

    @SerializedName("min_iterations")
    private Integer minIterations;

    /** Callee names (plain or {@code Owner.method}) the user vouches are pure. */
    @SerializedName("allow_pure_calls")
    private List<String> allowPureCalls;

    @SerializedName("target_backend_capabilities")
    private Backend backend;

    /** Whether loops inside an accepted loop may be parallelized too (default: false). */
    @SerializedName("nested_parallelism")
    private Boolean nestedParallelism;

    /** Trip estimate for loops whose bounds are not literal (default: 64). */
    @SerializedName("default_trip_count")
    private Integer defaultTripCount;

    public static class Backend {
        @SerializedName("supports_ordered_map")
        private Boolean supportsOrderedMap;

        @SerializedName("supports_reduce")
        private Boolean supportsReduce;

        @SerializedName("max_workers")
        private Integer maxWorkers;

        public boolean isSupportsOrderedMap() { return supportsOrderedMap == null || supportsOrderedMap; }
        public boolean isSupportsReduce()     { return supportsReduce == null || supportsReduce; }
        public int getMaxWorkers() {
            return maxWorkers != null ? maxWorkers : Runtime.getRuntime().availableProcessors();
        }
    }

    public int getMinIterations() {
        return minIterations != null ? minIterations : AnalysisConfig.DEFAULT_MIN_ITERATIONS;
    }
    public List<String> getAllowPureCalls() {
        return allowPureCalls != null ? allowPureCalls : Collections.emptyList();
    }
    public Backend getBackend()            { return backend != null ? backend : new Backend(); }
    public boolean isNestedParallelism()   { return nestedParallelism != null && nestedParallelism; }
    public int getDefaultTripCount() {
        return defaultTripCount != null ? defaultTripCount : AnalysisConfig.DEFAULT_TRIP_COUNT;
    }

    /**
     * @throws IllegalArgumentException if a value is out of range
     */
    public AnalysisConfig toAnalysisConfig() {
        Backend b = getBackend();
        return new AnalysisConfig(
            getMinIterations(),
            new LinkedHashSet<>(getAllowPureCalls()),
            new BackendCapabilities(b.isSupportsOrderedMap(), b.isSupportsReduce(), b.getMaxWorkers()),
            isNestedParallelism(),
            getDefaultTripCount());
    }
}
