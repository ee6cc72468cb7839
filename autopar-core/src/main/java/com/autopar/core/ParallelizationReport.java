package com.autopar.core;

import com.autopar.core.detect.DetectionResult;
import com.autopar.core.detect.DiagnosticsReport;
import com.autopar.core.transform.TransformResult;

import java.util.List;

/**
 * Everything one {@link Parallelizer#parallelize} run decided: the ranked candidates and
 * the outcome of every attempted rewrite, in the order they were attempted.
 */
public record ParallelizationReport(DetectionResult detection, List<TransformResult> outcomes, int finalVersion) {

    public ParallelizationReport {
        outcomes = List.copyOf(outcomes);
    }

    public DiagnosticsReport diagnostics() {
        return detection.diagnostics();
    }

    public long appliedCount() {
        return outcomes.stream().filter(TransformResult::isApplied).count();
    }
}
