package com.autopar.core.detect;

/**
 * One line of the diagnostics report: where, what was decided, and why.
 * {@code reason} and {@code category} are null for accepted regions.
 */
public record DiagnosticEntry(String location,
                              RegionKind kind,
                              Verdict decision,
                              String reason,
                              String category,
                              double benefit,
                              String detail) {

    static DiagnosticEntry of(ParallelRegion region) {
        return new DiagnosticEntry(
            region.location(),
            region.kind(),
            region.verdict(),
            region.rejection().map(RejectionReason::label).orElse(null),
            region.category().map(ResultCategory::label).orElse(null),
            region.benefit(),
            region.detail());
    }
}
