package com.autopar.core.detect;

import com.autopar.core.tree.NodeId;

import java.util.List;
import java.util.Optional;

/**
 * Ranked candidates for one tree version: descending benefit, ties by source position.
 */
public record DetectionResult(int version, List<ParallelRegion> regions) {

    public DetectionResult {
        regions = List.copyOf(regions);
    }

    public List<ParallelRegion> accepted() {
        return regions.stream().filter(ParallelRegion::isAccepted).toList();
    }

    public List<ParallelRegion> rejected() {
        return regions.stream().filter(r -> !r.isAccepted()).toList();
    }

    public Optional<ParallelRegion> find(NodeId node) {
        return regions.stream().filter(r -> r.node().equals(node)).findFirst();
    }

    public DiagnosticsReport diagnostics() {
        return new DiagnosticsReport(regions.stream().map(DiagnosticEntry::of).toList());
    }
}
