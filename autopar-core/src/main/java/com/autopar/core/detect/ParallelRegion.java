package com.autopar.core.detect;

import com.autopar.core.dependence.DependencyEdge;
import com.autopar.core.symbols.Symbol;
import com.autopar.core.tree.CombineKind;
import com.autopar.core.tree.NodeId;
import com.autopar.core.tree.SourcePos;

import java.util.List;
import java.util.Optional;
import java.util.SortedSet;

/**
 * A candidate region and the detector's decision about it.
 *
 * {@code benefit} is {@code tripEstimate * costPerIteration}; both factors are heuristics.
 * For accepted regions {@code combine} names the rewrite shape; rejected regions carry
 * their {@code reason} and, for dependence rejections, the evidence edges.
 */
public record ParallelRegion(NodeId node,
                             RegionKind kind,
                             String function,
                             SourcePos pos,
                             Verdict verdict,
                             RejectionReason reason,
                             String detail,
                             int tripEstimate,
                             double costPerIteration,
                             double benefit,
                             CombineKind combine,
                             String accumulationTarget,
                             SortedSet<Symbol> loopPrivate,
                             SortedSet<Symbol> shared,
                             SortedSet<Symbol> captures,
                             SortedSet<Symbol> privatized,
                             List<DependencyEdge> evidence,
                             List<NodeId> subCalls,
                             WorkloadProfile profile,
                             long fingerprint) {

    public ParallelRegion {
        evidence = List.copyOf(evidence);
        subCalls = List.copyOf(subCalls);
    }

    public boolean isAccepted() {
        return verdict == Verdict.ACCEPTED;
    }

    public Optional<RejectionReason> rejection() {
        return Optional.ofNullable(reason);
    }

    public Optional<ResultCategory> category() {
        return rejection().map(RejectionReason::category);
    }

    /** {@code function:line:column}. */
    public String location() {
        return (function == null ? "<module>" : function) + ":" + pos;
    }
}
