package com.autopar.adapter.report;

import com.autopar.adapter.report.ReportModel.*;
import com.autopar.core.dependence.DependencyEdge;
import com.autopar.core.detect.ParallelRegion;
import com.autopar.core.detect.RejectionReason;
import com.autopar.core.detect.ResultCategory;
import com.autopar.core.symbols.Symbol;
import com.autopar.core.transform.TransformResult;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Flattens per-unit analysis results into the report model.
 */
public class ReportAssembler {

    static final String REPORT_VERSION = "0.1";

    public ReportRoot assemble(String source, boolean applied, List<UnitAnalysis> analyses) {
        ReportRoot root = new ReportRoot();
        root.reportVersion = REPORT_VERSION;
        root.language = "java";
        root.source = source;
        root.applied = applied;
        root.files = new ArrayList<>();
        root.regions = new ArrayList<>();
        root.transforms = new ArrayList<>();

        Summary summary = new Summary();
        for (UnitAnalysis analysis : analyses) {
            String path = analysis.unit().path();

            FileEntry file = new FileEntry();
            file.path = path;
            file.program = analysis.unit().name();
            file.unsupported = analysis.unit().unsupported();
            file.version = analysis.unit().tree().version();
            root.files.add(file);

            for (ParallelRegion region : analysis.detection().regions()) {
                root.regions.add(region(path, region));
                summary.candidates++;
                if (region.isAccepted()) summary.accepted++;
                else summary.rejected++;
            }
            for (TransformResult outcome : analysis.outcomes()) {
                root.transforms.add(transform(path, outcome));
                if (outcome.isApplied()) summary.applied++;
            }
        }
        root.summary = summary;
        return root;
    }

    private static RegionEntry region(String path, ParallelRegion region) {
        RegionEntry e = new RegionEntry();
        e.file = path;
        e.location = region.location();
        e.function = region.function();
        e.line = region.pos().line();
        e.column = region.pos().column();
        e.kind = region.kind().name();
        e.decision = region.verdict().name();
        e.reason = region.rejection().map(RejectionReason::label).orElse(null);
        e.category = region.category().map(ResultCategory::label).orElse(null);
        e.detail = region.detail();
        e.tripEstimate = region.tripEstimate();
        e.costPerIteration = region.costPerIteration();
        e.benefit = region.benefit();
        e.combine = region.combine() == null ? null : region.combine().name();
        e.accumulationTarget = region.accumulationTarget();
        e.profile = region.profile() == null ? null : region.profile().name();
        e.suggestedBackend = region.profile() == null ? null : region.profile().suggestedBackend();
        e.privatized = names(region.privatized());
        e.captures = names(region.captures());
        e.evidence = region.evidence().stream().map(DependencyEdge::toString).collect(Collectors.toList());
        return e;
    }

    private static TransformEntry transform(String path, TransformResult result) {
        TransformEntry e = new TransformEntry();
        e.file = path;
        e.location = result.region().location();
        if (result instanceof TransformResult.Applied) {
            TransformResult.Applied applied = (TransformResult.Applied) result;
            e.outcome = "applied";
            e.combine = applied.combine().name();
            e.workers = applied.workers();
        } else if (result instanceof TransformResult.BackendMismatch) {
            e.outcome = "backend_mismatch";
            e.reason = ((TransformResult.BackendMismatch) result).reason();
        } else {
            e.outcome = "aborted";
            e.reason = ((TransformResult.TransformAborted) result).reason();
        }
        return e;
    }

    private static List<String> names(Collection<Symbol> symbols) {
        if (symbols == null) return List.of();
        return symbols.stream().map(Symbol::name).collect(Collectors.toList());
    }
}
