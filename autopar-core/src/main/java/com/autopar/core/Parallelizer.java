package com.autopar.core;

import com.autopar.core.config.AnalysisConfig;
import com.autopar.core.detect.DetectionResult;
import com.autopar.core.detect.OpportunityDetector;
import com.autopar.core.detect.ParallelRegion;
import com.autopar.core.transform.TransformResult;
import com.autopar.core.transform.TransformationEngine;
import com.autopar.core.tree.SyntaxTree;

import java.util.ArrayList;
import java.util.List;

/**
 * Entry point to the analysis: detect candidates, then rewrite the accepted ones.
 *
 * Instances hold no per-tree state and may be shared; concurrent calls must use
 * distinct trees.
 */
public final class Parallelizer {

    private final AnalysisConfig config;
    private final OpportunityDetector detector;
    private final TransformationEngine engine;

    public Parallelizer(AnalysisConfig config) {
        this.config = config;
        this.detector = new OpportunityDetector(config);
        this.engine = new TransformationEngine(config);
    }

    public Parallelizer() {
        this(AnalysisConfig.defaults());
    }

    public AnalysisConfig config() {
        return config;
    }

    /** Ranked candidates for the current tree version. Does not modify the tree. */
    public DetectionResult analyze(SyntaxTree tree) {
        DetectionResult result = detector.detect(tree);
        System.err.println("[autopar] Analyzed " + result.regions().size() + " candidate regions ("
            + result.accepted().size() + " accepted, " + result.rejected().size() + " rejected)");
        return result;
    }

    public TransformResult apply(SyntaxTree tree, ParallelRegion region) {
        return engine.apply(tree, region);
    }

    /**
     * Analyzes {@code tree} and applies every accepted region in rank order. Regions that
     * an earlier rewrite removed from the tree are skipped.
     */
    public ParallelizationReport parallelize(SyntaxTree tree) {
        DetectionResult detection = analyze(tree);
        List<TransformResult> outcomes = new ArrayList<>();
        for (ParallelRegion region : detection.accepted()) {
            if (!tree.isReachable(region.node())) {
                System.err.println("[autopar] Skipping " + region.location() + ": removed by an earlier rewrite");
                continue;
            }
            TransformResult result = engine.apply(tree, region);
            outcomes.add(result);
            if (result instanceof TransformResult.Applied) {
                TransformResult.Applied applied = (TransformResult.Applied) result;
                System.err.println("[autopar] Rewrote " + region.location() + " as " + applied.combine()
                    + " with " + applied.workers() + " workers");
            } else if (result instanceof TransformResult.BackendMismatch) {
                System.err.println("[autopar] WARNING: backend mismatch at " + region.location() + ": "
                    + ((TransformResult.BackendMismatch) result).reason());
            } else {
                System.err.println("[autopar] WARNING: rewrite aborted at " + region.location() + ": "
                    + ((TransformResult.TransformAborted) result).reason());
            }
        }
        return new ParallelizationReport(detection, outcomes, tree.version());
    }
}
