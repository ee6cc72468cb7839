package com.autopar.core;

import com.autopar.core.detect.DetectionResult;
import com.autopar.core.detect.RejectionReason;
import com.autopar.core.tree.NodeKind;
import com.autopar.core.tree.SyntaxTree;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ParallelizerTest {

    @Test
    void parallelizeRewritesOuterLoopOnly() {
        Kernels.Fixture f = Kernels.nested();
        SyntaxTree tree = f.tree();

        ParallelizationReport report = new Parallelizer().parallelize(tree);

        assertEquals(1, report.appliedCount());
        assertEquals(1, report.diagnostics().acceptedCount());
        assertEquals(1, report.diagnostics().rejectedCount());
        assertEquals(tree.version(), report.finalVersion());
        assertEquals(NodeKind.PARALLEL_TASK, tree.kind(f.loop()));
    }

    @Test
    void secondRunFindsNothingNew() {
        Kernels.Fixture f = Kernels.nested();
        SyntaxTree tree = f.tree();
        Parallelizer parallelizer = new Parallelizer();
        parallelizer.parallelize(tree);
        int version = tree.version();

        ParallelizationReport again = parallelizer.parallelize(tree);

        assertEquals(0, again.appliedCount());
        assertEquals(version, tree.version());
        assertTrue(again.detection().regions().stream()
            .allMatch(r -> r.reason() == RejectionReason.ENCLOSED_BY_PARALLEL_REGION));
    }

    @Test
    void analyzeDoesNotModifyTree() {
        Kernels.Fixture f = Kernels.fib();
        SyntaxTree tree = f.tree();
        long fingerprint = tree.fingerprint(tree.root());

        DetectionResult result = new Parallelizer().analyze(tree);

        assertEquals(1, result.accepted().size());
        assertEquals(fingerprint, tree.fingerprint(tree.root()));
    }
}
