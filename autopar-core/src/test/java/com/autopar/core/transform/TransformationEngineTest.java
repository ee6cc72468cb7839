package com.autopar.core.transform;

import com.autopar.core.Kernels;
import com.autopar.core.config.AnalysisConfig;
import com.autopar.core.config.BackendCapabilities;
import com.autopar.core.detect.OpportunityDetector;
import com.autopar.core.detect.ParallelRegion;
import com.autopar.core.tree.CombineKind;
import com.autopar.core.tree.NodeId;
import com.autopar.core.tree.NodeKind;
import com.autopar.core.tree.SyntaxNode.Binary;
import com.autopar.core.tree.SyntaxNode.Block;
import com.autopar.core.tree.SyntaxNode.ParallelTask;
import com.autopar.core.tree.SyntaxNode.UnitResult;
import com.autopar.core.tree.SyntaxNode.VarDecl;
import com.autopar.core.tree.SyntaxTree;
import com.autopar.core.tree.TreeBuilder;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TransformationEngineTest {

    private static final AnalysisConfig CONFIG = AnalysisConfig.defaults()
        .withBackend(new BackendCapabilities(true, true, 4));

    private static ParallelRegion detect(Kernels.Fixture f) {
        return new OpportunityDetector(CONFIG).detect(f.tree()).find(f.loop()).orElseThrow();
    }

    @Test
    void orderedCollectBecomesParallelTaskWithYield() {
        Kernels.Fixture f = Kernels.doubleAll();
        SyntaxTree tree = f.tree();
        int before = tree.version();

        TransformResult result = new TransformationEngine(CONFIG).apply(tree, detect(f));

        TransformResult.Applied applied = assertInstanceOf(TransformResult.Applied.class, result);
        assertEquals(CombineKind.ORDERED_COLLECT, applied.combine());
        assertEquals(4, applied.workers());
        assertEquals(before + 1, tree.version());
        assertEquals(applied.version(), tree.version());

        ParallelTask task = tree.node(f.loop(), ParallelTask.class);
        assertEquals("x", task.variable());
        assertEquals("out", task.target());
        assertEquals(1, task.units().size());
        assertEquals(NodeId.NONE, task.join());
        Kernels.first(tree, task.units().get(0), NodeKind.YIELD);
        assertFalse(tree.preorder(task.units().get(0)).stream().anyMatch(id -> tree.kind(id) == NodeKind.CALL),
            "append was replaced by the yield");
    }

    @Test
    void privatizedTemporaryIsRedeclaredInTemplate() {
        Kernels.Fixture f = Kernels.temporary();
        SyntaxTree tree = f.tree();
        assertTrue(new TransformationEngine(CONFIG).apply(tree, detect(f)).isApplied());

        ParallelTask task = tree.node(f.loop(), ParallelTask.class);
        Block template = tree.node(task.units().get(0), Block.class);
        VarDecl first = tree.node(template.statements().get(0), VarDecl.class);
        assertEquals("t", first.name());
        assertTrue(first.init().isNone());
    }

    @Test
    void indexedStoreKeepsTheStore() {
        Kernels.Fixture f = Kernels.squares();
        SyntaxTree tree = f.tree();
        TransformResult result = new TransformationEngine(CONFIG).apply(tree, detect(f));

        assertTrue(result.isApplied());
        ParallelTask task = tree.node(f.loop(), ParallelTask.class);
        assertEquals(CombineKind.INDEXED_STORE, task.combine());
        assertNull(task.target());
        Kernels.first(tree, task.units().get(0), NodeKind.ASSIGN);
    }

    @Test
    void recursionBecomesForkJoin() {
        Kernels.Fixture f = Kernels.fib();
        SyntaxTree tree = f.tree();
        TransformResult result = new TransformationEngine(CONFIG).apply(tree, detect(f));

        assertTrue(result.isApplied());
        ParallelTask task = tree.node(f.loop(), ParallelTask.class);
        assertEquals(CombineKind.FORK_JOIN, task.combine());
        assertEquals(2, task.units().size());
        assertEquals(NodeKind.CALL, tree.kind(task.units().get(0)));
        Binary join = tree.node(task.join(), Binary.class);
        assertEquals(0, tree.node(join.left(), UnitResult.class).unit());
        assertEquals(1, tree.node(join.right(), UnitResult.class).unit());
        assertEquals(2, ((TransformResult.Applied) result).workers());
    }

    @Test
    void backendWithoutOrderedMapLeavesTreeUntouched() {
        Kernels.Fixture f = Kernels.doubleAll();
        SyntaxTree tree = f.tree();
        int version = tree.version();
        long fingerprint = tree.fingerprint(tree.root());

        TransformResult result = new TransformationEngine(CONFIG)
            .apply(tree, detect(f), new BackendCapabilities(false, true, 4));

        assertInstanceOf(TransformResult.BackendMismatch.class, result);
        assertEquals(version, tree.version());
        assertEquals(fingerprint, tree.fingerprint(tree.root()));
    }

    @Test
    void rejectedRegionCannotBeApplied() {
        Kernels.Fixture f = Kernels.sumAll();
        ParallelRegion rejected = detect(f);
        assertThrows(IllegalArgumentException.class, () -> new TransformationEngine(CONFIG).apply(f.tree(), rejected));
    }

    @Test
    void secondApplyOfSameRegionAborts() {
        Kernels.Fixture f = Kernels.doubleAll();
        SyntaxTree tree = f.tree();
        ParallelRegion region = detect(f);
        TransformationEngine engine = new TransformationEngine(CONFIG);
        assertTrue(engine.apply(tree, region).isApplied());
        int version = tree.version();

        TransformResult again = engine.apply(tree, region);

        assertInstanceOf(TransformResult.TransformAborted.class, again);
        assertEquals(version, tree.version());
    }

    @Test
    void collectionSeededBeforeTheLoopAbortsOnRecheck() {
        SyntaxTree analyzed = fill(false);
        SyntaxTree changed = fill(true);
        NodeId loop = Kernels.loops(analyzed, analyzed.root()).get(0);
        assertEquals(loop, Kernels.loops(changed, changed.root()).get(0));
        assertEquals(analyzed.fingerprint(loop), changed.fingerprint(loop));
        ParallelRegion region = new OpportunityDetector(CONFIG).detect(analyzed).find(loop).orElseThrow();
        assertEquals(CombineKind.ORDERED_COLLECT, region.combine());
        int version = changed.version();

        TransformResult result = new TransformationEngine(CONFIG).apply(changed, region);

        TransformResult.TransformAborted aborted = assertInstanceOf(TransformResult.TransformAborted.class, result);
        assertTrue(aborted.reason().contains("no longer freshly declared"), aborted.reason());
        assertEquals(version, changed.version());
        assertEquals(NodeKind.LOOP, changed.kind(loop));
    }

    /**
     * {@code out = []; for x in xs { out.add(x * 2) } return out}, optionally with {@code out.add(99)}
     * before the loop. The extra statement is allocated after the loop so the loop keeps its id.
     */
    private static SyntaxTree fill(boolean seeded) {
        TreeBuilder b = new TreeBuilder();
        NodeId decl = b.varDecl("out", b.list());
        NodeId loop = b.forEach("x", b.name("xs"),
            b.block(b.append("out", b.binary("*", b.name("x"), b.literal(2)))));
        NodeId ret = b.ret(b.name("out"));
        List<NodeId> statements = seeded
            ? List.of(decl, b.append("out", b.literal(99)), loop, ret)
            : List.of(decl, loop, ret);
        NodeId fn = b.function("fill", List.of("xs"), b.block(statements));
        return b.build(b.program("kernels", fn));
    }

    @Test
    void workersNeverExceedTripCount() {
        Kernels.Fixture f = Kernels.writesFiles();
        AnalysisConfig wide = CONFIG.withBackend(new BackendCapabilities(true, true, 32));
        ParallelRegion region = new OpportunityDetector(wide).detect(f.tree()).find(f.loop()).orElseThrow();

        TransformResult result = new TransformationEngine(wide).apply(f.tree(), region);

        assertEquals(4, ((TransformResult.Applied) result).workers());
    }
}
