package com.autopar.core.transform;

import com.autopar.core.config.AnalysisConfig;
import com.autopar.core.config.BackendCapabilities;
import com.autopar.core.dependence.DependenceGraphBuilder;
import com.autopar.core.dependence.LoopDependenceGraph;
import com.autopar.core.detect.ParallelRegion;
import com.autopar.core.detect.RegionKind;
import com.autopar.core.effects.EffectAnalyzer;
import com.autopar.core.effects.EffectMap;
import com.autopar.core.symbols.Builtins;
import com.autopar.core.symbols.Symbol;
import com.autopar.core.symbols.SymbolTable;
import com.autopar.core.symbols.SymbolTableBuilder;
import com.autopar.core.transform.TransformResult.Applied;
import com.autopar.core.transform.TransformResult.BackendMismatch;
import com.autopar.core.transform.TransformResult.TransformAborted;
import com.autopar.core.tree.CombineKind;
import com.autopar.core.tree.MalformedTreeException;
import com.autopar.core.tree.NodeId;
import com.autopar.core.tree.NodeKind;
import com.autopar.core.tree.SyntaxNode;
import com.autopar.core.tree.SyntaxNode.*;
import com.autopar.core.tree.SyntaxTree;
import com.autopar.core.tree.TreeEditor;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Rewrites one accepted region into a {@code PARALLEL_TASK} node and splices it into the
 * tree in the region's own slot.
 *
 * The rewrite is staged in a {@link TreeEditor}; the tree only changes when the staged
 * arena validates and the region still looks the way the detector saw it. Everything else
 * comes back as a {@link TransformResult} with the tree untouched.
 */
public final class TransformationEngine {

    private final AnalysisConfig config;
    private final EffectAnalyzer analyzer;

    public TransformationEngine(AnalysisConfig config) {
        this.config = config;
        this.analyzer = new EffectAnalyzer(config);
    }

    public TransformResult apply(SyntaxTree tree, ParallelRegion region) {
        return apply(tree, region, config.backend());
    }

    /**
     * @throws IllegalArgumentException if {@code region} was rejected by the detector
     */
    public TransformResult apply(SyntaxTree tree, ParallelRegion region, BackendCapabilities backend) {
        if (!region.isAccepted()) {
            throw new IllegalArgumentException("Region " + region.location() + " was rejected ("
                + region.reason().label() + ") and cannot be transformed");
        }
        CombineKind combine = region.combine();
        if (combine.requiresOrderedCombination() && !backend.supportsOrderedMap()) {
            return new BackendMismatch(region, combine + " needs ordered combination, backend has none");
        }
        if (combine.requiresReduction() && !backend.supportsReduce()) {
            return new BackendMismatch(region, combine + " needs a reduce step, backend has none");
        }

        Optional<String> moved = ConsistencyCheck.locate(tree, region);
        if (moved.isPresent()) {
            return new TransformAborted(region, moved.get());
        }
        SymbolTable symbols = SymbolTableBuilder.build(tree);
        EffectMap effects = analyzer.analyze(symbols);

        TreeEditor editor = new TreeEditor(tree);
        try {
            NodeId task;
            int workers;
            if (region.kind() == RegionKind.LOOP) {
                LoopDependenceGraph g = DependenceGraphBuilder.build(effects, region.node());
                Optional<String> problem = ConsistencyCheck.loop(effects, region, g);
                if (problem.isPresent()) {
                    editor.discard();
                    return new TransformAborted(region, problem.get());
                }
                workers = workers(backend, region.tripEstimate());
                task = rewriteLoop(editor, symbols, region, g, workers);
            } else {
                NodeId function = tree.enclosing(region.node(), NodeKind.FUNCTION_DEF).orElse(NodeId.NONE);
                Optional<String> problem = ConsistencyCheck.recursion(effects, region, function);
                if (problem.isPresent()) {
                    editor.discard();
                    return new TransformAborted(region, problem.get());
                }
                workers = workers(backend, region.subCalls().size());
                task = rewriteRecursion(editor, symbols, region, workers);
            }
            int version = editor.commit();
            return new Applied(region, task, combine, workers, version);
        } catch (MalformedTreeException | IllegalStateException e) {
            editor.discard();
            return new TransformAborted(region, e.getMessage());
        }
    }

    private static int workers(BackendCapabilities backend, int units) {
        return Math.max(1, Math.min(backend.maxWorkers(), units));
    }

    private NodeId rewriteLoop(TreeEditor editor, SymbolTable symbols, ParallelRegion region,
                               LoopDependenceGraph g, int workers) {
        SyntaxTree tree = symbols.tree();
        NodeId loopId = region.node();
        Loop loop = tree.node(loopId, Loop.class);
        Block body = tree.node(loop.body(), Block.class);
        Symbol target = g.accumulationTarget().orElse(null);

        TreeEditor.Rewriter yields = new TreeEditor.Rewriter() {
            @Override
            public NodeId rewrite(NodeId original, SyntaxNode node, TreeEditor ed) {
                if (target == null || !(node instanceof ExprStmt)) return NodeId.NONE;
                NodeId expr = ((ExprStmt) node).expr();
                if (!isAppendTo(symbols, expr, target)) return NodeId.NONE;
                NodeId value = ed.copy(tree.node(expr, Call.class).args().get(0), this);
                return ed.allocate(new Yield(value, node.pos()));
            }
        };

        List<NodeId> statements = new ArrayList<>();
        for (Symbol temp : g.privatizedTemporaries()) {
            statements.add(editor.allocate(new VarDecl(temp.name(), NodeId.NONE, body.pos())));
        }
        for (NodeId stmt : body.statements()) {
            statements.add(editor.copy(stmt, yields));
        }
        NodeId template = editor.allocate(new Block(statements, body.pos()));

        ParallelTask task = new ParallelTask(region.combine(), loop.variable(), loop.loopKind(), loop.header(),
            List.of(template), NodeId.NONE, target == null ? null : target.name(), names(g.captures()),
            workers, loop.pos());
        editor.replace(loopId, task);
        return loopId;
    }

    private NodeId rewriteRecursion(TreeEditor editor, SymbolTable symbols, ParallelRegion region, int workers) {
        SyntaxTree tree = symbols.tree();
        NodeId expr = region.node();
        List<NodeId> calls = region.subCalls();
        List<NodeId> units = new ArrayList<>();
        for (NodeId call : calls) {
            units.add(editor.copy(call));
        }
        NodeId join = editor.copy(expr, (original, node, ed) -> {
            int k = calls.indexOf(original);
            return k < 0 ? NodeId.NONE : ed.allocate(new UnitResult(k, node.pos()));
        });
        Set<Symbol> reads = region.captures();
        SyntaxNode original = tree.node(expr);
        editor.replace(expr, new ParallelTask(CombineKind.FORK_JOIN, null, null, NodeId.NONE,
            units, join, null, names(reads), workers, original.pos()));
        return expr;
    }

    private static boolean isAppendTo(SymbolTable symbols, NodeId expr, Symbol target) {
        SyntaxNode node = symbols.tree().node(expr);
        if (!(node instanceof Call)) return false;
        Call call = (Call) node;
        return call.hasReceiver()
            && Builtins.isAppendMethod(call.callee())
            && call.args().size() == 1
            && symbols.tree().kind(call.receiver()) == NodeKind.NAME
            && target.equals(symbols.referenceAt(call.receiver()));
    }

    private static List<String> names(Set<Symbol> symbols) {
        List<String> out = new ArrayList<>();
        for (Symbol s : symbols) {
            if (!s.isUnknown() && !out.contains(s.name())) out.add(s.name());
        }
        return out;
    }
}
