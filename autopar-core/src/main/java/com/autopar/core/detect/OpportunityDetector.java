package com.autopar.core.detect;

import com.autopar.core.config.AnalysisConfig;
import com.autopar.core.dependence.DependenceGraphBuilder;
import com.autopar.core.dependence.DependencyEdge;
import com.autopar.core.dependence.FreshCollections;
import com.autopar.core.dependence.LoopDependenceGraph;
import com.autopar.core.effects.EffectAnalyzer;
import com.autopar.core.effects.EffectMap;
import com.autopar.core.effects.EffectSet;
import com.autopar.core.symbols.Callee;
import com.autopar.core.symbols.Symbol;
import com.autopar.core.symbols.SymbolTable;
import com.autopar.core.symbols.SymbolTableBuilder;
import com.autopar.core.tree.CombineKind;
import com.autopar.core.tree.IoMode;
import com.autopar.core.tree.LoopKind;
import com.autopar.core.tree.NodeId;
import com.autopar.core.tree.NodeKind;
import com.autopar.core.tree.SyntaxNode;
import com.autopar.core.tree.SyntaxNode.*;
import com.autopar.core.tree.SyntaxTree;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Applies the safety predicate to every loop and recursive region of a tree and ranks
 * the results. Rejected candidates stay in the result with their reason.
 *
 * Regions are visited outside-in, so a region nested in an already accepted one is
 * rejected as {@link RejectionReason#ENCLOSED_BY_PARALLEL_REGION} unless nested
 * parallelism is enabled.
 */
public final class OpportunityDetector {

    private static final Comparator<ParallelRegion> RANK = Comparator
        .comparingDouble(ParallelRegion::benefit).reversed()
        .thenComparing(ParallelRegion::pos)
        .thenComparing(ParallelRegion::node);

    private final AnalysisConfig config;
    private final EffectAnalyzer analyzer;

    public OpportunityDetector(AnalysisConfig config) {
        this.config = config;
        this.analyzer = new EffectAnalyzer(config);
    }

    public AnalysisConfig config() {
        return config;
    }

    public DetectionResult detect(SyntaxTree tree) {
        return detect(analyzer.analyze(SymbolTableBuilder.build(tree)));
    }

    public DetectionResult detect(EffectMap effects) {
        return new Pass(effects).run();
    }

    public EffectMap effects(SyntaxTree tree) {
        return analyzer.analyze(SymbolTableBuilder.build(tree));
    }

    private final class Pass {
        private final EffectMap effects;
        private final SymbolTable symbols;
        private final SyntaxTree tree;
        private final TripCountEstimator trips;
        private final CostModel costs;
        private final List<ParallelRegion> regions = new ArrayList<>();
        private final Set<NodeId> accepted = new HashSet<>();

        Pass(EffectMap effects) {
            this.effects = effects;
            this.symbols = effects.symbols();
            this.tree = symbols.tree();
            this.trips = new TripCountEstimator(symbols, config.defaultTripCount());
            this.costs = new CostModel(symbols, trips);
        }

        DetectionResult run() {
            walk(tree.root(), NodeId.NONE);
            regions.sort(RANK);
            return new DetectionResult(symbols.version(), regions);
        }

        private void walk(NodeId id, NodeId function) {
            SyntaxNode node = tree.node(id);
            if (node.kind() == NodeKind.FUNCTION_DEF) {
                function = id;
            }
            if (node.kind() == NodeKind.LOOP) {
                record(loop(id, (Loop) node, function));
            } else if (function.isPresent()) {
                NodeId expr = recursionCandidate(node);
                if (expr.isPresent()) {
                    List<NodeId> calls = directSelfCalls(expr, function);
                    if (calls.size() >= 2) {
                        record(recursion(expr, function, calls));
                    }
                }
            }
            for (NodeId child : node.children()) {
                walk(child, function);
            }
        }

        private void record(ParallelRegion region) {
            regions.add(region);
            if (region.isAccepted()) accepted.add(region.node());
        }

        private ParallelRegion loop(NodeId id, Loop loop, NodeId function) {
            LoopDependenceGraph g = DependenceGraphBuilder.build(effects, id);
            int trip = trips.estimate(loop);
            double cost = costs.cost(loop.body());
            if (loop.loopKind() == LoopKind.WHILE) {
                cost += costs.cost(loop.header());
            }

            RejectionReason reason = null;
            String detail = null;
            Optional<NodeId> outer = enclosingParallelRegion(id);
            if (outer.isPresent()) {
                reason = RejectionReason.ENCLOSED_BY_PARALLEL_REGION;
                detail = "inside parallel region at " + tree.node(outer.get()).pos();
            } else if (g.callsUnknown()) {
                reason = RejectionReason.UNKNOWN_CALL;
                detail = "calls " + String.join(", ", g.unknownCallees());
            } else if (!g.unknownSymbolWrites().isEmpty()) {
                reason = RejectionReason.UNKNOWN_SYMBOL_WRITE;
                detail = "writes " + names(g.unknownSymbolWrites());
            } else if (!loop.loopKind().isCountable()) {
                reason = RejectionReason.NOT_COUNTABLE;
                detail = "while loop";
            } else if (loop.loopKind() == LoopKind.FOR_RANGE && g.inductionWritten()) {
                reason = RejectionReason.NOT_COUNTABLE;
                detail = "induction variable " + loop.variable() + " is written in the body";
            } else if (hasEarlyExit(loop.body(), false)) {
                reason = RejectionReason.EARLY_EXIT;
                detail = "break or return in the body";
            } else if (g.hasCarriedDependence()) {
                reason = RejectionReason.LOOP_CARRIED_DEPENDENCE;
                detail = g.edges().stream().map(DependencyEdge::toString).collect(Collectors.joining("; "));
            } else if (g.hasIo() && !isIoDisjoint(loop, id)) {
                reason = RejectionReason.SHARED_IO;
                detail = "I/O targets are not distinct per iteration";
            } else if (trip < config.minIterations()) {
                reason = RejectionReason.TOO_SMALL;
                detail = "estimated " + trip + " iterations, minimum " + config.minIterations();
            }

            CombineKind combine = null;
            String target = null;
            if (reason == null) {
                Optional<Symbol> acc = g.accumulationTarget();
                if (acc.isPresent()) {
                    target = acc.get().name();
                    combine = FreshCollections.isFreshBefore(symbols, acc.get(), id)
                        ? CombineKind.ORDERED_COLLECT
                        : CombineKind.ORDERED_APPEND;
                } else {
                    combine = CombineKind.INDEXED_STORE;
                }
            }
            return new ParallelRegion(id, RegionKind.LOOP, functionName(function), loop.pos(),
                reason == null ? Verdict.ACCEPTED : Verdict.REJECTED, reason, detail,
                trip, cost, trip * cost, combine, target,
                g.loopPrivate(), g.shared(), g.captures(), g.privatizedTemporaries(),
                reason == RejectionReason.LOOP_CARRIED_DEPENDENCE ? g.edges() : List.of(),
                List.of(), WorkloadClassifier.classify(tree, id), tree.fingerprint(id));
        }

        private ParallelRegion recursion(NodeId expr, NodeId function, List<NodeId> calls) {
            EffectSet summary = effects.summary(function);
            EffectSet here = effects.of(expr);
            int trip = calls.size();
            double cost = costs.functionCost(function);

            RejectionReason reason = null;
            String detail = null;
            Optional<NodeId> outer = enclosingParallelRegion(expr);
            if (outer.isPresent()) {
                reason = RejectionReason.ENCLOSED_BY_PARALLEL_REGION;
                detail = "inside parallel region at " + tree.node(outer.get()).pos();
            } else if (summary.callsUnknown() || here.callsUnknown()) {
                TreeSet<String> callees = new TreeSet<>(summary.unknownCallees());
                callees.addAll(here.unknownCallees());
                reason = RejectionReason.UNKNOWN_CALL;
                detail = "calls " + String.join(", ", callees);
            } else if (!summary.writes().isEmpty() || summary.hasIo()
                    || !here.writes().isEmpty() || here.hasIo()) {
                reason = RejectionReason.IMPURE_RECURSION;
                detail = "sub-calls write shared state or perform I/O";
            } else if (!effects.parameterMutations(function).isEmpty()) {
                reason = RejectionReason.IMPURE_RECURSION;
                detail = "sub-calls change arguments " + effects.parameterMutations(function);
            } else if (trip < config.minIterations()) {
                reason = RejectionReason.TOO_SMALL;
                detail = trip + " sub-calls, minimum " + config.minIterations();
            }
            TreeSet<Symbol> reads = new TreeSet<>(here.reads());
            return new ParallelRegion(expr, RegionKind.RECURSION, functionName(function), tree.node(expr).pos(),
                reason == null ? Verdict.ACCEPTED : Verdict.REJECTED, reason, detail,
                trip, cost, trip * cost, reason == null ? CombineKind.FORK_JOIN : null, null,
                new TreeSet<>(), reads, reads, new TreeSet<>(), List.of(), calls,
                WorkloadClassifier.classify(tree, function), tree.fingerprint(expr));
        }

        private Optional<NodeId> enclosingParallelRegion(NodeId id) {
            if (config.nestedParallelism()) return Optional.empty();
            for (NodeId cur = tree.parentOf(id); cur.isPresent(); cur = tree.parentOf(cur)) {
                if (accepted.contains(cur) || tree.kind(cur) == NodeKind.PARALLEL_TASK) {
                    return Optional.of(cur);
                }
            }
            return Optional.empty();
        }

        /** Expression positions that may hold a fork-join shape. */
        private NodeId recursionCandidate(SyntaxNode node) {
            NodeId expr = switch (node.kind()) {
                case RETURN -> ((Return) node).value();
                case VAR_DECL -> ((VarDecl) node).init();
                case ASSIGN -> ((Assign) node).value();
                case EXPR_STMT -> ((ExprStmt) node).expr();
                default -> NodeId.NONE;
            };
            // already rewritten
            return expr.isPresent() && tree.kind(expr) == NodeKind.PARALLEL_TASK ? NodeId.NONE : expr;
        }

        /** Self-calls in {@code expr} that are not nested inside another self-call. */
        private List<NodeId> directSelfCalls(NodeId expr, NodeId function) {
            List<NodeId> out = new ArrayList<>();
            Deque<NodeId> work = new ArrayDeque<>();
            work.push(expr);
            while (!work.isEmpty()) {
                NodeId id = work.pop();
                SyntaxNode node = tree.node(id);
                if (node instanceof Call) {
                    Callee callee = symbols.resolveCallee(id);
                    if (callee.kind() == Callee.Kind.MODULE_FUNCTION && callee.function().equals(function)) {
                        out.add(id);
                        continue;
                    }
                }
                List<NodeId> children = node.children();
                for (int k = children.size() - 1; k >= 0; k--) {
                    work.push(children.get(k));
                }
            }
            return out;
        }

        private boolean hasEarlyExit(NodeId id, boolean insideInnerLoop) {
            SyntaxNode node = tree.node(id);
            switch (node.kind()) {
                case RETURN -> {
                    return true;
                }
                case BREAK -> {
                    return !insideInnerLoop;
                }
                case FUNCTION_DEF -> {
                    return false;
                }
                default -> { }
            }
            boolean inner = insideInnerLoop || node.kind() == NodeKind.LOOP;
            for (NodeId child : node.children()) {
                if (hasEarlyExit(child, inner)) return true;
            }
            return false;
        }

        /**
         * Targeted reads are always fine. Writes are fine when every write target is the
         * same pattern keyed on an iteration variable whose values are distinct. Console
         * I/O and I/O inside called functions never are.
         */
        private boolean isIoDisjoint(Loop loop, NodeId loopId) {
            Optional<Symbol> induction = symbols.declaredAt(loopId);
            boolean distinct = loop.loopKind() == LoopKind.FOR_RANGE || hasDistinctLiterals(loop.header());
            Long writePattern = null;
            List<NodeId> readTargets = new ArrayList<>();
            for (NodeId id : tree.preorder(loop.body())) {
                SyntaxNode node = tree.node(id);
                if (node instanceof IoOp) {
                    IoOp io = (IoOp) node;
                    NodeId target = io.target();
                    if (target.isNone()) return false;
                    if (io.mode() == IoMode.READ) {
                        readTargets.add(target);
                        continue;
                    }
                    if (!distinct || induction.isEmpty() || keyedNames(target, induction.get()) != 1) {
                        return false;
                    }
                    long fp = tree.fingerprint(target);
                    if (writePattern == null) {
                        writePattern = fp;
                    } else if (writePattern != fp) {
                        return false;
                    }
                } else if (node instanceof Call) {
                    Callee callee = symbols.resolveCallee(id);
                    if (callee.kind() == Callee.Kind.IO_BUILTIN) return false;
                    if (callee.kind() == Callee.Kind.MODULE_FUNCTION && effects.summary(callee.function()).hasIo()) {
                        return false;
                    }
                }
            }
            if (writePattern != null) {
                for (NodeId r : readTargets) {
                    if (tree.fingerprint(r) != writePattern) return false;
                }
            }
            return true;
        }

        /**
         * Number of references to {@code induction} in a target built only from that variable
         * and string literals joined with {@code +}; -1 for any other shape.
         */
        private int keyedNames(NodeId id, Symbol induction) {
            SyntaxNode node = tree.node(id);
            if (node instanceof Name) {
                return induction.equals(symbols.referenceAt(id)) ? 1 : -1;
            }
            if (node instanceof Literal && ((Literal) node).value() instanceof String) {
                return 0;
            }
            if (node instanceof Binary && "+".equals(((Binary) node).op())) {
                int left = keyedNames(((Binary) node).left(), induction);
                int right = keyedNames(((Binary) node).right(), induction);
                return left < 0 || right < 0 ? -1 : left + right;
            }
            return -1;
        }

        private boolean hasDistinctLiterals(NodeId header) {
            SyntaxNode node = tree.node(header);
            if (node instanceof Range) return true;
            if (!(node instanceof ListExpr)) return false;
            // compared as text: 1 and "1" name the same file
            Set<String> seen = new HashSet<>();
            for (NodeId e : ((ListExpr) node).elements()) {
                SyntaxNode el = tree.node(e);
                if (!(el instanceof Literal) || !seen.add(String.valueOf(((Literal) el).value()))) return false;
            }
            return true;
        }

        private String functionName(NodeId function) {
            return function.isNone() ? null : tree.node(function, FunctionDef.class).name();
        }

        private String names(Set<Symbol> symbols) {
            return symbols.stream().map(Symbol::name).collect(Collectors.joining(", "));
        }
    }
}
