package com.autopar.core.transform;

import com.autopar.core.dependence.FreshCollections;
import com.autopar.core.dependence.LoopDependenceGraph;
import com.autopar.core.detect.ParallelRegion;
import com.autopar.core.detect.RegionKind;
import com.autopar.core.effects.EffectMap;
import com.autopar.core.effects.EffectSet;
import com.autopar.core.symbols.Symbol;
import com.autopar.core.tree.CombineKind;
import com.autopar.core.tree.NodeId;
import com.autopar.core.tree.NodeKind;
import com.autopar.core.tree.SyntaxNode.Loop;
import com.autopar.core.tree.SyntaxNode.ParallelTask;
import com.autopar.core.tree.SyntaxTree;

import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Re-verifies a region against the current tree right before the rewrite is committed.
 * Returns the first inconsistency found.
 */
final class ConsistencyCheck {

    private ConsistencyCheck() {}

    static Optional<String> locate(SyntaxTree tree, ParallelRegion region) {
        NodeId id = region.node();
        if (id.index() >= tree.size() || !tree.isReachable(id)) {
            return Optional.of("region " + region.location() + " is no longer part of the tree");
        }
        NodeKind expected = region.kind() == RegionKind.LOOP ? NodeKind.LOOP : tree.kind(id);
        if (tree.kind(id) != expected || tree.fingerprint(id) != region.fingerprint()) {
            return Optional.of("region " + region.location() + " changed since it was analyzed");
        }
        return Optional.empty();
    }

    static Optional<String> loop(EffectMap effects, ParallelRegion region, LoopDependenceGraph g) {
        SyntaxTree tree = effects.symbols().tree();
        if (g.callsUnknown() || g.hasCarriedDependence() || !g.unknownSymbolWrites().isEmpty()) {
            return Optional.of("loop-carried dependence found on re-check");
        }
        String target = g.accumulationTarget().map(Symbol::name).orElse(null);
        if (target == null ? region.accumulationTarget() != null : !target.equals(region.accumulationTarget())) {
            return Optional.of("accumulation target changed");
        }
        EffectSet body = effects.of(tree.node(region.node(), Loop.class).body());
        Set<Symbol> closure = g.captures();
        for (Symbol s : closure) {
            if (body.writes(s)) {
                return Optional.of("captured " + s.name() + " is written by the loop body");
            }
        }
        Optional<String> outer = enclosingTaskWrites(effects, region.node(), closure);
        if (outer.isPresent()) return outer;
        if (region.combine() == CombineKind.ORDERED_COLLECT
                && !FreshCollections.isFreshBefore(effects.symbols(), g.accumulationTarget().get(), region.node())) {
            return Optional.of("collection " + target + " is no longer freshly declared before the loop");
        }
        return Optional.empty();
    }

    static Optional<String> recursion(EffectMap effects, ParallelRegion region, NodeId function) {
        EffectSet here = effects.of(region.node());
        EffectSet summary = effects.summary(function);
        if (here.callsUnknown() || summary.callsUnknown() || !here.writes().isEmpty()
                || !summary.writes().isEmpty() || here.hasIo() || summary.hasIo()
                || !effects.parameterMutations(function).isEmpty()) {
            return Optional.of("sub-calls are no longer side-effect free");
        }
        return enclosingTaskWrites(effects, region.node(), new TreeSet<>(here.reads()));
    }

    /** An enclosing parallel task must not write anything this region captures. */
    private static Optional<String> enclosingTaskWrites(EffectMap effects, NodeId id, Set<Symbol> closure) {
        SyntaxTree tree = effects.symbols().tree();
        for (NodeId cur = tree.parentOf(id); cur.isPresent(); cur = tree.parentOf(cur)) {
            if (tree.kind(cur) != NodeKind.PARALLEL_TASK) continue;
            for (NodeId unit : tree.node(cur, ParallelTask.class).units()) {
                for (Symbol s : closure) {
                    if (effects.of(unit).writes(s)) {
                        return Optional.of("enclosing parallel task at " + tree.node(cur).pos()
                            + " writes captured " + s.name());
                    }
                }
            }
        }
        return Optional.empty();
    }
}
