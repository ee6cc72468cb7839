package com.autopar.core.effects;

import com.autopar.core.symbols.SymbolTable;
import com.autopar.core.tree.NodeId;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Effect summaries for every reachable node of one tree version, plus the caller-visible
 * summary of every function that was analyzed.
 */
public final class EffectMap {

    private final SymbolTable symbols;
    private final Map<NodeId, EffectSet> nodes;
    private final Map<NodeId, EffectSet> functionSummaries;
    private final Map<NodeId, SortedSet<Integer>> mutatedParameters;
    private final AliasMap aliases;

    EffectMap(SymbolTable symbols, Map<NodeId, EffectSet> nodes, Map<NodeId, EffectSet> functionSummaries,
              Map<NodeId, SortedSet<Integer>> mutatedParameters, AliasMap aliases) {
        this.symbols = symbols;
        this.nodes = Map.copyOf(nodes);
        this.functionSummaries = Map.copyOf(functionSummaries);
        Map<NodeId, SortedSet<Integer>> params = new HashMap<>();
        mutatedParameters.forEach((k, v) -> params.put(k, Collections.unmodifiableSortedSet(new TreeSet<>(v))));
        this.mutatedParameters = Map.copyOf(params);
        this.aliases = aliases;
    }

    public SymbolTable symbols() {
        return symbols;
    }

    public int version() {
        return symbols.version();
    }

    /** Effects of {@code id}; nodes the analysis never reached get the most conservative summary. */
    public EffectSet of(NodeId id) {
        EffectSet e = nodes.get(id);
        return e != null ? e : EffectAnalyzer.UNANALYZED;
    }

    /** What a call to {@code functionId} does from the caller's point of view. */
    public EffectSet summary(NodeId functionId) {
        EffectSet e = functionSummaries.get(functionId);
        return e != null ? e : EffectAnalyzer.UNANALYZED;
    }

    /** Positions of the parameters whose containers {@code functionId} may change. */
    public SortedSet<Integer> parameterMutations(NodeId functionId) {
        return mutatedParameters.getOrDefault(functionId, Collections.emptySortedSet());
    }

    public AliasMap aliases() {
        return aliases;
    }
}
