package com.autopar.core.dependence;

import com.autopar.core.symbols.Symbol;
import com.autopar.core.tree.NodeId;

import java.util.List;
import java.util.Optional;
import java.util.SortedSet;

/**
 * Cross-iteration interactions of one loop.
 *
 * @param edges                  blocking loop-carried dependences
 * @param loopPrivate            symbols declared fresh in every iteration
 * @param shared                 symbols declared outside the loop and used by its body
 * @param benignAccumulations    append-only targets never read in the loop
 * @param disjointStores         containers written only at the induction variable's slot
 * @param privatizedTemporaries  outer locals that each iteration fully redefines before use
 * @param captures               shared symbols the body reads, i.e. the closure of a work unit
 * @param unknownSymbolWrites    writes the analysis could not attribute to a declaration
 */
public record LoopDependenceGraph(NodeId loop,
                                  List<DependencyEdge> edges,
                                  SortedSet<Symbol> loopPrivate,
                                  SortedSet<Symbol> shared,
                                  SortedSet<Symbol> benignAccumulations,
                                  SortedSet<Symbol> disjointStores,
                                  SortedSet<Symbol> privatizedTemporaries,
                                  SortedSet<Symbol> captures,
                                  SortedSet<Symbol> unknownSymbolWrites,
                                  SortedSet<String> unknownCallees,
                                  boolean callsUnknown,
                                  boolean hasIo,
                                  boolean inductionWritten) {

    public LoopDependenceGraph {
        edges = List.copyOf(edges);
    }

    public boolean hasCarriedDependence() {
        return !edges.isEmpty();
    }

    /** The single append target whose order the rewrite must reconstruct, if any. */
    public Optional<Symbol> accumulationTarget() {
        return benignAccumulations.isEmpty() ? Optional.empty() : Optional.of(benignAccumulations.first());
    }
}
