package com.autopar.core.dependence;

import com.autopar.core.effects.EffectMap;
import com.autopar.core.effects.EffectSet;
import com.autopar.core.symbols.Symbol;
import com.autopar.core.symbols.SymbolTable;
import com.autopar.core.tree.LoopKind;
import com.autopar.core.tree.NodeId;
import com.autopar.core.tree.NodeKind;
import com.autopar.core.tree.SyntaxNode;
import com.autopar.core.tree.SyntaxNode.Loop;
import com.autopar.core.tree.SyntaxNode.Name;
import com.autopar.core.tree.SyntaxNode.VarDecl;
import com.autopar.core.tree.SyntaxTree;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Decides, per symbol, whether two iterations of a loop can interact.
 *
 * Only symbols declared outside the loop can carry a value from one iteration to the next.
 * For each of them that the body writes, the builder either excuses the write (append-only
 * accumulation, disjoint slot stores, privatizable temporaries) or emits edges between
 * iteration {@code i} and {@code i+1}: flow and anti edges when some read is upward-exposed,
 * an output edge otherwise.
 */
public final class DependenceGraphBuilder {

    private static final String WHILE_ITERATION = "<iter>";

    private DependenceGraphBuilder() {}

    public static LoopDependenceGraph build(EffectMap effects, NodeId loopId) {
        SymbolTable symbols = effects.symbols();
        SyntaxTree tree = symbols.tree();
        Loop loop = tree.node(loopId, Loop.class);
        NodeId function = tree.enclosing(loopId, NodeKind.FUNCTION_DEF).orElse(NodeId.NONE);

        // a while condition runs once per iteration, a for header only once
        boolean perIterationHeader = loop.loopKind() == LoopKind.WHILE;
        EffectSet.Builder bodyEffects = new EffectSet.Builder().add(effects.of(loop.body()));
        List<Access> accesses;
        if (perIterationHeader) {
            bodyEffects.add(effects.of(loop.header()));
            accesses = DefUseOrder.of(effects, loopId, loop.header(), loop.body());
        } else {
            accesses = DefUseOrder.of(effects, loopId, loop.body());
        }
        EffectSet body = bodyEffects.build();

        Map<Symbol, List<Access>> bySymbol = new TreeMap<>();
        for (Access a : accesses) {
            bySymbol.computeIfAbsent(a.symbol(), k -> new ArrayList<>()).add(a);
        }

        Optional<Symbol> induction = symbols.declaredAt(loopId);
        TreeSet<Symbol> loopPrivate = new TreeSet<>();
        induction.ifPresent(loopPrivate::add);
        TreeSet<Symbol> shared = new TreeSet<>();
        TreeSet<Symbol> unknownWrites = new TreeSet<>();
        boolean inductionWritten = false;
        for (Map.Entry<Symbol, List<Access>> e : bySymbol.entrySet()) {
            Symbol s = e.getKey();
            boolean written = e.getValue().stream().anyMatch(Access::isWrite);
            if (s.isUnknown()) {
                if (written) unknownWrites.add(s);
            } else if (symbols.isDeclaredWithin(s, loopId)) {
                loopPrivate.add(s);
                if (induction.isPresent() && s.equals(induction.get()) && written) {
                    inductionWritten = true;
                }
            } else {
                shared.add(s);
            }
        }

        TreeSet<Symbol> appendOnly = new TreeSet<>();
        for (Symbol s : shared) {
            List<Access> list = bySymbol.get(s);
            if (list.stream().allMatch(a -> a.kind() == Access.Kind.APPEND)) {
                appendOnly.add(s);
            }
        }
        // order can be reconstructed for one accumulation target per loop
        TreeSet<Symbol> benign = new TreeSet<>();
        if (appendOnly.size() == 1) benign.addAll(appendOnly);

        IterationRef i = IterationRef.current(loop.variable() != null ? loop.variable() : WHILE_ITERATION);
        List<DependencyEdge> edges = new ArrayList<>();
        TreeSet<Symbol> disjoint = new TreeSet<>();
        TreeSet<Symbol> privatized = new TreeSet<>();
        TreeSet<Symbol> captures = new TreeSet<>();
        for (Symbol s : shared) {
            List<Access> list = bySymbol.get(s);
            List<Access> reads = list.stream().filter(a -> !a.isWrite()).toList();
            List<Access> writes = list.stream().filter(Access::isWrite).toList();
            if (writes.isEmpty()) {
                captures.add(s);
                continue;
            }
            if (benign.contains(s)) continue;
            if (loop.loopKind() == LoopKind.FOR_RANGE && induction.isPresent() && !inductionWritten
                    && reads.isEmpty() && storesOnlyAtInduction(symbols, tree, writes, induction.get())) {
                disjoint.add(s);
                continue;
            }
            if (isPrivatizable(symbols, tree, loopId, function, s, reads, writes)) {
                privatized.add(s);
                continue;
            }
            if (reads.stream().anyMatch(Access::upwardExposed)) {
                edges.add(new DependencyEdge(i, i.next(), s, DependenceKind.FLOW));
                edges.add(new DependencyEdge(i, i.next(), s, DependenceKind.ANTI));
            } else {
                edges.add(new DependencyEdge(i, i.next(), s, DependenceKind.OUTPUT));
            }
            if (!reads.isEmpty()) captures.add(s);
        }

        return new LoopDependenceGraph(loopId, edges, loopPrivate, shared, benign, disjoint, privatized,
            captures, unknownWrites, body.unknownCallees(), body.callsUnknown(), body.hasIo(), inductionWritten);
    }

    private static boolean storesOnlyAtInduction(SymbolTable symbols, SyntaxTree tree,
                                                 List<Access> writes, Symbol induction) {
        for (Access w : writes) {
            if (w.kind() != Access.Kind.STORE || w.slot().isNone()) return false;
            SyntaxNode slot = tree.node(w.slot());
            if (!(slot instanceof Name) || !induction.equals(symbols.referenceAt(w.slot()))) return false;
        }
        return true;
    }

    /**
     * A local of the enclosing function that every iteration assigns before reading and that
     * nothing outside the loop looks at, so each work unit can have its own copy.
     */
    private static boolean isPrivatizable(SymbolTable symbols, SyntaxTree tree, NodeId loopId, NodeId function,
                                          Symbol s, List<Access> reads, List<Access> writes) {
        if (function.isNone() || !symbols.isDeclaredWithin(s, function)) return false;
        NodeId decl = symbols.declarationOf(s);
        if (decl.isNone() || !(tree.node(decl) instanceof VarDecl)) return false;
        if (writes.stream().anyMatch(w -> w.kind() != Access.Kind.WRITE)) return false;
        if (reads.stream().anyMatch(Access::upwardExposed)) return false;
        for (NodeId ref : symbols.referencesOf(s)) {
            if (!tree.isAncestorOf(loopId, ref)) return false;
        }
        return true;
    }
}
