package com.autopar.core.effects;

import com.autopar.core.symbols.Builtins;
import com.autopar.core.symbols.Callee;
import com.autopar.core.symbols.Symbol;
import com.autopar.core.symbols.SymbolTable;
import com.autopar.core.tree.LoopKind;
import com.autopar.core.tree.NodeId;
import com.autopar.core.tree.NodeKind;
import com.autopar.core.tree.SyntaxNode;
import com.autopar.core.tree.SyntaxNode.*;
import com.autopar.core.tree.SyntaxTree;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Variables that may refer to the same container.
 *
 * Flow-insensitive: a variable is linked to every variable it is ever initialized or
 * assigned from, and a for-each variable to the sequence it walks. Links are symmetric.
 * Fresh lists, literals and arithmetic link to nothing; results of calls into the
 * program or of calls the analysis cannot see link to {@link Symbol#ANY_UNKNOWN}.
 */
public final class AliasMap {

    private final SymbolTable symbols;
    private final SyntaxTree tree;
    private final Map<Symbol, Set<Symbol>> links = new HashMap<>();

    private AliasMap(SymbolTable symbols) {
        this.symbols = symbols;
        this.tree = symbols.tree();
    }

    public static AliasMap build(SymbolTable symbols) {
        AliasMap map = new AliasMap(symbols);
        for (NodeId id : map.tree.preorder(map.tree.root())) {
            map.visit(id);
        }
        return map;
    }

    private void visit(NodeId id) {
        SyntaxNode node = tree.node(id);
        switch (node.kind()) {
            case VAR_DECL -> {
                VarDecl d = (VarDecl) node;
                if (d.init().isPresent()) {
                    symbols.declaredAt(id).ifPresent(s -> link(s, origins(d.init())));
                }
            }
            case ASSIGN -> {
                Assign a = (Assign) node;
                if (!a.isCompound() && tree.kind(a.target()) == NodeKind.NAME) {
                    symbols.lookupReference(a.target()).ifPresent(s -> link(s, origins(a.value())));
                }
            }
            case LOOP -> {
                Loop loop = (Loop) node;
                if (loop.loopKind() == LoopKind.FOR_EACH) {
                    symbols.declaredAt(id).ifPresent(s -> link(s, origins(loop.header())));
                }
            }
            case PARALLEL_TASK -> {
                ParallelTask task = (ParallelTask) node;
                if (task.iteration() == LoopKind.FOR_EACH && task.source().isPresent()) {
                    symbols.declaredAt(id).ifPresent(s -> link(s, origins(task.source())));
                }
            }
            default -> { }
        }
    }

    private void link(Symbol s, Set<Symbol> sources) {
        for (Symbol source : sources) {
            if (source.equals(s)) continue;
            links.computeIfAbsent(s, k -> new HashSet<>()).add(source);
            links.computeIfAbsent(source, k -> new HashSet<>()).add(s);
        }
    }

    /** Variables whose container {@code expr} may evaluate to. */
    public Set<Symbol> origins(NodeId expr) {
        SyntaxNode node = tree.node(expr);
        return switch (node.kind()) {
            case NAME -> symbols.lookupReference(expr).map(Set::of).orElse(Set.of());
            case INDEX -> origins(((Index) node).target());
            case CALL -> callOrigins(expr, (Call) node);
            default -> Set.of();
        };
    }

    private Set<Symbol> callOrigins(NodeId id, Call call) {
        Callee callee = symbols.resolveCallee(id);
        return switch (callee.kind()) {
            case PURE_BUILTIN, IO_BUILTIN -> Set.of();
            // size(), contains() and friends give scalars; get() gives an element
            case METHOD -> Builtins.isAccessorMethod(call.callee()) && !"get".equals(call.callee())
                ? Set.of()
                : origins(call.receiver());
            case MODULE_FUNCTION, UNKNOWN -> Set.of(Symbol.ANY_UNKNOWN);
        };
    }

    /**
     * {@code s} and every variable a container change through {@code s} may be visible in.
     * {@link Symbol#ANY_UNKNOWN} is reported but not followed.
     */
    public SortedSet<Symbol> reachedFrom(Symbol s) {
        TreeSet<Symbol> seen = new TreeSet<>();
        Deque<Symbol> work = new ArrayDeque<>();
        seen.add(s);
        work.push(s);
        while (!work.isEmpty()) {
            Symbol cur = work.pop();
            if (cur.equals(Symbol.ANY_UNKNOWN)) continue;
            for (Symbol next : links.getOrDefault(cur, Set.of())) {
                if (seen.add(next)) work.push(next);
            }
        }
        return Collections.unmodifiableSortedSet(seen);
    }

    /** Every variable a container change to the value of {@code expr} may be visible in. */
    public SortedSet<Symbol> mutatedBy(NodeId expr) {
        TreeSet<Symbol> out = new TreeSet<>();
        for (Symbol origin : origins(expr)) {
            out.addAll(reachedFrom(origin));
        }
        return Collections.unmodifiableSortedSet(out);
    }
}
