package com.autopar.core.dependence;

import com.autopar.core.effects.AliasMap;
import com.autopar.core.effects.EffectMap;
import com.autopar.core.effects.EffectSet;
import com.autopar.core.symbols.Builtins;
import com.autopar.core.symbols.Callee;
import com.autopar.core.symbols.Symbol;
import com.autopar.core.symbols.SymbolTable;
import com.autopar.core.tree.NodeId;
import com.autopar.core.tree.NodeKind;
import com.autopar.core.tree.SyntaxNode;
import com.autopar.core.tree.SyntaxNode.*;
import com.autopar.core.tree.SyntaxTree;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Lists the symbol accesses of one iteration in execution order and marks which reads are
 * upward-exposed, i.e. not preceded by a definite whole-value write in the same iteration.
 *
 * A write is definite only if it happens on every path: both branches of an {@code if}
 * must write, and nothing written inside a nested loop, a {@code try} or the right side
 * of a short-circuit operator counts afterwards.
 *
 * A container change through a variable also writes the aliases of that variable which
 * the scope refers to; aliases the scope never mentions cannot observe the change there.
 */
public final class DefUseOrder {

    private final EffectMap effects;
    private final SymbolTable symbols;
    private final SyntaxTree tree;
    private final AliasMap aliases;
    private final NodeId scope;
    private final List<Access> accesses = new ArrayList<>();
    private Set<Symbol> defined = new HashSet<>();

    private DefUseOrder(EffectMap effects, NodeId scope) {
        this.effects = effects;
        this.symbols = effects.symbols();
        this.tree = symbols.tree();
        this.aliases = effects.aliases();
        this.scope = scope;
    }

    /** Accesses of {@code roots}, all of which lie inside {@code scope}. */
    public static List<Access> of(EffectMap effects, NodeId scope, NodeId... roots) {
        DefUseOrder order = new DefUseOrder(effects, scope);
        for (NodeId root : roots) {
            if (root.isPresent()) order.visit(root);
        }
        return List.copyOf(order.accesses);
    }

    private void read(Symbol s, NodeId site) {
        accesses.add(new Access(s, Access.Kind.READ, site, NodeId.NONE, !defined.contains(s)));
    }

    private void write(Symbol s, NodeId site) {
        accesses.add(new Access(s, Access.Kind.WRITE, site, NodeId.NONE, false));
        defined.add(s);
    }

    private void record(Symbol s, Access.Kind kind, NodeId site, NodeId slot) {
        accesses.add(new Access(s, kind, site, slot, false));
    }

    /** Writes every alias of {@code s} other than itself that the scope mentions. */
    private void aliasWrites(Symbol s, NodeId site) {
        for (Symbol alias : aliases.reachedFrom(s)) {
            if (!alias.equals(s) && mentioned(alias)) {
                record(alias, Access.Kind.WRITE, site, NodeId.NONE);
            }
        }
    }

    private boolean mentioned(Symbol s) {
        if (s.isUnknown()) return true;
        if (symbols.isDeclaredWithin(s, scope)) return true;
        for (NodeId ref : symbols.referencesOf(s)) {
            if (tree.isAncestorOf(scope, ref)) return true;
        }
        return false;
    }

    private void visit(NodeId id) {
        SyntaxNode node = tree.node(id);
        switch (node.kind()) {
            case NAME -> read(symbols.referenceAt(id), id);
            case LITERAL, BREAK, CONTINUE, UNIT_RESULT -> { }
            case VAR_DECL -> {
                VarDecl d = (VarDecl) node;
                if (d.init().isPresent()) visit(d.init());
                symbols.declaredAt(id).ifPresent(s -> write(s, id));
            }
            case ASSIGN -> assign(id, (Assign) node);
            case IF -> {
                If branch = (If) node;
                visit(branch.condition());
                Set<Symbol> before = new HashSet<>(defined);
                visit(branch.thenBranch());
                Set<Symbol> afterThen = defined;
                defined = new HashSet<>(before);
                if (branch.elseBranch().isPresent()) visit(branch.elseBranch());
                defined.retainAll(afterThen);
            }
            case LOOP -> {
                Loop loop = (Loop) node;
                visit(loop.header());
                Set<Symbol> before = new HashSet<>(defined);
                symbols.declaredAt(id).ifPresent(s -> write(s, id));
                visit(loop.body());
                defined = before;
            }
            case TRY -> {
                Try t = (Try) node;
                Set<Symbol> before = new HashSet<>(defined);
                visit(t.body());
                defined = new HashSet<>(before);
                symbols.declaredAt(id).ifPresent(s -> write(s, id));
                visit(t.handler());
                defined = before;
            }
            case BINARY -> {
                Binary b = (Binary) node;
                visit(b.left());
                if ("&&".equals(b.op()) || "||".equals(b.op())) {
                    Set<Symbol> before = new HashSet<>(defined);
                    visit(b.right());
                    defined = before;
                } else {
                    visit(b.right());
                }
            }
            case CALL -> call(id, (Call) node);
            case PARALLEL_TASK -> {
                ParallelTask task = (ParallelTask) node;
                if (task.source().isPresent()) visit(task.source());
                Set<Symbol> before = new HashSet<>(defined);
                symbols.declaredAt(id).ifPresent(s -> write(s, id));
                task.units().forEach(this::visit);
                defined = before;
                if (task.join().isPresent()) visit(task.join());
            }
            default -> node.children().forEach(this::visit);
        }
    }

    private void assign(NodeId id, Assign a) {
        visit(a.value());
        SyntaxNode target = tree.node(a.target());
        if (target instanceof Name) {
            Symbol s = symbols.referenceAt(a.target());
            if (a.isCompound()) read(s, a.target());
            write(s, id);
            return;
        }
        if (target instanceof Index) {
            NodeId base = a.target();
            NodeId slot = NodeId.NONE;
            while (tree.node(base) instanceof Index) {
                Index ix = (Index) tree.node(base);
                visit(ix.index());
                slot = ix.index();
                base = ix.target();
            }
            if (tree.kind(base) == NodeKind.NAME) {
                Symbol s = symbols.referenceAt(base);
                if (a.isCompound()) read(s, base);
                record(s, Access.Kind.STORE, id, slot);
                aliasWrites(s, id);
                return;
            }
            visit(base);
        }
        record(Symbol.ANY_UNKNOWN, Access.Kind.WRITE, id, NodeId.NONE);
    }

    private void call(NodeId id, Call call) {
        Callee callee = symbols.resolveCallee(id);
        String m = call.callee();
        boolean namedReceiver = call.hasReceiver() && tree.kind(call.receiver()) == NodeKind.NAME;
        if (callee.kind() == Callee.Kind.METHOD && namedReceiver) {
            Symbol receiver = symbols.referenceAt(call.receiver());
            if (Builtins.isAppendMethod(m) && call.args().size() == 1 && isStatement(id)) {
                visit(call.args().get(0));
                record(receiver, Access.Kind.APPEND, id, NodeId.NONE);
                aliasWrites(receiver, id);
                return;
            }
            if (Builtins.isStoreMethod(m) && !call.args().isEmpty()) {
                call.args().forEach(this::visit);
                record(receiver, Access.Kind.STORE, id, call.args().get(0));
                aliasWrites(receiver, id);
                return;
            }
            if (Builtins.isMutatorMethod(m) || Builtins.isAppendMethod(m)) {
                call.args().forEach(this::visit);
                read(receiver, call.receiver());
                record(receiver, Access.Kind.WRITE, id, NodeId.NONE);
                aliasWrites(receiver, id);
                return;
            }
        }
        call.children().forEach(this::visit);
        switch (callee.kind()) {
            case MODULE_FUNCTION -> {
                EffectSet summary = effects.summary(callee.function());
                summary.reads().forEach(s -> read(s, id));
                summary.writes().forEach(s -> record(s, Access.Kind.WRITE, id, NodeId.NONE));
                for (int k : effects.parameterMutations(callee.function())) {
                    if (k >= call.args().size()) continue;
                    for (Symbol s : aliases.mutatedBy(call.args().get(k))) {
                        if (mentioned(s)) record(s, Access.Kind.WRITE, id, NodeId.NONE);
                    }
                }
            }
            case METHOD, UNKNOWN -> {
                if (!Builtins.isAccessorMethod(m)) {
                    effects.of(id).writes().forEach(s -> record(s, Access.Kind.WRITE, id, NodeId.NONE));
                }
            }
            default -> { }
        }
    }

    private boolean isStatement(NodeId id) {
        NodeId parent = tree.parentOf(id);
        return parent.isPresent() && tree.kind(parent) == NodeKind.EXPR_STMT;
    }
}
