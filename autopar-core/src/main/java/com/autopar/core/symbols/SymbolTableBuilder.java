package com.autopar.core.symbols;

import com.autopar.core.tree.NodeId;
import com.autopar.core.tree.NodeKind;
import com.autopar.core.tree.SyntaxNode;
import com.autopar.core.tree.SyntaxNode.*;
import com.autopar.core.tree.SyntaxTree;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Resolves every identifier of a tree to a {@link Symbol}. Never fails: names with no
 * visible declaration resolve to an {@link SymbolKind#UNKNOWN} symbol.
 *
 * Declarations become visible at the point they appear, except program-level ones
 * (globals and function names) which are visible everywhere.
 */
public final class SymbolTableBuilder {

    private final SyntaxTree tree;
    private final Map<NodeId, Scope> scopes = new HashMap<>();
    private final Map<NodeId, Symbol> references = new HashMap<>();
    private final Map<NodeId, Symbol> declarations = new HashMap<>();
    private final Map<Symbol, NodeId> declarationSites = new HashMap<>();
    private final Map<Symbol, List<NodeId>> referenceSites = new HashMap<>();
    private final Map<String, List<NodeId>> functions = new LinkedHashMap<>();
    private final Map<NodeId, Callee> callees = new HashMap<>();

    private SymbolTableBuilder(SyntaxTree tree) {
        this.tree = tree;
    }

    public static SymbolTable build(SyntaxTree tree) {
        SymbolTableBuilder b = new SymbolTableBuilder(tree);
        Scope program = b.seedProgram();
        for (NodeId stmt : b.programStatements()) {
            b.walk(stmt, program, NodeId.NONE);
        }
        return b.finish(program);
    }

    /** Resolves a single function against the program-level declarations. */
    public static SymbolTable build(SyntaxTree tree, NodeId functionId) {
        if (tree.kind(functionId) != NodeKind.FUNCTION_DEF) {
            throw new IllegalArgumentException("Node " + functionId + " is not a function definition");
        }
        SymbolTableBuilder b = new SymbolTableBuilder(tree);
        Scope program = b.seedProgram();
        b.walk(functionId, program, NodeId.NONE);
        return b.finish(program);
    }

    private List<NodeId> programStatements() {
        SyntaxNode root = tree.node(tree.root());
        return root instanceof Program ? ((Program) root).statements() : List.of(tree.root());
    }

    private Scope seedProgram() {
        // a bare function tree has no program node to own the outer scope
        NodeId rootId = tree.root();
        boolean hasProgram = tree.kind(rootId) == NodeKind.PROGRAM;
        Scope program = new Scope(hasProgram ? rootId : NodeId.NONE, null, NodeId.NONE);
        if (hasProgram) {
            scopes.put(rootId, program);
        }
        for (NodeId stmt : programStatements()) {
            SyntaxNode n = tree.node(stmt);
            if (n instanceof FunctionDef) {
                FunctionDef f = (FunctionDef) n;
                functions.computeIfAbsent(f.name(), k -> new ArrayList<>()).add(stmt);
                Symbol s = program.declare(f.name(), SymbolKind.GLOBAL);
                declarationSites.putIfAbsent(s, stmt);
            } else if (n instanceof VarDecl) {
                Symbol s = program.declare(((VarDecl) n).name(), SymbolKind.GLOBAL);
                declarationSites.putIfAbsent(s, stmt);
                declarations.put(stmt, s);
            }
        }
        return program;
    }

    private SymbolTable finish(Scope program) {
        return new SymbolTable(tree, tree.version(), program, scopes, references, declarations,
            declarationSites, referenceSites, functions, callees);
    }

    private Scope open(NodeId owner, Scope parent, NodeId function) {
        Scope s = new Scope(owner, parent, function);
        scopes.put(owner, s);
        return s;
    }

    private Symbol declare(Scope scope, String name, SymbolKind kind, NodeId site) {
        Symbol s = scope.declare(name, kind);
        declarationSites.putIfAbsent(s, site);
        return s;
    }

    private void walk(NodeId id, Scope scope, NodeId function) {
        SyntaxNode node = tree.node(id);
        switch (node.kind()) {
            case FUNCTION_DEF -> {
                FunctionDef f = (FunctionDef) node;
                if (!function.isNone()) {
                    declare(scope, f.name(), SymbolKind.LOCAL, id);
                }
                Scope fs = open(id, scope, id);
                for (String p : f.params()) {
                    declare(fs, p, SymbolKind.PARAMETER, id);
                }
                walk(f.body(), fs, id);
            }
            case BLOCK -> {
                Scope bs = open(id, scope, function);
                for (NodeId stmt : ((Block) node).statements()) {
                    walk(stmt, bs, function);
                }
            }
            case VAR_DECL -> {
                VarDecl d = (VarDecl) node;
                if (d.init().isPresent()) walk(d.init(), scope, function);
                SymbolKind kind = function.isNone() ? SymbolKind.GLOBAL : SymbolKind.LOCAL;
                declarations.put(id, declare(scope, d.name(), kind, id));
            }
            case LOOP -> {
                Loop loop = (Loop) node;
                walk(loop.header(), scope, function);
                Scope ls = open(id, scope, function);
                if (loop.variable() != null) {
                    declarations.put(id, declare(ls, loop.variable(), SymbolKind.LOCAL, id));
                }
                walk(loop.body(), ls, function);
            }
            case TRY -> {
                Try t = (Try) node;
                walk(t.body(), scope, function);
                Scope ts = open(id, scope, function);
                if (t.catchVariable() != null) {
                    declarations.put(id, declare(ts, t.catchVariable(), SymbolKind.LOCAL, id));
                }
                walk(t.handler(), ts, function);
            }
            case PARALLEL_TASK -> {
                ParallelTask task = (ParallelTask) node;
                if (task.source().isPresent()) walk(task.source(), scope, function);
                Scope us = open(id, scope, function);
                if (task.variable() != null) {
                    declarations.put(id, declare(us, task.variable(), SymbolKind.LOCAL, id));
                }
                for (NodeId unit : task.units()) {
                    walk(unit, us, function);
                }
                if (task.join().isPresent()) walk(task.join(), scope, function);
            }
            case NAME -> {
                Symbol s = resolve(((Name) node).identifier(), scope, function);
                references.put(id, s);
                referenceSites.computeIfAbsent(s, k -> new ArrayList<>()).add(id);
            }
            case CALL -> {
                callees.put(id, classify((Call) node));
                for (NodeId child : node.children()) {
                    walk(child, scope, function);
                }
            }
            default -> {
                for (NodeId child : node.children()) {
                    walk(child, scope, function);
                }
            }
        }
    }

    private Symbol resolve(String name, Scope scope, NodeId function) {
        Scope declaring = scope.declaring(name);
        if (declaring == null) {
            return Symbol.unresolved(name);
        }
        Symbol declared = declaring.local(name);
        if (declared.kind() == SymbolKind.GLOBAL || declaring.function().equals(function)) {
            return declared;
        }
        return declared.as(SymbolKind.CAPTURED);
    }

    private Callee classify(Call call) {
        if (call.hasReceiver()) {
            return Callee.of(Callee.Kind.METHOD, call.callee());
        }
        List<NodeId> defs = functions.getOrDefault(call.callee(), List.of());
        List<NodeId> matching = new ArrayList<>();
        for (NodeId def : defs) {
            if (tree.node(def, FunctionDef.class).params().size() == call.args().size()) {
                matching.add(def);
            }
        }
        if (matching.size() == 1) {
            return new Callee(Callee.Kind.MODULE_FUNCTION, call.callee(), matching.get(0));
        }
        if (!defs.isEmpty()) {
            // overloads we cannot tell apart by arity
            return Callee.of(Callee.Kind.UNKNOWN, call.callee());
        }
        if (Builtins.isPureFunction(call.callee())) {
            return Callee.of(Callee.Kind.PURE_BUILTIN, call.callee());
        }
        if (Builtins.isIoFunction(call.callee())) {
            return Callee.of(Callee.Kind.IO_BUILTIN, call.callee());
        }
        return Callee.of(Callee.Kind.UNKNOWN, call.callee());
    }
}
