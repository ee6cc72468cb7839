package com.autopar.core.symbols;

import com.autopar.core.tree.NodeId;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Ordered declarations owned by one node. The parent link is used for lookup only.
 */
public final class Scope {

    private final NodeId owner;
    private final Scope parent;
    private final NodeId function;
    private final Map<String, Symbol> declarations = new LinkedHashMap<>();
    private final List<Scope> children = new ArrayList<>();

    Scope(NodeId owner, Scope parent, NodeId function) {
        this.owner = owner;
        this.parent = parent;
        this.function = function;
        if (parent != null) {
            parent.children.add(this);
        }
    }

    public NodeId owner() {
        return owner;
    }

    public Optional<Scope> parent() {
        return Optional.ofNullable(parent);
    }

    /** Function whose body contains this scope, or {@link NodeId#NONE} at program level. */
    public NodeId function() {
        return function;
    }

    public List<Symbol> declarations() {
        return List.copyOf(declarations.values());
    }

    public List<Scope> children() {
        return Collections.unmodifiableList(children);
    }

    public boolean declares(String name) {
        return declarations.containsKey(name);
    }

    Symbol declare(String name, SymbolKind kind) {
        return declarations.computeIfAbsent(name, n -> new Symbol(n, owner, kind));
    }

    /** Innermost scope, starting here, that declares {@code name}. */
    Scope declaring(String name) {
        for (Scope s = this; s != null; s = s.parent) {
            if (s.declarations.containsKey(name)) return s;
        }
        return null;
    }

    Symbol local(String name) {
        return declarations.get(name);
    }
}
