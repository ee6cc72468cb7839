package com.autopar.core.symbols;

import com.autopar.core.tree.NodeId;

import java.util.Comparator;
import java.util.Objects;

/**
 * A declared variable. Two symbols are the same variable iff they share a name and a
 * declaring scope owner; {@link #kind()} describes the symbol as seen from the reference
 * that resolved it and does not take part in equality.
 */
public record Symbol(String name, NodeId scopeOwner, SymbolKind kind) implements Comparable<Symbol> {

    /** Stands for "anything the analysis cannot see", written by unknown calls. */
    public static final Symbol ANY_UNKNOWN = new Symbol("<unknown>", NodeId.NONE, SymbolKind.UNKNOWN);

    private static final Comparator<Symbol> ORDER =
        Comparator.comparing(Symbol::name).thenComparing(Symbol::scopeOwner);

    public Symbol {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(scopeOwner, "scopeOwner");
        Objects.requireNonNull(kind, "kind");
    }

    public static Symbol unresolved(String name) {
        return new Symbol(name, NodeId.NONE, SymbolKind.UNKNOWN);
    }

    public boolean isUnknown() {
        return kind == SymbolKind.UNKNOWN;
    }

    public Symbol as(SymbolKind newKind) {
        return newKind == kind ? this : new Symbol(name, scopeOwner, newKind);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Symbol)) return false;
        Symbol other = (Symbol) o;
        return name.equals(other.name) && scopeOwner.equals(other.scopeOwner);
    }

    @Override
    public int hashCode() {
        return name.hashCode() * 31 + scopeOwner.hashCode();
    }

    @Override
    public int compareTo(Symbol o) {
        return ORDER.compare(this, o);
    }

    @Override
    public String toString() {
        return name + "@" + scopeOwner;
    }
}
