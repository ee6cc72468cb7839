package com.autopar.core.dependence;

import com.autopar.core.symbols.Symbol;

/** Evidence that iteration {@code to} depends on iteration {@code from} through {@code symbol}. */
public record DependencyEdge(IterationRef from, IterationRef to, Symbol symbol, DependenceKind kind) {

    @Override
    public String toString() {
        return kind + " " + symbol.name() + ": " + from + " -> " + to;
    }
}
