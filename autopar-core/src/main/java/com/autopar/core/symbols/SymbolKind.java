package com.autopar.core.symbols;

public enum SymbolKind {
    LOCAL,
    PARAMETER,
    /** Declared in an enclosing function, or outside the region under analysis. */
    CAPTURED,
    GLOBAL,
    UNKNOWN;

    public boolean isShared() {
        return this == CAPTURED || this == GLOBAL;
    }
}
