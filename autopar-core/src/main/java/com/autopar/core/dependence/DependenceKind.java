package com.autopar.core.dependence;

public enum DependenceKind {
    /** Read after write. */
    FLOW,
    /** Write after read. */
    ANTI,
    /** Write after write. */
    OUTPUT
}
