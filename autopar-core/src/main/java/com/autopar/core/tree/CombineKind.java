package com.autopar.core.tree;

/**
 * How the results of the work units of a {@link SyntaxNode.ParallelTask} are combined.
 */
public enum CombineKind {
    /** One value per unit, collected in iteration order into a fresh collection. */
    ORDERED_COLLECT,
    /** Zero or more values per unit, appended to an existing collection in iteration order. */
    ORDERED_APPEND,
    /** Units write disjoint slots of a shared collection; no combination step. */
    INDEXED_STORE,
    /** Independent recursive sub-calls whose results feed a join expression. */
    FORK_JOIN;

    public boolean requiresOrderedCombination() {
        return this != INDEXED_STORE;
    }

    public boolean requiresReduction() {
        return this == FORK_JOIN;
    }
}
