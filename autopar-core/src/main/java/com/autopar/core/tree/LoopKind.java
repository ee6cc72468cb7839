package com.autopar.core.tree;

public enum LoopKind {
    /** Iterates the elements of a sequence expression. */
    FOR_EACH,
    /** Iterates an integer range; the header is a {@link SyntaxNode.Range}. */
    FOR_RANGE,
    /** Condition-controlled; never countable. */
    WHILE;

    public boolean isCountable() {
        return this != WHILE;
    }
}
