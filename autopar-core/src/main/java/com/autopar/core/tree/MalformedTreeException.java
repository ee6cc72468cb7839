package com.autopar.core.tree;

/**
 * The input tree violates a structural invariant (a node with two parents, a dangling
 * child reference, a loop whose body is not a block, ...). This is a programmer error in
 * whoever built the tree, not an analysis result.
 */
public class MalformedTreeException extends RuntimeException {
    public MalformedTreeException(String message) { super(message); }
}
