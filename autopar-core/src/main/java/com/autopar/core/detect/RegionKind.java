package com.autopar.core.detect;

public enum RegionKind {
    LOOP,
    /** An expression with two or more independent self-calls of its function. */
    RECURSION
}
