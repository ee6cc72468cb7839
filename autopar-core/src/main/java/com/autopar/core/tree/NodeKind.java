package com.autopar.core.tree;

/**
 * Closed tag over every node shape. Analyses switch over this enum so that
 * adding a kind fails compilation wherever it is not handled.
 */
public enum NodeKind {
    PROGRAM,
    FUNCTION_DEF,
    BLOCK,
    VAR_DECL,
    ASSIGN,
    LOOP,
    IF,
    RETURN,
    BREAK,
    CONTINUE,
    RAISE,
    TRY,
    EXPR_STMT,
    NAME,
    LITERAL,
    BINARY,
    UNARY,
    CALL,
    INDEX,
    LIST,
    RANGE,
    IO,
    YIELD,
    UNIT_RESULT,
    PARALLEL_TASK
}
