package com.autopar.core.symbols;

import com.autopar.core.tree.NodeId;

/**
 * What a call site resolves to. {@code function} is set only for {@link Kind#MODULE_FUNCTION}.
 */
public record Callee(Kind kind, String name, NodeId function) {

    public enum Kind {
        /** A function defined in the analyzed program; its body is available. */
        MODULE_FUNCTION,
        PURE_BUILTIN,
        IO_BUILTIN,
        /** {@code receiver.name(...)}; classified by the effect analyzer from the method name. */
        METHOD,
        UNKNOWN
    }

    public static Callee of(Kind kind, String name) {
        return new Callee(kind, name, NodeId.NONE);
    }
}
