package com.autopar.runtime;

import com.autopar.core.tree.NodeId;

/** A function value: its definition plus the frame it was defined in. */
record Closure(NodeId definition, String name, int arity, Frame scope) {

    /** Frame key; overloads differ by arity. */
    static String key(String name, int arity) {
        return name + "/" + arity;
    }

    @Override
    public String toString() {
        return "<function " + name + ">";
    }
}
