package com.autopar.core.dependence;

import com.autopar.core.symbols.Symbol;
import com.autopar.core.tree.NodeId;

/**
 * One use of a symbol inside a loop body, in execution order.
 *
 * @param site          the node performing the access
 * @param slot          for {@link Kind#STORE}, the index expression of the written slot
 * @param upwardExposed for reads, whether the value may come from before this iteration
 */
public record Access(Symbol symbol, Kind kind, NodeId site, NodeId slot, boolean upwardExposed) {

    public enum Kind {
        READ,
        /** Whole-value assignment. */
        WRITE,
        /** {@code s.add(v)}: the monotonic append pattern. */
        APPEND,
        /** {@code s[k] = v} or {@code s.set(k, v)}. */
        STORE
    }

    public boolean isWrite() {
        return kind != Kind.READ;
    }
}
