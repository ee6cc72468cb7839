package com.autopar.core.effects;

import com.autopar.core.symbols.Symbol;

import java.util.Collections;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Summary of what a node may do when evaluated.
 *
 * {@code writes} includes every written symbol; {@code appends} is the subset written
 * only through the monotonic append pattern within the summarized subtree.
 */
public record EffectSet(SortedSet<Symbol> reads,
                        SortedSet<Symbol> writes,
                        SortedSet<Symbol> appends,
                        boolean callsUnknown,
                        boolean hasIo,
                        boolean mayRaise,
                        SortedSet<String> unknownCallees) {

    public static final EffectSet EMPTY = new Builder().build();

    public EffectSet {
        reads = frozen(reads);
        writes = frozen(writes);
        appends = frozen(appends);
        unknownCallees = frozen(unknownCallees);
    }

    public boolean isPure() {
        return writes.isEmpty() && !callsUnknown && !hasIo;
    }

    public boolean reads(Symbol s) {
        return reads.contains(s);
    }

    public boolean writes(Symbol s) {
        return writes.contains(s);
    }

    public Builder toBuilder() {
        return new Builder().add(this);
    }

    private static <T> SortedSet<T> frozen(Set<T> in) {
        return Collections.unmodifiableSortedSet(in == null ? new TreeSet<>() : new TreeSet<>(in));
    }

    public static final class Builder {
        private final TreeSet<Symbol> reads = new TreeSet<>();
        private final TreeSet<Symbol> writes = new TreeSet<>();
        private final TreeSet<Symbol> appendOnly = new TreeSet<>();
        private final TreeSet<Symbol> plainWrites = new TreeSet<>();
        private final TreeSet<String> unknownCallees = new TreeSet<>();
        private boolean callsUnknown;
        private boolean hasIo;
        private boolean mayRaise;

        /** Union with another summary. */
        public Builder add(EffectSet other) {
            reads.addAll(other.reads);
            writes.addAll(other.writes);
            for (Symbol w : other.writes) {
                if (other.appends.contains(w)) {
                    appendOnly.add(w);
                } else {
                    plainWrites.add(w);
                }
            }
            unknownCallees.addAll(other.unknownCallees);
            callsUnknown |= other.callsUnknown;
            hasIo |= other.hasIo;
            mayRaise |= other.mayRaise;
            return this;
        }

        public Builder read(Symbol s) {
            reads.add(s);
            return this;
        }

        public Builder readAll(Set<Symbol> symbols) {
            reads.addAll(symbols);
            return this;
        }

        public Builder write(Symbol s) {
            writes.add(s);
            plainWrites.add(s);
            return this;
        }

        public Builder writeAll(Set<Symbol> symbols) {
            symbols.forEach(this::write);
            return this;
        }

        public Builder append(Symbol s) {
            writes.add(s);
            appendOnly.add(s);
            return this;
        }

        public Builder unknownCall(String callee) {
            callsUnknown = true;
            mayRaise = true;
            unknownCallees.add(callee);
            return this;
        }

        public Builder io() {
            hasIo = true;
            mayRaise = true;
            return this;
        }

        public Builder raise() {
            mayRaise = true;
            return this;
        }

        public EffectSet build() {
            TreeSet<Symbol> appends = new TreeSet<>(appendOnly);
            appends.removeAll(plainWrites);
            return new EffectSet(reads, writes, appends, callsUnknown, hasIo, mayRaise, unknownCallees);
        }
    }
}
