package com.autopar.runtime;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * One lexical scope of a running program. Frames are confined to the thread that
 * created them; work units get their own child frames, so only the values captured
 * from outer frames are shared.
 */
final class Frame {

    private final Frame parent;
    private final Map<String, Object> vars = new HashMap<>();
    private final List<Object> yields;
    private final Object[] unitResults;

    Frame(Frame parent) {
        this(parent, null, null);
    }

    private Frame(Frame parent, List<Object> yields, Object[] unitResults) {
        this.parent = parent;
        this.yields = yields;
        this.unitResults = unitResults;
    }

    /** A work-unit frame whose {@code YIELD}s land in {@code sink}. */
    static Frame unit(Frame parent, List<Object> sink) {
        return new Frame(parent, sink, null);
    }

    /** A join frame that resolves {@code UNIT_RESULT(k)} to {@code results[k]}. */
    static Frame join(Frame parent, Object[] results) {
        return new Frame(parent, null, results);
    }

    void declare(String name, Object value) {
        vars.put(name, value);
    }

    boolean isBound(String name) {
        for (Frame f = this; f != null; f = f.parent) {
            if (f.vars.containsKey(name)) return true;
        }
        return false;
    }

    Object lookup(String name) {
        for (Frame f = this; f != null; f = f.parent) {
            if (f.vars.containsKey(name)) return f.vars.get(name);
        }
        throw new IllegalStateException("unbound " + name);
    }

    /** Rebinds the nearest existing binding, or declares in this frame if there is none. */
    void assign(String name, Object value) {
        for (Frame f = this; f != null; f = f.parent) {
            if (f.vars.containsKey(name)) {
                f.vars.put(name, value);
                return;
            }
        }
        vars.put(name, value);
    }

    List<Object> yieldSink() {
        for (Frame f = this; f != null; f = f.parent) {
            if (f.yields != null) return f.yields;
        }
        return null;
    }

    Object[] unitResults() {
        for (Frame f = this; f != null; f = f.parent) {
            if (f.unitResults != null) return f.unitResults;
        }
        return null;
    }

    Map<String, Object> bindings() {
        return vars;
    }
}
