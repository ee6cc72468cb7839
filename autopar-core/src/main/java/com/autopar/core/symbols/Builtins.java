package com.autopar.core.symbols;

import java.util.Set;

/**
 * Callees and receiver methods the analysis recognizes without a body.
 */
public final class Builtins {

    private static final Set<String> PURE_FUNCTIONS = Set.of(
        "len", "abs", "min", "max", "sqrt", "pow", "newArray", "String.valueOf");

    private static final Set<String> IO_FUNCTIONS = Set.of("print", "println", "input", "open");

    private static final Set<String> APPEND_METHODS = Set.of("add", "append");

    private static final Set<String> ACCESSOR_METHODS = Set.of(
        "size", "get", "length", "contains", "isEmpty", "charAt", "indexOf");

    /** Mutators that overwrite one slot: the first argument is the index or key. */
    private static final Set<String> STORE_METHODS = Set.of("set", "put");

    private static final Set<String> MUTATOR_METHODS = Set.of(
        "remove", "clear", "addAll", "sort", "removeAll", "retainAll", "push", "pop", "poll", "offer");

    private Builtins() {}

    public static boolean isPureFunction(String name) {
        return PURE_FUNCTIONS.contains(name) || name.startsWith("Math.");
    }

    public static boolean isIoFunction(String name) {
        return IO_FUNCTIONS.contains(name);
    }

    public static boolean isAppendMethod(String method) {
        return APPEND_METHODS.contains(method);
    }

    public static boolean isAccessorMethod(String method) {
        return ACCESSOR_METHODS.contains(method);
    }

    public static boolean isStoreMethod(String method) {
        return STORE_METHODS.contains(method);
    }

    public static boolean isMutatorMethod(String method) {
        return MUTATOR_METHODS.contains(method) || STORE_METHODS.contains(method);
    }
}
