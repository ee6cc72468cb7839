package com.autopar.runtime;

import com.autopar.core.tree.SourcePos;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.DoubleUnaryOperator;

/**
 * Functions callable by plain name that the program does not define itself: the
 * recognized pure and I/O built-ins, plus anything a host registers (for example an
 * allow-listed pure call).
 *
 * Register before running; lookups may then happen from any thread.
 */
public final class HostFunctions {

    private final Map<String, HostFunction> functions = new HashMap<>();

    private HostFunctions() {}

    public static HostFunctions empty() {
        return new HostFunctions();
    }

    public static HostFunctions standard() {
        HostFunctions h = new HostFunctions();
        h.register("len", (args, ctx, pos) -> length(single(args, "len", pos), pos));
        h.register("abs", (args, ctx, pos) -> abs(single(args, "abs", pos), pos));
        h.register("min", (args, ctx, pos) -> extreme(args, true, pos));
        h.register("max", (args, ctx, pos) -> extreme(args, false, pos));
        h.register("sqrt", math("sqrt", Math::sqrt));
        h.register("pow", (args, ctx, pos) -> pow(args, pos));
        h.register("newArray", (args, ctx, pos) -> newArray(single(args, "newArray", pos), pos));
        h.register("String.valueOf", (args, ctx, pos) -> Values.display(single(args, "String.valueOf", pos)));

        h.register("Math.sqrt", math("Math.sqrt", Math::sqrt));
        h.register("Math.exp", math("Math.exp", Math::exp));
        h.register("Math.log", math("Math.log", Math::log));
        h.register("Math.sin", math("Math.sin", Math::sin));
        h.register("Math.cos", math("Math.cos", Math::cos));
        h.register("Math.floor", math("Math.floor", Math::floor));
        h.register("Math.ceil", math("Math.ceil", Math::ceil));
        h.register("Math.abs", (args, ctx, pos) -> abs(single(args, "Math.abs", pos), pos));
        h.register("Math.min", (args, ctx, pos) -> extreme(args, true, pos));
        h.register("Math.max", (args, ctx, pos) -> extreme(args, false, pos));
        h.register("Math.pow", (args, ctx, pos) -> pow(args, pos));
        h.register("Math.round", (args, ctx, pos) ->
            Math.round(Values.number(single(args, "Math.round", pos), pos).doubleValue()));

        h.register("print", (args, ctx, pos) -> {
            ctx.write(joined(args));
            return null;
        });
        h.register("println", (args, ctx, pos) -> {
            ctx.write(joined(args) + "\n");
            return null;
        });
        h.register("input", (args, ctx, pos) -> {
            if (!args.isEmpty()) ctx.write(joined(args));
            return ctx.readLine().orElseThrow(() -> new ProgramException("End of input", pos));
        });
        h.register("open", (args, ctx, pos) -> {
            String path = Values.display(single(args, "open", pos));
            return ctx.readFile(path).orElseThrow(() -> new ProgramException("No such file: " + path, pos));
        });
        return h;
    }

    public HostFunctions register(String name, HostFunction function) {
        functions.put(name, function);
        return this;
    }

    public Optional<HostFunction> lookup(String name) {
        return Optional.ofNullable(functions.get(name));
    }

    static String joined(List<Object> args) {
        StringBuilder sb = new StringBuilder();
        for (int k = 0; k < args.size(); k++) {
            if (k > 0) sb.append(' ');
            sb.append(Values.display(args.get(k)));
        }
        return sb.toString();
    }

    private static Object single(List<Object> args, String name, SourcePos pos) {
        if (args.size() != 1) {
            throw new ProgramException(name + " takes 1 argument, got " + args.size(), pos);
        }
        return args.get(0);
    }

    private static HostFunction math(String name, DoubleUnaryOperator op) {
        return (args, ctx, pos) -> op.applyAsDouble(Values.number(single(args, name, pos), pos).doubleValue());
    }

    private static Object length(Object value, SourcePos pos) {
        if (value instanceof String) return (long) ((String) value).length();
        return (long) Values.list(value, pos).size();
    }

    private static Object abs(Object value, SourcePos pos) {
        Number n = Values.number(value, pos);
        return n instanceof Long ? (Object) Math.abs(n.longValue()) : (Object) Math.abs(n.doubleValue());
    }

    private static Object pow(List<Object> args, SourcePos pos) {
        if (args.size() != 2) throw new ProgramException("pow takes 2 arguments, got " + args.size(), pos);
        return Math.pow(Values.number(args.get(0), pos).doubleValue(), Values.number(args.get(1), pos).doubleValue());
    }

    private static Object extreme(List<Object> args, boolean min, SourcePos pos) {
        List<Object> values = args.size() == 1 && args.get(0) instanceof List<?>
            ? Values.list(args.get(0), pos)
            : args;
        if (values.isEmpty()) throw new ProgramException((min ? "min" : "max") + " of empty sequence", pos);
        Object best = values.get(0);
        for (Object v : values.subList(1, values.size())) {
            boolean less = Values.truthy(Values.binary("<", v, best, pos));
            if (less == min && !Values.valueEquals(v, best)) best = v;
        }
        return best;
    }

    private static Object newArray(Object size, SourcePos pos) {
        long n = Values.number(size, pos).longValue();
        if (n < 0) throw new ProgramException("Negative array size " + n, pos);
        return new ArrayList<Object>(Collections.nCopies((int) n, 0L));
    }
}
