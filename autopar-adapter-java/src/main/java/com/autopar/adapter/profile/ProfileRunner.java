package com.autopar.adapter.profile;

import com.autopar.core.ParallelizationReport;
import com.autopar.core.Parallelizer;
import com.autopar.core.config.AnalysisConfig;
import com.autopar.core.detect.DiagnosticEntry;
import com.autopar.core.tree.SourcePos;
import com.autopar.core.tree.SyntaxTree;
import com.autopar.runtime.ExecutionContext;
import com.autopar.runtime.ParallelTaskExecutor;
import com.autopar.runtime.ProgramException;
import com.autopar.runtime.TreeInterpreter;
import com.autopar.runtime.Values;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.gson.JsonPrimitive;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Runs one function of a program twice through the reference runtime, first as written and
 * then after every accepted region has been rewritten, and compares the two runs.
 */
public class ProfileRunner {

    public static class ProfileException extends RuntimeException {
        public ProfileException(String message) { super(message); }
        public ProfileException(String message, Throwable cause) { super(message, cause); }
    }

    /** Return value or raised error, console output and wall time of one run. */
    public record Run(Object value, String error, String console, long nanos) {
        public String outcome() {
            return error != null ? "raised " + error : Values.display(value);
        }
    }

    public record ProfileResult(String source,
                                String function,
                                int workers,
                                Run original,
                                Run parallel,
                                long appliedRegions,
                                List<DiagnosticEntry> diagnostics) {

        public boolean resultsMatch() {
            return original.error() == null
                ? parallel.error() == null && Values.valueEquals(original.value(), parallel.value())
                : original.error().equals(parallel.error());
        }

        public boolean consoleMatches() {
            return original.console().equals(parallel.console());
        }

        public double speedup() {
            return parallel.nanos() == 0 ? 0.0 : (double) original.nanos() / parallel.nanos();
        }
    }

    private final AnalysisConfig config;

    public ProfileRunner(AnalysisConfig config) {
        this.config = config;
    }

    /**
     * Parses {@code inputJson} as the argument list, runs {@code function} on {@code tree}
     * sequentially, parallelizes {@code tree} in place and runs it again.
     *
     * @throws ProfileException if the input is not a JSON array or the function does not exist
     */
    public ProfileResult profile(String source, SyntaxTree tree, String function, String inputJson) {
        List<Object> args = parseArguments(inputJson);
        int workers = config.backend().maxWorkers();

        try (ParallelTaskExecutor executor = new ParallelTaskExecutor(workers)) {
            System.err.println("[autopar] Running " + function + " as written...");
            Run original = run(tree, function, args, executor);

            ParallelizationReport report = new Parallelizer(config).parallelize(tree);

            System.err.println("[autopar] Running " + function + " with " + report.appliedCount()
                + " parallel regions on " + workers + " workers...");
            Run parallel = run(tree, function, args, executor);

            return new ProfileResult(source, function, workers, original, parallel,
                report.appliedCount(), report.diagnostics().entries());
        }
    }

    private Run run(SyntaxTree tree, String function, List<Object> args, ParallelTaskExecutor executor) {
        TreeInterpreter interpreter = new TreeInterpreter(tree, new ExecutionContext(), executor);
        try {
            interpreter.load();
        } catch (ProgramException e) {
            throw new ProfileException("Program failed while loading: " + e.getMessage(), e);
        }
        List<Object> callArgs = new ArrayList<>();
        for (Object a : args) callArgs.add(Values.copy(a));

        long start = System.nanoTime();
        Object value = null;
        String error = null;
        try {
            value = interpreter.call(function, callArgs);
        } catch (ProgramException e) {
            if (e.pos().equals(SourcePos.UNKNOWN)
                && ("Unknown function " + function + "/" + args.size()).equals(e.getMessage())) {
                throw new ProfileException("No function " + function + "/" + args.size() + " in the program", e);
            }
            error = Values.display(e.value());
        }
        long nanos = System.nanoTime() - start;
        return new Run(value, error, interpreter.context().console(), nanos);
    }

    public static List<Object> parseArguments(String inputJson) {
        JsonElement parsed;
        try {
            parsed = JsonParser.parseString(inputJson);
        } catch (JsonParseException e) {
            throw new ProfileException("--input is not valid JSON: " + e.getMessage(), e);
        }
        if (!parsed.isJsonArray()) {
            throw new ProfileException("--input must be a JSON array of arguments, got: " + inputJson);
        }
        List<Object> args = new ArrayList<>();
        for (JsonElement e : parsed.getAsJsonArray()) args.add(toValue(e));
        return args;
    }

    /** Whole numbers become Long, other numbers Double, arrays mutable lists. */
    public static Object toValue(JsonElement e) {
        if (e == null || e.isJsonNull()) return null;
        if (e.isJsonArray()) {
            List<Object> list = new ArrayList<>();
            for (JsonElement item : (JsonArray) e) list.add(toValue(item));
            return list;
        }
        if (e.isJsonPrimitive()) {
            JsonPrimitive p = e.getAsJsonPrimitive();
            if (p.isBoolean()) return p.getAsBoolean();
            if (p.isString()) return p.getAsString();
            BigDecimal number = p.getAsBigDecimal();
            try {
                return number.longValueExact();
            } catch (ArithmeticException notIntegral) {
                return number.doubleValue();
            }
        }
        throw new ProfileException("Objects are not supported as arguments: " + e);
    }

    /** The text of the "Performance Analysis Report". */
    public String render(ProfileResult result) {
        StringBuilder out = new StringBuilder();
        out.append("Performance Analysis Report\n");
        out.append("===========================\n\n");
        out.append(String.format(Locale.ROOT, "Source:            %s%n", result.source()));
        out.append(String.format(Locale.ROOT, "Function:          %s%n", result.function()));
        out.append(String.format(Locale.ROOT, "Workers:           %d%n", result.workers()));
        out.append(String.format(Locale.ROOT, "Parallel regions:  %d applied%n%n", result.appliedRegions()));

        out.append(String.format(Locale.ROOT, "Original time:     %.3f ms%n", millis(result.original().nanos())));
        out.append(String.format(Locale.ROOT, "Parallel time:     %.3f ms%n", millis(result.parallel().nanos())));
        out.append(String.format(Locale.ROOT, "Speedup:           %.2fx%n%n", result.speedup()));

        out.append(String.format(Locale.ROOT, "Original result:   %s%n", result.original().outcome()));
        out.append(String.format(Locale.ROOT, "Parallel result:   %s%n", result.parallel().outcome()));
        out.append(String.format(Locale.ROOT, "Results match:     %s%n", result.resultsMatch() ? "yes" : "NO"));
        out.append(String.format(Locale.ROOT, "Console matches:   %s%n%n", result.consoleMatches() ? "yes" : "NO"));

        out.append("Regions:\n");
        if (result.diagnostics().isEmpty()) {
            out.append("  (none)\n");
        }
        for (DiagnosticEntry entry : result.diagnostics()) {
            out.append(String.format(Locale.ROOT, "  %-28s %-8s %s%n", entry.location(), entry.decision(),
                entry.reason() == null ? "" : entry.reason() + " (" + entry.category() + ")"));
        }
        return out.toString();
    }

    private static double millis(long nanos) {
        return nanos / 1_000_000.0;
    }
}
