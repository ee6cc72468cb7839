package com.autopar.adapter;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

import static org.junit.jupiter.api.Assertions.*;

class AdapterMainTest {

    private static final Path FIXTURE_ROOT =
        Paths.get(System.getProperty("user.dir"))
             .getParent()
             .resolve("test-fixtures/sample-kernels");

    @Test
    void noArgsThrowsUsageException() {
        assertThrows(AdapterMain.UsageException.class, () -> AdapterMain.run(new String[]{}));
    }

    @Test
    void unknownSubcommandThrowsUsageException() {
        assertThrows(AdapterMain.UsageException.class,
                () -> AdapterMain.run(new String[]{"record"}));
    }

    @Test
    void analyzeWithoutSourceThrowsUsageException() {
        assertThrows(AdapterMain.UsageException.class,
                () -> AdapterMain.run(new String[]{"analyze", "--output", "/tmp/out"}));
    }

    @Test
    void analyzeWithoutOutputThrowsUsageException() {
        assertThrows(AdapterMain.UsageException.class,
                () -> AdapterMain.run(new String[]{"analyze", "--source", FIXTURE_ROOT.toString()}));
    }

    @Test
    void unknownFlagThrowsUsageException() {
        assertThrows(AdapterMain.UsageException.class,
                () -> AdapterMain.run(new String[]{"analyze", "--foo", "bar"}));
    }

    @Test
    void flagWithoutValueThrowsUsageException() {
        Exception ex = assertThrows(AdapterMain.UsageException.class,
                () -> AdapterMain.run(new String[]{"analyze", "--source"}));
        assertEquals("--source requires an argument", ex.getMessage());
    }

    @Test
    void profileWithoutFunctionThrowsUsageException() {
        assertThrows(AdapterMain.UsageException.class,
                () -> AdapterMain.run(new String[]{"profile", "--source", "K.java", "--input", "[]"}));
    }

    @Test
    void profileOfDirectoryThrowsUsageException() {
        assertThrows(AdapterMain.UsageException.class,
                () -> AdapterMain.run(new String[]{"profile", "--source", FIXTURE_ROOT.toString(),
                        "--function", "fib", "--input", "[10]"}));
    }

    @Test
    void analyzeWritesReportAndRenderings(@TempDir Path tmp) throws Exception {
        AdapterMain.run(new String[]{"analyze", "--source", FIXTURE_ROOT.toString(),
                "--output", tmp.toString(), "--apply"});

        Path report = tmp.resolve("parallel_report.json");
        assertTrue(Files.exists(report));
        assertTrue(Files.exists(tmp.resolve("metadata.json")));

        JsonObject root = JsonParser.parseString(Files.readString(report)).getAsJsonObject();
        assertTrue(root.get("applied").getAsBoolean());
        JsonObject summary = root.getAsJsonObject("summary");
        assertTrue(summary.get("applied").getAsInt() >= 5,
            "Expected at least 5 rewrites, got: " + summary);
        assertEquals(summary.get("candidates").getAsInt(),
            summary.get("accepted").getAsInt() + summary.get("rejected").getAsInt());

        String kernels = Files.readString(tmp.resolve("Kernels.parallel.txt"));
        assertTrue(kernels.contains("parallel ORDERED_COLLECT for x in xs into out"), kernels);
        assertTrue(kernels.contains("parallel FORK_JOIN"), kernels);
        assertTrue(Files.exists(tmp.resolve("Scoring.parallel.txt")));
    }

    @Test
    void analyzeWithoutApplyLeavesOutTransforms(@TempDir Path tmp) throws Exception {
        AdapterMain.run(new String[]{"analyze", "--source", FIXTURE_ROOT.toString(),
                "--output", tmp.toString()});

        JsonObject root = JsonParser.parseString(Files.readString(tmp.resolve("parallel_report.json")))
            .getAsJsonObject();
        assertFalse(root.get("applied").getAsBoolean());
        assertEquals(0, root.getAsJsonArray("transforms").size());
        assertFalse(Files.exists(tmp.resolve("Kernels.parallel.txt")));
    }

    @Test
    void profileWritesPerformanceReport(@TempDir Path tmp) throws Exception {
        Path source = FIXTURE_ROOT.resolve("src/main/java/com/autopar/fixture/Kernels.java");
        Path report = tmp.resolve("perf.txt");
        AdapterMain.run(new String[]{"profile", "--source", source.toString(),
                "--config", FIXTURE_ROOT.resolve("autopar.json").toString(),
                "--function", "doubleAll", "--input", "[[1, 2, 3]]", "--report", report.toString()});

        String text = Files.readString(report);
        assertTrue(text.startsWith("Performance Analysis Report"));
        assertTrue(text.contains("Results match:     yes"), text);
        assertTrue(text.contains("Original result:   [2, 4, 6]"), text);
    }

    @Test
    void invalidConfigValueIsAUsageError(@TempDir Path tmp) throws Exception {
        Path config = tmp.resolve("autopar.json");
        Files.writeString(config, "{\"min_iterations\": 0}");
        assertThrows(AdapterMain.UsageException.class,
                () -> AdapterMain.loadConfig(FIXTURE_ROOT, config.toString()));
    }

    @Test
    void configDefaultsToSourceDirectory() {
        assertEquals(4, AdapterMain.loadConfig(FIXTURE_ROOT, null).backend().maxWorkers());
    }
}
