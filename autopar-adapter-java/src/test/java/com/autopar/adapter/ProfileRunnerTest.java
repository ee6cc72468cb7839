package com.autopar.adapter;

import com.autopar.adapter.profile.ProfileRunner;
import com.autopar.adapter.static_analysis.ConvertedUnit;
import com.autopar.adapter.static_analysis.SourceAnalyzer;
import com.autopar.core.config.AnalysisConfig;
import com.autopar.core.config.BackendCapabilities;
import com.google.gson.JsonParser;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ProfileRunnerTest {

    private static final Path KERNELS =
        Paths.get(System.getProperty("user.dir"))
             .getParent()
             .resolve("test-fixtures/sample-kernels/src/main/java/com/autopar/fixture/Kernels.java");

    private static final AnalysisConfig CONFIG =
        AnalysisConfig.defaults().withBackend(BackendCapabilities.defaults().withMaxWorkers(4));

    private static ConvertedUnit kernels() {
        return new SourceAnalyzer().analyze(KERNELS).get(0);
    }

    @Test
    void forkJoinRecursionGivesSameResult() {
        ConvertedUnit unit = kernels();
        ProfileRunner runner = new ProfileRunner(CONFIG);

        ProfileRunner.ProfileResult result = runner.profile(unit.path(), unit.tree(), "fib", "[15]");

        assertEquals(610L, result.original().value());
        assertEquals(610L, result.parallel().value());
        assertTrue(result.resultsMatch());
        assertTrue(result.consoleMatches());
        assertTrue(result.appliedRegions() >= 1);
        assertEquals(4, result.workers());
    }

    @Test
    void consoleOutputIsComparedToo() {
        ConvertedUnit unit = kernels();
        ProfileRunner.ProfileResult result =
            new ProfileRunner(CONFIG).profile(unit.path(), unit.tree(), "printAll", "[[1, 2]]");

        assertEquals("value 1\nvalue 2\n", result.original().console());
        assertTrue(result.consoleMatches());
    }

    @Test
    void renderedReport() {
        ConvertedUnit unit = kernels();
        ProfileRunner runner = new ProfileRunner(CONFIG);
        String text = runner.render(runner.profile(unit.path(), unit.tree(), "squares", "[5]"));

        assertTrue(text.startsWith("Performance Analysis Report\n"));
        assertTrue(text.contains("Speedup:"));
        assertTrue(text.contains("Original result:   [0, 1, 4, 9, 16]"), text);
        assertTrue(text.contains("Results match:     yes"), text);
        assertTrue(text.contains("squares:"), text);
    }

    @Test
    void unknownFunctionThrows() {
        ConvertedUnit unit = kernels();
        assertThrows(ProfileRunner.ProfileException.class,
            () -> new ProfileRunner(CONFIG).profile(unit.path(), unit.tree(), "missing", "[]"));
    }

    @Test
    void argumentsMustBeAJsonArray() {
        assertThrows(ProfileRunner.ProfileException.class, () -> ProfileRunner.parseArguments("[1, "));
        assertThrows(ProfileRunner.ProfileException.class, () -> ProfileRunner.parseArguments("{\"n\": 1}"));
        assertThrows(ProfileRunner.ProfileException.class, () -> ProfileRunner.parseArguments("[{\"n\": 1}]"));
    }

    @Test
    void numbersKeepTheirShape() {
        assertEquals(3L, ProfileRunner.toValue(JsonParser.parseString("3")));
        assertEquals(1.5, ProfileRunner.toValue(JsonParser.parseString("1.5")));
        assertEquals(List.of(1L, "a", true), ProfileRunner.parseArguments("[1, \"a\", true]"));
    }
}
