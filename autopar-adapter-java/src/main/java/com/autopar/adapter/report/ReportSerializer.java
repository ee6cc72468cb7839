package com.autopar.adapter.report;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;

import java.io.FileWriter;
import java.io.IOException;
import java.io.Writer;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;

/**
 * Sorts and serializes the report to parallel_report.json.
 * Produces deterministic output by sorting all arrays before writing.
 */
public class ReportSerializer {

    public static class ReportWriteException extends RuntimeException {
        public ReportWriteException(String msg, Throwable cause) { super(msg, cause); }
    }

    private static final Gson GSON = new GsonBuilder().setPrettyPrinting().serializeNulls().create();

    /**
     * Writes {@code root} to {@code outputDir/parallel_report.json} with arrays sorted by
     * file, then source position. Also writes {@code outputDir/metadata.json}.
     *
     * @param root      report to write
     * @param outputDir directory to write into (created if absent)
     */
    public void write(ReportModel.ReportRoot root, Path outputDir) {
        try {
            Files.createDirectories(outputDir);
        } catch (IOException e) {
            throw new ReportWriteException("Could not create output directory: " + outputDir, e);
        }

        if (root.files != null) {
            root.files = new ArrayList<>(root.files);
            root.files.sort(Comparator.comparing(f -> f.path));
        }
        if (root.regions != null) {
            root.regions = new ArrayList<>(root.regions);
            root.regions.sort(Comparator.comparing((ReportModel.RegionEntry r) -> r.file)
                    .thenComparingInt(r -> r.line)
                    .thenComparingInt(r -> r.column)
                    .thenComparing(r -> r.kind));
        }
        if (root.transforms != null) {
            root.transforms = new ArrayList<>(root.transforms);
            root.transforms.sort(Comparator.comparing((ReportModel.TransformEntry t) -> t.file)
                    .thenComparing(t -> t.location));
        }

        Path reportPath = outputDir.resolve("parallel_report.json");
        try (Writer w = new FileWriter(reportPath.toFile())) {
            GSON.toJson(root, w);
        } catch (IOException e) {
            throw new ReportWriteException("Failed to write parallel_report.json: " + e.getMessage(), e);
        }
        System.err.println("[autopar] parallel_report.json written: " + reportPath);

        var meta = new Metadata(root.source, "java", ReportAssembler.REPORT_VERSION, Instant.now().toString());
        Path metaPath = outputDir.resolve("metadata.json");
        try (Writer w = new FileWriter(metaPath.toFile())) {
            GSON.toJson(meta, w);
        } catch (IOException e) {
            throw new ReportWriteException("Failed to write metadata.json: " + e.getMessage(), e);
        }
        System.err.println("[autopar] metadata.json written: " + metaPath);
    }

    /** Writes one rendered tree next to the report. */
    public Path writeText(Path outputDir, String fileName, String text) {
        Path path = outputDir.resolve(fileName);
        try {
            Files.createDirectories(outputDir);
            Files.writeString(path, text);
        } catch (IOException e) {
            throw new ReportWriteException("Failed to write " + fileName + ": " + e.getMessage(), e);
        }
        System.err.println("[autopar] " + fileName + " written: " + path);
        return path;
    }

    private record Metadata(
            String source,
            String language,
            String reportVersion,
            String timestamp
    ) {}
}
