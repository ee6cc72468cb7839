package com.autopar.adapter;

import com.autopar.adapter.manifest.ManifestConfig;
import com.autopar.adapter.manifest.ManifestReader;
import com.autopar.adapter.profile.ProfileRunner;
import com.autopar.adapter.report.ReportAssembler;
import com.autopar.adapter.report.ReportModel;
import com.autopar.adapter.report.ReportSerializer;
import com.autopar.adapter.report.TreePrinter;
import com.autopar.adapter.report.UnitAnalysis;
import com.autopar.adapter.static_analysis.ConvertedUnit;
import com.autopar.adapter.static_analysis.SourceAnalyzer;
import com.autopar.core.ParallelizationReport;
import com.autopar.core.Parallelizer;
import com.autopar.core.config.AnalysisConfig;
import com.autopar.core.detect.DetectionResult;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

/**
 * Command-line entry point.
 *
 * Usage:
 *   java -jar autopar-adapter-java.jar analyze \
 *     --source <project-dir|File.java> \
 *     --output <output-dir> \
 *     [--config <autopar.json>] [--apply]
 *
 *   java -jar autopar-adapter-java.jar profile \
 *     --source <File.java> --function <name> --input <json-array> \
 *     [--config <autopar.json>] [--report <path>]
 */
public class AdapterMain {

    static final String CONFIG_FILE = "autopar.json";

    public static void main(String[] args) {
        try {
            run(args);
            System.exit(0);
        } catch (UsageException e) {
            System.err.println("[autopar] ERROR: " + e.getMessage());
            System.err.println("Usage: java -jar autopar-adapter-java.jar analyze " +
                               "--source <dir|file> --output <dir> [--config <path>] [--apply]");
            System.err.println("       java -jar autopar-adapter-java.jar profile " +
                               "--source <file> --function <name> --input <json> [--config <path>] [--report <path>]");
            System.exit(2);
        } catch (Exception e) {
            System.err.println("[autopar] FATAL: " + e.getMessage());
            System.exit(1);
        }
    }

    static void run(String[] args) {
        if (args.length == 0) {
            throw new UsageException("No subcommand specified");
        }
        switch (args[0]) {
            case "analyze" -> analyze(args);
            case "profile" -> profile(args);
            default -> throw new UsageException("Unknown subcommand: " + args[0]);
        }
    }

    private static void analyze(String[] args) {
        String sourcePath = null;
        String outputDir = null;
        String configPath = null;
        boolean apply = false;

        for (int i = 1; i < args.length; i++) {
            switch (args[i]) {
                case "--source" -> sourcePath = requireNext(args, i++, "--source");
                case "--output" -> outputDir  = requireNext(args, i++, "--output");
                case "--config" -> configPath = requireNext(args, i++, "--config");
                case "--apply"  -> apply = true;
                default -> throw new UsageException("Unknown flag: " + args[i]);
            }
        }

        if (sourcePath == null) throw new UsageException("--source is required");
        if (outputDir == null)  throw new UsageException("--output is required");

        Path source = Paths.get(sourcePath);
        Path output = Paths.get(outputDir);
        AnalysisConfig config = loadConfig(source, configPath);

        // 1. Parse and convert
        System.err.println("[autopar] Converting sources: " + source);
        List<ConvertedUnit> units = new SourceAnalyzer().analyze(source);

        // 2. Detect, and rewrite when asked
        Parallelizer parallelizer = new Parallelizer(config);
        List<UnitAnalysis> analyses = new ArrayList<>();
        for (ConvertedUnit unit : units) {
            System.err.println("[autopar] Analyzing " + unit.path());
            if (apply) {
                ParallelizationReport report = parallelizer.parallelize(unit.tree());
                analyses.add(new UnitAnalysis(unit, report.detection(), report.outcomes()));
            } else {
                DetectionResult detection = parallelizer.analyze(unit.tree());
                analyses.add(new UnitAnalysis(unit, detection, List.of()));
            }
        }

        // 3. Serialize
        System.err.println("[autopar] Writing output to: " + output);
        ReportSerializer serializer = new ReportSerializer();
        ReportModel.ReportRoot root = new ReportAssembler().assemble(source.toString(), apply, analyses);
        serializer.write(root, output);
        if (apply) {
            TreePrinter printer = new TreePrinter();
            for (ConvertedUnit unit : units) {
                serializer.writeText(output, unit.name() + ".parallel.txt", printer.render(unit.tree()));
            }
        }

        System.err.println("[autopar] Done: " + root.summary.candidates + " candidates, "
            + root.summary.accepted + " accepted, " + root.summary.applied + " applied.");
    }

    private static void profile(String[] args) {
        String sourcePath = null;
        String function = null;
        String input = null;
        String configPath = null;
        String reportPath = null;

        for (int i = 1; i < args.length; i++) {
            switch (args[i]) {
                case "--source"   -> sourcePath = requireNext(args, i++, "--source");
                case "--function" -> function   = requireNext(args, i++, "--function");
                case "--input"    -> input      = requireNext(args, i++, "--input");
                case "--config"   -> configPath = requireNext(args, i++, "--config");
                case "--report"   -> reportPath = requireNext(args, i++, "--report");
                default -> throw new UsageException("Unknown flag: " + args[i]);
            }
        }

        if (sourcePath == null) throw new UsageException("--source is required");
        if (function == null)   throw new UsageException("--function is required");
        if (input == null)      throw new UsageException("--input is required");

        Path source = Paths.get(sourcePath);
        if (!Files.isRegularFile(source)) {
            throw new UsageException("--source must be a .java file for profile: " + source);
        }
        AnalysisConfig config = loadConfig(source, configPath);

        List<ConvertedUnit> units = new SourceAnalyzer().analyze(source);
        ConvertedUnit unit = units.get(0);

        ProfileRunner runner = new ProfileRunner(config);
        ProfileRunner.ProfileResult result = runner.profile(unit.path(), unit.tree(), function, input);
        String text = runner.render(result);

        if (reportPath == null) {
            System.out.print(text);
        } else {
            Path report = Paths.get(reportPath);
            try {
                if (report.toAbsolutePath().getParent() != null) {
                    Files.createDirectories(report.toAbsolutePath().getParent());
                }
                Files.writeString(report, text);
            } catch (IOException e) {
                throw new ProfileRunner.ProfileException("Failed to write report " + report + ": " + e.getMessage(), e);
            }
            System.err.println("[autopar] Performance report written: " + report);
        }
        if (!result.resultsMatch() || !result.consoleMatches()) {
            System.err.println("[autopar] WARNING: parallel run differs from the original run");
        }
    }

    /**
     * An explicit {@code --config}, else {@code autopar.json} in the source directory, else defaults.
     */
    static AnalysisConfig loadConfig(Path source, String configPath) {
        Path config;
        if (configPath != null) {
            config = Paths.get(configPath);
        } else {
            Path dir = Files.isDirectory(source) ? source : source.toAbsolutePath().getParent();
            config = dir == null ? null : dir.resolve(CONFIG_FILE);
            if (config == null || !Files.exists(config)) {
                System.err.println("[autopar] No " + CONFIG_FILE + " found, using default options");
                return AnalysisConfig.defaults();
            }
        }
        System.err.println("[autopar] Reading config: " + config);
        ManifestConfig manifest = new ManifestReader().read(config);
        try {
            return manifest.toAnalysisConfig();
        } catch (IllegalArgumentException e) {
            throw new UsageException("Invalid " + config + ": " + e.getMessage());
        }
    }

    private static String requireNext(String[] args, int i, String flag) {
        if (i + 1 >= args.length) {
            throw new UsageException(flag + " requires an argument");
        }
        return args[i + 1];
    }

    static class UsageException extends RuntimeException {
        UsageException(String msg) { super(msg); }
    }
}
