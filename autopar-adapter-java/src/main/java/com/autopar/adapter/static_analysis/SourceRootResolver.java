package com.autopar.adapter.static_analysis;

import org.apache.maven.model.Model;
import org.apache.maven.model.io.xpp3.MavenXpp3Reader;
import org.codehaus.plexus.util.xml.pull.XmlPullParserException;

import java.io.FileReader;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Resolves what to parse from a {@code --source} argument: a single {@code .java} file,
 * or the main source root of a Maven or Gradle project.
 */
public class SourceRootResolver {

    public static class UnsupportedBuildToolException extends RuntimeException {
        public UnsupportedBuildToolException(String message) { super(message); }
    }

    public SourceRoots resolve(Path source) {
        Path absolute = source.toAbsolutePath().normalize();
        if (Files.isRegularFile(absolute)) {
            if (!absolute.toString().endsWith(".java")) {
                throw new UnsupportedBuildToolException("Not a Java source file: " + absolute);
            }
            Path dir = absolute.getParent();
            return new SourceRoots(dir.toString(), dir.toString(), List.of(absolute.toString()), List.of());
        }

        Path pomFile = absolute.resolve("pom.xml");
        Path gradleFile = absolute.resolve("build.gradle");
        Path gradleKts = absolute.resolve("build.gradle.kts");

        if (pomFile.toFile().exists()) {
            return resolveMaven(absolute, pomFile);
        } else if (gradleFile.toFile().exists() || gradleKts.toFile().exists()) {
            return resolveGradle(absolute);
        } else {
            throw new UnsupportedBuildToolException(
                "No pom.xml or build.gradle found in: " + absolute +
                ". Pass a project directory (Maven, Gradle) or a single .java file."
            );
        }
    }

    private SourceRoots resolveMaven(Path projectRoot, Path pomFile) {
        String sourceDir = "src/main/java";
        try (FileReader reader = new FileReader(pomFile.toFile())) {
            Model model = new MavenXpp3Reader().read(reader);
            if (model.getBuild() != null && model.getBuild().getSourceDirectory() != null) {
                sourceDir = model.getBuild().getSourceDirectory();
            }
        } catch (IOException | XmlPullParserException e) {
            System.err.println("[autopar] WARNING: could not parse pom.xml, using default source root: " + e.getMessage());
        }

        Path absoluteSourceRoot = projectRoot.resolve(sourceDir).toAbsolutePath().normalize();
        return new SourceRoots(projectRoot.toString(), absoluteSourceRoot.toString(), List.of(),
            collectJarsInDir(projectRoot.resolve("target/dependency")));
    }

    private SourceRoots resolveGradle(Path projectRoot) {
        Path absoluteSourceRoot = projectRoot.resolve("src/main/java").toAbsolutePath().normalize();
        return new SourceRoots(projectRoot.toString(), absoluteSourceRoot.toString(), List.of(),
            collectJarsInDir(projectRoot.resolve("build/dependency")));
    }

    /** Jars copied next to the project by {@code mvn dependency:copy-dependencies} or an equivalent task. */
    private List<String> collectJarsInDir(Path dir) {
        if (!dir.toFile().exists()) return Collections.emptyList();
        try (Stream<Path> walk = Files.walk(dir)) {
            return walk
                .filter(p -> p.toString().endsWith(".jar"))
                .filter(p -> !p.toString().contains("-sources"))
                .filter(p -> !p.toString().contains("-tests"))
                .map(Path::toString)
                .sorted()
                .collect(Collectors.toList());
        } catch (IOException e) {
            System.err.println("[autopar] WARNING: could not scan dependency dir: " + e.getMessage());
            return Collections.emptyList();
        }
    }
}
