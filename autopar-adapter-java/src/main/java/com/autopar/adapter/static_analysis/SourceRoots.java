package com.autopar.adapter.static_analysis;

import java.util.List;

/**
 * Where the Java sources to analyze live, and the jars their bindings resolve against.
 */
public record SourceRoots(
    String projectRoot,         // absolute; report paths are relative to it
    String sourceRoot,          // absolute path to src/main/java (or equivalent)
    List<String> sourceFiles,   // explicit files; empty means every .java file under sourceRoot
    List<String> classpathJars  // absolute paths to dependency JARs
) {
    public SourceRoots {
        sourceFiles = List.copyOf(sourceFiles);
        classpathJars = List.copyOf(classpathJars);
    }
}
