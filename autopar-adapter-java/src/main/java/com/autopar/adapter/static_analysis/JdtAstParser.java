package com.autopar.adapter.static_analysis;

import org.eclipse.jdt.core.JavaCore;
import org.eclipse.jdt.core.compiler.IProblem;
import org.eclipse.jdt.core.dom.AST;
import org.eclipse.jdt.core.dom.ASTParser;
import org.eclipse.jdt.core.dom.CompilationUnit;
import org.eclipse.jdt.core.dom.FileASTRequestor;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Wrapper around Eclipse JDT's ASTParser.
 * Parses Java source files with binding resolution enabled, so static calls such as
 * {@code Math.sqrt} can be told apart from calls on local variables.
 */
public class JdtAstParser {

    private final SourceRoots sourceRoots;

    public JdtAstParser(SourceRoots sourceRoots) {
        this.sourceRoots = sourceRoots;
    }

    /**
     * Parses the explicit source files, or every .java file under the source root.
     * Returns a map of absolute file path -> CompilationUnit, in path order.
     */
    public Map<String, CompilationUnit> parseAll() {
        List<String> files = sourceRoots.sourceFiles().isEmpty()
            ? collectSourceFiles(sourceRoots.sourceRoot())
            : sourceRoots.sourceFiles();
        return parseFiles(files);
    }

    public Map<String, CompilationUnit> parseFiles(List<String> absoluteFilePaths) {
        if (absoluteFilePaths.isEmpty()) return Collections.emptyMap();

        ASTParser parser = ASTParser.newParser(AST.JLS21);
        parser.setKind(ASTParser.K_COMPILATION_UNIT);
        parser.setResolveBindings(true);
        parser.setBindingsRecovery(true);
        parser.setStatementsRecovery(true);

        Map<String, String> options = JavaCore.getOptions();
        JavaCore.setComplianceOptions(JavaCore.VERSION_17, options);
        parser.setCompilerOptions(options);

        String[] encodings = new String[absoluteFilePaths.size()];
        Arrays.fill(encodings, "UTF-8");

        String[] sourcepathEntries = { sourceRoots.sourceRoot() };
        String[] classpathEntries = sourceRoots.classpathJars().toArray(new String[0]);

        parser.setEnvironment(classpathEntries, sourcepathEntries, new String[]{"UTF-8"}, true);

        Map<String, CompilationUnit> parsed = new LinkedHashMap<>();
        parser.createASTs(
            absoluteFilePaths.toArray(new String[0]),
            encodings,
            new String[0],
            new FileASTRequestor() {
                @Override
                public void acceptAST(String sourceFilePath, CompilationUnit ast) {
                    reportSyntaxErrors(sourceFilePath, ast);
                    parsed.put(sourceFilePath, ast);
                }
            },
            null
        );

        // createASTs reports in its own order; keep output independent of it
        Map<String, CompilationUnit> result = new LinkedHashMap<>();
        parsed.keySet().stream().sorted().forEach(k -> result.put(k, parsed.get(k)));
        return result;
    }

    /**
     * Statement recovery keeps going past syntax errors; the recovered nodes still convert,
     * so the user only gets a warning. Unresolved-type errors are expected without a
     * classpath and are not reported.
     */
    private static void reportSyntaxErrors(String path, CompilationUnit ast) {
        for (IProblem problem : ast.getProblems()) {
            if (problem.isError() && (problem.getID() & IProblem.Syntax) != 0) {
                System.err.println("[autopar] WARNING: " + path + ":" + problem.getSourceLineNumber()
                    + " " + problem.getMessage());
            }
        }
    }

    private List<String> collectSourceFiles(String sourceRoot) {
        Path root = Paths.get(sourceRoot);
        if (!root.toFile().exists()) return Collections.emptyList();
        try (Stream<Path> walk = Files.walk(root)) {
            return walk
                .filter(p -> p.toString().endsWith(".java"))
                .filter(p -> !p.getFileName().toString().endsWith("-info.java"))
                .map(Path::toAbsolutePath)
                .map(Path::toString)
                .sorted()
                .collect(Collectors.toList());
        } catch (IOException e) {
            System.err.println("[autopar] WARNING: could not walk source tree: " + e.getMessage());
            return Collections.emptyList();
        }
    }
}
