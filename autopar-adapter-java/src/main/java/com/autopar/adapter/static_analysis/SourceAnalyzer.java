package com.autopar.adapter.static_analysis;

import org.eclipse.jdt.core.dom.AbstractTypeDeclaration;
import org.eclipse.jdt.core.dom.CompilationUnit;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Orchestrates the frontend: resolve what to parse, parse it with JDT, convert every
 * compilation unit into an analysis tree.
 */
public class SourceAnalyzer {

    public List<ConvertedUnit> analyze(Path source) {
        SourceRoots sourceRoots = new SourceRootResolver().resolve(source);

        Map<String, CompilationUnit> compilationUnits = new JdtAstParser(sourceRoots).parseAll();
        System.err.println("[autopar] Parsed " + compilationUnits.size() + " source files under "
            + sourceRoots.sourceRoot());

        List<ConvertedUnit> units = new ArrayList<>();
        for (Map.Entry<String, CompilationUnit> entry : compilationUnits.entrySet()) {
            String relativePath = makeRelative(sourceRoots.projectRoot(), entry.getKey());
            CompilationUnit cu = entry.getValue();
            JavaTreeConverter converter = new JavaTreeConverter(cu, relativePath);
            String name = programName(cu, entry.getKey());
            units.add(new ConvertedUnit(relativePath, name, converter.convert(name), converter.unsupportedCount()));
        }
        return units;
    }

    private static String programName(CompilationUnit cu, String path) {
        if (!cu.types().isEmpty()) {
            return ((AbstractTypeDeclaration) cu.types().get(0)).getName().getIdentifier();
        }
        String file = Paths.get(path).getFileName().toString();
        return file.endsWith(".java") ? file.substring(0, file.length() - ".java".length()) : file;
    }

    private static String makeRelative(String projectRoot, String absolutePath) {
        Path root = Paths.get(projectRoot).toAbsolutePath().normalize();
        Path file = Paths.get(absolutePath).toAbsolutePath().normalize();
        Path rel = file.startsWith(root) ? root.relativize(file) : file;
        return rel.toString().replace('\\', '/');
    }
}
