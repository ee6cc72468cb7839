package com.autopar.core.detect;

import com.autopar.core.tree.NodeId;
import com.autopar.core.tree.SyntaxNode;
import com.autopar.core.tree.SyntaxNode.Call;
import com.autopar.core.tree.SyntaxTree;

import java.util.Locale;
import java.util.Set;

/**
 * Scores a region as CPU- or I/O-heavy from its node mix and the names of what it calls.
 */
final class WorkloadClassifier {

    private static final Set<String> CPU_KEYWORDS = Set.of(
        "math", "compute", "calculate", "process", "transform", "matrix", "vector",
        "array", "prime", "sqrt", "pow", "sum", "hash");

    private static final Set<String> IO_KEYWORDS = Set.of(
        "read", "write", "file", "network", "http", "request", "download", "upload",
        "socket", "database", "sql", "open", "stream", "content", "print", "fetch");

    private WorkloadClassifier() {}

    static WorkloadProfile classify(SyntaxTree tree, NodeId region) {
        double cpu = 0;
        double io = 0;
        int total = 0;
        for (NodeId id : tree.preorder(region)) {
            SyntaxNode node = tree.node(id);
            switch (node.kind()) {
                case CALL -> {
                    total++;
                    String name = ((Call) node).callee().toLowerCase(Locale.ROOT);
                    if (matches(name, CPU_KEYWORDS)) cpu += 1.0;
                    if (matches(name, IO_KEYWORDS)) io += 1.0;
                }
                case BINARY, UNARY -> {
                    total++;
                    cpu += 0.5;
                }
                case LOOP -> {
                    total++;
                    cpu += 0.3;
                }
                case IF -> {
                    total++;
                    cpu += 0.2;
                }
                case IO -> {
                    total++;
                    io += 1.0;
                }
                case TRY -> {
                    total++;
                    io += 0.3;
                }
                default -> { }
            }
        }
        if (total == 0) return WorkloadProfile.CPU_BOUND;
        return io > cpu ? WorkloadProfile.IO_BOUND : WorkloadProfile.CPU_BOUND;
    }

    private static boolean matches(String name, Set<String> keywords) {
        for (String k : keywords) {
            if (name.contains(k)) return true;
        }
        return false;
    }
}
