package com.autopar.runtime;

import com.autopar.core.tree.NodeId;
import com.autopar.core.tree.SyntaxTree;
import com.autopar.core.tree.TreeBuilder;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Seeded generator of single-loop kernels {@code kernel(xs)}. The same seed always gives
 * a structurally identical tree, so one copy can be rewritten and compared against the other.
 */
final class RandomKernels {

    enum Shape { PURE_MAP, PRIVATE_TEMP, FILTER, SHARED_SUM, INDEXED_STORE, SEEDED_APPEND, NESTED_MAP }

    private final Random random;
    private final TreeBuilder b = new TreeBuilder();

    private RandomKernels(long seed) {
        this.random = new Random(seed);
    }

    static SyntaxTree build(long seed) {
        return new RandomKernels(seed).kernel();
    }

    static Shape shape(long seed) {
        return Shape.values()[new Random(seed).nextInt(Shape.values().length)];
    }

    static List<Object> input(long seed) {
        Random r = new Random(seed * 31 + 7);
        int n = 3 + r.nextInt(20);
        List<Object> xs = new ArrayList<>(n);
        for (int k = 0; k < n; k++) xs.add((long) (r.nextInt(200) - 100));
        return xs;
    }

    private SyntaxTree kernel() {
        Shape shape = Shape.values()[random.nextInt(Shape.values().length)];
        NodeId body = switch (shape) {
            case PURE_MAP -> b.block(
                b.varDecl("out", b.list()),
                b.forEach("x", b.name("xs"), b.block(b.append("out", expr("x", 2)))),
                b.ret(b.name("out")));
            case PRIVATE_TEMP -> b.block(
                b.varDecl("t", b.literal(0)),
                b.varDecl("out", b.list()),
                b.forEach("x", b.name("xs"), b.block(
                    b.assign("t", expr("x", 2)),
                    b.append("out", b.binary("-", b.name("t"), expr("x", 1))))),
                b.ret(b.name("out")));
            case FILTER -> b.block(
                b.varDecl("out", b.list()),
                b.forEach("x", b.name("xs"), b.block(
                    b.ifThenElse(b.binary("==", b.binary("%", b.name("x"), b.literal(2)), b.literal(0)),
                        b.block(b.append("out", expr("x", 1))),
                        b.block(b.append("out", b.literal(-1)), b.append("out", expr("x", 1)))))),
                b.ret(b.name("out")));
            case SHARED_SUM -> b.block(
                b.varDecl("total", b.literal(0)),
                b.forEach("x", b.name("xs"), b.block(
                    b.assign("total", b.binary("+", b.name("total"), expr("x", 2))))),
                b.ret(b.name("total")));
            case INDEXED_STORE -> b.block(
                b.varDecl("arr", b.call("newArray", b.call("len", b.name("xs")))),
                b.forRange("i", b.literal(0), b.call("len", b.name("xs")), b.block(
                    b.assign(b.index(b.name("arr"), b.name("i")),
                        b.binary("+", expr("i", 1), b.index(b.name("xs"), b.name("i")))))),
                b.ret(b.name("arr")));
            case SEEDED_APPEND -> b.block(
                b.varDecl("out", b.list(b.literal(random.nextInt(10)))),
                b.forEach("x", b.name("xs"), b.block(b.append("out", expr("x", 2)))),
                b.ret(b.name("out")));
            case NESTED_MAP -> b.block(
                b.varDecl("out", b.list()),
                b.forEach("x", b.name("xs"), b.block(
                    b.varDecl("row", b.list()),
                    b.forRange("j", b.literal(0), b.literal(3),
                        b.block(b.append("row", b.binary("*", b.name("x"), b.name("j"))))),
                    b.append("out", b.name("row")))),
                b.ret(b.name("out")));
        };
        NodeId fn = b.function("kernel", List.of("xs"), body);
        return b.build(b.program("random", fn));
    }

    /** A side-effect-free integer expression over {@code var}. */
    private NodeId expr(String var, int depth) {
        if (depth == 0 || random.nextInt(3) == 0) {
            return random.nextBoolean() ? b.name(var) : b.literal(random.nextInt(9) + 1);
        }
        return switch (random.nextInt(5)) {
            case 0 -> b.binary("+", expr(var, depth - 1), expr(var, depth - 1));
            case 1 -> b.binary("*", expr(var, depth - 1), b.literal(random.nextInt(5) + 1));
            case 2 -> b.binary("%", expr(var, depth - 1), b.literal(random.nextInt(7) + 1));
            case 3 -> b.call("abs", b.binary("-", expr(var, depth - 1), b.literal(random.nextInt(50))));
            default -> b.binary("-", b.name(var), expr(var, depth - 1));
        };
    }
}
