package com.autopar.core;

import com.autopar.core.tree.IoMode;
import com.autopar.core.tree.NodeId;
import com.autopar.core.tree.NodeKind;
import com.autopar.core.tree.SyntaxNode;
import com.autopar.core.tree.SyntaxTree;
import com.autopar.core.tree.TreeBuilder;

import java.util.List;

/**
 * Small programs shared by the core tests. Each returns the built tree plus the ids a test
 * usually needs.
 */
public final class Kernels {

    public record Fixture(SyntaxTree tree, NodeId function, NodeId loop) {}

    private Kernels() {}

    /** {@code out = []; for x in xs { out.add(x * 2) } return out} */
    public static Fixture doubleAll() {
        TreeBuilder b = new TreeBuilder();
        b.at(2, 5);
        NodeId decl = b.varDecl("out", b.list());
        b.at(3, 5);
        NodeId loop = b.forEach("x", b.name("xs"),
            b.block(b.append("out", b.binary("*", b.name("x"), b.literal(2)))));
        b.at(6, 5);
        NodeId ret = b.ret(b.name("out"));
        NodeId fn = b.function("doubleAll", List.of("xs"), b.block(decl, loop, ret));
        return new Fixture(b.build(b.program("kernels", fn)), fn, loop);
    }

    /** {@code total = 0; for item in items { total = total + item } return total} */
    public static Fixture sumAll() {
        TreeBuilder b = new TreeBuilder();
        NodeId decl = b.varDecl("total", b.literal(0));
        NodeId loop = b.forEach("item", b.name("items"),
            b.block(b.assign("total", b.binary("+", b.name("total"), b.name("item")))));
        NodeId fn = b.function("sumAll", List.of("items"), b.block(decl, loop, b.ret(b.name("total"))));
        return new Fixture(b.build(b.program("kernels", fn)), fn, loop);
    }

    /** {@code out = []; for x in xs { out.add(mystery(x)) } return out} */
    public static Fixture callsUnknown() {
        TreeBuilder b = new TreeBuilder();
        NodeId decl = b.varDecl("out", b.list());
        NodeId loop = b.forEach("x", b.name("xs"),
            b.block(b.append("out", b.call("mystery", b.name("x")))));
        NodeId fn = b.function("mapMystery", List.of("xs"), b.block(decl, loop, b.ret(b.name("out"))));
        return new Fixture(b.build(b.program("kernels", fn)), fn, loop);
    }

    /** {@code arr = newArray(n); for i in range(0, n) { arr[i] = i * i } return arr} */
    public static Fixture squares() {
        TreeBuilder b = new TreeBuilder();
        NodeId decl = b.varDecl("arr", b.call("newArray", b.name("n")));
        NodeId loop = b.forRange("i", b.literal(0), b.name("n"),
            b.block(b.assign(b.index(b.name("arr"), b.name("i")),
                b.binary("*", b.name("i"), b.name("i")))));
        NodeId fn = b.function("squares", List.of("n"), b.block(decl, loop, b.ret(b.name("arr"))));
        return new Fixture(b.build(b.program("kernels", fn)), fn, loop);
    }

    /** {@code for i in range(1, n) { a[i] = a[i - 1] + 1 }} */
    public static Fixture prefix() {
        TreeBuilder b = new TreeBuilder();
        NodeId loop = b.forRange("i", b.literal(1), b.name("n"),
            b.block(b.assign(b.index(b.name("a"), b.name("i")),
                b.binary("+", b.index(b.name("a"), b.binary("-", b.name("i"), b.literal(1))), b.literal(1)))));
        NodeId fn = b.function("prefix", List.of("a", "n"), b.block(loop));
        return new Fixture(b.build(b.program("kernels", fn)), fn, loop);
    }

    /** {@code t = 0; out = []; for x in xs { t = x + 1; out.add(t * t) } return out} */
    public static Fixture temporary() {
        TreeBuilder b = new TreeBuilder();
        NodeId t = b.varDecl("t", b.literal(0));
        NodeId out = b.varDecl("out", b.list());
        NodeId loop = b.forEach("x", b.name("xs"), b.block(
            b.assign("t", b.binary("+", b.name("x"), b.literal(1))),
            b.append("out", b.binary("*", b.name("t"), b.name("t")))));
        NodeId fn = b.function("squaresPlusOne", List.of("xs"), b.block(t, out, loop, b.ret(b.name("out"))));
        return new Fixture(b.build(b.program("kernels", fn)), fn, loop);
    }

    /** {@code for x in xs { print(x) }} */
    public static Fixture printsEach() {
        TreeBuilder b = new TreeBuilder();
        NodeId loop = b.forEach("x", b.name("xs"), b.block(b.print(b.name("x"))));
        NodeId fn = b.function("printAll", List.of("xs"), b.block(loop));
        return new Fixture(b.build(b.program("kernels", fn)), fn, loop);
    }

    /** {@code for i in range(0, 4) { writeString("out_" + i + ".txt", "row " + i) }} */
    public static Fixture writesFiles() {
        TreeBuilder b = new TreeBuilder();
        NodeId path = b.binary("+", b.binary("+", b.literal("out_"), b.name("i")), b.literal(".txt"));
        NodeId loop = b.forRange("i", b.literal(0), b.literal(4), b.block(
            b.exprStmt(b.io(IoMode.WRITE, "writeString", path, b.binary("+", b.literal("row "), b.name("i"))))));
        NodeId fn = b.function("writeAll", List.of(), b.block(loop));
        return new Fixture(b.build(b.program("kernels", fn)), fn, loop);
    }

    /** {@code i = 0; while (i < n) { i = i + 1 }} */
    public static Fixture whileLoop() {
        TreeBuilder b = new TreeBuilder();
        NodeId decl = b.varDecl("i", b.literal(0));
        NodeId loop = b.whileLoop(b.binary("<", b.name("i"), b.name("n")),
            b.block(b.assign("i", b.binary("+", b.name("i"), b.literal(1)))));
        NodeId fn = b.function("count", List.of("n"), b.block(decl, loop));
        return new Fixture(b.build(b.program("kernels", fn)), fn, loop);
    }

    /** {@code out = []; for x in xs { if (x < 0) { break } out.add(x) }} */
    public static Fixture breaksEarly() {
        TreeBuilder b = new TreeBuilder();
        NodeId decl = b.varDecl("out", b.list());
        NodeId loop = b.forEach("x", b.name("xs"), b.block(
            b.ifThen(b.binary("<", b.name("x"), b.literal(0)), b.block(b.breakStmt())),
            b.append("out", b.name("x"))));
        NodeId fn = b.function("untilNegative", List.of("xs"), b.block(decl, loop, b.ret(b.name("out"))));
        return new Fixture(b.build(b.program("kernels", fn)), fn, loop);
    }

    /** {@code arr = newArray(1); for i in range(0, 1) { arr[i] = i }} */
    public static Fixture singleIteration() {
        TreeBuilder b = new TreeBuilder();
        NodeId decl = b.varDecl("arr", b.call("newArray", b.literal(1)));
        NodeId loop = b.forRange("i", b.literal(0), b.literal(1),
            b.block(b.assign(b.index(b.name("arr"), b.name("i")), b.name("i"))));
        NodeId fn = b.function("one", List.of(), b.block(decl, loop, b.ret(b.name("arr"))));
        return new Fixture(b.build(b.program("kernels", fn)), fn, loop);
    }

    /** {@code fib(n) { if (n < 2) { return n } return fib(n - 1) + fib(n - 2) }}; the loop id is the join expression. */
    public static Fixture fib() {
        TreeBuilder b = new TreeBuilder();
        NodeId base = b.ifThen(b.binary("<", b.name("n"), b.literal(2)), b.block(b.ret(b.name("n"))));
        NodeId join = b.binary("+",
            b.call("fib", b.binary("-", b.name("n"), b.literal(1))),
            b.call("fib", b.binary("-", b.name("n"), b.literal(2))));
        NodeId fn = b.function("fib", List.of("n"), b.block(base, b.ret(join)));
        return new Fixture(b.build(b.program("kernels", fn)), fn, join);
    }

    /** Like {@link #fib()}, but every call bumps the global {@code calls}. */
    public static Fixture countingFib() {
        TreeBuilder b = new TreeBuilder();
        NodeId global = b.varDecl("calls", b.literal(0));
        NodeId bump = b.assign("calls", b.binary("+", b.name("calls"), b.literal(1)));
        NodeId base = b.ifThen(b.binary("<", b.name("n"), b.literal(2)), b.block(b.ret(b.name("n"))));
        NodeId join = b.binary("+",
            b.call("fib", b.binary("-", b.name("n"), b.literal(1))),
            b.call("fib", b.binary("-", b.name("n"), b.literal(2))));
        NodeId fn = b.function("fib", List.of("n"), b.block(bump, base, b.ret(join)));
        return new Fixture(b.build(b.program("kernels", global, fn)), fn, join);
    }

    /** {@code out = []; for row in rows { inner = []; for x in row { inner.add(x + 1) } out.add(inner) }} */
    public static Fixture nested() {
        TreeBuilder b = new TreeBuilder();
        NodeId decl = b.varDecl("out", b.list());
        NodeId inner = b.forEach("x", b.name("row"),
            b.block(b.append("inner", b.binary("+", b.name("x"), b.literal(1)))));
        NodeId loop = b.forEach("row", b.name("rows"), b.block(
            b.varDecl("inner", b.list()),
            inner,
            b.append("out", b.name("inner"))));
        NodeId fn = b.function("incrementRows", List.of("rows"), b.block(decl, loop, b.ret(b.name("out"))));
        return new Fixture(b.build(b.program("kernels", fn)), fn, loop);
    }

    /** First node of {@code kind} under {@code from}, in pre-order. */
    public static NodeId first(SyntaxTree tree, NodeId from, NodeKind kind) {
        for (NodeId id : tree.preorder(from)) {
            if (tree.kind(id) == kind) return id;
        }
        throw new AssertionError("No " + kind + " under " + from);
    }

    /** First {@code NAME} node spelling {@code identifier} under {@code from}. */
    public static NodeId name(SyntaxTree tree, NodeId from, String identifier) {
        for (NodeId id : tree.preorder(from)) {
            SyntaxNode n = tree.node(id);
            if (n instanceof SyntaxNode.Name && ((SyntaxNode.Name) n).identifier().equals(identifier)) {
                return id;
            }
        }
        throw new AssertionError("No name " + identifier + " under " + from);
    }

    /** Loops under {@code from}, outermost first. */
    public static List<NodeId> loops(SyntaxTree tree, NodeId from) {
        return tree.preorder(from).stream().filter(id -> tree.kind(id) == NodeKind.LOOP).toList();
    }
}
