package com.autopar.core.tree;

import com.autopar.core.tree.SyntaxNode.*;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Allocates nodes into a fresh arena. Frontends and tests build bottom-up: children first,
 * then the node that owns them. {@link #build(NodeId)} validates and freezes the result.
 *
 * Nodes are stamped with the position last set through {@link #at(int, int)}.
 */
public final class TreeBuilder {

    private final List<SyntaxNode> slots = new ArrayList<>();
    private SourcePos pos = SourcePos.UNKNOWN;

    public TreeBuilder at(int line, int column) {
        this.pos = SourcePos.of(line, column);
        return this;
    }

    public SourcePos position() {
        return pos;
    }

    public NodeId add(SyntaxNode node) {
        slots.add(node);
        return new NodeId(slots.size() - 1);
    }

    public SyntaxNode get(NodeId id) {
        return slots.get(id.index());
    }

    /**
     * @throws MalformedTreeException if the nodes reachable from {@code root} do not form a tree
     */
    public SyntaxTree build(NodeId root) {
        return new SyntaxTree(slots, root);
    }

    // --- Declarations and statements ---

    public NodeId program(String name, NodeId... statements) {
        return add(new Program(name, Arrays.asList(statements), pos));
    }

    public NodeId program(String name, List<NodeId> statements) {
        return add(new Program(name, statements, pos));
    }

    public NodeId function(String name, List<String> params, NodeId body) {
        return add(new FunctionDef(name, params, body, pos));
    }

    public NodeId block(NodeId... statements) {
        return add(new Block(Arrays.asList(statements), pos));
    }

    public NodeId block(List<NodeId> statements) {
        return add(new Block(statements, pos));
    }

    public NodeId varDecl(String name, NodeId init) {
        return add(new VarDecl(name, init, pos));
    }

    public NodeId varDecl(String name) {
        return varDecl(name, NodeId.NONE);
    }

    public NodeId assign(String name, NodeId value) {
        return add(new Assign(name(name), null, value, pos));
    }

    public NodeId assign(NodeId target, NodeId value) {
        return add(new Assign(target, null, value, pos));
    }

    public NodeId compoundAssign(String name, String op, NodeId value) {
        return add(new Assign(name(name), op, value, pos));
    }

    public NodeId forEach(String variable, NodeId iterable, NodeId body) {
        return add(new Loop(LoopKind.FOR_EACH, variable, iterable, body, pos));
    }

    public NodeId forRange(String variable, NodeId start, NodeId end, NodeId body) {
        return add(new Loop(LoopKind.FOR_RANGE, variable, range(start, end), body, pos));
    }

    public NodeId whileLoop(NodeId condition, NodeId body) {
        return add(new Loop(LoopKind.WHILE, null, condition, body, pos));
    }

    public NodeId ifThen(NodeId condition, NodeId thenBranch) {
        return add(new If(condition, thenBranch, NodeId.NONE, pos));
    }

    public NodeId ifThenElse(NodeId condition, NodeId thenBranch, NodeId elseBranch) {
        return add(new If(condition, thenBranch, elseBranch, pos));
    }

    public NodeId ret(NodeId value) {
        return add(new Return(value, pos));
    }

    public NodeId breakStmt() {
        return add(new Break(pos));
    }

    public NodeId continueStmt() {
        return add(new Continue(pos));
    }

    public NodeId raise(NodeId value) {
        return add(new Raise(value, pos));
    }

    public NodeId tryCatch(NodeId body, String catchVariable, NodeId handler) {
        return add(new Try(body, catchVariable, handler, pos));
    }

    public NodeId exprStmt(NodeId expr) {
        return add(new ExprStmt(expr, pos));
    }

    // --- Expressions ---

    public NodeId name(String identifier) {
        return add(new Name(identifier, pos));
    }

    public NodeId literal(Object value) {
        Object v = value;
        if (v instanceof Integer || v instanceof Short || v instanceof Byte) {
            v = ((Number) v).longValue();
        } else if (v instanceof Float) {
            v = ((Float) v).doubleValue();
        } else if (v instanceof Character) {
            v = v.toString();
        }
        return add(new Literal(v, pos));
    }

    public NodeId binary(String op, NodeId left, NodeId right) {
        return add(new Binary(op, left, right, pos));
    }

    public NodeId unary(String op, NodeId operand) {
        return add(new Unary(op, operand, pos));
    }

    public NodeId call(String callee, NodeId... args) {
        return add(new Call(NodeId.NONE, callee, Arrays.asList(args), pos));
    }

    public NodeId methodCall(NodeId receiver, String callee, NodeId... args) {
        return add(new Call(receiver, callee, Arrays.asList(args), pos));
    }

    /** {@code target.add(value)} as a statement: the monotonic-append pattern. */
    public NodeId append(String target, NodeId value) {
        return exprStmt(methodCall(name(target), "add", value));
    }

    public NodeId index(NodeId target, NodeId index) {
        return add(new Index(target, index, pos));
    }

    public NodeId list(NodeId... elements) {
        return add(new ListExpr(Arrays.asList(elements), pos));
    }

    public NodeId list(List<NodeId> elements) {
        return add(new ListExpr(elements, pos));
    }

    public NodeId range(NodeId start, NodeId end) {
        return add(new Range(start, end, NodeId.NONE, pos));
    }

    public NodeId range(NodeId start, NodeId end, NodeId step) {
        return add(new Range(start, end, step, pos));
    }

    public NodeId io(IoMode mode, String operation, NodeId... args) {
        return add(new IoOp(mode, operation, Arrays.asList(args), pos));
    }

    public NodeId print(NodeId... args) {
        return exprStmt(io(IoMode.WRITE, "print", args));
    }
}
