package com.autopar.core.tree;

import com.autopar.core.tree.SyntaxNode.*;

import java.util.ArrayList;
import java.util.List;
import java.util.function.UnaryOperator;

/**
 * Structural helpers over the closed set of node records.
 */
public final class SyntaxNodes {

    private SyntaxNodes() {}

    /**
     * Returns a copy of {@code node} whose present child references have been passed
     * through {@code mapper}. Absent ({@link NodeId#NONE}) children stay absent.
     */
    public static SyntaxNode withChildren(SyntaxNode node, UnaryOperator<NodeId> mapper) {
        UnaryOperator<NodeId> m = id -> id.isPresent() ? mapper.apply(id) : id;
        return switch (node.kind()) {
            case PROGRAM -> {
                Program n = (Program) node;
                yield new Program(n.name(), mapAll(n.statements(), m), n.pos());
            }
            case FUNCTION_DEF -> {
                FunctionDef n = (FunctionDef) node;
                yield new FunctionDef(n.name(), n.params(), m.apply(n.body()), n.pos());
            }
            case BLOCK -> {
                Block n = (Block) node;
                yield new Block(mapAll(n.statements(), m), n.pos());
            }
            case VAR_DECL -> {
                VarDecl n = (VarDecl) node;
                yield new VarDecl(n.name(), m.apply(n.init()), n.pos());
            }
            case ASSIGN -> {
                Assign n = (Assign) node;
                yield new Assign(m.apply(n.target()), n.op(), m.apply(n.value()), n.pos());
            }
            case LOOP -> {
                Loop n = (Loop) node;
                yield new Loop(n.loopKind(), n.variable(), m.apply(n.header()), m.apply(n.body()), n.pos());
            }
            case IF -> {
                If n = (If) node;
                yield new If(m.apply(n.condition()), m.apply(n.thenBranch()), m.apply(n.elseBranch()), n.pos());
            }
            case RETURN -> {
                Return n = (Return) node;
                yield new Return(m.apply(n.value()), n.pos());
            }
            case BREAK, CONTINUE, NAME, LITERAL, UNIT_RESULT -> node;
            case RAISE -> {
                Raise n = (Raise) node;
                yield new Raise(m.apply(n.value()), n.pos());
            }
            case TRY -> {
                Try n = (Try) node;
                yield new Try(m.apply(n.body()), n.catchVariable(), m.apply(n.handler()), n.pos());
            }
            case EXPR_STMT -> {
                ExprStmt n = (ExprStmt) node;
                yield new ExprStmt(m.apply(n.expr()), n.pos());
            }
            case BINARY -> {
                Binary n = (Binary) node;
                yield new Binary(n.op(), m.apply(n.left()), m.apply(n.right()), n.pos());
            }
            case UNARY -> {
                Unary n = (Unary) node;
                yield new Unary(n.op(), m.apply(n.operand()), n.pos());
            }
            case CALL -> {
                Call n = (Call) node;
                yield new Call(m.apply(n.receiver()), n.callee(), mapAll(n.args(), m), n.pos());
            }
            case INDEX -> {
                Index n = (Index) node;
                yield new Index(m.apply(n.target()), m.apply(n.index()), n.pos());
            }
            case LIST -> {
                ListExpr n = (ListExpr) node;
                yield new ListExpr(mapAll(n.elements(), m), n.pos());
            }
            case RANGE -> {
                Range n = (Range) node;
                yield new Range(m.apply(n.start()), m.apply(n.end()), m.apply(n.step()), n.pos());
            }
            case IO -> {
                IoOp n = (IoOp) node;
                yield new IoOp(n.mode(), n.operation(), mapAll(n.args(), m), n.pos());
            }
            case YIELD -> {
                Yield n = (Yield) node;
                yield new Yield(m.apply(n.value()), n.pos());
            }
            case PARALLEL_TASK -> {
                ParallelTask n = (ParallelTask) node;
                yield new ParallelTask(n.combine(), n.variable(), n.iteration(), m.apply(n.source()),
                    mapAll(n.units(), m), m.apply(n.join()), n.target(), n.captures(), n.maxWorkers(), n.pos());
            }
        };
    }

    /**
     * Non-structural attributes of a node (operator, identifier, literal value, ...),
     * excluding source position and child references. Used for structural fingerprints.
     */
    public static List<Object> attributes(SyntaxNode node) {
        return switch (node.kind()) {
            case PROGRAM -> List.of(((Program) node).name());
            case FUNCTION_DEF -> List.of(((FunctionDef) node).name(), ((FunctionDef) node).params());
            case VAR_DECL -> List.of(((VarDecl) node).name());
            case ASSIGN -> listOfNullable(((Assign) node).op());
            case LOOP -> listOfNullable(((Loop) node).loopKind(), ((Loop) node).variable());
            case TRY -> listOfNullable(((Try) node).catchVariable());
            case NAME -> List.of(((Name) node).identifier());
            case LITERAL -> listOfNullable(((Literal) node).value());
            case BINARY -> List.of(((Binary) node).op());
            case UNARY -> List.of(((Unary) node).op());
            case CALL -> List.of(((Call) node).callee(), ((Call) node).hasReceiver());
            case IO -> List.of(((IoOp) node).mode(), ((IoOp) node).operation());
            case UNIT_RESULT -> List.of(((UnitResult) node).unit());
            case PARALLEL_TASK -> {
                ParallelTask n = (ParallelTask) node;
                yield listOfNullable(n.combine(), n.variable(), n.target(), n.captures(), n.maxWorkers());
            }
            case BLOCK, IF, RETURN, BREAK, CONTINUE, RAISE, EXPR_STMT, INDEX, LIST, RANGE, YIELD -> List.of();
        };
    }

    private static List<NodeId> mapAll(List<NodeId> ids, UnaryOperator<NodeId> m) {
        List<NodeId> out = new ArrayList<>(ids.size());
        for (NodeId id : ids) out.add(m.apply(id));
        return out;
    }

    private static List<Object> listOfNullable(Object... values) {
        List<Object> out = new ArrayList<>(values.length);
        for (Object v : values) out.add(v);
        return out;
    }
}
