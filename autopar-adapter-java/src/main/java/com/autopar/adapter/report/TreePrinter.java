package com.autopar.adapter.report;

import com.autopar.core.tree.NodeId;
import com.autopar.core.tree.NodeKind;
import com.autopar.core.tree.SyntaxNode;
import com.autopar.core.tree.SyntaxNode.*;
import com.autopar.core.tree.SyntaxTree;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Renders a tree as indented pseudo-source, one statement per line. Parallel tasks show
 * their combine shape, iteration space, worker count and captured inputs, followed by the
 * work-unit templates.
 */
public class TreePrinter {

    private static final String INDENT = "    ";

    public String render(SyntaxTree tree) {
        StringBuilder out = new StringBuilder();
        statement(tree, tree.root(), 0, out);
        return out.toString();
    }

    private void statement(SyntaxTree tree, NodeId id, int depth, StringBuilder out) {
        SyntaxNode node = tree.node(id);
        String pad = INDENT.repeat(depth);
        switch (node.kind()) {
            case PROGRAM -> {
                Program p = (Program) node;
                line(out, pad, "program " + p.name());
                for (NodeId s : p.statements()) statement(tree, s, depth + 1, out);
            }
            case FUNCTION_DEF -> {
                FunctionDef f = (FunctionDef) node;
                line(out, pad, "def " + f.name() + "(" + String.join(", ", f.params()) + "):");
                body(tree, f.body(), depth + 1, out);
            }
            case BLOCK -> {
                line(out, pad, "do:");
                body(tree, id, depth + 1, out);
            }
            case VAR_DECL -> {
                VarDecl v = (VarDecl) node;
                line(out, pad, "var " + v.name() + (v.hasInit() ? " = " + expr(tree, v.init()) : ""));
            }
            case ASSIGN -> {
                Assign a = (Assign) node;
                String op = a.isCompound() ? " " + a.op() + "= " : " = ";
                line(out, pad, expr(tree, a.target()) + op + expr(tree, a.value()));
            }
            case LOOP -> {
                Loop l = (Loop) node;
                String header = switch (l.loopKind()) {
                    case FOR_EACH, FOR_RANGE -> "for " + l.variable() + " in " + expr(tree, l.header()) + ":";
                    case WHILE -> "while " + expr(tree, l.header()) + ":";
                };
                line(out, pad, header);
                body(tree, l.body(), depth + 1, out);
            }
            case IF -> {
                If i = (If) node;
                line(out, pad, "if " + expr(tree, i.condition()) + ":");
                body(tree, i.thenBranch(), depth + 1, out);
                if (i.elseBranch().isPresent()) {
                    line(out, pad, "else:");
                    if (tree.kind(i.elseBranch()) == NodeKind.IF) {
                        statement(tree, i.elseBranch(), depth + 1, out);
                    } else {
                        body(tree, i.elseBranch(), depth + 1, out);
                    }
                }
            }
            case RETURN -> {
                Return r = (Return) node;
                line(out, pad, r.value().isPresent() ? "return " + expr(tree, r.value()) : "return");
            }
            case BREAK -> line(out, pad, "break");
            case CONTINUE -> line(out, pad, "continue");
            case RAISE -> {
                Raise r = (Raise) node;
                line(out, pad, r.value().isPresent() ? "raise " + expr(tree, r.value()) : "raise");
            }
            case TRY -> {
                Try t = (Try) node;
                line(out, pad, "try:");
                body(tree, t.body(), depth + 1, out);
                line(out, pad, "catch " + t.catchVariable() + ":");
                body(tree, t.handler(), depth + 1, out);
            }
            case EXPR_STMT -> line(out, pad, expr(tree, ((ExprStmt) node).expr()));
            case YIELD -> line(out, pad, "yield " + expr(tree, ((Yield) node).value()));
            case PARALLEL_TASK -> task(tree, (ParallelTask) node, depth, out);
            default -> line(out, pad, expr(tree, id));
        }
    }

    private void body(SyntaxTree tree, NodeId block, int depth, StringBuilder out) {
        List<NodeId> statements = ((Block) tree.node(block)).statements();
        if (statements.isEmpty()) {
            line(out, INDENT.repeat(depth), "pass");
        }
        for (NodeId s : statements) statement(tree, s, depth, out);
    }

    private String header(SyntaxTree tree, ParallelTask t) {
        StringBuilder header = new StringBuilder("parallel ").append(t.combine());
        if (t.variable() != null) {
            header.append(" for ").append(t.variable()).append(" in ").append(expr(tree, t.source()));
        }
        if (t.target() != null) {
            header.append(" into ").append(t.target());
        }
        header.append(" [workers=").append(t.maxWorkers());
        if (!t.captures().isEmpty()) {
            header.append(", captures=").append(String.join(", ", t.captures()));
        }
        return header.append("]").toString();
    }

    private void task(SyntaxTree tree, ParallelTask t, int depth, StringBuilder out) {
        String pad = INDENT.repeat(depth);
        line(out, pad, header(tree, t) + ":");
        for (int i = 0; i < t.units().size(); i++) {
            NodeId unit = t.units().get(i);
            if (tree.kind(unit) == NodeKind.BLOCK) {
                line(out, pad + INDENT, "unit:");
                body(tree, unit, depth + 2, out);
            } else {
                line(out, pad + INDENT, "unit " + i + ": " + expr(tree, unit));
            }
        }
        if (t.join().isPresent()) {
            line(out, pad + INDENT, "join: " + expr(tree, t.join()));
        }
    }

    private String expr(SyntaxTree tree, NodeId id) {
        if (id.isNone()) return "";
        SyntaxNode node = tree.node(id);
        return switch (node.kind()) {
            case NAME -> ((Name) node).identifier();
            case LITERAL -> literal(((Literal) node).value());
            case BINARY -> {
                Binary bin = (Binary) node;
                yield "(" + expr(tree, bin.left()) + " " + bin.op() + " " + expr(tree, bin.right()) + ")";
            }
            case UNARY -> ((Unary) node).op() + expr(tree, ((Unary) node).operand());
            case CALL -> {
                Call c = (Call) node;
                String prefix = c.hasReceiver() ? expr(tree, c.receiver()) + "." : "";
                yield prefix + c.callee() + "(" + exprs(tree, c.args()) + ")";
            }
            case INDEX -> {
                Index i = (Index) node;
                yield expr(tree, i.target()) + "[" + expr(tree, i.index()) + "]";
            }
            case LIST -> "[" + exprs(tree, ((ListExpr) node).elements()) + "]";
            case RANGE -> {
                Range r = (Range) node;
                yield "range(" + expr(tree, r.start()) + ", " + expr(tree, r.end())
                    + (r.step().isPresent() ? ", " + expr(tree, r.step()) : "") + ")";
            }
            case IO -> {
                IoOp io = (IoOp) node;
                yield "io." + io.mode().name().toLowerCase() + ":" + io.operation() + "(" + exprs(tree, io.args()) + ")";
            }
            case UNIT_RESULT -> "result[" + ((UnitResult) node).unit() + "]";
            case PARALLEL_TASK -> inlineTask(tree, (ParallelTask) node);
            default -> "<" + node.kind() + ">";
        };
    }

    /** Fork-join tasks replace an expression, so they print on one line. */
    private String inlineTask(SyntaxTree tree, ParallelTask t) {
        StringBuilder text = new StringBuilder(header(tree, t)).append(" { ");
        for (int i = 0; i < t.units().size(); i++) {
            text.append("unit ").append(i).append(": ").append(expr(tree, t.units().get(i))).append("; ");
        }
        if (t.join().isPresent()) {
            text.append("join: ").append(expr(tree, t.join())).append(" ");
        }
        return text.append("}").toString();
    }

    private String exprs(SyntaxTree tree, List<NodeId> ids) {
        return ids.stream().map(a -> expr(tree, a)).collect(Collectors.joining(", "));
    }

    private static String literal(Object value) {
        if (value == null) return "null";
        if (value instanceof String) {
            return "\"" + ((String) value).replace("\\", "\\\\").replace("\"", "\\\"").replace("\n", "\\n") + "\"";
        }
        return value.toString();
    }

    private static void line(StringBuilder out, String pad, String text) {
        out.append(pad).append(text).append('\n');
    }
}
