package com.autopar.core.tree;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * A node of the analyzed program. One record per {@link NodeKind}; children are
 * referenced by {@link NodeId} into the owning {@link SyntaxTree} arena, never by object.
 *
 * Optional children use {@link NodeId#NONE}. {@link #children()} lists only present
 * children, in evaluation order.
 */
public interface SyntaxNode {

    NodeKind kind();

    SourcePos pos();

    List<NodeId> children();

    /** Whole compilation unit: top-level declarations and function definitions. */
    record Program(String name, List<NodeId> statements, SourcePos pos) implements SyntaxNode {
        public Program {
            statements = List.copyOf(statements);
        }
        public NodeKind kind() { return NodeKind.PROGRAM; }
        public List<NodeId> children() { return statements; }
    }

    record FunctionDef(String name, List<String> params, NodeId body, SourcePos pos) implements SyntaxNode {
        public FunctionDef {
            params = List.copyOf(params);
        }
        public NodeKind kind() { return NodeKind.FUNCTION_DEF; }
        public List<NodeId> children() { return List.of(body); }
    }

    record Block(List<NodeId> statements, SourcePos pos) implements SyntaxNode {
        public Block {
            statements = List.copyOf(statements);
        }
        public NodeKind kind() { return NodeKind.BLOCK; }
        public List<NodeId> children() { return statements; }
    }

    record VarDecl(String name, NodeId init, SourcePos pos) implements SyntaxNode {
        public NodeKind kind() { return NodeKind.VAR_DECL; }
        public List<NodeId> children() { return present(init); }
        public boolean hasInit() { return init.isPresent(); }
    }

    /**
     * {@code target = value}, or {@code target op= value} when {@code op} is non-null.
     * The target is a {@link Name} or an {@link Index}.
     */
    record Assign(NodeId target, String op, NodeId value, SourcePos pos) implements SyntaxNode {
        public NodeKind kind() { return NodeKind.ASSIGN; }
        public List<NodeId> children() { return List.of(value, target); }
        public boolean isCompound() { return op != null; }
    }

    record Loop(LoopKind loopKind, String variable, NodeId header, NodeId body, SourcePos pos) implements SyntaxNode {
        public NodeKind kind() { return NodeKind.LOOP; }
        public List<NodeId> children() { return List.of(header, body); }
    }

    record If(NodeId condition, NodeId thenBranch, NodeId elseBranch, SourcePos pos) implements SyntaxNode {
        public NodeKind kind() { return NodeKind.IF; }
        public List<NodeId> children() { return present(condition, thenBranch, elseBranch); }
    }

    record Return(NodeId value, SourcePos pos) implements SyntaxNode {
        public NodeKind kind() { return NodeKind.RETURN; }
        public List<NodeId> children() { return present(value); }
    }

    record Break(SourcePos pos) implements SyntaxNode {
        public NodeKind kind() { return NodeKind.BREAK; }
        public List<NodeId> children() { return List.of(); }
    }

    record Continue(SourcePos pos) implements SyntaxNode {
        public NodeKind kind() { return NodeKind.CONTINUE; }
        public List<NodeId> children() { return List.of(); }
    }

    record Raise(NodeId value, SourcePos pos) implements SyntaxNode {
        public NodeKind kind() { return NodeKind.RAISE; }
        public List<NodeId> children() { return present(value); }
    }

    /** Protected body with one handler; {@code catchVariable} is bound inside the handler. */
    record Try(NodeId body, String catchVariable, NodeId handler, SourcePos pos) implements SyntaxNode {
        public NodeKind kind() { return NodeKind.TRY; }
        public List<NodeId> children() { return present(body, handler); }
    }

    record ExprStmt(NodeId expr, SourcePos pos) implements SyntaxNode {
        public NodeKind kind() { return NodeKind.EXPR_STMT; }
        public List<NodeId> children() { return List.of(expr); }
    }

    record Name(String identifier, SourcePos pos) implements SyntaxNode {
        public NodeKind kind() { return NodeKind.NAME; }
        public List<NodeId> children() { return List.of(); }
    }

    /** Long, Double, String, Boolean or null. */
    record Literal(Object value, SourcePos pos) implements SyntaxNode {
        public NodeKind kind() { return NodeKind.LITERAL; }
        public List<NodeId> children() { return List.of(); }
    }

    record Binary(String op, NodeId left, NodeId right, SourcePos pos) implements SyntaxNode {
        public NodeKind kind() { return NodeKind.BINARY; }
        public List<NodeId> children() { return List.of(left, right); }
    }

    record Unary(String op, NodeId operand, SourcePos pos) implements SyntaxNode {
        public NodeKind kind() { return NodeKind.UNARY; }
        public List<NodeId> children() { return List.of(operand); }
    }

    /** {@code callee(args)} or {@code receiver.callee(args)}. */
    record Call(NodeId receiver, String callee, List<NodeId> args, SourcePos pos) implements SyntaxNode {
        public Call {
            args = List.copyOf(args);
        }
        public NodeKind kind() { return NodeKind.CALL; }
        public List<NodeId> children() {
            List<NodeId> out = new ArrayList<>(present(receiver));
            out.addAll(args);
            return out;
        }
        public boolean hasReceiver() { return receiver.isPresent(); }
    }

    record Index(NodeId target, NodeId index, SourcePos pos) implements SyntaxNode {
        public NodeKind kind() { return NodeKind.INDEX; }
        public List<NodeId> children() { return List.of(target, index); }
    }

    record ListExpr(List<NodeId> elements, SourcePos pos) implements SyntaxNode {
        public ListExpr {
            elements = List.copyOf(elements);
        }
        public NodeKind kind() { return NodeKind.LIST; }
        public List<NodeId> children() { return elements; }
    }

    /** Half-open integer range {@code [start, end)}; a missing step means 1. */
    record Range(NodeId start, NodeId end, NodeId step, SourcePos pos) implements SyntaxNode {
        public NodeKind kind() { return NodeKind.RANGE; }
        public List<NodeId> children() { return present(start, end, step); }
    }

    /**
     * Explicit I/O. Console operations have no target; for every other operation the
     * first argument, when present, is the target (file path).
     */
    record IoOp(IoMode mode, String operation, List<NodeId> args, SourcePos pos) implements SyntaxNode {
        private static final Set<String> CONSOLE = Set.of("print", "println", "printf", "input", "readLine");

        public IoOp {
            args = List.copyOf(args);
        }
        public NodeKind kind() { return NodeKind.IO; }
        public List<NodeId> children() { return args; }
        public boolean isConsole() { return CONSOLE.contains(operation); }
        public NodeId target() { return isConsole() || args.isEmpty() ? NodeId.NONE : args.get(0); }
    }

    /** Emits one value from a work unit of a {@link ParallelTask}. */
    record Yield(NodeId value, SourcePos pos) implements SyntaxNode {
        public NodeKind kind() { return NodeKind.YIELD; }
        public List<NodeId> children() { return List.of(value); }
    }

    /** Result of fork-join work unit {@code unit}, referenced from the join expression. */
    record UnitResult(int unit, SourcePos pos) implements SyntaxNode {
        public NodeKind kind() { return NodeKind.UNIT_RESULT; }
        public List<NodeId> children() { return List.of(); }
    }

    /**
     * Backend-agnostic parallel form of a region.
     *
     * For loop shapes, {@code source} is the iteration space (the original loop header),
     * {@code units} holds one work-unit template instantiated once per iteration with
     * {@code variable} bound, and {@code target} names the combined collection.
     * For {@link CombineKind#FORK_JOIN}, {@code units} holds one expression per sub-call and
     * {@code join} combines their results through {@link UnitResult} placeholders.
     * {@code captures} lists the closure every unit reads from the enclosing scope.
     */
    record ParallelTask(CombineKind combine,
                        String variable,
                        LoopKind iteration,
                        NodeId source,
                        List<NodeId> units,
                        NodeId join,
                        String target,
                        List<String> captures,
                        int maxWorkers,
                        SourcePos pos) implements SyntaxNode {
        public ParallelTask {
            Objects.requireNonNull(combine, "combine");
            units = List.copyOf(units);
            captures = List.copyOf(captures);
        }
        public NodeKind kind() { return NodeKind.PARALLEL_TASK; }
        public List<NodeId> children() {
            List<NodeId> out = new ArrayList<>(present(source));
            out.addAll(units);
            out.addAll(present(join));
            return out;
        }
    }

    private static List<NodeId> present(NodeId... ids) {
        List<NodeId> out = new ArrayList<>(ids.length);
        for (NodeId id : ids) {
            if (id != null && id.isPresent()) out.add(id);
        }
        return List.copyOf(out);
    }
}
