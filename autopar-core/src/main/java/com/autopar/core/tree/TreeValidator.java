package com.autopar.core.tree;

import com.autopar.core.tree.SyntaxNode.*;

import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Deque;
import java.util.List;

/**
 * Checks the invariants every analysis relies on and computes the parent index of each
 * reachable node. Unreachable slots (left behind by replacements) are ignored.
 */
final class TreeValidator {

    private TreeValidator() {}

    /**
     * @return parent slot index per slot; -1 for the root and for unreachable slots
     * @throws MalformedTreeException on the first violated invariant
     */
    static int[] validate(List<SyntaxNode> slots, NodeId root) {
        if (root == null || root.isNone() || root.index() >= slots.size()) {
            throw new MalformedTreeException("Root " + root + " is not a node of the tree");
        }
        int[] parents = new int[slots.size()];
        Arrays.fill(parents, -1);
        boolean[] seen = new boolean[slots.size()];

        Deque<NodeId> work = new ArrayDeque<>();
        work.push(root);
        seen[root.index()] = true;
        while (!work.isEmpty()) {
            NodeId id = work.pop();
            SyntaxNode node = slots.get(id.index());
            if (node == null) {
                throw new MalformedTreeException("Slot " + id + " is empty");
            }
            checkShape(id, node, slots, root);
            for (NodeId child : node.children()) {
                if (child.index() >= slots.size()) {
                    throw new MalformedTreeException("Node " + id + " references missing child " + child);
                }
                if (seen[child.index()]) {
                    String first = parents[child.index()] < 0 ? "root" : "#" + parents[child.index()];
                    throw new MalformedTreeException(
                        "Node " + child + " has two parents (" + first + " and " + id + ")");
                }
                seen[child.index()] = true;
                parents[child.index()] = id.index();
                work.push(child);
            }
        }
        return parents;
    }

    private static void checkShape(NodeId id, SyntaxNode node, List<SyntaxNode> slots, NodeId root) {
        if (node.getClass().getEnclosingClass() != SyntaxNode.class || !node.getClass().isRecord()) {
            throw new MalformedTreeException("Node " + id + " is a " + node.getClass().getName()
                + ", not one of the node records");
        }
        switch (node.kind()) {
            case PROGRAM -> {
                if (!id.equals(root)) {
                    throw new MalformedTreeException("Program node " + id + " is not the root");
                }
            }
            case FUNCTION_DEF -> requireKind(slots, ((FunctionDef) node).body(), NodeKind.BLOCK, id, "function body");
            case LOOP -> {
                Loop loop = (Loop) node;
                requireKind(slots, loop.body(), NodeKind.BLOCK, id, "loop body");
                if (loop.loopKind() == LoopKind.FOR_RANGE) {
                    requireKind(slots, loop.header(), NodeKind.RANGE, id, "range loop header");
                }
                if (loop.loopKind().isCountable() && loop.variable() == null) {
                    throw new MalformedTreeException("Loop " + id + " has no iteration variable");
                }
            }
            case ASSIGN -> {
                NodeKind target = kindOf(slots, ((Assign) node).target(), id);
                if (target != NodeKind.NAME && target != NodeKind.INDEX) {
                    throw new MalformedTreeException("Assignment " + id + " targets a " + target);
                }
            }
            case IF -> {
                If n = (If) node;
                requireKind(slots, n.thenBranch(), NodeKind.BLOCK, id, "then branch");
                if (n.elseBranch().isPresent()) {
                    NodeKind k = kindOf(slots, n.elseBranch(), id);
                    if (k != NodeKind.BLOCK && k != NodeKind.IF) {
                        throw new MalformedTreeException("Else branch of " + id + " is a " + k);
                    }
                }
            }
            case TRY -> {
                Try n = (Try) node;
                requireKind(slots, n.body(), NodeKind.BLOCK, id, "try body");
                requireKind(slots, n.handler(), NodeKind.BLOCK, id, "handler");
            }
            case PARALLEL_TASK -> {
                if (((ParallelTask) node).units().isEmpty()) {
                    throw new MalformedTreeException("Parallel task " + id + " has no work units");
                }
            }
            case BLOCK, VAR_DECL, RETURN, BREAK, CONTINUE, RAISE, EXPR_STMT, NAME, LITERAL, BINARY,
                 UNARY, CALL, INDEX, LIST, RANGE, IO, YIELD, UNIT_RESULT -> { }
        }
    }

    private static void requireKind(List<SyntaxNode> slots, NodeId child, NodeKind expected, NodeId parent, String role) {
        NodeKind actual = kindOf(slots, child, parent);
        if (actual != expected) {
            throw new MalformedTreeException("The " + role + " of " + parent + " is a " + actual + ", expected " + expected);
        }
    }

    private static NodeKind kindOf(List<SyntaxNode> slots, NodeId child, NodeId parent) {
        if (child == null || child.isNone() || child.index() >= slots.size() || slots.get(child.index()) == null) {
            throw new MalformedTreeException("Node " + parent + " references missing child " + child);
        }
        return slots.get(child.index()).kind();
    }
}
