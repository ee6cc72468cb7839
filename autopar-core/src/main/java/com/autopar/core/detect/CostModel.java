package com.autopar.core.detect;

import com.autopar.core.symbols.Callee;
import com.autopar.core.symbols.SymbolTable;
import com.autopar.core.tree.NodeId;
import com.autopar.core.tree.SyntaxNode;
import com.autopar.core.tree.SyntaxNode.FunctionDef;
import com.autopar.core.tree.SyntaxNode.Loop;
import com.autopar.core.tree.SyntaxTree;

import java.util.HashSet;
import java.util.Set;

/**
 * Per-iteration cost heuristic. Weights: call 1.0, arithmetic or comparison 0.5,
 * conditional 0.2, I/O 2.0, any other node 0.1. A nested loop costs 0.3 plus its trip
 * estimate times its body cost. A call into the analyzed program adds its callee's body
 * cost once per region.
 */
final class CostModel {

    static final double CALL = 1.0;
    static final double OPERATOR = 0.5;
    static final double CONDITIONAL = 0.2;
    static final double NESTED_LOOP = 0.3;
    static final double IO = 2.0;
    static final double OTHER = 0.1;

    private final SymbolTable symbols;
    private final SyntaxTree tree;
    private final TripCountEstimator trips;

    CostModel(SymbolTable symbols, TripCountEstimator trips) {
        this.symbols = symbols;
        this.tree = symbols.tree();
        this.trips = trips;
    }

    /** Cost of one evaluation of the subtree rooted at {@code id}. */
    double cost(NodeId id) {
        return cost(id, new HashSet<>());
    }

    /** Cost of one call to {@code function}, counting its own recursive calls once. */
    double functionCost(NodeId function) {
        Set<NodeId> visited = new HashSet<>();
        visited.add(function);
        return cost(tree.node(function, FunctionDef.class).body(), visited);
    }

    private double cost(NodeId id, Set<NodeId> visitedFunctions) {
        SyntaxNode node = tree.node(id);
        double own = switch (node.kind()) {
            case CALL -> CALL + calleeCost(id, visitedFunctions);
            case BINARY, UNARY -> OPERATOR;
            case IF -> CONDITIONAL;
            case IO -> IO;
            case LOOP -> {
                Loop loop = (Loop) node;
                yield NESTED_LOOP + cost(loop.header(), visitedFunctions)
                    + trips.estimate(loop) * cost(loop.body(), visitedFunctions);
            }
            default -> OTHER;
        };
        if (node instanceof Loop) {
            return own;
        }
        for (NodeId child : node.children()) {
            own += cost(child, visitedFunctions);
        }
        return own;
    }

    private double calleeCost(NodeId callId, Set<NodeId> visitedFunctions) {
        Callee callee = symbols.resolveCallee(callId);
        if (callee.kind() != Callee.Kind.MODULE_FUNCTION || !visitedFunctions.add(callee.function())) {
            return 0;
        }
        return cost(tree.node(callee.function(), FunctionDef.class).body(), visitedFunctions);
    }
}
