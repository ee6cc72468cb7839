package com.autopar.core.detect;

import com.autopar.core.symbols.Builtins;
import com.autopar.core.symbols.Symbol;
import com.autopar.core.symbols.SymbolTable;
import com.autopar.core.tree.NodeId;
import com.autopar.core.tree.SyntaxNode;
import com.autopar.core.tree.SyntaxNode.*;
import com.autopar.core.tree.SyntaxTree;

/**
 * Estimates how many times a loop body runs. Exact only for literal shapes; everything
 * else gets the configured default.
 */
final class TripCountEstimator {

    private final SymbolTable symbols;
    private final SyntaxTree tree;
    private final int defaultTripCount;

    TripCountEstimator(SymbolTable symbols, int defaultTripCount) {
        this.symbols = symbols;
        this.tree = symbols.tree();
        this.defaultTripCount = defaultTripCount;
    }

    int estimate(Loop loop) {
        return switch (loop.loopKind()) {
            case FOR_RANGE -> range(tree.node(loop.header(), Range.class));
            case FOR_EACH -> sequence(loop.header());
            case WHILE -> defaultTripCount;
        };
    }

    private int range(Range r) {
        Long start = longLiteral(r.start());
        Long end = longLiteral(r.end());
        Long step = r.step().isPresent() ? longLiteral(r.step()) : Long.valueOf(1);
        if (start == null || end == null || step == null || step == 0) {
            return defaultTripCount;
        }
        long span = step > 0 ? end - start : start - end;
        long abs = Math.abs(step);
        long trips = span <= 0 ? 0 : (span + abs - 1) / abs;
        return (int) Math.min(trips, Integer.MAX_VALUE);
    }

    private int sequence(NodeId header) {
        SyntaxNode node = tree.node(header);
        if (node instanceof ListExpr) {
            return ((ListExpr) node).elements().size();
        }
        if (node instanceof Range) {
            return range((Range) node);
        }
        if (node instanceof Name) {
            Symbol s = symbols.referenceAt(header);
            NodeId decl = symbols.declarationOf(s);
            if (decl.isPresent() && tree.node(decl) instanceof VarDecl && isNeverModified(s)) {
                NodeId init = ((VarDecl) tree.node(decl)).init();
                if (init.isPresent() && tree.node(init) instanceof ListExpr) {
                    return ((ListExpr) tree.node(init)).elements().size();
                }
            }
        }
        return defaultTripCount;
    }

    /** Every reference only reads the collection: no reassignment, no mutating method. */
    private boolean isNeverModified(Symbol s) {
        for (NodeId ref : symbols.referencesOf(s)) {
            NodeId parent = tree.parentOf(ref);
            if (parent.isNone()) continue;
            SyntaxNode p = tree.node(parent);
            if (p instanceof Assign && ((Assign) p).target().equals(ref)) return false;
            if (p instanceof Index && tree.parentOf(parent).isPresent()) {
                SyntaxNode grand = tree.node(tree.parentOf(parent));
                if (grand instanceof Assign && ((Assign) grand).target().equals(parent)) return false;
            }
            if (p instanceof Call && ((Call) p).receiver().equals(ref)) {
                String m = ((Call) p).callee();
                if (!Builtins.isAccessorMethod(m)) return false;
            }
        }
        return true;
    }

    private Long longLiteral(NodeId id) {
        SyntaxNode n = tree.node(id);
        if (n instanceof Literal && ((Literal) n).value() instanceof Long) {
            return (Long) ((Literal) n).value();
        }
        if (n instanceof Unary && "-".equals(((Unary) n).op())) {
            Long inner = longLiteral(((Unary) n).operand());
            return inner == null ? null : -inner;
        }
        return null;
    }
}
