package com.autopar.core.dependence;

import com.autopar.core.symbols.Symbol;
import com.autopar.core.symbols.SymbolTable;
import com.autopar.core.tree.NodeId;
import com.autopar.core.tree.SyntaxNode;
import com.autopar.core.tree.SyntaxNode.Block;
import com.autopar.core.tree.SyntaxNode.ListExpr;
import com.autopar.core.tree.SyntaxNode.VarDecl;
import com.autopar.core.tree.SyntaxTree;

import java.util.List;

/** Recognizes the "declare an empty collection, then fill it in a loop" shape. */
public final class FreshCollections {

    private FreshCollections() {}

    /**
     * True when {@code target} is declared as an empty list literal in the same block as
     * {@code loop}, before it, and no statement in between mentions it.
     */
    public static boolean isFreshBefore(SymbolTable symbols, Symbol target, NodeId loop) {
        SyntaxTree tree = symbols.tree();
        NodeId decl = symbols.declarationOf(target);
        if (decl.isNone() || !tree.isReachable(decl)) return false;
        SyntaxNode declNode = tree.node(decl);
        if (!(declNode instanceof VarDecl)) return false;
        NodeId init = ((VarDecl) declNode).init();
        if (init.isNone() || !(tree.node(init) instanceof ListExpr)
                || !((ListExpr) tree.node(init)).elements().isEmpty()) {
            return false;
        }
        NodeId parent = tree.parentOf(loop);
        if (parent.isNone() || !parent.equals(tree.parentOf(decl))) return false;
        SyntaxNode parentNode = tree.node(parent);
        if (!(parentNode instanceof Block)) return false;
        List<NodeId> statements = ((Block) parentNode).statements();
        int from = statements.indexOf(decl);
        int to = statements.indexOf(loop);
        if (from < 0 || to < 0 || from >= to) return false;
        for (NodeId ref : symbols.referencesOf(target)) {
            for (int k = from + 1; k < to; k++) {
                NodeId stmt = statements.get(k);
                if (stmt.equals(ref) || tree.isAncestorOf(stmt, ref)) return false;
            }
        }
        return true;
    }
}
