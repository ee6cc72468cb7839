package com.autopar.core.tree;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Stages a rewrite against one version of a {@link SyntaxTree}: new nodes are allocated
 * past the end of the arena, existing slots may be replaced, and nothing is visible to
 * readers until {@link #commit()} validates the result and swaps it in.
 */
public final class TreeEditor {

    /**
     * Hook for {@link #copy(NodeId, Rewriter)}: returns the id to use in place of
     * {@code original}, or {@link NodeId#NONE} to copy it structurally.
     */
    @FunctionalInterface
    public interface Rewriter {
        NodeId rewrite(NodeId original, SyntaxNode node, TreeEditor editor);
    }

    private final SyntaxTree tree;
    private final SyntaxTree.Snapshot base;
    private final List<SyntaxNode> staged = new ArrayList<>();
    private final Map<NodeId, SyntaxNode> replacements = new HashMap<>();
    private boolean closed;

    public TreeEditor(SyntaxTree tree) {
        this.tree = tree;
        this.base = tree.snapshot();
    }

    /** Version of the tree this edit is based on. */
    public int baseVersion() {
        return base.version();
    }

    public NodeId allocate(SyntaxNode node) {
        ensureOpen();
        staged.add(node);
        return new NodeId(base.slots().size() + staged.size() - 1);
    }

    /** Reads through staged allocations and replacements. */
    public SyntaxNode node(NodeId id) {
        SyntaxNode replaced = replacements.get(id);
        if (replaced != null) return replaced;
        int baseSize = base.slots().size();
        return id.index() < baseSize ? base.slots().get(id.index()) : staged.get(id.index() - baseSize);
    }

    public void replace(NodeId id, SyntaxNode node) {
        ensureOpen();
        if (id.isNone() || id.index() >= base.slots().size() + staged.size()) {
            throw new IllegalArgumentException("No node " + id + " to replace");
        }
        replacements.put(id, node);
    }

    /**
     * Deep-copies the subtree rooted at {@code id} into fresh slots. The rewriter sees every
     * original node first and may substitute its own subtree for it.
     */
    public NodeId copy(NodeId id, Rewriter rewriter) {
        SyntaxNode original = node(id);
        NodeId substitute = rewriter.rewrite(id, original, this);
        if (substitute != null && substitute.isPresent()) {
            return substitute;
        }
        return allocate(SyntaxNodes.withChildren(original, child -> copy(child, rewriter)));
    }

    public NodeId copy(NodeId id) {
        return copy(id, (orig, node, editor) -> NodeId.NONE);
    }

    /**
     * Validates and publishes the staged rewrite.
     *
     * @return the new tree version
     * @throws MalformedTreeException if the rewritten tree breaks an invariant; the tree is unchanged
     * @throws IllegalStateException if the tree was committed by someone else in the meantime
     */
    public int commit() {
        ensureOpen();
        closed = true;
        List<SyntaxNode> next = new ArrayList<>(base.slots().size() + staged.size());
        next.addAll(base.slots());
        next.addAll(staged);
        for (Map.Entry<NodeId, SyntaxNode> e : replacements.entrySet()) {
            next.set(e.getKey().index(), e.getValue());
        }
        return tree.commit(base, next);
    }

    public void discard() {
        closed = true;
        staged.clear();
        replacements.clear();
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("Edit already committed or discarded");
        }
    }
}
