package com.autopar.core.tree;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

/**
 * Arena of {@link SyntaxNode}s addressed by {@link NodeId}.
 *
 * The tree is an immutable snapshot between commits. A {@link TreeEditor} builds the next
 * snapshot off to the side and swaps it in with a single reference assignment, so readers
 * never observe a half-applied rewrite and an abandoned edit leaves nothing behind.
 */
public final class SyntaxTree {

    /** One immutable version of the arena. */
    record Snapshot(List<SyntaxNode> slots, NodeId root, int[] parents, int version) {}

    private volatile Snapshot snapshot;

    SyntaxTree(List<SyntaxNode> slots, NodeId root) {
        List<SyntaxNode> copy = List.copyOf(slots);
        this.snapshot = new Snapshot(copy, root, TreeValidator.validate(copy, root), 0);
    }

    Snapshot snapshot() {
        return snapshot;
    }

    /** Swaps in the next version; {@code expected} must still be current. */
    synchronized int commit(Snapshot expected, List<SyntaxNode> slots) {
        if (snapshot != expected) {
            throw new IllegalStateException("Tree changed since the edit began (version "
                + expected.version() + " -> " + snapshot.version() + ")");
        }
        List<SyntaxNode> copy = List.copyOf(slots);
        int[] parents = TreeValidator.validate(copy, expected.root());
        snapshot = new Snapshot(copy, expected.root(), parents, expected.version() + 1);
        return snapshot.version();
    }

    public NodeId root() {
        return snapshot.root();
    }

    /** Incremented on every committed rewrite. */
    public int version() {
        return snapshot.version();
    }

    /** Number of slots, reachable or not. */
    public int size() {
        return snapshot.slots().size();
    }

    public SyntaxNode node(NodeId id) {
        Snapshot s = snapshot;
        if (id == null || id.isNone() || id.index() >= s.slots().size()) {
            throw new IllegalArgumentException("No node " + id);
        }
        return s.slots().get(id.index());
    }

    public <T extends SyntaxNode> T node(NodeId id, Class<T> type) {
        SyntaxNode n = node(id);
        if (!type.isInstance(n)) {
            throw new IllegalArgumentException("Node " + id + " is a " + n.kind() + ", not " + type.getSimpleName());
        }
        return type.cast(n);
    }

    public NodeKind kind(NodeId id) {
        return node(id).kind();
    }

    /** Parent of a reachable node, or {@link NodeId#NONE} for the root and detached slots. */
    public NodeId parentOf(NodeId id) {
        int p = snapshot.parents()[id.index()];
        return p < 0 ? NodeId.NONE : new NodeId(p);
    }

    public boolean isReachable(NodeId id) {
        Snapshot s = snapshot;
        return id.isPresent() && id.index() < s.slots().size()
            && (id.equals(s.root()) || s.parents()[id.index()] >= 0);
    }

    /** Nearest proper ancestor of the given kind. */
    public Optional<NodeId> enclosing(NodeId id, NodeKind kind) {
        NodeId cur = parentOf(id);
        while (cur.isPresent()) {
            if (kind(cur) == kind) return Optional.of(cur);
            cur = parentOf(cur);
        }
        return Optional.empty();
    }

    public boolean isAncestorOf(NodeId ancestor, NodeId id) {
        NodeId cur = parentOf(id);
        while (cur.isPresent()) {
            if (cur.equals(ancestor)) return true;
            cur = parentOf(cur);
        }
        return false;
    }

    /** Pre-order walk of the subtree rooted at {@code from}, children in evaluation order. */
    public List<NodeId> preorder(NodeId from) {
        List<NodeId> out = new ArrayList<>();
        Deque<NodeId> work = new ArrayDeque<>();
        work.push(from);
        while (!work.isEmpty()) {
            NodeId id = work.pop();
            out.add(id);
            List<NodeId> children = node(id).children();
            for (int i = children.size() - 1; i >= 0; i--) {
                work.push(children.get(i));
            }
        }
        return out;
    }

    /**
     * Structural hash of a subtree: node kinds and attributes, ignoring slot numbers and
     * source positions. Equal subtrees copied elsewhere in the arena hash equally.
     */
    public long fingerprint(NodeId id) {
        SyntaxNode n = node(id);
        long h = n.kind().ordinal() + 1;
        h = h * 1_000_003L + SyntaxNodes.attributes(n).hashCode();
        for (NodeId child : n.children()) {
            h = h * 31 + fingerprint(child);
        }
        return h;
    }
}
