package com.autopar.core.tree;

import com.autopar.core.Kernels;
import com.autopar.core.tree.SyntaxNode.*;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SyntaxTreeTest {

    @Test
    void parentsAreRecordedForEveryReachableNode() {
        Kernels.Fixture f = Kernels.doubleAll();
        SyntaxTree tree = f.tree();
        assertEquals(NodeId.NONE, tree.parentOf(tree.root()));
        assertEquals(f.function(), tree.parentOf(tree.node(f.function(), FunctionDef.class).body()));
        for (NodeId id : tree.preorder(tree.root())) {
            if (!id.equals(tree.root())) {
                assertTrue(tree.parentOf(id).isPresent(), "orphan " + id);
            }
        }
    }

    @Test
    void enclosingFindsNearestAncestorOfKind() {
        Kernels.Fixture f = Kernels.nested();
        List<NodeId> loops = Kernels.loops(f.tree(), f.function());
        NodeId x = Kernels.name(f.tree(), loops.get(1), "x");
        assertEquals(loops.get(1), f.tree().enclosing(x, NodeKind.LOOP).orElseThrow());
        assertEquals(loops.get(0), f.tree().enclosing(loops.get(1), NodeKind.LOOP).orElseThrow());
        assertTrue(f.tree().isAncestorOf(f.function(), x));
        assertFalse(f.tree().isAncestorOf(x, f.function()));
    }

    @Test
    void fingerprintIgnoresSlotNumbersAndPositions() {
        TreeBuilder b = new TreeBuilder();
        NodeId first = b.binary("+", b.name("a"), b.literal(1));
        b.at(9, 9);
        NodeId second = b.binary("+", b.name("a"), b.literal(1));
        NodeId third = b.binary("+", b.name("a"), b.literal(2));
        SyntaxTree tree = b.build(b.block(b.exprStmt(first), b.exprStmt(second), b.exprStmt(third)));
        assertEquals(tree.fingerprint(first), tree.fingerprint(second));
        assertNotEquals(tree.fingerprint(first), tree.fingerprint(third));
    }

    @Test
    void integerLiteralsAreWidenedToLong() {
        TreeBuilder b = new TreeBuilder();
        NodeId lit = b.literal(7);
        SyntaxTree tree = b.build(b.block(b.exprStmt(lit)));
        assertEquals(7L, tree.node(lit, Literal.class).value());
    }

    @Test
    void sharedChildIsMalformed() {
        TreeBuilder b = new TreeBuilder();
        NodeId shared = b.name("x");
        NodeId sum = b.binary("+", shared, shared);
        MalformedTreeException e = assertThrows(MalformedTreeException.class,
            () -> b.build(b.block(b.exprStmt(sum))));
        assertTrue(e.getMessage().contains("two parents"), e.getMessage());
    }

    @Test
    void rangeLoopNeedsRangeHeader() {
        TreeBuilder b = new TreeBuilder();
        NodeId loop = b.add(new Loop(LoopKind.FOR_RANGE, "i", b.name("xs"), b.block(), SourcePos.UNKNOWN));
        assertThrows(MalformedTreeException.class, () -> b.build(b.block(loop)));
    }

    @Test
    void foreignNodeTypeIsMalformed() {
        TreeBuilder b = new TreeBuilder();
        NodeId foreign = b.add(new SyntaxNode() {
            public NodeKind kind() { return NodeKind.LOOP; }
            public SourcePos pos() { return SourcePos.UNKNOWN; }
            public List<NodeId> children() { return List.of(); }
        });
        MalformedTreeException e = assertThrows(MalformedTreeException.class,
            () -> b.build(b.block(foreign)));
        assertTrue(e.getMessage().contains("not one of the node records"), e.getMessage());
    }

    @Test
    void programMustBeTheRoot() {
        TreeBuilder b = new TreeBuilder();
        NodeId inner = b.program("inner");
        assertThrows(MalformedTreeException.class, () -> b.build(b.block(inner)));
    }

    @Test
    void missingChildIsMalformed() {
        TreeBuilder b = new TreeBuilder();
        NodeId stmt = b.exprStmt(new NodeId(42));
        assertThrows(MalformedTreeException.class, () -> b.build(b.block(stmt)));
    }

    @Test
    void editorCommitSwapsInNewVersion() {
        Kernels.Fixture f = Kernels.doubleAll();
        SyntaxTree tree = f.tree();
        NodeId ret = Kernels.first(tree, f.function(), NodeKind.RETURN);
        NodeId oldValue = tree.node(ret, Return.class).value();

        TreeEditor editor = new TreeEditor(tree);
        NodeId literal = editor.allocate(new Literal(0L, SourcePos.UNKNOWN));
        editor.replace(ret, new Return(literal, SourcePos.UNKNOWN));
        assertEquals(0, tree.version(), "staged edits are invisible");
        assertEquals(1, editor.commit());

        assertEquals(1, tree.version());
        assertEquals(literal, tree.node(ret, Return.class).value());
        assertFalse(tree.isReachable(oldValue));
    }

    @Test
    void malformedCommitLeavesTreeUntouched() {
        Kernels.Fixture f = Kernels.doubleAll();
        SyntaxTree tree = f.tree();
        long before = tree.fingerprint(tree.root());
        NodeId ret = Kernels.first(tree, f.function(), NodeKind.RETURN);
        NodeId alreadyUsed = Kernels.name(tree, f.loop(), "x");

        TreeEditor editor = new TreeEditor(tree);
        editor.replace(ret, new Return(alreadyUsed, SourcePos.UNKNOWN));
        assertThrows(MalformedTreeException.class, editor::commit);

        assertEquals(0, tree.version());
        assertEquals(before, tree.fingerprint(tree.root()));
    }

    @Test
    void staleEditorCannotCommit() {
        Kernels.Fixture f = Kernels.doubleAll();
        SyntaxTree tree = f.tree();
        NodeId ret = Kernels.first(tree, f.function(), NodeKind.RETURN);

        TreeEditor first = new TreeEditor(tree);
        TreeEditor second = new TreeEditor(tree);
        first.replace(ret, new Return(first.allocate(new Literal(1L, SourcePos.UNKNOWN)), SourcePos.UNKNOWN));
        first.commit();
        second.replace(ret, new Return(second.allocate(new Literal(2L, SourcePos.UNKNOWN)), SourcePos.UNKNOWN));
        assertThrows(IllegalStateException.class, second::commit);
        assertEquals(1, tree.version());
    }

    @Test
    void discardedEditorRejectsFurtherWork() {
        Kernels.Fixture f = Kernels.doubleAll();
        TreeEditor editor = new TreeEditor(f.tree());
        editor.discard();
        assertThrows(IllegalStateException.class,
            () -> editor.allocate(new Literal(1L, SourcePos.UNKNOWN)));
        assertEquals(0, f.tree().version());
    }

    @Test
    void copyProducesStructurallyEqualSubtree() {
        Kernels.Fixture f = Kernels.doubleAll();
        SyntaxTree tree = f.tree();
        NodeId body = tree.node(f.loop(), Loop.class).body();
        NodeId ret = Kernels.first(tree, f.function(), NodeKind.RETURN);

        TreeEditor editor = new TreeEditor(tree);
        NodeId copy = editor.copy(body);
        // park the copy where the return used to be
        editor.replace(ret, new If(editor.allocate(new Literal(true, SourcePos.UNKNOWN)), copy, NodeId.NONE,
            SourcePos.UNKNOWN));
        editor.commit();

        assertNotEquals(body, copy);
        assertEquals(tree.fingerprint(body), tree.fingerprint(copy));
        assertTrue(tree.isReachable(copy));
    }
}
