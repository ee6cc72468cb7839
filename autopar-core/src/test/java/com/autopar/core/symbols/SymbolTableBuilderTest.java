package com.autopar.core.symbols;

import com.autopar.core.Kernels;
import com.autopar.core.tree.NodeId;
import com.autopar.core.tree.NodeKind;
import com.autopar.core.tree.SyntaxTree;
import com.autopar.core.tree.TreeBuilder;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SymbolTableBuilderTest {

    @Test
    void classifiesLocalsAndParameters() {
        Kernels.Fixture f = Kernels.sumAll();
        SymbolTable table = SymbolTableBuilder.build(f.tree());

        Symbol total = table.referenceAt(Kernels.name(f.tree(), f.loop(), "total"));
        Symbol items = table.referenceAt(Kernels.name(f.tree(), f.loop(), "items"));
        Symbol item = table.referenceAt(Kernels.name(f.tree(), f.loop(), "item"));

        assertEquals(SymbolKind.LOCAL, total.kind());
        assertEquals(SymbolKind.PARAMETER, items.kind());
        assertEquals(f.loop(), item.scopeOwner(), "loop variable is declared by the loop");
    }

    @Test
    void regionRelativeKindTreatsOuterLocalsAsCaptured() {
        Kernels.Fixture f = Kernels.sumAll();
        SymbolTable table = SymbolTableBuilder.build(f.tree());
        Symbol total = table.referenceAt(Kernels.name(f.tree(), f.loop(), "total"));
        Symbol item = table.referenceAt(Kernels.name(f.tree(), f.loop(), "item"));

        assertEquals(SymbolKind.CAPTURED, table.kindWithin(total, f.loop()));
        assertEquals(SymbolKind.LOCAL, table.kindWithin(item, f.loop()));
    }

    @Test
    void programLevelDeclarationsAreGlobalEvenBeforeTheirPosition() {
        TreeBuilder b = new TreeBuilder();
        NodeId use = b.name("limit");
        NodeId fn = b.function("check", List.of(), b.block(b.ret(use)));
        NodeId decl = b.varDecl("limit", b.literal(10));
        SyntaxTree tree = b.build(b.program("m", fn, decl));

        SymbolTable table = SymbolTableBuilder.build(tree);
        assertEquals(SymbolKind.GLOBAL, table.referenceAt(use).kind());
        assertEquals(decl, table.declarationOf(table.referenceAt(use)));
    }

    @Test
    void unresolvedNamesAreUnknownNotErrors() {
        TreeBuilder b = new TreeBuilder();
        NodeId ghost = b.name("ghost");
        NodeId fn = b.function("haunt", List.of(), b.block(b.ret(ghost)));
        SymbolTable table = SymbolTableBuilder.build(b.build(b.program("m", fn)));

        Symbol s = table.referenceAt(ghost);
        assertTrue(s.isUnknown());
        assertEquals(SymbolKind.UNKNOWN, table.kindWithin(s, fn));
    }

    @Test
    void shadowingCreatesDistinctSymbol() {
        TreeBuilder b = new TreeBuilder();
        NodeId outerUse = b.name("x");
        NodeId innerUse = b.name("x");
        NodeId inner = b.block(b.varDecl("x", b.literal(2)), b.exprStmt(innerUse));
        NodeId fn = b.function("shadow", List.of(), b.block(
            b.varDecl("x", b.literal(1)),
            b.ifThen(b.literal(true), inner),
            b.exprStmt(outerUse)));
        SymbolTable table = SymbolTableBuilder.build(b.build(b.program("m", fn)));

        Symbol outer = table.referenceAt(outerUse);
        Symbol shadow = table.referenceAt(innerUse);
        assertNotEquals(outer, shadow);
        assertEquals(inner, shadow.scopeOwner());
    }

    @Test
    void namesFromEnclosingFunctionAreCaptured() {
        TreeBuilder b = new TreeBuilder();
        NodeId use = b.name("factor");
        NodeId helper = b.function("scale", List.of("v"), b.block(b.ret(b.binary("*", b.name("v"), use))));
        NodeId fn = b.function("outer", List.of("factor"), b.block(helper));
        SymbolTable table = SymbolTableBuilder.build(b.build(b.program("m", fn)));

        Symbol s = table.referenceAt(use);
        assertEquals(SymbolKind.CAPTURED, s.kind());
        assertEquals(fn, s.scopeOwner());
    }

    @Test
    void calleesResolveToFunctionsBuiltinsOrUnknown() {
        TreeBuilder b = new TreeBuilder();
        NodeId local = b.call("helper", b.literal(1));
        NodeId builtin = b.call("sqrt", b.literal(4));
        NodeId io = b.call("println", b.literal("hi"));
        NodeId mystery = b.call("mystery");
        NodeId method = b.methodCall(b.name("xs"), "size");
        NodeId helper = b.function("helper", List.of("a"), b.block(b.ret(b.name("a"))));
        NodeId main = b.function("main", List.of("xs"), b.block(
            b.exprStmt(local), b.exprStmt(builtin), b.exprStmt(io), b.exprStmt(mystery), b.exprStmt(method)));
        SymbolTable table = SymbolTableBuilder.build(b.build(b.program("m", helper, main)));

        assertEquals(new Callee(Callee.Kind.MODULE_FUNCTION, "helper", helper), table.resolveCallee(local));
        assertEquals(Callee.Kind.PURE_BUILTIN, table.resolveCallee(builtin).kind());
        assertEquals(Callee.Kind.IO_BUILTIN, table.resolveCallee(io).kind());
        assertEquals(Callee.Kind.UNKNOWN, table.resolveCallee(mystery).kind());
        assertEquals(Callee.Kind.METHOD, table.resolveCallee(method).kind());
    }

    @Test
    void overloadsAreResolvedByArity() {
        TreeBuilder b = new TreeBuilder();
        NodeId oneArg = b.call("area", b.literal(2));
        NodeId twoArgs = b.call("area", b.literal(2), b.literal(3));
        NodeId square = b.function("area", List.of("s"), b.block(b.ret(b.name("s"))));
        NodeId rect = b.function("area", List.of("w", "h"), b.block(b.ret(b.name("w"))));
        NodeId main = b.function("main", List.of(), b.block(b.exprStmt(oneArg), b.exprStmt(twoArgs)));
        SymbolTable table = SymbolTableBuilder.build(b.build(b.program("m", square, rect, main)));

        assertEquals(square, table.resolveCallee(oneArg).function());
        assertEquals(rect, table.resolveCallee(twoArgs).function());
    }

    @Test
    void singleFunctionBuildStillSeesGlobals() {
        Kernels.Fixture f = Kernels.countingFib();
        SymbolTable table = SymbolTableBuilder.build(f.tree(), f.function());
        NodeId calls = Kernels.name(f.tree(), f.function(), "calls");
        assertEquals(SymbolKind.GLOBAL, table.referenceAt(calls).kind());
        assertThrows(IllegalArgumentException.class,
            () -> SymbolTableBuilder.build(f.tree(), Kernels.first(f.tree(), f.function(), NodeKind.BLOCK)));
    }

    @Test
    void resolutionIsStableAcrossRuns() {
        Kernels.Fixture f = Kernels.temporary();
        NodeId t = Kernels.name(f.tree(), f.loop(), "t");
        assertEquals(SymbolTableBuilder.build(f.tree()).referenceAt(t),
            SymbolTableBuilder.build(f.tree()).referenceAt(t));
    }
}
