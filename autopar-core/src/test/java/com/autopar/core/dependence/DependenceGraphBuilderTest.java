package com.autopar.core.dependence;

import com.autopar.core.Kernels;
import com.autopar.core.config.AnalysisConfig;
import com.autopar.core.effects.EffectAnalyzer;
import com.autopar.core.effects.EffectMap;
import com.autopar.core.symbols.Symbol;
import com.autopar.core.symbols.SymbolTableBuilder;
import com.autopar.core.tree.NodeId;
import com.autopar.core.tree.SyntaxTree;
import com.autopar.core.tree.TreeBuilder;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class DependenceGraphBuilderTest {

    private static LoopDependenceGraph graph(SyntaxTree tree, NodeId loop) {
        EffectMap effects = new EffectAnalyzer(AnalysisConfig.defaults()).analyze(SymbolTableBuilder.build(tree));
        return DependenceGraphBuilder.build(effects, loop);
    }

    private static Set<String> names(Set<Symbol> symbols) {
        return symbols.stream().map(Symbol::name).collect(java.util.stream.Collectors.toSet());
    }

    @Test
    void runningSumCarriesFlowAndAntiEdges() {
        Kernels.Fixture f = Kernels.sumAll();
        LoopDependenceGraph g = graph(f.tree(), f.loop());

        assertTrue(g.hasCarriedDependence());
        assertEquals(Set.of(DependenceKind.FLOW, DependenceKind.ANTI),
            g.edges().stream().map(DependencyEdge::kind).collect(java.util.stream.Collectors.toSet()));
        DependencyEdge edge = g.edges().get(0);
        assertEquals("total", edge.symbol().name());
        assertEquals(IterationRef.current("item"), edge.from());
        assertEquals(IterationRef.current("item").next(), edge.to());
        assertEquals(Set.of("item"), names(g.loopPrivate()));
    }

    @Test
    void appendOnlyTargetIsBenign() {
        Kernels.Fixture f = Kernels.doubleAll();
        LoopDependenceGraph g = graph(f.tree(), f.loop());

        assertFalse(g.hasCarriedDependence());
        assertEquals(Set.of("out"), names(g.benignAccumulations()));
        assertEquals("out", g.accumulationTarget().orElseThrow().name());
        assertFalse(g.captures().stream().anyMatch(s -> s.name().equals("out")));
    }

    @Test
    void overwrittenScalarUsedAfterLoopGetsOutputEdge() {
        TreeBuilder b = new TreeBuilder();
        NodeId decl = b.varDecl("last", b.literal(0));
        NodeId loop = b.forEach("x", b.name("xs"), b.block(b.assign("last", b.name("x"))));
        NodeId fn = b.function("lastOf", List.of("xs"), b.block(decl, loop, b.ret(b.name("last"))));
        LoopDependenceGraph g = graph(b.build(b.program("m", fn)), loop);

        assertEquals(1, g.edges().size());
        assertEquals(DependenceKind.OUTPUT, g.edges().get(0).kind());
        assertEquals("OUTPUT last: x -> x+1", g.edges().get(0).toString());
    }

    @Test
    void appendThroughHelperParameterIsCarried() {
        TreeBuilder b = new TreeBuilder();
        NodeId bump = b.function("bump", List.of("xs", "v"), b.block(b.append("xs", b.name("v"))));
        NodeId decl = b.varDecl("acc", b.list());
        NodeId loop = b.forRange("i", b.literal(0), b.literal(20),
            b.block(b.exprStmt(b.call("bump", b.name("acc"), b.name("i")))));
        NodeId main = b.function("main", List.of(), b.block(decl, loop, b.ret(b.name("acc"))));
        LoopDependenceGraph g = graph(b.build(b.program("m", bump, main)), loop);

        assertTrue(g.hasCarriedDependence());
        assertTrue(g.edges().stream().anyMatch(e -> e.symbol().name().equals("acc")));
        assertTrue(g.benignAccumulations().isEmpty());
    }

    @Test
    void appendThroughLoopLocalAliasIsCarried() {
        TreeBuilder b = new TreeBuilder();
        NodeId decl = b.varDecl("acc", b.list());
        NodeId loop = b.forRange("i", b.literal(0), b.literal(20), b.block(
            b.varDecl("a", b.name("acc")),
            b.append("a", b.name("i"))));
        NodeId fn = b.function("collect", List.of(), b.block(decl, loop, b.ret(b.name("acc"))));
        LoopDependenceGraph g = graph(b.build(b.program("m", fn)), loop);

        assertTrue(g.hasCarriedDependence());
        assertTrue(g.edges().stream().anyMatch(e -> e.symbol().name().equals("acc")));
    }

    @Test
    void changingTheElementsOfTheSequenceIsCarried() {
        TreeBuilder b = new TreeBuilder();
        NodeId loop = b.forEach("row", b.name("rows"), b.block(b.append("row", b.literal(1))));
        NodeId fn = b.function("pad", List.of("rows"), b.block(loop));
        LoopDependenceGraph g = graph(b.build(b.program("m", fn)), loop);

        assertTrue(g.hasCarriedDependence());
        assertEquals(Set.of("rows"), names(g.edges().stream().map(DependencyEdge::symbol)
            .collect(java.util.stream.Collectors.toSet())));
    }

    @Test
    void aliasTakenAfterTheLoopKeepsAppendBenign() {
        TreeBuilder b = new TreeBuilder();
        NodeId decl = b.varDecl("out", b.list());
        NodeId loop = b.forEach("x", b.name("xs"), b.block(b.append("out", b.name("x"))));
        NodeId copy = b.varDecl("result", b.name("out"));
        NodeId fn = b.function("copyAll", List.of("xs"), b.block(decl, loop, copy, b.ret(b.name("result"))));
        LoopDependenceGraph g = graph(b.build(b.program("m", fn)), loop);

        assertFalse(g.hasCarriedDependence());
        assertEquals(Set.of("out"), names(g.benignAccumulations()));
    }

    @Test
    void storeAtInductionSlotIsDisjoint() {
        Kernels.Fixture f = Kernels.squares();
        LoopDependenceGraph g = graph(f.tree(), f.loop());

        assertFalse(g.hasCarriedDependence());
        assertEquals(Set.of("arr"), names(g.disjointStores()));
        assertTrue(g.benignAccumulations().isEmpty());
    }

    @Test
    void readOfNeighbouringSlotIsCarried() {
        Kernels.Fixture f = Kernels.prefix();
        LoopDependenceGraph g = graph(f.tree(), f.loop());

        assertTrue(g.disjointStores().isEmpty());
        assertTrue(g.edges().stream().anyMatch(e -> e.kind() == DependenceKind.FLOW && e.symbol().name().equals("a")));
        assertTrue(names(g.captures()).contains("a"));
    }

    @Test
    void temporaryRedefinedEveryIterationIsPrivatized() {
        Kernels.Fixture f = Kernels.temporary();
        LoopDependenceGraph g = graph(f.tree(), f.loop());

        assertFalse(g.hasCarriedDependence());
        assertEquals(Set.of("t"), names(g.privatizedTemporaries()));
        assertEquals(Set.of("out"), names(g.benignAccumulations()));
    }

    @Test
    void twoAppendTargetsAreNotBothBenign() {
        TreeBuilder b = new TreeBuilder();
        NodeId evens = b.varDecl("evens", b.list());
        NodeId odds = b.varDecl("odds", b.list());
        NodeId loop = b.forEach("x", b.name("xs"), b.block(b.append("evens", b.name("x")), b.append("odds", b.name("x"))));
        NodeId fn = b.function("split", List.of("xs"), b.block(evens, odds, loop));
        LoopDependenceGraph g = graph(b.build(b.program("m", fn)), loop);

        assertTrue(g.benignAccumulations().isEmpty());
        assertTrue(g.edges().stream().allMatch(e -> e.kind() == DependenceKind.OUTPUT));
        assertEquals(Set.of("evens", "odds"),
            g.edges().stream().map(e -> e.symbol().name()).collect(java.util.stream.Collectors.toSet()));
    }

    @Test
    void appendTargetThatIsAlsoReadIsCarried() {
        TreeBuilder b = new TreeBuilder();
        NodeId seen = b.varDecl("seen", b.list());
        NodeId loop = b.forEach("x", b.name("xs"), b.block(
            b.ifThen(b.unary("!", b.methodCall(b.name("seen"), "contains", b.name("x"))),
                b.block(b.append("seen", b.name("x"))))));
        NodeId fn = b.function("distinct", List.of("xs"), b.block(seen, loop, b.ret(b.name("seen"))));
        LoopDependenceGraph g = graph(b.build(b.program("m", fn)), loop);

        assertTrue(g.benignAccumulations().isEmpty());
        assertTrue(g.edges().stream().anyMatch(e -> e.kind() == DependenceKind.FLOW));
    }

    @Test
    void unknownCallIsReportedNotExcused() {
        Kernels.Fixture f = Kernels.callsUnknown();
        LoopDependenceGraph g = graph(f.tree(), f.loop());

        assertTrue(g.callsUnknown());
        assertEquals(Set.of("mystery"), g.unknownCallees());
        assertFalse(g.unknownSymbolWrites().isEmpty());
    }

    @Test
    void freshCollectionRequiresEmptyListJustBeforeLoop() {
        Kernels.Fixture f = Kernels.doubleAll();
        EffectMap effects = new EffectAnalyzer(AnalysisConfig.defaults()).analyze(SymbolTableBuilder.build(f.tree()));
        Symbol out = effects.symbols().referenceAt(Kernels.name(f.tree(), f.loop(), "out"));
        assertTrue(FreshCollections.isFreshBefore(effects.symbols(), out, f.loop()));

        TreeBuilder b = new TreeBuilder();
        NodeId decl = b.varDecl("out", b.list(b.literal(0)));
        NodeId loop = b.forEach("x", b.name("xs"), b.block(b.append("out", b.name("x"))));
        NodeId fn = b.function("prepend", List.of("xs"), b.block(decl, loop, b.ret(b.name("out"))));
        SyntaxTree tree = b.build(b.program("m", fn));
        EffectMap seeded = new EffectAnalyzer(AnalysisConfig.defaults()).analyze(SymbolTableBuilder.build(tree));
        Symbol target = seeded.symbols().referenceAt(Kernels.name(tree, loop, "out"));
        assertFalse(FreshCollections.isFreshBefore(seeded.symbols(), target, loop));
    }
}
