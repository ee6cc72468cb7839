package com.autopar.core.effects;

import com.autopar.core.config.AnalysisConfig;
import com.autopar.core.symbols.Builtins;
import com.autopar.core.symbols.Callee;
import com.autopar.core.symbols.Symbol;
import com.autopar.core.symbols.SymbolTable;
import com.autopar.core.tree.NodeId;
import com.autopar.core.tree.NodeKind;
import com.autopar.core.tree.SyntaxNode;
import com.autopar.core.tree.SyntaxNode.*;
import com.autopar.core.tree.SyntaxTree;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Computes an {@link EffectSet} for every node in one post-order pass.
 *
 * Calls into functions of the analyzed program use the callee's summary, computed on first
 * use and memoized. Anything the analysis cannot see resolves to the most conservative
 * summary: reads and writes of {@link Symbol#ANY_UNKNOWN} plus the unknown-call flag.
 *
 * A container change through a variable is also a write of every {@link AliasMap alias}
 * of it. When the changed container is a parameter, the change is recorded by parameter
 * position and every call site writes whatever it passed in that position.
 *
 * The analyzer never throws for a well-formed tree.
 */
public final class EffectAnalyzer {

    static final EffectSet UNANALYZED = new EffectSet.Builder()
        .read(Symbol.ANY_UNKNOWN)
        .write(Symbol.ANY_UNKNOWN)
        .unknownCall("<unanalyzed>")
        .build();

    private final AnalysisConfig config;

    private SyntaxTree lastTree;
    private int lastVersion = -1;
    private EffectMap last;

    public EffectAnalyzer(AnalysisConfig config) {
        this.config = config;
    }

    /** Effects for the tree version {@code symbols} was built from; reused while the version is unchanged. */
    public synchronized EffectMap analyze(SymbolTable symbols) {
        if (last != null && lastTree == symbols.tree() && lastVersion == symbols.version()
                && last.symbols() == symbols) {
            return last;
        }
        EffectMap result = new Run(symbols).all();
        lastTree = symbols.tree();
        lastVersion = symbols.version();
        last = result;
        return result;
    }

    private final class Run {
        private final SymbolTable symbols;
        private final SyntaxTree tree;
        private final Map<NodeId, EffectSet> nodes = new HashMap<>();
        private final Map<NodeId, EffectSet> summaries = new HashMap<>();
        private final Map<NodeId, SortedSet<Integer>> mutatedParameters = new HashMap<>();
        private final Deque<NodeId> inProgress = new ArrayDeque<>();
        private final AliasMap aliases;

        Run(SymbolTable symbols) {
            this.symbols = symbols;
            this.tree = symbols.tree();
            this.aliases = AliasMap.build(symbols);
        }

        EffectMap all() {
            compute(tree.root(), NodeId.NONE);
            return new EffectMap(symbols, nodes, summaries, mutatedParameters, aliases);
        }

        private EffectSet compute(NodeId id, NodeId function) {
            EffectSet memo = nodes.get(id);
            if (memo != null) return memo;
            SyntaxNode node = tree.node(id);
            EffectSet result = switch (node.kind()) {
                case FUNCTION_DEF -> function(id, (FunctionDef) node);
                case NAME -> new EffectSet.Builder().read(symbols.referenceAt(id)).build();
                case LITERAL, BREAK, CONTINUE, UNIT_RESULT -> EffectSet.EMPTY;
                case VAR_DECL -> declaring(id, node, function);
                case LOOP, TRY, PARALLEL_TASK -> declaring(id, node, function);
                case ASSIGN -> assign((Assign) node, function);
                case CALL -> call(id, (Call) node, function);
                case IO -> children(node, function).io().build();
                case RAISE, INDEX -> children(node, function).raise().build();
                case BINARY -> {
                    String op = ((Binary) node).op();
                    EffectSet.Builder b = children(node, function);
                    yield ("/".equals(op) || "%".equals(op)) ? b.raise().build() : b.build();
                }
                case PROGRAM, BLOCK, IF, RETURN, EXPR_STMT, UNARY, LIST, RANGE, YIELD ->
                    children(node, function).build();
            };
            nodes.put(id, result);
            return result;
        }

        private EffectSet.Builder children(SyntaxNode node, NodeId function) {
            EffectSet.Builder b = new EffectSet.Builder();
            for (NodeId child : node.children()) {
                b.add(compute(child, function));
            }
            return b;
        }

        private EffectSet declaring(NodeId id, SyntaxNode node, NodeId function) {
            EffectSet.Builder b = children(node, function);
            symbols.declaredAt(id).ifPresent(b::write);
            return b.build();
        }

        private EffectSet function(NodeId id, FunctionDef def) {
            inProgress.push(id);
            EffectSet body;
            try {
                body = compute(def.body(), id);
            } finally {
                inProgress.pop();
            }
            summaries.put(id, summarize(body, id));
            return body;
        }

        /** Drops everything private to the function; what is left is visible to callers. */
        private EffectSet summarize(EffectSet body, NodeId function) {
            EffectSet.Builder b = new EffectSet.Builder();
            for (Symbol r : body.reads()) {
                if (!symbols.isDeclaredWithin(r, function)) b.read(r);
            }
            for (Symbol w : body.writes()) {
                if (symbols.isDeclaredWithin(w, function)) continue;
                if (body.appends().contains(w)) b.append(w);
                else b.write(w);
            }
            EffectSet flags = new EffectSet(null, null, null, body.callsUnknown(), body.hasIo(),
                body.mayRaise(), body.unknownCallees());
            return b.add(flags).build();
        }

        private EffectSet assign(Assign a, NodeId function) {
            EffectSet.Builder b = new EffectSet.Builder().add(compute(a.value(), function));
            b.add(target(a.target(), a.isCompound(), function));
            return b.build();
        }

        /** Effects of storing into {@code target}: a variable, or a slot of a container. */
        private EffectSet target(NodeId target, boolean alsoRead, NodeId function) {
            SyntaxNode node = tree.node(target);
            EffectSet.Builder b = new EffectSet.Builder();
            if (node instanceof Name) {
                Symbol s = symbols.referenceAt(target);
                b.write(s);
                if (alsoRead) b.read(s);
            } else if (node instanceof Index) {
                Index ix = (Index) node;
                b.add(compute(ix.index(), function)).raise();
                NodeId base = ix.target();
                while (tree.node(base) instanceof Index) {
                    Index inner = (Index) tree.node(base);
                    b.add(compute(inner.index(), function));
                    base = inner.target();
                }
                if (tree.kind(base) == NodeKind.NAME) {
                    Symbol s = symbols.referenceAt(base);
                    b.write(s);
                    if (alsoRead) b.read(s);
                    mutated(b, s);
                } else {
                    b.add(compute(base, function)).write(Symbol.ANY_UNKNOWN);
                }
            } else {
                b.add(compute(target, function)).write(Symbol.ANY_UNKNOWN);
            }
            EffectSet result = b.build();
            nodes.put(target, result);
            return result;
        }

        private EffectSet call(NodeId id, Call call, NodeId function) {
            Callee callee = symbols.resolveCallee(id);
            return switch (callee.kind()) {
                case PURE_BUILTIN -> children(call, function).build();
                case IO_BUILTIN -> children(call, function).io().build();
                case MODULE_FUNCTION -> {
                    EffectSet.Builder b = children(call, function);
                    b.add(calleeSummary(callee, function));
                    if (!callee.function().equals(function)) {
                        passedIn(b, call, callee.function());
                    }
                    yield b.build();
                }
                case METHOD -> method(id, call, function);
                case UNKNOWN -> isAllowListed(call)
                    ? children(call, function).build()
                    : unknown(call, function);
            };
        }

        private EffectSet calleeSummary(Callee callee, NodeId function) {
            NodeId target = callee.function();
            if (target.equals(function)) {
                return EffectSet.EMPTY;
            }
            EffectSet known = summaries.get(target);
            if (known != null) return known;
            if (inProgress.contains(target)) {
                // mutual recursion: the summary we would need is still being built
                return new EffectSet.Builder()
                    .read(Symbol.ANY_UNKNOWN)
                    .write(Symbol.ANY_UNKNOWN)
                    .unknownCall(callee.name())
                    .build();
            }
            compute(target, NodeId.NONE);
            return summaries.getOrDefault(target, UNANALYZED);
        }

        private EffectSet method(NodeId id, Call call, NodeId function) {
            String m = call.callee();
            NodeId receiver = call.receiver();
            boolean named = tree.kind(receiver) == NodeKind.NAME;
            if (Builtins.isAccessorMethod(m)) {
                return children(call, function).raise().build();
            }
            // an append whose result is used is an ordinary mutation
            boolean append = Builtins.isAppendMethod(m) && call.args().size() == 1
                && tree.parentOf(id).isPresent() && tree.kind(tree.parentOf(id)) == NodeKind.EXPR_STMT;
            if (!append && !Builtins.isMutatorMethod(m) && !Builtins.isAppendMethod(m)) {
                return isAllowListed(call) ? children(call, function).build() : unknown(call, function);
            }
            EffectSet.Builder b = new EffectSet.Builder();
            for (NodeId arg : call.args()) {
                b.add(compute(arg, function));
            }
            EffectSet.Builder self = new EffectSet.Builder();
            if (!named) {
                self.add(compute(receiver, function)).write(Symbol.ANY_UNKNOWN);
            } else {
                Symbol s = symbols.referenceAt(receiver);
                if (append) {
                    self.append(s);
                } else if (Builtins.isStoreMethod(m)) {
                    self.write(s);
                } else {
                    self.read(s).write(s);
                }
                mutated(self, s);
                nodes.put(receiver, self.build());
            }
            b.add(self.build());
            return append ? b.build() : b.raise().build();
        }

        /** A container change through {@code s}: plain writes of its aliases, noted for parameters. */
        private void mutated(EffectSet.Builder b, Symbol s) {
            for (Symbol alias : aliases.reachedFrom(s)) {
                if (!alias.equals(s)) b.write(alias);
                noteParameter(alias);
            }
        }

        /** Arguments in positions the callee changes are changed by the call. */
        private void passedIn(EffectSet.Builder b, Call call, NodeId callee) {
            for (int k : new TreeSet<>(mutatedParameters.getOrDefault(callee, new TreeSet<>()))) {
                if (k >= call.args().size()) continue;
                for (Symbol s : aliases.mutatedBy(call.args().get(k))) {
                    b.write(s);
                    noteParameter(s);
                }
            }
        }

        private void noteParameter(Symbol s) {
            NodeId owner = s.scopeOwner();
            if (owner.isNone() || tree.kind(owner) != NodeKind.FUNCTION_DEF) return;
            int position = tree.node(owner, FunctionDef.class).params().indexOf(s.name());
            if (position >= 0) {
                mutatedParameters.computeIfAbsent(owner, k -> new TreeSet<>()).add(position);
            }
        }

        private EffectSet unknown(Call call, NodeId function) {
            EffectSet args = children(call, function).build();
            return args.toBuilder()
                .writeAll(args.reads())
                .read(Symbol.ANY_UNKNOWN)
                .write(Symbol.ANY_UNKNOWN)
                .unknownCall(qualifiedName(call))
                .build();
        }

        private boolean isAllowListed(Call call) {
            return config.isAllowListed(call.callee()) || config.isAllowListed(qualifiedName(call));
        }

        private String qualifiedName(Call call) {
            if (call.hasReceiver() && tree.node(call.receiver()) instanceof Name) {
                return ((Name) tree.node(call.receiver())).identifier() + "." + call.callee();
            }
            return call.callee();
        }
    }
}
