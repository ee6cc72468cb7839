package com.autopar.runtime;

import com.autopar.core.tree.CombineKind;
import com.autopar.core.tree.LoopKind;
import com.autopar.core.tree.NodeId;
import com.autopar.core.tree.NodeKind;
import com.autopar.core.tree.SourcePos;
import com.autopar.core.tree.SyntaxNode;
import com.autopar.core.tree.SyntaxNode.*;
import com.autopar.core.tree.SyntaxTree;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Executes a {@link SyntaxTree}, sequential or rewritten. {@code PARALLEL_TASK} nodes run
 * their work units on a {@link ParallelTaskExecutor} and combine the results in unit
 * order, so a rewritten tree is observably equivalent to the original.
 *
 * The interpreter keeps no per-call state outside {@link Frame}s, which lets work units
 * evaluate on worker threads while reading the frames they captured.
 */
public final class TreeInterpreter {

    private final SyntaxTree tree;
    private final ExecutionContext context;
    private final ParallelTaskExecutor executor;
    private final HostFunctions hosts;
    private Frame globals;

    public TreeInterpreter(SyntaxTree tree, ExecutionContext context, ParallelTaskExecutor executor,
                           HostFunctions hosts) {
        this.tree = tree;
        this.context = context;
        this.executor = executor;
        this.hosts = hosts;
    }

    public TreeInterpreter(SyntaxTree tree, ExecutionContext context, ParallelTaskExecutor executor) {
        this(tree, context, executor, HostFunctions.standard());
    }

    public ExecutionContext context() {
        return context;
    }

    /**
     * Runs the program's top level once: binds every top-level function, then executes
     * the remaining statements in order.
     */
    public synchronized void load() {
        if (globals != null) return;
        Frame frame = new Frame(null);
        SyntaxNode root = tree.node(tree.root());
        if (root instanceof Program) {
            List<NodeId> statements = ((Program) root).statements();
            for (NodeId id : statements) {
                if (tree.kind(id) == NodeKind.FUNCTION_DEF) bind(id, frame);
            }
            globals = frame;
            for (NodeId id : statements) {
                if (tree.kind(id) != NodeKind.FUNCTION_DEF) exec(id, frame);
            }
        } else if (root instanceof FunctionDef) {
            bind(tree.root(), frame);
            globals = frame;
        } else {
            globals = frame;
            exec(tree.root(), frame);
        }
    }

    /** Calls the module function {@code name} with {@code args}, loading the program first if needed. */
    public Object call(String name, List<Object> args) {
        load();
        String key = Closure.key(name, args.size());
        if (!globals.isBound(key)) {
            throw new ProgramException("Unknown function " + name + "/" + args.size(), SourcePos.UNKNOWN);
        }
        return invoke((Closure) globals.lookup(key), args, SourcePos.UNKNOWN);
    }

    public Object global(String name) {
        load();
        if (!globals.isBound(name)) {
            throw new ProgramException("Unknown global " + name, SourcePos.UNKNOWN);
        }
        return globals.lookup(name);
    }

    /** Top-level variables, sorted by name; functions are left out. */
    public Map<String, Object> globals() {
        load();
        Map<String, Object> out = new TreeMap<>();
        for (Map.Entry<String, Object> e : globals.bindings().entrySet()) {
            if (!(e.getValue() instanceof Closure)) out.put(e.getKey(), e.getValue());
        }
        return out;
    }

    // -----------------------------------------------------------------------
    // Statements
    // -----------------------------------------------------------------------

    private void exec(NodeId id, Frame frame) {
        SyntaxNode node = tree.node(id);
        switch (node.kind()) {
            case BLOCK -> {
                Frame inner = new Frame(frame);
                for (NodeId stmt : ((Block) node).statements()) {
                    exec(stmt, inner);
                }
            }
            case VAR_DECL -> {
                VarDecl v = (VarDecl) node;
                frame.declare(v.name(), v.init().isPresent() ? eval(v.init(), frame) : null);
            }
            case ASSIGN -> assign((Assign) node, frame);
            case LOOP -> loop((Loop) node, frame);
            case IF -> {
                If s = (If) node;
                if (Values.truthy(eval(s.condition(), frame))) {
                    exec(s.thenBranch(), frame);
                } else if (s.elseBranch().isPresent()) {
                    exec(s.elseBranch(), frame);
                }
            }
            case RETURN -> {
                NodeId value = ((Return) node).value();
                throw new ControlSignal.Return(value.isPresent() ? eval(value, frame) : null);
            }
            case BREAK -> throw new ControlSignal.Break();
            case CONTINUE -> throw new ControlSignal.Continue();
            case RAISE -> throw new ProgramException(eval(((Raise) node).value(), frame), node.pos());
            case TRY -> {
                Try t = (Try) node;
                try {
                    exec(t.body(), frame);
                } catch (ProgramException e) {
                    Frame handler = new Frame(frame);
                    if (t.catchVariable() != null) handler.declare(t.catchVariable(), e.value());
                    exec(t.handler(), handler);
                }
            }
            case EXPR_STMT -> eval(((ExprStmt) node).expr(), frame);
            case FUNCTION_DEF -> bind(id, frame);
            case YIELD -> {
                List<Object> sink = frame.yieldSink();
                if (sink == null) throw new ProgramException("yield outside a parallel task", node.pos());
                sink.add(eval(((Yield) node).value(), frame));
            }
            case PARALLEL_TASK -> parallel((ParallelTask) node, frame);
            default -> eval(id, frame);
        }
    }

    private void bind(NodeId id, Frame frame) {
        FunctionDef def = tree.node(id, FunctionDef.class);
        frame.declare(Closure.key(def.name(), def.params().size()),
            new Closure(id, def.name(), def.params().size(), frame));
    }

    private void assign(Assign a, Frame frame) {
        Object value = eval(a.value(), frame);
        SyntaxNode target = tree.node(a.target());
        if (target instanceof Name) {
            String name = ((Name) target).identifier();
            if (a.isCompound()) {
                value = Values.binary(a.op(), eval(a.target(), frame), value, a.pos());
            }
            frame.assign(name, value);
        } else if (target instanceof Index) {
            Index ix = (Index) target;
            Object container = eval(ix.target(), frame);
            Object key = eval(ix.index(), frame);
            List<Object> list = Values.list(container, a.pos());
            int k = Values.index(key, list.size(), a.pos());
            if (a.isCompound()) {
                value = Values.binary(a.op(), list.get(k), value, a.pos());
            }
            list.set(k, value);
        } else {
            throw new ProgramException("Cannot assign to " + target.kind(), a.pos());
        }
    }

    private void loop(Loop loop, Frame frame) {
        if (loop.loopKind() == LoopKind.WHILE) {
            while (Values.truthy(eval(loop.header(), frame))) {
                if (!iteration(loop.body(), new Frame(frame))) return;
            }
            return;
        }
        for (Object value : iterationValues(loop.loopKind(), loop.header(), frame, loop.pos())) {
            Frame f = new Frame(frame);
            f.declare(loop.variable(), value);
            if (!iteration(loop.body(), f)) return;
        }
    }

    /** Runs one iteration; false when it breaks out of the loop. */
    private boolean iteration(NodeId body, Frame frame) {
        try {
            exec(body, frame);
            return true;
        } catch (ControlSignal.Break b) {
            return false;
        } catch (ControlSignal.Continue c) {
            return true;
        }
    }

    private List<Object> iterationValues(LoopKind kind, NodeId header, Frame frame, SourcePos pos) {
        Object source = eval(header, frame);
        return kind == LoopKind.FOR_RANGE ? Values.list(source, pos) : Values.iterable(source, pos);
    }

    // -----------------------------------------------------------------------
    // Parallel tasks
    // -----------------------------------------------------------------------

    private Object parallel(ParallelTask task, Frame frame) {
        if (task.combine() == CombineKind.FORK_JOIN) {
            return forkJoin(task, frame);
        }
        List<Object> values = iterationValues(task.iteration(), task.source(), frame, task.pos());
        NodeId template = task.units().get(0);
        List<UnitOutcome<List<Object>>> outcomes = executor.execute(values.size(), task.maxWorkers(),
            (k, partial) -> {
                List<Object> sink = new ArrayList<>();
                partial.set(sink);
                Frame unit = Frame.unit(frame, sink);
                unit.declare(task.variable(), values.get(k));
                return runUnit(template, unit, sink);
            });

        List<Object> target = task.target() == null ? null : Values.list(frame.lookup(task.target()), task.pos());
        for (UnitOutcome<List<Object>> outcome : outcomes) {
            if (outcome.skipped()) continue;
            if (target != null && outcome.value() != null) {
                target.addAll(outcome.value());
            }
            if (outcome.isFailure()) throw outcome.failure();
        }
        return null;
    }

    private List<Object> runUnit(NodeId template, Frame unit, List<Object> sink) {
        try {
            exec(template, unit);
            return sink;
        } catch (ControlSignal.Continue c) {
            return sink;
        } catch (ControlSignal.Break b) {
            throw new ProgramException("break inside a parallel work unit", tree.node(template).pos());
        }
    }

    private Object forkJoin(ParallelTask task, Frame frame) {
        List<NodeId> units = task.units();
        List<UnitOutcome<Object>> outcomes = executor.execute(units.size(), task.maxWorkers(),
            (k, partial) -> eval(units.get(k), frame));
        Object[] results = new Object[units.size()];
        for (UnitOutcome<Object> outcome : outcomes) {
            if (outcome.skipped()) continue;
            if (outcome.isFailure()) throw outcome.failure();
            results[outcome.index()] = outcome.value();
        }
        return eval(task.join(), Frame.join(frame, results));
    }

    // -----------------------------------------------------------------------
    // Expressions
    // -----------------------------------------------------------------------

    private Object eval(NodeId id, Frame frame) {
        SyntaxNode node = tree.node(id);
        return switch (node.kind()) {
            case NAME -> {
                String name = ((Name) node).identifier();
                if (!frame.isBound(name)) throw new ProgramException("Unknown name " + name, node.pos());
                yield frame.lookup(name);
            }
            case LITERAL -> ((Literal) node).value();
            case BINARY -> binary((Binary) node, frame);
            case UNARY -> {
                Unary u = (Unary) node;
                yield Values.unary(u.op(), eval(u.operand(), frame), u.pos());
            }
            case CALL -> call((Call) node, frame);
            case INDEX -> {
                Index ix = (Index) node;
                Object container = eval(ix.target(), frame);
                Object key = eval(ix.index(), frame);
                if (container instanceof String) {
                    String s = (String) container;
                    yield String.valueOf(s.charAt(Values.index(key, s.length(), ix.pos())));
                }
                List<Object> list = Values.list(container, ix.pos());
                yield list.get(Values.index(key, list.size(), ix.pos()));
            }
            case LIST -> {
                List<Object> out = new ArrayList<>();
                for (NodeId e : ((ListExpr) node).elements()) out.add(eval(e, frame));
                yield out;
            }
            case RANGE -> {
                Range r = (Range) node;
                long start = Values.number(eval(r.start(), frame), r.pos()).longValue();
                long end = Values.number(eval(r.end(), frame), r.pos()).longValue();
                long step = r.step().isPresent() ? Values.number(eval(r.step(), frame), r.pos()).longValue() : 1L;
                yield Values.range(start, end, step, r.pos());
            }
            case IO -> io((IoOp) node, frame);
            case UNIT_RESULT -> {
                Object[] results = frame.unitResults();
                if (results == null) throw new ProgramException("unit result outside a join", node.pos());
                yield results[((UnitResult) node).unit()];
            }
            case PARALLEL_TASK -> parallel((ParallelTask) node, frame);
            default -> throw new ProgramException(node.kind() + " is not an expression", node.pos());
        };
    }

    private Object binary(Binary b, Frame frame) {
        if (b.op().equals("&&")) {
            return Values.truthy(eval(b.left(), frame)) && Values.truthy(eval(b.right(), frame));
        }
        if (b.op().equals("||")) {
            return Values.truthy(eval(b.left(), frame)) || Values.truthy(eval(b.right(), frame));
        }
        return Values.binary(b.op(), eval(b.left(), frame), eval(b.right(), frame), b.pos());
    }

    private Object call(Call c, Frame frame) {
        if (c.hasReceiver()) {
            Object receiver = eval(c.receiver(), frame);
            return Methods.invoke(receiver, c.callee(), evalAll(c.args(), frame), c.pos());
        }
        List<Object> args = evalAll(c.args(), frame);
        String key = Closure.key(c.callee(), args.size());
        if (frame.isBound(key)) {
            return invoke((Closure) frame.lookup(key), args, c.pos());
        }
        HostFunction host = hosts.lookup(c.callee())
            .orElseThrow(() -> new ProgramException("Unknown function " + c.callee(), c.pos()));
        return host.call(args, context, c.pos());
    }

    private List<Object> evalAll(List<NodeId> ids, Frame frame) {
        List<Object> out = new ArrayList<>(ids.size());
        for (NodeId id : ids) out.add(eval(id, frame));
        return out;
    }

    private Object invoke(Closure closure, List<Object> args, SourcePos pos) {
        FunctionDef def = tree.node(closure.definition(), FunctionDef.class);
        Frame f = new Frame(closure.scope());
        for (int k = 0; k < def.params().size(); k++) {
            f.declare(def.params().get(k), args.get(k));
        }
        try {
            exec(def.body(), f);
            return null;
        } catch (ControlSignal.Return r) {
            return r.value;
        } catch (ControlSignal.Break | ControlSignal.Continue s) {
            throw new ProgramException("break or continue outside a loop in " + def.name(), pos);
        }
    }

    private Object io(IoOp io, Frame frame) {
        List<Object> args = evalAll(io.args(), frame);
        SourcePos pos = io.pos();
        return switch (io.operation()) {
            case "print" -> {
                context.write(HostFunctions.joined(args));
                yield null;
            }
            case "println" -> {
                context.write(HostFunctions.joined(args) + "\n");
                yield null;
            }
            case "printf" -> {
                if (args.isEmpty()) throw new ProgramException("printf needs a format", pos);
                context.write(String.format(Values.display(args.get(0)), args.subList(1, args.size()).toArray()));
                yield null;
            }
            case "input", "readLine" -> context.readLine()
                .orElseThrow(() -> new ProgramException("End of input", pos));
            case "readString", "read" -> {
                String path = path(args, pos);
                yield context.readFile(path).orElseThrow(() -> new ProgramException("No such file: " + path, pos));
            }
            case "writeString", "write" -> {
                context.writeFile(path(args, pos), content(args));
                yield null;
            }
            case "appendString", "append" -> {
                context.appendFile(path(args, pos), content(args));
                yield null;
            }
            default -> throw new ProgramException("Unsupported I/O operation " + io.operation(), pos);
        };
    }

    private static String path(List<Object> args, SourcePos pos) {
        if (args.isEmpty()) throw new ProgramException("I/O operation needs a path", pos);
        return Values.display(args.get(0));
    }

    private static String content(List<Object> args) {
        return args.size() < 2 ? "" : HostFunctions.joined(args.subList(1, args.size()));
    }
}
