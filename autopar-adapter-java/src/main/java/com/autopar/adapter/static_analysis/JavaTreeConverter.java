package com.autopar.adapter.static_analysis;

import com.autopar.core.symbols.Builtins;
import com.autopar.core.tree.IoMode;
import com.autopar.core.tree.LoopKind;
import com.autopar.core.tree.NodeId;
import com.autopar.core.tree.SyntaxNode;
import com.autopar.core.tree.SyntaxTree;
import com.autopar.core.tree.TreeBuilder;
import org.eclipse.jdt.core.dom.*;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Converts one JDT compilation unit into an analysis tree.
 *
 * Methods become functions and fields become program-level declarations. Counted
 * {@code for} loops of the shape {@code for (int i = a; i < b; i++)} become range loops,
 * enhanced {@code for} becomes a for-each loop, every other loop a while loop.
 * Anything without a counterpart becomes a call to {@code <unsupported:Kind>}, which the
 * analysis treats as an unknown call.
 */
public class JavaTreeConverter {

    private static final Map<String, String> COMPOUND_OPS = Map.of(
        "+=", "+", "-=", "-", "*=", "*", "/=", "/", "%=", "%", "&=", "&", "|=", "|");

    private static final Set<String> BINARY_OPS = Set.of(
        "==", "!=", "+", "-", "*", "/", "%", "<", "<=", ">", ">=", "&&", "||", "&", "|");

    private static final Set<String> LIST_TYPES = Set.of(
        "ArrayList", "LinkedList", "ArrayDeque", "Vector", "CopyOnWriteArrayList");

    private final CompilationUnit cu;
    private final String fileLabel;
    private final TreeBuilder b = new TreeBuilder();

    private final Set<String> variables = new HashSet<>();
    private final Set<String> catchVariables = new HashSet<>();
    private int unsupported;
    private int synthetic;

    public JavaTreeConverter(CompilationUnit cu, String fileLabel) {
        this.cu = cu;
        this.fileLabel = fileLabel;
    }

    /** Number of constructs replaced by {@code <unsupported:...>} calls in the last conversion. */
    public int unsupportedCount() {
        return unsupported;
    }

    /**
     * @param programName name of the resulting program node, usually the primary type
     */
    public SyntaxTree convert(String programName) {
        List<NodeId> members = new ArrayList<>();
        Set<String> fields = new HashSet<>();
        for (Object t : cu.types()) {
            if (t instanceof TypeDeclaration) {
                TypeDeclaration type = (TypeDeclaration) t;
                for (FieldDeclaration field : type.getFields()) {
                    for (Object f : field.fragments()) {
                        fields.add(((VariableDeclarationFragment) f).getName().getIdentifier());
                    }
                }
            }
        }

        for (Object t : cu.types()) {
            if (!(t instanceof TypeDeclaration)) {
                warn((ASTNode) t, "skipping " + ((AbstractTypeDeclaration) t).getName() + ": only classes are converted");
                continue;
            }
            for (Object d : ((TypeDeclaration) t).bodyDeclarations()) {
                if (d instanceof FieldDeclaration) {
                    members.addAll(field((FieldDeclaration) d));
                } else if (d instanceof MethodDeclaration) {
                    MethodDeclaration method = (MethodDeclaration) d;
                    if (method.getBody() == null || method.isConstructor()) continue;
                    variables.clear();
                    variables.addAll(fields);
                    catchVariables.clear();
                    members.add(method(method));
                } else if (d instanceof AbstractTypeDeclaration) {
                    warn((ASTNode) d, "skipping nested type " + ((AbstractTypeDeclaration) d).getName());
                }
            }
        }
        at(cu);
        return b.build(b.program(programName, members));
    }

    // --- Declarations ---

    private List<NodeId> field(FieldDeclaration field) {
        List<NodeId> out = new ArrayList<>();
        for (Object f : field.fragments()) {
            VariableDeclarationFragment fragment = (VariableDeclarationFragment) f;
            NodeId init = fragment.getInitializer() != null
                ? expr(fragment.getInitializer())
                : defaultValue(field.getType(), fragment);
            at(fragment);
            out.add(b.varDecl(fragment.getName().getIdentifier(), init));
        }
        return out;
    }

    private NodeId method(MethodDeclaration method) {
        List<String> params = new ArrayList<>();
        for (Object p : method.parameters()) {
            String name = ((SingleVariableDeclaration) p).getName().getIdentifier();
            params.add(name);
            variables.add(name);
        }
        NodeId body = block(method.getBody());
        at(method.getName());
        return b.function(method.getName().getIdentifier(), params, body);
    }

    /** Java's zero value for primitive fields; reference fields start out null. */
    private NodeId defaultValue(Type type, VariableDeclarationFragment fragment) {
        if (fragment.getExtraDimensions() > 0 || !type.isPrimitiveType()) return NodeId.NONE;
        PrimitiveType.Code code = ((PrimitiveType) type).getPrimitiveTypeCode();
        at(fragment);
        if (code == PrimitiveType.BOOLEAN) return b.literal(false);
        if (code == PrimitiveType.DOUBLE || code == PrimitiveType.FLOAT) return b.literal(0.0);
        if (code == PrimitiveType.CHAR) return b.literal("\0");
        return b.literal(0L);
    }

    // --- Statements ---

    private NodeId block(Statement statement) {
        List<NodeId> statements = new ArrayList<>();
        if (statement instanceof Block) {
            for (Object s : ((Block) statement).statements()) {
                statements.addAll(statement((Statement) s));
            }
        } else if (statement != null) {
            statements.addAll(statement(statement));
        }
        at(statement == null ? cu : statement);
        return b.block(statements);
    }

    private List<NodeId> statement(Statement s) {
        if (s instanceof Block) {
            return List.of(block(s));
        }
        if (s instanceof EmptyStatement) {
            return List.of();
        }
        if (s instanceof VariableDeclarationStatement) {
            VariableDeclarationStatement decl = (VariableDeclarationStatement) s;
            return declarations(decl.fragments());
        }
        if (s instanceof ExpressionStatement) {
            return List.of(expressionStatement(((ExpressionStatement) s).getExpression()));
        }
        if (s instanceof EnhancedForStatement) {
            return List.of(enhancedFor((EnhancedForStatement) s));
        }
        if (s instanceof ForStatement) {
            return List.of(forStatement((ForStatement) s));
        }
        if (s instanceof WhileStatement) {
            WhileStatement w = (WhileStatement) s;
            NodeId condition = expr(w.getExpression());
            NodeId body = block(w.getBody());
            at(s);
            return List.of(b.whileLoop(condition, body));
        }
        if (s instanceof DoStatement) {
            return List.of(doStatement((DoStatement) s));
        }
        if (s instanceof IfStatement) {
            return List.of(ifStatement((IfStatement) s));
        }
        if (s instanceof ReturnStatement) {
            Expression value = ((ReturnStatement) s).getExpression();
            NodeId v = value == null ? NodeId.NONE : expr(value);
            at(s);
            return List.of(b.ret(v));
        }
        if (s instanceof BreakStatement && ((BreakStatement) s).getLabel() == null) {
            at(s);
            return List.of(b.breakStmt());
        }
        if (s instanceof ContinueStatement && ((ContinueStatement) s).getLabel() == null) {
            at(s);
            return List.of(b.continueStmt());
        }
        if (s instanceof ThrowStatement) {
            NodeId value = thrown(((ThrowStatement) s).getExpression());
            at(s);
            return List.of(b.raise(value));
        }
        if (s instanceof TryStatement) {
            return List.of(tryStatement((TryStatement) s));
        }
        if (s instanceof SynchronizedStatement) {
            return List.of(block(((SynchronizedStatement) s).getBody()));
        }
        NodeId call = unsupportedCall(s, List.of());
        at(s);
        return List.of(b.exprStmt(call));
    }

    private List<NodeId> declarations(List<?> fragments) {
        List<NodeId> out = new ArrayList<>();
        for (Object f : fragments) {
            VariableDeclarationFragment fragment = (VariableDeclarationFragment) f;
            NodeId init = fragment.getInitializer() == null ? NodeId.NONE : expr(fragment.getInitializer());
            String name = fragment.getName().getIdentifier();
            variables.add(name);
            at(fragment);
            out.add(b.varDecl(name, init));
        }
        return out;
    }

    private NodeId expressionStatement(Expression e) {
        if (e instanceof Assignment) {
            Assignment a = (Assignment) e;
            String op = a.getOperator().toString();
            if (!op.equals("=") && !COMPOUND_OPS.containsKey(op)) {
                return unsupportedStatement(e, "Assignment" + op);
            }
            NodeId value = expr(a.getRightHandSide());
            NodeId target = assignTarget(a.getLeftHandSide());
            if (target == null) {
                return unsupportedStatement(e, "AssignTarget");
            }
            at(e);
            return b.add(new SyntaxNode.Assign(target, op.equals("=") ? null : COMPOUND_OPS.get(op), value, b.position()));
        }
        if (e instanceof PostfixExpression) {
            PostfixExpression p = (PostfixExpression) e;
            return increment(e, p.getOperand(), p.getOperator() == PostfixExpression.Operator.INCREMENT);
        }
        if (e instanceof PrefixExpression) {
            PrefixExpression p = (PrefixExpression) e;
            if (p.getOperator() == PrefixExpression.Operator.INCREMENT
                || p.getOperator() == PrefixExpression.Operator.DECREMENT) {
                return increment(e, p.getOperand(), p.getOperator() == PrefixExpression.Operator.INCREMENT);
            }
        }
        NodeId value = expr(e);
        at(e);
        return b.exprStmt(value);
    }

    private NodeId increment(Expression e, Expression operand, boolean up) {
        NodeId target = assignTarget(operand);
        if (target == null) {
            return unsupportedStatement(e, "Increment");
        }
        at(e);
        NodeId one = b.literal(1L);
        return b.add(new SyntaxNode.Assign(target, up ? "+" : "-", one, b.position()));
    }

    private NodeId assignTarget(Expression lhs) {
        if (lhs instanceof SimpleName) {
            at(lhs);
            return b.name(((SimpleName) lhs).getIdentifier());
        }
        if (lhs instanceof FieldAccess && ((FieldAccess) lhs).getExpression() instanceof ThisExpression) {
            at(lhs);
            return b.name(((FieldAccess) lhs).getName().getIdentifier());
        }
        if (lhs instanceof ArrayAccess) {
            ArrayAccess access = (ArrayAccess) lhs;
            NodeId array = expr(access.getArray());
            NodeId index = expr(access.getIndex());
            at(lhs);
            return b.index(array, index);
        }
        return null;
    }

    private NodeId enhancedFor(EnhancedForStatement s) {
        NodeId iterable = expr(s.getExpression());
        String variable = s.getParameter().getName().getIdentifier();
        variables.add(variable);
        NodeId body = block(s.getBody());
        at(s);
        return b.forEach(variable, iterable, body);
    }

    private NodeId forStatement(ForStatement s) {
        String variable = countedVariable(s);
        if (variable != null) {
            VariableDeclarationExpression init = (VariableDeclarationExpression) s.initializers().get(0);
            VariableDeclarationFragment fragment = (VariableDeclarationFragment) init.fragments().get(0);
            InfixExpression condition = (InfixExpression) s.getExpression();

            NodeId start = expr(fragment.getInitializer());
            NodeId end = expr(condition.getRightOperand());
            if (condition.getOperator() == InfixExpression.Operator.LESS_EQUALS) {
                at(condition);
                end = b.binary("+", end, b.literal(1L));
            }
            NodeId step = NodeId.NONE;
            Object updater = s.updaters().get(0);
            if (updater instanceof Assignment) {
                step = expr(((Assignment) updater).getRightHandSide());
            }
            variables.add(variable);
            NodeId body = block(s.getBody());
            at(s);
            NodeId range = b.range(start, end, step);
            return b.add(new SyntaxNode.Loop(LoopKind.FOR_RANGE, variable, range, body, b.position()));
        }
        return generalFor(s);
    }

    /**
     * The induction variable of {@code for (int v = a; v < b; v++)} (also {@code <=},
     * {@code ++v} and {@code v += k} with a positive literal {@code k}) when the body never
     * assigns it and cannot change the bound; null for any other shape.
     */
    private String countedVariable(ForStatement s) {
        if (s.initializers().size() != 1 || s.updaters().size() != 1) return null;
        if (!(s.initializers().get(0) instanceof VariableDeclarationExpression)) return null;
        VariableDeclarationExpression init = (VariableDeclarationExpression) s.initializers().get(0);
        if (init.fragments().size() != 1) return null;
        VariableDeclarationFragment fragment = (VariableDeclarationFragment) init.fragments().get(0);
        if (fragment.getInitializer() == null) return null;
        String v = fragment.getName().getIdentifier();

        if (!(s.getExpression() instanceof InfixExpression)) return null;
        InfixExpression condition = (InfixExpression) s.getExpression();
        if (condition.hasExtendedOperands()) return null;
        if (condition.getOperator() != InfixExpression.Operator.LESS
            && condition.getOperator() != InfixExpression.Operator.LESS_EQUALS) return null;
        if (!isName(condition.getLeftOperand(), v)) return null;

        Object updater = s.updaters().get(0);
        boolean stepOk;
        if (updater instanceof PostfixExpression) {
            PostfixExpression p = (PostfixExpression) updater;
            stepOk = p.getOperator() == PostfixExpression.Operator.INCREMENT && isName(p.getOperand(), v);
        } else if (updater instanceof PrefixExpression) {
            PrefixExpression p = (PrefixExpression) updater;
            stepOk = p.getOperator() == PrefixExpression.Operator.INCREMENT && isName(p.getOperand(), v);
        } else if (updater instanceof Assignment) {
            Assignment a = (Assignment) updater;
            stepOk = a.getOperator() == Assignment.Operator.PLUS_ASSIGN
                && isName(a.getLeftHandSide(), v)
                && a.getRightHandSide() instanceof NumberLiteral
                && parseNumber(((NumberLiteral) a.getRightHandSide()).getToken()) instanceof Long
                && (Long) parseNumber(((NumberLiteral) a.getRightHandSide()).getToken()) > 0;
        } else {
            stepOk = false;
        }
        if (!stepOk || assigns(s.getBody(), v)) return null;
        if (changesBound(s.getBody(), condition.getRightOperand())) return null;
        return v;
    }

    /**
     * {@code init; while (cond) { body; updaters }}. When the body continues, the updaters
     * run at the top of every iteration after the first instead.
     */
    private NodeId generalFor(ForStatement s) {
        List<NodeId> outer = new ArrayList<>();
        for (Object i : s.initializers()) {
            Expression init = (Expression) i;
            if (init instanceof VariableDeclarationExpression) {
                outer.addAll(declarations(((VariableDeclarationExpression) init).fragments()));
            } else {
                outer.add(expressionStatement(init));
            }
        }
        boolean continues = continues(s.getBody());
        String first = continues && !s.updaters().isEmpty() ? "$first" + synthetic++ : null;

        List<NodeId> body = new ArrayList<>();
        if (first != null) {
            List<NodeId> updates = new ArrayList<>();
            for (Object u : s.updaters()) updates.add(expressionStatement((Expression) u));
            at(s);
            NodeId notFirst = b.unary("!", b.name(first));
            body.add(b.ifThen(notFirst, b.block(updates)));
            body.add(b.assign(first, b.literal(false)));
            if (s.getExpression() != null) {
                NodeId cond = expr(s.getExpression());
                at(s);
                body.add(b.ifThen(b.unary("!", cond), b.block(b.breakStmt())));
            }
            body.add(block(s.getBody()));
        } else {
            body.add(block(s.getBody()));
            for (Object u : s.updaters()) body.add(expressionStatement((Expression) u));
        }

        NodeId condition;
        if (first != null || s.getExpression() == null) {
            at(s);
            condition = b.literal(true);
        } else {
            condition = expr(s.getExpression());
        }
        at(s);
        if (first != null) {
            outer.add(b.varDecl(first, b.literal(true)));
        }
        outer.add(b.whileLoop(condition, b.block(body)));
        return b.block(outer);
    }

    /** {@code first = true; while (first || cond) { first = false; body }}. */
    private NodeId doStatement(DoStatement s) {
        String first = "$first" + synthetic++;
        NodeId cond = expr(s.getExpression());
        at(s);
        NodeId clear = b.assign(first, b.literal(false));
        NodeId body = block(s.getBody());
        at(s);
        NodeId condition = b.binary("||", b.name(first), cond);
        NodeId loop = b.whileLoop(condition, b.block(clear, body));
        return b.block(b.varDecl(first, b.literal(true)), loop);
    }

    private NodeId ifStatement(IfStatement s) {
        NodeId condition = expr(s.getExpression());
        NodeId then = block(s.getThenStatement());
        if (s.getElseStatement() == null) {
            at(s);
            return b.ifThen(condition, then);
        }
        NodeId otherwise = s.getElseStatement() instanceof IfStatement
            ? ifStatement((IfStatement) s.getElseStatement())
            : block(s.getElseStatement());
        at(s);
        return b.ifThenElse(condition, then, otherwise);
    }

    /** Only the first handler is kept; the program raises a single error type. */
    private NodeId tryStatement(TryStatement s) {
        if (!s.resources().isEmpty() || s.getFinally() != null || s.catchClauses().isEmpty()) {
            return unsupportedStatement(s, "TryStatement");
        }
        NodeId body = block(s.getBody());
        CatchClause clause = (CatchClause) s.catchClauses().get(0);
        if (s.catchClauses().size() > 1) {
            warn(s, "only the first of " + s.catchClauses().size() + " catch clauses is kept");
        }
        String variable = clause.getException().getName().getIdentifier();
        catchVariables.add(variable);
        variables.add(variable);
        NodeId handler = block(clause.getBody());
        at(s);
        return b.tryCatch(body, variable, handler);
    }

    /** {@code throw new XException(msg)} raises {@code msg}; other throws raise the type name. */
    private NodeId thrown(Expression e) {
        if (e instanceof ClassInstanceCreation) {
            ClassInstanceCreation creation = (ClassInstanceCreation) e;
            if (creation.arguments().size() == 1) {
                return expr((Expression) creation.arguments().get(0));
            }
            at(e);
            return b.literal(simpleTypeName(creation.getType()));
        }
        return expr(e);
    }

    // --- Expressions ---

    private NodeId expr(Expression e) {
        if (e instanceof ParenthesizedExpression) {
            return expr(((ParenthesizedExpression) e).getExpression());
        }
        if (e instanceof CastExpression) {
            return expr(((CastExpression) e).getExpression());
        }
        if (e instanceof SimpleName) {
            at(e);
            return b.name(((SimpleName) e).getIdentifier());
        }
        if (e instanceof QualifiedName) {
            return qualifiedName((QualifiedName) e);
        }
        if (e instanceof FieldAccess) {
            FieldAccess access = (FieldAccess) e;
            if (access.getExpression() instanceof ThisExpression) {
                at(e);
                return b.name(access.getName().getIdentifier());
            }
            if (access.getName().getIdentifier().equals("length")) {
                NodeId receiver = expr(access.getExpression());
                at(e);
                return b.methodCall(receiver, "length");
            }
            return unsupportedCall(e, List.of(expr(access.getExpression())));
        }
        if (e instanceof NumberLiteral) {
            at(e);
            return b.literal(parseNumber(((NumberLiteral) e).getToken()));
        }
        if (e instanceof StringLiteral) {
            at(e);
            return b.literal(((StringLiteral) e).getLiteralValue());
        }
        if (e instanceof TextBlock) {
            at(e);
            return b.literal(((TextBlock) e).getLiteralValue());
        }
        if (e instanceof CharacterLiteral) {
            at(e);
            return b.literal(String.valueOf(((CharacterLiteral) e).charValue()));
        }
        if (e instanceof BooleanLiteral) {
            at(e);
            return b.literal(((BooleanLiteral) e).booleanValue());
        }
        if (e instanceof NullLiteral) {
            at(e);
            return b.literal(null);
        }
        if (e instanceof InfixExpression) {
            return infix((InfixExpression) e);
        }
        if (e instanceof PrefixExpression) {
            PrefixExpression p = (PrefixExpression) e;
            String op = p.getOperator().toString();
            NodeId operand = expr(p.getOperand());
            if (!op.equals("!") && !op.equals("-") && !op.equals("+")) {
                return unsupportedCall(e, List.of(operand));
            }
            at(e);
            return b.unary(op, operand);
        }
        if (e instanceof MethodInvocation) {
            return invocation((MethodInvocation) e);
        }
        if (e instanceof ClassInstanceCreation) {
            return creation((ClassInstanceCreation) e);
        }
        if (e instanceof ArrayCreation) {
            ArrayCreation creation = (ArrayCreation) e;
            if (creation.getInitializer() != null) {
                return expr(creation.getInitializer());
            }
            if (creation.dimensions().size() == 1) {
                NodeId size = expr((Expression) creation.dimensions().get(0));
                at(e);
                return b.call("newArray", size);
            }
            return unsupportedCall(e, List.of());
        }
        if (e instanceof ArrayInitializer) {
            List<NodeId> elements = exprs(((ArrayInitializer) e).expressions());
            at(e);
            return b.list(elements);
        }
        if (e instanceof ArrayAccess) {
            ArrayAccess access = (ArrayAccess) e;
            NodeId array = expr(access.getArray());
            NodeId index = expr(access.getIndex());
            at(e);
            return b.index(array, index);
        }
        if (e instanceof ConditionalExpression) {
            ConditionalExpression c = (ConditionalExpression) e;
            return unsupportedCall(e, List.of(expr(c.getExpression()), expr(c.getThenExpression()),
                expr(c.getElseExpression())));
        }
        return unsupportedCall(e, List.of());
    }

    private List<NodeId> exprs(List<?> expressions) {
        List<NodeId> out = new ArrayList<>(expressions.size());
        for (Object o : expressions) out.add(expr((Expression) o));
        return out;
    }

    private NodeId infix(InfixExpression e) {
        String op = e.getOperator().toString();
        List<NodeId> operands = new ArrayList<>();
        operands.add(expr(e.getLeftOperand()));
        operands.add(expr(e.getRightOperand()));
        operands.addAll(exprs(e.extendedOperands()));
        if (!BINARY_OPS.contains(op)) {
            return unsupportedCall(e, operands);
        }
        at(e);
        NodeId acc = operands.get(0);
        for (int i = 1; i < operands.size(); i++) {
            acc = b.binary(op, acc, operands.get(i));
        }
        return acc;
    }

    private NodeId qualifiedName(QualifiedName q) {
        String full = q.getFullyQualifiedName();
        if (full.equals("Math.PI")) {
            at(q);
            return b.literal(Math.PI);
        }
        if (full.equals("Math.E")) {
            at(q);
            return b.literal(Math.E);
        }
        Object limit = switch (full) {
            case "Integer.MAX_VALUE" -> (long) Integer.MAX_VALUE;
            case "Integer.MIN_VALUE" -> (long) Integer.MIN_VALUE;
            case "Long.MAX_VALUE" -> Long.MAX_VALUE;
            case "Long.MIN_VALUE" -> Long.MIN_VALUE;
            default -> null;
        };
        if (limit != null) {
            at(q);
            return b.literal(limit);
        }
        if (!isTypeName(q.getQualifier())) {
            NodeId receiver = expr(q.getQualifier());
            at(q);
            if (q.getName().getIdentifier().equals("length")) {
                return b.methodCall(receiver, "length");
            }
            return unsupportedCall(q, List.of(receiver));
        }
        return unsupportedCall(q, List.of());
    }

    private NodeId invocation(MethodInvocation m) {
        String name = m.getName().getIdentifier();
        Expression receiver = m.getExpression();

        if (receiver instanceof QualifiedName) {
            String qualifier = ((QualifiedName) receiver).getFullyQualifiedName();
            if ((qualifier.equals("System.out") || qualifier.equals("System.err"))
                && (name.equals("print") || name.equals("println") || name.equals("printf"))) {
                List<NodeId> args = exprs(m.arguments());
                at(m);
                return b.io(IoMode.WRITE, name, args.toArray(new NodeId[0]));
            }
        }
        if (receiver == null || receiver instanceof ThisExpression) {
            List<NodeId> args = exprs(m.arguments());
            at(m);
            return b.call(name, args.toArray(new NodeId[0]));
        }
        if (receiver instanceof Name && isTypeName((Name) receiver)) {
            return staticCall(m, typeName((Name) receiver), name);
        }
        if (receiver instanceof SimpleName && catchVariables.contains(((SimpleName) receiver).getIdentifier())
            && name.equals("getMessage") && m.arguments().isEmpty()) {
            at(m);
            return b.name(((SimpleName) receiver).getIdentifier());
        }
        NodeId target = expr(receiver);
        List<NodeId> args = exprs(m.arguments());
        at(m);
        return b.methodCall(target, name, args.toArray(new NodeId[0]));
    }

    private NodeId staticCall(MethodInvocation m, String type, String name) {
        List<?> arguments = m.arguments();
        if (type.equals("Files") && name.equals("readString") && arguments.size() == 1) {
            NodeId path = path((Expression) arguments.get(0));
            at(m);
            return b.io(IoMode.READ, "readString", path);
        }
        if (type.equals("Files") && name.equals("writeString") && arguments.size() >= 2) {
            NodeId path = path((Expression) arguments.get(0));
            NodeId content = expr((Expression) arguments.get(1));
            boolean append = false;
            for (int i = 2; i < arguments.size(); i++) {
                if (arguments.get(i).toString().endsWith("APPEND")) append = true;
            }
            at(m);
            return b.io(IoMode.WRITE, append ? "appendString" : "writeString", path, content);
        }
        if ((type.equals("List") && name.equals("of")) || (type.equals("Arrays") && name.equals("asList"))) {
            List<NodeId> elements = exprs(arguments);
            at(m);
            return b.list(elements);
        }
        List<NodeId> args = exprs(arguments);
        at(m);
        return b.call(type + "." + name, args.toArray(new NodeId[0]));
    }

    /** Unwraps {@code Path.of(a, b)} and {@code Paths.get(a, b)} into {@code a + "/" + b}. */
    private NodeId path(Expression e) {
        if (e instanceof MethodInvocation) {
            MethodInvocation m = (MethodInvocation) e;
            Expression receiver = m.getExpression();
            String owner = receiver instanceof Name ? typeName((Name) receiver) : "";
            String name = m.getName().getIdentifier();
            if (!m.arguments().isEmpty()
                && ((owner.equals("Path") && name.equals("of")) || (owner.equals("Paths") && name.equals("get")))) {
                List<NodeId> parts = exprs(m.arguments());
                at(e);
                NodeId acc = parts.get(0);
                for (int i = 1; i < parts.size(); i++) {
                    acc = b.binary("+", b.binary("+", acc, b.literal("/")), parts.get(i));
                }
                return acc;
            }
        }
        return expr(e);
    }

    private NodeId creation(ClassInstanceCreation c) {
        String type = simpleTypeName(c.getType());
        if (LIST_TYPES.contains(type) && c.getAnonymousClassDeclaration() == null) {
            if (c.arguments().isEmpty()) {
                at(c);
                return b.list();
            }
            if (c.arguments().size() == 1) {
                Expression arg = (Expression) c.arguments().get(0);
                ITypeBinding argType = arg.resolveTypeBinding();
                if (argType != null && argType.isPrimitive()) {
                    at(c);
                    return b.list();
                }
                // copy constructor: [] + source
                NodeId source = expr(arg);
                at(c);
                return b.binary("+", b.list(), source);
            }
        }
        return unsupportedCall(c, exprs(c.arguments()));
    }

    // --- Helpers ---

    private boolean isTypeName(Name name) {
        IBinding binding = name.resolveBinding();
        if (binding != null) {
            return binding instanceof ITypeBinding;
        }
        if (name instanceof SimpleName) {
            String id = ((SimpleName) name).getIdentifier();
            return !variables.contains(id) && Character.isUpperCase(id.charAt(0));
        }
        return isTypeName(((QualifiedName) name).getQualifier());
    }

    private static String typeName(Name name) {
        return name instanceof QualifiedName
            ? ((QualifiedName) name).getName().getIdentifier()
            : ((SimpleName) name).getIdentifier();
    }

    private static String simpleTypeName(Type type) {
        if (type instanceof ParameterizedType) {
            return simpleTypeName(((ParameterizedType) type).getType());
        }
        if (type instanceof SimpleType) {
            return typeName(((SimpleType) type).getName());
        }
        if (type instanceof QualifiedType) {
            return ((QualifiedType) type).getName().getIdentifier();
        }
        return type.toString();
    }

    private static boolean isName(Expression e, String identifier) {
        return e instanceof SimpleName && ((SimpleName) e).getIdentifier().equals(identifier);
    }

    /** Long for integral literals (with hex, octal, binary and underscores), Double otherwise. */
    public static Object parseNumber(String token) {
        String t = token.replace("_", "");
        String lower = t.toLowerCase();
        boolean hex = lower.startsWith("0x");
        if (!hex && (lower.contains(".") || lower.contains("e") || lower.endsWith("d") || lower.endsWith("f"))) {
            return Double.parseDouble(t);
        }
        if (lower.endsWith("l")) {
            t = t.substring(0, t.length() - 1);
            lower = lower.substring(0, lower.length() - 1);
        }
        if (lower.startsWith("0b")) {
            return Long.parseLong(t.substring(2), 2);
        }
        return Long.decode(t);
    }

    private static boolean assigns(Statement body, String variable) {
        boolean[] found = {false};
        body.accept(new ASTVisitor() {
            @Override
            public boolean visit(Assignment node) {
                if (isName(node.getLeftHandSide(), variable)) found[0] = true;
                return true;
            }

            @Override
            public boolean visit(PostfixExpression node) {
                if (isName(node.getOperand(), variable)) found[0] = true;
                return true;
            }

            @Override
            public boolean visit(PrefixExpression node) {
                if ((node.getOperator() == PrefixExpression.Operator.INCREMENT
                    || node.getOperator() == PrefixExpression.Operator.DECREMENT)
                    && isName(node.getOperand(), variable)) found[0] = true;
                return true;
            }
        });
        return found[0];
    }

    /**
     * Whether {@code body} assigns a name the bound reads, or calls anything but an accessor
     * on one. A range evaluates its end once, so such loops stay while loops.
     */
    private static boolean changesBound(Statement body, Expression bound) {
        Set<String> names = new HashSet<>();
        bound.accept(new ASTVisitor() {
            @Override
            public boolean visit(SimpleName node) {
                names.add(node.getIdentifier());
                return true;
            }
        });
        for (String name : names) {
            if (assigns(body, name)) return true;
        }
        boolean[] found = {false};
        body.accept(new ASTVisitor() {
            @Override
            public boolean visit(MethodInvocation node) {
                Expression receiver = node.getExpression();
                if (receiver instanceof SimpleName && names.contains(((SimpleName) receiver).getIdentifier())
                    && !Builtins.isAccessorMethod(node.getName().getIdentifier())) found[0] = true;
                return true;
            }
        });
        return found[0];
    }

    /** Whether {@code body} has an unlabeled continue that targets the enclosing loop. */
    private static boolean continues(Statement body) {
        boolean[] found = {false};
        body.accept(new ASTVisitor() {
            @Override
            public boolean visit(ContinueStatement node) {
                found[0] = true;
                return false;
            }

            @Override public boolean visit(ForStatement node) { return false; }
            @Override public boolean visit(EnhancedForStatement node) { return false; }
            @Override public boolean visit(WhileStatement node) { return false; }
            @Override public boolean visit(DoStatement node) { return false; }
            @Override public boolean visit(LambdaExpression node) { return false; }
            @Override public boolean visit(AnonymousClassDeclaration node) { return false; }
        });
        return found[0];
    }

    private NodeId unsupportedCall(ASTNode node, List<NodeId> args) {
        String kind = node.getClass().getSimpleName();
        warn(node, "unsupported " + kind + " treated as an unknown call");
        unsupported++;
        at(node);
        return b.call("<unsupported:" + kind + ">", args.toArray(new NodeId[0]));
    }

    private NodeId unsupportedStatement(ASTNode node, String kind) {
        warn(node, "unsupported " + kind + " treated as an unknown call");
        unsupported++;
        at(node);
        return b.exprStmt(b.call("<unsupported:" + kind + ">"));
    }

    private void at(ASTNode node) {
        int start = node.getStartPosition();
        int line = cu.getLineNumber(start);
        // recovered nodes have no position
        if (line < 1) {
            b.at(0, 0);
        } else {
            b.at(line, cu.getColumnNumber(start) + 1);
        }
    }

    private void warn(ASTNode node, String message) {
        int start = node.getStartPosition();
        System.err.println("[autopar] WARNING: " + fileLabel + ":" + cu.getLineNumber(start) + ": " + message);
    }
}
