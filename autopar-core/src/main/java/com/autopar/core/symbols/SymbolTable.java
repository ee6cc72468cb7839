package com.autopar.core.symbols;

import com.autopar.core.tree.NodeId;
import com.autopar.core.tree.SyntaxTree;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Resolution results for one version of a tree: scopes, the symbol behind every name
 * reference and declaration, and what every call site targets.
 */
public final class SymbolTable {

    private final SyntaxTree tree;
    private final int version;
    private final Scope programScope;
    private final Map<NodeId, Scope> scopes;
    private final Map<NodeId, Symbol> references;
    private final Map<NodeId, Symbol> declarations;
    private final Map<Symbol, NodeId> declarationSites;
    private final Map<Symbol, List<NodeId>> referenceSites;
    private final Map<String, List<NodeId>> functions;
    private final Map<NodeId, Callee> callees;

    SymbolTable(SyntaxTree tree,
                int version,
                Scope programScope,
                Map<NodeId, Scope> scopes,
                Map<NodeId, Symbol> references,
                Map<NodeId, Symbol> declarations,
                Map<Symbol, NodeId> declarationSites,
                Map<Symbol, List<NodeId>> referenceSites,
                Map<String, List<NodeId>> functions,
                Map<NodeId, Callee> callees) {
        this.tree = tree;
        this.version = version;
        this.programScope = programScope;
        this.scopes = scopes;
        this.references = references;
        this.declarations = declarations;
        this.declarationSites = declarationSites;
        this.referenceSites = referenceSites;
        this.functions = functions;
        this.callees = callees;
    }

    public SyntaxTree tree() {
        return tree;
    }

    /** Tree version this table was built from. */
    public int version() {
        return version;
    }

    public Scope programScope() {
        return programScope;
    }

    public Optional<Scope> scopeOf(NodeId owner) {
        return Optional.ofNullable(scopes.get(owner));
    }

    /** Symbol a {@code NAME} node refers to; unresolved names yield an {@link SymbolKind#UNKNOWN} symbol. */
    public Symbol referenceAt(NodeId nameId) {
        Symbol s = references.get(nameId);
        if (s == null) {
            throw new IllegalArgumentException("Node " + nameId + " is not a resolved name reference");
        }
        return s;
    }

    public Optional<Symbol> lookupReference(NodeId nameId) {
        return Optional.ofNullable(references.get(nameId));
    }

    /** Symbol introduced by a declaring node (variable declaration, loop, catch clause, parallel task). */
    public Optional<Symbol> declaredAt(NodeId node) {
        return Optional.ofNullable(declarations.get(node));
    }

    /** Declaring node of a symbol; parameters map to their function. */
    public NodeId declarationOf(Symbol symbol) {
        return declarationSites.getOrDefault(symbol, NodeId.NONE);
    }

    /** Every {@code NAME} node resolving to {@code symbol}, in tree order. */
    public List<NodeId> referencesOf(Symbol symbol) {
        return referenceSites.getOrDefault(symbol, List.of());
    }

    public Callee resolveCallee(NodeId callId) {
        Callee c = callees.get(callId);
        if (c == null) {
            throw new IllegalArgumentException("Node " + callId + " is not a resolved call");
        }
        return c;
    }

    /** Function definitions with the given name, in declaration order. */
    public List<NodeId> functions(String name) {
        return functions.getOrDefault(name, List.of());
    }

    /**
     * Classifies {@code symbol} from the point of view of a region: anything declared inside
     * the region keeps its declared kind, globals stay global, everything else is captured.
     */
    public SymbolKind kindWithin(Symbol symbol, NodeId region) {
        if (symbol.isUnknown()) return SymbolKind.UNKNOWN;
        if (isDeclaredWithin(symbol, region)) {
            return symbol.kind() == SymbolKind.CAPTURED ? SymbolKind.LOCAL : symbol.kind();
        }
        NodeId owner = symbol.scopeOwner();
        if (owner.equals(programScope.owner())) return SymbolKind.GLOBAL;
        return SymbolKind.CAPTURED;
    }

    public boolean isDeclaredWithin(Symbol symbol, NodeId region) {
        NodeId owner = symbol.scopeOwner();
        if (owner.isNone()) return false;
        return owner.equals(region) || tree.isAncestorOf(region, owner);
    }
}
