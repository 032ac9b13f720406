package com.vidnyan.cpg.domain.dfg;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * SSA data-flow graph of one function: versions, definitions, uses, flow edges, phi nodes and scopes.
 * Immutable and thread-safe.
 */
public final class DataFlowGraph {

    private final String functionId;
    private final String rootScopeId;
    private final Map<String, VariableVersion> variables;
    private final Map<String, Definition> definitions;
    private final Map<String, Use> uses;
    private final List<DataFlowEdge> edges;
    private final List<PhiNode> phiNodes;
    private final Map<String, Scope> scopes;
    private final List<Diagnostic> diagnostics;
    private final Map<String, Definition> definitionByVersion;
    private final Map<String, List<Use>> usesByDefinition;

    public DataFlowGraph(String functionId, String rootScopeId, List<VariableVersion> variables,
                         List<Definition> definitions, List<Use> uses, List<DataFlowEdge> edges,
                         List<PhiNode> phiNodes, List<Scope> scopes, List<Diagnostic> diagnostics) {
        this.functionId = functionId;
        this.rootScopeId = rootScopeId;
        this.variables = index(variables, VariableVersion::key);
        this.definitions = index(definitions, Definition::id);
        this.uses = index(uses, Use::id);
        this.edges = List.copyOf(edges);
        this.phiNodes = List.copyOf(phiNodes);
        this.scopes = index(scopes, Scope::id);
        this.diagnostics = List.copyOf(diagnostics);

        Map<String, Definition> byVersion = new HashMap<>();
        definitions.forEach(d -> byVersion.put(d.variable().key(), d));
        this.definitionByVersion = Collections.unmodifiableMap(byVersion);

        Map<String, List<Use>> byDefinition = new HashMap<>();
        uses.forEach(u -> byDefinition.computeIfAbsent(u.reachingDefinition(), k -> new ArrayList<>()).add(u));
        this.usesByDefinition = Collections.unmodifiableMap(byDefinition);
    }

    private static <T> Map<String, T> index(List<T> items, java.util.function.Function<T, String> key) {
        Map<String, T> map = new LinkedHashMap<>();
        items.forEach(item -> map.put(key.apply(item), item));
        return Collections.unmodifiableMap(map);
    }

    public String functionId() {
        return functionId;
    }

    public Scope rootScope() {
        return scopes.get(rootScopeId);
    }

    public Collection<VariableVersion> variables() {
        return variables.values();
    }

    public Collection<Definition> definitions() {
        return definitions.values();
    }

    public Collection<Use> uses() {
        return uses.values();
    }

    public List<DataFlowEdge> edges() {
        return edges;
    }

    public List<PhiNode> phiNodes() {
        return phiNodes;
    }

    public Collection<Scope> scopes() {
        return scopes.values();
    }

    public List<Diagnostic> diagnostics() {
        return diagnostics;
    }

    public Optional<Definition> definition(String id) {
        return Optional.ofNullable(definitions.get(id));
    }

    public Optional<Use> use(String id) {
        return Optional.ofNullable(uses.get(id));
    }

    public Optional<Scope> scope(String id) {
        return Optional.ofNullable(scopes.get(id));
    }

    public Optional<VariableVersion> version(String name, int version) {
        return Optional.ofNullable(variables.get(VariableVersion.key(name, version)));
    }

    public Optional<Definition> definitionOf(VariableVersion version) {
        return Optional.ofNullable(definitionByVersion.get(version.key()));
    }

    public List<Definition> definitionsOf(String name) {
        return definitions.values().stream().filter(d -> d.name().equals(name)).toList();
    }

    public List<Use> usesOf(String name) {
        return uses.values().stream().filter(u -> u.name().equals(name)).toList();
    }

    public List<Use> usesOfDefinition(String definitionId) {
        return usesByDefinition.getOrDefault(definitionId, List.of());
    }

    public List<PhiNode> phiNodesFor(String name) {
        return phiNodes.stream().filter(p -> p.name().equals(name)).toList();
    }

    public List<Diagnostic> diagnostics(Diagnostic.Kind kind) {
        return diagnostics.stream().filter(d -> d.kind() == kind).toList();
    }

    /**
     * True when {@code ancestorId} is {@code scopeId} or one of its enclosing scopes.
     */
    public boolean isAncestorOrSelf(String ancestorId, String scopeId) {
        String current = scopeId;
        while (current != null) {
            if (current.equals(ancestorId)) {
                return true;
            }
            Scope scope = scopes.get(current);
            current = scope != null ? scope.parentId() : null;
        }
        return false;
    }

    /**
     * First definition line and last use line of a source variable, over all its versions.
     */
    public Optional<Lifetime> lifetime(String name) {
        List<Definition> defs = definitionsOf(name);
        if (defs.isEmpty()) {
            return Optional.empty();
        }
        int first = defs.stream().mapToInt(Definition::line).min().orElse(0);
        int last = usesOf(name).stream().mapToInt(Use::line).max().orElse(first);
        return Optional.of(new Lifetime(name, first, Math.max(first, last), defs.size()));
    }

    public Stats stats() {
        return new Stats(variables.size(), definitions.size(), uses.size(), edges.size(),
                phiNodes.size(), scopes.size(), diagnostics.size());
    }

    public record Lifetime(String name, int firstDefinitionLine, int lastUseLine, int versionCount) {}

    public record Stats(int variableCount, int definitionCount, int useCount, int edgeCount,
                        int phiCount, int scopeCount, int diagnosticCount) {}
}
