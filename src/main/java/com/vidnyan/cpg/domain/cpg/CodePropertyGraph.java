package com.vidnyan.cpg.domain.cpg;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * AST, CFG and DFG of one function merged into a single arena of nodes,
 * with side tables from original ids and query indexes. Immutable and thread-safe.
 */
public final class CodePropertyGraph {

    private final String functionId;
    private final List<CpgNode> nodes;
    private final List<CpgEdge> edges;
    private final Map<String, CpgNodeId> astIndex;
    private final Map<String, CpgNodeId> cfgIndex;
    private final Map<String, CpgNodeId> definitionIndex;
    private final Map<String, CpgNodeId> useIndex;
    private final Map<CpgNodeType, List<CpgNodeId>> byType;
    private final Map<Integer, List<CpgNodeId>> byLine;
    private final Map<String, List<CpgNodeId>> byVariable;
    private final Map<CpgEdgeType, List<CpgEdge>> edgesByType;
    private final Map<SourceGraph, List<CpgEdge>> edgesBySource;
    private final Map<CpgNodeId, List<CpgEdge>> outgoing;
    private final Map<CpgNodeId, List<CpgEdge>> incoming;

    CodePropertyGraph(String functionId, List<CpgNode> nodes, List<CpgEdge> edges,
                      Map<String, CpgNodeId> astIndex, Map<String, CpgNodeId> cfgIndex,
                      Map<String, CpgNodeId> definitionIndex, Map<String, CpgNodeId> useIndex) {
        this.functionId = functionId;
        this.nodes = List.copyOf(nodes);
        this.edges = List.copyOf(edges);
        this.astIndex = Map.copyOf(astIndex);
        this.cfgIndex = Map.copyOf(cfgIndex);
        this.definitionIndex = Map.copyOf(definitionIndex);
        this.useIndex = Map.copyOf(useIndex);

        Map<CpgNodeType, List<CpgNodeId>> types = new EnumMap<>(CpgNodeType.class);
        Map<Integer, List<CpgNodeId>> lines = new HashMap<>();
        Map<String, List<CpgNodeId>> variables = new HashMap<>();
        for (CpgNode node : nodes) {
            types.computeIfAbsent(node.type(), k -> new ArrayList<>()).add(node.id());
            if (node.line() > 0) {
                lines.computeIfAbsent(node.line(), k -> new ArrayList<>()).add(node.id());
            }
            node.property("variable").ifPresent(v ->
                    variables.computeIfAbsent(v.toString(), k -> new ArrayList<>()).add(node.id()));
        }
        Map<CpgEdgeType, List<CpgEdge>> byEdgeType = new EnumMap<>(CpgEdgeType.class);
        Map<SourceGraph, List<CpgEdge>> bySource = new EnumMap<>(SourceGraph.class);
        Map<CpgNodeId, List<CpgEdge>> out = new HashMap<>();
        Map<CpgNodeId, List<CpgEdge>> in = new HashMap<>();
        for (CpgEdge edge : edges) {
            byEdgeType.computeIfAbsent(edge.type(), k -> new ArrayList<>()).add(edge);
            bySource.computeIfAbsent(edge.sourceGraph(), k -> new ArrayList<>()).add(edge);
            out.computeIfAbsent(edge.from(), k -> new ArrayList<>()).add(edge);
            in.computeIfAbsent(edge.to(), k -> new ArrayList<>()).add(edge);
        }
        this.byType = Collections.unmodifiableMap(types);
        this.byLine = Collections.unmodifiableMap(lines);
        this.byVariable = Collections.unmodifiableMap(variables);
        this.edgesByType = Collections.unmodifiableMap(byEdgeType);
        this.edgesBySource = Collections.unmodifiableMap(bySource);
        this.outgoing = Collections.unmodifiableMap(out);
        this.incoming = Collections.unmodifiableMap(in);
    }

    public String functionId() {
        return functionId;
    }

    public List<CpgNode> nodes() {
        return nodes;
    }

    public List<CpgEdge> edges() {
        return edges;
    }

    public CpgNode node(CpgNodeId id) {
        return nodes.get(id.value());
    }

    public Optional<CpgNode> forAst(String astNodeId) {
        return Optional.ofNullable(astIndex.get(astNodeId)).map(this::node);
    }

    public Optional<CpgNode> forCfg(String cfgNodeId) {
        return Optional.ofNullable(cfgIndex.get(cfgNodeId)).map(this::node);
    }

    public Optional<CpgNode> forDefinition(String definitionId) {
        return Optional.ofNullable(definitionIndex.get(definitionId)).map(this::node);
    }

    public Optional<CpgNode> forUse(String useId) {
        return Optional.ofNullable(useIndex.get(useId)).map(this::node);
    }

    public List<CpgNode> nodesOfType(CpgNodeType type) {
        return resolve(byType.getOrDefault(type, List.of()));
    }

    public List<CpgNode> nodesAtLine(int line) {
        return resolve(byLine.getOrDefault(line, List.of()));
    }

    /**
     * Definition and use nodes of a source variable, across all versions.
     */
    public List<CpgNode> nodesForVariable(String name) {
        return resolve(byVariable.getOrDefault(name, List.of()));
    }

    public List<CpgEdge> edgesOfType(CpgEdgeType type) {
        return edgesByType.getOrDefault(type, List.of());
    }

    public List<CpgEdge> edgesFrom(SourceGraph source) {
        return edgesBySource.getOrDefault(source, List.of());
    }

    public List<CpgEdge> outgoing(CpgNodeId id) {
        return outgoing.getOrDefault(id, List.of());
    }

    public List<CpgEdge> incoming(CpgNodeId id) {
        return incoming.getOrDefault(id, List.of());
    }

    private List<CpgNode> resolve(List<CpgNodeId> ids) {
        return ids.stream().map(this::node).toList();
    }

    public Stats stats() {
        Map<CpgNodeType, Integer> nodeCounts = new EnumMap<>(CpgNodeType.class);
        byType.forEach((type, ids) -> nodeCounts.put(type, ids.size()));
        Map<SourceGraph, Integer> edgeCounts = new EnumMap<>(SourceGraph.class);
        edgesBySource.forEach((source, list) -> edgeCounts.put(source, list.size()));
        return new Stats(nodes.size(), edges.size(), nodeCounts, edgeCounts);
    }

    public record Stats(int nodeCount, int edgeCount, Map<CpgNodeType, Integer> nodesByType,
                        Map<SourceGraph, Integer> edgesBySource) {}
}
