package com.vidnyan.cpg.domain.cfg;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Control-flow graph of a single function.
 * One entry, one or more exits. Immutable and thread-safe.
 */
public final class ControlFlowGraph {

    private final String functionId;
    private final String entryId;
    private final List<String> exitIds;
    private final Map<String, CfgNode> nodes;
    private final List<CfgEdge> edges;
    private final Map<String, List<CfgEdge>> outgoing;
    private final Map<String, List<CfgEdge>> incoming;
    private final ComplexityMetrics metrics;

    private ControlFlowGraph(String functionId, String entryId, List<String> exitIds, Map<String, CfgNode> nodes,
                             List<CfgEdge> edges, Map<String, List<CfgEdge>> outgoing,
                             Map<String, List<CfgEdge>> incoming, ComplexityMetrics metrics) {
        this.functionId = functionId;
        this.entryId = entryId;
        this.exitIds = List.copyOf(exitIds);
        this.nodes = Collections.unmodifiableMap(nodes);
        this.edges = List.copyOf(edges);
        this.outgoing = Collections.unmodifiableMap(outgoing);
        this.incoming = Collections.unmodifiableMap(incoming);
        this.metrics = metrics;
    }

    /**
     * Assemble a graph, filling each node's predecessor and successor lists from the edges.
     */
    public static ControlFlowGraph assemble(String functionId, String entryId, List<String> exitIds,
                                            Collection<CfgNode> rawNodes, List<CfgEdge> edges) {
        Map<String, List<CfgEdge>> outgoing = new HashMap<>();
        Map<String, List<CfgEdge>> incoming = new HashMap<>();
        for (CfgEdge edge : edges) {
            outgoing.computeIfAbsent(edge.from(), k -> new ArrayList<>()).add(edge);
            incoming.computeIfAbsent(edge.to(), k -> new ArrayList<>()).add(edge);
        }

        Map<String, CfgNode> nodes = new LinkedHashMap<>();
        for (CfgNode node : rawNodes) {
            List<String> preds = incoming.getOrDefault(node.id(), List.of()).stream().map(CfgEdge::from).toList();
            List<String> succs = outgoing.getOrDefault(node.id(), List.of()).stream().map(CfgEdge::to).toList();
            nodes.put(node.id(), node.withLinks(preds, succs));
        }
        outgoing.replaceAll((k, v) -> List.copyOf(v));
        incoming.replaceAll((k, v) -> List.copyOf(v));
        return new ControlFlowGraph(functionId, entryId, exitIds, nodes, edges, outgoing, incoming, null);
    }

    public ControlFlowGraph withMetrics(ComplexityMetrics computed) {
        return new ControlFlowGraph(functionId, entryId, exitIds, nodes, edges, outgoing, incoming, computed);
    }

    public String functionId() {
        return functionId;
    }

    public String entryId() {
        return entryId;
    }

    public List<String> exitIds() {
        return exitIds;
    }

    public Collection<CfgNode> nodes() {
        return nodes.values();
    }

    public Optional<CfgNode> node(String id) {
        return Optional.ofNullable(nodes.get(id));
    }

    public List<CfgEdge> edges() {
        return edges;
    }

    public List<CfgEdge> outgoing(String nodeId) {
        return outgoing.getOrDefault(nodeId, List.of());
    }

    public List<CfgEdge> incoming(String nodeId) {
        return incoming.getOrDefault(nodeId, List.of());
    }

    public ComplexityMetrics metrics() {
        return metrics;
    }

    public List<CfgNode> decisionPoints() {
        return nodes.values().stream().filter(CfgNode::isDecision).toList();
    }

    public List<CfgNode> nodesOfType(CfgNodeType type) {
        return nodes.values().stream().filter(n -> n.type() == type).toList();
    }

    /**
     * Nodes attached to the given AST node.
     */
    public List<CfgNode> nodesForAst(String astNodeId) {
        return nodes.values().stream().filter(n -> astNodeId.equals(n.astNodeId())).toList();
    }

    /**
     * Every node reachable from the entry by following successor edges.
     */
    public Set<String> reachableFromEntry() {
        return forwardClosure(entryId);
    }

    public Set<String> forwardClosure(String start) {
        Set<String> visited = new HashSet<>();
        Deque<String> queue = new ArrayDeque<>();
        queue.add(start);
        while (!queue.isEmpty()) {
            String current = queue.poll();
            if (!visited.add(current)) {
                continue;
            }
            for (CfgEdge edge : outgoing(current)) {
                queue.add(edge.to());
            }
        }
        return visited;
    }

    /**
     * Every node from which the target can be reached.
     */
    public Set<String> backwardClosure(String target) {
        Set<String> visited = new HashSet<>();
        Deque<String> queue = new ArrayDeque<>();
        queue.add(target);
        while (!queue.isEmpty()) {
            String current = queue.poll();
            if (!visited.add(current)) {
                continue;
            }
            for (CfgEdge edge : incoming(current)) {
                queue.add(edge.from());
            }
        }
        return visited;
    }

    public Stats stats() {
        return new Stats(nodes.size(), edges.size(), decisionPoints().size(), exitIds.size());
    }

    public record Stats(int nodeCount, int edgeCount, int decisionCount, int exitCount) {}
}
