package com.vidnyan.cpg.domain.cpg;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Unified node. Keeps the original AST, CFG or DFG object it was created from under {@code representations}.
 */
public record CpgNode(
    CpgNodeId id,
    CpgNodeType type,
    Map<SourceGraph, Object> representations,
    Map<String, Object> properties,
    Map<String, List<CpgNodeId>> relationships
) {

    public CpgNode {
        representations = Map.copyOf(representations);
        properties = Map.copyOf(properties);
        relationships = Map.copyOf(relationships);
    }

    public <T> Optional<T> representation(SourceGraph graph, Class<T> type) {
        Object value = representations.get(graph);
        return type.isInstance(value) ? Optional.of(type.cast(value)) : Optional.empty();
    }

    public Optional<Object> property(String key) {
        return Optional.ofNullable(properties.get(key));
    }

    public int line() {
        Object line = properties.get("line");
        return line instanceof Number n ? n.intValue() : 0;
    }

    public List<CpgNodeId> related(String relationship) {
        return relationships.getOrDefault(relationship, List.of());
    }
}
