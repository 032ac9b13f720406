package com.vidnyan.cpg.domain.cpg;

import java.util.Map;

public record CpgEdge(
    CpgNodeId from,
    CpgNodeId to,
    CpgEdgeType type,
    SourceGraph sourceGraph,
    Map<String, Object> properties
) {

    public CpgEdge {
        properties = properties != null ? Map.copyOf(properties) : Map.of();
    }
}
