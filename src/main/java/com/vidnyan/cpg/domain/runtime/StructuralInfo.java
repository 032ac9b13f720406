package com.vidnyan.cpg.domain.runtime;

import java.util.Map;

public record StructuralInfo(
        String astNodeType,
        int structuralDepth,
        Map<String, Object> patternContext,
        ControlFlowPosition controlFlowPosition
) {
    public StructuralInfo {
        patternContext = Map.copyOf(patternContext);
    }
}
