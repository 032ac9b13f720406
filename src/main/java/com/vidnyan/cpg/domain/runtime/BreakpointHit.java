package com.vidnyan.cpg.domain.runtime;

import java.util.Map;

public record BreakpointHit(
        String breakpointId,
        BreakpointKind kind,
        String functionId,
        String astNodeId,
        int line,
        int hitCount,
        Map<String, Object> details
) {
    public BreakpointHit {
        details = Map.copyOf(details);
    }
}
