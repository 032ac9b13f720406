package com.vidnyan.cpg.domain.runtime;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Execution event captured by the runtime tracer.
 * Only module and function are required; everything else refines the correlation.
 */
@Value
@Builder
public class ExecutionEvent {

    String module;
    String function;
    @Builder.Default
    int arity = 0;
    String astNodeId;
    Integer line;
    Integer callerLine;
    @Builder.Default
    Map<String, Object> variables = Map.of();
    Long durationNs;
    String correlationId;
    @Builder.Default
    long timestamp = System.nanoTime();

    /** Caller line wins over the event's own line. */
    public Integer effectiveLine() {
        return callerLine != null ? callerLine : line;
    }

    public Map<String, Object> variablesOrEmpty() {
        return variables != null ? variables : Map.of();
    }

    public String functionKey() {
        return module + "." + function + "/" + arity;
    }
}
