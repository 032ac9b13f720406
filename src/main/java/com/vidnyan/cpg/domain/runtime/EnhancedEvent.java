package com.vidnyan.cpg.domain.runtime;

import java.time.Instant;

/**
 * Execution event with its static context attached. Events that could not be correlated pass
 * through with a null context so traces stay complete.
 */
public record EnhancedEvent(
        ExecutionEvent originalEvent,
        AstContext astContext,
        Instant correlatedAt,
        StructuralInfo structuralInfo,
        DataFlowInfo dataFlowInfo
) {

    public static EnhancedEvent of(ExecutionEvent event, AstContext context, Instant now) {
        return new EnhancedEvent(event, context, now, context.structuralInfo(), context.dataFlowInfo());
    }

    public static EnhancedEvent passThrough(ExecutionEvent event) {
        return new EnhancedEvent(event, null, null, null, null);
    }

    public boolean isCorrelated() {
        return astContext != null;
    }
}
