package com.vidnyan.cpg.domain.runtime;

import com.vidnyan.cpg.domain.cfg.CfgNode;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Static context of an event joined with what only the event itself knows: local variable values
 * and the calls seen earlier under the same correlation id.
 */
public record RuntimeContext(
        AstContext astContext,
        Map<String, Object> localVariables,
        String scopeId,
        List<String> callContext
) {
    public RuntimeContext {
        localVariables = localVariables == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(localVariables));
        callContext = List.copyOf(callContext);
    }

    public static RuntimeContext of(AstContext context, ExecutionEvent event, List<String> callContext) {
        String scope = context.getCfgNode().map(CfgNode::scopeId).orElse(context.getFunction().dfg().rootScope().id());
        return new RuntimeContext(context, event.variablesOrEmpty(), scope, callContext);
    }

    public Optional<Object> variable(String name) {
        return Optional.ofNullable(localVariables.get(name));
    }
}
