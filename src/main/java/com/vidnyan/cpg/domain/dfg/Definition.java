package com.vidnyan.cpg.domain.dfg;

import java.util.List;

/**
 * Binding event that creates exactly one {@link VariableVersion}.
 *
 * @param reachingDefinitions definitions of the same name live just before this binding
 * @param sourceUses          uses evaluated to produce the bound value (the right-hand side)
 */
public record Definition(
    String id,
    VariableVersion variable,
    String astNodeId,
    DefinitionKind kind,
    String scopeId,
    int line,
    List<String> reachingDefinitions,
    List<String> sourceUses
) {

    public Definition {
        reachingDefinitions = reachingDefinitions != null ? List.copyOf(reachingDefinitions) : List.of();
        sourceUses = sourceUses != null ? List.copyOf(sourceUses) : List.of();
    }

    public String name() {
        return variable.name();
    }
}
