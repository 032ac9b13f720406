package com.vidnyan.cpg.domain.dfg;

/**
 * Read of a variable version.
 */
public record Use(
    String id,
    VariableVersion variable,
    String astNodeId,
    UseKind kind,
    String scopeId,
    int line,
    String reachingDefinition
) {

    public String name() {
        return variable.name();
    }
}
