package com.vidnyan.cpg.domain.dfg;

/**
 * Value flow from a definition to a use.
 *
 * @param transformation what happens to the value on the way, e.g. {@code call:Enum.map#0} or {@code identity}
 */
public record DataFlowEdge(
    String definitionId,
    String useId,
    FlowKind kind,
    String transformation
) {}
