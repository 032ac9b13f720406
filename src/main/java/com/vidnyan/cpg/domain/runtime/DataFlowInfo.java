package com.vidnyan.cpg.domain.runtime;

import java.util.List;

/**
 * Variable versions defined, read and depended upon at one execution point, as {@code name_version} keys.
 */
public record DataFlowInfo(
        List<String> variableDefinitions,
        List<String> variableUses,
        List<String> dataDependencies,
        FlowDirection flowDirection
) {
    public DataFlowInfo {
        variableDefinitions = List.copyOf(variableDefinitions);
        variableUses = List.copyOf(variableUses);
        dataDependencies = List.copyOf(dataDependencies);
    }
}
