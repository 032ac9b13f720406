package com.vidnyan.cpg.domain.dfg;

import java.util.List;

/**
 * Merge-point selector: after the merge the variable holds one of the source versions,
 * chosen by the branch that executed. {@code conditions.get(i)} names the branch of {@code sources.get(i)}.
 */
public record PhiNode(
    String id,
    VariableVersion target,
    List<VariableVersion> sources,
    String mergeAstNodeId,
    List<String> conditions,
    String definitionId
) {

    public PhiNode {
        sources = List.copyOf(sources);
        conditions = List.copyOf(conditions);
    }

    public String name() {
        return target.name();
    }
}
