package com.vidnyan.cpg.domain.dfg;

import java.util.List;

public record Scope(
    String id,
    ScopeKind kind,
    String parentId,
    List<String> childIds,
    List<String> variables,
    String entryAstNodeId,
    String exitAstNodeId
) {

    public Scope {
        childIds = List.copyOf(childIds);
        variables = List.copyOf(variables);
    }

    public boolean isRoot() {
        return parentId == null;
    }
}
