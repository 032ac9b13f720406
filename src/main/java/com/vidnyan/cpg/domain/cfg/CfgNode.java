package com.vidnyan.cpg.domain.cfg;

import java.util.List;

/**
 * Control point of one function.
 *
 * @param decisionKind set only for {@link CfgNodeType#DECISION} nodes
 * @param nesting      number of branching constructs enclosing this node
 */
public record CfgNode(
    String id,
    CfgNodeType type,
    DecisionKind decisionKind,
    String astNodeId,
    int line,
    String scopeId,
    int nesting,
    String label,
    List<String> predecessors,
    List<String> successors
) {

    public CfgNode {
        predecessors = predecessors != null ? List.copyOf(predecessors) : List.of();
        successors = successors != null ? List.copyOf(successors) : List.of();
    }

    public boolean isDecision() {
        return type == CfgNodeType.DECISION;
    }

    CfgNode withLinks(List<String> preds, List<String> succs) {
        return new CfgNode(id, type, decisionKind, astNodeId, line, scopeId, nesting, label, preds, succs);
    }
}
