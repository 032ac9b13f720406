package com.vidnyan.cpg.domain.cpg;

public enum CpgNodeType {
    FUNCTION,
    AST_NODE,
    CALL_EXPRESSION,
    ENTRY,
    EXIT,
    CONTROL_FLOW_NODE,
    DECISION_POINT,
    MERGE_POINT,
    VARIABLE_DEFINITION,
    VARIABLE_USE,
    PHI_NODE
}
