package com.vidnyan.cpg.domain.dfg;

public enum DefinitionKind {
    ASSIGNMENT,
    PARAMETER,
    PATTERN_MATCH,
    COMPREHENSION_BINDING,
    EXCEPTION_BINDING,
    RECEIVE_BINDING,
    /** Synthetic binding created at a control-merge point. */
    PHI
}
