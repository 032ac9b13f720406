package com.vidnyan.cpg.domain.dfg;

public enum FlowKind {
    DIRECT,
    CONDITIONAL,
    PATTERN_MATCH,
    PIPELINE_STAGE,
    RETURN_VALUE,
    CLOSURE_CAPTURE,
    MESSAGE_PASS,
    DESTRUCTURE
}
