package com.vidnyan.cpg.domain.cfg;

public enum CfgEdgeType {
    SEQUENTIAL,
    PATTERN_MATCH,
    PATTERN_NO_MATCH,
    CONDITIONAL_TRUE,
    CONDITIONAL_FALSE,
    EXCEPTION;

    public boolean isConditional() {
        return this != SEQUENTIAL;
    }
}
