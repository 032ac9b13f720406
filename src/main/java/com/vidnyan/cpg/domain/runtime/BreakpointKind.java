package com.vidnyan.cpg.domain.runtime;

public enum BreakpointKind {
    STRUCTURAL("structural_bp_"),
    DATA_FLOW("data_flow_bp_"),
    WATCHPOINT("wp_");

    private final String idPrefix;

    BreakpointKind(String idPrefix) {
        this.idPrefix = idPrefix;
    }

    public String idPrefix() {
        return idPrefix;
    }
}
