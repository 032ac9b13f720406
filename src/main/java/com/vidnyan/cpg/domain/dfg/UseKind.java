package com.vidnyan.cpg.domain.dfg;

public enum UseKind {
    READ(FlowKind.DIRECT),
    PATTERN(FlowKind.PATTERN_MATCH),
    GUARD(FlowKind.CONDITIONAL),
    CALL_ARGUMENT(FlowKind.DIRECT),
    PIPE_STAGE(FlowKind.PIPELINE_STAGE),
    MESSAGE_PAYLOAD(FlowKind.MESSAGE_PASS),
    CLOSURE_CAPTURE(FlowKind.CLOSURE_CAPTURE);

    private final FlowKind flowKind;

    UseKind(FlowKind flowKind) {
        this.flowKind = flowKind;
    }

    public FlowKind flowKind() {
        return flowKind;
    }
}
