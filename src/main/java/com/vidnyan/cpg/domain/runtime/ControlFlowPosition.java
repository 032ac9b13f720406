package com.vidnyan.cpg.domain.runtime;

public enum ControlFlowPosition {
    ENTRY,
    EXIT,
    DECISION,
    MERGE,
    SEQUENTIAL,
    UNREACHABLE
}
