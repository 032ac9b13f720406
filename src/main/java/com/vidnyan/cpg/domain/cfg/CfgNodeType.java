package com.vidnyan.cpg.domain.cfg;

public enum CfgNodeType {
    ENTRY,
    EXIT,
    DECISION,
    MERGE,
    STATEMENT
}
