package com.vidnyan.cpg.domain.pattern;

public enum Severity {
    INFO,
    WARNING,
    ERROR,
    CRITICAL;

    public String wireName() {
        return name().toLowerCase();
    }
}
