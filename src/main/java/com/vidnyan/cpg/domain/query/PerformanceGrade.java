package com.vidnyan.cpg.domain.query;

public enum PerformanceGrade {
    EXCELLENT,
    GOOD,
    FAIR,
    POOR;

    public static PerformanceGrade of(long elapsedMs, long excellentMs, long goodMs, long fairMs) {
        if (elapsedMs <= excellentMs) {
            return EXCELLENT;
        }
        if (elapsedMs <= goodMs) {
            return GOOD;
        }
        return elapsedMs <= fairMs ? FAIR : POOR;
    }

    public String wireName() {
        return name().toLowerCase();
    }
}
