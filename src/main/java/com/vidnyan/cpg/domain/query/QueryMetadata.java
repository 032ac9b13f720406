package com.vidnyan.cpg.domain.query;

import java.util.List;

public record QueryMetadata(
        int totalCount,
        long executionTimeMs,
        boolean cacheHit,
        List<String> optimizationApplied,
        PerformanceGrade performanceScore,
        int estimatedCost
) {
    public QueryMetadata {
        optimizationApplied = List.copyOf(optimizationApplied);
    }
}
