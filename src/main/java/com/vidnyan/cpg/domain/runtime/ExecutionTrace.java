package com.vidnyan.cpg.domain.runtime;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Ordered batch of enhanced events with derived flow, variable history, pattern frequency
 * and per-node performance.
 */
public record ExecutionTrace(
        String traceId,
        Instant createdAt,
        List<EnhancedEvent> events,
        List<TraceStep> astFlow,
        Map<String, List<VariableSnapshot>> variableFlow,
        List<StructuralPatternStats> structuralPatterns,
        Map<String, PerformanceStats> performanceCorrelation
) {
    public ExecutionTrace {
        events = List.copyOf(events);
        astFlow = List.copyOf(astFlow);
        variableFlow = Map.copyOf(variableFlow);
        structuralPatterns = List.copyOf(structuralPatterns);
        performanceCorrelation = Map.copyOf(performanceCorrelation);
    }

    public int eventCount() {
        return events.size();
    }

    public record TraceStep(String astNodeId, long timestamp, StructuralInfo structuralInfo) {}

    public record VariableSnapshot(Object value, long timestamp, String astNodeId, int line) {}

    public record StructuralPatternStats(String patternType, int occurrences, long firstOccurrence,
                                         long lastOccurrence) {}

    public record PerformanceStats(double avgDuration, long minDuration, long maxDuration, int callCount,
                                   int complexity, double performanceRatio) {}
}
