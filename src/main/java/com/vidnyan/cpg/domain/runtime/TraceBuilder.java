package com.vidnyan.cpg.domain.runtime;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.LongStream;

/**
 * Derives trace views from enhanced events. Uncorrelated events only contribute variable snapshots,
 * keyed under {@code module.function:variable_snapshot}.
 */
public final class TraceBuilder {

    private TraceBuilder() {
    }

    public static ExecutionTrace build(String traceId, Instant createdAt, List<EnhancedEvent> events) {
        return new ExecutionTrace(traceId, createdAt, events,
                astFlow(events), variableFlow(events), structuralPatterns(events), performance(events));
    }

    static List<ExecutionTrace.TraceStep> astFlow(List<EnhancedEvent> events) {
        return events.stream()
                .filter(EnhancedEvent::isCorrelated)
                .map(e -> new ExecutionTrace.TraceStep(e.astContext().getAstNodeId(),
                        e.originalEvent().getTimestamp(), e.structuralInfo()))
                .sorted(Comparator.comparingLong(ExecutionTrace.TraceStep::timestamp))
                .toList();
    }

    static Map<String, List<ExecutionTrace.VariableSnapshot>> variableFlow(List<EnhancedEvent> events) {
        Map<String, List<ExecutionTrace.VariableSnapshot>> flow = new LinkedHashMap<>();
        for (EnhancedEvent enhanced : events) {
            ExecutionEvent event = enhanced.originalEvent();
            String nodeId;
            int line;
            if (enhanced.isCorrelated()) {
                nodeId = enhanced.astContext().getAstNodeId();
                line = enhanced.astContext().getLine();
            } else {
                nodeId = event.getModule() + "." + event.getFunction() + ":variable_snapshot";
                line = event.getLine() != null ? event.getLine() : 0;
            }
            event.variablesOrEmpty().forEach((name, value) -> flow
                    .computeIfAbsent(name, k -> new ArrayList<>())
                    .add(new ExecutionTrace.VariableSnapshot(value, event.getTimestamp(), nodeId, line)));
        }
        flow.replaceAll((name, history) -> List.copyOf(history));
        return flow;
    }

    static List<ExecutionTrace.StructuralPatternStats> structuralPatterns(List<EnhancedEvent> events) {
        Map<String, List<EnhancedEvent>> byType = events.stream()
                .filter(e -> e.structuralInfo() != null)
                .collect(Collectors.groupingBy(e -> e.structuralInfo().astNodeType(),
                        LinkedHashMap::new, Collectors.toList()));
        return byType.entrySet().stream()
                .map(entry -> new ExecutionTrace.StructuralPatternStats(
                        entry.getKey(),
                        entry.getValue().size(),
                        timestamps(entry.getValue()).min().orElse(0L),
                        timestamps(entry.getValue()).max().orElse(0L)))
                .toList();
    }

    private static LongStream timestamps(List<EnhancedEvent> events) {
        return events.stream().mapToLong(e -> e.originalEvent().getTimestamp());
    }

    static Map<String, ExecutionTrace.PerformanceStats> performance(List<EnhancedEvent> events) {
        Map<String, List<EnhancedEvent>> byNode = events.stream()
                .filter(e -> e.isCorrelated() && e.originalEvent().getDurationNs() != null)
                .collect(Collectors.groupingBy(e -> e.astContext().getAstNodeId(),
                        LinkedHashMap::new, Collectors.toList()));
        Map<String, ExecutionTrace.PerformanceStats> stats = new LinkedHashMap<>();
        byNode.forEach((nodeId, measurements) -> {
            List<Long> durations = measurements.stream().map(e -> e.originalEvent().getDurationNs()).toList();
            double average = durations.stream().mapToLong(Long::longValue).average().orElse(0.0);
            int complexity = measurements.get(0).astContext().getMetadata().complexity();
            stats.put(nodeId, new ExecutionTrace.PerformanceStats(
                    average,
                    durations.stream().mapToLong(Long::longValue).min().orElse(0L),
                    durations.stream().mapToLong(Long::longValue).max().orElse(0L),
                    durations.size(),
                    complexity,
                    average / Math.max(complexity, 1)));
        });
        return stats;
    }
}
