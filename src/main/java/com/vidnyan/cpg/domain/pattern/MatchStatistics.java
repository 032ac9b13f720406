package com.vidnyan.cpg.domain.pattern;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Summary of a match list: totals by severity and by confidence band.
 */
public record MatchStatistics(
    int total,
    Map<Severity, Long> bySeverity,
    Map<String, Long> byConfidence,
    double averageConfidence
) {

    public static MatchStatistics of(List<PatternMatch> matches) {
        Map<Severity, Long> severities = new EnumMap<>(Severity.class);
        Map<String, Long> bands = new LinkedHashMap<>();
        for (String band : List.of("high", "medium", "low", "very_low")) {
            bands.put(band, 0L);
        }
        for (PatternMatch match : matches) {
            severities.merge(match.severity(), 1L, Long::sum);
            bands.merge(band(match.confidence()), 1L, Long::sum);
        }
        double average = matches.stream().mapToDouble(PatternMatch::confidence).average().orElse(0.0);
        return new MatchStatistics(matches.size(), Map.copyOf(severities), Map.copyOf(bands), average);
    }

    static String band(double confidence) {
        if (confidence >= 0.9) {
            return "high";
        }
        if (confidence >= 0.7) {
            return "medium";
        }
        if (confidence >= 0.5) {
            return "low";
        }
        return "very_low";
    }
}
