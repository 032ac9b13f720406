package com.vidnyan.cpg.domain.pattern;

import com.vidnyan.cpg.domain.ast.SourceLocation;

import java.util.List;
import java.util.Map;

public record PatternMatch(
    SourceLocation location,
    String patternName,
    PatternType type,
    double confidence,
    Severity severity,
    List<String> suggestions,
    Map<String, Object> metadata
) {

    public PatternMatch {
        suggestions = List.copyOf(suggestions);
        metadata = Map.copyOf(metadata);
    }
}
