package com.vidnyan.cpg.application.port.in;

import com.vidnyan.cpg.domain.common.AnalysisError;
import com.vidnyan.cpg.domain.common.Result;
import com.vidnyan.cpg.domain.pattern.MatchStatistics;
import com.vidnyan.cpg.domain.pattern.PatternDefinition;
import com.vidnyan.cpg.domain.pattern.PatternMatch;
import com.vidnyan.cpg.domain.pattern.PatternSpec;
import com.vidnyan.cpg.domain.pattern.PatternType;

import java.util.List;
import java.util.Map;

/**
 * Structural, behavioral and anti-pattern detection over analyzed modules.
 */
public interface MatchPatternsUseCase {

    /**
     * Matches in one stored module at or above the specification's confidence threshold.
     */
    Result<List<PatternMatch>> match(String module, PatternSpec spec);

    /**
     * Run a specification against every stored module, stopping at the sweep timeout.
     */
    SweepResult matchAcrossRepository(PatternSpec spec);

    /**
     * Add or replace a library pattern. Definitions without a name, a non-structural type
     * or well-formed rules are rejected with a tagged error.
     */
    Result<PatternDefinition> registerPattern(PatternDefinition definition);

    List<String> availablePatterns(PatternType type);

    MatchStatistics statistics(List<PatternMatch> matches);

    /**
     * Sweep outcome; {@code timedOut} is set when some modules were not scanned.
     */
    record SweepResult(
        List<PatternMatch> matches,
        List<String> modulesScanned,
        List<String> modulesSkipped,
        Map<String, AnalysisError> failures,
        boolean timedOut
    ) {}
}
