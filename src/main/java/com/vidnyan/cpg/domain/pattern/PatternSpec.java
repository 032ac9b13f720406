package com.vidnyan.cpg.domain.pattern;

import com.vidnyan.cpg.domain.ast.AstNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Caller's description of what to match.
 *
 * @param template            structural template for {@link PatternType#AST}; alternative to {@code patternName}
 * @param patternName         library entry to use; for AST patterns a named template
 * @param confidenceThreshold minimum confidence of returned matches; null means the configured default
 * @param matchVariables      when true, {@code $name} template variables must bind consistently
 * @param contextSensitive    when true, matches in unreachable code are dropped and enclosing context is reported
 * @param customRules         extra predicates evaluated alongside a library definition
 */
public record PatternSpec(
    PatternType type,
    AstNode template,
    String patternName,
    Double confidenceThreshold,
    boolean matchVariables,
    boolean contextSensitive,
    List<PatternRule.Named> customRules
) {

    public PatternSpec {
        customRules = customRules != null ? new ArrayList<>(customRules) : List.of();
    }

    public static PatternSpec ast(AstNode template) {
        return new PatternSpec(PatternType.AST, template, null, null, false, false, List.of());
    }

    public static PatternSpec named(PatternType type, String patternName) {
        return new PatternSpec(type, null, patternName, null, false, false, List.of());
    }

    public PatternSpec withThreshold(Double threshold) {
        return new PatternSpec(type, template, patternName, threshold, matchVariables, contextSensitive, customRules);
    }

    public PatternSpec withMatchVariables(boolean enabled) {
        return new PatternSpec(type, template, patternName, confidenceThreshold, enabled, contextSensitive, customRules);
    }

    public PatternSpec withContextSensitive(boolean enabled) {
        return new PatternSpec(type, template, patternName, confidenceThreshold, matchVariables, enabled, customRules);
    }

    public PatternSpec withCustomRule(String name, PatternRule rule) {
        List<PatternRule.Named> rules = new ArrayList<>(customRules);
        rules.add(new PatternRule.Named(name, rule));
        return new PatternSpec(type, template, patternName, confidenceThreshold, matchVariables, contextSensitive, rules);
    }
}
