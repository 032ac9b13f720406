package com.vidnyan.cpg.domain.pattern;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Library entry: a list of predicates plus the description, severity and remediation
 * reported when enough of them hold.
 */
public record PatternDefinition(
    String name,
    PatternType type,
    PatternScope scope,
    List<PatternRule.Named> rules,
    String description,
    Severity severity,
    String category,
    List<String> suggestions,
    Map<String, Object> metadata
) {

    public PatternDefinition {
        rules = List.copyOf(rules);
        suggestions = List.copyOf(suggestions);
        metadata = Map.copyOf(metadata);
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public static class Builder {
        private final String name;
        private PatternType type = PatternType.BEHAVIORAL;
        private PatternScope scope = PatternScope.MODULE;
        private final List<PatternRule.Named> rules = new ArrayList<>();
        private String description = "";
        private Severity severity = Severity.INFO;
        private String category = "custom";
        private final List<String> suggestions = new ArrayList<>();
        private final Map<String, Object> metadata = new LinkedHashMap<>();

        private Builder(String name) {
            this.name = name;
        }

        public Builder type(PatternType type) { this.type = type; return this; }
        public Builder scope(PatternScope scope) { this.scope = scope; return this; }
        public Builder rule(String ruleName, PatternRule rule) { this.rules.add(PatternRule.Named.of(ruleName, rule)); return this; }
        public Builder description(String description) { this.description = description; return this; }
        public Builder severity(Severity severity) { this.severity = severity; return this; }
        public Builder category(String category) { this.category = category; return this; }
        public Builder suggestion(String suggestion) { this.suggestions.add(suggestion); return this; }
        public Builder metadata(String key, Object value) { this.metadata.put(key, value); return this; }

        public PatternDefinition build() {
            return new PatternDefinition(name, type, scope, rules, description, severity, category,
                    suggestions, metadata);
        }
    }
}
