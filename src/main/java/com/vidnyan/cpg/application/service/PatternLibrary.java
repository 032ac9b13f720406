package com.vidnyan.cpg.application.service;

import com.vidnyan.cpg.domain.common.ErrorCode;
import com.vidnyan.cpg.domain.common.Result;
import com.vidnyan.cpg.domain.pattern.BuiltInPatterns;
import com.vidnyan.cpg.domain.pattern.PatternDefinition;
import com.vidnyan.cpg.domain.pattern.PatternRule;
import com.vidnyan.cpg.domain.pattern.PatternType;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry of behavioral and anti-pattern definitions, seeded with the built-in library.
 * Lookups are lock-free; registrations are serialized.
 */
@Slf4j
@Component
public class PatternLibrary {

    private final Map<String, PatternDefinition> definitions = new ConcurrentHashMap<>();

    @PostConstruct
    public void loadBuiltIns() {
        for (PatternDefinition definition : BuiltInPatterns.all()) {
            Result<PatternDefinition> registered = register(definition);
            if (registered.isFailure()) {
                throw new IllegalStateException("Invalid built-in pattern: " + registered.error().format());
            }
        }
        log.info("Loaded {} built-in patterns", definitions.size());
    }

    /**
     * Add a definition, replacing any with the same name.
     * Structural templates belong to the AST pattern repository and are rejected here.
     */
    public synchronized Result<PatternDefinition> register(PatternDefinition definition) {
        Result<PatternDefinition> validated = validate(definition);
        if (validated.isFailure()) {
            log.warn("Pattern registration rejected: {}", validated.error().format());
            return validated;
        }
        PatternDefinition previous = definitions.put(definition.name(), definition);
        if (previous != null) {
            log.info("Replaced pattern: {}", definition.name());
        } else {
            log.debug("Registered pattern: {} ({})", definition.name(), definition.type());
        }
        return validated;
    }

    public Optional<PatternDefinition> find(String name) {
        return Optional.ofNullable(definitions.get(name));
    }

    public List<PatternDefinition> findByType(PatternType type) {
        return definitions.values().stream()
                .filter(d -> d.type() == type)
                .sorted(Comparator.comparing(PatternDefinition::name))
                .toList();
    }

    public int size() {
        return definitions.size();
    }

    private static Result<PatternDefinition> validate(PatternDefinition definition) {
        if (definition == null || definition.name() == null || definition.name().isBlank()) {
            return Result.failure(ErrorCode.INVALID_CUSTOM_RULE, "Pattern definition needs a name");
        }
        if (definition.type() == null) {
            return Result.failure(ErrorCode.MISSING_PATTERN_TYPE, "Pattern " + definition.name() + " needs a type");
        }
        if (definition.type() == PatternType.AST) {
            return Result.failure(ErrorCode.INVALID_AST_PATTERN,
                    "Pattern " + definition.name() + " is structural; register it as an AST template");
        }
        if (definition.rules().isEmpty()) {
            return Result.failure(ErrorCode.INVALID_CUSTOM_RULE,
                    "Pattern " + definition.name() + " needs at least one rule");
        }
        for (PatternRule.Named rule : definition.rules()) {
            if (rule.rule() == null || rule.name() == null || rule.name().isBlank()) {
                return Result.failure(ErrorCode.INVALID_CUSTOM_RULE,
                        "Every rule of pattern " + definition.name() + " needs a name and a predicate");
            }
        }
        return Result.success(definition);
    }
}
