package com.vidnyan.cpg.application.service;

import com.vidnyan.cpg.application.port.in.MatchPatternsUseCase;
import com.vidnyan.cpg.application.port.out.AnalysisRepository;
import com.vidnyan.cpg.application.port.out.AstPatternRepository;
import com.vidnyan.cpg.config.EngineProperties;
import com.vidnyan.cpg.domain.analysis.FunctionAnalysis;
import com.vidnyan.cpg.domain.analysis.ModuleAnalysis;
import com.vidnyan.cpg.domain.ast.AstNode;
import com.vidnyan.cpg.domain.common.AnalysisError;
import com.vidnyan.cpg.domain.common.ErrorCode;
import com.vidnyan.cpg.domain.common.Result;
import com.vidnyan.cpg.domain.pattern.AstPatternTemplate;
import com.vidnyan.cpg.domain.pattern.MatchStatistics;
import com.vidnyan.cpg.domain.pattern.PatternDefinition;
import com.vidnyan.cpg.domain.pattern.PatternEvaluator;
import com.vidnyan.cpg.domain.pattern.PatternMatch;
import com.vidnyan.cpg.domain.pattern.PatternRule;
import com.vidnyan.cpg.domain.pattern.PatternScope;
import com.vidnyan.cpg.domain.pattern.PatternSpec;
import com.vidnyan.cpg.domain.pattern.PatternTarget;
import com.vidnyan.cpg.domain.pattern.PatternType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.TimeUnit;

/**
 * Pattern matching over stored module analyses.
 * Specifications are validated before any module is touched.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PatternMatcherService implements MatchPatternsUseCase {

    private final AnalysisRepository analysisRepository;
    private final AstPatternRepository astPatternRepository;
    private final PatternLibrary patternLibrary;
    private final DeadlineExecutor deadlineExecutor;
    private final EngineProperties properties;
    private final PatternEvaluator evaluator = new PatternEvaluator();

    /** Validated form of a specification. */
    private record Plan(PatternSpec spec, double threshold, AstPatternTemplate template,
                        List<PatternDefinition> definitions) {}

    @Override
    public Result<List<PatternMatch>> match(String module, PatternSpec spec) {
        Result<Plan> plan = validate(spec);
        if (plan.isFailure()) {
            return Result.failure(plan.error());
        }
        ModuleAnalysis analysis = analysisRepository.findModule(module).orElse(null);
        if (analysis == null) {
            return Result.failure(ErrorCode.MODULE_NOT_FOUND, "Module not analyzed: " + module);
        }
        return deadlineExecutor.call("Pattern match on " + module, properties.getPattern().getMatchTimeoutMs(),
                () -> matchModule(analysis, plan.get()));
    }

    @Override
    public SweepResult matchAcrossRepository(PatternSpec spec) {
        List<PatternMatch> matches = new ArrayList<>();
        List<String> scanned = new ArrayList<>();
        List<String> skipped = new ArrayList<>();
        Map<String, AnalysisError> failures = new LinkedHashMap<>();

        Result<Plan> plan = validate(spec);
        if (plan.isFailure()) {
            failures.put("*", plan.error());
            return new SweepResult(matches, scanned, skipped, failures, false);
        }

        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(properties.getPattern().getSweepTimeoutMs());
        List<ModuleAnalysis> modules = analysisRepository.findAll();
        log.info("Sweeping {} modules for {}", modules.size(), describe(spec));
        boolean timedOut = false;
        for (ModuleAnalysis module : modules) {
            long remainingMs = TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime());
            if (timedOut || remainingMs <= 0) {
                timedOut = true;
                skipped.add(module.name());
                continue;
            }
            Result<List<PatternMatch>> result = deadlineExecutor.call("Pattern sweep of " + module.name(),
                    remainingMs, () -> matchModule(module, plan.get()));
            if (result.errorCode() == ErrorCode.TIMEOUT) {
                // the module that hit the deadline is reported as skipped, not scanned
                timedOut = true;
                skipped.add(module.name());
                continue;
            }
            scanned.add(module.name());
            if (result.isSuccess()) {
                matches.addAll(result.get());
            } else {
                failures.put(module.name(), result.error());
            }
        }
        if (timedOut) {
            log.warn("Pattern sweep timed out, {} modules skipped", skipped.size());
        }
        matches.sort(Comparator.comparingDouble(PatternMatch::confidence).reversed());
        return new SweepResult(matches, scanned, skipped, failures, timedOut);
    }

    @Override
    public Result<PatternDefinition> registerPattern(PatternDefinition definition) {
        return patternLibrary.register(definition);
    }

    @Override
    public List<String> availablePatterns(PatternType type) {
        if (type == PatternType.AST) {
            return astPatternRepository.findAll().stream().map(AstPatternTemplate::name).sorted().toList();
        }
        return patternLibrary.findByType(type).stream().map(PatternDefinition::name).toList();
    }

    @Override
    public MatchStatistics statistics(List<PatternMatch> matches) {
        return MatchStatistics.of(matches);
    }

    private Result<Plan> validate(PatternSpec spec) {
        if (spec == null || spec.type() == null) {
            return Result.failure(ErrorCode.MISSING_PATTERN_TYPE, "Pattern specification needs a type");
        }
        double threshold = spec.confidenceThreshold() != null
                ? spec.confidenceThreshold()
                : properties.getPattern().getDefaultConfidenceThreshold();
        if (Double.isNaN(threshold) || threshold < 0.0 || threshold > 1.0) {
            return Result.failure(ErrorCode.INVALID_CONFIDENCE_THRESHOLD,
                    "Confidence threshold must be within [0, 1]: " + spec.confidenceThreshold());
        }
        for (PatternRule.Named rule : spec.customRules()) {
            if (rule == null || rule.rule() == null || rule.name() == null || rule.name().isBlank()) {
                return Result.failure(ErrorCode.INVALID_CUSTOM_RULE, "Custom rules need a name and a predicate");
            }
        }

        if (spec.type() == PatternType.AST) {
            if (spec.template() != null) {
                return Result.success(new Plan(spec, threshold,
                        new AstPatternTemplate("custom_ast_pattern", "", spec.template(), spec.matchVariables()),
                        List.of()));
            }
            if (spec.patternName() == null) {
                return Result.failure(ErrorCode.INVALID_AST_PATTERN, "AST pattern needs a template or a library name");
            }
            return astPatternRepository.findByName(spec.patternName())
                    .map(t -> Result.success(new Plan(spec, threshold, t, List.of())))
                    .orElseGet(() -> Result.failure(ErrorCode.PATTERN_NOT_FOUND,
                            "Unknown AST pattern: " + spec.patternName()));
        }

        if (spec.patternName() == null) {
            return Result.success(new Plan(spec, threshold, null, patternLibrary.findByType(spec.type())));
        }
        return patternLibrary.find(spec.patternName())
                .filter(d -> d.type() == spec.type())
                .map(d -> Result.success(new Plan(spec, threshold, null, List.of(d))))
                .orElseGet(() -> Result.failure(ErrorCode.PATTERN_NOT_FOUND,
                        "Unknown " + spec.type().name().toLowerCase() + " pattern: " + spec.patternName()));
    }

    private Result<List<PatternMatch>> matchModule(ModuleAnalysis module, Plan plan) {
        try {
            List<PatternMatch> candidates = plan.template() != null
                    ? matchTemplate(module, plan)
                    : matchDefinitions(module, plan);
            List<PatternMatch> accepted = candidates.stream()
                    .filter(m -> m.confidence() >= plan.threshold())
                    .sorted(Comparator.comparingDouble(PatternMatch::confidence).reversed())
                    .toList();
            log.debug("{}: {} of {} candidates at or above {}", module.name(), accepted.size(),
                    candidates.size(), plan.threshold());
            return Result.success(accepted);
        } catch (CancellationException e) {
            log.debug("Pattern matching on {} cancelled at the deadline", module.name());
            return Result.failure(ErrorCode.TIMEOUT, e.getMessage());
        } catch (RuntimeException e) {
            log.error("Pattern matching failed on module {}", module.name(), e);
            return Result.failure(AnalysisError.wrap(ErrorCode.INTERNAL_ERROR, e));
        }
    }

    private List<PatternMatch> matchTemplate(ModuleAnalysis module, Plan plan) {
        AstPatternTemplate template = plan.template();
        AstNode shape = template.template();
        boolean matchVariables = plan.spec().matchVariables() || template.matchVariables();
        return evaluator.matchTemplate(template.name(), shape, module, matchVariables, plan.spec().contextSensitive());
    }

    private List<PatternMatch> matchDefinitions(ModuleAnalysis module, Plan plan) {
        List<PatternMatch> matches = new ArrayList<>();
        for (PatternDefinition definition : plan.definitions()) {
            if (definition.scope() == PatternScope.MODULE) {
                checkNotCancelled();
                matches.add(evaluator.evaluate(definition, plan.spec().customRules(), PatternTarget.of(module)));
            } else {
                for (FunctionAnalysis function : module.functions()) {
                    checkNotCancelled();
                    matches.add(evaluator.evaluate(definition, plan.spec().customRules(),
                            PatternTarget.of(module, function)));
                }
            }
        }
        return matches;
    }

    private static void checkNotCancelled() {
        if (Thread.currentThread().isInterrupted()) {
            throw new CancellationException("Pattern matching cancelled");
        }
    }

    private static String describe(PatternSpec spec) {
        return spec.type() + (spec.patternName() != null ? ":" + spec.patternName() : "");
    }
}
