package com.vidnyan.cpg.domain.pattern;

import com.vidnyan.cpg.domain.analysis.FunctionAnalysis;
import com.vidnyan.cpg.domain.analysis.ModuleAnalysis;
import com.vidnyan.cpg.domain.ast.AstIndex;
import com.vidnyan.cpg.domain.ast.AstKind;
import com.vidnyan.cpg.domain.ast.AstNode;
import com.vidnyan.cpg.domain.ast.AstPrinter;
import com.vidnyan.cpg.domain.cfg.CfgNode;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Evaluates pattern definitions and structural templates against analyzed code.
 * Confidence of a library pattern is the fraction of its predicates that hold.
 */
@Slf4j
public class PatternEvaluator {

    /**
     * Score one definition against one target. A predicate that throws counts as not satisfied.
     */
    public PatternMatch evaluate(PatternDefinition definition, List<PatternRule.Named> extraRules,
                                 PatternTarget target) {
        List<PatternRule.Named> rules = new ArrayList<>(definition.rules());
        rules.addAll(extraRules);

        List<String> satisfied = new ArrayList<>();
        List<String> failed = new ArrayList<>();
        List<String> errored = new ArrayList<>();
        for (PatternRule.Named rule : rules) {
            try {
                if (rule.rule().test(target)) {
                    satisfied.add(rule.name());
                } else {
                    failed.add(rule.name());
                }
            } catch (RuntimeException e) {
                log.warn("Rule {} of pattern {} failed on {}: {}",
                        rule.name(), definition.name(), target.describe(), e.getMessage());
                errored.add(rule.name());
            }
        }
        double confidence = rules.isEmpty() ? 0.0 : (double) satisfied.size() / rules.size();

        Map<String, Object> metadata = new LinkedHashMap<>(definition.metadata());
        metadata.put("target", target.describe());
        putIfPresent(metadata, "description", definition.description());
        putIfPresent(metadata, "category", definition.category());
        metadata.put("satisfied_rules", satisfied);
        metadata.put("failed_rules", failed);
        if (!errored.isEmpty()) {
            metadata.put("errored_rules", errored);
        }
        return new PatternMatch(target.location(), definition.name(), definition.type(), confidence,
                definition.severity(), definition.suggestions(), metadata);
    }

    /**
     * Every node in the module's functions whose kind matches the template root, scored against the template.
     */
    public List<PatternMatch> matchTemplate(String patternName, AstNode template, ModuleAnalysis module,
                                            boolean matchVariables, boolean contextSensitive) {
        List<PatternMatch> matches = new ArrayList<>();
        for (FunctionAnalysis function : module.functions()) {
            AstIndex index = contextSensitive ? AstIndex.of(function.ast()) : null;
            Set<String> unreachableAst = contextSensitive ? unreachableAstNodes(function) : Set.of();
            function.ast().stream().forEach(node -> {
                AstTemplateMatcher.TemplateMatch scored = AstTemplateMatcher.match(template, node, matchVariables);
                if (scored.confidence() <= 0.0 || unreachableAst.contains(node.id())) {
                    return;
                }
                Map<String, Object> metadata = new LinkedHashMap<>();
                metadata.put("function", function.id());
                metadata.put("ast_node_id", node.id());
                metadata.put("matched", AstPrinter.render(node));
                if (!scored.bindings().isEmpty()) {
                    metadata.put("bindings", scored.bindings());
                }
                if (index != null) {
                    metadata.put("context", enclosingConstruct(index, node));
                }
                matches.add(new PatternMatch(node.location(), patternName, PatternType.AST, scored.confidence(),
                        Severity.INFO, List.of(), metadata));
            });
        }
        return matches;
    }

    private static void putIfPresent(Map<String, Object> metadata, String key, Object value) {
        if (value != null) {
            metadata.put(key, value);
        }
    }

    private static String enclosingConstruct(AstIndex index, AstNode node) {
        return index.ancestorsOf(node.id()).stream()
                .filter(a -> a.kind().isBranching() || a.is(AstKind.FN)
                        || a.is(AstKind.COMPREHENSION))
                .findFirst()
                .map(a -> a.kind().name().toLowerCase())
                .orElse("function_body");
    }

    private static Set<String> unreachableAstNodes(FunctionAnalysis function) {
        Set<String> reachable = function.cfg().reachableFromEntry();
        Set<String> dead = new HashSet<>();
        for (CfgNode node : function.cfg().nodes()) {
            if (!reachable.contains(node.id())) {
                function.ast().stream()
                        .filter(a -> a.id().equals(node.astNodeId()))
                        .findFirst()
                        .ifPresent(a -> a.stream().forEach(d -> dead.add(d.id())));
            }
        }
        return dead;
    }
}
