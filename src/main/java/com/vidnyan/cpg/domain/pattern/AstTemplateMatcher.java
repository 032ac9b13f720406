package com.vidnyan.cpg.domain.pattern;

import com.vidnyan.cpg.domain.ast.AstKind;
import com.vidnyan.cpg.domain.ast.AstNode;
import com.vidnyan.cpg.domain.ast.AstPrinter;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Scores how well a syntax node fits a template.
 * Template syntax: {@code _} matches anything, {@code $name} is a binding variable,
 * any other node must agree on kind, name, qualifier, value and operator.
 */
public final class AstTemplateMatcher {

    private static final String BINDING_PREFIX = "$";

    private AstTemplateMatcher() {
    }

    public record TemplateMatch(double confidence, Map<String, String> bindings) {

        public boolean isExact() {
            return confidence >= 1.0;
        }
    }

    /**
     * @return the fraction of template nodes satisfied, or 0 when the root kinds differ
     */
    public static TemplateMatch match(AstNode template, AstNode node, boolean matchVariables) {
        if (!isHole(template) && template.kind() != node.kind()) {
            return new TemplateMatch(0.0, Map.of());
        }
        Map<String, AstNode> bindings = new HashMap<>();
        int[] score = new int[2];
        compare(template, node, matchVariables, bindings, score);
        Map<String, String> rendered = new HashMap<>();
        bindings.forEach((name, bound) -> rendered.put(name, AstPrinter.render(bound)));
        return new TemplateMatch(score[1] == 0 ? 0.0 : (double) score[0] / score[1], rendered);
    }

    private static void compare(AstNode template, AstNode node, boolean matchVariables,
                                Map<String, AstNode> bindings, int[] score) {
        score[1]++;
        if (template.isWildcard()) {
            score[0]++;
            return;
        }
        if (isBinding(template)) {
            if (!matchVariables) {
                score[0]++;
                return;
            }
            AstNode bound = bindings.putIfAbsent(template.name(), node);
            if (bound == null || structurallyEqual(bound, node)) {
                score[0]++;
            }
            return;
        }
        if (!sameHead(template, node)) {
            score[1] += size(template) - 1;
            return;
        }
        score[0]++;
        int shared = Math.min(template.children().size(), node.children().size());
        for (int i = 0; i < shared; i++) {
            compare(template.child(i), node.child(i), matchVariables, bindings, score);
        }
        for (int i = shared; i < template.children().size(); i++) {
            score[1] += size(template.child(i));
        }
        // surplus children on the candidate count as one miss
        if (node.children().size() > template.children().size()) {
            score[1]++;
        }
    }

    private static boolean sameHead(AstNode template, AstNode node) {
        return template.kind() == node.kind()
                && Objects.equals(template.name(), node.name())
                && Objects.equals(template.qualifier(), node.qualifier())
                && Objects.equals(template.value(), node.value())
                && Objects.equals(template.operator(), node.operator());
    }

    static boolean structurallyEqual(AstNode a, AstNode b) {
        if (!sameHead(a, b) || a.children().size() != b.children().size()) {
            return false;
        }
        for (int i = 0; i < a.children().size(); i++) {
            if (!structurallyEqual(a.child(i), b.child(i))) {
                return false;
            }
        }
        return true;
    }

    private static boolean isHole(AstNode template) {
        return template.isWildcard() || isBinding(template);
    }

    private static boolean isBinding(AstNode template) {
        return template.is(AstKind.VARIABLE) && template.name() != null && template.name().startsWith(BINDING_PREFIX);
    }

    private static int size(AstNode node) {
        return (int) node.stream().count();
    }
}
