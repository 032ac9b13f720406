package com.vidnyan.cpg.domain.runtime;

import com.vidnyan.cpg.domain.ast.AstNode;
import com.vidnyan.cpg.domain.pattern.AstTemplateMatcher;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Fires when the code at an event's position has the shape of {@code pattern}.
 *
 * @param astPath ancestor kinds (lower case) that must appear, in order, above the matched node
 */
public record StructuralBreakpoint(
        String id,
        AstNode pattern,
        BreakpointCondition condition,
        List<String> astPath,
        boolean enabled,
        Map<String, Object> metadata
) {
    public StructuralBreakpoint {
        astPath = List.copyOf(astPath);
        metadata = Map.copyOf(metadata);
    }

    /** The matched AST node, when the breakpoint fires for this context. */
    public Optional<AstNode> evaluate(RuntimeContext context) {
        if (!enabled || !condition.test(context.localVariables())) {
            return Optional.empty();
        }
        AstContext ast = context.astContext();
        Optional<AstNode> anchor = ast.getAstNode();
        if (anchor.isEmpty() || !Paths.containsInOrder(ast.astPath(), astPath)) {
            return Optional.empty();
        }
        return anchor.get().stream()
                .filter(n -> n == anchor.get() || n.line() == ast.getLine())
                .filter(n -> AstTemplateMatcher.match(pattern, n, true).isExact())
                .findFirst();
    }
}
