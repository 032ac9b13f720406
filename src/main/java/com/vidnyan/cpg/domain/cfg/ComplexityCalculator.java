package com.vidnyan.cpg.domain.cfg;

import com.vidnyan.cpg.domain.ast.AstKind;
import com.vidnyan.cpg.domain.ast.AstNode;
import com.vidnyan.cpg.domain.ast.PatternShapes;

import java.util.Set;

/**
 * Computes {@link ComplexityMetrics} from a finished graph and the function it was built from.
 */
public final class ComplexityCalculator {

    private ComplexityCalculator() {
    }

    public static ComplexityMetrics compute(ControlFlowGraph graph, AstNode function, String errorExitId,
                                            int nestingDepth) {
        int decisionPoints = graph.decisionPoints().size();
        // one decision point adds one independent path however many edges it emits
        int cyclomatic = decisionPoints + 1;

        int cognitive = graph.decisionPoints().stream()
                .mapToInt(n -> n.decisionKind().cognitiveWeight() + n.nesting())
                .sum();

        int essential = 1;
        if (errorExitId != null) {
            Set<String> reachesError = graph.backwardClosure(errorExitId);
            essential += (int) graph.decisionPoints().stream()
                    .filter(d -> d.successors().stream().anyMatch(reachesError::contains))
                    .count();
        }

        Set<String> reachable = graph.reachableFromEntry();
        int unreachable = (int) graph.nodes().stream()
                .filter(n -> n.type() != CfgNodeType.ENTRY && n.type() != CfgNodeType.EXIT)
                .filter(n -> !reachable.contains(n.id()))
                .count();

        int patternMatches = (int) function.stream().filter(ComplexityCalculator::isPatternMatchSite).count()
                + (int) function.stream()
                        .filter(n -> n.is(AstKind.PARAMETERS))
                        .flatMap(p -> p.children().stream())
                        .filter(PatternShapes::isRefutable)
                        .count();
        int guards = (int) function.stream().filter(n -> n.is(AstKind.GUARD)).count();
        int maxPipe = function.stream().mapToInt(ComplexityCalculator::pipeChainLength).max().orElse(0);

        return new ComplexityMetrics(
                cyclomatic,
                cognitive,
                essential,
                decisionPoints,
                patternMatches,
                guards,
                maxPipe,
                nestingDepth,
                unreachable,
                ComplexityMetrics.maintainability(cyclomatic, cognitive, nestingDepth)
        );
    }

    private static boolean isPatternMatchSite(AstNode node) {
        return switch (node.kind()) {
            case CASE, RECEIVE -> false;
            case CLAUSE -> !node.child(0).is(AstKind.PARAMETERS);
            case CATCH_CLAUSE, GENERATOR -> true;
            case ASSIGNMENT -> PatternShapes.isDestructuring(node.child(0));
            default -> false;
        };
    }

    static int pipeChainLength(AstNode node) {
        int length = 0;
        AstNode current = node;
        while (current.is(AstKind.PIPE)) {
            length++;
            current = current.child(0);
        }
        return length;
    }
}
