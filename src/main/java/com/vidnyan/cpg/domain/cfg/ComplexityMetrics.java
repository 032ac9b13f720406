package com.vidnyan.cpg.domain.cfg;

/**
 * Complexity figures derived from one function's control-flow graph.
 */
public record ComplexityMetrics(
    int cyclomatic,
    int cognitive,
    int essential,
    int decisionPoints,
    int patternMatchCount,
    int guardCount,
    int maxPipeChain,
    int nestingDepth,
    int unreachableNodes,
    double maintainability
) {

    /**
     * Maintainability score in [0, 100]; falls with branching, cognitive load and nesting.
     */
    public static double maintainability(int cyclomatic, int cognitive, int nestingDepth) {
        return Math.max(0.0, 100.0 - 2.0 * cyclomatic - cognitive - 5.0 * nestingDepth);
    }
}
