package com.vidnyan.cpg.domain.cfg;

/**
 * Branching construct behind a decision-point node, with its cognitive weight.
 */
public enum DecisionKind {
    CASE(1),
    IF(1),
    COND(2),
    WITH(1),
    TRY(1),
    RECEIVE(1),
    GUARD(1),
    FUNCTION_CLAUSE(1);

    private final int cognitiveWeight;

    DecisionKind(int cognitiveWeight) {
        this.cognitiveWeight = cognitiveWeight;
    }

    public int cognitiveWeight() {
        return cognitiveWeight;
    }
}
