package com.vidnyan.cpg.domain.cfg;

/**
 * Possible transition between two control points.
 * Probabilities out of one node are independent estimates and need not sum to 1.
 */
public record CfgEdge(
    String from,
    String to,
    CfgEdgeType type,
    String condition,
    double probability
) {

    public CfgEdge {
        if (probability < 0.0 || probability > 1.0) {
            throw new IllegalArgumentException("Edge probability out of range: " + probability);
        }
    }
}
