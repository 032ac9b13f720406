package com.vidnyan.cpg.domain.cpg;

public enum CpgEdgeType {
    AST_CHILD(SourceGraph.AST),
    CONTROL_FLOW(SourceGraph.CFG),
    DATA_FLOW(SourceGraph.DFG),
    /** Use evaluated while producing a definition's value. */
    DERIVES(SourceGraph.DFG),
    PHI(SourceGraph.DFG),
    CORRESPONDS_TO(SourceGraph.CROSS),
    INFLUENCES(SourceGraph.CROSS),
    ALIAS(SourceGraph.CROSS);

    private final SourceGraph sourceGraph;

    CpgEdgeType(SourceGraph sourceGraph) {
        this.sourceGraph = sourceGraph;
    }

    public SourceGraph sourceGraph() {
        return sourceGraph;
    }

    public String relationshipName() {
        return name().toLowerCase();
    }
}
