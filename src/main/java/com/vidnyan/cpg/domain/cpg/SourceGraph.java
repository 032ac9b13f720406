package com.vidnyan.cpg.domain.cpg;

/**
 * Graph a node representation or an edge originates from. {@code CROSS} marks synthesized links.
 */
public enum SourceGraph {
    AST,
    CFG,
    DFG,
    CROSS
}
