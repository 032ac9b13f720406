package com.vidnyan.cpg.domain.dfg;

/**
 * Defect found in the analyzed program. Not a failure of the analysis itself.
 */
public record Diagnostic(
    Kind kind,
    String variable,
    String astNodeId,
    int line,
    String message
) {

    public enum Kind {
        UNDEFINED_VARIABLE,
        UNUSED_DEFINITION
    }
}
