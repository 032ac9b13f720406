package com.vidnyan.cpg.domain.common;

/**
 * Raised inside builders when an AST has a shape they cannot handle.
 * Builders convert it to a failed {@link Result} at their boundary.
 */
public class AnalysisException extends RuntimeException {

    private final ErrorCode code;

    public AnalysisException(ErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    public AnalysisException(ErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public ErrorCode getCode() {
        return code;
    }
}
