package com.vidnyan.cpg.domain.common;

/**
 * Failure description carried by a failed {@link Result}.
 */
public record AnalysisError(
    ErrorCode code,
    String message,
    Throwable cause
) {

    public static AnalysisError of(ErrorCode code, String message) {
        return new AnalysisError(code, message, null);
    }

    public static AnalysisError wrap(ErrorCode code, Throwable cause) {
        return new AnalysisError(code, cause.getMessage() != null ? cause.getMessage() : cause.toString(), cause);
    }

    public boolean isRetryable() {
        return code.isRetryable();
    }

    public String format() {
        return code.wireName() + ": " + message;
    }
}
