package com.vidnyan.cpg.domain.pattern;

public enum PatternType {
    /** Structural template over syntax nodes. */
    AST,
    /** Named library pattern describing intended behaviour, such as an OTP server. */
    BEHAVIORAL,
    /** Named library pattern describing a smell, performance or security issue. */
    ANTI_PATTERN
}
