package com.vidnyan.cpg.domain.pattern;

/**
 * Granularity a library pattern is evaluated at.
 */
public enum PatternScope {
    MODULE,
    FUNCTION
}
