package com.vidnyan.cpg.domain.pattern;

/**
 * One independent boolean check of a pattern definition.
 */
@FunctionalInterface
public interface PatternRule {

    boolean test(PatternTarget target);

    /**
     * Rule paired with the name reported in match metadata.
     */
    record Named(String name, PatternRule rule) {

        public static Named of(String name, PatternRule rule) {
            return new Named(name, rule);
        }
    }
}
