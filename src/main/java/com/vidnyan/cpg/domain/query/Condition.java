package com.vidnyan.cpg.domain.query;

import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import java.util.stream.Collectors;

/**
 * Boolean tree over field comparisons evaluated against one relation row.
 */
public interface Condition {

    boolean test(Map<String, Object> row);

    int selectivity();

    /** Number of expensive operators in this subtree. */
    int expensiveOperations();

    /** Stable textual form used for cache keys and log output. */
    String canonical();

    static Condition where(String field, Operator operator, Object value) {
        return new Comparison(field, operator, value);
    }

    static Condition and(Condition... conditions) {
        return new And(Arrays.asList(conditions));
    }

    static Condition or(Condition... conditions) {
        return new Or(Arrays.asList(conditions));
    }

    static Condition not(Condition condition) {
        return new Not(condition);
    }

    record Comparison(String field, Operator operator, Object value) implements Condition {

        @Override
        public boolean test(Map<String, Object> row) {
            Object actual = row.get(field);
            return switch (operator) {
                case EQ -> Values.equal(actual, value);
                case NE -> !Values.equal(actual, value);
                case GT -> actual != null && Values.compare(actual, value) > 0;
                case LT -> actual != null && Values.compare(actual, value) < 0;
                case GTE -> actual != null && Values.compare(actual, value) >= 0;
                case LTE -> actual != null && Values.compare(actual, value) <= 0;
                case IN -> Values.memberOf(actual, (Collection<?>) value);
                case NOT_IN -> !Values.memberOf(actual, (Collection<?>) value);
                case CONTAINS -> Values.contains(actual, value);
                case NOT_CONTAINS -> !Values.contains(actual, value);
                case MATCHES -> actual instanceof String text && matches(text, String.valueOf(value));
                case SIMILAR_TO -> actual != null
                        && StringSimilarity.score(actual.toString(), String.valueOf(value))
                        >= StringSimilarity.DEFAULT_THRESHOLD;
                case SIMILARITY_THRESHOLD -> similarEnough(actual);
                case IS_NIL -> actual == null;
                case NOT_NIL -> actual != null;
            };
        }

        private boolean similarEnough(Object actual) {
            if (actual == null || !(value instanceof List<?> pair) || pair.size() != 2) {
                return false;
            }
            double minimum = ((Number) pair.get(1)).doubleValue();
            return StringSimilarity.score(actual.toString(), String.valueOf(pair.get(0))) >= minimum;
        }

        private static boolean matches(String text, String regex) {
            try {
                return Pattern.compile(regex).matcher(text).find();
            } catch (PatternSyntaxException e) {
                return false;
            }
        }

        @Override
        public int selectivity() {
            return operator.selectivity();
        }

        @Override
        public int expensiveOperations() {
            return operator.isExpensive() ? 1 : 0;
        }

        @Override
        public String canonical() {
            return operator.takesValue()
                    ? "(" + field + " " + operator.wireName() + " " + Values.canonical(value) + ")"
                    : "(" + field + " " + operator.wireName() + ")";
        }
    }

    record And(List<Condition> conditions) implements Condition {
        public And {
            conditions = QuerySpec.copyOf(conditions);
        }

        @Override
        public boolean test(Map<String, Object> row) {
            return conditions.stream().allMatch(c -> c.test(row));
        }

        @Override
        public int selectivity() {
            return 7;
        }

        @Override
        public int expensiveOperations() {
            return conditions.stream().mapToInt(Condition::expensiveOperations).sum();
        }

        @Override
        public String canonical() {
            return conditions.stream().map(Condition::canonical).collect(Collectors.joining(" and ", "(", ")"));
        }
    }

    record Or(List<Condition> conditions) implements Condition {
        public Or {
            conditions = QuerySpec.copyOf(conditions);
        }

        @Override
        public boolean test(Map<String, Object> row) {
            return conditions.stream().anyMatch(c -> c.test(row));
        }

        @Override
        public int selectivity() {
            return 3;
        }

        @Override
        public int expensiveOperations() {
            return conditions.stream().mapToInt(Condition::expensiveOperations).sum();
        }

        @Override
        public String canonical() {
            return conditions.stream().map(Condition::canonical).collect(Collectors.joining(" or ", "(", ")"));
        }
    }

    record Not(Condition condition) implements Condition {
        public Not {
            Objects.requireNonNull(condition, "condition");
        }

        @Override
        public boolean test(Map<String, Object> row) {
            return !condition.test(row);
        }

        @Override
        public int selectivity() {
            return 2;
        }

        @Override
        public int expensiveOperations() {
            return condition.expensiveOperations();
        }

        @Override
        public String canonical() {
            return "(not " + condition.canonical() + ")";
        }
    }
}
