package com.vidnyan.cpg.domain.query;

import com.vidnyan.cpg.domain.common.ErrorCode;
import com.vidnyan.cpg.domain.common.Result;

import java.util.Collection;
import java.util.List;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Rejects malformed queries before any relation is touched.
 * Clauses are checked in order: from, select, where, order by, limit/offset.
 */
public final class QueryValidator {

    private QueryValidator() {
    }

    public static Result<Relation> validate(QuerySpec spec) {
        if (spec == null) {
            return Result.failure(ErrorCode.INVALID_FROM_CLAUSE, "query is null");
        }
        Relation relation = Relation.fromName(spec.from()).orElse(null);
        if (relation == null) {
            return Result.failure(ErrorCode.INVALID_FROM_CLAUSE, "unknown relation: " + spec.from());
        }
        if (!spec.selectsAll() && spec.select().stream().anyMatch(f -> f == null || f.isBlank() || "*".equals(f))) {
            return Result.failure(ErrorCode.INVALID_SELECT_CLAUSE, "select fields must be named: " + spec.select());
        }
        for (Condition condition : spec.where()) {
            String problem = problemWith(condition);
            if (problem != null) {
                return Result.failure(ErrorCode.INVALID_WHERE_CONDITION, problem);
            }
        }
        for (OrderBy order : spec.orderBy()) {
            if (order == null || order.field() == null || order.field().isBlank() || order.direction() == null) {
                return Result.failure(ErrorCode.INVALID_ORDER_BY_CLAUSE, "order by needs a field and a direction");
            }
        }
        if (spec.limit() != null && spec.limit() < 0) {
            return Result.failure(ErrorCode.INVALID_LIMIT, "limit must not be negative: " + spec.limit());
        }
        if (spec.offset() != null && spec.offset() < 0) {
            return Result.failure(ErrorCode.INVALID_LIMIT, "offset must not be negative: " + spec.offset());
        }
        return Result.success(relation);
    }

    /** Description of what is wrong with a condition, or null when it is well formed. */
    static String problemWith(Condition condition) {
        if (condition == null) {
            return "null condition";
        }
        if (condition instanceof Condition.And and) {
            return problemWithAll(and.conditions(), "and");
        }
        if (condition instanceof Condition.Or or) {
            return problemWithAll(or.conditions(), "or");
        }
        if (condition instanceof Condition.Not not) {
            return problemWith(not.condition());
        }
        if (condition instanceof Condition.Comparison comparison) {
            return problemWithComparison(comparison);
        }
        return "unsupported condition type " + condition.getClass().getSimpleName();
    }

    private static String problemWithAll(List<Condition> conditions, String operator) {
        if (conditions.isEmpty()) {
            return operator + " needs at least one condition";
        }
        for (Condition child : conditions) {
            String problem = problemWith(child);
            if (problem != null) {
                return problem;
            }
        }
        return null;
    }

    private static String problemWithComparison(Condition.Comparison comparison) {
        if (comparison.field() == null || comparison.field().isBlank()) {
            return "condition without a field";
        }
        Operator operator = comparison.operator();
        if (operator == null) {
            return "condition on " + comparison.field() + " without an operator";
        }
        Object value = comparison.value();
        if (operator.takesValue() && value == null) {
            return operator.wireName() + " on " + comparison.field() + " needs a value";
        }
        switch (operator) {
            case IN, NOT_IN -> {
                if (!(value instanceof Collection<?>)) {
                    return operator.wireName() + " needs a list of values";
                }
            }
            case MATCHES -> {
                try {
                    Pattern.compile(String.valueOf(value));
                } catch (PatternSyntaxException e) {
                    return "invalid regular expression: " + e.getDescription();
                }
            }
            case SIMILARITY_THRESHOLD -> {
                if (!(value instanceof List<?> pair) || pair.size() != 2 || !(pair.get(1) instanceof Number minimum)) {
                    return "similarity_threshold needs [target, minimum]";
                }
                double threshold = minimum.doubleValue();
                if (threshold < 0.0 || threshold > 1.0) {
                    return "similarity threshold out of range: " + threshold;
                }
            }
            default -> {
                // value shape is free for the remaining operators
            }
        }
        return null;
    }
}
