package com.vidnyan.cpg.domain.query;

import com.vidnyan.cpg.domain.common.Result;
import org.springframework.util.DigestUtils;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Turns a submitted query into an executable plan.
 * <p>
 * Cost = relation base cost + 20 per where condition + 40 per join + 80 per expensive operator
 * + 15 per order-by field. Where conditions are reordered by descending selectivity, an
 * automatic limit is applied to expensive unbounded queries, and the cache key is the md5 of
 * the normalized plan.
 */
public class QueryOptimizer {

    public static final int CONDITION_COST = 20;
    public static final int JOIN_COST = 40;
    public static final int EXPENSIVE_OPERATOR_COST = 80;
    public static final int ORDER_COST = 15;

    static final int LIMIT_HINT_COST = 80;
    static final int HIGH_COST = 120;
    static final int INDEX_HINT_CONDITIONS = 3;

    static final String LIMIT_HINT = "Consider adding a LIMIT clause to reduce memory usage";
    static final String INDEX_HINT = "Complex WHERE conditions detected - ensure proper indexing";
    static final String CACHE_HINT = "High-cost query detected - results will be cached";

    private final int autoLimit;

    public QueryOptimizer(int autoLimit) {
        this.autoLimit = autoLimit;
    }

    public Result<QueryPlan> plan(QuerySpec spec) {
        return QueryValidator.validate(spec).map(relation -> optimize(spec, relation));
    }

    private QueryPlan optimize(QuerySpec spec, Relation relation) {
        int cost = estimateCost(spec, relation);

        List<String> hints = new ArrayList<>();
        if (spec.limit() == null && cost > LIMIT_HINT_COST) {
            hints.add(LIMIT_HINT);
        }
        if (spec.where().size() >= INDEX_HINT_CONDITIONS) {
            hints.add(INDEX_HINT);
        }
        if (cost > HIGH_COST) {
            hints.add(CACHE_HINT);
        }

        Integer limit = spec.limit();
        if (limit == null && cost > HIGH_COST) {
            limit = autoLimit;
        }

        List<Condition> ordered = spec.where().stream()
                .sorted(Comparator.comparingInt(Condition::selectivity).reversed())
                .toList();
        List<String> select = spec.selectsAll() ? List.of() : spec.select();
        int offset = spec.offset() == null ? 0 : spec.offset();

        String key = cacheKey(relation, select, ordered, spec.orderBy(), limit, offset, spec.joins());
        return new QueryPlan(select, relation, ordered, spec.orderBy(), limit, offset, spec.joins(), cost, key, hints);
    }

    static int estimateCost(QuerySpec spec, Relation relation) {
        int expensive = spec.where().stream().mapToInt(Condition::expensiveOperations).sum();
        return relation.baseCost()
                + spec.where().size() * CONDITION_COST
                + spec.joins().size() * JOIN_COST
                + expensive * EXPENSIVE_OPERATOR_COST
                + spec.orderBy().size() * ORDER_COST;
    }

    private static String cacheKey(Relation relation, List<String> select, List<Condition> where,
                                   List<OrderBy> orderBy, Integer limit, int offset, List<String> joins) {
        String normalized = "from=" + relation.wireName()
                + ";select=" + (select.isEmpty() ? "*" : String.join(",", select))
                + ";where=" + where.stream().map(Condition::canonical).collect(Collectors.joining("&"))
                + ";order=" + orderBy.stream().map(OrderBy::canonical).collect(Collectors.joining(","))
                + ";limit=" + limit
                + ";offset=" + offset
                + ";joins=" + String.join(",", joins);
        return DigestUtils.md5DigestAsHex(normalized.getBytes(StandardCharsets.UTF_8));
    }
}
