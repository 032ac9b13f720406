package com.vidnyan.cpg.domain.query;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

/**
 * Applies a plan to the rows of its relation: filter, order, offset/limit, projection, in that order.
 */
public final class QueryExecutor {

    private QueryExecutor() {
    }

    public record Rows(List<Map<String, Object>> data, int totalCount) {
        public Rows {
            data = List.copyOf(data);
        }
    }

    public static Rows execute(QueryPlan plan, List<Map<String, Object>> relation) {
        List<Map<String, Object>> filtered = relation.stream()
                .filter(row -> plan.where().stream().allMatch(c -> c.test(row)))
                .toList();

        Stream<Map<String, Object>> stream = filtered.stream();
        Comparator<Map<String, Object>> ordering = ordering(plan.orderBy());
        if (ordering != null) {
            stream = stream.sorted(ordering);
        }
        stream = stream.skip(plan.offset());
        if (plan.limit() != null) {
            stream = stream.limit(plan.limit());
        }
        List<Map<String, Object>> page = stream.map(row -> project(row, plan)).toList();
        return new Rows(page, filtered.size());
    }

    private static Comparator<Map<String, Object>> ordering(List<OrderBy> orderBy) {
        Comparator<Map<String, Object>> combined = null;
        for (OrderBy order : orderBy) {
            Comparator<Map<String, Object>> next = Comparator.comparing(
                    (Map<String, Object> row) -> row.get(order.field()),
                    order.direction() == OrderBy.Direction.DESC ? descendingNullsLast() : Values.NULLS_LAST);
            combined = combined == null ? next : combined.thenComparing(next);
        }
        return combined;
    }

    private static Comparator<Object> descendingNullsLast() {
        return (a, b) -> {
            if (a == null || b == null) {
                return Values.NULLS_LAST.compare(a, b);
            }
            return Values.compare(b, a);
        };
    }

    private static Map<String, Object> project(Map<String, Object> row, QueryPlan plan) {
        if (plan.selectsAll()) {
            return row;
        }
        Map<String, Object> projected = new LinkedHashMap<>();
        for (String field : plan.select()) {
            if (row.containsKey(field)) {
                projected.put(field, row.get(field));
            }
        }
        return projected;
    }
}
