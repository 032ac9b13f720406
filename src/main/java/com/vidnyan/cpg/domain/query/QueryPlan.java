package com.vidnyan.cpg.domain.query;

import java.util.List;

/**
 * Validated, cost-estimated and optimized query ready for execution.
 */
public record QueryPlan(
        List<String> select,
        Relation relation,
        List<Condition> where,
        List<OrderBy> orderBy,
        Integer limit,
        int offset,
        List<String> joins,
        int estimatedCost,
        String cacheKey,
        List<String> hints
) {
    public QueryPlan {
        select = List.copyOf(select);
        where = List.copyOf(where);
        orderBy = List.copyOf(orderBy);
        joins = List.copyOf(joins);
        hints = List.copyOf(hints);
    }

    public boolean selectsAll() {
        return select.isEmpty();
    }
}
