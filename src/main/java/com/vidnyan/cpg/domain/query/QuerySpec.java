package com.vidnyan.cpg.domain.query;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Declarative query as submitted by a caller, before validation.
 * An empty select list, or a single {@code *}, selects every field. Null clause entries are
 * rejected by {@link QueryValidator}, not here.
 */
public record QuerySpec(
        List<String> select,
        String from,
        List<Condition> where,
        List<OrderBy> orderBy,
        Integer limit,
        Integer offset,
        List<String> joins
) {
    public QuerySpec {
        select = copyOf(select);
        where = copyOf(where);
        orderBy = copyOf(orderBy);
        joins = copyOf(joins);
    }

    /** Null elements are kept so that validation can report the clause they appear in. */
    static <T> List<T> copyOf(List<T> list) {
        return list == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(list));
    }

    public static Builder from(String relation) {
        return new Builder(relation);
    }

    public boolean selectsAll() {
        return select.isEmpty() || (select.size() == 1 && "*".equals(select.get(0)));
    }

    public static class Builder {
        private final String from;
        private final List<String> select = new ArrayList<>();
        private final List<Condition> where = new ArrayList<>();
        private final List<OrderBy> orderBy = new ArrayList<>();
        private final List<String> joins = new ArrayList<>();
        private Integer limit;
        private Integer offset;

        private Builder(String from) {
            this.from = from;
        }

        public Builder select(String... fields) {
            select.addAll(List.of(fields));
            return this;
        }

        public Builder where(Condition condition) {
            where.add(condition);
            return this;
        }

        public Builder where(String field, Operator operator, Object value) {
            return where(Condition.where(field, operator, value));
        }

        public Builder orderBy(OrderBy order) {
            orderBy.add(order);
            return this;
        }

        public Builder join(String relation) {
            joins.add(relation);
            return this;
        }

        public Builder limit(Integer limit) {
            this.limit = limit;
            return this;
        }

        public Builder offset(Integer offset) {
            this.offset = offset;
            return this;
        }

        public QuerySpec build() {
            return new QuerySpec(select, from, where, orderBy, limit, offset, joins);
        }
    }
}
