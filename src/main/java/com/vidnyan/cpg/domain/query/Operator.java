package com.vidnyan.cpg.domain.query;

import java.util.Arrays;
import java.util.Optional;

/**
 * Comparison operators of a where clause.
 * Selectivity ranks how strongly an operator narrows a relation; higher runs first.
 */
public enum Operator {
    EQ("eq", 10),
    NE("ne", 1),
    GT("gt", 6),
    LT("lt", 6),
    GTE("gte", 5),
    LTE("lte", 5),
    IN("in", 8),
    NOT_IN("not_in", 1),
    CONTAINS("contains", 4),
    NOT_CONTAINS("not_contains", 1),
    MATCHES("matches", 3),
    SIMILAR_TO("similar_to", 2),
    SIMILARITY_THRESHOLD("similarity_threshold", 2),
    IS_NIL("nil", 0),
    NOT_NIL("not_nil", 0);

    private final String wireName;
    private final int selectivity;

    Operator(String wireName, int selectivity) {
        this.wireName = wireName;
        this.selectivity = selectivity;
    }

    public String wireName() {
        return wireName;
    }

    public int selectivity() {
        return selectivity;
    }

    /** Operators that need per-row text analysis and carry an extra cost. */
    public boolean isExpensive() {
        return this == SIMILAR_TO || this == MATCHES || this == SIMILARITY_THRESHOLD;
    }

    public boolean takesValue() {
        return this != IS_NIL && this != NOT_NIL;
    }

    public static Optional<Operator> fromName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String normalized = name.trim().toLowerCase();
        return Arrays.stream(values())
                .filter(op -> op.wireName.equals(normalized) || op.name().equalsIgnoreCase(normalized))
                .findFirst();
    }
}
