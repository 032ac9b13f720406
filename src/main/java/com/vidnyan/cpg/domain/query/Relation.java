package com.vidnyan.cpg.domain.query;

import java.util.Arrays;
import java.util.Optional;

/**
 * Queryable relations with their base scan cost.
 */
public enum Relation {
    FUNCTIONS("functions", 60),
    MODULES("modules", 35),
    PATTERNS("patterns", 120);

    private final String wireName;
    private final int baseCost;

    Relation(String wireName, int baseCost) {
        this.wireName = wireName;
        this.baseCost = baseCost;
    }

    public String wireName() {
        return wireName;
    }

    public int baseCost() {
        return baseCost;
    }

    public static Optional<Relation> fromName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String normalized = name.trim().toLowerCase();
        return Arrays.stream(values())
                .filter(r -> r.wireName.equals(normalized))
                .findFirst();
    }
}
