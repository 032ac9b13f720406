package com.vidnyan.cpg.domain.cache;

/**
 * Memory pressure levels, each strictly more aggressive than the previous one:
 * <ol>
 *   <li>clear the query cache</li>
 *   <li>also compress rarely used analysis entries</li>
 *   <li>also compress query and analysis caches and evict stale module data</li>
 *   <li>clear every cache, evict recently unused module data and request a collection</li>
 * </ol>
 */
public enum PressureLevel {
    NONE(0),
    ELEVATED(1),
    HIGH(2),
    SEVERE(3),
    CRITICAL(4);

    private final int level;

    PressureLevel(int level) {
        this.level = level;
    }

    public int level() {
        return level;
    }

    public static PressureLevel of(int level) {
        for (PressureLevel candidate : values()) {
            if (candidate.level == level) {
                return candidate;
            }
        }
        throw new IllegalArgumentException("Unknown pressure level: " + level);
    }

    public boolean atLeast(PressureLevel other) {
        return level >= other.level;
    }
}
