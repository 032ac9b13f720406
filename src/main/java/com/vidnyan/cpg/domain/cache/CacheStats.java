package com.vidnyan.cpg.domain.cache;

public record CacheStats(
        CacheType type,
        int size,
        long hits,
        long misses,
        long evictions,
        int compressed
) {
    public double hitRate() {
        long lookups = hits + misses;
        return lookups == 0 ? 0.0 : (double) hits / lookups;
    }
}
