package com.vidnyan.cpg.domain.cache;

/**
 * Named caches, cheapest to rebuild first.
 */
public enum CacheType {
    QUERY,
    ANALYSIS,
    CPG
}
