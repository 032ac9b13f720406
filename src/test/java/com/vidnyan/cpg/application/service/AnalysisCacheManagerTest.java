package com.vidnyan.cpg.application.service;

import com.vidnyan.cpg.MutableClock;
import com.vidnyan.cpg.config.EngineProperties;
import com.vidnyan.cpg.domain.cache.CacheStats;
import com.vidnyan.cpg.domain.cache.CacheType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class AnalysisCacheManagerTest {

    private EngineProperties properties;
    private MutableClock clock;
    private AnalysisCacheManager cacheManager;

    @BeforeEach
    void setUp() {
        properties = new EngineProperties();
        clock = new MutableClock();
        cacheManager = new AnalysisCacheManager(properties, clock);
    }

    @Test
    void get_AfterPut_ShouldReturnValueAndCountHit() {
        // Arrange
        cacheManager.put(CacheType.ANALYSIS, "MyApp@1", "analysis");

        // Act
        Optional<String> value = cacheManager.get(CacheType.ANALYSIS, "MyApp@1", String.class);
        Optional<Object> missing = cacheManager.get(CacheType.ANALYSIS, "Other@1");

        // Assert
        assertEquals(Optional.of("analysis"), value);
        assertTrue(missing.isEmpty());
        CacheStats stats = cacheManager.stats().get(CacheType.ANALYSIS);
        assertEquals(1, stats.hits());
        assertEquals(1, stats.misses());
        assertEquals(0.5, stats.hitRate());
    }

    @Test
    void get_WrongValueType_ShouldBeEmpty() {
        cacheManager.put(CacheType.CPG, "k", 42);

        assertTrue(cacheManager.get(CacheType.CPG, "k", String.class).isEmpty());
    }

    @Test
    void get_PastTtl_ShouldExpireEntry() {
        // Arrange
        cacheManager.put(CacheType.QUERY, "q", "rows");
        clock.advance(Duration.ofSeconds(59));
        assertTrue(cacheManager.get(CacheType.QUERY, "q").isPresent());

        // Act
        clock.advance(Duration.ofSeconds(2));

        // Assert
        assertTrue(cacheManager.get(CacheType.QUERY, "q").isEmpty());
        assertEquals(0, cacheManager.size(CacheType.QUERY));
    }

    @Test
    void put_AtCapacity_ShouldEvictLeastRecentlyUsed() {
        // Arrange
        properties.getCache().setMaxEntries(3);
        cacheManager.put(CacheType.CPG, "a", 1);
        clock.advance(Duration.ofSeconds(1));
        cacheManager.put(CacheType.CPG, "b", 2);
        clock.advance(Duration.ofSeconds(1));
        cacheManager.put(CacheType.CPG, "c", 3);
        clock.advance(Duration.ofSeconds(1));
        cacheManager.get(CacheType.CPG, "a");

        // Act
        cacheManager.put(CacheType.CPG, "d", 4);

        // Assert
        assertEquals(3, cacheManager.size(CacheType.CPG));
        assertTrue(cacheManager.get(CacheType.CPG, "b").isEmpty());
        assertTrue(cacheManager.get(CacheType.CPG, "a").isPresent());
        assertEquals(1, cacheManager.stats().get(CacheType.CPG).evictions());
    }

    @Test
    void compressIdle_ShouldKeepValuesReadable() {
        // Arrange
        cacheManager.put(CacheType.ANALYSIS, "cold", "value");
        cacheManager.put(CacheType.ANALYSIS, "hot", "value");
        for (int i = 0; i < 3; i++) {
            cacheManager.get(CacheType.ANALYSIS, "hot");
        }
        clock.advance(Duration.ofMinutes(20));

        // Act
        int compressed = cacheManager.compressIdle(CacheType.ANALYSIS, 3, Duration.ofMinutes(15));
        int again = cacheManager.compressIdle(CacheType.ANALYSIS, 3, Duration.ofMinutes(15));

        // Assert
        assertEquals(1, compressed);
        assertEquals(0, again);
        assertEquals(1, cacheManager.stats().get(CacheType.ANALYSIS).compressed());
    }

    @Test
    void evictIdle_ShouldDropEntriesNotAccessedRecently() {
        cacheManager.put(CacheType.ANALYSIS, "old", 1);
        clock.advance(Duration.ofMinutes(2));
        cacheManager.put(CacheType.ANALYSIS, "new", 2);

        int evicted = cacheManager.evictIdle(CacheType.ANALYSIS, Duration.ofMinutes(1));

        assertEquals(1, evicted);
        assertEquals(1, cacheManager.size(CacheType.ANALYSIS));
    }

    @Test
    void clearAll_ShouldEmptyEveryCache() {
        cacheManager.put(CacheType.QUERY, "q", 1);
        cacheManager.put(CacheType.ANALYSIS, "a", 2);
        cacheManager.put(CacheType.CPG, "c", 3);

        assertEquals(3, cacheManager.clearAll());
        assertEquals(0, cacheManager.size(CacheType.CPG));
    }
}
