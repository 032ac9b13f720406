package com.vidnyan.cpg.application.service;

import com.vidnyan.cpg.AstFixtures;
import com.vidnyan.cpg.MutableClock;
import com.vidnyan.cpg.adapter.out.repository.InMemoryAnalysisRepository;
import com.vidnyan.cpg.application.port.out.MemoryUsageProbe;
import com.vidnyan.cpg.config.EngineProperties;
import com.vidnyan.cpg.domain.analysis.FunctionAnalyzer;
import com.vidnyan.cpg.domain.analysis.ModuleAnalysis;
import com.vidnyan.cpg.domain.cache.CacheType;
import com.vidnyan.cpg.domain.cache.PressureLevel;
import com.vidnyan.cpg.domain.cfg.CfgBuilder;
import com.vidnyan.cpg.domain.cpg.CpgUnifier;
import com.vidnyan.cpg.domain.dfg.DfgBuilder;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MemoryPressureServiceTest {

    private MutableClock clock;
    private AnalysisCacheManager cacheManager;
    private InMemoryAnalysisRepository repository;
    private FakeProbe probe;
    private MemoryPressureService service;

    @BeforeEach
    void setUp() {
        EngineProperties properties = new EngineProperties();
        clock = new MutableClock();
        cacheManager = new AnalysisCacheManager(properties, clock);
        repository = new InMemoryAnalysisRepository(clock);
        probe = new FakeProbe();
        service = new MemoryPressureService(cacheManager, repository, probe, properties, clock);
    }

    @Test
    void levelFor_ShouldMapThresholds() {
        assertEquals(PressureLevel.NONE, service.levelFor(0.5));
        assertEquals(PressureLevel.ELEVATED, service.levelFor(0.80));
        assertEquals(PressureLevel.HIGH, service.levelFor(0.91));
        assertEquals(PressureLevel.SEVERE, service.levelFor(0.95));
        assertEquals(PressureLevel.CRITICAL, service.levelFor(0.99));
    }

    @Test
    void checkMemory_BelowThreshold_ShouldDoNothing() {
        // Arrange
        probe.used = 10;
        cacheManager.put(CacheType.QUERY, "q", "rows");

        // Act
        MemoryPressureService.PressureReport report = service.checkMemory();

        // Assert
        assertEquals(PressureLevel.NONE, report.level());
        assertTrue(report.actions().isEmpty());
        assertEquals(1, cacheManager.size(CacheType.QUERY));
    }

    @Test
    void checkMemory_Elevated_ShouldOnlyClearQueryCache() {
        // Arrange
        probe.used = 85;
        cacheManager.put(CacheType.QUERY, "q", "rows");
        cacheManager.put(CacheType.ANALYSIS, "a", "analysis");

        // Act
        MemoryPressureService.PressureReport report = service.checkMemory();

        // Assert
        assertEquals(PressureLevel.ELEVATED, report.level());
        assertEquals(0, cacheManager.size(CacheType.QUERY));
        assertEquals(1, cacheManager.size(CacheType.ANALYSIS));
    }

    @Test
    void handle_High_ShouldCompressIdleAnalysisEntries() {
        // Arrange
        cacheManager.put(CacheType.ANALYSIS, "a", "analysis");
        clock.advance(Duration.ofMinutes(16));

        // Act
        List<String> actions = service.handle(PressureLevel.HIGH);

        // Assert
        assertTrue(actions.contains("compressed 1 analysis cache entries"));
        assertEquals(1, cacheManager.stats().get(CacheType.ANALYSIS).compressed());
        assertEquals(1, cacheManager.size(CacheType.ANALYSIS));
    }

    @Test
    void handle_Severe_ShouldCompressAnalysisAndGraphCaches() {
        // Arrange
        cacheManager.put(CacheType.QUERY, "q", "rows");
        cacheManager.put(CacheType.ANALYSIS, "a", "analysis");
        cacheManager.put(CacheType.CPG, "c", "graph");
        clock.advance(Duration.ofMinutes(16));

        // Act
        List<String> actions = service.handle(PressureLevel.SEVERE);

        // Assert
        assertEquals(List.of(
                "cleared 1 query cache entries",
                "compressed 1 analysis cache entries",
                "compressed 1 cpg cache entries"), actions.subList(0, 3));
        assertEquals(0, cacheManager.size(CacheType.QUERY));
        assertEquals(1, cacheManager.stats().get(CacheType.CPG).compressed());
    }

    @Test
    void handle_Severe_ShouldEvictStaleModules() {
        // Arrange
        repository.save(analyzedCalculator());
        clock.advance(Duration.ofMinutes(31));

        // Act
        service.handle(PressureLevel.SEVERE);

        // Assert
        assertTrue(repository.findAll().isEmpty());
    }

    @Test
    void handle_Critical_ShouldClearEverythingAndStayIdempotent() {
        // Arrange
        cacheManager.put(CacheType.QUERY, "q", 1);
        cacheManager.put(CacheType.CPG, "c", 2);
        repository.save(analyzedCalculator());
        clock.advance(Duration.ofMinutes(16));

        // Act
        List<String> first = service.handle(PressureLevel.CRITICAL);
        List<String> second = service.handle(PressureLevel.CRITICAL);

        // Assert
        assertEquals("cleared 2 cache entries", first.get(0));
        assertEquals("cleared 0 cache entries", second.get(0));
        assertTrue(repository.findAll().isEmpty());
    }

    @Test
    void handle_Severe_RecentlyUsedModule_ShouldSurvive() {
        repository.save(analyzedCalculator());
        clock.advance(Duration.ofMinutes(31));
        repository.findModule("MyApp.Calculator");

        service.handle(PressureLevel.SEVERE);

        assertEquals(1, repository.findAll().size());
    }

    private ModuleAnalysis analyzedCalculator() {
        FunctionAnalyzer analyzer = new FunctionAnalyzer(new CfgBuilder(), new DfgBuilder(), new CpgUnifier(), clock);
        return analyzer.analyzeModule(AstFixtures.calculator()).get();
    }

    private static final class FakeProbe implements MemoryUsageProbe {
        private long used;

        @Override
        public long usedBytes() {
            return used;
        }

        @Override
        public long maxBytes() {
            return 100;
        }
    }
}
