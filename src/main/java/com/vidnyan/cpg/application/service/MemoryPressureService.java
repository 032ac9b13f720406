package com.vidnyan.cpg.application.service;

import com.vidnyan.cpg.application.port.out.AnalysisRepository;
import com.vidnyan.cpg.application.port.out.MemoryUsageProbe;
import com.vidnyan.cpg.config.EngineProperties;
import com.vidnyan.cpg.domain.cache.CacheType;
import com.vidnyan.cpg.domain.cache.PressureLevel;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Escalating cache eviction under heap pressure. Every level repeats the actions of the
 * levels below it, and running a level twice leaves nothing more to do the second time.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MemoryPressureService {

    private final AnalysisCacheManager cacheManager;
    private final AnalysisRepository analysisRepository;
    private final MemoryUsageProbe memoryUsageProbe;
    private final EngineProperties properties;
    private final Clock clock;

    public record PressureReport(PressureLevel level, double usedFraction, List<String> actions) {}

    @Scheduled(fixedDelayString = "${cpg.cache.check-interval-ms:30000}")
    public void scheduledCheck() {
        PressureReport report = checkMemory();
        if (report.level() != PressureLevel.NONE) {
            log.info("Memory pressure {} at {}% heap: {}", report.level(),
                    Math.round(report.usedFraction() * 100), report.actions());
        }
    }

    public PressureReport checkMemory() {
        double used = memoryUsageProbe.usedFraction();
        PressureLevel level = levelFor(used);
        List<String> actions = level == PressureLevel.NONE ? List.of() : handle(level);
        return new PressureReport(level, used, actions);
    }

    public PressureLevel levelFor(double usedFraction) {
        EngineProperties.Cache cache = properties.getCache();
        if (usedFraction >= cache.getPressureLevel4()) {
            return PressureLevel.CRITICAL;
        }
        if (usedFraction >= cache.getPressureLevel3()) {
            return PressureLevel.SEVERE;
        }
        if (usedFraction >= cache.getPressureLevel2()) {
            return PressureLevel.HIGH;
        }
        if (usedFraction >= cache.getPressureLevel1()) {
            return PressureLevel.ELEVATED;
        }
        return PressureLevel.NONE;
    }

    /**
     * Apply the actions of {@code level}.
     * @return human readable summary of what was done
     */
    public synchronized List<String> handle(PressureLevel level) {
        EngineProperties.Cache cache = properties.getCache();
        List<String> actions = new ArrayList<>();
        switch (level) {
            case NONE -> {
                return actions;
            }
            case ELEVATED -> clearQueryCache(actions);
            case HIGH -> {
                clearQueryCache(actions);
                compress(CacheType.ANALYSIS, actions);
            }
            case SEVERE -> {
                clearQueryCache(actions);
                compress(CacheType.ANALYSIS, actions);
                compress(CacheType.CPG, actions);
                evictModules(Duration.ofSeconds(cache.getStaleAgeSeconds()), actions);
            }
            case CRITICAL -> {
                actions.add("cleared " + cacheManager.clearAll() + " cache entries");
                evictModules(Duration.ofSeconds(cache.getCriticalAgeSeconds()), actions);
                System.gc();
                actions.add("requested garbage collection");
            }
        }
        log.debug("Pressure level {} handled: {}", level, actions);
        return actions;
    }

    private void clearQueryCache(List<String> actions) {
        actions.add("cleared " + cacheManager.clear(CacheType.QUERY) + " query cache entries");
    }

    private void compress(CacheType type, List<String> actions) {
        EngineProperties.Cache cache = properties.getCache();
        int compressed = cacheManager.compressIdle(type, cache.getCompressAccessThreshold(),
                Duration.ofSeconds(cache.getCompressAgeSeconds()));
        actions.add("compressed " + compressed + " " + type.name().toLowerCase() + " cache entries");
    }

    private void evictModules(Duration unusedFor, List<String> actions) {
        int evicted = analysisRepository.evictUnusedSince(clock.instant().minus(unusedFor));
        actions.add("evicted " + evicted + " modules unused for " + unusedFor.toSeconds() + "s");
        if (evicted > 0) {
            log.warn("Evicted {} stored modules under memory pressure", evicted);
        }
    }
}
