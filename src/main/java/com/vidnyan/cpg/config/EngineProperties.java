package com.vidnyan.cpg.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Tunables of the analysis engine, bound from {@code cpg.*} in application.yml.
 */
@Data
@ConfigurationProperties(prefix = "cpg")
public class EngineProperties {

    private Query query = new Query();
    private Pattern pattern = new Pattern();
    private Cache cache = new Cache();
    private Correlator correlator = new Correlator();
    private Batch batch = new Batch();

    @Data
    public static class Query {
        /** Upper bound in ms of an "excellent" query. */
        private long excellentMs = 50;
        private long goodMs = 200;
        private long fairMs = 400;
        /** Limit applied to high-cost queries that did not ask for one. */
        private int autoLimit = 1000;
        private long timeoutMs = 5000;
    }

    @Data
    public static class Pattern {
        private double defaultConfidenceThreshold = 0.7;
        private double highConfidenceThreshold = 0.9;
        private long matchTimeoutMs = 500;
        private long sweepTimeoutMs = 30000;
        private String libraryPath = "classpath*:patterns/*.json";
    }

    @Data
    public static class Cache {
        private long queryTtlMs = 60_000;
        private long analysisTtlMs = 300_000;
        private long cpgTtlMs = 600_000;
        private int maxEntries = 1000;
        private double evictionFraction = 0.1;
        private double pressureLevel1 = 0.80;
        private double pressureLevel2 = 0.90;
        private double pressureLevel3 = 0.95;
        private double pressureLevel4 = 0.98;
        private int compressAccessThreshold = 3;
        private long compressAgeSeconds = 900;
        private long staleAgeSeconds = 1800;
        private long criticalAgeSeconds = 900;
        private long checkIntervalMs = 30_000;
    }

    @Data
    public static class Correlator {
        private long cacheTtlMs = 300_000;
        /** Calls remembered per correlation id for call context. */
        private int callContextDepth = 32;
        /** Correlation ids tracked at once; the least recently seen are dropped first. */
        private int maxCallStacks = 10_000;
        private long purgeIntervalMs = 60_000;
    }

    @Data
    public static class Batch {
        private int maxConcurrency = Runtime.getRuntime().availableProcessors();
        private long timeoutMs = 30_000;
    }
}
