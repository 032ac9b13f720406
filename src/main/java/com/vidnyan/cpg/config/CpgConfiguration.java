package com.vidnyan.cpg.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.vidnyan.cpg.application.port.out.AstPatternRepository;
import com.vidnyan.cpg.application.service.PatternLibrary;
import com.vidnyan.cpg.domain.analysis.FunctionAnalyzer;
import com.vidnyan.cpg.domain.cfg.CfgBuilder;
import com.vidnyan.cpg.domain.cpg.CpgUnifier;
import com.vidnyan.cpg.domain.dfg.DfgBuilder;
import com.vidnyan.cpg.domain.pattern.PatternType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Spring configuration for the analysis engine.
 * The graph builders are plain domain classes wired here as stateless singletons.
 */
@Slf4j
@Configuration
@EnableScheduling
@EnableConfigurationProperties(EngineProperties.class)
public class CpgConfiguration {

    /**
     * ObjectMapper for JSON parsing.
     */
    @Bean
    public ObjectMapper objectMapper() {
        return new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .configure(SerializationFeature.INDENT_OUTPUT, true);
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public CfgBuilder cfgBuilder() {
        return new CfgBuilder();
    }

    @Bean
    public DfgBuilder dfgBuilder() {
        return new DfgBuilder();
    }

    @Bean
    public CpgUnifier cpgUnifier() {
        return new CpgUnifier();
    }

    @Bean
    public FunctionAnalyzer functionAnalyzer(CfgBuilder cfgBuilder, DfgBuilder dfgBuilder,
                                             CpgUnifier cpgUnifier, Clock clock) {
        return new FunctionAnalyzer(cfgBuilder, dfgBuilder, cpgUnifier, clock);
    }

    /**
     * Bounded pool for batch analysis.
     */
    @Bean(destroyMethod = "shutdown")
    public ExecutorService analysisExecutor(EngineProperties properties) {
        int threads = Math.max(1, properties.getBatch().getMaxConcurrency());
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory factory = runnable -> {
            Thread thread = new Thread(runnable, "cpg-analysis-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        log.info("Batch analysis pool: {} threads", threads);
        return Executors.newFixedThreadPool(threads, factory);
    }

    /**
     * Log the pattern libraries on startup.
     */
    @Bean
    public String logPatterns(PatternLibrary patternLibrary, AstPatternRepository astPatterns) {
        log.info("Registered {} behavioral / anti-patterns:", patternLibrary.size());
        for (PatternType type : new PatternType[] {PatternType.BEHAVIORAL, PatternType.ANTI_PATTERN}) {
            patternLibrary.findByType(type).forEach(p -> log.info("  - [{}] {}", type, p.name()));
        }
        astPatterns.findAll().forEach(t -> log.info("  - [AST] {}", t.name()));
        return "patterns-logged";
    }
}
