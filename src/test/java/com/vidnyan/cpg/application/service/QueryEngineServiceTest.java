package com.vidnyan.cpg.application.service;

import com.vidnyan.cpg.AstFixtures;
import com.vidnyan.cpg.MutableClock;
import com.vidnyan.cpg.adapter.out.repository.InMemoryAnalysisRepository;
import com.vidnyan.cpg.config.EngineProperties;
import com.vidnyan.cpg.domain.analysis.FunctionAnalyzer;
import com.vidnyan.cpg.domain.cache.CacheType;
import com.vidnyan.cpg.domain.cfg.CfgBuilder;
import com.vidnyan.cpg.domain.common.ErrorCode;
import com.vidnyan.cpg.domain.common.Result;
import com.vidnyan.cpg.domain.cpg.CpgUnifier;
import com.vidnyan.cpg.domain.dfg.DfgBuilder;
import com.vidnyan.cpg.domain.query.Operator;
import com.vidnyan.cpg.domain.query.OrderBy;
import com.vidnyan.cpg.domain.query.PerformanceGrade;
import com.vidnyan.cpg.domain.query.QueryResult;
import com.vidnyan.cpg.domain.query.QuerySpec;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class QueryEngineServiceTest {

    private EngineProperties properties;
    private MutableClock clock;
    private AnalysisCacheManager cacheManager;
    private InMemoryAnalysisRepository repository;
    private DeadlineExecutor deadlineExecutor;
    private QueryEngineService queryEngine;

    @BeforeEach
    void setUp() {
        properties = new EngineProperties();
        clock = new MutableClock();
        cacheManager = new AnalysisCacheManager(properties, clock);
        repository = new InMemoryAnalysisRepository(clock);
        deadlineExecutor = new DeadlineExecutor();
        queryEngine = new QueryEngineService(repository, cacheManager, deadlineExecutor, properties);
    }

    @AfterEach
    void tearDown() {
        deadlineExecutor.shutdown();
    }

    @Test
    void execute_EmptyRepository_ShouldReturnNoRowsThenHitCache() {
        // Arrange
        QuerySpec spec = QuerySpec.from("functions")
                .where("complexity", Operator.GT, 15)
                .limit(20)
                .build();

        // Act
        QueryResult first = queryEngine.execute(spec).get();
        QueryResult second = queryEngine.execute(spec).get();

        // Assert
        assertTrue(first.data().isEmpty());
        assertEquals(0, first.metadata().totalCount());
        assertFalse(first.metadata().cacheHit());
        assertEquals(PerformanceGrade.EXCELLENT, first.metadata().performanceScore());
        assertEquals(80, first.metadata().estimatedCost());
        assertTrue(second.metadata().cacheHit());
        assertEquals(1, queryEngine.statistics().cacheHits());
        assertEquals(2, queryEngine.statistics().executed());
    }

    @Test
    void execute_ShouldFilterAnalyzedFunctions() {
        // Arrange
        repository.save(analyzer().analyzeModule(AstFixtures.calculator()).get());
        QuerySpec spec = QuerySpec.from("functions")
                .select("name", "complexity")
                .where("complexity", Operator.GT, 1)
                .orderBy(OrderBy.desc("complexity"))
                .limit(10)
                .build();

        // Act
        QueryResult result = queryEngine.execute(spec).get();

        // Assert
        assertEquals(List.of(
                Map.of("name", "sign", "complexity", 3),
                Map.of("name", "bump", "complexity", 2)), result.data());
    }

    @Test
    void execute_ModulesRelation_ShouldExposeModuleFacts() {
        repository.save(analyzer().analyzeModule(AstFixtures.calculator()).get());

        QueryResult result = queryEngine.execute(QuerySpec.from("modules")
                .where("name", Operator.EQ, "MyApp.Calculator")
                .limit(1)
                .build()).get();

        assertEquals(1, result.size());
        assertEquals(3, result.data().get(0).get("function_count"));
    }

    @Test
    void execute_PatternsRelation_ShouldBeRejected() {
        Result<QueryResult> result = queryEngine.execute(QuerySpec.from("patterns").limit(5).build());

        assertEquals(ErrorCode.PATTERN_QUERIES_NOT_IMPLEMENTED, result.errorCode());
    }

    @Test
    void execute_InvalidQuery_ShouldPropagateValidationError() {
        Result<QueryResult> result = queryEngine.execute(QuerySpec.from("functions").select("").build());

        assertEquals(ErrorCode.INVALID_SELECT_CLAUSE, result.errorCode());
    }

    @Test
    void invalidateCache_ShouldForceFreshExecution() {
        QuerySpec spec = QuerySpec.from("modules").limit(5).build();
        queryEngine.execute(spec);

        queryEngine.invalidateCache();

        assertEquals(0, cacheManager.size(CacheType.QUERY));
        assertFalse(queryEngine.execute(spec).get().metadata().cacheHit());
    }

    @Test
    void execute_RelationBlockingPastTimeout_ShouldReturnTimeoutWithoutCaching() throws InterruptedException {
        // Arrange
        properties.getQuery().setTimeoutMs(100);
        CountDownLatch release = new CountDownLatch(1);
        CountDownLatch interrupted = new CountDownLatch(1);
        QueryEngineService slowEngine = new QueryEngineService(relation -> {
            try {
                release.await(30, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                interrupted.countDown();
                Thread.currentThread().interrupt();
            }
            return List.of();
        }, cacheManager, deadlineExecutor, properties);
        QuerySpec spec = QuerySpec.from("functions").limit(10).build();

        // Act
        long start = System.nanoTime();
        Result<QueryResult> result = slowEngine.execute(spec);
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

        // Assert
        assertEquals(ErrorCode.TIMEOUT, result.errorCode());
        assertTrue(result.error().isRetryable());
        assertTrue(elapsedMs < 5_000, "returned after " + elapsedMs + "ms");
        assertTrue(interrupted.await(5, TimeUnit.SECONDS), "blocked relation was not interrupted");
        assertEquals(0, cacheManager.size(CacheType.QUERY));
        assertEquals(0, slowEngine.statistics().executed());
        release.countDown();
    }

    private FunctionAnalyzer analyzer() {
        return new FunctionAnalyzer(new CfgBuilder(), new DfgBuilder(), new CpgUnifier(), clock);
    }
}
