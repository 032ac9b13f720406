package com.vidnyan.cpg.application.service;

import com.vidnyan.cpg.AstFixtures;
import com.vidnyan.cpg.MutableClock;
import com.vidnyan.cpg.adapter.out.repository.InMemoryAnalysisRepository;
import com.vidnyan.cpg.application.port.in.AnalyzeModuleUseCase.BatchRequest;
import com.vidnyan.cpg.application.port.in.AnalyzeModuleUseCase.BatchResult;
import com.vidnyan.cpg.config.EngineProperties;
import com.vidnyan.cpg.domain.analysis.FunctionAnalyzer;
import com.vidnyan.cpg.domain.analysis.ModuleAnalysis;
import com.vidnyan.cpg.domain.ast.AstKind;
import com.vidnyan.cpg.domain.ast.AstNode;
import com.vidnyan.cpg.domain.cache.CacheType;
import com.vidnyan.cpg.domain.cfg.CfgBuilder;
import com.vidnyan.cpg.domain.common.ErrorCode;
import com.vidnyan.cpg.domain.common.Result;
import com.vidnyan.cpg.domain.cpg.CpgUnifier;
import com.vidnyan.cpg.domain.dfg.DfgBuilder;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static com.vidnyan.cpg.AstFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class CodeAnalysisServiceTest {

    private ExecutorService executor;
    private AnalysisCacheManager cacheManager;
    private InMemoryAnalysisRepository repository;
    private CodeAnalysisService service;

    @BeforeEach
    void setUp() {
        EngineProperties properties = new EngineProperties();
        MutableClock clock = new MutableClock();
        executor = Executors.newFixedThreadPool(2);
        cacheManager = new AnalysisCacheManager(properties, clock);
        repository = new InMemoryAnalysisRepository(clock);
        FunctionAnalyzer analyzer = new FunctionAnalyzer(new CfgBuilder(), new DfgBuilder(), new CpgUnifier(), clock);
        service = new CodeAnalysisService(analyzer, repository, cacheManager, executor, properties);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void analyze_ShouldStoreModuleAndCacheGraphs() {
        // Act
        ModuleAnalysis analysis = service.analyze(AstFixtures.calculator()).get();

        // Assert
        assertEquals("MyApp.Calculator", analysis.name());
        assertEquals(3, analysis.functions().size());
        assertTrue(analysis.failures().isEmpty());
        assertTrue(repository.findModule("MyApp.Calculator").isPresent());
        assertEquals(1, cacheManager.size(CacheType.ANALYSIS));
        assertEquals(3, cacheManager.size(CacheType.CPG));
    }

    @Test
    void analyze_SameAstTwice_ShouldReuseCachedAnalysis() {
        AstNode module = AstFixtures.calculator();

        ModuleAnalysis first = service.analyze(module).get();
        ModuleAnalysis second = service.analyze(module).get();

        assertSame(first, second);
        assertEquals(1, cacheManager.stats().get(CacheType.ANALYSIS).hits());
    }

    @Test
    void analyze_SameNameDifferentBody_ShouldNotReuseCachedAnalysis() {
        // Arrange: one literal differs between the two trees
        AstNode original = module("MyApp.Limits", def("max", 2, 4, params(2),
                block(3, lit(10, 3))));
        AstNode edited = module("MyApp.Limits", def("max", 2, 4, params(2),
                block(3, lit(20, 3))));

        // Act
        ModuleAnalysis first = service.analyze(original).get();
        ModuleAnalysis second = service.analyze(edited).get();
        ModuleAnalysis rebuilt = service.analyze(original.toBuilder().build()).get();

        // Assert
        assertNotSame(first, second);
        assertEquals(2, cacheManager.size(CacheType.ANALYSIS));
        assertEquals(1, cacheManager.stats().get(CacheType.ANALYSIS).hits());
        assertSame(first, rebuilt);
    }

    @Test
    void analyze_BrokenFunction_ShouldKeepSiblings() {
        // Arrange
        AstNode broken = AstNode.builder("broken", AstKind.FUNCTION).name("oops").build();
        AstNode module = module("MyApp.Partial", addFunction(), broken);

        // Act
        ModuleAnalysis analysis = service.analyze(module).get();

        // Assert
        assertEquals(1, analysis.functions().size());
        assertEquals(1, analysis.failures().size());
        assertEquals(ErrorCode.CFG_GENERATION_FAILED, analysis.failures().get(0).code());
        assertTrue(analysis.failures().get(0).message().startsWith("MyApp.Partial.oops/0"));
    }

    @Test
    void analyze_NonModuleNode_ShouldFail() {
        Result<ModuleAnalysis> result = service.analyze(addFunction());

        assertEquals(ErrorCode.INVALID_AST, result.errorCode());
        assertTrue(repository.findAll().isEmpty());
    }

    @Test
    void analyzeAll_ShouldReturnPartialResults() {
        // Arrange
        List<AstNode> modules = Arrays.asList(
                AstFixtures.calculator(),
                null,
                module("MyApp.Other", def("ping", 2, 3, params(2), block(3, lit("pong", 3)))));

        // Act
        BatchResult result = service.analyzeAll(BatchRequest.of(modules));

        // Assert
        assertFalse(result.isComplete());
        assertEquals(List.of("MyApp.Calculator", "MyApp.Other"),
                result.analyzed().stream().map(ModuleAnalysis::name).toList());
        assertEquals(ErrorCode.INVALID_AST, result.failures().get("<null>").code());
        assertTrue(result.timedOut().isEmpty());
        assertEquals(3, result.stats().modulesRequested());
        assertEquals(2, result.stats().modulesAnalyzed());
        assertEquals(4, result.stats().functionsAnalyzed());
    }

    @Test
    void analyzeAll_ExpiredDeadline_ShouldReportTimedOutModules() {
        BatchResult result = service.analyzeAll(new BatchRequest(List.of(AstFixtures.calculator()), Duration.ZERO));

        assertEquals(List.of("MyApp.Calculator"), result.timedOut());
        assertTrue(result.analyzed().isEmpty());
    }

    @Test
    void findCpg_ShouldServeStoredGraph() {
        service.analyze(AstFixtures.calculator());
        cacheManager.clear(CacheType.CPG);

        assertTrue(service.findCpg("MyApp.Calculator", "add", 2).isPresent());
        assertEquals(1, cacheManager.size(CacheType.CPG));
        assertTrue(service.findCpg("MyApp.Calculator", "add", 3).isEmpty());
    }
}
