package com.vidnyan.cpg;

import com.vidnyan.cpg.adapter.out.ast.AstJsonReader;
import com.vidnyan.cpg.application.port.in.AnalyzeModuleUseCase;
import com.vidnyan.cpg.application.port.in.CorrelateEventsUseCase;
import com.vidnyan.cpg.application.port.in.MatchPatternsUseCase;
import com.vidnyan.cpg.application.port.in.QueryCodeUseCase;
import com.vidnyan.cpg.application.service.MemoryPressureService;
import com.vidnyan.cpg.domain.analysis.ModuleAnalysis;
import com.vidnyan.cpg.domain.ast.AstNode;
import com.vidnyan.cpg.domain.pattern.PatternMatch;
import com.vidnyan.cpg.domain.pattern.PatternSpec;
import com.vidnyan.cpg.domain.pattern.PatternType;
import com.vidnyan.cpg.domain.query.Operator;
import com.vidnyan.cpg.domain.query.QueryResult;
import com.vidnyan.cpg.domain.query.QuerySpec;
import com.vidnyan.cpg.domain.runtime.AstContext;
import com.vidnyan.cpg.domain.runtime.ExecutionEvent;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
class CpgApplicationTest {

    @Autowired
    private AstJsonReader astJsonReader;
    @Autowired
    private AnalyzeModuleUseCase analyzeModuleUseCase;
    @Autowired
    private QueryCodeUseCase queryCodeUseCase;
    @Autowired
    private MatchPatternsUseCase matchPatternsUseCase;
    @Autowired
    private CorrelateEventsUseCase correlateEventsUseCase;
    @Autowired
    private MemoryPressureService memoryPressureService;

    @Test
    void analyzedModule_ShouldBeQueryableMatchableAndCorrelatable() throws IOException {
        // Arrange
        AstNode worker;
        try (InputStream in = getClass().getResourceAsStream("/fixtures/worker.json")) {
            worker = astJsonReader.read(in, "worker.ex");
        }

        // Act
        ModuleAnalysis analysis = analyzeModuleUseCase.analyze(worker).get();
        QueryResult functions = queryCodeUseCase.execute(QuerySpec.from("functions")
                .select("name", "arity")
                .where("module", Operator.EQ, "MyApp.Worker")
                .where("name", Operator.MATCHES, "^handle_")
                .limit(10)
                .build()).get();
        List<PatternMatch> behaviours = matchPatternsUseCase.match("MyApp.Worker",
                PatternSpec.named(PatternType.BEHAVIORAL, "genserver")).get();
        List<PatternMatch> pipes = matchPatternsUseCase.match("MyApp.Worker",
                PatternSpec.named(PatternType.AST, "pipe_operator")).get();
        AstContext context = correlateEventsUseCase.correlate(ExecutionEvent.builder()
                .module("MyApp.Worker").function("handle_call").arity(3).line(9).build()).get();

        // Assert
        assertEquals(2, analysis.functions().size());
        assertEquals(List.of(Map.of("name", "handle_call", "arity", 3)), functions.data());
        assertEquals(1, behaviours.size());
        assertEquals(1.0, behaviours.get(0).confidence());
        assertEquals(1, pipes.size());
        assertEquals("Worker.handle_call/3:line_9", context.getAstNodeId());
        assertEquals("lib/my_app/worker.ex", context.getMetadata().filePath());
    }

    @Test
    void contextLoads_WithBuiltInLibraries() {
        assertTrue(matchPatternsUseCase.availablePatterns(PatternType.AST).contains("enum_map"));
        assertTrue(matchPatternsUseCase.availablePatterns(PatternType.ANTI_PATTERN).contains("n_plus_one_query"));
        assertNotNull(memoryPressureService.levelFor(0.1));
    }
}
