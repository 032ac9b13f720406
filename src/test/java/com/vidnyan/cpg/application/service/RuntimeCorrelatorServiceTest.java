package com.vidnyan.cpg.application.service;

import com.vidnyan.cpg.AstFixtures;
import com.vidnyan.cpg.MutableClock;
import com.vidnyan.cpg.adapter.out.repository.InMemoryAnalysisRepository;
import com.vidnyan.cpg.application.port.in.CorrelateEventsUseCase.DataFlowBreakpointRequest;
import com.vidnyan.cpg.application.port.in.CorrelateEventsUseCase.StructuralBreakpointRequest;
import com.vidnyan.cpg.application.port.in.CorrelateEventsUseCase.WatchpointRequest;
import com.vidnyan.cpg.config.EngineProperties;
import com.vidnyan.cpg.domain.analysis.FunctionAnalyzer;
import com.vidnyan.cpg.domain.ast.AstKind;
import com.vidnyan.cpg.domain.ast.AstNode;
import com.vidnyan.cpg.domain.cfg.CfgBuilder;
import com.vidnyan.cpg.domain.common.ErrorCode;
import com.vidnyan.cpg.domain.common.Result;
import com.vidnyan.cpg.domain.cpg.CpgUnifier;
import com.vidnyan.cpg.domain.dfg.DfgBuilder;
import com.vidnyan.cpg.domain.runtime.AstContext;
import com.vidnyan.cpg.domain.runtime.BreakpointHit;
import com.vidnyan.cpg.domain.runtime.BreakpointKind;
import com.vidnyan.cpg.domain.runtime.DataFlowBreakpoint;
import com.vidnyan.cpg.domain.runtime.ExecutionEvent;
import com.vidnyan.cpg.domain.runtime.ExecutionTrace;
import com.vidnyan.cpg.domain.runtime.RuntimeContext;
import com.vidnyan.cpg.domain.runtime.SemanticWatchpoint;
import com.vidnyan.cpg.domain.runtime.StructuralBreakpoint;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static com.vidnyan.cpg.AstFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class RuntimeCorrelatorServiceTest {

    private static final String MODULE = "MyApp.Calculator";

    private EngineProperties properties;
    private MutableClock clock;
    private AstNode calculator;
    private RuntimeCorrelatorService correlator;

    @BeforeEach
    void setUp() {
        properties = new EngineProperties();
        clock = new MutableClock();
        InMemoryAnalysisRepository repository = new InMemoryAnalysisRepository(clock);
        FunctionAnalyzer analyzer = new FunctionAnalyzer(new CfgBuilder(), new DfgBuilder(), new CpgUnifier(), clock);
        calculator = AstFixtures.calculator();
        repository.save(analyzer.analyzeModule(calculator).get());
        correlator = new RuntimeCorrelatorService(repository, new BreakpointRegistry(), properties, clock);
    }

    @Test
    void correlate_EventWithoutNodeId_ShouldSynthesizeOne() {
        // Act
        AstContext context = correlator.correlate(addEvent(4).build()).get();

        // Assert
        assertEquals("Calculator.add/2:line_4", context.getAstNodeId());
        assertEquals(4, context.getLine());
        assertEquals("MyApp.Calculator.add/2", context.functionId());
        assertEquals(1, context.getMetadata().complexity());
        assertEquals("public", context.getMetadata().visibility());
        assertEquals(3, context.getMetadata().lineStart());
        assertTrue(context.getAstNode().isPresent());
    }

    @Test
    void correlate_CallerLine_ShouldWinOverOwnLine() {
        AstContext context = correlator.correlate(addEvent(4).callerLine(5).build()).get();

        assertEquals(5, context.getLine());
    }

    @Test
    void correlate_InvalidEvents_ShouldReportErrorCodes() {
        assertEquals(ErrorCode.NIL_EVENT, correlator.correlate(null).errorCode());
        assertEquals(ErrorCode.MISSING_MODULE,
                correlator.correlate(ExecutionEvent.builder().function("add").build()).errorCode());
        assertEquals(ErrorCode.MISSING_FUNCTION,
                correlator.correlate(ExecutionEvent.builder().module(MODULE).function(" ").build()).errorCode());
        assertEquals(ErrorCode.MODULE_NOT_FOUND,
                correlator.correlate(ExecutionEvent.builder().module("Ghost").function("run").build()).errorCode());
        assertEquals(ErrorCode.FUNCTION_NOT_FOUND,
                correlator.correlate(ExecutionEvent.builder().module(MODULE).function("add").arity(3).build()).errorCode());
    }

    @Test
    void correlate_RepeatedPosition_ShouldHitCacheUntilTtlExpires() {
        // Arrange
        ExecutionEvent event = addEvent(4).build();

        // Act
        correlator.correlate(event);
        correlator.correlate(event);
        clock.advance(Duration.ofMinutes(6));
        correlator.correlate(event);

        // Assert
        assertEquals(1, correlator.statistics().cacheHits());
        assertEquals(2, correlator.statistics().cacheMisses());
        assertEquals(3, correlator.statistics().eventsCorrelated());
    }

    @Test
    void correlate_ExpiredEntry_ShouldBeReplacedNotAccumulated() {
        // Arrange
        correlator.correlate(addEvent(4).build());
        clock.advance(Duration.ofMinutes(6));

        // Act
        correlator.correlate(addEvent(4).build());

        // Assert
        assertEquals(1, correlator.statistics().cachedContexts());
        assertEquals(2, correlator.statistics().cacheMisses());
    }

    @Test
    void purgeExpired_ShouldRemoveStaleContextsAndIdleCallStacks() {
        // Arrange
        correlator.runtimeContext(addEvent(4).correlationId("req-1").build());
        correlator.runtimeContext(addEvent(5).correlationId("req-2").build());
        clock.advance(Duration.ofMinutes(4));
        correlator.runtimeContext(addEvent(6).correlationId("req-2").build());
        clock.advance(Duration.ofMinutes(2));

        // Act
        int removed = correlator.purgeExpired();

        // Assert: only req-2 and the line 6 context were touched after the start
        assertEquals(3, removed);
        assertEquals(1, correlator.statistics().cachedContexts());
        assertEquals(1, correlator.statistics().trackedCallStacks());
        RuntimeContext fresh = correlator.runtimeContext(addEvent(5).correlationId("req-1").build()).get();
        assertTrue(fresh.callContext().isEmpty());
    }

    @Test
    void runtimeContext_ManyCorrelationIds_ShouldKeepOnlyMostRecentlySeen() {
        // Arrange
        properties.getCorrelator().setMaxCallStacks(2);

        // Act
        for (String id : List.of("req-1", "req-2", "req-3")) {
            correlator.runtimeContext(addEvent(4).correlationId(id).build());
            clock.advance(Duration.ofSeconds(1));
        }
        RuntimeContext evicted = correlator.runtimeContext(addEvent(4).correlationId("req-1").build()).get();

        // Assert
        assertTrue(evicted.callContext().isEmpty());
        assertEquals(2, correlator.statistics().trackedCallStacks());
    }

    @Test
    void runtimeContext_ShouldCarryVariablesAndCallContext() {
        // Arrange
        correlator.runtimeContext(addEvent(4).correlationId("req-1").build());

        // Act
        RuntimeContext context = correlator.runtimeContext(ExecutionEvent.builder()
                .module(MODULE).function("sign").arity(1).line(12)
                .variables(Map.of("n", 3))
                .correlationId("req-1")
                .build()).get();

        // Assert
        assertEquals(List.of("MyApp.Calculator.add/2"), context.callContext());
        assertEquals(3, context.variable("n").orElseThrow());
        assertNotNull(context.scopeId());
    }

    @Test
    void buildTrace_ShouldPassUncorrelatedEventsThrough() {
        // Arrange
        List<ExecutionEvent> events = Arrays.asList(
                addEvent(4).variables(Map.of("a", 1, "b", 2)).timestamp(10).build(),
                null,
                ExecutionEvent.builder().module("Ghost").function("run").line(7)
                        .variables(Map.of("a", 9)).timestamp(20).build());

        // Act
        ExecutionTrace trace = correlator.buildTrace(events).get();

        // Assert
        assertTrue(trace.traceId().startsWith("trace_"));
        assertEquals(2, trace.eventCount());
        assertTrue(trace.events().get(0).isCorrelated());
        assertFalse(trace.events().get(1).isCorrelated());
        assertEquals(1, trace.astFlow().size());
        List<ExecutionTrace.VariableSnapshot> history = trace.variableFlow().get("a");
        assertEquals(2, history.size());
        assertEquals("Ghost.run:variable_snapshot", history.get(1).astNodeId());
        assertEquals(7, history.get(1).line());
    }

    @Test
    void buildTrace_OutOfOrderEvents_ShouldReportEarliestAndLatestOccurrence() {
        // Arrange
        List<ExecutionEvent> events = List.of(
                addEvent(4).timestamp(30).build(),
                addEvent(4).timestamp(10).build(),
                addEvent(4).timestamp(20).build());

        // Act
        ExecutionTrace trace = correlator.buildTrace(events).get();

        // Assert
        assertEquals(1, trace.structuralPatterns().size());
        ExecutionTrace.StructuralPatternStats stats = trace.structuralPatterns().get(0);
        assertEquals(3, stats.occurrences());
        assertEquals(10, stats.firstOccurrence());
        assertEquals(30, stats.lastOccurrence());
        assertEquals(List.of(10L, 20L, 30L),
                trace.astFlow().stream().map(ExecutionTrace.TraceStep::timestamp).toList());
    }

    @Test
    void buildTrace_NullList_ShouldFail() {
        assertEquals(ErrorCode.NIL_EVENT, correlator.buildTrace(null).errorCode());
    }

    @Test
    void setStructuralBreakpoint_WithoutPattern_ShouldBeRejected() {
        Result<StructuralBreakpoint> missing = correlator.setStructuralBreakpoint(StructuralBreakpointRequest.of(null));
        Result<StructuralBreakpoint> badCondition = correlator.setStructuralBreakpoint(
                new StructuralBreakpointRequest(var("_", 1), "a is big", null, null, null));

        assertEquals(ErrorCode.INVALID_PATTERN, missing.errorCode());
        assertEquals(ErrorCode.INVALID_PATTERN, badCondition.errorCode());
        assertEquals(0, correlator.listBreakpoints().total());
    }

    @Test
    void evaluateBreakpoints_StructuralPattern_ShouldFireWhenConditionHolds() {
        // Arrange
        AstNode addition = calculator.stream()
                .filter(n -> n.is(AstKind.BINARY_OP) && "+".equals(n.operator()))
                .findFirst()
                .orElseThrow();
        StructuralBreakpoint breakpoint = correlator.setStructuralBreakpoint(new StructuralBreakpointRequest(
                op("+", 1, var("_", 1), var("_", 1)), "a > 0", List.of("function", "block"), null, null)).get();

        // Act
        List<BreakpointHit> positive = correlator.evaluateBreakpoints(addEvent(4)
                .astNodeId(addition.id()).variables(Map.of("a", 1)).build()).get();
        List<BreakpointHit> negative = correlator.evaluateBreakpoints(addEvent(4)
                .astNodeId(addition.id()).variables(Map.of("a", 0)).build()).get();

        // Assert
        assertEquals(1, positive.size());
        BreakpointHit hit = positive.get(0);
        assertEquals(breakpoint.id(), hit.breakpointId());
        assertEquals(BreakpointKind.STRUCTURAL, hit.kind());
        assertEquals(addition.id(), hit.details().get("matched_node"));
        assertEquals("binary_op", hit.details().get("matched_kind"));
        assertEquals(1, hit.hitCount());
        assertTrue(negative.isEmpty());
    }

    @Test
    void evaluateBreakpoints_DataFlow_ShouldFilterByFlowTags() {
        // Arrange
        DataFlowBreakpoint onDefinition = correlator.setDataFlowBreakpoint(
                new DataFlowBreakpointRequest("r", null, List.of("definition"), null, null)).get();
        DataFlowBreakpoint onAnything = correlator.setDataFlowBreakpoint(DataFlowBreakpointRequest.of("r")).get();

        // Act
        List<BreakpointHit> atAssignment = correlator.evaluateBreakpoints(addEvent(4).build()).get();
        List<BreakpointHit> atReturn = correlator.evaluateBreakpoints(addEvent(5).build()).get();

        // Assert
        assertEquals(List.of(onDefinition.id(), onAnything.id()),
                atAssignment.stream().map(BreakpointHit::breakpointId).toList());
        assertTrue(((List<?>) atAssignment.get(0).details().get("flow")).contains("definition"));
        assertEquals(List.of(onAnything.id()), atReturn.stream().map(BreakpointHit::breakpointId).toList());
        assertEquals(2, atReturn.get(0).hitCount());
    }

    @Test
    void setDataFlowBreakpoint_BlankVariable_ShouldBeRejected() {
        assertEquals(ErrorCode.INVALID_VARIABLE,
                correlator.setDataFlowBreakpoint(DataFlowBreakpointRequest.of(" ")).errorCode());
        assertEquals(ErrorCode.INVALID_VARIABLE,
                correlator.setSemanticWatchpoint(WatchpointRequest.of(null)).errorCode());
    }

    @Test
    void evaluateBreakpoints_Watchpoint_ShouldRecordHistoryWithinScope() {
        // Arrange
        SemanticWatchpoint watchpoint = correlator.setSemanticWatchpoint(
                new WatchpointRequest("x", null, "MyApp.Calculator.bump", null, null)).get();

        // Act
        correlator.evaluateBreakpoints(bumpEvent(21, 11).build());
        correlator.evaluateBreakpoints(bumpEvent(24, 12).build());
        correlator.evaluateBreakpoints(ExecutionEvent.builder().module(MODULE).function("sign").arity(1)
                .line(11).variables(Map.of("x", 99)).build());

        // Assert
        List<SemanticWatchpoint.WatchedValue> history = correlator.watchHistory(watchpoint.id()).get();
        assertEquals(List.of(11, 12), history.stream().map(SemanticWatchpoint.WatchedValue::value).toList());
        assertEquals(24, history.get(1).line());
        assertEquals(ErrorCode.BREAKPOINT_NOT_FOUND, correlator.watchHistory("wp_missing").errorCode());
    }

    @Test
    void removeBreakpoint_ShouldForgetIt() {
        String id = correlator.setDataFlowBreakpoint(DataFlowBreakpointRequest.of("r")).get().id();

        assertTrue(correlator.removeBreakpoint(id).isSuccess());
        assertEquals(ErrorCode.BREAKPOINT_NOT_FOUND, correlator.removeBreakpoint(id).errorCode());
        assertEquals(0, correlator.listBreakpoints().total());
    }

    @Test
    void clearCaches_ShouldForceNewLookups() {
        ExecutionEvent event = addEvent(4).build();
        correlator.correlate(event);

        correlator.clearCaches();
        correlator.correlate(event);

        assertEquals(0, correlator.statistics().cacheHits());
    }

    private static ExecutionEvent.ExecutionEventBuilder addEvent(int line) {
        return ExecutionEvent.builder().module(MODULE).function("add").arity(2).line(line);
    }

    private static ExecutionEvent.ExecutionEventBuilder bumpEvent(int line, int x) {
        return ExecutionEvent.builder().module(MODULE).function("bump").arity(1).line(line).variables(Map.of("x", x));
    }
}
