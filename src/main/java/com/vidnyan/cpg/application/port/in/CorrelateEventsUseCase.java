package com.vidnyan.cpg.application.port.in;

import com.vidnyan.cpg.domain.ast.AstNode;
import com.vidnyan.cpg.domain.common.Result;
import com.vidnyan.cpg.domain.runtime.AstContext;
import com.vidnyan.cpg.domain.runtime.BreakpointHit;
import com.vidnyan.cpg.domain.runtime.DataFlowBreakpoint;
import com.vidnyan.cpg.domain.runtime.EnhancedEvent;
import com.vidnyan.cpg.domain.runtime.ExecutionEvent;
import com.vidnyan.cpg.domain.runtime.ExecutionTrace;
import com.vidnyan.cpg.domain.runtime.RuntimeContext;
import com.vidnyan.cpg.domain.runtime.SemanticWatchpoint;
import com.vidnyan.cpg.domain.runtime.StructuralBreakpoint;

import java.util.List;
import java.util.Map;

/**
 * Maps execution events onto analyzed code and drives structural debugging.
 */
public interface CorrelateEventsUseCase {

    Result<AstContext> correlate(ExecutionEvent event);

    Result<RuntimeContext> runtimeContext(ExecutionEvent event);

    Result<EnhancedEvent> enhance(ExecutionEvent event);

    /**
     * Enhance a batch and derive the trace views; uncorrelated events pass through.
     */
    Result<ExecutionTrace> buildTrace(List<ExecutionEvent> events);

    Result<StructuralBreakpoint> setStructuralBreakpoint(StructuralBreakpointRequest request);

    Result<DataFlowBreakpoint> setDataFlowBreakpoint(DataFlowBreakpointRequest request);

    Result<SemanticWatchpoint> setSemanticWatchpoint(WatchpointRequest request);

    Breakpoints listBreakpoints();

    Result<Void> removeBreakpoint(String id);

    /**
     * Evaluate every enabled breakpoint and watchpoint against one event.
     */
    Result<List<BreakpointHit>> evaluateBreakpoints(ExecutionEvent event);

    Result<List<SemanticWatchpoint.WatchedValue>> watchHistory(String watchpointId);

    CorrelationStats statistics();

    void clearCaches();

    /**
     * Structural breakpoint; {@code condition} defaults to {@code any}.
     */
    record StructuralBreakpointRequest(
        AstNode pattern,
        String condition,
        List<String> astPath,
        Boolean enabled,
        Map<String, Object> metadata
    ) {
        public static StructuralBreakpointRequest of(AstNode pattern) {
            return new StructuralBreakpointRequest(pattern, null, null, null, null);
        }
    }

    /**
     * Data-flow breakpoint; {@code flowConditions} defaults to {@code [any]}.
     */
    record DataFlowBreakpointRequest(
        String variable,
        List<String> astPath,
        List<String> flowConditions,
        Boolean enabled,
        Map<String, Object> metadata
    ) {
        public static DataFlowBreakpointRequest of(String variable) {
            return new DataFlowBreakpointRequest(variable, null, null, null, null);
        }
    }

    /**
     * Semantic watchpoint; {@code trackThrough} defaults to {@code [all]}.
     */
    record WatchpointRequest(
        String variable,
        List<String> trackThrough,
        String astScope,
        Boolean enabled,
        Map<String, Object> metadata
    ) {
        public static WatchpointRequest of(String variable) {
            return new WatchpointRequest(variable, null, null, null, null);
        }
    }

    record Breakpoints(
        List<StructuralBreakpoint> structural,
        List<DataFlowBreakpoint> dataFlow,
        List<SemanticWatchpoint> watchpoints
    ) {
        public int total() {
            return structural.size() + dataFlow.size() + watchpoints.size();
        }
    }

    record CorrelationStats(
        long eventsCorrelated,
        long contextLookups,
        long cacheHits,
        long cacheMisses,
        int breakpoints,
        int cachedContexts,
        int trackedCallStacks
    ) {}
}
