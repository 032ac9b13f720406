package com.vidnyan.cpg.application.service;

import com.vidnyan.cpg.application.port.in.CorrelateEventsUseCase;
import com.vidnyan.cpg.application.port.out.AnalysisRepository;
import com.vidnyan.cpg.config.EngineProperties;
import com.vidnyan.cpg.domain.analysis.FunctionAnalysis;
import com.vidnyan.cpg.domain.analysis.ModuleAnalysis;
import com.vidnyan.cpg.domain.ast.AstNode;
import com.vidnyan.cpg.domain.common.AnalysisError;
import com.vidnyan.cpg.domain.common.ErrorCode;
import com.vidnyan.cpg.domain.common.Result;
import com.vidnyan.cpg.domain.runtime.AstContext;
import com.vidnyan.cpg.domain.runtime.BreakpointCondition;
import com.vidnyan.cpg.domain.runtime.BreakpointHit;
import com.vidnyan.cpg.domain.runtime.BreakpointKind;
import com.vidnyan.cpg.domain.runtime.DataFlowBreakpoint;
import com.vidnyan.cpg.domain.runtime.EnhancedEvent;
import com.vidnyan.cpg.domain.runtime.ExecutionEvent;
import com.vidnyan.cpg.domain.runtime.ExecutionTrace;
import com.vidnyan.cpg.domain.runtime.RuntimeContext;
import com.vidnyan.cpg.domain.runtime.SemanticWatchpoint;
import com.vidnyan.cpg.domain.runtime.StructuralBreakpoint;
import com.vidnyan.cpg.domain.runtime.TraceBuilder;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Correlates execution events with analyzed functions and evaluates breakpoints against them.
 * Resolved contexts are cached per {@code module.function/arity:line} for the configured TTL.
 * Expired contexts and idle call stacks are dropped on lookup and by a scheduled purge.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RuntimeCorrelatorService implements CorrelateEventsUseCase {

    private final AnalysisRepository analysisRepository;
    private final BreakpointRegistry breakpoints;
    private final EngineProperties properties;
    private final Clock clock;

    private final Map<String, CachedContext> contextCache = new ConcurrentHashMap<>();
    private final Map<String, CallStack> callStacks = new ConcurrentHashMap<>();
    private final SecureRandom random = new SecureRandom();

    private final AtomicLong eventsCorrelated = new AtomicLong();
    private final AtomicLong contextLookups = new AtomicLong();
    private final AtomicLong cacheHits = new AtomicLong();
    private final AtomicLong cacheMisses = new AtomicLong();

    private record CachedContext(AstContext context, Instant storedAt) {

        boolean expiredAt(Instant now, long ttlMs) {
            return !storedAt.plusMillis(ttlMs).isAfter(now);
        }
    }

    /** Recent calls of one correlation id; guarded by its own monitor. */
    private static final class CallStack {
        private final Deque<String> calls = new ArrayDeque<>();
        private volatile Instant lastSeen;

        CallStack(Instant lastSeen) {
            this.lastSeen = lastSeen;
        }
    }

    @Override
    public Result<AstContext> correlate(ExecutionEvent event) {
        Result<Void> valid = validate(event);
        if (valid.isFailure()) {
            return Result.failure(valid.error());
        }
        contextLookups.incrementAndGet();
        String key = cacheKey(event);
        Instant now = clock.instant();
        CachedContext cached = contextCache.get(key);
        if (cached != null) {
            if (!cached.expiredAt(now, properties.getCorrelator().getCacheTtlMs())) {
                cacheHits.incrementAndGet();
                eventsCorrelated.incrementAndGet();
                return Result.success(withNodeId(cached.context(), event));
            }
            contextCache.remove(key, cached);
        }
        cacheMisses.incrementAndGet();

        Optional<ModuleAnalysis> module = analysisRepository.findModule(event.getModule());
        if (module.isEmpty()) {
            return Result.failure(ErrorCode.MODULE_NOT_FOUND, "Module not analyzed: " + event.getModule());
        }
        Optional<FunctionAnalysis> function = module.get().function(event.getFunction(), event.getArity());
        if (function.isEmpty()) {
            return Result.failure(ErrorCode.FUNCTION_NOT_FOUND, "Function not found: " + event.functionKey());
        }
        try {
            AstContext context = AstContext.resolve(function.get(), event);
            contextCache.put(key, new CachedContext(context, now));
            eventsCorrelated.incrementAndGet();
            log.debug("Correlated {} to {}", event.functionKey(), context.getAstNodeId());
            return Result.success(context);
        } catch (RuntimeException e) {
            log.error("Correlation failed for {}", event.functionKey(), e);
            return Result.failure(AnalysisError.wrap(ErrorCode.INTERNAL_ERROR, e));
        }
    }

    @Override
    public Result<RuntimeContext> runtimeContext(ExecutionEvent event) {
        return correlate(event).flatMap(context -> {
            try {
                return Result.success(RuntimeContext.of(context, event, callContext(event)));
            } catch (RuntimeException e) {
                log.error("Runtime context failed for {}", event.functionKey(), e);
                return Result.failure(AnalysisError.wrap(ErrorCode.INTERNAL_ERROR, e));
            }
        });
    }

    @Override
    public Result<EnhancedEvent> enhance(ExecutionEvent event) {
        return correlate(event).flatMap(context -> {
            try {
                return Result.success(EnhancedEvent.of(event, context, clock.instant()));
            } catch (RuntimeException e) {
                log.error("Event enhancement failed for {}", event.functionKey(), e);
                return Result.failure(AnalysisError.wrap(ErrorCode.INTERNAL_ERROR, e));
            }
        });
    }

    @Override
    public Result<ExecutionTrace> buildTrace(List<ExecutionEvent> events) {
        if (events == null) {
            return Result.failure(ErrorCode.NIL_EVENT, "Trace needs a list of events");
        }
        List<EnhancedEvent> enhanced = new ArrayList<>(events.size());
        int passedThrough = 0;
        for (ExecutionEvent event : events) {
            if (event == null) {
                continue;
            }
            Result<EnhancedEvent> result = enhance(event);
            if (result.isSuccess()) {
                enhanced.add(result.get());
            } else {
                passedThrough++;
                enhanced.add(EnhancedEvent.passThrough(event));
            }
        }
        String traceId = "trace_" + randomHex();
        log.info("Built trace {} from {} events ({} uncorrelated)", traceId, enhanced.size(), passedThrough);
        try {
            return Result.success(TraceBuilder.build(traceId, clock.instant(), enhanced));
        } catch (RuntimeException e) {
            log.error("Trace construction failed", e);
            return Result.failure(AnalysisError.wrap(ErrorCode.INTERNAL_ERROR, e));
        }
    }

    @Override
    public Result<StructuralBreakpoint> setStructuralBreakpoint(StructuralBreakpointRequest request) {
        if (request == null || request.pattern() == null) {
            return Result.failure(ErrorCode.INVALID_PATTERN, "Structural breakpoint needs an AST pattern");
        }
        Optional<BreakpointCondition> condition = BreakpointCondition.parse(request.condition());
        if (condition.isEmpty()) {
            return Result.failure(ErrorCode.INVALID_PATTERN, "Unsupported breakpoint condition: " + request.condition());
        }
        StructuralBreakpoint breakpoint = new StructuralBreakpoint(
                breakpoints.nextId(BreakpointKind.STRUCTURAL),
                request.pattern(),
                condition.get(),
                orEmpty(request.astPath()),
                request.enabled() == null || request.enabled(),
                orEmpty(request.metadata()));
        breakpoints.add(breakpoint);
        log.info("Structural breakpoint {} set", breakpoint.id());
        return Result.success(breakpoint);
    }

    @Override
    public Result<DataFlowBreakpoint> setDataFlowBreakpoint(DataFlowBreakpointRequest request) {
        if (request == null || request.variable() == null || request.variable().isBlank()) {
            return Result.failure(ErrorCode.INVALID_VARIABLE, "Data-flow breakpoint needs a variable");
        }
        List<String> conditions = request.flowConditions() == null || request.flowConditions().isEmpty()
                ? List.of(DataFlowBreakpoint.ANY)
                : request.flowConditions();
        DataFlowBreakpoint breakpoint = new DataFlowBreakpoint(
                breakpoints.nextId(BreakpointKind.DATA_FLOW),
                request.variable(),
                orEmpty(request.astPath()),
                conditions,
                request.enabled() == null || request.enabled(),
                orEmpty(request.metadata()));
        breakpoints.add(breakpoint);
        log.info("Data-flow breakpoint {} set on {}", breakpoint.id(), breakpoint.variable());
        return Result.success(breakpoint);
    }

    @Override
    public Result<SemanticWatchpoint> setSemanticWatchpoint(WatchpointRequest request) {
        if (request == null || request.variable() == null || request.variable().isBlank()) {
            return Result.failure(ErrorCode.INVALID_VARIABLE, "Watchpoint needs a variable");
        }
        List<String> trackThrough = request.trackThrough() == null || request.trackThrough().isEmpty()
                ? List.of(SemanticWatchpoint.ALL)
                : request.trackThrough();
        SemanticWatchpoint watchpoint = new SemanticWatchpoint(
                breakpoints.nextId(BreakpointKind.WATCHPOINT),
                request.variable(),
                trackThrough,
                request.astScope(),
                request.enabled() == null || request.enabled(),
                orEmpty(request.metadata()));
        breakpoints.add(watchpoint);
        log.info("Watchpoint {} set on {}", watchpoint.id(), watchpoint.variable());
        return Result.success(watchpoint);
    }

    @Override
    public Breakpoints listBreakpoints() {
        return new Breakpoints(breakpoints.structural(), breakpoints.dataFlow(), breakpoints.watchpoints());
    }

    @Override
    public Result<Void> removeBreakpoint(String id) {
        if (id == null || !breakpoints.remove(id)) {
            return Result.failure(ErrorCode.BREAKPOINT_NOT_FOUND, "No breakpoint with id " + id);
        }
        log.info("Breakpoint {} removed", id);
        return Result.success(null);
    }

    @Override
    public Result<List<BreakpointHit>> evaluateBreakpoints(ExecutionEvent event) {
        Result<RuntimeContext> resolved = runtimeContext(event);
        if (resolved.isFailure()) {
            return Result.failure(resolved.error());
        }
        RuntimeContext context = resolved.get();
        AstContext ast = context.astContext();
        List<BreakpointHit> hits = new ArrayList<>();

        for (StructuralBreakpoint breakpoint : breakpoints.structural()) {
            breakpoint.evaluate(context).ifPresent(node -> {
                Map<String, Object> details = new LinkedHashMap<>();
                details.put("matched_node", node.id());
                details.put("matched_kind", node.kind().name().toLowerCase());
                details.put("condition", breakpoint.condition().text());
                hits.add(hit(breakpoint.id(), BreakpointKind.STRUCTURAL, ast, details));
            });
        }
        for (DataFlowBreakpoint breakpoint : breakpoints.dataFlow()) {
            Set<String> tags = breakpoint.evaluate(context);
            if (!tags.isEmpty()) {
                Map<String, Object> details = new LinkedHashMap<>();
                details.put("variable", breakpoint.variable());
                details.put("flow", tags.stream().sorted().toList());
                hits.add(hit(breakpoint.id(), BreakpointKind.DATA_FLOW, ast, details));
            }
        }
        for (SemanticWatchpoint watchpoint : breakpoints.watchpoints()) {
            if (watchpoint.observes(context)) {
                Object value = context.localVariables().get(watchpoint.variable());
                breakpoints.recordValue(watchpoint.id(),
                        new SemanticWatchpoint.WatchedValue(value, event.getTimestamp(), ast.getAstNodeId(), ast.getLine()));
                Map<String, Object> details = new LinkedHashMap<>();
                details.put("variable", watchpoint.variable());
                details.put("value", String.valueOf(value));
                hits.add(hit(watchpoint.id(), BreakpointKind.WATCHPOINT, ast, details));
            }
        }
        if (!hits.isEmpty()) {
            log.debug("{} breakpoint hits at {}", hits.size(), ast.getAstNodeId());
        }
        return Result.success(hits);
    }

    @Override
    public Result<List<SemanticWatchpoint.WatchedValue>> watchHistory(String watchpointId) {
        return breakpoints.history(watchpointId)
                .map(Result::success)
                .orElseGet(() -> Result.failure(ErrorCode.BREAKPOINT_NOT_FOUND, "No watchpoint with id " + watchpointId));
    }

    @Override
    public CorrelationStats statistics() {
        return new CorrelationStats(eventsCorrelated.get(), contextLookups.get(),
                cacheHits.get(), cacheMisses.get(), breakpoints.size(), contextCache.size(), callStacks.size());
    }

    /**
     * Drops contexts past their TTL and call stacks not extended within the TTL.
     *
     * @return number of entries removed
     */
    @Scheduled(fixedDelayString = "${cpg.correlator.purge-interval-ms:60000}")
    public int purgeExpired() {
        Instant now = clock.instant();
        long ttlMs = properties.getCorrelator().getCacheTtlMs();
        int before = contextCache.size() + callStacks.size();
        contextCache.values().removeIf(cached -> cached.expiredAt(now, ttlMs));
        callStacks.values().removeIf(stack -> !stack.lastSeen.plusMillis(ttlMs).isAfter(now));
        int removed = before - contextCache.size() - callStacks.size();
        if (removed > 0) {
            log.debug("Purged {} expired correlation entries", removed);
        }
        return Math.max(removed, 0);
    }

    @Override
    public void clearCaches() {
        int cleared = contextCache.size();
        contextCache.clear();
        callStacks.clear();
        log.info("Correlation caches cleared ({} contexts)", cleared);
    }

    private static Result<Void> validate(ExecutionEvent event) {
        if (event == null) {
            return Result.failure(ErrorCode.NIL_EVENT, "Event is nil");
        }
        if (event.getModule() == null || event.getModule().isBlank()) {
            return Result.failure(ErrorCode.MISSING_MODULE, "Event has no module");
        }
        if (event.getFunction() == null || event.getFunction().isBlank()) {
            return Result.failure(ErrorCode.MISSING_FUNCTION, "Event has no function");
        }
        return Result.success(null);
    }

    private static String cacheKey(ExecutionEvent event) {
        Integer line = event.effectiveLine();
        return event.functionKey() + ":" + (line != null ? line : "entry");
    }

    /** Cached contexts are shared per line; an explicit node id on the event takes precedence. */
    private static AstContext withNodeId(AstContext cached, ExecutionEvent event) {
        if (event.getAstNodeId() == null || event.getAstNodeId().equals(cached.getAstNodeId())) {
            return cached;
        }
        return AstContext.resolve(cached.getFunction(), event);
    }

    /**
     * Function keys seen earlier under the event's correlation id, oldest first. The event's own
     * function is appended afterwards.
     */
    private List<String> callContext(ExecutionEvent event) {
        if (event.getCorrelationId() == null) {
            return List.of();
        }
        Instant now = clock.instant();
        CallStack stack = callStacks.computeIfAbsent(event.getCorrelationId(), k -> new CallStack(now));
        List<String> previous;
        synchronized (stack) {
            stack.lastSeen = now;
            previous = List.copyOf(stack.calls);
            stack.calls.addLast(event.functionKey());
            while (stack.calls.size() > properties.getCorrelator().getCallContextDepth()) {
                stack.calls.removeFirst();
            }
        }
        evictIdleCallStacks(event.getCorrelationId());
        return previous;
    }

    private void evictIdleCallStacks(String keep) {
        int overflow = callStacks.size() - properties.getCorrelator().getMaxCallStacks();
        if (overflow <= 0) {
            return;
        }
        callStacks.entrySet().stream()
                .filter(e -> !e.getKey().equals(keep))
                .sorted(Comparator.comparing(e -> e.getValue().lastSeen))
                .limit(overflow)
                .map(Map.Entry::getKey)
                .toList()
                .forEach(callStacks::remove);
    }

    private BreakpointHit hit(String id, BreakpointKind kind, AstContext ast, Map<String, Object> details) {
        int count = breakpoints.recordHit(id);
        return new BreakpointHit(id, kind, ast.functionId(), ast.getAstNodeId(), ast.getLine(), count, details);
    }

    private String randomHex() {
        byte[] bytes = new byte[8];
        random.nextBytes(bytes);
        return HexFormat.of().formatHex(bytes);
    }

    private static <T> List<T> orEmpty(List<T> list) {
        return list == null ? List.of() : list;
    }

    private static Map<String, Object> orEmpty(Map<String, Object> map) {
        return map == null ? Map.of() : map;
    }
}
