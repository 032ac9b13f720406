package com.vidnyan.cpg.application.service;

import com.vidnyan.cpg.domain.runtime.BreakpointKind;
import com.vidnyan.cpg.domain.runtime.DataFlowBreakpoint;
import com.vidnyan.cpg.domain.runtime.SemanticWatchpoint;
import com.vidnyan.cpg.domain.runtime.StructuralBreakpoint;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.security.SecureRandom;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Registered breakpoints and watchpoints with their hit counts and watched-value history.
 * All mutation goes through this object's monitor.
 */
@Slf4j
@Component
public class BreakpointRegistry {

    private final SecureRandom random = new SecureRandom();

    private final Map<String, StructuralBreakpoint> structural = new LinkedHashMap<>();
    private final Map<String, DataFlowBreakpoint> dataFlow = new LinkedHashMap<>();
    private final Map<String, SemanticWatchpoint> watchpoints = new LinkedHashMap<>();
    private final Map<String, Integer> hitCounts = new LinkedHashMap<>();
    private final Map<String, List<SemanticWatchpoint.WatchedValue>> history = new LinkedHashMap<>();

    /** Fresh id such as {@code structural_bp_3f9a0c1de2b47a65}. */
    public synchronized String nextId(BreakpointKind kind) {
        String id;
        do {
            byte[] bytes = new byte[8];
            random.nextBytes(bytes);
            id = kind.idPrefix() + HexFormat.of().formatHex(bytes);
        } while (contains(id));
        return id;
    }

    public synchronized void add(StructuralBreakpoint breakpoint) {
        structural.put(breakpoint.id(), breakpoint);
        log.debug("Structural breakpoint set: {}", breakpoint.id());
    }

    public synchronized void add(DataFlowBreakpoint breakpoint) {
        dataFlow.put(breakpoint.id(), breakpoint);
        log.debug("Data-flow breakpoint set: {} on {}", breakpoint.id(), breakpoint.variable());
    }

    public synchronized void add(SemanticWatchpoint watchpoint) {
        watchpoints.put(watchpoint.id(), watchpoint);
        history.put(watchpoint.id(), new ArrayList<>());
        log.debug("Watchpoint set: {} on {}", watchpoint.id(), watchpoint.variable());
    }

    public synchronized List<StructuralBreakpoint> structural() {
        return List.copyOf(structural.values());
    }

    public synchronized List<DataFlowBreakpoint> dataFlow() {
        return List.copyOf(dataFlow.values());
    }

    public synchronized List<SemanticWatchpoint> watchpoints() {
        return List.copyOf(watchpoints.values());
    }

    public synchronized boolean remove(String id) {
        boolean removed = structural.remove(id) != null
                | dataFlow.remove(id) != null
                | watchpoints.remove(id) != null;
        hitCounts.remove(id);
        history.remove(id);
        return removed;
    }

    /** @return the hit count after this hit */
    public synchronized int recordHit(String id) {
        return hitCounts.merge(id, 1, Integer::sum);
    }

    public synchronized void recordValue(String watchpointId, SemanticWatchpoint.WatchedValue value) {
        List<SemanticWatchpoint.WatchedValue> values = history.get(watchpointId);
        if (values != null) {
            values.add(value);
        }
    }

    public synchronized Optional<List<SemanticWatchpoint.WatchedValue>> history(String watchpointId) {
        List<SemanticWatchpoint.WatchedValue> values = history.get(watchpointId);
        return values == null ? Optional.empty() : Optional.of(List.copyOf(values));
    }

    public synchronized int size() {
        return structural.size() + dataFlow.size() + watchpoints.size();
    }

    private boolean contains(String id) {
        return structural.containsKey(id) || dataFlow.containsKey(id) || watchpoints.containsKey(id);
    }
}
