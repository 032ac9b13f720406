package com.vidnyan.cpg.domain.runtime;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Fires when {@code variable} is defined or read at the event's position through one of
 * {@code flowConditions} (flow tags such as {@code definition}, {@code use}, {@code conditional},
 * {@code pattern_match}), or through anything when the conditions contain {@code any}.
 */
public record DataFlowBreakpoint(
        String id,
        String variable,
        List<String> astPath,
        List<String> flowConditions,
        boolean enabled,
        Map<String, Object> metadata
) {
    public static final String ANY = "any";

    public DataFlowBreakpoint {
        astPath = List.copyOf(astPath);
        flowConditions = List.copyOf(flowConditions);
        metadata = Map.copyOf(metadata);
    }

    /** Flow tags that triggered the breakpoint; empty when it does not fire. */
    public Set<String> evaluate(RuntimeContext context) {
        if (!enabled || !Paths.containsInOrder(context.astContext().astPath(), astPath)) {
            return Set.of();
        }
        Set<String> tags = context.astContext().getDfgContext().flowTagsFor(variable);
        if (tags.isEmpty()) {
            return Set.of();
        }
        if (flowConditions.contains(ANY) || flowConditions.stream().anyMatch(tags::contains)) {
            return tags;
        }
        return Set.of();
    }
}
