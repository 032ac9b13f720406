package com.vidnyan.cpg.domain.runtime;

import java.util.List;
import java.util.Map;

/**
 * Tracks the values a variable takes within {@code astScope} (a module or function id prefix; null
 * for everywhere). {@code trackThrough} restricts recording to flow tags, {@code all} records every
 * observation.
 */
public record SemanticWatchpoint(
        String id,
        String variable,
        List<String> trackThrough,
        String astScope,
        boolean enabled,
        Map<String, Object> metadata
) {
    public static final String ALL = "all";

    public SemanticWatchpoint {
        trackThrough = List.copyOf(trackThrough);
        metadata = Map.copyOf(metadata);
    }

    public boolean observes(RuntimeContext context) {
        if (!enabled || !context.localVariables().containsKey(variable)) {
            return false;
        }
        if (astScope != null && !context.astContext().functionId().startsWith(astScope)) {
            return false;
        }
        if (trackThrough.contains(ALL)) {
            return true;
        }
        return context.astContext().getDfgContext().flowTagsFor(variable).stream()
                .anyMatch(trackThrough::contains);
    }

    public record WatchedValue(Object value, long timestamp, String astNodeId, int line) {}
}
