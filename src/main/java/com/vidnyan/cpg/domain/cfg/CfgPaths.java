package com.vidnyan.cpg.domain.cfg;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Bounded enumeration of entry-to-exit paths.
 * Function graphs are acyclic; the visited set only guards against malformed input.
 */
public final class CfgPaths {

    public static final int DEFAULT_MAX_PATHS = 1000;

    private CfgPaths() {
    }

    public static PathSummary summarize(ControlFlowGraph graph) {
        return summarize(graph, DEFAULT_MAX_PATHS);
    }

    public static PathSummary summarize(ControlFlowGraph graph, int maxPaths) {
        List<List<String>> paths = new ArrayList<>();
        walk(graph, graph.entryId(), new ArrayList<>(), new HashSet<>(), paths, maxPaths);
        int shortest = paths.stream().mapToInt(List::size).min().orElse(0);
        int longest = paths.stream().mapToInt(List::size).max().orElse(0);
        List<String> critical = paths.stream()
                .filter(p -> p.size() == longest)
                .findFirst()
                .orElse(List.of());
        return new PathSummary(paths.size(), shortest, longest, paths.size() >= maxPaths, critical);
    }

    private static void walk(ControlFlowGraph graph, String current, List<String> path, Set<String> onPath,
                             List<List<String>> paths, int maxPaths) {
        if (paths.size() >= maxPaths || !onPath.add(current)) {
            return;
        }
        path.add(current);
        List<CfgEdge> out = graph.outgoing(current);
        if (out.isEmpty()) {
            paths.add(List.copyOf(path));
        } else {
            for (CfgEdge edge : out) {
                walk(graph, edge.to(), path, onPath, paths, maxPaths);
            }
        }
        path.remove(path.size() - 1);
        onPath.remove(current);
    }

    /**
     * @param truncated  true when enumeration stopped at the path limit
     * @param criticalPath first longest path, as node ids
     */
    public record PathSummary(int pathCount, int shortestLength, int longestLength, boolean truncated,
                              List<String> criticalPath) {}
}
