package com.vidnyan.cpg.adapter.out.repository;

import com.vidnyan.cpg.application.port.out.AnalysisRepository;
import com.vidnyan.cpg.application.port.out.QueryRelationProvider;
import com.vidnyan.cpg.domain.analysis.FunctionAnalysis;
import com.vidnyan.cpg.domain.analysis.ModuleAnalysis;
import com.vidnyan.cpg.domain.cfg.ComplexityMetrics;
import com.vidnyan.cpg.domain.query.Relation;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory store of module analyses, also serving them as query rows.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class InMemoryAnalysisRepository implements AnalysisRepository, QueryRelationProvider {

    private final Clock clock;

    private final Map<String, Stored> modules = new ConcurrentHashMap<>();

    private record Stored(ModuleAnalysis module, Instant storedAt, Instant lastAccess, long accessCount) {

        Stored touched(Instant now) {
            return new Stored(module, storedAt, now, accessCount + 1);
        }
    }

    @Override
    public void save(ModuleAnalysis module) {
        Instant now = clock.instant();
        modules.put(module.name(), new Stored(module, now, now, 0));
        log.debug("Stored module {} ({} functions)", module.name(), module.functions().size());
    }

    @Override
    public Optional<ModuleAnalysis> findModule(String name) {
        if (name == null) {
            return Optional.empty();
        }
        Stored stored = modules.computeIfPresent(name, (k, s) -> s.touched(clock.instant()));
        return Optional.ofNullable(stored).map(Stored::module);
    }

    @Override
    public Optional<FunctionAnalysis> findFunction(String module, String function, int arity) {
        return findModule(module).flatMap(m -> m.function(function, arity));
    }

    /** Does not count as an access of each module. */
    @Override
    public List<ModuleAnalysis> findAll() {
        return modules.values().stream()
                .map(Stored::module)
                .sorted(Comparator.comparing(ModuleAnalysis::name))
                .toList();
    }

    @Override
    public boolean remove(String name) {
        return name != null && modules.remove(name) != null;
    }

    @Override
    public Optional<AccessInfo> accessInfo(String name) {
        return Optional.ofNullable(name)
                .map(modules::get)
                .map(s -> new AccessInfo(s.storedAt(), s.lastAccess(), s.accessCount()));
    }

    @Override
    public int evictUnusedSince(Instant cutoff) {
        List<String> stale = modules.entrySet().stream()
                .filter(e -> e.getValue().lastAccess().isBefore(cutoff))
                .map(Map.Entry::getKey)
                .toList();
        stale.forEach(modules::remove);
        if (!stale.isEmpty()) {
            log.info("Evicted {} modules unused since {}", stale.size(), cutoff);
        }
        return stale.size();
    }

    @Override
    public List<Map<String, Object>> rows(Relation relation) {
        List<Map<String, Object>> rows = new ArrayList<>();
        for (ModuleAnalysis module : findAll()) {
            switch (relation) {
                case FUNCTIONS -> module.functions().forEach(f -> rows.add(functionRow(f)));
                case MODULES -> rows.add(moduleRow(module));
                case PATTERNS -> {
                    // served by the pattern matcher
                }
            }
        }
        return rows;
    }

    private static Map<String, Object> functionRow(FunctionAnalysis function) {
        ComplexityMetrics metrics = function.metrics();
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("id", function.id());
        row.put("module", function.module());
        row.put("name", function.name());
        row.put("function", function.name());
        row.put("arity", function.arity());
        row.put("visibility", function.isPublic() ? "public" : "private");
        row.put("file", function.location().filePath());
        row.put("line", function.startLine());
        row.put("end_line", function.endLine());
        row.put("complexity", metrics.cyclomatic());
        row.put("cyclomatic_complexity", metrics.cyclomatic());
        row.put("cognitive_complexity", metrics.cognitive());
        row.put("essential_complexity", metrics.essential());
        row.put("decision_points", metrics.decisionPoints());
        row.put("nesting_depth", metrics.nestingDepth());
        row.put("pattern_matches", metrics.patternMatchCount());
        row.put("guards", metrics.guardCount());
        row.put("max_pipe_chain", metrics.maxPipeChain());
        row.put("unreachable_nodes", metrics.unreachableNodes());
        row.put("maintainability", metrics.maintainability());
        row.put("variables", function.dfg().stats().variableCount());
        row.put("cpg_nodes", function.cpg().nodes().size());
        return row;
    }

    private static Map<String, Object> moduleRow(ModuleAnalysis module) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("name", module.name());
        row.put("module", module.name());
        row.put("file", module.file());
        row.put("line", module.location().line());
        row.put("function_count", module.functions().size());
        row.put("failed_functions", module.failures().size());
        row.put("behaviours", module.behaviours());
        row.put("directives", module.directives());
        row.put("total_complexity", module.totalComplexity());
        row.put("average_complexity", module.functions().isEmpty()
                ? 0.0
                : (double) module.totalComplexity() / module.functions().size());
        return row;
    }
}
