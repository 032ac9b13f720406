package com.vidnyan.cpg.application.service;

import com.vidnyan.cpg.application.port.in.AnalyzeModuleUseCase;
import com.vidnyan.cpg.application.port.out.AnalysisRepository;
import com.vidnyan.cpg.config.EngineProperties;
import com.vidnyan.cpg.domain.analysis.FunctionAnalysis;
import com.vidnyan.cpg.domain.analysis.FunctionAnalyzer;
import com.vidnyan.cpg.domain.analysis.ModuleAnalysis;
import com.vidnyan.cpg.domain.ast.AstNode;
import com.vidnyan.cpg.domain.cache.CacheType;
import com.vidnyan.cpg.domain.common.AnalysisError;
import com.vidnyan.cpg.domain.common.ErrorCode;
import com.vidnyan.cpg.domain.common.Result;
import com.vidnyan.cpg.domain.cpg.CodePropertyGraph;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.DigestUtils;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

/**
 * Application service that analyzes modules and keeps the results available to the
 * query engine, the pattern matcher and the runtime correlator.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CodeAnalysisService implements AnalyzeModuleUseCase {

    private final FunctionAnalyzer functionAnalyzer;
    private final AnalysisRepository analysisRepository;
    private final AnalysisCacheManager cacheManager;
    private final ExecutorService analysisExecutor;
    private final EngineProperties properties;

    @Override
    public Result<ModuleAnalysis> analyze(AstNode module) {
        Instant startTime = Instant.now();
        String name = module != null ? module.name() : null;
        log.info("Starting analysis of module: {}", name);

        // Step 1: Reuse an analysis of the identical AST if one is cached
        String cacheKey = analysisCacheKey(module);
        if (cacheKey != null) {
            Optional<ModuleAnalysis> cached = cacheManager.get(CacheType.ANALYSIS, cacheKey, ModuleAnalysis.class);
            if (cached.isPresent()) {
                log.info("Step 1: Analysis cache hit for {}", name);
                store(cached.get());
                return Result.success(cached.get());
            }
        }

        // Step 2: Build CFG, DFG and CPG per function
        log.info("Step 2: Building graphs...");
        Result<ModuleAnalysis> result;
        try {
            result = functionAnalyzer.analyzeModule(module);
        } catch (RuntimeException e) {
            log.error("Unexpected failure analyzing module {}", name, e);
            return Result.failure(AnalysisError.wrap(ErrorCode.INTERNAL_ERROR, e));
        }
        if (result.isFailure()) {
            log.warn("Module {} rejected: {}", name, result.error().format());
            return result;
        }
        ModuleAnalysis analysis = result.get();
        analysis.failures().forEach(f -> log.warn("  Function failed: {}", f.format()));
        log.info("Built graphs for {} functions ({} failed)", analysis.functions().size(), analysis.failures().size());

        // Step 3: Store and cache
        log.info("Step 3: Storing analysis...");
        store(analysis);
        cacheManager.put(CacheType.ANALYSIS, cacheKey, analysis);
        for (FunctionAnalysis function : analysis.functions()) {
            cacheManager.put(CacheType.CPG, function.id(), function.cpg());
        }

        log.info("Analysis of {} complete in {}ms", analysis.name(),
                Duration.between(startTime, Instant.now()).toMillis());
        return Result.success(analysis);
    }

    @Override
    public BatchResult analyzeAll(BatchRequest request) {
        Instant startTime = Instant.now();
        List<AstNode> modules = request.modules();
        Duration timeout = request.timeout() != null
                ? request.timeout()
                : Duration.ofMillis(properties.getBatch().getTimeoutMs());
        log.info("Starting batch analysis of {} modules (timeout {}ms)", modules.size(), timeout.toMillis());

        List<Callable<Result<ModuleAnalysis>>> tasks = modules.stream()
                .<Callable<Result<ModuleAnalysis>>>map(m -> () -> analyze(m))
                .toList();

        List<ModuleAnalysis> analyzed = new ArrayList<>();
        Map<String, AnalysisError> failures = new LinkedHashMap<>();
        List<String> timedOut = new ArrayList<>();

        List<Future<Result<ModuleAnalysis>>> futures;
        try {
            futures = analysisExecutor.invokeAll(tasks, timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Batch analysis interrupted");
            modules.forEach(m -> timedOut.add(labelOf(m)));
            return new BatchResult(analyzed, failures, timedOut, stats(modules, analyzed, startTime));
        }

        for (int i = 0; i < futures.size(); i++) {
            Future<Result<ModuleAnalysis>> future = futures.get(i);
            String label = labelOf(modules.get(i));
            if (future.isCancelled()) {
                timedOut.add(label);
                continue;
            }
            try {
                Result<ModuleAnalysis> result = future.get();
                if (result.isSuccess()) {
                    analyzed.add(result.get());
                } else {
                    failures.put(label, result.error());
                }
            } catch (ExecutionException e) {
                failures.put(label, AnalysisError.wrap(ErrorCode.INTERNAL_ERROR,
                        e.getCause() != null ? e.getCause() : e));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                timedOut.add(label);
            }
        }

        if (!timedOut.isEmpty()) {
            log.warn("Batch analysis timed out for {} modules: {}", timedOut.size(), timedOut);
        }
        BatchStats stats = stats(modules, analyzed, startTime);
        log.info("Batch analysis complete: {}/{} modules in {}ms",
                analyzed.size(), modules.size(), stats.totalDurationMs());
        return new BatchResult(analyzed, failures, timedOut, stats);
    }

    /**
     * CPG of a stored function, from the CPG cache when still present.
     */
    public Optional<CodePropertyGraph> findCpg(String module, String function, int arity) {
        String id = FunctionAnalysis.idOf(module, function, arity);
        Optional<CodePropertyGraph> cached = cacheManager.get(CacheType.CPG, id, CodePropertyGraph.class);
        if (cached.isPresent()) {
            return cached;
        }
        Optional<CodePropertyGraph> stored = analysisRepository.findFunction(module, function, arity)
                .map(FunctionAnalysis::cpg);
        stored.ifPresent(cpg -> cacheManager.put(CacheType.CPG, id, cpg));
        return stored;
    }

    private void store(ModuleAnalysis analysis) {
        analysisRepository.save(analysis);
        // query results derived from the previous contents are stale now
        cacheManager.clear(CacheType.QUERY);
    }

    private static String analysisCacheKey(AstNode module) {
        if (module == null || module.name() == null) {
            return null;
        }
        return module.name() + "@" + DigestUtils.md5DigestAsHex(module.canonical().getBytes(StandardCharsets.UTF_8));
    }

    private static String labelOf(AstNode module) {
        if (module == null) {
            return "<null>";
        }
        return module.name() != null ? module.name() : module.id();
    }

    private static BatchStats stats(List<AstNode> modules, List<ModuleAnalysis> analyzed, Instant startTime) {
        return new BatchStats(
                modules.size(),
                analyzed.size(),
                analyzed.stream().mapToInt(m -> m.functions().size()).sum(),
                analyzed.stream().mapToInt(m -> m.failures().size()).sum(),
                Duration.between(startTime, Instant.now()).toMillis());
    }
}
