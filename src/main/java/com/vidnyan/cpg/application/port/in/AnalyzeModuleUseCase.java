package com.vidnyan.cpg.application.port.in;

import com.vidnyan.cpg.domain.analysis.ModuleAnalysis;
import com.vidnyan.cpg.domain.ast.AstNode;
import com.vidnyan.cpg.domain.common.AnalysisError;
import com.vidnyan.cpg.domain.common.Result;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Primary use case: build CFG, DFG and CPG for every function of a module AST and store the result.
 */
public interface AnalyzeModuleUseCase {

    /**
     * Analyze one module. Functions that fail are listed in the analysis, not fatal.
     */
    Result<ModuleAnalysis> analyze(AstNode module);

    /**
     * Analyze many modules in parallel, returning whatever finished within the timeout.
     */
    BatchResult analyzeAll(BatchRequest request);

    /**
     * Batch request; a null timeout uses the configured one.
     */
    record BatchRequest(
        List<AstNode> modules,
        Duration timeout
    ) {
        public static BatchRequest of(List<AstNode> modules) {
            return new BatchRequest(modules, null);
        }
    }

    /**
     * Batch outcome with partial results.
     */
    record BatchResult(
        List<ModuleAnalysis> analyzed,
        Map<String, AnalysisError> failures,
        List<String> timedOut,
        BatchStats stats
    ) {
        public boolean isComplete() {
            return failures.isEmpty() && timedOut.isEmpty();
        }
    }

    record BatchStats(
        int modulesRequested,
        int modulesAnalyzed,
        int functionsAnalyzed,
        int functionFailures,
        long totalDurationMs
    ) {}
}
