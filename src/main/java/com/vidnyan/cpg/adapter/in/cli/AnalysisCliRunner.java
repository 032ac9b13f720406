package com.vidnyan.cpg.adapter.in.cli;

import com.vidnyan.cpg.adapter.out.ast.AstJsonReader;
import com.vidnyan.cpg.application.port.in.AnalyzeModuleUseCase;
import com.vidnyan.cpg.application.port.in.MatchPatternsUseCase;
import com.vidnyan.cpg.domain.analysis.FunctionAnalysis;
import com.vidnyan.cpg.domain.analysis.ModuleAnalysis;
import com.vidnyan.cpg.domain.ast.AstNode;
import com.vidnyan.cpg.domain.cfg.ComplexityMetrics;
import com.vidnyan.cpg.domain.common.AnalysisError;
import com.vidnyan.cpg.domain.common.AnalysisException;
import com.vidnyan.cpg.domain.common.Result;
import com.vidnyan.cpg.domain.pattern.PatternMatch;
import com.vidnyan.cpg.domain.pattern.PatternSpec;
import com.vidnyan.cpg.domain.pattern.PatternType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * CLI runner for one-shot module analysis.
 * Runs when cpg.analyze.path points at a module AST exported as JSON.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AnalysisCliRunner implements CommandLineRunner {

    private final AnalyzeModuleUseCase analyzeModuleUseCase;
    private final MatchPatternsUseCase matchPatternsUseCase;
    private final AstJsonReader astJsonReader;
    private final ConfigurableApplicationContext context;

    @Value("${cpg.analyze.path:}")
    private String astPath;

    @Override
    public void run(String... args) {
        if (astPath == null || astPath.isBlank()) {
            log.info("No AST path specified. Set cpg.analyze.path property.");
            return;
        }

        int exitCode = 0;
        try {
            log.info("╔══════════════════════════════════════════════════════════════╗");
            log.info("║              CPG - Code Property Graph Engine                 ║");
            log.info("╠══════════════════════════════════════════════════════════════╣");
            log.info("║ Analyzing: {}", truncatePath(astPath, 50));
            log.info("╚══════════════════════════════════════════════════════════════╝");

            AstNode module = astJsonReader.read(Path.of(astPath));
            Result<ModuleAnalysis> result = analyzeModuleUseCase.analyze(module);
            if (result.isFailure()) {
                log.error("Analysis failed: {}", result.error().format());
                exitCode = 1;
                return;
            }

            printMetrics(result.get());
            printMatches(result.get());

            log.info("");
            log.info("Analysis complete!");
        } catch (AnalysisException e) {
            log.error("Cannot analyze {}: {}", astPath, e.getMessage());
            exitCode = 1;
        } finally {
            int code = exitCode;
            SpringApplication.exit(context, () -> code);
        }
    }

    private void printMetrics(ModuleAnalysis module) {
        log.info("");
        log.info("═══════════════════════════════════════════════════════════════");
        log.info(" MODULE {}", module.name());
        log.info("═══════════════════════════════════════════════════════════════");
        log.info(" Functions analyzed: {}", module.functions().size());
        log.info(" Functions failed:   {}", module.failures().size());
        log.info(" Total complexity:   {}", module.totalComplexity());
        log.info("───────────────────────────────────────────────────────────────");

        for (FunctionAnalysis function : module.functions()) {
            ComplexityMetrics m = function.metrics();
            log.info(" {} (line {})", function.id(), function.startLine());
            log.info("   cyclomatic={} cognitive={} nesting={} maintainability={}",
                    m.cyclomatic(), m.cognitive(), m.nestingDepth(), String.format("%.1f", m.maintainability()));
            if (m.unreachableNodes() > 0) {
                log.info("   unreachable nodes: {}", m.unreachableNodes());
            }
        }
        for (AnalysisError failure : module.failures()) {
            log.warn(" {}", failure.format());
        }
    }

    private void printMatches(ModuleAnalysis module) {
        List<PatternMatch> matches = new ArrayList<>();
        for (PatternType type : List.of(PatternType.BEHAVIORAL, PatternType.ANTI_PATTERN)) {
            Result<List<PatternMatch>> result = matchPatternsUseCase.match(module.name(), PatternSpec.named(type, null));
            if (result.isSuccess()) {
                matches.addAll(result.get());
            } else {
                log.warn("{} matching failed: {}", type, result.error().format());
            }
        }

        log.info("");
        log.info("═══════════════════════════════════════════════════════════════");
        log.info(" PATTERN MATCHES: {}", matches.size());
        log.info("═══════════════════════════════════════════════════════════════");
        for (PatternMatch match : matches) {
            log.info("");
            log.info(" {} [{}] confidence {}", match.severity(), match.patternName(),
                    String.format("%.2f", match.confidence()));
            log.info(" Location: {}", match.location().format());
            match.suggestions().forEach(s -> log.info("   - {}", s));
        }
    }

    private String truncatePath(String path, int maxLen) {
        if (path.length() <= maxLen)
            return path;
        return "..." + path.substring(path.length() - maxLen + 3);
    }
}
