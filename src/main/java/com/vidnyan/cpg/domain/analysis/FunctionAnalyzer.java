package com.vidnyan.cpg.domain.analysis;

import com.vidnyan.cpg.domain.ast.AstKind;
import com.vidnyan.cpg.domain.ast.AstNode;
import com.vidnyan.cpg.domain.cfg.CfgBuilder;
import com.vidnyan.cpg.domain.cfg.ControlFlowGraph;
import com.vidnyan.cpg.domain.common.AnalysisError;
import com.vidnyan.cpg.domain.common.ErrorCode;
import com.vidnyan.cpg.domain.common.Result;
import com.vidnyan.cpg.domain.cpg.CpgUnifier;
import com.vidnyan.cpg.domain.dfg.DataFlowGraph;
import com.vidnyan.cpg.domain.dfg.DfgBuilder;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * Runs the CFG and DFG builders and the CPG unifier for functions and whole modules.
 * Holds no per-call state.
 */
public class FunctionAnalyzer {

    private final CfgBuilder cfgBuilder;
    private final DfgBuilder dfgBuilder;
    private final CpgUnifier cpgUnifier;
    private final Clock clock;

    public FunctionAnalyzer(CfgBuilder cfgBuilder, DfgBuilder dfgBuilder, CpgUnifier cpgUnifier, Clock clock) {
        this.cfgBuilder = cfgBuilder;
        this.dfgBuilder = dfgBuilder;
        this.cpgUnifier = cpgUnifier;
        this.clock = clock;
    }

    public Result<FunctionAnalysis> analyze(String module, AstNode function) {
        Result<ControlFlowGraph> cfg = cfgBuilder.build(function);
        if (cfg.isFailure()) {
            return Result.failure(qualify(cfg.error(), module, function));
        }
        Result<DataFlowGraph> dfg = dfgBuilder.build(function);
        if (dfg.isFailure()) {
            return Result.failure(qualify(dfg.error(), module, function));
        }
        return cpgUnifier.unify(function, cfg.get(), dfg.get())
                .map(cpg -> new FunctionAnalysis(module, function.name(), function.arity(),
                        !"defp".equals(function.attributes().get("visibility")),
                        function, cfg.get(), dfg.get(), cpg));
    }

    /**
     * Analyze every function of a module. A failing function is recorded and its siblings still analyzed.
     */
    public Result<ModuleAnalysis> analyzeModule(AstNode module) {
        if (module == null || !module.is(AstKind.MODULE)) {
            return Result.failure(ErrorCode.INVALID_AST,
                    "Expected a MODULE node but got " + (module == null ? "null" : module.kind()));
        }
        if (module.name() == null || module.name().isBlank()) {
            return Result.failure(ErrorCode.INVALID_AST, "Module node " + module.id() + " has no name");
        }
        List<FunctionAnalysis> functions = new ArrayList<>();
        List<AnalysisError> failures = new ArrayList<>();
        for (AstNode function : module.childrenOfKind(AstKind.FUNCTION)) {
            Result<FunctionAnalysis> result = analyze(module.name(), function);
            if (result.isSuccess()) {
                functions.add(result.get());
            } else {
                failures.add(result.error());
            }
        }
        return Result.success(new ModuleAnalysis(module.name(), module, functions, failures,
                declared(module, "behaviour"), directives(module), clock.instant()));
    }

    private static List<String> declared(AstNode module, String attribute) {
        return module.childrenOfKind(AstKind.MODULE_ATTRIBUTE).stream()
                .filter(a -> attribute.equals(a.name()) && !a.children().isEmpty())
                .map(a -> String.valueOf(a.child(0).value()))
                .toList();
    }

    private static List<String> directives(AstNode module) {
        return module.childrenOfKind(AstKind.CALL).stream()
                .filter(c -> "use".equals(c.name()) && !c.children().isEmpty())
                .map(c -> String.valueOf(c.child(0).value()))
                .toList();
    }

    private static AnalysisError qualify(AnalysisError error, String module, AstNode function) {
        return new AnalysisError(error.code(),
                FunctionAnalysis.idOf(module, function.name(), function.arity()) + ": " + error.message(),
                error.cause());
    }
}
