package com.vidnyan.cpg.domain.analysis;

import com.vidnyan.cpg.domain.ast.AstNode;
import com.vidnyan.cpg.domain.ast.SourceLocation;
import com.vidnyan.cpg.domain.common.AnalysisError;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Analysis of a module: its functions plus module-level facts such as declared behaviours.
 *
 * @param failures functions that could not be analyzed; siblings are unaffected
 */
public record ModuleAnalysis(
    String name,
    AstNode ast,
    List<FunctionAnalysis> functions,
    List<AnalysisError> failures,
    List<String> behaviours,
    List<String> directives,
    Instant analyzedAt
) {

    public ModuleAnalysis {
        functions = List.copyOf(functions);
        failures = List.copyOf(failures);
        behaviours = List.copyOf(behaviours);
        directives = List.copyOf(directives);
    }

    public SourceLocation location() {
        return ast.location();
    }

    public String file() {
        return ast.location().filePath();
    }

    public Optional<FunctionAnalysis> function(String functionName, int arity) {
        return functions.stream()
                .filter(f -> f.name().equals(functionName) && f.arity() == arity)
                .findFirst();
    }

    public List<FunctionAnalysis> functionsNamed(String functionName) {
        return functions.stream().filter(f -> f.name().equals(functionName)).toList();
    }

    public boolean hasFunction(String functionName, int arity) {
        return function(functionName, arity).isPresent();
    }

    /**
     * True for {@code @behaviour X} or {@code use X}.
     */
    public boolean declares(String behaviour) {
        return behaviours.contains(behaviour) || directives.contains(behaviour);
    }

    public int totalComplexity() {
        return functions.stream().mapToInt(f -> f.metrics().cyclomatic()).sum();
    }
}
