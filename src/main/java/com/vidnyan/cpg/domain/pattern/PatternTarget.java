package com.vidnyan.cpg.domain.pattern;

import com.vidnyan.cpg.domain.analysis.FunctionAnalysis;
import com.vidnyan.cpg.domain.analysis.ModuleAnalysis;
import com.vidnyan.cpg.domain.ast.SourceLocation;

/**
 * What a predicate looks at: a module, or one function of it.
 */
public record PatternTarget(ModuleAnalysis module, FunctionAnalysis function) {

    public static PatternTarget of(ModuleAnalysis module) {
        return new PatternTarget(module, null);
    }

    public static PatternTarget of(ModuleAnalysis module, FunctionAnalysis function) {
        return new PatternTarget(module, function);
    }

    public boolean isFunction() {
        return function != null;
    }

    public SourceLocation location() {
        return function != null ? function.location() : module.location();
    }

    public String describe() {
        return function != null ? function.id() : module.name();
    }
}
