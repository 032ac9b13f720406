package com.vidnyan.cpg.domain.analysis;

import com.vidnyan.cpg.domain.ast.AstNode;
import com.vidnyan.cpg.domain.ast.SourceLocation;
import com.vidnyan.cpg.domain.cfg.ComplexityMetrics;
import com.vidnyan.cpg.domain.cfg.ControlFlowGraph;
import com.vidnyan.cpg.domain.cpg.CodePropertyGraph;
import com.vidnyan.cpg.domain.dfg.DataFlowGraph;

/**
 * All graphs derived for one function.
 */
public record FunctionAnalysis(
    String module,
    String name,
    int arity,
    boolean isPublic,
    AstNode ast,
    ControlFlowGraph cfg,
    DataFlowGraph dfg,
    CodePropertyGraph cpg
) {

    public static String idOf(String module, String name, int arity) {
        return module + "." + name + "/" + arity;
    }

    /**
     * Fully qualified id, e.g. {@code MyApp.Worker.handle_call/3}.
     */
    public String id() {
        return idOf(module, name, arity);
    }

    public ComplexityMetrics metrics() {
        return cfg.metrics();
    }

    public SourceLocation location() {
        return ast.location();
    }

    public int startLine() {
        return ast.line();
    }

    public int endLine() {
        return Math.max(ast.location().endLine(), ast.line());
    }

    public boolean coversLine(int line) {
        return line >= startLine() && line <= endLine();
    }
}
