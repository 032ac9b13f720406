package com.vidnyan.cpg.domain.runtime;

import com.vidnyan.cpg.domain.analysis.FunctionAnalysis;
import com.vidnyan.cpg.domain.ast.AstIndex;
import com.vidnyan.cpg.domain.ast.AstKind;
import com.vidnyan.cpg.domain.ast.AstNode;
import com.vidnyan.cpg.domain.cfg.CfgNode;
import com.vidnyan.cpg.domain.cfg.CfgNodeType;
import com.vidnyan.cpg.domain.cfg.ControlFlowGraph;
import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Static position of an execution event: the function it ran in, the AST node id and line.
 * The AST node, CFG node and data-flow slice are resolved on first access and then kept,
 * so a cached context only pays for what its callers actually read.
 */
@Getter
public final class AstContext {

    private final FunctionAnalysis function;
    private final String astNodeId;
    private final int line;
    private final AstMetadata metadata;

    @Getter(lazy = true)
    private final AstIndex index = AstIndex.of(function.ast());
    @Getter(lazy = true)
    private final Optional<AstNode> astNode = locateAstNode();
    @Getter(lazy = true)
    private final Optional<CfgNode> cfgNode = locateCfgNode();
    @Getter(lazy = true)
    private final DfgContext dfgContext = DfgContext.at(function.dfg(), line);

    private AstContext(FunctionAnalysis function, String astNodeId, int line) {
        this.function = function;
        this.astNodeId = astNodeId;
        this.line = line;
        this.metadata = new AstMetadata(
                function.metrics().cyclomatic(),
                function.isPublic() ? "public" : "private",
                function.location().filePath(),
                function.startLine(),
                function.endLine());
    }

    /**
     * Context for an event inside {@code function}. A missing node id is synthesized as
     * {@code ShortModule.function/arity:line_N}; a missing line falls back to the function's first line.
     */
    public static AstContext resolve(FunctionAnalysis function, ExecutionEvent event) {
        int line = event.effectiveLine() != null ? event.effectiveLine() : function.startLine();
        String nodeId = event.getAstNodeId() != null
                ? event.getAstNodeId()
                : syntheticNodeId(function.module(), function.name(), function.arity(), line);
        return new AstContext(function, nodeId, line);
    }

    static String syntheticNodeId(String module, String function, int arity, int line) {
        String shortModule = module.startsWith("Elixir.") ? module.substring("Elixir.".length()) : module;
        int lastDot = shortModule.lastIndexOf('.');
        if (lastDot >= 0) {
            shortModule = shortModule.substring(lastDot + 1);
        }
        return shortModule + "." + function + "/" + arity + ":line_" + line;
    }

    public String module() {
        return function.module();
    }

    public String functionName() {
        return function.name();
    }

    public int arity() {
        return function.arity();
    }

    public String functionId() {
        return function.id();
    }

    public StructuralInfo structuralInfo() {
        Optional<AstNode> node = getAstNode();
        String type = node.map(n -> n.kind().name().toLowerCase()).orElse("function_call");
        int depth = node.map(n -> getIndex().depthOf(n.id())).orElse(0);
        return new StructuralInfo(type, depth, patternContext(node), controlFlowPosition());
    }

    public DataFlowInfo dataFlowInfo() {
        DfgContext slice = getDfgContext();
        List<String> definitions = slice.definitions().stream().map(d -> d.variable().key()).toList();
        List<String> uses = slice.uses().stream().map(u -> u.variable().key()).toList();
        FlowDirection direction = !definitions.isEmpty() ? FlowDirection.FORWARD
                : !uses.isEmpty() ? FlowDirection.BACKWARD
                : FlowDirection.NONE;
        return new DataFlowInfo(definitions, uses, slice.dependencies(), direction);
    }

    /** Ancestor kinds from the function root down to the resolved node, lower case. */
    public List<String> astPath() {
        return getAstNode()
                .map(n -> getIndex().ancestorsOf(n.id()).stream()
                        .map(a -> a.kind().name().toLowerCase())
                        .toList())
                .map(AstContext::reverse)
                .orElse(List.of());
    }

    private Optional<AstNode> locateAstNode() {
        AstIndex idx = getIndex();
        Optional<AstNode> byId = idx.find(astNodeId);
        return byId.isPresent() ? byId : idx.deepestAtLine(line);
    }

    private Optional<CfgNode> locateCfgNode() {
        ControlFlowGraph cfg = function.cfg();
        Optional<AstNode> node = getAstNode();
        if (node.isPresent()) {
            Optional<CfgNode> direct = firstStatement(cfg.nodesForAst(node.get().id()));
            if (direct.isPresent()) {
                return direct;
            }
            for (AstNode ancestor : getIndex().ancestorsOf(node.get().id())) {
                Optional<CfgNode> enclosing = firstStatement(cfg.nodesForAst(ancestor.id()));
                if (enclosing.isPresent()) {
                    return enclosing;
                }
            }
        }
        return firstStatement(cfg.nodes().stream().filter(n -> n.line() == line).toList());
    }

    private static Optional<CfgNode> firstStatement(List<CfgNode> candidates) {
        return candidates.stream()
                .filter(n -> n.type() != CfgNodeType.ENTRY && n.type() != CfgNodeType.EXIT)
                .findFirst();
    }

    private ControlFlowPosition controlFlowPosition() {
        Optional<CfgNode> node = getCfgNode();
        if (node.isEmpty()) {
            return ControlFlowPosition.SEQUENTIAL;
        }
        if (!function.cfg().reachableFromEntry().contains(node.get().id())) {
            return ControlFlowPosition.UNREACHABLE;
        }
        return switch (node.get().type()) {
            case ENTRY -> ControlFlowPosition.ENTRY;
            case EXIT -> ControlFlowPosition.EXIT;
            case DECISION -> ControlFlowPosition.DECISION;
            case MERGE -> ControlFlowPosition.MERGE;
            case STATEMENT -> ControlFlowPosition.SEQUENTIAL;
        };
    }

    private Map<String, Object> patternContext(Optional<AstNode> node) {
        Map<String, Object> context = new LinkedHashMap<>();
        if (node.isEmpty()) {
            return context;
        }
        List<AstNode> ancestors = getIndex().ancestorsOf(node.get().id());
        ancestors.stream()
                .filter(a -> a.kind().isBranching())
                .findFirst()
                .ifPresent(a -> context.put("enclosing_construct", a.kind().name().toLowerCase()));
        context.put("in_closure", ancestors.stream().anyMatch(a -> a.is(AstKind.FN)));
        context.put("in_comprehension", ancestors.stream().anyMatch(a -> a.is(AstKind.COMPREHENSION)));
        getCfgNode().ifPresent(cfgNode -> {
            if (cfgNode.scopeId() != null) {
                context.put("scope", cfgNode.scopeId());
            }
            context.put("nesting", cfgNode.nesting());
            if (cfgNode.decisionKind() != null) {
                context.put("decision_kind", cfgNode.decisionKind().name().toLowerCase());
            }
        });
        return context;
    }

    private static List<String> reverse(List<String> path) {
        List<String> reversed = new ArrayList<>(path);
        Collections.reverse(reversed);
        return reversed;
    }
}
