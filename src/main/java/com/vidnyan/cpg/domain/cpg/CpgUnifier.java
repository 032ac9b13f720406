package com.vidnyan.cpg.domain.cpg;

import com.vidnyan.cpg.domain.ast.AstIndex;
import com.vidnyan.cpg.domain.ast.AstKind;
import com.vidnyan.cpg.domain.ast.AstNode;
import com.vidnyan.cpg.domain.cfg.CfgEdge;
import com.vidnyan.cpg.domain.cfg.CfgNode;
import com.vidnyan.cpg.domain.cfg.ControlFlowGraph;
import com.vidnyan.cpg.domain.common.AnalysisError;
import com.vidnyan.cpg.domain.common.ErrorCode;
import com.vidnyan.cpg.domain.common.Result;
import com.vidnyan.cpg.domain.dfg.DataFlowEdge;
import com.vidnyan.cpg.domain.dfg.DataFlowGraph;
import com.vidnyan.cpg.domain.dfg.Definition;
import com.vidnyan.cpg.domain.dfg.DefinitionKind;
import com.vidnyan.cpg.domain.dfg.PhiNode;
import com.vidnyan.cpg.domain.dfg.Use;
import com.vidnyan.cpg.domain.dfg.UseKind;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Merges a function's AST, CFG and DFG into one {@link CodePropertyGraph}.
 * Every CFG node and every DFG definition or use gets exactly one CPG node.
 */
@Slf4j
public class CpgUnifier {

    public Result<CodePropertyGraph> unify(AstNode function, ControlFlowGraph cfg, DataFlowGraph dfg) {
        try {
            CodePropertyGraph graph = new Assembly(function, cfg, dfg).run();
            log.debug("Unified CPG for {}: {}", function.signature(), graph.stats());
            return Result.success(graph);
        } catch (RuntimeException e) {
            log.warn("CPG build failed for {}: {}", function != null ? function.name() : null, e.getMessage());
            return Result.failure(AnalysisError.wrap(ErrorCode.CPG_BUILD_FAILED, e));
        }
    }

    private static final class NodeDraft {
        final CpgNodeId id;
        final CpgNodeType type;
        final Map<SourceGraph, Object> representations = new EnumMap<>(SourceGraph.class);
        final Map<String, Object> properties = new LinkedHashMap<>();

        NodeDraft(CpgNodeId id, CpgNodeType type) {
            this.id = id;
            this.type = type;
        }

        NodeDraft put(String key, Object value) {
            if (value != null) {
                properties.put(key, value);
            }
            return this;
        }
    }

    private static final class Assembly {
        private final AstNode function;
        private final ControlFlowGraph cfg;
        private final DataFlowGraph dfg;
        private final AstIndex ast;
        private final List<NodeDraft> nodes = new ArrayList<>();
        private final List<CpgEdge> edges = new ArrayList<>();
        private final Map<String, CpgNodeId> astIndex = new HashMap<>();
        private final Map<String, CpgNodeId> cfgIndex = new HashMap<>();
        private final Map<String, CpgNodeId> definitionIndex = new HashMap<>();
        private final Map<String, CpgNodeId> useIndex = new HashMap<>();

        Assembly(AstNode function, ControlFlowGraph cfg, DataFlowGraph dfg) {
            this.function = function;
            this.cfg = cfg;
            this.dfg = dfg;
            this.ast = AstIndex.of(function);
        }

        CodePropertyGraph run() {
            addAstNodes();
            addCfg();
            addDfg();
            linkCorrespondence();
            linkInfluence();
            linkAliases();
            return freeze();
        }

        private void addAstNodes() {
            function.stream().forEach(node -> {
                CpgNodeType type = node == function ? CpgNodeType.FUNCTION
                        : node.is(AstKind.CALL) ? CpgNodeType.CALL_EXPRESSION : CpgNodeType.AST_NODE;
                NodeDraft draft = newNode(type, SourceGraph.AST, node)
                        .put("ast_kind", node.kind().name())
                        .put("name", node.is(AstKind.CALL) ? node.qualifiedName() : node.name())
                        .put("operator", node.operator())
                        .put("line", node.line());
                astIndex.put(node.id(), draft.id);
            });
            function.stream().forEach(parent -> {
                for (int i = 0; i < parent.children().size(); i++) {
                    edge(astIndex.get(parent.id()), astIndex.get(parent.child(i).id()), CpgEdgeType.AST_CHILD,
                            Map.of("index", i));
                }
            });
        }

        private void addCfg() {
            for (CfgNode node : cfg.nodes()) {
                CpgNodeType type = switch (node.type()) {
                    case ENTRY -> CpgNodeType.ENTRY;
                    case EXIT -> CpgNodeType.EXIT;
                    case DECISION -> CpgNodeType.DECISION_POINT;
                    case MERGE -> CpgNodeType.MERGE_POINT;
                    case STATEMENT -> CpgNodeType.CONTROL_FLOW_NODE;
                };
                NodeDraft draft = newNode(type, SourceGraph.CFG, node)
                        .put("cfg_id", node.id())
                        .put("label", node.label())
                        .put("decision_kind", node.decisionKind() != null ? node.decisionKind().name() : null)
                        .put("scope", node.scopeId())
                        .put("nesting", node.nesting())
                        .put("line", node.line());
                cfgIndex.put(node.id(), draft.id);
            }
            for (CfgEdge edge : cfg.edges()) {
                Map<String, Object> props = new HashMap<>();
                props.put("edge_type", edge.type().name());
                props.put("probability", edge.probability());
                if (edge.condition() != null) {
                    props.put("condition", edge.condition());
                }
                edge(cfgIndex.get(edge.from()), cfgIndex.get(edge.to()), CpgEdgeType.CONTROL_FLOW, props);
            }
        }

        private void addDfg() {
            Map<String, PhiNode> phiByDefinition = new HashMap<>();
            dfg.phiNodes().forEach(p -> phiByDefinition.put(p.definitionId(), p));

            for (Definition def : dfg.definitions()) {
                PhiNode phi = phiByDefinition.get(def.id());
                NodeDraft draft = newNode(def.kind() == DefinitionKind.PHI ? CpgNodeType.PHI_NODE
                        : CpgNodeType.VARIABLE_DEFINITION, SourceGraph.DFG, def)
                        .put("variable", def.name())
                        .put("version", def.variable().key())
                        .put("definition_kind", def.kind().name())
                        .put("scope", def.scopeId())
                        .put("line", def.line())
                        .put("phi_id", phi != null ? phi.id() : null);
                definitionIndex.put(def.id(), draft.id);
            }
            for (Use use : dfg.uses()) {
                NodeDraft draft = newNode(CpgNodeType.VARIABLE_USE, SourceGraph.DFG, use)
                        .put("variable", use.name())
                        .put("version", use.variable().key())
                        .put("use_kind", use.kind().name())
                        .put("scope", use.scopeId())
                        .put("line", use.line());
                useIndex.put(use.id(), draft.id);
            }
            for (DataFlowEdge flow : dfg.edges()) {
                edge(definitionIndex.get(flow.definitionId()), useIndex.get(flow.useId()), CpgEdgeType.DATA_FLOW,
                        Map.of("flow_kind", flow.kind().name(), "transformation", flow.transformation()));
            }
            for (Definition def : dfg.definitions()) {
                for (String useId : def.sourceUses()) {
                    edge(useIndex.get(useId), definitionIndex.get(def.id()), CpgEdgeType.DERIVES, Map.of());
                }
            }
            for (PhiNode phi : dfg.phiNodes()) {
                for (int i = 0; i < phi.sources().size(); i++) {
                    int branch = i;
                    dfg.definitionOf(phi.sources().get(i)).ifPresent(source ->
                            edge(definitionIndex.get(source.id()), definitionIndex.get(phi.definitionId()),
                                    CpgEdgeType.PHI, Map.of("condition", phi.conditions().get(branch))));
                }
            }
        }

        /**
         * AST node to the CFG node executing it and to the definitions and uses it carries.
         * Calls nested inside a statement link to that statement's CFG node.
         */
        private void linkCorrespondence() {
            for (CfgNode node : cfg.nodes()) {
                CpgNodeId astId = astIndex.get(node.astNodeId());
                if (astId != null) {
                    edge(astId, cfgIndex.get(node.id()), CpgEdgeType.CORRESPONDS_TO, Map.of("view", "cfg"));
                }
            }
            function.stream()
                    .filter(n -> n.is(AstKind.CALL) && cfg.nodesForAst(n.id()).isEmpty())
                    .forEach(call -> executingCfgNode(call).ifPresent(cfgNode ->
                            edge(astIndex.get(call.id()), cfgIndex.get(cfgNode.id()), CpgEdgeType.CORRESPONDS_TO,
                                    Map.of("view", "cfg"))));
            for (Definition def : dfg.definitions()) {
                CpgNodeId astId = astIndex.get(def.astNodeId());
                if (astId != null) {
                    edge(astId, definitionIndex.get(def.id()), CpgEdgeType.CORRESPONDS_TO, Map.of("view", "dfg"));
                }
            }
            for (Use use : dfg.uses()) {
                CpgNodeId astId = astIndex.get(use.astNodeId());
                if (astId != null) {
                    edge(astId, useIndex.get(use.id()), CpgEdgeType.CORRESPONDS_TO, Map.of("view", "dfg"));
                }
            }
        }

        /**
         * Uses that steer a decision point and call arguments that feed a call.
         */
        private void linkInfluence() {
            for (Use use : dfg.uses()) {
                CpgNodeId useId = useIndex.get(use.id());
                executingCfgNode(ast.find(use.astNodeId()).orElse(null))
                        .filter(CfgNode::isDecision)
                        .ifPresent(decision -> edge(useId, cfgIndex.get(decision.id()), CpgEdgeType.INFLUENCES,
                                Map.of("use_kind", use.kind().name())));
                if (use.kind() == UseKind.CALL_ARGUMENT) {
                    ast.ancestorsOf(use.astNodeId()).stream()
                            .filter(a -> a.is(AstKind.CALL))
                            .findFirst()
                            .ifPresent(call -> edge(useId, astIndex.get(call.id()), CpgEdgeType.INFLUENCES,
                                    Map.of("use_kind", use.kind().name())));
                }
            }
        }

        /**
         * {@code y = x}: the new version of y aliases the version of x it was bound from.
         */
        private void linkAliases() {
            Map<String, Use> useByAst = new HashMap<>();
            dfg.uses().forEach(u -> useByAst.put(u.astNodeId(), u));
            for (Definition def : dfg.definitions()) {
                if (def.kind() != DefinitionKind.ASSIGNMENT) {
                    continue;
                }
                ast.parentOf(def.astNodeId())
                        .filter(p -> p.is(AstKind.ASSIGNMENT) && p.child(1).is(AstKind.VARIABLE))
                        .map(p -> useByAst.get(p.child(1).id()))
                        .ifPresent(source -> edge(definitionIndex.get(def.id()),
                                definitionIndex.get(source.reachingDefinition()), CpgEdgeType.ALIAS,
                                Map.of("variable", source.name())));
            }
        }

        private Optional<CfgNode> executingCfgNode(AstNode start) {
            if (start == null) {
                return Optional.empty();
            }
            List<AstNode> chain = new ArrayList<>();
            chain.add(start);
            chain.addAll(ast.ancestorsOf(start.id()));
            for (AstNode candidate : chain) {
                List<CfgNode> matches = cfg.nodesForAst(candidate.id());
                if (!matches.isEmpty()) {
                    return matches.stream().filter(CfgNode::isDecision).findFirst().or(() -> Optional.of(matches.get(0)));
                }
            }
            return Optional.empty();
        }

        private NodeDraft newNode(CpgNodeType type, SourceGraph graph, Object representation) {
            NodeDraft draft = new NodeDraft(new CpgNodeId(nodes.size()), type);
            draft.representations.put(graph, representation);
            draft.put("source_graph", graph.name());
            nodes.add(draft);
            return draft;
        }

        private void edge(CpgNodeId from, CpgNodeId to, CpgEdgeType type, Map<String, Object> properties) {
            if (from == null || to == null) {
                throw new IllegalStateException("Dangling " + type + " edge in " + function.signature());
            }
            edges.add(new CpgEdge(from, to, type, type.sourceGraph(), properties));
        }

        private CodePropertyGraph freeze() {
            Map<CpgNodeId, Map<String, List<CpgNodeId>>> relationships = new HashMap<>();
            for (CpgEdge edge : edges) {
                relationships.computeIfAbsent(edge.from(), k -> new LinkedHashMap<>())
                        .computeIfAbsent(edge.type().relationshipName(), k -> new ArrayList<>())
                        .add(edge.to());
            }
            List<CpgNode> frozen = nodes.stream()
                    .map(d -> new CpgNode(d.id, d.type, d.representations, d.properties,
                            relationships.getOrDefault(d.id, Map.of())))
                    .toList();
            return new CodePropertyGraph(function.signature(), frozen, edges, astIndex, cfgIndex,
                    definitionIndex, useIndex);
        }
    }
}
