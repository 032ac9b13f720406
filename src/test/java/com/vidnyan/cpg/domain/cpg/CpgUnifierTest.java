package com.vidnyan.cpg.domain.cpg;

import com.vidnyan.cpg.domain.ast.AstNode;
import com.vidnyan.cpg.domain.cfg.CfgBuilder;
import com.vidnyan.cpg.domain.cfg.CfgNode;
import com.vidnyan.cpg.domain.cfg.ControlFlowGraph;
import com.vidnyan.cpg.domain.dfg.DataFlowGraph;
import com.vidnyan.cpg.domain.dfg.Definition;
import com.vidnyan.cpg.domain.dfg.DfgBuilder;
import com.vidnyan.cpg.domain.dfg.Use;
import org.junit.jupiter.api.Test;

import static com.vidnyan.cpg.AstFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class CpgUnifierTest {

    private final CfgBuilder cfgBuilder = new CfgBuilder();
    private final DfgBuilder dfgBuilder = new DfgBuilder();
    private final CpgUnifier unifier = new CpgUnifier();

    @Test
    void unify_ShouldRepresentEveryNodeOfEverySourceGraph() {
        // Arrange
        AstNode function = bumpFunction();
        ControlFlowGraph cfg = cfgBuilder.build(function).get();
        DataFlowGraph dfg = dfgBuilder.build(function).get();

        // Act
        CodePropertyGraph cpg = unifier.unify(function, cfg, dfg).get();

        // Assert
        function.stream().forEach(n -> assertTrue(cpg.forAst(n.id()).isPresent(), n.id()));
        for (CfgNode node : cfg.nodes()) {
            assertTrue(cpg.forCfg(node.id()).isPresent(), node.id());
        }
        for (Definition def : dfg.definitions()) {
            assertTrue(cpg.forDefinition(def.id()).isPresent(), def.id());
        }
        for (Use use : dfg.uses()) {
            assertTrue(cpg.forUse(use.id()).isPresent(), use.id());
        }
        assertEquals(1, cpg.nodesOfType(CpgNodeType.FUNCTION).size());
        assertEquals(1, cpg.nodesOfType(CpgNodeType.PHI_NODE).size());
    }

    @Test
    void unify_EdgesShouldConnectExistingNodes() {
        AstNode function = bumpFunction();
        CodePropertyGraph cpg = unifier.unify(function,
                cfgBuilder.build(function).get(), dfgBuilder.build(function).get()).get();

        for (CpgEdge edge : cpg.edges()) {
            assertNotNull(edge.from(), edge.type().name());
            assertNotNull(edge.to(), edge.type().name());
            assertNotNull(cpg.node(edge.from()));
            assertNotNull(cpg.node(edge.to()));
        }
        assertEquals(2, cpg.edgesOfType(CpgEdgeType.PHI).size());
        assertFalse(cpg.edgesOfType(CpgEdgeType.CORRESPONDS_TO).isEmpty());
        assertEquals(function.stream().count() - 1, cpg.edgesOfType(CpgEdgeType.AST_CHILD).size());
    }

    @Test
    void stats_ShouldCountNodesPerType() {
        AstNode function = addFunction();
        CodePropertyGraph cpg = unifier.unify(function,
                cfgBuilder.build(function).get(), dfgBuilder.build(function).get()).get();

        CodePropertyGraph.Stats stats = cpg.stats();

        assertEquals(cpg.nodes().size(), stats.nodeCount());
        assertEquals(3, stats.nodesByType().get(CpgNodeType.VARIABLE_DEFINITION));
        assertEquals(1, stats.nodesByType().get(CpgNodeType.ENTRY));
        assertTrue(stats.edgesBySource().get(SourceGraph.CROSS) > 0);
    }

    @Test
    void nodesForVariable_ShouldReturnDefinitionsAndUses() {
        AstNode function = addFunction();
        CodePropertyGraph cpg = unifier.unify(function,
                cfgBuilder.build(function).get(), dfgBuilder.build(function).get()).get();

        assertEquals(2, cpg.nodesForVariable("r").size());
    }
}
