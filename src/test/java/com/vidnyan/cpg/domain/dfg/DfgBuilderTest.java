package com.vidnyan.cpg.domain.dfg;

import com.vidnyan.cpg.domain.ast.AstNode;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

import static com.vidnyan.cpg.AstFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class DfgBuilderTest {

    private final DfgBuilder builder = new DfgBuilder();

    @Test
    void build_StraightLineFunction_ShouldVersionEveryBinding() {
        // Act
        DataFlowGraph dfg = builder.build(addFunction()).get();

        // Assert
        Set<String> keys = dfg.variables().stream().map(VariableVersion::key).collect(Collectors.toSet());
        assertEquals(Set.of("a_0", "b_0", "r_0"), keys);
        assertEquals(1, dfg.definitionsOf("r").size());
        List<Use> rUses = dfg.usesOf("r");
        assertEquals(1, rUses.size());
        assertEquals("r_0", rUses.get(0).variable().key());
        assertTrue(dfg.version("a", 0).orElseThrow().parameter());
        assertTrue(dfg.diagnostics().isEmpty());
    }

    @Test
    void build_EveryVersion_ShouldHaveExactlyOneDefinition() {
        for (AstNode function : List.of(addFunction(), signFunction(), bumpFunction())) {
            DataFlowGraph dfg = builder.build(function).get();

            Map<String, Long> perVersion = dfg.definitions().stream()
                    .collect(Collectors.groupingBy(d -> d.variable().key(), Collectors.counting()));

            assertEquals(dfg.variables().size(), perVersion.size(), function.name());
            assertTrue(perVersion.values().stream().allMatch(c -> c == 1), function.name());
        }
    }

    @Test
    void build_RebindingInsideIf_ShouldInsertPhiAtMerge() {
        // Act
        DataFlowGraph dfg = builder.build(bumpFunction()).get();

        // Assert
        List<PhiNode> phis = dfg.phiNodesFor("x");
        assertEquals(1, phis.size());
        PhiNode phi = phis.get(0);
        Set<String> sources = phi.sources().stream().map(VariableVersion::key).collect(Collectors.toSet());
        assertEquals(Set.of("x_0", "x_1"), sources);
        assertEquals("x_2", phi.target().key());
        assertEquals(dfg.rootScope().id(), phi.target().scopeId());
        assertEquals(DefinitionKind.PHI, dfg.definition(phi.definitionId()).orElseThrow().kind());

        Use returned = dfg.usesOf("x").stream().filter(u -> u.line() == 24).findFirst().orElseThrow();
        assertEquals("x_2", returned.variable().key());
    }

    @Test
    void build_RebindingInCaseClauses_ShouldInsertPhiAtCaseMerge() {
        // Arrange: y = 0; case x do :a -> y = 1; :b -> y = 2; _ -> :none end; y
        AstNode caseNode = caseOf(3, var("x", 3),
                clause(4, lit("a", 4), block(4, assign(4, var("y", 4), lit(1, 4)))),
                clause(5, lit("b", 5), block(5, assign(5, var("y", 5), lit(2, 5)))),
                clause(6, var("_", 6), block(6, lit("none", 6))));
        AstNode function = def("pick", 1, 9, params(1, var("x", 1)), block(2,
                assign(2, var("y", 2), lit(0, 2)),
                caseNode,
                var("y", 8)));

        // Act
        DataFlowGraph dfg = builder.build(function).get();

        // Assert
        List<PhiNode> phis = dfg.phiNodesFor("y");
        assertEquals(1, phis.size());
        PhiNode phi = phis.get(0);
        assertEquals(caseNode.id(), phi.mergeAstNodeId());
        assertEquals(Set.of("y_0", "y_1", "y_2"),
                phi.sources().stream().map(VariableVersion::key).collect(Collectors.toSet()));
        assertEquals(3, phi.conditions().size());
        assertEquals("y_3", phi.target().key());
        assertEquals(dfg.rootScope().id(), phi.target().scopeId());
        assertTrue(dfg.phiNodesFor("x").isEmpty());

        Use returned = dfg.usesOf("y").stream().filter(u -> u.line() == 8).findFirst().orElseThrow();
        assertEquals("y_3", returned.variable().key());
        assertTrue(dfg.diagnostics().isEmpty());
    }

    @Test
    void build_BindingInEveryCondBranch_ShouldMergeThroughPhi() {
        // Arrange
        AstNode function = def("label", 1, 8, params(1, var("x", 1)), block(2,
                cond(2,
                        clause(3, op(">", 3, var("x", 3), lit(0, 3)),
                                block(3, assign(3, var("label", 3), lit("positive", 3)))),
                        clause(4, lit(true, 4),
                                block(4, assign(4, var("label", 4), lit("other", 4))))),
                var("label", 6)));

        // Act
        DataFlowGraph dfg = builder.build(function).get();

        // Assert
        PhiNode phi = dfg.phiNodesFor("label").get(0);
        assertEquals(List.of("label_0", "label_1"), phi.sources().stream().map(VariableVersion::key).toList());
        assertEquals("label_2", phi.target().key());
        Use returned = dfg.usesOf("label").get(0);
        assertEquals("label_2", returned.variable().key());
        assertTrue(dfg.diagnostics(Diagnostic.Kind.UNDEFINED_VARIABLE).isEmpty());
    }

    @Test
    void build_BindingInOneCaseClause_ShouldNotBeVisibleInSiblingClause() {
        // Arrange: case x do {:ok, value} -> value; :error -> value end
        AstNode okClause = clause(3, tuple(3, lit("ok", 3), var("value", 3)), block(3, var("value", 3)));
        AstNode function = def("unwrap", 1, 5, params(1, var("x", 1)), block(2,
                caseOf(2, var("x", 2),
                        okClause,
                        clause(4, lit("error", 4), block(4, var("value", 4))))));

        // Act
        DataFlowGraph dfg = builder.build(function).get();

        // Assert
        VariableVersion bound = dfg.version("value", 0).orElseThrow();
        assertEquals("scope_" + okClause.id(), bound.scopeId());
        assertEquals(ScopeKind.CASE_CLAUSE, dfg.scope(bound.scopeId()).orElseThrow().kind());
        assertTrue(dfg.version("value", 1).isEmpty());
        assertTrue(dfg.phiNodesFor("value").isEmpty());

        List<Use> uses = dfg.usesOf("value");
        assertEquals(1, uses.size());
        assertEquals(3, uses.get(0).line());

        List<Diagnostic> undefined = dfg.diagnostics(Diagnostic.Kind.UNDEFINED_VARIABLE);
        assertEquals(1, undefined.size());
        assertEquals("value", undefined.get(0).variable());
        assertEquals(4, undefined.get(0).line());
    }

    @Test
    void build_UsesShouldStayWithinTheirDefinitionScope() {
        for (AstNode function : List.of(addFunction(), signFunction(), bumpFunction(), closureFunction())) {
            DataFlowGraph dfg = builder.build(function).get();
            Map<String, Definition> byId = dfg.definitions().stream()
                    .collect(Collectors.toMap(Definition::id, Function.identity()));

            for (Use use : dfg.uses()) {
                Definition reaching = byId.get(use.reachingDefinition());
                assertNotNull(reaching, use.id());
                assertTrue(dfg.isAncestorOrSelf(reaching.scopeId(), use.scopeId()),
                        use.variable().key() + " used outside its scope");
            }
        }
    }

    @Test
    void build_ReadOfUnboundName_ShouldReportUndefinedVariable() {
        // Arrange
        AstNode function = def("oops", 1, 3, params(1), block(2, var("missing", 2)));

        // Act
        DataFlowGraph dfg = builder.build(function).get();

        // Assert
        List<Diagnostic> undefined = dfg.diagnostics(Diagnostic.Kind.UNDEFINED_VARIABLE);
        assertEquals(1, undefined.size());
        assertEquals("missing", undefined.get(0).variable());
    }

    @Test
    void build_UnreadBinding_ShouldReportUnusedUnlessUnderscored() {
        // Arrange
        AstNode function = def("waste", 1, 5, params(1, var("a", 1)), block(2,
                assign(2, var("t", 2), var("a", 2)),
                assign(3, var("_ignored", 3), var("a", 3)),
                lit("ok", 4)));

        // Act
        DataFlowGraph dfg = builder.build(function).get();

        // Assert
        List<String> unused = dfg.diagnostics(Diagnostic.Kind.UNUSED_DEFINITION).stream()
                .map(Diagnostic::variable)
                .toList();
        assertEquals(List.of("t"), unused);
    }

    @Test
    void build_ClosureReadingOuterVariable_ShouldMarkCapture() {
        // Act
        DataFlowGraph dfg = builder.build(closureFunction()).get();

        // Assert
        assertTrue(dfg.version("k", 0).orElseThrow().captured());
        assertFalse(dfg.version("v", 0).orElseThrow().captured());
        assertTrue(dfg.usesOf("k").stream().anyMatch(u -> u.kind() == UseKind.CLOSURE_CAPTURE));
        assertTrue(dfg.edges().stream().anyMatch(e -> e.kind() == FlowKind.CLOSURE_CAPTURE));
    }

    @Test
    void lifetime_ShouldSpanFirstDefinitionToLastUse() {
        DataFlowGraph dfg = builder.build(bumpFunction()).get();

        DataFlowGraph.Lifetime lifetime = dfg.lifetime("x").orElseThrow();

        assertEquals(20, lifetime.firstDefinitionLine());
        assertEquals(24, lifetime.lastUseLine());
        assertEquals(3, lifetime.versionCount());
    }

    /** {@code def adder(k) do fn v -> v + k end end} */
    private static AstNode closureFunction() {
        return def("adder", 30, 33, params(30, var("k", 30)), block(31,
                fn(31, params(31, var("v", 31)), block(32, op("+", 32, var("v", 32), var("k", 32))))));
    }
}
