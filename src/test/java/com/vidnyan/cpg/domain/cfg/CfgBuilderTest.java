package com.vidnyan.cpg.domain.cfg;

import com.vidnyan.cpg.domain.ast.AstKind;
import com.vidnyan.cpg.domain.ast.AstNode;
import com.vidnyan.cpg.domain.common.ErrorCode;
import com.vidnyan.cpg.domain.common.Result;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.vidnyan.cpg.AstFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class CfgBuilderTest {

    private final CfgBuilder builder = new CfgBuilder();

    @Test
    void build_StraightLineFunction_ShouldHaveComplexityOne() {
        // Act
        ControlFlowGraph cfg = builder.build(addFunction()).get();

        // Assert
        assertEquals(1, cfg.metrics().cyclomatic());
        assertEquals(0, cfg.metrics().decisionPoints());
        assertEquals(1, cfg.exitIds().size());
        assertEquals(1, cfg.nodesOfType(CfgNodeType.ENTRY).size());
        assertEquals(0, cfg.metrics().unreachableNodes());
        assertEquals(100.0 - 2.0, cfg.metrics().maintainability(), 0.001);
    }

    @Test
    void build_GuardedCase_ShouldCountDecisionPointsNotEdges() {
        // Act
        ControlFlowGraph cfg = builder.build(signFunction()).get();

        // Assert: two guards, irrefutable heads, so no separate case dispatch
        assertEquals(2, cfg.metrics().decisionPoints());
        assertEquals(3, cfg.metrics().cyclomatic());
        assertEquals(2, cfg.metrics().guardCount());
        assertTrue(cfg.decisionPoints().stream().allMatch(n -> n.decisionKind() == DecisionKind.GUARD));
    }

    @Test
    void build_FourClauseCase_ShouldContributeOneDecisionPoint() {
        // Arrange
        AstNode function = def("classify", 1, 8, params(1, var("x", 1)), block(2,
                caseOf(2, var("x", 2),
                        clause(3, lit(1, 3), block(3, lit("one", 3))),
                        clause(4, lit(2, 4), block(4, lit("two", 4))),
                        clause(5, lit(3, 5), block(5, lit("three", 5))),
                        clause(6, var("_", 6), block(6, lit("many", 6))))));

        // Act
        ControlFlowGraph cfg = builder.build(function).get();

        // Assert
        assertEquals(2, cfg.metrics().cyclomatic());
        CfgNode decision = cfg.decisionPoints().get(0);
        assertEquals(DecisionKind.CASE, decision.decisionKind());
        List<CfgEdge> out = cfg.outgoing(decision.id());
        assertEquals(4, out.size());
        assertTrue(out.stream().allMatch(e -> e.type() == CfgEdgeType.PATTERN_MATCH));
        assertTrue(out.stream().allMatch(e -> Math.abs(e.probability() - 0.25) < 1e-9));
        assertEquals(1, cfg.nodesOfType(CfgNodeType.MERGE).size());
    }

    @Test
    void build_IfWithoutElse_ShouldEmitTrueAndFalseBranches() {
        // Act
        ControlFlowGraph cfg = builder.build(bumpFunction()).get();

        // Assert
        assertEquals(2, cfg.metrics().cyclomatic());
        CfgNode decision = cfg.decisionPoints().get(0);
        assertEquals(DecisionKind.IF, decision.decisionKind());
        List<CfgEdgeType> types = cfg.outgoing(decision.id()).stream().map(CfgEdge::type).toList();
        assertTrue(types.contains(CfgEdgeType.CONDITIONAL_TRUE));
        assertTrue(types.contains(CfgEdgeType.CONDITIONAL_FALSE));
        assertEquals(1, cfg.metrics().nestingDepth());
    }

    @Test
    void build_StatementAfterRaise_ShouldBeUnreachable() {
        // Arrange
        AstNode function = def("fail", 1, 4, params(1), block(2,
                raise(2, lit("boom", 2)),
                lit("never", 3)));

        // Act
        ControlFlowGraph cfg = builder.build(function).get();

        // Assert
        assertEquals(1, cfg.metrics().unreachableNodes());
        assertEquals(2, cfg.exitIds().size());
    }

    @Test
    void build_FunctionWithoutBody_ShouldFailWithTaggedError() {
        // Arrange
        AstNode headless = AstNode.builder("bad", AstKind.FUNCTION).name("broken").child(params(1)).build();

        // Act
        Result<ControlFlowGraph> result = builder.build(headless);

        // Assert
        assertTrue(result.isFailure());
        assertEquals(ErrorCode.CFG_GENERATION_FAILED, result.errorCode());
    }

    @Test
    void build_NonFunctionNode_ShouldFail() {
        Result<ControlFlowGraph> result = builder.build(var("x", 1));

        assertEquals(ErrorCode.CFG_GENERATION_FAILED, result.errorCode());
    }

    @Test
    void build_CondWithCatchAll_ShouldBranchOncePerCondition() {
        // Arrange
        AstNode function = def("grade", 1, 7, params(1, var("x", 1)), block(2,
                cond(2,
                        clause(3, op(">", 3, var("x", 3), lit(90, 3)), block(3, lit("a", 3))),
                        clause(4, op(">", 4, var("x", 4), lit(50, 4)), block(4, lit("b", 4))),
                        clause(5, lit(true, 5), block(5, lit("c", 5))))));

        // Act
        ControlFlowGraph cfg = builder.build(function).get();

        // Assert
        assertEquals(1, cfg.metrics().decisionPoints());
        assertEquals(2, cfg.metrics().cyclomatic());
        CfgNode decision = cfg.decisionPoints().get(0);
        assertEquals(DecisionKind.COND, decision.decisionKind());
        List<CfgEdge> out = cfg.outgoing(decision.id());
        assertEquals(3, out.size());
        assertTrue(out.stream().allMatch(e -> e.type() == CfgEdgeType.CONDITIONAL_TRUE));
        assertTrue(out.stream().allMatch(e -> Math.abs(e.probability() - 1.0 / 3.0) < 1e-9));
        assertEquals(2, cfg.metrics().cognitive());
        assertEquals(1, cfg.metrics().nestingDepth());
        assertEquals(1, cfg.nodesOfType(CfgNodeType.MERGE).size());
        assertEquals(1, cfg.exitIds().size());
    }

    @Test
    void build_CondWithoutCatchAll_ShouldRouteNoMatchToErrorExit() {
        // Arrange
        AstNode function = def("grade", 1, 5, params(1, var("x", 1)), block(2,
                cond(2,
                        clause(3, op(">", 3, var("x", 3), lit(0, 3)), block(3, lit("pos", 3))),
                        clause(4, op("<", 4, var("x", 4), lit(0, 4)), block(4, lit("neg", 4))))));

        // Act
        ControlFlowGraph cfg = builder.build(function).get();

        // Assert
        CfgNode decision = cfg.decisionPoints().get(0);
        List<CfgEdgeType> types = cfg.outgoing(decision.id()).stream().map(CfgEdge::type).toList();
        assertEquals(List.of(CfgEdgeType.CONDITIONAL_TRUE, CfgEdgeType.CONDITIONAL_TRUE, CfgEdgeType.CONDITIONAL_FALSE),
                types.stream().sorted().toList());
        assertEquals(2, cfg.exitIds().size());
        assertEquals(2, cfg.metrics().cyclomatic());
        assertEquals(2, cfg.metrics().essential());
    }

    @Test
    void build_TryRescueAfter_ShouldJoinBodyAndHandlerBeforeAfterBlock() {
        // Arrange
        AstNode handler = lit("error", 4);
        AstNode cleanup = call("cleanup", 5);
        AstNode function = def("safely", 1, 6, params(1, var("x", 1)), block(2,
                tryOf(2, block(3, call("risky", 3, var("x", 3))),
                        rescue(4, var("e", 4), block(4, handler)),
                        after(5, block(5, cleanup)))));

        // Act
        ControlFlowGraph cfg = builder.build(function).get();

        // Assert
        assertEquals(2, cfg.metrics().cyclomatic());
        CfgNode decision = cfg.decisionPoints().get(0);
        assertEquals(DecisionKind.TRY, decision.decisionKind());
        List<CfgEdge> out = cfg.outgoing(decision.id());
        assertEquals(List.of(CfgEdgeType.SEQUENTIAL, CfgEdgeType.EXCEPTION),
                out.stream().map(CfgEdge::type).sorted().toList());
        assertTrue(out.stream().allMatch(e -> e.probability() == 0.5));

        List<CfgEdge> intoHandler = cfg.incoming(nodeFor(cfg, handler).id());
        assertEquals(1, intoHandler.size());
        assertEquals(CfgEdgeType.EXCEPTION, intoHandler.get(0).type());
        assertEquals(decision.id(), intoHandler.get(0).from());

        List<CfgEdge> intoCleanup = cfg.incoming(nodeFor(cfg, cleanup).id());
        assertEquals(1, intoCleanup.size());
        assertEquals(CfgNodeType.MERGE, cfg.node(intoCleanup.get(0).from()).orElseThrow().type());
        assertEquals(1, cfg.exitIds().size());
        assertEquals(1, cfg.metrics().patternMatchCount());
    }

    @Test
    void build_ReceiveWithAfter_ShouldTreatTimeoutAsBranch() {
        // Arrange
        AstNode reply = call("reply", 3, var("from", 3));
        AstNode timedOut = lit("timeout", 5);
        AstNode function = def("await", 1, 6, params(1), block(2,
                receive(2,
                        clause(3, tuple(3, lit("ping", 3), var("from", 3)), block(3, reply)),
                        after(5, block(5, timedOut)))));

        // Act
        ControlFlowGraph cfg = builder.build(function).get();

        // Assert
        assertEquals(2, cfg.metrics().cyclomatic());
        CfgNode decision = cfg.decisionPoints().get(0);
        assertEquals(DecisionKind.RECEIVE, decision.decisionKind());
        CfgEdge message = cfg.incoming(nodeFor(cfg, reply).id()).get(0);
        CfgEdge timeout = cfg.incoming(nodeFor(cfg, timedOut).id()).get(0);
        assertEquals(CfgEdgeType.PATTERN_MATCH, message.type());
        assertEquals(CfgEdgeType.PATTERN_NO_MATCH, timeout.type());
        assertEquals("timeout", timeout.condition());
        assertEquals(decision.id(), timeout.from());
        assertEquals(0.5, timeout.probability());
        assertEquals(1, cfg.nodesOfType(CfgNodeType.MERGE).size());
    }

    @Test
    void build_ReceiveWithSingleClause_ShouldNotBranch() {
        AstNode function = def("await", 1, 4, params(1), block(2,
                receive(2, clause(3, var("msg", 3), block(3, var("msg", 3))))));

        ControlFlowGraph cfg = builder.build(function).get();

        assertEquals(0, cfg.metrics().decisionPoints());
        assertEquals(1, cfg.metrics().cyclomatic());
    }

    @Test
    void build_WithElse_ShouldSplitOnClauseMismatch() {
        // Arrange
        AstNode step = generator(2, tuple(2, lit("ok", 2), var("a", 2)), call("fetch", 2, var("id", 2)));
        AstNode success = var("a", 3);
        AstNode failure = var("reason", 4);
        AstNode function = def("load", 1, 5, params(1, var("id", 1)), block(2,
                with(2, step,
                        block(3, success),
                        clause(4, tuple(4, lit("error", 4), var("reason", 4)), block(4, failure)))));

        // Act
        ControlFlowGraph cfg = builder.build(function).get();

        // Assert
        assertEquals(2, cfg.metrics().cyclomatic());
        assertEquals(1, cfg.metrics().cognitive());
        CfgNode decision = cfg.decisionPoints().get(0);
        assertEquals(DecisionKind.WITH, decision.decisionKind());
        assertEquals(CfgNodeType.STATEMENT, nodeFor(cfg, step).type());
        assertEquals(decision.id(), cfg.outgoing(nodeFor(cfg, step).id()).get(0).to());

        CfgEdge matched = cfg.incoming(nodeFor(cfg, success).id()).get(0);
        CfgEdge mismatched = cfg.incoming(nodeFor(cfg, failure).id()).get(0);
        assertEquals(CfgEdgeType.PATTERN_MATCH, matched.type());
        assertEquals(CfgEdgeType.PATTERN_NO_MATCH, mismatched.type());
        assertEquals(0.5, mismatched.probability());
        assertEquals(2, cfg.metrics().patternMatchCount());
        assertEquals(1, cfg.exitIds().size());
    }

    @Test
    void summarize_ShouldCountEntryToExitPaths() {
        // Arrange
        ControlFlowGraph cfg = builder.build(bumpFunction()).get();

        // Act
        CfgPaths.PathSummary summary = CfgPaths.summarize(cfg);

        // Assert
        assertEquals(2, summary.pathCount());
        assertTrue(summary.longestLength() > summary.shortestLength());
        assertFalse(summary.truncated());
    }

    private static CfgNode nodeFor(ControlFlowGraph cfg, AstNode ast) {
        return cfg.nodesForAst(ast.id()).get(0);
    }
}
