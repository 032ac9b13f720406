package com.vidnyan.cpg.domain.cfg;

import com.vidnyan.cpg.domain.ast.AstKind;
import com.vidnyan.cpg.domain.ast.AstNode;
import com.vidnyan.cpg.domain.ast.AstPrinter;
import com.vidnyan.cpg.domain.ast.PatternShapes;
import com.vidnyan.cpg.domain.ast.ScopeIds;
import com.vidnyan.cpg.domain.common.AnalysisError;
import com.vidnyan.cpg.domain.common.AnalysisException;
import com.vidnyan.cpg.domain.common.ErrorCode;
import com.vidnyan.cpg.domain.common.Result;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Lowers one function's AST into a {@link ControlFlowGraph}.
 * Stateless: every call works on its own {@link BuildState}, so one instance can serve parallel builds.
 */
@Slf4j
public class CfgBuilder {

    public Result<ControlFlowGraph> build(AstNode function) {
        if (function == null || !function.is(AstKind.FUNCTION)) {
            return Result.failure(ErrorCode.CFG_GENERATION_FAILED,
                    "Expected a FUNCTION node but got " + (function == null ? "null" : function.kind()));
        }
        try {
            ControlFlowGraph graph = new BuildState(function).run();
            log.debug("Built CFG for {}: {} nodes, cyclomatic {}",
                    function.name(), graph.stats().nodeCount(), graph.metrics().cyclomatic());
            return Result.success(graph);
        } catch (AnalysisException e) {
            log.warn("CFG generation failed for {}: {}", function.name(), e.getMessage());
            return Result.failure(AnalysisError.wrap(ErrorCode.CFG_GENERATION_FAILED, e));
        } catch (RuntimeException e) {
            log.error("Unexpected error building CFG for {}", function.name(), e);
            return Result.failure(AnalysisError.wrap(ErrorCode.CFG_GENERATION_FAILED, e));
        }
    }

    /**
     * Outgoing edge whose target is not known yet.
     */
    private record Pending(String from, CfgEdgeType type, String condition, double probability) {}

    private record ClauseOutcome(List<Pending> exits, List<Pending> guardFailed) {}

    private static final class Draft {
        final String id;
        final CfgNodeType type;
        final DecisionKind decisionKind;
        final String astNodeId;
        final int line;
        final String scopeId;
        final int nesting;
        final String label;

        Draft(String id, CfgNodeType type, DecisionKind decisionKind, String astNodeId, int line,
              String scopeId, int nesting, String label) {
            this.id = id;
            this.type = type;
            this.decisionKind = decisionKind;
            this.astNodeId = astNodeId;
            this.line = line;
            this.scopeId = scopeId;
            this.nesting = nesting;
            this.label = label;
        }

        CfgNode toNode() {
            return new CfgNode(id, type, decisionKind, astNodeId, line, scopeId, nesting, label, null, null);
        }
    }

    private static final class BuildState {
        private final AstNode function;
        private final Map<String, Draft> nodes = new LinkedHashMap<>();
        private final List<CfgEdge> edges = new ArrayList<>();
        private final Deque<String> scopes = new ArrayDeque<>();
        private final Deque<List<Pending>> handlers = new ArrayDeque<>();
        private final List<Pending> abrupt = new ArrayList<>();
        private int counter;
        private int depth;
        private int maxDepth;

        BuildState(AstNode function) {
            this.function = function;
        }

        ControlFlowGraph run() {
            scopes.push(ScopeIds.of(function));
            String entry = newNode(CfgNodeType.ENTRY, null, function, "entry " + function.name());
            List<Pending> pending = sequential(entry);

            List<AstNode> clauses = function.childrenOfKind(AstKind.CLAUSE);
            if (!clauses.isEmpty()) {
                pending = lowerClauses(function, clauses, pending, DecisionKind.FUNCTION_CLAUSE);
            } else {
                AstNode body = function.firstChildOfKind(AstKind.BLOCK)
                        .orElseThrow(() -> new AnalysisException(ErrorCode.CFG_GENERATION_FAILED,
                                "Function " + function.name() + " has no body"));
                Optional<AstNode> guard = function.firstChildOfKind(AstKind.GUARD);
                if (guard.isPresent()) {
                    ClauseOutcome guarded = lowerGuard(guard.get(), pending);
                    abrupt.addAll(guarded.guardFailed());
                    pending = guarded.exits();
                }
                pending = lowerBlock(body, pending);
            }

            int exitLine = Math.max(function.location().endLine(), function.line());
            String exit = newNode(CfgNodeType.EXIT, null, function, "exit", exitLine);
            connect(pending, exit);
            List<String> exits = new ArrayList<>(List.of(exit));
            String errorExit = null;
            if (!abrupt.isEmpty()) {
                errorExit = newNode(CfgNodeType.EXIT, null, function, "error exit", exitLine);
                connect(abrupt, errorExit);
                exits.add(errorExit);
            }

            ControlFlowGraph graph = ControlFlowGraph.assemble(
                    function.signature(), entry, exits,
                    nodes.values().stream().map(Draft::toNode).toList(), edges);
            return graph.withMetrics(ComplexityCalculator.compute(graph, function, errorExit, maxDepth));
        }

        private List<Pending> lowerBlock(AstNode block, List<Pending> pending) {
            if (!block.is(AstKind.BLOCK)) {
                return lowerStatement(block, pending);
            }
            List<Pending> current = pending;
            for (AstNode statement : block.children()) {
                current = lowerStatement(statement, current);
            }
            return current;
        }

        private List<Pending> lowerStatement(AstNode node, List<Pending> pending) {
            return switch (node.kind()) {
                case CASE -> lowerCase(node, pending);
                case IF -> lowerIf(node, pending);
                case COND -> lowerCond(node, pending);
                case WITH -> lowerWith(node, pending);
                case TRY -> lowerTry(node, pending);
                case RECEIVE -> lowerReceive(node, pending);
                case BLOCK -> lowerBlock(node, pending);
                case RAISE -> {
                    String id = statement(node, pending);
                    raise(new Pending(id, CfgEdgeType.EXCEPTION, AstPrinter.render(node), 1.0));
                    yield List.of();
                }
                case ASSIGNMENT, CALL, PIPE, VARIABLE, LITERAL, INTERPOLATION, TUPLE, LIST, MAP,
                        BINARY_OP, UNARY_OP, FN, COMPREHENSION, SEND, PIN, MODULE_ATTRIBUTE ->
                        sequential(statement(node, pending));
                case MODULE, FUNCTION, PARAMETERS, CLAUSE, GUARD, CATCH_CLAUSE, AFTER, GENERATOR,
                        FILTER, MAP_ENTRY -> throw new AnalysisException(ErrorCode.CFG_GENERATION_FAILED,
                        "Unexpected " + node.kind() + " in statement position at line " + node.line());
            };
        }

        /**
         * Emit a statement node after lowering any branching construct nested in the expression.
         */
        private String statement(AstNode node, List<Pending> pending) {
            List<Pending> before = lowerNested(node, pending);
            String id = newNode(CfgNodeType.STATEMENT, null, node, AstPrinter.render(node));
            connect(before, id);
            return id;
        }

        private List<Pending> lowerExpression(AstNode expression, List<Pending> pending) {
            return expression.kind().isBranching()
                    ? lowerStatement(expression, pending)
                    : lowerNested(expression, pending);
        }

        private List<Pending> lowerNested(AstNode node, List<Pending> pending) {
            List<Pending> current = pending;
            for (int i = 0; i < node.children().size(); i++) {
                AstNode child = node.child(i);
                if (node.is(AstKind.ASSIGNMENT) && i == 0) {
                    continue;
                }
                // closures and comprehension bodies run in their own frames
                if (child.is(AstKind.FN) || child.is(AstKind.COMPREHENSION)) {
                    continue;
                }
                current = lowerExpression(child, current);
            }
            return current;
        }

        private List<Pending> lowerCase(AstNode node, List<Pending> pending) {
            List<Pending> afterSubject = lowerExpression(node.child(0), pending);
            return lowerClauses(node, node.childrenOfKind(AstKind.CLAUSE), afterSubject, DecisionKind.CASE);
        }

        /**
         * Clause dispatch is a decision point only when some non-final head can fail to match.
         * Otherwise the clauses form a guard chain tried in order.
         */
        private List<Pending> lowerClauses(AstNode owner, List<AstNode> clauses, List<Pending> pending,
                                           DecisionKind kind) {
            if (clauses.isEmpty()) {
                throw new AnalysisException(ErrorCode.CFG_GENERATION_FAILED,
                        owner.kind() + " at line " + owner.line() + " has no clauses");
            }
            int n = clauses.size();
            boolean decision = clauses.subList(0, n - 1).stream()
                    .anyMatch(c -> PatternShapes.isRefutable(c.child(0)));

            String decisionId = null;
            double probability = 1.0;
            if (decision) {
                decisionId = newNode(CfgNodeType.DECISION, kind, owner, kind.name().toLowerCase());
                connect(pending, decisionId);
                boolean exhaustive = !PatternShapes.isRefutable(clauses.get(n - 1).child(0));
                probability = 1.0 / (n + (exhaustive ? 0 : 1));
                if (!exhaustive) {
                    abrupt.add(new Pending(decisionId, CfgEdgeType.PATTERN_NO_MATCH, "no clause matched", probability));
                }
            }

            enterNesting();
            List<Pending> exits = new ArrayList<>();
            List<Pending> carry = decision ? List.of() : pending;
            for (int i = 0; i < n; i++) {
                AstNode clause = clauses.get(i);
                List<Pending> in = new ArrayList<>(carry);
                if (decision) {
                    in.add(new Pending(decisionId, CfgEdgeType.PATTERN_MATCH,
                            AstPrinter.render(clause.child(0)), probability));
                }
                ClauseOutcome outcome = lowerClause(clause, in);
                exits.addAll(outcome.exits());
                if (i < n - 1) {
                    carry = outcome.guardFailed();
                } else {
                    abrupt.addAll(outcome.guardFailed());
                }
            }
            exitNesting();
            return merge(owner, exits);
        }

        private ClauseOutcome lowerClause(AstNode clause, List<Pending> in) {
            scopes.push(ScopeIds.of(clause));
            try {
                List<Pending> bodyIn = in;
                List<Pending> failed = List.of();
                Optional<AstNode> guard = clause.firstChildOfKind(AstKind.GUARD);
                if (guard.isPresent()) {
                    ClauseOutcome guarded = lowerGuard(guard.get(), in);
                    bodyIn = guarded.exits();
                    failed = guarded.guardFailed();
                }
                return new ClauseOutcome(lowerBlock(clause.lastChild(), bodyIn), failed);
            } finally {
                scopes.pop();
            }
        }

        private ClauseOutcome lowerGuard(AstNode guard, List<Pending> in) {
            String condition = guard.children().isEmpty() ? "guard" : AstPrinter.render(guard.child(0));
            String id = newNode(CfgNodeType.DECISION, DecisionKind.GUARD, guard, "when " + condition);
            connect(in, id);
            return new ClauseOutcome(
                    List.of(new Pending(id, CfgEdgeType.CONDITIONAL_TRUE, condition, 0.5)),
                    List.of(new Pending(id, CfgEdgeType.CONDITIONAL_FALSE, condition, 0.5)));
        }

        private List<Pending> lowerIf(AstNode node, List<Pending> pending) {
            AstNode condition = node.child(0);
            String text = AstPrinter.render(condition);
            List<Pending> afterCondition = lowerExpression(condition, pending);
            String id = newNode(CfgNodeType.DECISION, DecisionKind.IF, node, "if " + text);
            connect(afterCondition, id);

            enterNesting();
            List<Pending> exits = new ArrayList<>(inScope(node.child(1),
                    List.of(new Pending(id, CfgEdgeType.CONDITIONAL_TRUE, text, 0.5))));
            List<Pending> elseIn = List.of(new Pending(id, CfgEdgeType.CONDITIONAL_FALSE, text, 0.5));
            exits.addAll(node.children().size() > 2 ? inScope(node.child(2), elseIn) : elseIn);
            exitNesting();
            return merge(node, exits);
        }

        private List<Pending> inScope(AstNode block, List<Pending> in) {
            scopes.push(ScopeIds.of(block));
            try {
                return lowerBlock(block, in);
            } finally {
                scopes.pop();
            }
        }

        private List<Pending> lowerCond(AstNode node, List<Pending> pending) {
            List<AstNode> clauses = node.childrenOfKind(AstKind.CLAUSE);
            if (clauses.isEmpty()) {
                throw new AnalysisException(ErrorCode.CFG_GENERATION_FAILED,
                        "cond at line " + node.line() + " has no clauses");
            }
            boolean catchAll = PatternShapes.isLiteralTrue(clauses.get(clauses.size() - 1).child(0));
            int outcomes = clauses.size() + (catchAll ? 0 : 1);
            if (outcomes < 2) {
                return lowerClause(clauses.get(0), pending).exits();
            }
            String id = newNode(CfgNodeType.DECISION, DecisionKind.COND, node, "cond");
            connect(pending, id);
            double probability = 1.0 / outcomes;

            enterNesting();
            List<Pending> exits = new ArrayList<>();
            for (AstNode clause : clauses) {
                exits.addAll(lowerClause(clause, List.of(new Pending(id, CfgEdgeType.CONDITIONAL_TRUE,
                        AstPrinter.render(clause.child(0)), probability))).exits());
            }
            exitNesting();
            if (!catchAll) {
                abrupt.add(new Pending(id, CfgEdgeType.CONDITIONAL_FALSE, "no condition matched", probability));
            }
            return merge(node, exits);
        }

        private List<Pending> lowerWith(AstNode node, List<Pending> pending) {
            List<Pending> current = pending;
            for (AstNode generator : node.childrenOfKind(AstKind.GENERATOR)) {
                current = lowerExpression(generator.child(1), current);
                String step = newNode(CfgNodeType.STATEMENT, null, generator, AstPrinter.render(generator));
                connect(current, step);
                current = sequential(step);
            }
            AstNode body = node.firstChildOfKind(AstKind.BLOCK)
                    .orElseThrow(() -> new AnalysisException(ErrorCode.CFG_GENERATION_FAILED,
                            "with at line " + node.line() + " has no body"));
            List<AstNode> elseClauses = node.childrenOfKind(AstKind.CLAUSE);

            String id = newNode(CfgNodeType.DECISION, DecisionKind.WITH, node, "with");
            connect(current, id);
            double probability = 1.0 / (1 + Math.max(1, elseClauses.size()));

            enterNesting();
            List<Pending> exits = new ArrayList<>(inScope(body,
                    List.of(new Pending(id, CfgEdgeType.PATTERN_MATCH, "all clauses matched", probability))));
            if (elseClauses.isEmpty()) {
                exits.add(new Pending(id, CfgEdgeType.PATTERN_NO_MATCH, "clause mismatch", probability));
            } else {
                List<Pending> carry = List.of();
                for (int i = 0; i < elseClauses.size(); i++) {
                    AstNode clause = elseClauses.get(i);
                    List<Pending> in = new ArrayList<>(carry);
                    in.add(new Pending(id, CfgEdgeType.PATTERN_NO_MATCH, AstPrinter.render(clause.child(0)), probability));
                    ClauseOutcome outcome = lowerClause(clause, in);
                    exits.addAll(outcome.exits());
                    carry = outcome.guardFailed();
                }
                abrupt.addAll(carry);
            }
            exitNesting();
            return merge(node, exits);
        }

        private List<Pending> lowerTry(AstNode node, List<Pending> pending) {
            AstNode body = node.child(0);
            List<AstNode> catches = node.childrenOfKind(AstKind.CATCH_CLAUSE);
            Optional<AstNode> after = node.firstChildOfKind(AstKind.AFTER);

            List<Pending> out;
            if (catches.isEmpty()) {
                String id = newNode(CfgNodeType.STATEMENT, null, node, "try");
                connect(pending, id);
                out = inScope(body, sequential(id));
            } else {
                String id = newNode(CfgNodeType.DECISION, DecisionKind.TRY, node, "try");
                connect(pending, id);
                double probability = 1.0 / (1 + catches.size());

                enterNesting();
                handlers.push(new ArrayList<>());
                List<Pending> exits = new ArrayList<>(inScope(body,
                        List.of(new Pending(id, CfgEdgeType.SEQUENTIAL, null, probability))));
                List<Pending> raised = handlers.pop();

                List<Pending> carry = List.of();
                for (AstNode clause : catches) {
                    List<Pending> in = new ArrayList<>(raised);
                    in.addAll(carry);
                    in.add(new Pending(id, CfgEdgeType.EXCEPTION, AstPrinter.render(clause.child(0)), probability));
                    ClauseOutcome outcome = lowerClause(clause, in);
                    exits.addAll(outcome.exits());
                    carry = outcome.guardFailed();
                }
                carry.forEach(this::raise);
                exitNesting();
                out = merge(node, exits);
            }

            if (after.isPresent()) {
                out = inScope(after.get().child(0), out);
            }
            return out;
        }

        private List<Pending> lowerReceive(AstNode node, List<Pending> pending) {
            List<AstNode> clauses = node.childrenOfKind(AstKind.CLAUSE);
            Optional<AstNode> after = node.firstChildOfKind(AstKind.AFTER);
            int outcomes = clauses.size() + (after.isPresent() ? 1 : 0);
            if (outcomes == 0) {
                throw new AnalysisException(ErrorCode.CFG_GENERATION_FAILED,
                        "receive at line " + node.line() + " has no clauses");
            }

            String id;
            double probability = 1.0 / outcomes;
            boolean decision = outcomes >= 2;
            if (decision) {
                id = newNode(CfgNodeType.DECISION, DecisionKind.RECEIVE, node, "receive");
            } else {
                id = newNode(CfgNodeType.STATEMENT, null, node, "receive");
            }
            connect(pending, id);

            enterNesting();
            List<Pending> exits = new ArrayList<>();
            List<Pending> carry = List.of();
            for (AstNode clause : clauses) {
                List<Pending> in = new ArrayList<>(carry);
                in.add(decision
                        ? new Pending(id, CfgEdgeType.PATTERN_MATCH, AstPrinter.render(clause.child(0)), probability)
                        : new Pending(id, CfgEdgeType.SEQUENTIAL, null, 1.0));
                ClauseOutcome outcome = lowerClause(clause, in);
                exits.addAll(outcome.exits());
                carry = outcome.guardFailed();
            }
            abrupt.addAll(carry);
            if (after.isPresent()) {
                exits.addAll(inScope(after.get().child(0), List.of(decision
                        ? new Pending(id, CfgEdgeType.PATTERN_NO_MATCH, "timeout", probability)
                        : new Pending(id, CfgEdgeType.SEQUENTIAL, null, 1.0))));
            }
            exitNesting();
            return merge(node, exits);
        }

        private List<Pending> merge(AstNode owner, List<Pending> exits) {
            if (exits.size() < 2) {
                return exits;
            }
            String id = newNode(CfgNodeType.MERGE, null, owner, "merge " + owner.kind().name().toLowerCase());
            connect(exits, id);
            return sequential(id);
        }

        private void raise(Pending pending) {
            if (handlers.isEmpty()) {
                abrupt.add(pending);
            } else {
                handlers.peek().add(pending);
            }
        }

        private void enterNesting() {
            depth++;
            maxDepth = Math.max(maxDepth, depth);
        }

        private void exitNesting() {
            depth--;
        }

        private String newNode(CfgNodeType type, DecisionKind kind, AstNode ast, String label) {
            return newNode(type, kind, ast, label, ast.line());
        }

        private String newNode(CfgNodeType type, DecisionKind kind, AstNode ast, String label, int line) {
            String id = "cfg_" + counter++;
            nodes.put(id, new Draft(id, type, kind, ast.id(), line, scopes.peek(), depth, label));
            return id;
        }

        private void connect(List<Pending> incoming, String target) {
            for (Pending p : incoming) {
                edges.add(new CfgEdge(p.from(), target, p.type(), p.condition(), p.probability()));
            }
        }

        private static List<Pending> sequential(String from) {
            return List.of(new Pending(from, CfgEdgeType.SEQUENTIAL, null, 1.0));
        }
    }
}
