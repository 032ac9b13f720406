package com.vidnyan.cpg.domain.dfg;

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
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Builds the SSA data-flow graph of one function.
 * Every rebinding of a name allocates a new version; branch merges get phi nodes.
 * Stateless: each call owns a private {@link BuildState}.
 */
@Slf4j
public class DfgBuilder {

    public Result<DataFlowGraph> build(AstNode function) {
        if (function == null || !function.is(AstKind.FUNCTION)) {
            return Result.failure(ErrorCode.DFG_GENERATION_FAILED,
                    "Expected a FUNCTION node but got " + (function == null ? "null" : function.kind()));
        }
        try {
            DataFlowGraph graph = new BuildState(function).run();
            log.debug("Built DFG for {}: {}", function.signature(), graph.stats());
            return Result.success(graph);
        } catch (AnalysisException e) {
            log.warn("DFG generation failed for {}: {}", function.name(), e.getMessage());
            return Result.failure(AnalysisError.wrap(ErrorCode.DFG_GENERATION_FAILED, e));
        } catch (RuntimeException e) {
            log.error("Unexpected error building DFG for {}", function.name(), e);
            return Result.failure(AnalysisError.wrap(ErrorCode.DFG_GENERATION_FAILED, e));
        }
    }

    /**
     * How variables met while walking an expression are recorded.
     *
     * @param flow overrides the use kind's default flow kind when set
     */
    private record Ctx(UseKind kind, FlowKind flow, String transformation) {
        static final Ctx READ = new Ctx(UseKind.READ, null, "identity");

        FlowKind flowKind() {
            return flow != null ? flow : kind.flowKind();
        }

        Ctx nested(UseKind nestedKind, String nestedTransformation) {
            return new Ctx(kind == UseKind.GUARD ? UseKind.GUARD : nestedKind,
                    flow == FlowKind.CONDITIONAL ? FlowKind.CONDITIONAL : null, nestedTransformation);
        }
    }

    private record VersionDraft(String name, int version, String scopeId, boolean parameter) {}

    private record DefDraft(String id, String versionKey, String astNodeId, DefinitionKind kind, String scopeId,
                            int line, List<String> reaching, List<String> sourceUses) {}

    private record UseDraft(String id, String versionKey, String astNodeId, UseKind kind, String scopeId,
                            int line, String reachingDefinition) {}

    private record PhiDraft(String id, String targetKey, List<String> sourceKeys, String mergeAstNodeId,
                            List<String> conditions, String definitionId) {}

    private record Lookup(String versionKey, boolean captured) {}

    private static final class ScopeDraft {
        final String id;
        final ScopeKind kind;
        final String parentId;
        final List<String> children = new ArrayList<>();
        final List<String> variables = new ArrayList<>();
        final String entryAstNodeId;
        final String exitAstNodeId;

        ScopeDraft(String id, ScopeKind kind, String parentId, AstNode opener) {
            this.id = id;
            this.kind = kind;
            this.parentId = parentId;
            this.entryAstNodeId = opener.id();
            this.exitAstNodeId = opener.children().isEmpty() ? opener.id() : opener.lastChild().id();
        }

        Scope toScope() {
            return new Scope(id, kind, parentId, children, variables, entryAstNodeId, exitAstNodeId);
        }
    }

    private static final class Frame {
        final ScopeDraft scope;
        final Map<String, String> bindings = new HashMap<>();
        final boolean closureBoundary;

        Frame(ScopeDraft scope, boolean closureBoundary) {
            this.scope = scope;
            this.closureBoundary = closureBoundary;
        }
    }

    private static final class BuildState {
        private final AstNode function;
        private final Map<String, Integer> nextVersion = new HashMap<>();
        private final Map<String, VersionDraft> versions = new LinkedHashMap<>();
        private final Map<String, String> definitionByVersion = new HashMap<>();
        private final Map<String, ScopeDraft> scopes = new LinkedHashMap<>();
        private final Deque<Frame> frames = new ArrayDeque<>();
        private final Deque<List<String>> collectors = new ArrayDeque<>();
        private final List<DefDraft> definitions = new ArrayList<>();
        private final List<UseDraft> uses = new ArrayList<>();
        private final List<DataFlowEdge> edges = new ArrayList<>();
        private final List<PhiDraft> phis = new ArrayList<>();
        private final List<Diagnostic> diagnostics = new ArrayList<>();
        private final Set<String> captured = new HashSet<>();
        private int useCounter;
        private int phiCounter;

        BuildState(AstNode function) {
            this.function = function;
        }

        DataFlowGraph run() {
            pushScope(ScopeKind.FUNCTION, function, false);
            List<AstNode> clauses = function.childrenOfKind(AstKind.CLAUSE);
            if (!clauses.isEmpty()) {
                for (AstNode clause : clauses) {
                    processClause(clause, ScopeKind.CASE_CLAUSE, DefinitionKind.PARAMETER, true);
                }
            } else {
                function.firstChildOfKind(AstKind.PARAMETERS)
                        .ifPresent(params -> bindPattern(params, DefinitionKind.PARAMETER, List.of()));
                function.firstChildOfKind(AstKind.GUARD)
                        .ifPresent(guard -> processExpr(guard, new Ctx(UseKind.GUARD, null, "guard")));
                AstNode body = function.firstChildOfKind(AstKind.BLOCK)
                        .orElseThrow(() -> new AnalysisException(ErrorCode.DFG_GENERATION_FAILED,
                                "Function " + function.name() + " has no body"));
                processBlock(body, true);
            }
            popScope();
            reportUnusedDefinitions();
            return assemble();
        }

        // ---- statements and expressions ----

        private void processBlock(AstNode block, boolean tail) {
            if (!block.is(AstKind.BLOCK)) {
                processStatement(block, tail);
                return;
            }
            List<AstNode> statements = block.children();
            for (int i = 0; i < statements.size(); i++) {
                processStatement(statements.get(i), tail && i == statements.size() - 1);
            }
        }

        private void processStatement(AstNode node, boolean tail) {
            if (node.kind().isBranching()) {
                processBranching(node, tail);
            } else if (tail && node.is(AstKind.VARIABLE)) {
                use(node, new Ctx(UseKind.READ, FlowKind.RETURN_VALUE, "return"));
            } else {
                processExpr(node, Ctx.READ);
            }
        }

        private void processExpr(AstNode node, Ctx ctx) {
            switch (node.kind()) {
                case VARIABLE -> use(node, ctx);
                case PIN, TUPLE, LIST, MAP, MAP_ENTRY -> node.children().forEach(c -> processExpr(c, ctx));
                case LITERAL, MODULE_ATTRIBUTE -> {
                    // constants carry no data flow
                }
                case INTERPOLATION -> node.children().forEach(c -> processExpr(c, ctx.nested(UseKind.READ, "interpolate")));
                case BINARY_OP, UNARY_OP -> node.children()
                        .forEach(c -> processExpr(c, ctx.nested(UseKind.READ, "op:" + node.operator())));
                case GUARD -> node.children().forEach(c -> processExpr(c, new Ctx(UseKind.GUARD, null, "guard")));
                case CALL -> {
                    for (int i = 0; i < node.children().size(); i++) {
                        processExpr(node.child(i),
                                ctx.nested(UseKind.CALL_ARGUMENT, "call:" + node.qualifiedName() + "#" + i));
                    }
                }
                case PIPE -> {
                    AstNode target = node.child(1);
                    String stage = target.is(AstKind.CALL) ? target.qualifiedName() : AstPrinter.render(target);
                    processExpr(node.child(0), ctx.nested(UseKind.PIPE_STAGE, "pipe:" + stage));
                    processExpr(target, Ctx.READ);
                }
                case SEND -> {
                    processExpr(node.child(0), Ctx.READ);
                    processExpr(node.child(1), new Ctx(UseKind.MESSAGE_PAYLOAD, null, "send"));
                }
                case RAISE -> node.children().forEach(c -> processExpr(c, Ctx.READ));
                case ASSIGNMENT -> processAssignment(node);
                case CASE, IF, COND, WITH, TRY, RECEIVE -> processBranching(node, false);
                case FN -> processClosure(node);
                case COMPREHENSION -> processComprehension(node);
                case BLOCK -> processBlock(node, false);
                case MODULE, FUNCTION, PARAMETERS, CLAUSE, CATCH_CLAUSE, AFTER, GENERATOR, FILTER ->
                        throw new AnalysisException(ErrorCode.DFG_GENERATION_FAILED,
                                "Unexpected " + node.kind() + " in expression position at line " + node.line());
            }
        }

        private void processAssignment(AstNode node) {
            AstNode pattern = node.child(0);
            boolean destructuring = PatternShapes.isDestructuring(pattern);
            collectors.push(new ArrayList<>());
            // right-hand side first: a rebound name on the right still refers to its previous version
            processExpr(node.child(1), destructuring
                    ? new Ctx(UseKind.READ, FlowKind.DESTRUCTURE, "destructure")
                    : Ctx.READ);
            List<String> sourceUses = collectors.pop();
            bindPattern(pattern, destructuring ? DefinitionKind.PATTERN_MATCH : DefinitionKind.ASSIGNMENT, sourceUses);
        }

        private void bindPattern(AstNode pattern, DefinitionKind kind, List<String> sourceUses) {
            switch (pattern.kind()) {
                case VARIABLE -> bind(pattern.name(), kind, pattern, sourceUses, null);
                case PIN -> pattern.children().forEach(c -> use(c, new Ctx(UseKind.PATTERN, null, "pin")));
                case TUPLE, LIST, MAP, MAP_ENTRY, BINARY_OP, ASSIGNMENT, PARAMETERS ->
                        pattern.children().forEach(c -> bindPattern(c, kind, sourceUses));
                case LITERAL -> {
                    // literal patterns bind nothing
                }
                default -> processExpr(pattern, Ctx.READ);
            }
        }

        // ---- branching and merges ----

        private void processBranching(AstNode node, boolean tail) {
            Map<String, String> before = visibleBindings();
            List<Map<String, String>> ends = new ArrayList<>();
            List<String> labels = new ArrayList<>();

            switch (node.kind()) {
                case CASE -> {
                    processExpr(node.child(0), Ctx.READ);
                    for (AstNode clause : node.childrenOfKind(AstKind.CLAUSE)) {
                        ends.add(processClause(clause, ScopeKind.CASE_CLAUSE, DefinitionKind.PATTERN_MATCH, tail));
                        labels.add(AstPrinter.render(clause.child(0)));
                    }
                }
                case IF -> {
                    AstNode condition = node.child(0);
                    String text = AstPrinter.render(condition);
                    processExpr(condition, new Ctx(UseKind.READ, FlowKind.CONDITIONAL, "condition"));
                    ends.add(processBranch(node.child(1), ScopeKind.IF_BRANCH, tail));
                    labels.add(text);
                    if (node.children().size() > 2) {
                        ends.add(processBranch(node.child(2), ScopeKind.IF_BRANCH, tail));
                    } else {
                        ends.add(before);
                    }
                    labels.add("not " + text);
                }
                case COND -> {
                    for (AstNode clause : node.childrenOfKind(AstKind.CLAUSE)) {
                        ends.add(processClause(clause, ScopeKind.IF_BRANCH, null, tail));
                        labels.add(AstPrinter.render(clause.child(0)));
                    }
                }
                case WITH -> processWith(node, before, ends, labels, tail);
                case TRY -> {
                    ends.add(processBranch(node.child(0), ScopeKind.TRY_BLOCK, tail));
                    labels.add("no exception");
                    for (AstNode clause : node.childrenOfKind(AstKind.CATCH_CLAUSE)) {
                        ends.add(processClause(clause, ScopeKind.CATCH_CLAUSE, DefinitionKind.EXCEPTION_BINDING, tail));
                        labels.add("rescue " + AstPrinter.render(clause.child(0)));
                    }
                }
                case RECEIVE -> {
                    for (AstNode clause : node.childrenOfKind(AstKind.CLAUSE)) {
                        ends.add(processClause(clause, ScopeKind.RECEIVE_CLAUSE, DefinitionKind.RECEIVE_BINDING, tail));
                        labels.add(AstPrinter.render(clause.child(0)));
                    }
                    Optional<AstNode> after = node.firstChildOfKind(AstKind.AFTER);
                    if (after.isPresent()) {
                        ends.add(processBranch(after.get().child(0), ScopeKind.RECEIVE_CLAUSE, tail));
                        labels.add("timeout");
                    }
                }
                default -> throw new AnalysisException(ErrorCode.DFG_GENERATION_FAILED,
                        node.kind() + " is not a branching construct");
            }

            insertPhiNodes(node, ends, labels);

            if (node.is(AstKind.TRY)) {
                node.firstChildOfKind(AstKind.AFTER)
                        .ifPresent(after -> processBranch(after.child(0), ScopeKind.TRY_BLOCK, false));
            }
        }

        private void processWith(AstNode node, Map<String, String> before, List<Map<String, String>> ends,
                                 List<String> labels, boolean tail) {
            AstNode body = node.firstChildOfKind(AstKind.BLOCK)
                    .orElseThrow(() -> new AnalysisException(ErrorCode.DFG_GENERATION_FAILED,
                            "with at line " + node.line() + " has no body"));
            pushScope(ScopeKind.CASE_CLAUSE, body, false);
            for (AstNode generator : node.childrenOfKind(AstKind.GENERATOR)) {
                collectors.push(new ArrayList<>());
                processExpr(generator.child(1), new Ctx(UseKind.READ, FlowKind.PATTERN_MATCH, "with"));
                bindPattern(generator.child(0), DefinitionKind.PATTERN_MATCH, collectors.pop());
            }
            processBlock(body, tail);
            ends.add(visibleBindings());
            labels.add("all clauses matched");
            popScope();

            List<AstNode> elseClauses = node.childrenOfKind(AstKind.CLAUSE);
            if (elseClauses.isEmpty()) {
                ends.add(before);
                labels.add("clause mismatch");
            }
            for (AstNode clause : elseClauses) {
                ends.add(processClause(clause, ScopeKind.CASE_CLAUSE, DefinitionKind.PATTERN_MATCH, tail));
                labels.add("else " + AstPrinter.render(clause.child(0)));
            }
        }

        /**
         * Process one clause in its own scope and return the bindings visible at its end.
         *
         * @param headKind binding kind for the head pattern, or null when the head is a condition
         */
        private Map<String, String> processClause(AstNode clause, ScopeKind scopeKind, DefinitionKind headKind,
                                                  boolean tail) {
            pushScope(scopeKind, clause, false);
            AstNode head = clause.child(0);
            if (headKind != null) {
                bindPattern(head, headKind, List.of());
            } else {
                processExpr(head, new Ctx(UseKind.READ, FlowKind.CONDITIONAL, "condition"));
            }
            clause.firstChildOfKind(AstKind.GUARD).ifPresent(guard -> processExpr(guard, Ctx.READ));
            processBlock(clause.lastChild(), tail);
            Map<String, String> end = visibleBindings();
            popScope();
            return end;
        }

        private Map<String, String> processBranch(AstNode block, ScopeKind scopeKind, boolean tail) {
            pushScope(scopeKind, block, false);
            processBlock(block, tail);
            Map<String, String> end = visibleBindings();
            popScope();
            return end;
        }

        /**
         * One phi per name that reaches the merge with two or more distinct versions.
         * The phi target lives in the enclosing scope and is the version seen after the merge.
         */
        private void insertPhiNodes(AstNode merge, List<Map<String, String>> ends, List<String> labels) {
            Set<String> names = new LinkedHashSet<>();
            ends.forEach(end -> names.addAll(end.keySet()));
            for (String name : names) {
                Map<String, String> sources = new LinkedHashMap<>();
                for (int i = 0; i < ends.size(); i++) {
                    String key = ends.get(i).get(name);
                    if (key != null) {
                        sources.putIfAbsent(key, labels.get(i));
                    }
                }
                if (sources.size() < 2) {
                    continue;
                }
                List<String> sourceKeys = new ArrayList<>(sources.keySet());
                List<String> reaching = sourceKeys.stream().map(definitionByVersion::get).toList();
                String definitionId = bind(name, DefinitionKind.PHI, merge, List.of(), reaching);
                String targetKey = definitions.get(definitions.size() - 1).versionKey();
                phis.add(new PhiDraft("phi_" + phiCounter++, targetKey, sourceKeys, merge.id(),
                        new ArrayList<>(sources.values()), definitionId));
            }
        }

        // ---- closures and comprehensions ----

        private void processClosure(AstNode fn) {
            pushScope(ScopeKind.CLOSURE, fn, true);
            fn.firstChildOfKind(AstKind.PARAMETERS)
                    .ifPresent(params -> bindPattern(params, DefinitionKind.PARAMETER, List.of()));
            fn.firstChildOfKind(AstKind.BLOCK).ifPresent(body -> processBlock(body, false));
            popScope();
        }

        private void processComprehension(AstNode node) {
            pushScope(ScopeKind.COMPREHENSION, node, false);
            for (AstNode part : node.children()) {
                switch (part.kind()) {
                    case GENERATOR -> {
                        collectors.push(new ArrayList<>());
                        processExpr(part.child(1), new Ctx(UseKind.READ, null, "enumerate"));
                        bindPattern(part.child(0), DefinitionKind.COMPREHENSION_BINDING, collectors.pop());
                    }
                    case FILTER -> part.children()
                            .forEach(c -> processExpr(c, new Ctx(UseKind.READ, FlowKind.CONDITIONAL, "filter")));
                    default -> processBlock(part, false);
                }
            }
            popScope();
        }

        // ---- bindings and uses ----

        private String bind(String name, DefinitionKind kind, AstNode node, List<String> sourceUses,
                            List<String> reachingOverride) {
            if (AstNode.WILDCARD.equals(name)) {
                return null;
            }
            Frame top = frames.peek();
            int version = nextVersion.merge(name, 1, Integer::sum) - 1;
            String key = VariableVersion.key(name, version);
            versions.put(key, new VersionDraft(name, version, top.scope.id, kind == DefinitionKind.PARAMETER));

            List<String> reaching = reachingOverride;
            if (reaching == null) {
                Lookup previous = lookup(name);
                reaching = previous != null ? List.of(definitionByVersion.get(previous.versionKey())) : List.of();
            }
            String id = "def_" + definitions.size();
            definitions.add(new DefDraft(id, key, node.id(), kind, top.scope.id, node.line(), reaching,
                    List.copyOf(sourceUses)));
            definitionByVersion.put(key, id);
            top.bindings.put(name, key);
            top.scope.variables.add(key);
            return id;
        }

        private void use(AstNode variable, Ctx ctx) {
            if (!variable.is(AstKind.VARIABLE)) {
                processExpr(variable, ctx);
                return;
            }
            Lookup found = lookup(variable.name());
            if (found == null) {
                diagnostics.add(new Diagnostic(Diagnostic.Kind.UNDEFINED_VARIABLE, variable.name(), variable.id(),
                        variable.line(), "Undefined variable " + variable.name()));
                return;
            }
            UseKind kind = ctx.kind();
            FlowKind flow = ctx.flowKind();
            if (found.captured()) {
                captured.add(found.versionKey());
                kind = UseKind.CLOSURE_CAPTURE;
                flow = FlowKind.CLOSURE_CAPTURE;
            }
            String definitionId = definitionByVersion.get(found.versionKey());
            String id = "use_" + useCounter++;
            uses.add(new UseDraft(id, found.versionKey(), variable.id(), kind, frames.peek().scope.id,
                    variable.line(), definitionId));
            edges.add(new DataFlowEdge(definitionId, id, flow, ctx.transformation()));
            collectors.forEach(collector -> collector.add(id));
        }

        private Lookup lookup(String name) {
            boolean crossedClosure = false;
            for (Frame frame : frames) {
                String key = frame.bindings.get(name);
                if (key != null) {
                    return new Lookup(key, crossedClosure);
                }
                if (frame.closureBoundary) {
                    crossedClosure = true;
                }
            }
            return null;
        }

        private Map<String, String> visibleBindings() {
            Map<String, String> visible = new HashMap<>();
            Iterator<Frame> bottomUp = frames.descendingIterator();
            while (bottomUp.hasNext()) {
                visible.putAll(bottomUp.next().bindings);
            }
            return visible;
        }

        private void pushScope(ScopeKind kind, AstNode opener, boolean closureBoundary) {
            Frame parent = frames.peek();
            ScopeDraft scope = new ScopeDraft(ScopeIds.of(opener), kind, parent != null ? parent.scope.id : null, opener);
            if (parent != null) {
                parent.scope.children.add(scope.id);
            }
            scopes.put(scope.id, scope);
            frames.push(new Frame(scope, closureBoundary));
        }

        private void popScope() {
            frames.pop();
        }

        // ---- finishing ----

        private void reportUnusedDefinitions() {
            Set<String> read = new HashSet<>();
            uses.forEach(u -> read.add(u.reachingDefinition()));
            phis.forEach(p -> p.sourceKeys().forEach(k -> read.add(definitionByVersion.get(k))));
            for (DefDraft def : definitions) {
                String name = versions.get(def.versionKey()).name();
                if (def.kind() == DefinitionKind.PHI || name.startsWith("_") || read.contains(def.id())) {
                    continue;
                }
                diagnostics.add(new Diagnostic(Diagnostic.Kind.UNUSED_DEFINITION, name, def.astNodeId(),
                        def.line(), "Variable " + def.versionKey() + " is never used"));
            }
        }

        private DataFlowGraph assemble() {
            Map<String, VariableVersion> finalVersions = new LinkedHashMap<>();
            versions.forEach((key, draft) -> finalVersions.put(key, new VariableVersion(
                    draft.name(), draft.version(), draft.scopeId(), draft.parameter(), captured.contains(key))));

            List<Definition> finalDefinitions = definitions.stream()
                    .map(d -> new Definition(d.id(), finalVersions.get(d.versionKey()), d.astNodeId(), d.kind(),
                            d.scopeId(), d.line(), d.reaching(), d.sourceUses()))
                    .toList();
            List<Use> finalUses = uses.stream()
                    .map(u -> new Use(u.id(), finalVersions.get(u.versionKey()), u.astNodeId(), u.kind(),
                            u.scopeId(), u.line(), u.reachingDefinition()))
                    .toList();
            List<PhiNode> finalPhis = phis.stream()
                    .map(p -> new PhiNode(p.id(), finalVersions.get(p.targetKey()),
                            p.sourceKeys().stream().map(finalVersions::get).toList(),
                            p.mergeAstNodeId(), p.conditions(), p.definitionId()))
                    .toList();
            List<Scope> finalScopes = scopes.values().stream().map(ScopeDraft::toScope).toList();

            return new DataFlowGraph(function.signature(), ScopeIds.of(function),
                    new ArrayList<>(finalVersions.values()), finalDefinitions, finalUses, edges, finalPhis,
                    finalScopes, diagnostics);
        }
    }
}
