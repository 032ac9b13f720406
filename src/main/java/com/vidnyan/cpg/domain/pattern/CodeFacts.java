package com.vidnyan.cpg.domain.pattern;

import com.vidnyan.cpg.domain.analysis.FunctionAnalysis;
import com.vidnyan.cpg.domain.ast.AstKind;
import com.vidnyan.cpg.domain.ast.AstNode;
import com.vidnyan.cpg.domain.dfg.DefinitionKind;
import com.vidnyan.cpg.domain.dfg.ScopeKind;
import com.vidnyan.cpg.domain.dfg.Use;

import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Syntactic and data-flow facts the built-in pattern predicates are written against.
 */
public final class CodeFacts {

    private static final Set<String> QUERY_FUNCTIONS = Set.of(
            "get", "get!", "get_by", "get_by!", "one", "one!", "all", "query", "query!",
            "insert", "update", "delete", "preload", "exists?", "aggregate");
    private static final Set<String> ITERATORS = Set.of("Enum", "Stream", "Flow", "Task");
    private static final Pattern SQL_KEYWORDS = Pattern.compile(
            "\\b(select|insert\\s+into|update|delete\\s+from|where|drop\\s+table)\\b");

    private CodeFacts() {
    }

    public static Stream<AstNode> calls(AstNode root) {
        return root.stream().filter(n -> n.is(AstKind.CALL));
    }

    /**
     * Database access through an Ecto-style repository or a raw SQL adapter.
     */
    public static boolean isQueryCall(AstNode call) {
        if (!call.is(AstKind.CALL) || call.name() == null) {
            return false;
        }
        String qualifier = call.qualifier().orElse("");
        boolean repository = qualifier.endsWith("Repo") || qualifier.endsWith("SQL");
        return repository && QUERY_FUNCTIONS.contains(call.name());
    }

    /**
     * Comprehensions and higher-order calls such as {@code Enum.map(list, fn)} that run a body per element.
     */
    public static boolean isIteration(AstNode node) {
        if (node.is(AstKind.COMPREHENSION)) {
            return true;
        }
        return node.is(AstKind.CALL)
                && node.qualifier().map(ITERATORS::contains).orElse(false)
                && node.children().stream().anyMatch(c -> c.is(AstKind.FN));
    }

    public static Stream<AstNode> iterations(AstNode root) {
        return root.stream().filter(CodeFacts::isIteration);
    }

    public static boolean containsSql(String text) {
        return text != null && SQL_KEYWORDS.matcher(text.toLowerCase(Locale.ROOT)).find();
    }

    /**
     * String interpolation whose literal parts read like SQL and that splices in at least one expression.
     */
    public static boolean isSqlInterpolation(AstNode node) {
        if (!node.is(AstKind.INTERPOLATION)) {
            return false;
        }
        boolean sqlText = node.children().stream()
                .filter(c -> c.is(AstKind.LITERAL))
                .anyMatch(c -> containsSql(String.valueOf(c.value())));
        boolean dynamic = node.children().stream().anyMatch(c -> !c.is(AstKind.LITERAL));
        return sqlText && dynamic;
    }

    /**
     * {@code "SELECT ..." <> value}: SQL text concatenated with a non-literal.
     */
    public static boolean isSqlConcatenation(AstNode node) {
        if (!node.is(AstKind.BINARY_OP) || !"<>".equals(node.operator())) {
            return false;
        }
        boolean sqlText = node.stream()
                .filter(c -> c.is(AstKind.LITERAL))
                .anyMatch(c -> containsSql(String.valueOf(c.value())));
        boolean dynamic = node.stream().anyMatch(c -> c.is(AstKind.VARIABLE) || c.is(AstKind.CALL));
        return sqlText && dynamic;
    }

    /**
     * Uses inside {@code node} whose value comes from an iteration element:
     * a comprehension binding or a parameter of a closure.
     */
    public static boolean dependsOnIterationVariable(FunctionAnalysis function, AstNode node) {
        Set<String> ids = Set.copyOf(node.stream().map(AstNode::id).toList());
        return function.dfg().uses().stream()
                .filter(u -> ids.contains(u.astNodeId()))
                .map(Use::reachingDefinition)
                .map(id -> function.dfg().definition(id).orElse(null))
                .filter(java.util.Objects::nonNull)
                .anyMatch(def -> def.kind() == DefinitionKind.COMPREHENSION_BINDING
                        || (def.kind() == DefinitionKind.PARAMETER && function.dfg().scope(def.scopeId())
                                .map(s -> s.kind() == ScopeKind.CLOSURE).orElse(false)));
    }

    /**
     * Distinct remote modules a function calls, a proxy for the number of concerns it touches.
     */
    public static long distinctCollaborators(AstNode function) {
        return calls(function)
                .map(c -> c.qualifier().orElse(null))
                .filter(java.util.Objects::nonNull)
                .distinct()
                .count();
    }

    public static long statementCount(AstNode function) {
        return function.stream().filter(n -> n.is(AstKind.BLOCK)).mapToLong(b -> b.children().size()).sum();
    }

    /**
     * Keyword list entry {@code name: __MODULE__}.
     */
    public static boolean registersModuleName(AstNode root) {
        return root.stream()
                .filter(n -> n.is(AstKind.TUPLE) && n.children().size() == 2)
                .anyMatch(t -> "name".equals(String.valueOf(t.child(0).value())) && isModuleReference(t.child(1)));
    }

    public static boolean isModuleReference(AstNode node) {
        return "__MODULE__".equals(node.name()) || "__MODULE__".equals(String.valueOf(node.value()));
    }
}
