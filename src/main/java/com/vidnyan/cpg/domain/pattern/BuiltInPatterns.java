package com.vidnyan.cpg.domain.pattern;

import com.vidnyan.cpg.domain.analysis.FunctionAnalysis;
import com.vidnyan.cpg.domain.analysis.ModuleAnalysis;
import com.vidnyan.cpg.domain.ast.AstKind;
import com.vidnyan.cpg.domain.ast.AstNode;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Behavioral and anti-pattern definitions every pattern library starts with.
 */
public final class BuiltInPatterns {

    static final int GOD_FUNCTION_COMPLEXITY = 10;
    static final int GOD_FUNCTION_COLLABORATORS = 5;
    static final int GOD_FUNCTION_STATEMENTS = 40;
    static final int DEEP_NESTING = 3;

    private BuiltInPatterns() {
    }

    public static List<PatternDefinition> all() {
        return List.of(genServer(), supervisor(), singleton(), nPlusOneQuery(), godFunction(), deepNesting(),
                sqlInjection());
    }

    static PatternDefinition genServer() {
        return PatternDefinition.builder("genserver")
                .type(PatternType.BEHAVIORAL)
                .scope(PatternScope.MODULE)
                .description("GenServer implementation pattern")
                .severity(Severity.INFO)
                .category("otp")
                .rule("has_genserver_behaviour", t -> t.module().declares("GenServer"))
                .rule("has_init_callback", t -> t.module().hasFunction("init", 1))
                .rule("has_handle_call_or_cast", t -> t.module().hasFunction("handle_call", 3)
                        || t.module().hasFunction("handle_cast", 2))
                .suggestion("Ensure proper state management")
                .suggestion("Consider using handle_continue/2 for expensive initialization")
                .suggestion("Implement proper error handling in callbacks")
                .build();
    }

    static PatternDefinition supervisor() {
        return PatternDefinition.builder("supervisor")
                .type(PatternType.BEHAVIORAL)
                .scope(PatternScope.MODULE)
                .description("Supervisor implementation pattern")
                .severity(Severity.INFO)
                .category("otp")
                .rule("has_supervisor_behaviour", t -> t.module().declares("Supervisor"))
                .rule("has_init_callback", t -> t.module().hasFunction("init", 1))
                .rule("has_child_spec", t -> t.module().hasFunction("child_spec", 1)
                        || callsAny(t.module(), Set.of("Supervisor.init", "Supervisor.start_link")))
                .suggestion("Choose a restart strategy that matches the failure domain of the children")
                .suggestion("Keep supervisors free of business logic")
                .build();
    }

    static PatternDefinition singleton() {
        return PatternDefinition.builder("singleton")
                .type(PatternType.ANTI_PATTERN)
                .scope(PatternScope.MODULE)
                .description("Process registered under a global module name")
                .severity(Severity.WARNING)
                .category("design")
                .rule("registers_global_name", t -> t.module().functions().stream()
                        .anyMatch(f -> CodeFacts.registersModuleName(f.ast())))
                .rule("exposes_module_wide_api", t -> t.module().functions().stream()
                        .filter(FunctionAnalysis::isPublic)
                        .flatMap(f -> CodeFacts.calls(f.ast()))
                        .anyMatch(c -> c.qualifier().filter("GenServer"::equals).isPresent()
                                && !c.children().isEmpty()
                                && CodeFacts.isModuleReference(c.child(0))))
                .suggestion("Consider using Registry or passing the process identifier explicitly")
                .suggestion("Avoid global names so callers can start several instances")
                .build();
    }

    static PatternDefinition nPlusOneQuery() {
        return PatternDefinition.builder("n_plus_one_query")
                .type(PatternType.ANTI_PATTERN)
                .scope(PatternScope.FUNCTION)
                .description("Database query executed once per element of a collection")
                .severity(Severity.ERROR)
                .category("performance")
                .rule("has_loop_with_queries", t -> CodeFacts.iterations(t.function().ast())
                        .anyMatch(it -> CodeFacts.calls(it).anyMatch(CodeFacts::isQueryCall)))
                .rule("has_repeated_query", t -> CodeFacts.iterations(t.function().ast())
                        .flatMap(CodeFacts::calls)
                        .filter(CodeFacts::isQueryCall)
                        .anyMatch(q -> CodeFacts.dependsOnIterationVariable(t.function(), q)))
                .suggestion("Use Repo.preload/2 or a join to load associated records in one query")
                .suggestion("Batch lookups into a single query with a where ... in clause")
                .build();
    }

    static PatternDefinition godFunction() {
        return PatternDefinition.builder("god_function")
                .type(PatternType.ANTI_PATTERN)
                .scope(PatternScope.FUNCTION)
                .description("Function with too much logic and too many responsibilities")
                .severity(Severity.WARNING)
                .category("maintainability")
                .rule("high_complexity", t -> t.function().metrics().cyclomatic() > GOD_FUNCTION_COMPLEXITY)
                .rule("many_responsibilities", t ->
                        CodeFacts.distinctCollaborators(t.function().ast()) >= GOD_FUNCTION_COLLABORATORS
                                || CodeFacts.statementCount(t.function().ast()) > GOD_FUNCTION_STATEMENTS)
                .suggestion("Break the function into smaller, single-purpose functions")
                .suggestion("Move pattern-matching branches into separate function clauses")
                .build();
    }

    static PatternDefinition deepNesting() {
        return PatternDefinition.builder("deep_nesting")
                .type(PatternType.ANTI_PATTERN)
                .scope(PatternScope.FUNCTION)
                .description("Deeply nested conditional logic")
                .severity(Severity.WARNING)
                .category("maintainability")
                .rule("excessive_nesting", t -> t.function().metrics().nestingDepth() > DEEP_NESTING)
                .rule("deeply_nested_decision", t -> t.function().cfg().decisionPoints().stream()
                        .anyMatch(d -> d.nesting() >= DEEP_NESTING))
                .suggestion("Flatten nested case expressions with a with statement")
                .suggestion("Extract nested branches into helper functions with pattern-matched heads")
                .build();
    }

    static PatternDefinition sqlInjection() {
        return PatternDefinition.builder("sql_injection")
                .type(PatternType.ANTI_PATTERN)
                .scope(PatternScope.FUNCTION)
                .description("SQL text built from untrusted values")
                .severity(Severity.CRITICAL)
                .category("security")
                .rule("string_interpolation_in_sql", t -> t.function().ast().stream()
                        .anyMatch(n -> CodeFacts.isSqlInterpolation(n) || CodeFacts.isSqlConcatenation(n)))
                .rule("unsafe_query_construction", t -> hasUnsafeQuery(t.function().ast()))
                .suggestion("Use parameterized queries with placeholders instead of string interpolation")
                .suggestion("Build queries with Ecto.Query so values are bound as parameters")
                .build();
    }

    private static boolean hasUnsafeQuery(AstNode function) {
        Set<String> taintedNames = function.stream()
                .filter(n -> n.is(AstKind.ASSIGNMENT) && n.child(0).is(AstKind.VARIABLE))
                .filter(n -> CodeFacts.isSqlInterpolation(n.child(1)) || CodeFacts.isSqlConcatenation(n.child(1)))
                .map(n -> n.child(0).name())
                .collect(Collectors.toSet());
        return CodeFacts.calls(function)
                .filter(c -> CodeFacts.isQueryCall(c) || "query".equals(c.name()) || "query!".equals(c.name()))
                .flatMap(c -> c.children().stream())
                .anyMatch(arg -> CodeFacts.isSqlInterpolation(arg) || CodeFacts.isSqlConcatenation(arg)
                        || (arg.is(AstKind.VARIABLE) && taintedNames.contains(arg.name())));
    }

    private static boolean callsAny(ModuleAnalysis module, Set<String> qualifiedNames) {
        return module.functions().stream()
                .flatMap(f -> CodeFacts.calls(f.ast()))
                .anyMatch(c -> qualifiedNames.contains(c.qualifiedName()));
    }
}
