package com.vidnyan.cpg.domain.ast;

/**
 * Closed set of syntactic constructs the analysis understands.
 * Child layout per kind:
 * <ul>
 *   <li>{@code MODULE}: body statements (functions, attributes, directives)</li>
 *   <li>{@code FUNCTION}: {@code PARAMETERS, GUARD?, BLOCK} or one {@code CLAUSE} per function head</li>
 *   <li>{@code CLAUSE}: {@code head, GUARD?, BLOCK}; the head is a pattern, a condition or a {@code PARAMETERS}</li>
 *   <li>{@code CATCH_CLAUSE}: {@code pattern, GUARD?, BLOCK}</li>
 *   <li>{@code ASSIGNMENT}: {@code pattern, expression}</li>
 *   <li>{@code CASE}: {@code subject, CLAUSE+}</li>
 *   <li>{@code IF}: {@code condition, BLOCK, BLOCK?}</li>
 *   <li>{@code COND}, {@code RECEIVE}: {@code CLAUSE+}, receive may end with {@code AFTER}</li>
 *   <li>{@code WITH}: {@code GENERATOR+, BLOCK, CLAUSE*} (trailing clauses form the else branch)</li>
 *   <li>{@code TRY}: {@code BLOCK, CATCH_CLAUSE*, AFTER?}</li>
 *   <li>{@code AFTER}: {@code BLOCK}</li>
 *   <li>{@code PIPE}: {@code left, right}</li>
 *   <li>{@code FN}: {@code PARAMETERS, BLOCK}</li>
 *   <li>{@code COMPREHENSION}: {@code (GENERATOR | FILTER)+, BLOCK}</li>
 *   <li>{@code GENERATOR}: {@code pattern, enumerable}</li>
 * </ul>
 */
public enum AstKind {
    MODULE,
    MODULE_ATTRIBUTE,
    FUNCTION,
    PARAMETERS,
    BLOCK,
    ASSIGNMENT,
    CASE,
    CLAUSE,
    GUARD,
    IF,
    COND,
    WITH,
    TRY,
    CATCH_CLAUSE,
    AFTER,
    RECEIVE,
    PIPE,
    CALL,
    VARIABLE,
    LITERAL,
    INTERPOLATION,
    TUPLE,
    LIST,
    MAP,
    MAP_ENTRY,
    BINARY_OP,
    UNARY_OP,
    FN,
    COMPREHENSION,
    GENERATOR,
    FILTER,
    RAISE,
    SEND,
    PIN;

    /**
     * Constructs that split control flow into alternative branches.
     */
    public boolean isBranching() {
        return switch (this) {
            case CASE, IF, COND, WITH, TRY, RECEIVE -> true;
            default -> false;
        };
    }

    /**
     * Containers whose elements are patterns when they appear on the left of a match.
     */
    public boolean isContainer() {
        return this == TUPLE || this == LIST || this == MAP || this == MAP_ENTRY;
    }

    public static AstKind fromName(String name) {
        return valueOf(name.trim().toUpperCase().replace('-', '_'));
    }
}
