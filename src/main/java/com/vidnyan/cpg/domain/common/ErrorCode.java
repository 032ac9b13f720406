package com.vidnyan.cpg.domain.common;

/**
 * Tagged failure reasons returned by every public operation.
 */
public enum ErrorCode {
    // build failures
    CFG_GENERATION_FAILED("cfg_generation_failed"),
    DFG_GENERATION_FAILED("dfg_generation_failed"),
    CPG_BUILD_FAILED("cpg_build_failed"),
    INVALID_AST("invalid_ast"),

    // resolution failures
    NIL_EVENT("nil_event"),
    MISSING_MODULE("missing_module"),
    MISSING_FUNCTION("missing_function"),
    MODULE_NOT_FOUND("module_not_found"),
    FUNCTION_NOT_FOUND("function_not_found"),
    PATTERN_NOT_FOUND("pattern_not_found"),
    BREAKPOINT_NOT_FOUND("breakpoint_not_found"),

    // specification errors
    INVALID_CONFIDENCE_THRESHOLD("invalid_confidence_threshold"),
    MISSING_PATTERN_TYPE("missing_pattern_type"),
    INVALID_AST_PATTERN("invalid_ast_pattern"),
    INVALID_CUSTOM_RULE("invalid_custom_rule"),
    INVALID_FROM_CLAUSE("invalid_from_clause"),
    INVALID_SELECT_CLAUSE("invalid_select_clause"),
    INVALID_WHERE_CONDITION("invalid_where_condition"),
    INVALID_ORDER_BY_CLAUSE("invalid_order_by_clause"),
    INVALID_LIMIT("invalid_limit"),
    INVALID_PATTERN("invalid_pattern"),
    INVALID_VARIABLE("invalid_variable"),
    PATTERN_QUERIES_NOT_IMPLEMENTED("pattern_queries_not_implemented"),

    TIMEOUT("timeout"),
    INTERNAL_ERROR("internal_error");

    private final String wireName;

    ErrorCode(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public boolean isRetryable() {
        return this == TIMEOUT;
    }
}
