package com.vidnyan.cpg.domain.dfg;

public enum ScopeKind {
    MODULE,
    FUNCTION,
    CASE_CLAUSE,
    IF_BRANCH,
    TRY_BLOCK,
    CATCH_CLAUSE,
    COMPREHENSION,
    RECEIVE_CLAUSE,
    CLOSURE
}
