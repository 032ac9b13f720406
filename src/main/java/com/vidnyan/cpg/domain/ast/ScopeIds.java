package com.vidnyan.cpg.domain.ast;

/**
 * Scope identifiers shared by the control-flow and data-flow builders.
 * A scope is named after the AST node that opens it.
 */
public final class ScopeIds {

    private ScopeIds() {
    }

    public static String of(AstNode opener) {
        return "scope_" + opener.id();
    }
}
