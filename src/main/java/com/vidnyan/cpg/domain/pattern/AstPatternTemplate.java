package com.vidnyan.cpg.domain.pattern;

import com.vidnyan.cpg.domain.ast.AstNode;

/**
 * Named structural template from the AST pattern library.
 */
public record AstPatternTemplate(
        String name,
        String description,
        AstNode template,
        boolean matchVariables
) {}
