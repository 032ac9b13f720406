package com.vidnyan.cpg.domain.ast;

/**
 * Structural questions about pattern positions (clause heads, match left-hand sides).
 */
public final class PatternShapes {

    private PatternShapes() {
    }

    /**
     * A pattern is refutable when some value could fail to match it.
     * Bare variables and the wildcard always match.
     */
    public static boolean isRefutable(AstNode pattern) {
        return switch (pattern.kind()) {
            case VARIABLE -> false;
            case PARAMETERS -> pattern.children().stream().anyMatch(PatternShapes::isRefutable);
            case ASSIGNMENT -> isRefutable(pattern.child(0)) || isRefutable(pattern.child(1));
            default -> true;
        };
    }

    /**
     * True for a literal {@code true} head, the catch-all of a {@code cond}.
     */
    public static boolean isLiteralTrue(AstNode node) {
        return node.is(AstKind.LITERAL) && Boolean.TRUE.equals(node.value());
    }

    /**
     * True when the pattern destructures a value instead of binding it whole.
     */
    public static boolean isDestructuring(AstNode pattern) {
        return pattern.kind().isContainer() || pattern.is(AstKind.BINARY_OP);
    }
}
