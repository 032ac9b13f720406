package com.vidnyan.cpg.domain.ast;

import java.util.stream.Collectors;

/**
 * Renders expressions back to compact source-like text.
 * Used for edge conditions, phi conditions and match metadata.
 */
public final class AstPrinter {

    private static final int MAX_LENGTH = 120;

    private AstPrinter() {
    }

    public static String render(AstNode node) {
        String text = renderNode(node);
        return text.length() > MAX_LENGTH ? text.substring(0, MAX_LENGTH - 3) + "..." : text;
    }

    private static String renderNode(AstNode node) {
        return switch (node.kind()) {
            case VARIABLE -> node.name();
            case LITERAL -> renderLiteral(node);
            case PIN -> "^" + joined(node, ", ");
            case TUPLE -> "{" + joined(node, ", ") + "}";
            case LIST -> "[" + joined(node, ", ") + "]";
            case MAP -> "%{" + joined(node, ", ") + "}";
            case MAP_ENTRY -> renderNode(node.child(0)) + " => " + renderNode(node.child(1));
            case BINARY_OP -> renderNode(node.child(0)) + " " + node.operator() + " " + renderNode(node.child(1));
            case UNARY_OP -> node.operator() + " " + renderNode(node.child(0));
            case CALL -> node.qualifiedName() + "(" + joined(node, ", ") + ")";
            case PIPE -> renderNode(node.child(0)) + " |> " + renderNode(node.child(1));
            case ASSIGNMENT -> renderNode(node.child(0)) + " = " + renderNode(node.child(1));
            case GUARD -> "when " + joined(node, " ");
            case PARAMETERS -> "(" + joined(node, ", ") + ")";
            case INTERPOLATION -> "\"" + node.children().stream()
                    .map(c -> c.is(AstKind.LITERAL) ? String.valueOf(c.value()) : "#{" + renderNode(c) + "}")
                    .collect(Collectors.joining()) + "\"";
            case MODULE_ATTRIBUTE -> "@" + node.name() + " " + joined(node, " ");
            case GENERATOR -> renderNode(node.child(0)) + " <- " + renderNode(node.child(1));
            case FILTER -> joined(node, " ");
            case RAISE -> "raise " + joined(node, ", ");
            case SEND -> "send(" + joined(node, ", ") + ")";
            case FN -> "fn ... end";
            case FUNCTION -> "def " + node.name();
            case MODULE -> "defmodule " + node.name();
            case CLAUSE, CATCH_CLAUSE -> renderNode(node.child(0)) + " -> ...";
            case BLOCK, CASE, IF, COND, WITH, TRY, AFTER, RECEIVE, COMPREHENSION ->
                    node.kind().name().toLowerCase();
        };
    }

    private static String renderLiteral(AstNode node) {
        Object value = node.value();
        if (value == null) {
            return "nil";
        }
        if ("atom".equals(node.attributes().get("type"))) {
            return ":" + value;
        }
        if (value instanceof String s && !"alias".equals(node.attributes().get("type"))) {
            return "\"" + s + "\"";
        }
        return String.valueOf(value);
    }

    private static String joined(AstNode node, String separator) {
        return node.children().stream().map(AstPrinter::renderNode).collect(Collectors.joining(separator));
    }
}
