package com.vidnyan.cpg.domain.runtime;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Guard on a breakpoint: {@code any}, or {@code <variable> <op> <literal>} over the event's variables
 * with {@code ==, !=, >, <, >=, <=}. Literals are numbers, quoted strings, {@code true}, {@code false},
 * {@code nil}, or bare atoms.
 */
public final class BreakpointCondition {

    public static final String ANY_TEXT = "any";
    public static final BreakpointCondition ANY = new BreakpointCondition(ANY_TEXT, null, null, null);

    private static final Pattern COMPARISON =
            Pattern.compile("^\\s*([A-Za-z_][A-Za-z0-9_?!]*)\\s*(==|!=|>=|<=|>|<)\\s*(.+?)\\s*$");

    private final String text;
    private final String variable;
    private final String operator;
    private final Object literal;

    private BreakpointCondition(String text, String variable, String operator, Object literal) {
        this.text = text;
        this.variable = variable;
        this.operator = operator;
        this.literal = literal;
    }

    /**
     * Parsed condition, or empty when the text is neither {@code any} nor a single comparison.
     */
    public static Optional<BreakpointCondition> parse(String text) {
        if (text == null || text.isBlank() || ANY_TEXT.equalsIgnoreCase(text.trim())
                || ":any".equalsIgnoreCase(text.trim())) {
            return Optional.of(ANY);
        }
        Matcher matcher = COMPARISON.matcher(text);
        if (!matcher.matches()) {
            return Optional.empty();
        }
        return Optional.of(new BreakpointCondition(text.trim(), matcher.group(1), matcher.group(2),
                literal(matcher.group(3))));
    }

    public boolean isAny() {
        return variable == null;
    }

    public String text() {
        return text;
    }

    public boolean test(Map<String, Object> variables) {
        if (isAny()) {
            return true;
        }
        if (!variables.containsKey(variable)) {
            return false;
        }
        Object actual = variables.get(variable);
        return switch (operator) {
            case "==" -> same(actual, literal);
            case "!=" -> !same(actual, literal);
            default -> ordered(actual, literal);
        };
    }

    private boolean ordered(Object actual, Object expected) {
        if (!(actual instanceof Number a) || !(expected instanceof Number e)) {
            return false;
        }
        int comparison = Double.compare(a.doubleValue(), e.doubleValue());
        return switch (operator) {
            case ">" -> comparison > 0;
            case "<" -> comparison < 0;
            case ">=" -> comparison >= 0;
            case "<=" -> comparison <= 0;
            default -> false;
        };
    }

    private static boolean same(Object actual, Object expected) {
        if (actual instanceof Number a && expected instanceof Number e) {
            return Double.compare(a.doubleValue(), e.doubleValue()) == 0;
        }
        if (actual == null || expected == null) {
            return actual == expected;
        }
        return Objects.equals(actual, expected) || actual.toString().equals(expected.toString());
    }

    private static Object literal(String raw) {
        if ((raw.startsWith("\"") && raw.endsWith("\"") && raw.length() >= 2)
                || (raw.startsWith("'") && raw.endsWith("'") && raw.length() >= 2)) {
            return raw.substring(1, raw.length() - 1);
        }
        switch (raw) {
            case "true":
                return Boolean.TRUE;
            case "false":
                return Boolean.FALSE;
            case "nil":
                return null;
            default:
                break;
        }
        try {
            return raw.contains(".") ? Double.parseDouble(raw) : Long.parseLong(raw);
        } catch (NumberFormatException e) {
            return raw.startsWith(":") ? raw.substring(1) : raw;
        }
    }

    @Override
    public String toString() {
        return text;
    }
}
