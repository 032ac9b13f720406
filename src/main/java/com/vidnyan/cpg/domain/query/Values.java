package com.vidnyan.cpg.domain.query;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Collection;
import java.util.Comparator;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Loose value semantics for relation rows: numbers compare by magnitude regardless of boxed type,
 * collections test membership element-wise.
 */
final class Values {

    static final Comparator<Object> NULLS_LAST = (a, b) -> {
        if (a == null && b == null) {
            return 0;
        }
        if (a == null) {
            return 1;
        }
        if (b == null) {
            return -1;
        }
        return compare(a, b);
    };

    private Values() {
    }

    static boolean equal(Object left, Object right) {
        if (left instanceof Number l && right instanceof Number r) {
            return compareNumbers(l, r) == 0;
        }
        return Objects.equals(left, right);
    }

    @SuppressWarnings({"unchecked", "rawtypes"})
    static int compare(Object left, Object right) {
        if (left instanceof Number l && right instanceof Number r) {
            return compareNumbers(l, r);
        }
        if (left instanceof Comparable c && right != null && left.getClass() == right.getClass()) {
            return c.compareTo(right);
        }
        return String.valueOf(left).compareTo(String.valueOf(right));
    }

    static boolean memberOf(Object actual, Collection<?> candidates) {
        if (actual instanceof Collection<?> many) {
            return many.stream().anyMatch(item -> candidates.stream().anyMatch(c -> equal(item, c)));
        }
        return candidates.stream().anyMatch(c -> equal(actual, c));
    }

    static boolean contains(Object actual, Object value) {
        if (actual instanceof Collection<?> many) {
            return many.stream().anyMatch(item -> equal(item, value));
        }
        if (actual instanceof String text) {
            return text.contains(String.valueOf(value));
        }
        return false;
    }

    static String canonical(Object value) {
        if (value instanceof Collection<?> many) {
            return many.stream().map(Values::canonical).collect(Collectors.joining(",", "[", "]"));
        }
        if (value instanceof Map<?, ?> map) {
            return new TreeMap<>(map.entrySet().stream()
                    .collect(Collectors.toMap(e -> String.valueOf(e.getKey()), e -> canonical(e.getValue()))))
                    .toString();
        }
        if (value instanceof Number number) {
            return isFinite(number)
                    ? toDecimal(number).stripTrailingZeros().toPlainString()
                    : String.valueOf(number.doubleValue());
        }
        return value instanceof String ? "'" + value + "'" : String.valueOf(value);
    }

    /** NaN and the infinities have no decimal form; they order as {@link Double#compare} does. */
    private static int compareNumbers(Number left, Number right) {
        if (!isFinite(left) || !isFinite(right)) {
            return Double.compare(left.doubleValue(), right.doubleValue());
        }
        return toDecimal(left).compareTo(toDecimal(right));
    }

    private static boolean isFinite(Number number) {
        return !(number instanceof Double || number instanceof Float) || Double.isFinite(number.doubleValue());
    }

    private static BigDecimal toDecimal(Number number) {
        if (number instanceof BigDecimal decimal) {
            return decimal;
        }
        if (number instanceof BigInteger integer) {
            return new BigDecimal(integer);
        }
        if (number instanceof Double || number instanceof Float) {
            return BigDecimal.valueOf(number.doubleValue());
        }
        return BigDecimal.valueOf(number.longValue());
    }
}
