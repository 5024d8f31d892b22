package io.github.cyfko.taskql.core.utils;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Utility class for loose conversions between the value shapes found in task metadata
 * and in filter conditions.
 * <p>
 * Task metadata is hand written, so a "number" field may hold {@code 5}, {@code "5"} or
 * {@code "10-High"} and a "boolean" field may hold {@code true} or {@code "true"}. These
 * helpers never throw; values that cannot be read report absence instead.
 * </p>
 *
 * <p><strong>Emptiness rule:</strong> null, a blank string, an empty collection and a
 * collection whose items are all blank or a pair of empty quotes are all empty.</p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class ValueCoercion {

    private static final Pattern LEADING_NUMBER =
            Pattern.compile("^\\s*([+-]?(?:\\d+\\.?\\d*|\\.\\d+)(?:[eE][+-]?\\d+)?)");

    private ValueCoercion() {
    }

    /**
     * Reads the number a value starts with: {@code "10-High"} gives {@code 10},
     * {@code "x"} gives nothing.
     *
     * @param value number or text
     * @return the leading number, empty when there is none
     */
    public static OptionalDouble leadingNumber(Object value) {
        if (value instanceof Number number) {
            double d = number.doubleValue();
            return Double.isNaN(d) ? OptionalDouble.empty() : OptionalDouble.of(d);
        }
        if (!(value instanceof String text)) return OptionalDouble.empty();

        Matcher matcher = LEADING_NUMBER.matcher(text);
        if (!matcher.find()) return OptionalDouble.empty();
        try {
            return OptionalDouble.of(Double.parseDouble(matcher.group(1)));
        } catch (NumberFormatException e) {
            return OptionalDouble.empty();
        }
    }

    /**
     * Reads a boolean from {@code true}/{@code false} or their text forms, ignoring case.
     *
     * @param value raw value
     * @return the boolean, or empty for anything else
     */
    public static Optional<Boolean> bool(Object value) {
        if (value instanceof Boolean b) return Optional.of(b);
        if (value instanceof String text) {
            String t = text.trim().toLowerCase(Locale.ROOT);
            if (t.equals("true")) return Optional.of(Boolean.TRUE);
            if (t.equals("false")) return Optional.of(Boolean.FALSE);
        }
        return Optional.empty();
    }

    public static boolean isEmpty(Object value) {
        if (value == null) return true;
        if (value instanceof String text) return text.trim().isEmpty();
        if (value instanceof Collection<?> items) {
            if (items.isEmpty()) return true;
            for (Object item : items) {
                if (!(item instanceof String text)) return false;
                String trimmed = text.trim();
                if (!trimmed.isEmpty() && !trimmed.equals("\"\"") && !trimmed.equals("''")) return false;
            }
            return true;
        }
        return false;
    }

    /**
     * Formats a value for display and bucket names: whole numbers lose their fraction.
     *
     * @param value any value
     * @return text form, never null
     */
    public static String text(Object value) {
        if (value == null) return "";
        if (value instanceof Double || value instanceof Float) {
            double d = ((Number) value).doubleValue();
            if (d == Math.rint(d) && !Double.isInfinite(d) && Math.abs(d) < 1e15) {
                return Long.toString((long) d);
            }
        }
        return value.toString();
    }

    public static String formatNumber(double number) {
        return text(number);
    }

    /**
     * @param value single value or collection
     * @return the collection's items, or a one-element list; an empty list for null
     */
    public static List<Object> items(Object value) {
        List<Object> items = new ArrayList<>();
        if (value == null) return items;
        if (value instanceof Collection<?> collection) {
            items.addAll(collection);
        } else {
            items.add(value);
        }
        return items;
    }

    /**
     * Equality used by {@code is}: numbers compare numerically, booleans compare with
     * their text forms, everything else compares as exact text.
     */
    public static boolean looselyEquals(Object a, Object b) {
        if (a == null || b == null) return a == b;
        if (a instanceof Number || b instanceof Number) {
            OptionalDouble x = exactNumber(a);
            OptionalDouble y = exactNumber(b);
            return x.isPresent() && y.isPresent() && Double.compare(x.getAsDouble(), y.getAsDouble()) == 0;
        }
        if (a instanceof Boolean || b instanceof Boolean) {
            Optional<Boolean> x = bool(a);
            return x.isPresent() && x.equals(bool(b));
        }
        return a.toString().equals(b.toString());
    }

    private static OptionalDouble exactNumber(Object value) {
        if (value instanceof Number number) return OptionalDouble.of(number.doubleValue());
        if (value instanceof String text) {
            try {
                return OptionalDouble.of(Double.parseDouble(text.trim()));
            } catch (NumberFormatException e) {
                return OptionalDouble.empty();
            }
        }
        return OptionalDouble.empty();
    }
}
