package com.company.metrics.util;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Collection;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Helpers for the loosely typed values carried by entry fields
 * (numbers, strings, booleans, lists and maps).
 */
public final class Values {

    private static final Pattern NUMBER_PATTERN =
            Pattern.compile("[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");

    private Values() {
    }

    public static boolean isNumeric(Object value) {
        return value instanceof Number;
    }

    public static Double toDouble(Object value) {
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        return null;
    }

    /**
     * Empty-ish values: null, false, zero, empty strings and empty collections.
     */
    public static boolean isFalsy(Object value) {
        if (value == null) return true;
        if (value instanceof Boolean) return !((Boolean) value);
        if (value instanceof Number) return ((Number) value).doubleValue() == 0.0;
        if (value instanceof CharSequence) return ((CharSequence) value).length() == 0;
        if (value instanceof Collection) return ((Collection<?>) value).isEmpty();
        if (value instanceof Map) return ((Map<?, ?>) value).isEmpty();
        return false;
    }

    /**
     * Equality that treats 5 and 5.0 as the same value.
     */
    public static boolean valueEquals(Object a, Object b) {
        if (a == b) return true;
        if (a == null || b == null) return false;
        if (a instanceof Number && b instanceof Number) {
            return ((Number) a).doubleValue() == ((Number) b).doubleValue();
        }
        return a.equals(b);
    }

    /**
     * Hash code consistent with {@link #valueEquals(Object, Object)}.
     */
    public static int valueHash(Object value) {
        if (value == null) return 0;
        if (value instanceof Number) {
            // 0.0 == -0.0 but their bit patterns differ
            double number = ((Number) value).doubleValue() + 0.0;
            return Double.hashCode(number);
        }
        return value.hashCode();
    }

    /**
     * Compares two numbers numerically or two strings lexicographically.
     *
     * @throws IllegalArgumentException if the values are not mutually comparable
     */
    public static int compare(Object a, Object b) {
        if (a instanceof Number && b instanceof Number) {
            return Double.compare(((Number) a).doubleValue(), ((Number) b).doubleValue());
        }
        if (a instanceof String && b instanceof String) {
            return ((String) a).compareTo((String) b);
        }
        if (a instanceof Boolean && b instanceof Boolean) {
            return Boolean.compare((Boolean) a, (Boolean) b);
        }
        throw new IllegalArgumentException("Values are not comparable: " + describe(a) + " and " + describe(b));
    }

    public static boolean isComparable(Object a, Object b) {
        return (a instanceof Number && b instanceof Number)
                || (a instanceof String && b instanceof String)
                || (a instanceof Boolean && b instanceof Boolean);
    }

    /**
     * Text form used in names, labels and condition strings. Whole doubles print
     * without a fraction ("10", not "10.0").
     */
    public static String toDisplayString(Object value) {
        if (value == null) return "none";
        if (value instanceof Double || value instanceof Float) {
            double d = ((Number) value).doubleValue();
            if (Double.isNaN(d) || Double.isInfinite(d)) {
                return String.valueOf(d);
            }
            return BigDecimal.valueOf(d).stripTrailingZeros().toPlainString();
        }
        return String.valueOf(value);
    }

    public static double round(double value, int precision) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return value;
        }
        return BigDecimal.valueOf(value).setScale(precision, RoundingMode.HALF_UP).doubleValue();
    }

    /**
     * Parses a number, returning null when the text is not numeric.
     */
    public static Double parseNumber(String text) {
        if (text == null) return null;
        String trimmed = text.trim();
        if (!NUMBER_PATTERN.matcher(trimmed).matches()) return null;
        return Double.parseDouble(trimmed);
    }

    private static String describe(Object value) {
        return value == null ? "null" : value.getClass().getSimpleName() + "(" + value + ")";
    }
}
