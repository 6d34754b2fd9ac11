package com.queryroute.util;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Comparison helpers for cell values coming from heterogeneous sources.
 */
public final class Values {

    private Values() {
    }

    public static boolean isNumeric(Object v) {
        if (v instanceof Number) {
            return true;
        }
        if (v instanceof String s) {
            return parseDouble(s) != null;
        }
        return false;
    }

    /**
     * @param v value
     * @return numeric value, or {@code null} when {@code v} is not a number or numeric string
     */
    public static Double toDouble(Object v) {
        if (v instanceof Number n) {
            return n.doubleValue();
        }
        if (v instanceof String s) {
            return parseDouble(s);
        }
        return null;
    }

    private static Double parseDouble(String s) {
        String t = s.trim();
        if (t.isEmpty()) {
            return null;
        }
        try {
            return Double.parseDouble(t);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    /**
     * Numeric values compare by value ({@code 1 == 1.0}), everything else by string form.
     */
    public static boolean sameValue(Object a, Object b) {
        if (a == null || b == null) {
            return a == b;
        }
        if (a instanceof Number && b instanceof Number) {
            return compareNumbers((Number) a, (Number) b) == 0;
        }
        return Objects.equals(String.valueOf(a), String.valueOf(b));
    }

    /**
     * Orders two non-null values: numerically when both are numeric, otherwise by string form.
     */
    public static int compare(Object a, Object b) {
        Double da = toDouble(a);
        Double db = toDouble(b);
        if (da != null && db != null) {
            return Double.compare(da, db);
        }
        return String.valueOf(a).compareTo(String.valueOf(b));
    }

    private static int compareNumbers(Number a, Number b) {
        if (a instanceof BigDecimal || b instanceof BigDecimal) {
            return new BigDecimal(a.toString()).compareTo(new BigDecimal(b.toString()));
        }
        return Double.compare(a.doubleValue(), b.doubleValue());
    }

    /**
     * Key used to match rows across sources: numbers normalize to their plain decimal form.
     */
    public static Object joinKey(Object v) {
        if (v instanceof Number n) {
            return new BigDecimal(n.toString()).stripTrailingZeros().toPlainString();
        }
        return v != null ? v.toString() : null;
    }

    /**
     * Reads a CSV cell: blank becomes null, integers become {@code Long}, decimals {@code Double}.
     */
    public static Object parseCell(String raw) {
        if (raw == null) {
            return null;
        }
        String t = raw.trim();
        if (t.isEmpty()) {
            return null;
        }
        if (t.matches("-?\\d{1,18}")) {
            return Long.parseLong(t);
        }
        if (t.matches("-?\\d*\\.\\d+([eE][-+]?\\d+)?")) {
            return Double.parseDouble(t);
        }
        return raw;
    }
}
