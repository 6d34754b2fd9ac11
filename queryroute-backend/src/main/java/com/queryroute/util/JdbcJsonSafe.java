package com.queryroute.util;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.sql.Blob;
import java.sql.Clob;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;

/**
 * Converts JDBC driver values into plain values that merge, compare and serialize predictably.
 *
 * <p>Dates become ISO strings, integral numbers become {@code Long}, exact decimals stay {@link BigDecimal}.
 */
public final class JdbcJsonSafe {
    private static final int MAX_LOB_CHARS = 100_000;
    private static final int MAX_BLOB_BYTES = 100_000;
    private static final int MAX_NESTED_DEPTH = 3;
    private static final String UNSUPPORTED_PLACEHOLDER = "[unsupported]";

    private JdbcJsonSafe() {
    }

    /**
     * Reads a JDBC column value and returns a JSON-safe equivalent.
     *
     * @param rs result set
     * @param columnIndex 1-based column index
     * @return json-safe value
     * @throws SQLException when the cursor itself fails
     */
    public static Object read(ResultSet rs, int columnIndex) throws SQLException {
        Object v = rs.getObject(columnIndex);
        try {
            return toPlain(v, 0);
        } catch (SQLException e) {
            return UNSUPPORTED_PLACEHOLDER;
        }
    }

    static Object toPlain(Object v, int depth) throws SQLException {
        if (v == null) {
            return null;
        }
        if (depth > MAX_NESTED_DEPTH) {
            return UNSUPPORTED_PLACEHOLDER;
        }
        if (v instanceof Integer || v instanceof Short || v instanceof Byte) {
            return ((Number) v).longValue();
        }
        if (v instanceof BigInteger bi) {
            return bi.bitLength() < 64 ? (Object) bi.longValue() : new BigDecimal(bi);
        }
        if (v instanceof Number || v instanceof Boolean || v instanceof String) {
            return v;
        }
        if (v instanceof java.sql.Date date) {
            return date.toLocalDate().toString();
        }
        if (v instanceof java.sql.Timestamp ts) {
            return ts.toLocalDateTime().toString();
        }
        if (v instanceof java.sql.Time time) {
            return time.toLocalTime().toString();
        }
        if (v instanceof java.time.temporal.TemporalAccessor) {
            return v.toString();
        }
        if (v instanceof Clob clob) {
            long length = clob.length();
            return length <= 0 ? "" : clob.getSubString(1, (int) Math.min(length, MAX_LOB_CHARS));
        }
        if (v instanceof Blob blob) {
            long length = blob.length();
            return length <= 0 ? "" : Base64.getEncoder().encodeToString(blob.getBytes(1, (int) Math.min(length, MAX_BLOB_BYTES)));
        }
        if (v instanceof byte[] bytes) {
            return Base64.getEncoder().encodeToString(bytes);
        }
        if (v instanceof java.sql.Array arr) {
            Object arrayValue = arr.getArray();
            if (arrayValue instanceof Object[] objectArray) {
                List<Object> out = new ArrayList<>(objectArray.length);
                for (Object elem : objectArray) {
                    out.add(toPlain(elem, depth + 1));
                }
                return out;
            }
            return String.valueOf(arrayValue);
        }
        // PostgreSQL json/jsonb/custom types
        if ("org.postgresql.util.PGobject".equals(v.getClass().getName())) {
            try {
                Object value = v.getClass().getMethod("getValue").invoke(v);
                return value != null ? value.toString() : "";
            } catch (ReflectiveOperationException e) {
                return UNSUPPORTED_PLACEHOLDER;
            }
        }
        return String.valueOf(v);
    }
}
