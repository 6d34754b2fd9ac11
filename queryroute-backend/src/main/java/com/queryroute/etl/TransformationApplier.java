package com.queryroute.etl;

import com.queryroute.model.TabularData;
import com.queryroute.model.TransformationConfig;
import com.queryroute.util.Values;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Applies post-query transformations in order. Rows are copied, the input table is never modified.
 */
final class TransformationApplier {
    private static final Set<String> CAST_TARGETS = Set.of("integer", "int", "float", "double", "string", "date");

    private TransformationApplier() {
    }

    /**
     * Checks transformations before anything runs.
     *
     * @return problems found, empty when all are well formed
     */
    static List<String> validate(List<TransformationConfig> transformations) {
        List<String> problems = new ArrayList<>();
        for (int i = 0; i < transformations.size(); i++) {
            TransformationConfig t = transformations.get(i);
            String at = "transformations[" + i + "]";
            if (t.getType() == null) {
                problems.add(at + ": type is required");
                continue;
            }
            switch (t.getType()) {
                case CAST:
                    if (isBlank(t.getField())) {
                        problems.add(at + ": cast needs a field");
                    }
                    if (t.getTargetType() == null || !CAST_TARGETS.contains(t.getTargetType().toLowerCase(Locale.ROOT))) {
                        problems.add(at + ": unsupported cast target " + t.getTargetType());
                    }
                    break;
                case FORMAT:
                    if (isBlank(t.getField()) || t.getPattern() == null) {
                        problems.add(at + ": format needs a field and a pattern");
                    }
                    break;
                case CALCULATE:
                    if (isBlank(t.getTargetField())) {
                        problems.add(at + ": calculate needs a target field");
                    }
                    try {
                        ExpressionEvaluator.compile(t.getFormula());
                    } catch (IllegalArgumentException e) {
                        problems.add(at + ": " + e.getMessage());
                    }
                    break;
                default:
                    problems.add(at + ": unsupported type " + t.getType());
            }
        }
        return problems;
    }

    static TabularData apply(TabularData data, List<TransformationConfig> transformations) {
        List<String> columns = new ArrayList<>(data.getColumns());
        List<Map<String, Object>> rows = new ArrayList<>(data.rowCount());
        for (Map<String, Object> row : data.getRows()) {
            rows.add(new LinkedHashMap<>(row));
        }

        for (TransformationConfig t : transformations) {
            switch (t.getType()) {
                case CAST:
                    String target = t.getTargetType().toLowerCase(Locale.ROOT);
                    for (Map<String, Object> row : rows) {
                        if (row.containsKey(t.getField())) {
                            row.put(t.getField(), cast(row.get(t.getField()), target));
                        }
                    }
                    break;
                case FORMAT:
                    for (Map<String, Object> row : rows) {
                        Object v = row.get(t.getField());
                        if (v != null) {
                            row.put(t.getField(), t.getPattern().replace("{}", String.valueOf(v)));
                        }
                    }
                    break;
                case CALCULATE:
                    ExpressionEvaluator evaluator = ExpressionEvaluator.compile(t.getFormula());
                    for (Map<String, Object> row : rows) {
                        row.put(t.getTargetField(), evaluator.evaluate(row));
                    }
                    if (!columns.contains(t.getTargetField())) {
                        columns.add(t.getTargetField());
                    }
                    break;
                default:
                    throw new IllegalArgumentException("Unsupported transformation: " + t.getType());
            }
        }
        return new TabularData(columns, rows);
    }

    /**
     * Truncates toward zero. Integral values keep every digit; only doubles go through floating point.
     */
    static Long toLong(Object value) {
        if (value instanceof Long || value instanceof Integer || value instanceof Short || value instanceof Byte
                || value instanceof BigInteger) {
            return ((Number) value).longValue();
        }
        if (value instanceof BigDecimal d) {
            return d.setScale(0, RoundingMode.DOWN).longValue();
        }
        if (value instanceof Number n) {
            return (long) n.doubleValue();
        }
        String s = String.valueOf(value).trim();
        try {
            return new BigDecimal(s).setScale(0, RoundingMode.DOWN).longValue();
        } catch (NumberFormatException e) {
            return null;
        }
    }

    static Object cast(Object value, String target) {
        if (value == null) {
            return null;
        }
        switch (target) {
            case "integer":
            case "int":
                return toLong(value);
            case "float":
            case "double":
                return Values.toDouble(value);
            case "string":
                if (value instanceof BigDecimal bd) {
                    return bd.toPlainString();
                }
                return String.valueOf(value);
            case "date": {
                String s = String.valueOf(value).trim();
                try {
                    return LocalDate.parse(s.length() > 10 ? s.substring(0, 10) : s).toString();
                } catch (DateTimeParseException e) {
                    return null;
                }
            }
            default:
                throw new IllegalArgumentException("Unsupported cast target: " + target);
        }
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
