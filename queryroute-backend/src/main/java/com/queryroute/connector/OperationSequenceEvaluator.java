package com.queryroute.connector;

import com.queryroute.model.AggregateFunction;
import com.queryroute.model.AggregationConfig;
import com.queryroute.model.FilterConfig;
import com.queryroute.model.TabularData;
import com.queryroute.util.Values;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;
import java.util.regex.Pattern;

/**
 * Runs an operation sequence over in-memory rows with SQL-like semantics.
 *
 * <p>Nulls never satisfy a predicate. An aggregate without grouping over no rows yields one row,
 * {@code count} being 0 and every other function null.
 */
final class OperationSequenceEvaluator {
    private final Function<String, TabularData> tableLoader;

    OperationSequenceEvaluator(Function<String, TabularData> tableLoader) {
        this.tableLoader = tableLoader;
    }

    TabularData evaluate(List<OperationStep> steps) {
        List<String> columns = new ArrayList<>();
        List<Map<String, Object>> rows = new ArrayList<>();
        for (OperationStep step : steps) {
            switch (step.getType()) {
                case LOAD:
                    TabularData loaded = tableLoader.apply(step.getTable());
                    columns = new ArrayList<>(loaded.getColumns());
                    rows = new ArrayList<>(loaded.getRows());
                    break;
                case FILTER:
                    requireColumn(columns, step.getFilter().getColumn());
                    rows = filter(rows, step.getFilter());
                    break;
                case AGGREGATE:
                    TabularData aggregated = aggregate(columns, rows, step);
                    columns = aggregated.getColumns();
                    rows = aggregated.getRows();
                    break;
                case SELECT:
                    for (String column : step.getColumns()) {
                        requireColumn(columns, column);
                    }
                    columns = new ArrayList<>(step.getColumns());
                    rows = project(rows, columns);
                    break;
                case ORDER_BY:
                    requireColumn(columns, step.getOrderBy());
                    rows.sort(rowComparator(step.getOrderBy(), step.isDescending()));
                    break;
                case OFFSET:
                    rows = new ArrayList<>(rows.subList(Math.min(step.getCount(), rows.size()), rows.size()));
                    break;
                case LIMIT:
                    rows = new ArrayList<>(rows.subList(0, Math.min(step.getCount(), rows.size())));
                    break;
                default:
                    throw new IllegalArgumentException("Unsupported operation: " + step.getType());
            }
        }
        return new TabularData(columns, rows);
    }

    private static void requireColumn(List<String> columns, String column) {
        if (!columns.contains(column)) {
            throw new IllegalArgumentException("Unknown column: " + column);
        }
    }

    private static List<Map<String, Object>> filter(List<Map<String, Object>> rows, FilterConfig filter) {
        List<Map<String, Object>> out = new ArrayList<>();
        for (Map<String, Object> row : rows) {
            if (matches(row.get(filter.getColumn()), filter.getOperator(), filter.getValue())) {
                out.add(row);
            }
        }
        return out;
    }

    static boolean matches(Object cell, String operator, Object value) {
        if (cell == null || value == null) {
            return false;
        }
        String op = operator != null ? operator.trim().toUpperCase(Locale.ROOT) : "=";
        switch (op) {
            case "=":
                return Values.sameValue(cell, coerce(cell, value));
            case "!=":
            case "<>":
                return !Values.sameValue(cell, coerce(cell, value));
            case ">":
                return Values.compare(cell, value) > 0;
            case ">=":
                return Values.compare(cell, value) >= 0;
            case "<":
                return Values.compare(cell, value) < 0;
            case "<=":
                return Values.compare(cell, value) <= 0;
            case "LIKE":
                return likeToRegex(String.valueOf(value)).matcher(String.valueOf(cell)).matches();
            case "IN":
                if (value instanceof Collection<?> candidates) {
                    return candidates.stream().anyMatch(c -> c != null && Values.sameValue(cell, coerce(cell, c)));
                }
                return Values.sameValue(cell, coerce(cell, value));
            default:
                throw new IllegalArgumentException("Unsupported operator: " + operator);
        }
    }

    private static Object coerce(Object cell, Object value) {
        if (cell instanceof Number && value instanceof String s) {
            Double d = Values.toDouble(s);
            return d != null ? d : value;
        }
        return value;
    }

    private static Pattern likeToRegex(String like) {
        StringBuilder regex = new StringBuilder();
        for (char c : like.toCharArray()) {
            if (c == '%') {
                regex.append(".*");
            } else if (c == '_') {
                regex.append('.');
            } else {
                regex.append(Pattern.quote(String.valueOf(c)));
            }
        }
        return Pattern.compile(regex.toString(), Pattern.DOTALL);
    }

    private static TabularData aggregate(List<String> columns, List<Map<String, Object>> rows, OperationStep step) {
        List<String> groupBy = step.getGroupBy() != null ? step.getGroupBy() : List.of();
        for (String g : groupBy) {
            requireColumn(columns, g);
        }
        for (AggregationConfig agg : step.getAggregations()) {
            if (agg.getFunction() != AggregateFunction.COUNT || !"*".equals(agg.getField())) {
                requireColumn(columns, agg.getField());
            }
        }

        Map<List<Object>, List<Map<String, Object>>> groups = new LinkedHashMap<>();
        for (Map<String, Object> row : rows) {
            List<Object> key = new ArrayList<>(groupBy.size());
            for (String g : groupBy) {
                key.add(row.get(g));
            }
            groups.computeIfAbsent(key, k -> new ArrayList<>()).add(row);
        }
        if (groups.isEmpty() && groupBy.isEmpty()) {
            groups.put(List.of(), List.of());
        }

        List<String> outColumns = new ArrayList<>();
        for (AggregationConfig agg : step.getAggregations()) {
            outColumns.add(agg.alias());
        }
        outColumns.addAll(groupBy);

        List<Map<String, Object>> out = new ArrayList<>();
        for (Map.Entry<List<Object>, List<Map<String, Object>>> group : groups.entrySet()) {
            Map<String, Object> row = new LinkedHashMap<>();
            for (AggregationConfig agg : step.getAggregations()) {
                row.put(agg.alias(), apply(agg, group.getValue()));
            }
            for (int i = 0; i < groupBy.size(); i++) {
                row.put(groupBy.get(i), group.getKey().get(i));
            }
            if (step.getHaving() == null || step.getHaving().isBlank() || having(step.getHaving(), step.getAggregations(), row)) {
                out.add(row);
            }
        }
        return new TabularData(outColumns, out);
    }

    private static Object apply(AggregationConfig agg, List<Map<String, Object>> rows) {
        if (agg.getFunction() == AggregateFunction.COUNT) {
            if ("*".equals(agg.getField())) {
                return (long) rows.size();
            }
            return rows.stream().filter(r -> r.get(agg.getField()) != null).count();
        }
        List<Object> values = new ArrayList<>();
        for (Map<String, Object> row : rows) {
            Object v = row.get(agg.getField());
            if (v != null) {
                values.add(v);
            }
        }
        if (values.isEmpty()) {
            return null;
        }
        switch (agg.getFunction()) {
            case SUM:
                return sum(values);
            case AVG:
                return values.stream().map(Values::toDouble).filter(d -> d != null).mapToDouble(Double::doubleValue).average().orElse(0);
            case MIN:
                return values.stream().min(Values::compare).orElse(null);
            case MAX:
                return values.stream().max(Values::compare).orElse(null);
            default:
                throw new IllegalArgumentException("Unsupported aggregate: " + agg.getFunction());
        }
    }

    private static Object sum(List<Object> values) {
        boolean integral = values.stream().allMatch(v -> v instanceof Long || v instanceof Integer);
        if (integral) {
            return values.stream().mapToLong(v -> ((Number) v).longValue()).sum();
        }
        double total = 0;
        for (Object v : values) {
            Double d = Values.toDouble(v);
            if (d != null) {
                total += d;
            }
        }
        return total;
    }

    /**
     * Supports {@code <alias|FN(field)> <op> <number>}.
     */
    private static boolean having(String condition, List<AggregationConfig> aggregations, Map<String, Object> row) {
        HavingCondition having = HavingCondition.parse(condition)
                .orElseThrow(() -> new IllegalArgumentException("Unsupported HAVING condition: " + condition));
        String expr = having.getExpression();
        Object value = null;
        for (AggregationConfig agg : aggregations) {
            String call = agg.getFunction().wireName() + "(" + agg.getField() + ")";
            if (expr.equalsIgnoreCase(agg.alias()) || expr.equalsIgnoreCase(call)) {
                value = row.get(agg.alias());
                break;
            }
        }
        if (value == null && row.containsKey(expr)) {
            value = row.get(expr);
        }
        return matches(value, having.getOperator(), having.getThreshold());
    }

    private static List<Map<String, Object>> project(List<Map<String, Object>> rows, List<String> columns) {
        List<Map<String, Object>> out = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            Map<String, Object> projected = new LinkedHashMap<>();
            for (String column : columns) {
                projected.put(column, row.get(column));
            }
            out.add(projected);
        }
        return out;
    }

    private static Comparator<Map<String, Object>> rowComparator(String column, boolean descending) {
        Comparator<Object> nullsLast = (a, b) -> {
            if (a == null || b == null) {
                return a == null ? (b == null ? 0 : 1) : -1;
            }
            return Values.compare(a, b);
        };
        Comparator<Map<String, Object>> comparator = Comparator.comparing(r -> r.get(column), nullsLast);
        return descending ? comparator.reversed() : comparator;
    }
}
