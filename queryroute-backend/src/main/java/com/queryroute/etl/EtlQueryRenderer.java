package com.queryroute.etl;

import com.queryroute.connector.HavingCondition;
import com.queryroute.connector.OperationStep;
import com.queryroute.connector.SourceQuery;
import com.queryroute.etl.RelativePeriodResolver.DateRange;
import com.queryroute.model.AggregateFunction;
import com.queryroute.model.AggregationConfig;
import com.queryroute.model.EtlInstructions;
import com.queryroute.model.EtlQueryType;
import com.queryroute.model.FilterConfig;
import com.queryroute.model.RegionMatchMode;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Renders resolved ETL instructions as SQL or as an operation sequence for flat-file sources.
 */
final class EtlQueryRenderer {
    static final Set<String> OPERATORS = Set.of("=", "!=", "<>", ">", ">=", "<", "<=", "LIKE", "IN");

    private EtlQueryRenderer() {
    }

    /**
     * Filters resolved from the instructions and the task context.
     */
    record ResolvedFilters(String timeField, DateRange timeRange, String regionField, String regionValue,
                           RegionMatchMode regionMode) {

        boolean hasTime() {
            return timeField != null && timeRange != null && (timeRange.start() != null || timeRange.end() != null);
        }

        boolean hasRegion() {
            return regionField != null && regionValue != null && !regionValue.isBlank();
        }
    }

    static SourceQuery render(EtlInstructions instructions, String table, ResolvedFilters resolved, boolean sql) {
        List<FilterConfig> filters = effectiveFilters(instructions, resolved);
        return sql ? SourceQuery.sql(renderSql(instructions, table, filters)) : renderOperations(instructions, table, filters);
    }

    /**
     * Declared filters followed by the time and region bounds, LIKE values wrapped in {@code %} when they
     * carry no wildcard.
     */
    static List<FilterConfig> effectiveFilters(EtlInstructions instructions, ResolvedFilters resolved) {
        List<FilterConfig> filters = new ArrayList<>();
        for (FilterConfig f : instructions.getFilters()) {
            String op = normalizeOperator(f.getOperator());
            Object value = f.getValue();
            if ("LIKE".equals(op) && value != null && !String.valueOf(value).contains("%")) {
                value = "%" + value + "%";
            }
            filters.add(FilterConfig.builder().column(f.getColumn()).operator(op).value(value).build());
        }
        if (resolved.hasTime()) {
            DateRange range = resolved.timeRange();
            if (range.start() != null) {
                filters.add(FilterConfig.builder().column(resolved.timeField()).operator(">=").value(range.start().toString()).build());
            }
            if (range.end() != null) {
                filters.add(FilterConfig.builder().column(resolved.timeField()).operator("<").value(range.endExclusive().toString()).build());
            }
        }
        if (resolved.hasRegion()) {
            String value = resolved.regionValue().trim();
            RegionMatchMode mode = resolved.regionMode() != null ? resolved.regionMode() : RegionMatchMode.EXACT;
            switch (mode) {
                case CONTAINS:
                    filters.add(FilterConfig.builder().column(resolved.regionField()).operator("LIKE").value("%" + value + "%").build());
                    break;
                case STARTS_WITH:
                    filters.add(FilterConfig.builder().column(resolved.regionField()).operator("LIKE").value(value + "%").build());
                    break;
                case EXACT:
                default:
                    filters.add(FilterConfig.builder().column(resolved.regionField()).operator("=").value(value).build());
            }
        }
        return filters;
    }

    static String normalizeOperator(String operator) {
        String op = operator == null || operator.isBlank() ? "=" : operator.trim().toUpperCase(Locale.ROOT);
        if (!OPERATORS.contains(op)) {
            throw new InvalidInstructionException("Unsupported filter operator: " + operator);
        }
        return op;
    }

    private static String renderSql(EtlInstructions instructions, String table, List<FilterConfig> filters) {
        List<String> select = new ArrayList<>();
        AggregationConfig primary = instructions.primaryAggregation();
        boolean aggregate = instructions.getQueryType() == EtlQueryType.AGGREGATE && primary != null;
        if (aggregate) {
            for (AggregationConfig agg : instructions.getAggregations()) {
                select.add(aggregateCall(agg) + " AS " + agg.alias());
            }
            if (primary.hasGroupBy()) {
                select.addAll(primary.getGroupBy());
            }
        } else if (!instructions.getSourceFields().isEmpty()) {
            select.addAll(instructions.getSourceFields());
        } else {
            select.add("*");
        }

        StringBuilder sql = new StringBuilder("SELECT ").append(String.join(", ", select)).append(" FROM ").append(table);
        if (!filters.isEmpty()) {
            sql.append(" WHERE ").append(filters.stream().map(EtlQueryRenderer::predicate).collect(Collectors.joining(" AND ")));
        }
        if (aggregate && primary.hasGroupBy()) {
            sql.append(" GROUP BY ").append(String.join(", ", primary.getGroupBy()));
        }
        if (aggregate && primary.getHavingCondition() != null && !primary.getHavingCondition().isBlank()) {
            HavingCondition having = HavingCondition.parse(primary.getHavingCondition())
                    .orElseThrow(() -> new InvalidInstructionException("Unsupported HAVING condition: " + primary.getHavingCondition()));
            sql.append(" HAVING ").append(havingClause(having, instructions.getAggregations()));
        }
        if (instructions.getQueryType() == EtlQueryType.SELECT_FOR_CHART && !instructions.getSourceFields().isEmpty()) {
            sql.append(" ORDER BY ").append(instructions.getSourceFields().get(0));
        }
        return sql.toString();
    }

    /**
     * Rebuilds a parsed condition, aliases replaced by the aggregate they name.
     */
    static String havingClause(HavingCondition having, List<AggregationConfig> aggregations) {
        String expr = having.getExpression();
        String rendered = null;
        for (AggregationConfig agg : aggregations) {
            String call = agg.getFunction().wireName() + "(" + agg.getField() + ")";
            if (expr.equalsIgnoreCase(agg.alias()) || expr.equalsIgnoreCase(call)) {
                rendered = aggregateCall(agg);
                break;
            }
        }
        if (rendered == null) {
            rendered = having.isCall()
                    ? AggregateFunction.parse(having.function()).name() + "(" + having.argument() + ")"
                    : expr;
        }
        return rendered + " " + having.getOperator() + " " + having.getThreshold();
    }

    private static String aggregateCall(AggregationConfig agg) {
        String fn = agg.getFunction().name();
        if (agg.getFunction() == AggregateFunction.COUNT && "*".equals(agg.getField())) {
            return "COUNT(*)";
        }
        return fn + "(" + agg.getField() + ")";
    }

    static String predicate(FilterConfig filter) {
        String op = normalizeOperator(filter.getOperator());
        Object value = filter.getValue();
        if (value == null) {
            return filter.getColumn() + ("=".equals(op) ? " IS NULL" : " IS NOT NULL");
        }
        if ("IN".equals(op)) {
            Collection<?> values = value instanceof Collection<?> c ? c : List.of(value);
            if (values.isEmpty()) {
                return "1 = 0";
            }
            return filter.getColumn() + " IN (" + values.stream().map(EtlQueryRenderer::literal).collect(Collectors.joining(", ")) + ")";
        }
        return filter.getColumn() + " " + op + " " + literal(value);
    }

    static String literal(Object value) {
        if (value instanceof Number) {
            return value.toString();
        }
        return "'" + String.valueOf(value).replace("'", "''") + "'";
    }

    private static SourceQuery renderOperations(EtlInstructions instructions, String table, List<FilterConfig> filters) {
        List<OperationStep> steps = new ArrayList<>();
        steps.add(OperationStep.load(table));
        for (FilterConfig filter : filters) {
            steps.add(OperationStep.filter(filter));
        }
        AggregationConfig primary = instructions.primaryAggregation();
        if (instructions.getQueryType() == EtlQueryType.AGGREGATE && primary != null) {
            steps.add(OperationStep.aggregate(instructions.getAggregations(),
                    primary.hasGroupBy() ? primary.getGroupBy() : List.of(), primary.getHavingCondition()));
        } else if (!instructions.getSourceFields().isEmpty()) {
            steps.add(OperationStep.select(instructions.getSourceFields()));
        }
        if (instructions.getQueryType() == EtlQueryType.SELECT_FOR_CHART && !instructions.getSourceFields().isEmpty()) {
            steps.add(OperationStep.orderBy(instructions.getSourceFields().get(0), false));
        }
        return SourceQuery.operations(steps);
    }
}
