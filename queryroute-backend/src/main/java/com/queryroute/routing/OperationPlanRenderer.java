package com.queryroute.routing;

import com.queryroute.connector.OperationStep;
import com.queryroute.model.AggregateFunction;
import com.queryroute.model.AggregationConfig;
import com.queryroute.model.FilterConfig;
import com.queryroute.model.QueryPlan;
import com.queryroute.model.TableCandidate;
import com.queryroute.model.TableDescriptor;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Renders a plan as an operation sequence for sources that do not run SQL.
 *
 * <p>Operation sequences read one table, so only the first table of the group is used. Plan fragments that
 * name other tables are dropped.
 */
@Slf4j
final class OperationPlanRenderer {
    private static final Pattern AGGREGATE_COLUMN = Pattern.compile(
            "^\\s*(COUNT|SUM|AVG|MAX|MIN)\\s*\\(\\s*(?:([A-Za-z_][\\w]*)\\.)?([A-Za-z_][\\w]*|\\*)\\s*\\)\\s+as\\s+([A-Za-z_][\\w]*)\\s*$",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern ORDER_COLUMN = Pattern.compile(
            "^\\s*(?:([A-Za-z_][\\w]*)\\.)?([A-Za-z_][\\w]*)(?:\\s+(ASC|DESC))?\\s*$", Pattern.CASE_INSENSITIVE);

    private OperationPlanRenderer() {
    }

    static List<OperationStep> render(List<TableCandidate> tables, QueryPlan plan) {
        if (tables.isEmpty()) {
            throw new IllegalArgumentException("Cannot render an operation sequence without tables");
        }
        TableDescriptor table = tables.get(0).getTable();
        if (tables.size() > 1) {
            log.warn("Operation sequences cannot join, reading one table: table={}, skipped={}",
                    table.getName(), tables.subList(1, tables.size()).stream().map(TableCandidate::getTableName).toList());
        }

        List<OperationStep> steps = new ArrayList<>();
        steps.add(OperationStep.load(table.getName()));
        for (FilterConfig filter : plan.getFilters()) {
            Optional<String> column = ownColumn(filter.getColumn(), table);
            if (column.isPresent()) {
                steps.add(OperationStep.filter(new FilterConfig(column.get(), filter.getOperator(), filter.getValue())));
            } else {
                log.warn("Dropping filter on another table: table={}, column={}", table.getName(), filter.getColumn());
            }
        }

        List<AggregationConfig> aggregations = aggregations(plan.getSelectColumns(), table);
        if (!aggregations.isEmpty()) {
            steps.add(OperationStep.aggregate(aggregations, ownColumns(plan.getGroupByColumns(), table), null));
        } else {
            List<String> columns = ownColumns(plan.getSelectColumns(), table);
            if (!columns.isEmpty()) {
                steps.add(OperationStep.select(columns));
            }
        }

        for (String order : plan.getOrderByColumns()) {
            Matcher m = ORDER_COLUMN.matcher(order);
            if (!m.matches()) {
                continue;
            }
            boolean aggregateAlias = m.group(1) == null
                    && aggregations.stream().anyMatch(a -> a.alias().equalsIgnoreCase(m.group(2)));
            Optional<String> column = aggregateAlias ? Optional.of(m.group(2)) : ownColumn(qualified(m.group(1), m.group(2)), table);
            column.ifPresent(c -> steps.add(OperationStep.orderBy(c, "DESC".equalsIgnoreCase(m.group(3)))));
            break;
        }
        return steps;
    }

    /**
     * Counts the placeholder table of a fallback plan.
     */
    static List<OperationStep> renderFallback(QueryPlan plan) {
        TableDescriptor placeholder = TableDescriptor.builder()
                .sourceId(plan.getSourceId())
                .name(plan.getPlaceholderTable())
                .build();
        List<AggregationConfig> count = aggregations(plan.getSelectColumns(), placeholder);
        return List.of(OperationStep.load(plan.getPlaceholderTable()), OperationStep.aggregate(count, List.of(), null));
    }

    private static List<AggregationConfig> aggregations(List<String> selectColumns, TableDescriptor table) {
        List<AggregationConfig> aggregations = new ArrayList<>();
        for (String column : selectColumns) {
            Matcher m = AGGREGATE_COLUMN.matcher(column);
            if (!m.matches()) {
                continue;
            }
            String field = m.group(3);
            if (!"*".equals(field)) {
                Optional<String> own = ownColumn(qualified(m.group(2), field), table);
                if (own.isEmpty()) {
                    continue;
                }
                field = own.get();
            }
            aggregations.add(AggregationConfig.builder()
                    .function(AggregateFunction.parse(m.group(1)))
                    .field(field)
                    .outputName(m.group(4))
                    .build());
        }
        return aggregations;
    }

    private static List<String> ownColumns(List<String> fragments, TableDescriptor table) {
        List<String> columns = new ArrayList<>();
        for (String fragment : fragments) {
            if (!"*".equals(fragment.trim()) && !SqlFragments.isAggregate(fragment)) {
                ownColumn(fragment.trim(), table).ifPresent(columns::add);
            }
        }
        return columns;
    }

    /**
     * Strips the qualifier of {@code table.column} when it names this table. An unqualified name is kept when the
     * table has that column, or when its columns are unknown.
     */
    static Optional<String> ownColumn(String reference, TableDescriptor table) {
        int dot = reference.indexOf('.');
        if (dot >= 0) {
            String qualifier = reference.substring(0, dot);
            return qualifier.equalsIgnoreCase(table.getName()) ? Optional.of(reference.substring(dot + 1)) : Optional.empty();
        }
        if (table.getColumns().isEmpty() || table.hasColumn(reference)) {
            return Optional.of(reference);
        }
        return Optional.empty();
    }

    private static String qualified(String qualifier, String column) {
        return qualifier == null ? column : qualifier + "." + column;
    }
}
