package com.queryroute.routing;

import com.queryroute.catalog.SourceRegistry;
import com.queryroute.model.DatabaseQueryTask;
import com.queryroute.model.QueryPlan;
import com.queryroute.model.SourceDefinition;
import com.queryroute.model.TableCandidate;
import com.queryroute.model.TableDescriptor;
import com.queryroute.util.DbTypeNormalizer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Renders a {@link QueryPlan} into per-source query tasks.
 */
@Slf4j
@Component
public class QueryTaskGenerator {
    private final SourceRegistry registry;

    public QueryTaskGenerator(SourceRegistry registry) {
        this.registry = registry;
    }

    public List<DatabaseQueryTask> generateTasks(QueryPlan plan) {
        if (plan.isFallback()) {
            return List.of(fallbackTask(plan));
        }
        if (!plan.isCrossDatabase()) {
            List<TableCandidate> tables = plan.allTables();
            String sourceId = tables.isEmpty() ? plan.getSourceId() : tables.get(0).getSourceId();
            if (takesOperations(sourceId)) {
                return List.of(operationTask(sourceId, tables, plan, 1));
            }
            String sql = render(tables, plan.getJoinConditions(), plan.getSelectColumns(),
                    plan.getWhereConditions(), plan.getGroupByColumns(), plan.getOrderByColumns());
            return List.of(task(sourceId, tables, sql, 1));
        }

        Map<String, List<TableCandidate>> groups = new LinkedHashMap<>();
        for (TableCandidate candidate : plan.allTables()) {
            groups.computeIfAbsent(candidate.getSourceId(), k -> new ArrayList<>()).add(candidate);
        }

        List<DatabaseQueryTask> tasks = new ArrayList<>();
        for (Map.Entry<String, List<TableCandidate>> group : groups.entrySet()) {
            List<TableCandidate> tables = group.getValue();
            boolean holdsPrimary = tables.stream().anyMatch(plan.getPrimaryTables()::contains);
            if (takesOperations(group.getKey())) {
                tasks.add(operationTask(group.getKey(), tables, plan, holdsPrimary ? 1 : 2));
                continue;
            }
            List<String> names = tables.stream().map(TableCandidate::getTableName).toList();

            List<String> select = restrict(plan.getSelectColumns(), names);
            if (select.isEmpty()) {
                select = List.of("*");
            }
            String sql = render(tables,
                    restrict(plan.getJoinConditions(), names),
                    select,
                    restrict(plan.getWhereConditions(), names),
                    restrict(plan.getGroupByColumns(), names),
                    restrict(plan.getOrderByColumns(), names));
            tasks.add(task(group.getKey(), tables, sql, holdsPrimary ? 1 : 2));
        }
        log.info("Split cross-source plan: source_id={}, tasks={}", plan.getSourceId(), tasks.size());
        return tasks;
    }

    private DatabaseQueryTask fallbackTask(QueryPlan plan) {
        if (takesOperations(plan.getSourceId())) {
            DatabaseQueryTask task = task(plan.getSourceId(), List.of(), null, 1);
            task.setOperations(OperationPlanRenderer.renderFallback(plan));
            return task;
        }
        String sql = "SELECT " + String.join(", ", plan.getSelectColumns()) + " FROM " + plan.getPlaceholderTable();
        return task(plan.getSourceId(), List.of(), sql, 1);
    }

    private boolean takesOperations(String sourceId) {
        return registry.find(sourceId).map(s -> DbTypeNormalizer.isFlatFile(s.getType())).orElse(false);
    }

    private DatabaseQueryTask operationTask(String sourceId, List<TableCandidate> tables, QueryPlan plan, int priority) {
        DatabaseQueryTask task = task(sourceId, tables, null, priority);
        task.setOperations(OperationPlanRenderer.render(tables, plan));
        log.debug("Rendered operation sequence: source_id={}, query={}", sourceId, task.queryText());
        return task;
    }

    private DatabaseQueryTask task(String sourceId, List<TableCandidate> tables, String sql, int priority) {
        Optional<SourceDefinition> source = registry.find(sourceId);
        String sourceName = source.map(SourceDefinition::displayName)
                .orElseGet(() -> tables.isEmpty() ? sourceId : tables.get(0).getTable().getSourceName());
        return DatabaseQueryTask.builder()
                .sourceId(sourceId)
                .sourceName(sourceName)
                .sourceType(source.map(SourceDefinition::getType).orElse(null))
                .tables(List.copyOf(tables))
                .sql(sql)
                .priority(priority)
                .build();
    }

    private static List<String> restrict(List<String> fragments, List<String> tableNames) {
        return fragments.stream()
                .filter(f -> SqlFragments.onlyReferences(f, tableNames))
                .collect(Collectors.toList());
    }

    /**
     * SELECT, FROM, LEFT JOINs, WHERE, GROUP BY and ORDER BY in that order. Tables that no join condition
     * links to the ones already attached are left out, together with the fragments that mention them.
     */
    static String render(List<TableCandidate> tables, List<String> joinConditions, List<String> select,
                         List<String> where, List<String> groupBy, List<String> orderBy) {
        if (tables.isEmpty()) {
            throw new IllegalArgumentException("Cannot render a query without tables");
        }
        List<String> attached = new ArrayList<>();
        attached.add(tables.get(0).getTableName());
        StringBuilder from = new StringBuilder(tableRef(tables.get(0).getTable()));

        for (TableCandidate candidate : tables.subList(1, tables.size())) {
            String name = candidate.getTableName();
            Optional<String> condition = joinConditions.stream()
                    .filter(c -> SqlFragments.qualifiers(c).contains(name.toLowerCase(Locale.ROOT)))
                    .filter(c -> {
                        List<String> scope = new ArrayList<>(attached);
                        scope.add(name);
                        return SqlFragments.onlyReferences(c, scope);
                    })
                    .filter(c -> SqlFragments.qualifiers(c).size() > 1)
                    .findFirst();
            if (condition.isEmpty()) {
                log.warn("Skipping table without a join condition: table={}", name);
                continue;
            }
            from.append(" LEFT JOIN ").append(tableRef(candidate.getTable())).append(" ON ").append(condition.get());
            attached.add(name);
        }

        List<String> selectColumns = restrict(select, attached);
        if (selectColumns.isEmpty()) {
            selectColumns = List.of("*");
        }
        StringBuilder sql = new StringBuilder("SELECT ")
                .append(String.join(", ", selectColumns))
                .append(" FROM ")
                .append(from);
        List<String> whereConditions = restrict(where, attached);
        if (!whereConditions.isEmpty()) {
            sql.append(" WHERE ").append(String.join(" AND ", whereConditions));
        }
        List<String> group = restrict(groupBy, attached);
        if (!group.isEmpty()) {
            sql.append(" GROUP BY ").append(String.join(", ", group));
        }
        List<String> order = restrict(orderBy, attached);
        if (!order.isEmpty()) {
            sql.append(" ORDER BY ").append(String.join(", ", order));
        }
        return sql.toString();
    }

    private static String tableRef(TableDescriptor table) {
        if (table.getSchema() == null || table.getSchema().isBlank()) {
            return table.getName();
        }
        return table.qualifiedName() + " " + table.getName();
    }
}
