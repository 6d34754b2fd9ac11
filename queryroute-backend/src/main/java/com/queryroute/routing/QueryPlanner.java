package com.queryroute.routing;

import com.queryroute.analyzer.KeywordVocabulary;
import com.queryroute.catalog.MetadataCatalog;
import com.queryroute.model.ColumnDescriptor;
import com.queryroute.model.Complexity;
import com.queryroute.model.FilterConfig;
import com.queryroute.model.QueryContext;
import com.queryroute.model.QueryPlan;
import com.queryroute.model.TableCandidate;
import com.queryroute.model.TableDescriptor;
import com.queryroute.model.TableRelation;
import com.queryroute.model.TimeRange;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Builds an immutable {@link QueryPlan} from ranked candidates.
 */
@Slf4j
@Component
public class QueryPlanner {
    static final String FALLBACK_SELECT = "COUNT(*) as count";
    private static final DateTimeFormatter FALLBACK_STAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");
    private static final int MAX_DETAIL_COLUMNS = 5;
    private static final List<String> ORDER_TIME_KEYWORDS = List.of("time", "date", "created");

    private final MetadataCatalog catalog;
    private final KeywordVocabulary vocabulary;
    private final Clock clock;
    private final TimeRangeResolver timeRangeResolver;
    private final String placeholderTable;

    public QueryPlanner(
            MetadataCatalog catalog,
            KeywordVocabulary vocabulary,
            Clock clock,
            @Value("${queryroute.planner.placeholder-table:default_table}") String placeholderTable
    ) {
        this.catalog = catalog;
        this.vocabulary = vocabulary;
        this.clock = clock;
        this.timeRangeResolver = new TimeRangeResolver(clock);
        this.placeholderTable = placeholderTable;
    }

    public QueryPlan createPlan(QueryContext context, List<TableCandidate> candidates, String sourceId) {
        if (candidates == null || candidates.isEmpty()) {
            log.warn("No candidate tables, using fallback plan: source_id={}, request={}", sourceId, context.getOriginalQuery());
            return fallbackPlan(sourceId);
        }

        List<TableCandidate> primaries = List.copyOf(candidates.subList(0, Math.min(2, candidates.size())));
        List<TableCandidate> joins = candidates.size() > 2 ? List.copyOf(candidates.subList(2, candidates.size())) : List.of();
        List<TableCandidate> all = new ArrayList<>(primaries);
        all.addAll(joins);

        List<String> joinConditions = planJoinConditions(all);
        List<String> whereConditions = whereConditions(context, all);
        List<String> selectColumns = selectColumns(context, primaries);
        List<String> groupBy = groupBy(context, selectColumns);
        List<String> orderBy = orderBy(selectColumns);
        Complexity complexity = complexity(all.size(), joinConditions.size());

        Set<String> sourceIds = new LinkedHashSet<>();
        all.forEach(c -> sourceIds.add(c.getSourceId()));

        QueryPlan plan = QueryPlan.builder()
                .sourceId(sourceId)
                .primaryTables(primaries)
                .joinTables(joins)
                .joinConditions(joinConditions)
                .whereConditions(whereConditions)
                .filters(filters(context, all))
                .selectColumns(selectColumns)
                .groupByColumns(groupBy)
                .orderByColumns(orderBy)
                .complexity(complexity)
                .crossDatabase(sourceIds.size() > 1)
                .executionOrder(List.copyOf(sourceIds))
                .build();
        log.info("Created plan: source_id={}, tables={}, joins={}, complexity={}, cross_db={}",
                sourceId, all.size(), joinConditions.size(), complexity, plan.isCrossDatabase());
        return plan;
    }

    /**
     * Minimal plan used when nothing matched: a count over the placeholder table.
     */
    public QueryPlan fallbackPlan(String sourceId) {
        return QueryPlan.builder()
                .sourceId(sourceId)
                .selectColumns(List.of(FALLBACK_SELECT))
                .complexity(Complexity.LOW)
                .crossDatabase(false)
                .executionOrder(List.of("fallback_" + LocalDateTime.now(clock).format(FALLBACK_STAMP)))
                .fallback(true)
                .placeholderTable(placeholderTable)
                .build();
    }

    private List<String> planJoinConditions(List<TableCandidate> tables) {
        List<String> conditions = new ArrayList<>();
        for (int i = 0; i < tables.size(); i++) {
            for (int j = i + 1; j < tables.size(); j++) {
                TableDescriptor a = tables.get(i).getTable();
                TableDescriptor b = tables.get(j).getTable();
                Optional<String> condition = declaredRelation(a, b).or(() -> inferJoin(a, b));
                condition.ifPresent(conditions::add);
            }
        }
        return conditions;
    }

    private Optional<String> declaredRelation(TableDescriptor a, TableDescriptor b) {
        if (!a.getSourceId().equals(b.getSourceId())) {
            return Optional.empty();
        }
        return catalog.findRelation(a.getSourceId(), a.getName(), b.getName()).map(TableRelation::toJoinCondition);
    }

    /**
     * {@code a.<b>_id = b.id}, in either direction. A trailing plural {@code s} on the referenced table is tolerated.
     */
    static Optional<String> inferJoin(TableDescriptor a, TableDescriptor b) {
        Optional<String> fk = foreignKey(a, b);
        if (fk.isPresent()) {
            return Optional.of(a.getName() + "." + fk.get() + " = " + b.getName() + ".id");
        }
        return foreignKey(b, a).map(col -> b.getName() + "." + col + " = " + a.getName() + ".id");
    }

    private static Optional<String> foreignKey(TableDescriptor child, TableDescriptor parent) {
        if (!parent.hasColumn("id")) {
            return Optional.empty();
        }
        String parentName = parent.getName().toLowerCase(Locale.ROOT);
        List<String> expected = new ArrayList<>();
        expected.add(parentName + "_id");
        if (parentName.endsWith("s") && parentName.length() > 1) {
            expected.add(parentName.substring(0, parentName.length() - 1) + "_id");
        }
        return child.columnNames().stream()
                .filter(c -> expected.contains(c.toLowerCase(Locale.ROOT)))
                .findFirst();
    }

    private List<String> whereConditions(QueryContext context, List<TableCandidate> tables) {
        List<String> conditions = new ArrayList<>();
        if (context.hasTimeRange()) {
            String column = timeColumn(tables);
            TimeRange range = context.getTimeRange();
            String start = range.getStartExpression();
            String end = range.getEndExpression();
            Optional<TimeRangeResolver.Bounds> bounds = timeRangeResolver.resolve(range);
            if (bounds.isPresent()) {
                start = bounds.get().startLiteral();
                end = bounds.get().endLiteral();
            }
            conditions.add(column + " >= " + start + " AND " + column + " < " + end);
        }
        for (Map.Entry<String, String> filter : context.getFilters().entrySet()) {
            conditions.add(filterColumn(filter.getKey(), tables) + " = " + SqlFragments.quote(filter.getValue()));
        }
        return conditions;
    }

    /**
     * Column filters matching the where conditions. A time window without fixed bounds has no filter form
     * and is left out.
     */
    private List<FilterConfig> filters(QueryContext context, List<TableCandidate> tables) {
        List<FilterConfig> filters = new ArrayList<>();
        if (context.hasTimeRange()) {
            Optional<TimeRangeResolver.Bounds> bounds = timeRangeResolver.resolve(context.getTimeRange());
            if (bounds.isPresent()) {
                String column = timeColumn(tables);
                filters.add(new FilterConfig(column, ">=", bounds.get().startValue()));
                filters.add(new FilterConfig(column, "<", bounds.get().endValue()));
            } else {
                log.warn("Time window has no fixed bounds, not filtering operation sequences: label={}",
                        context.getTimeRange().getLabel());
            }
        }
        for (Map.Entry<String, String> filter : context.getFilters().entrySet()) {
            filters.add(new FilterConfig(filterColumn(filter.getKey(), tables), "=", filter.getValue()));
        }
        return List.copyOf(filters);
    }

    private String timeColumn(List<TableCandidate> tables) {
        for (TableCandidate candidate : tables) {
            Optional<String> timeColumn = firstTimeColumn(candidate.getTable());
            if (timeColumn.isPresent()) {
                return candidate.getTableName() + "." + timeColumn.get();
            }
        }
        return "created_at";
    }

    private static String filterColumn(String key, List<TableCandidate> tables) {
        for (TableCandidate candidate : tables) {
            Optional<String> owned = candidate.getTable().columnNames().stream()
                    .filter(c -> c.equalsIgnoreCase(key))
                    .findFirst();
            if (owned.isPresent()) {
                return candidate.getTableName() + "." + owned.get();
            }
        }
        return key;
    }

    private Optional<String> firstTimeColumn(TableDescriptor table) {
        for (ColumnDescriptor column : table.getColumns()) {
            String name = column.getName().toLowerCase(Locale.ROOT);
            if (vocabulary.getTimeColumnKeywords().stream().anyMatch(name::contains)) {
                return Optional.of(column.getName());
            }
        }
        return Optional.empty();
    }

    private List<String> selectColumns(QueryContext context, List<TableCandidate> primaries) {
        List<String> columns = new ArrayList<>();
        if (context.getIntent().isAggregating()) {
            columns.add("COUNT(*) as total_count");
            String fn = context.getAggregationFunction();
            if (fn != null && !"COUNT".equalsIgnoreCase(fn)) {
                Set<String> aliases = new LinkedHashSet<>();
                for (TableCandidate candidate : primaries) {
                    for (String col : candidate.getMatchingColumns()) {
                        String lower = col.toLowerCase(Locale.ROOT);
                        if (vocabulary.getPlannerMeasureKeywords().stream().anyMatch(lower::contains)) {
                            String alias = col + "_" + fn.toLowerCase(Locale.ROOT);
                            if (aliases.add(alias)) {
                                columns.add(fn.toUpperCase(Locale.ROOT) + "(" + candidate.getTableName() + "." + col + ") as " + alias);
                            }
                        }
                    }
                }
            }
        } else {
            for (TableCandidate candidate : primaries) {
                candidate.getMatchingColumns().stream()
                        .limit(MAX_DETAIL_COLUMNS)
                        .forEach(col -> columns.add(candidate.getTableName() + "." + col));
            }
        }
        return columns.isEmpty() ? List.of("*") : List.copyOf(columns);
    }

    private static List<String> groupBy(QueryContext context, List<String> selectColumns) {
        if (!context.getIntent().isAggregating()) {
            return List.of();
        }
        List<String> group = new ArrayList<>();
        for (String col : selectColumns) {
            if (!SqlFragments.isAggregate(col) && !"*".equals(col)) {
                group.add(col);
            }
        }
        return List.copyOf(group);
    }

    private static List<String> orderBy(List<String> selectColumns) {
        for (String col : selectColumns) {
            String lower = col.toLowerCase(Locale.ROOT);
            if (!SqlFragments.isAggregate(col) && ORDER_TIME_KEYWORDS.stream().anyMatch(lower::contains)) {
                return List.of(col + " DESC");
            }
        }
        for (String col : selectColumns) {
            if (SqlFragments.isAggregate(col)) {
                return List.of(SqlFragments.alias(col) + " DESC");
            }
        }
        return List.of();
    }

    static Complexity complexity(int tableCount, int joinCount) {
        if (tableCount <= 2 && joinCount <= 1) {
            return Complexity.LOW;
        }
        if (tableCount <= 4 && joinCount <= 3) {
            return Complexity.MEDIUM;
        }
        return Complexity.HIGH;
    }
}
