package com.queryroute.routing;

import com.queryroute.analyzer.KeywordVocabulary;
import com.queryroute.catalog.MetadataCatalog;
import com.queryroute.catalog.SchemaIntrospectionException;
import com.queryroute.catalog.SchemaIntrospector;
import com.queryroute.catalog.SourceRegistry;
import com.queryroute.connector.SourceAccessException;
import com.queryroute.connector.SourceConnector;
import com.queryroute.connector.SourceConnectorProvider;
import com.queryroute.connector.SourceSession;
import com.queryroute.model.ColumnDescriptor;
import com.queryroute.model.QueryContext;
import com.queryroute.model.SourceDefinition;
import com.queryroute.model.TableCandidate;
import com.queryroute.model.TableDescriptor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Scores catalog tables against a {@link QueryContext}.
 *
 * <p>When the catalog knows no tables for a source, tables are listed live and scored on their names only.
 */
@Slf4j
@Component
public class TableMatcher {
    /** Score descending, then table name. */
    public static final Comparator<TableCandidate> RANKING = Comparator
            .comparingDouble(TableCandidate::getRelevanceScore).reversed()
            .thenComparing(TableCandidate::getTableName, String.CASE_INSENSITIVE_ORDER);
    static final double MIN_SCORE = 0.3;
    static final double MIN_DISCOVERED_SCORE = 0.1;
    static final int DISCOVERY_LIMIT = 5;
    private static final long LARGE_TABLE_ROWS = 10_000;
    private static final int RECENT_ANALYSIS_DAYS = 30;

    private final MetadataCatalog catalog;
    private final SourceRegistry registry;
    private final SourceConnectorProvider connectorProvider;
    private final SchemaIntrospector introspector;
    private final KeywordVocabulary vocabulary;
    private final Clock clock;
    private final int defaultMaxTables;

    public TableMatcher(
            MetadataCatalog catalog,
            SourceRegistry registry,
            SourceConnectorProvider connectorProvider,
            SchemaIntrospector introspector,
            KeywordVocabulary vocabulary,
            Clock clock,
            @Value("${queryroute.matcher.max-tables:5}") int defaultMaxTables
    ) {
        this.catalog = catalog;
        this.registry = registry;
        this.connectorProvider = connectorProvider;
        this.introspector = introspector;
        this.vocabulary = vocabulary;
        this.clock = clock;
        this.defaultMaxTables = defaultMaxTables;
    }

    public List<TableCandidate> findRelevantTables(QueryContext context, String sourceId) {
        return findRelevantTables(context, sourceId, List.of(), defaultMaxTables, false);
    }

    /**
     * Rank the tables of one source.
     *
     * @param context analyzed request
     * @param sourceId registered source
     * @param explicitTables when non-empty, only these tables are considered and they are kept whatever their score
     * @param maxResults cap on returned candidates, {@code <= 0} for the configured default
     * @param namesOnly skip describing tables found by live listing
     * @return candidates, best first; never null
     */
    public List<TableCandidate> findRelevantTables(
            QueryContext context,
            String sourceId,
            List<String> explicitTables,
            int maxResults,
            boolean namesOnly
    ) {
        int limit = maxResults > 0 ? maxResults : defaultMaxTables;
        List<String> explicit = explicitTables != null ? explicitTables : List.of();

        List<TableDescriptor> tables = catalog.tables(sourceId);
        if (tables.isEmpty()) {
            log.warn("No catalog tables, trying live discovery: source_id={}", sourceId);
            return truncate(discoverTables(context, sourceId, explicit, namesOnly), limit);
        }

        List<TableCandidate> candidates = new ArrayList<>();
        for (TableDescriptor table : tables) {
            boolean isExplicit = containsIgnoreCase(explicit, table.getName());
            if (!explicit.isEmpty() && !isExplicit) {
                continue;
            }
            double score = relevanceScore(table, context);
            if (score > MIN_SCORE || isExplicit) {
                candidates.add(TableCandidate.builder()
                        .table(table)
                        .relevanceScore(score)
                        .matchingColumns(matchingColumns(table, context))
                        .businessContext(businessContext(table))
                        .build());
            }
        }
        candidates.sort(RANKING);
        log.info("Matched tables: source_id={}, candidates={}, kept={}", sourceId, candidates.size(), Math.min(limit, candidates.size()));
        return truncate(candidates, limit);
    }

    double relevanceScore(TableDescriptor table, QueryContext context) {
        double score = 0.0;
        String name = lower(table.getName());
        String displayName = lower(table.getDisplayName());
        List<String> columnNames = table.columnNames().stream().map(TableMatcher::lower).toList();

        for (String entity : context.getEntities()) {
            List<String> keywords = vocabulary.keywordsFor(entity);
            if (keywords.stream().map(TableMatcher::lower).anyMatch(k -> name.contains(k) || displayName.contains(k))) {
                score += 0.4;
            }
            if (table.getBusinessTags().stream().anyMatch(entity::equalsIgnoreCase)) {
                score += 0.3;
            }
            if (keywords.stream().map(TableMatcher::lower).anyMatch(k -> columnNames.stream().anyMatch(c -> c.contains(k)))) {
                score += 0.2;
            }
        }
        if (table.getRowCount() > LARGE_TABLE_ROWS) {
            score += 0.1;
        }
        if (table.getLastAnalyzed() != null
                && Duration.between(table.getLastAnalyzed(), clock.instant()).toDays() < RECENT_ANALYSIS_DAYS) {
            score += 0.1;
        }
        return Math.min(score, 1.0);
    }

    List<String> matchingColumns(TableDescriptor table, QueryContext context) {
        Set<String> matched = new LinkedHashSet<>();
        for (ColumnDescriptor column : table.getColumns()) {
            String name = lower(column.getName());
            String displayName = lower(column.getDisplayName());
            for (String entity : context.getEntities()) {
                if (vocabulary.keywordsFor(entity).stream().map(TableMatcher::lower)
                        .anyMatch(k -> name.contains(k) || displayName.contains(k))) {
                    matched.add(column.getName());
                    break;
                }
            }
            if (context.hasTimeRange() && containsAny(name, vocabulary.getTimeColumnKeywords())) {
                matched.add(column.getName());
            }
            if (context.hasAggregationFunction() && containsAny(name, vocabulary.getMeasureColumnKeywords())) {
                matched.add(column.getName());
            }
        }
        return List.copyOf(matched);
    }

    String businessContext(TableDescriptor table) {
        List<String> parts = new ArrayList<>();
        if (!table.getBusinessTags().isEmpty()) {
            parts.add("tags: " + String.join(", ", table.getBusinessTags()));
        }
        if (table.getSensitivity() != null && !table.getSensitivity().isBlank()) {
            parts.add("sensitivity: " + table.getSensitivity());
        }
        if (table.getRowCount() > 1_000_000) {
            parts.add("large table");
        } else if (table.getRowCount() > LARGE_TABLE_ROWS) {
            parts.add("medium table");
        } else if (table.getRowCount() > 0) {
            parts.add("small table");
        }
        return parts.isEmpty() ? "general business table" : String.join("; ", parts);
    }

    private List<TableCandidate> discoverTables(QueryContext context, String sourceId, List<String> explicit, boolean namesOnly) {
        SourceDefinition source = registry.require(sourceId);
        List<TableCandidate> candidates = new ArrayList<>();
        try {
            SourceConnector connector = connectorProvider.connectorFor(sourceId);
            try (SourceSession session = connector.connect()) {
                List<String> names = introspector.listTables(session).stream()
                        .filter(n -> explicit.isEmpty() || containsIgnoreCase(explicit, n))
                        .limit(DISCOVERY_LIMIT)
                        .toList();
                log.info("Live discovery listed tables: source_id={}, tables={}", sourceId, names);
                for (String name : names) {
                    double score = discoveredScore(name, context);
                    if (score <= MIN_DISCOVERED_SCORE) {
                        continue;
                    }
                    List<ColumnDescriptor> columns = namesOnly ? List.of() : introspector.describeOrEmpty(session, name);
                    TableDescriptor table = TableDescriptor.builder()
                            .sourceId(sourceId)
                            .sourceName(source.displayName())
                            .schema(source.getSchema())
                            .name(name)
                            .displayName(name)
                            .sensitivity("public")
                            .columns(columns)
                            .build();
                    candidates.add(TableCandidate.builder()
                            .table(table)
                            .relevanceScore(score)
                            .matchingColumns(matchingColumns(table, context))
                            .businessContext("discovered by live listing")
                            .build());
                }
            }
        } catch (SchemaIntrospectionException | SourceAccessException e) {
            log.error("Live discovery failed: source_id={}, error={}", sourceId, e.getMessage());
            return List.of();
        }
        candidates.sort(RANKING);
        return candidates;
    }

    double discoveredScore(String tableName, QueryContext context) {
        double score = 0.5;
        String name = lower(tableName);
        for (String entity : context.getEntities()) {
            if (vocabulary.keywordsFor(entity).stream().map(TableMatcher::lower).anyMatch(name::contains)) {
                score += 0.3;
            }
        }
        if (containsAny(name, vocabulary.getBusinessKeywords())) {
            score += 0.2;
        }
        return Math.min(score, 1.0);
    }

    private static List<TableCandidate> truncate(List<TableCandidate> candidates, int limit) {
        return candidates.size() > limit ? List.copyOf(candidates.subList(0, limit)) : List.copyOf(candidates);
    }

    private static boolean containsAny(String text, List<String> fragments) {
        for (String f : fragments) {
            if (text.contains(f.toLowerCase(Locale.ROOT))) {
                return true;
            }
        }
        return false;
    }

    private static boolean containsIgnoreCase(List<String> names, String name) {
        return names.stream().anyMatch(n -> n.equalsIgnoreCase(name));
    }

    private static String lower(String s) {
        return s != null ? s.toLowerCase(Locale.ROOT) : "";
    }

    public int getDefaultMaxTables() {
        return defaultMaxTables;
    }
}
