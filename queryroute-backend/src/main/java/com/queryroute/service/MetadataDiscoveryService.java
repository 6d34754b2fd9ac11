package com.queryroute.service;

import com.queryroute.catalog.MetadataCatalog;
import com.queryroute.catalog.SchemaIntrospectionException;
import com.queryroute.catalog.SchemaIntrospector;
import com.queryroute.catalog.SourceRegistry;
import com.queryroute.connector.ConnectorResult;
import com.queryroute.connector.OperationStep;
import com.queryroute.connector.SourceAccessException;
import com.queryroute.connector.SourceConnector;
import com.queryroute.connector.SourceConnectorProvider;
import com.queryroute.connector.SourceQuery;
import com.queryroute.connector.SourceSession;
import com.queryroute.model.AggregateFunction;
import com.queryroute.model.AggregationConfig;
import com.queryroute.model.ColumnDescriptor;
import com.queryroute.model.DiscoveryResult;
import com.queryroute.model.SourceDefinition;
import com.queryroute.model.TableDescriptor;
import com.queryroute.model.TableRelation;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Refreshes the catalog of one source from its live schema.
 */
@Slf4j
@Service
public class MetadataDiscoveryService {
    private final SourceRegistry registry;
    private final SourceConnectorProvider connectorProvider;
    private final SchemaIntrospector introspector;
    private final MetadataCatalog catalog;
    private final Clock clock;
    private final long countTimeoutMs;

    public MetadataDiscoveryService(
            SourceRegistry registry,
            SourceConnectorProvider connectorProvider,
            SchemaIntrospector introspector,
            MetadataCatalog catalog,
            Clock clock,
            @Value("${queryroute.discovery.count-timeout-ms:10000}") long countTimeoutMs
    ) {
        this.registry = registry;
        this.connectorProvider = connectorProvider;
        this.introspector = introspector;
        this.catalog = catalog;
        this.clock = clock;
        this.countTimeoutMs = countTimeoutMs;
    }

    /**
     * Lists and describes every table, counts rows, and infers {@code <x>_id -> x.id} relations. Declared
     * tags, display names and relations survive the refresh.
     */
    public DiscoveryResult discover(String sourceId) {
        long start = System.currentTimeMillis();
        SourceDefinition source = registry.require(sourceId);
        DiscoveryResult result = new DiscoveryResult();
        result.setSourceId(sourceId);

        SourceConnector connector = connectorProvider.connectorFor(sourceId);
        List<TableDescriptor> tables = new ArrayList<>();
        try (SourceSession session = connector.connect()) {
            Instant now = clock.instant();
            for (String name : introspector.listTables(session)) {
                List<ColumnDescriptor> columns = introspector.describeOrEmpty(session, name);
                if (columns.isEmpty()) {
                    result.getErrors().add("table " + name + ": no columns described");
                }
                Optional<TableDescriptor> declared = catalog.table(sourceId, name);
                TableDescriptor.TableDescriptorBuilder builder = declared
                        .map(TableDescriptor::toBuilder)
                        .orElseGet(() -> TableDescriptor.builder().sourceId(sourceId).sourceName(source.displayName())
                                .schema(source.getSchema()).name(name));
                tables.add(builder
                        .columns(columns.isEmpty() && declared.isPresent() ? declared.get().getColumns() : columns)
                        .rowCount(countRows(session, connector.supportsSql(), name, result.getErrors()))
                        .lastAnalyzed(now)
                        .build());
            }
        } catch (SchemaIntrospectionException | SourceAccessException e) {
            log.warn("Discovery failed: source_id={}", sourceId, e);
            result.setSuccess(false);
            result.getErrors().add(e.getMessage());
            result.setDiscoveryTimeMs(System.currentTimeMillis() - start);
            return result;
        }

        List<TableRelation> relations = new ArrayList<>(catalog.relations(sourceId));
        for (TableRelation inferred : inferRelations(tables)) {
            boolean known = relations.stream().anyMatch(r -> r.connects(inferred.getParentTable(), inferred.getChildTable()));
            if (!known) {
                relations.add(inferred);
            }
        }
        catalog.replace(sourceId, tables, relations);

        result.setSuccess(true);
        result.setTablesFound(tables.size());
        result.setColumnsFound(tables.stream().mapToInt(t -> t.getColumns().size()).sum());
        result.setRelationsFound(relations.size());
        result.setDiscoveryTimeMs(System.currentTimeMillis() - start);
        log.info("Discovery finished: source_id={}, tables={}, columns={}, relations={}, duration_ms={}",
                sourceId, result.getTablesFound(), result.getColumnsFound(), result.getRelationsFound(), result.getDiscoveryTimeMs());
        return result;
    }

    private long countRows(SourceSession session, boolean sql, String table, List<String> errors) {
        SourceQuery query = sql
                ? SourceQuery.sql("SELECT COUNT(*) FROM " + table)
                : SourceQuery.operations(List.of(OperationStep.load(table), OperationStep.aggregate(
                        List.of(AggregationConfig.builder().function(AggregateFunction.COUNT).field("*").build()), List.of(), null)));
        ConnectorResult result = session.execute(query, 1, Duration.ofMillis(countTimeoutMs));
        if (!result.isSuccess() || result.getRows().isEmpty()) {
            errors.add("table " + table + ": row count failed: " + result.getError());
            return 0L;
        }
        Object value = result.getRows().get(0).values().iterator().next();
        return value instanceof Number n ? n.longValue() : 0L;
    }

    /**
     * A column {@code <x>_id} references a table named {@code x}, or whose name contains {@code x} or is
     * contained in it, provided that table has an {@code id} column.
     */
    static List<TableRelation> inferRelations(List<TableDescriptor> tables) {
        List<TableRelation> relations = new ArrayList<>();
        for (TableDescriptor child : tables) {
            for (String column : child.columnNames()) {
                String lower = column.toLowerCase(Locale.ROOT);
                if (!lower.endsWith("_id") || lower.length() <= 3) {
                    continue;
                }
                String stem = lower.substring(0, lower.length() - 3);
                findParent(tables, child, stem).ifPresent(parent -> relations.add(TableRelation.builder()
                        .parentTable(parent.getName())
                        .parentColumn(parent.columnNames().stream().filter("id"::equalsIgnoreCase).findFirst().orElse("id"))
                        .childTable(child.getName())
                        .childColumn(column)
                        .build()));
            }
        }
        return relations;
    }

    private static Optional<TableDescriptor> findParent(List<TableDescriptor> tables, TableDescriptor child, String stem) {
        TableDescriptor contains = null;
        for (TableDescriptor candidate : tables) {
            if (candidate == child || !candidate.hasColumn("id")) {
                continue;
            }
            String name = candidate.getName().toLowerCase(Locale.ROOT);
            if (name.equals(stem)) {
                return Optional.of(candidate);
            }
            if (contains == null && (name.contains(stem) || stem.contains(name))) {
                contains = candidate;
            }
        }
        return Optional.ofNullable(contains);
    }
}
