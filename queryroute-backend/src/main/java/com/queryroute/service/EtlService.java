package com.queryroute.service;

import com.queryroute.catalog.MetadataCatalog;
import com.queryroute.catalog.SchemaIntrospector;
import com.queryroute.catalog.SourceRegistry;
import com.queryroute.connector.SourceSession;
import com.queryroute.connector.SourceConnectorProvider;
import com.queryroute.etl.EtlExecutor;
import com.queryroute.etl.EtlInstructionPlanner;
import com.queryroute.model.ColumnDescriptor;
import com.queryroute.model.EtlInstructions;
import com.queryroute.model.EtlOptions;
import com.queryroute.model.EtlTaskContext;
import com.queryroute.model.PlaceholderRequirement;
import com.queryroute.model.ProcessedData;
import com.queryroute.model.SourceDefinition;
import com.queryroute.model.TableDescriptor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

@Slf4j
@Service
public class EtlService {
    private final SourceRegistry registry;
    private final MetadataCatalog catalog;
    private final SourceConnectorProvider connectorProvider;
    private final SchemaIntrospector introspector;
    private final EtlInstructionPlanner planner;
    private final EtlExecutor executor;

    public EtlService(
            SourceRegistry registry,
            MetadataCatalog catalog,
            SourceConnectorProvider connectorProvider,
            SchemaIntrospector introspector,
            EtlInstructionPlanner planner,
            EtlExecutor executor
    ) {
        this.registry = registry;
        this.catalog = catalog;
        this.connectorProvider = connectorProvider;
        this.introspector = introspector;
        this.planner = planner;
        this.executor = executor;
    }

    public ProcessedData executeEtl(EtlInstructions instructions, String sourceId, EtlTaskContext context, EtlOptions options) {
        if (instructions == null) {
            throw new IllegalArgumentException("Instructions are required");
        }
        return executor.execute(instructions, sourceId, context, options);
    }

    public List<EtlInstructions> plan(List<PlaceholderRequirement> requirements, List<String> availableFields, EtlTaskContext context) {
        return planner.plan(requirements, availableFields, context);
    }

    /**
     * Plans against the fields of a source table: the context's table, else the source's default table.
     * Explicit fields win when given.
     */
    public List<EtlInstructions> plan(List<PlaceholderRequirement> requirements, String sourceId,
                                      List<String> availableFields, EtlTaskContext context) {
        if (availableFields != null && !availableFields.isEmpty()) {
            return plan(requirements, availableFields, context);
        }
        if (sourceId == null || sourceId.isBlank()) {
            throw new IllegalArgumentException("Either available fields or a source id is required");
        }
        SourceDefinition source = registry.require(sourceId);
        String table = context != null && context.getTableName() != null && !context.getTableName().isBlank()
                ? context.getTableName() : source.getDefaultTable();
        if (table == null || table.isBlank()) {
            throw new IllegalArgumentException("Source " + sourceId + " has no default table; name one in the context");
        }
        return plan(requirements, fieldsOf(sourceId, table), context);
    }

    private List<String> fieldsOf(String sourceId, String table) {
        Optional<TableDescriptor> known = catalog.table(sourceId, table);
        if (known.isPresent() && !known.get().getColumns().isEmpty()) {
            return known.get().columnNames();
        }
        try (SourceSession session = connectorProvider.connectorFor(sourceId).connect()) {
            List<String> fields = introspector.describeOrEmpty(session, table).stream().map(ColumnDescriptor::getName).toList();
            log.debug("Described table for planning: source_id={}, table={}, fields={}", sourceId, table, fields.size());
            return fields;
        }
    }
}
