package com.queryroute.etl;

import com.queryroute.catalog.SchemaIntrospector;
import com.queryroute.catalog.SourceRegistry;
import com.queryroute.connector.ConnectorResult;
import com.queryroute.connector.HavingCondition;
import com.queryroute.connector.SourceConnector;
import com.queryroute.connector.SourceConnectorProvider;
import com.queryroute.connector.SourceQuery;
import com.queryroute.connector.SourceSession;
import com.queryroute.etl.EtlQueryRenderer.ResolvedFilters;
import com.queryroute.etl.RelativePeriodResolver.DateRange;
import com.queryroute.model.AggregateFunction;
import com.queryroute.model.AggregationConfig;
import com.queryroute.model.ColumnDescriptor;
import com.queryroute.model.EtlInstructions;
import com.queryroute.model.EtlOptions;
import com.queryroute.model.EtlQueryType;
import com.queryroute.model.EtlTaskContext;
import com.queryroute.model.FilterConfig;
import com.queryroute.model.ProcessedData;
import com.queryroute.model.RegionFilterConfig;
import com.queryroute.model.SourceDefinition;
import com.queryroute.model.TabularData;
import com.queryroute.model.TimeFilterConfig;
import com.queryroute.model.TransformationConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Executes one set of ETL instructions against one registered source.
 *
 * <p>Malformed instructions are rejected with {@link InvalidInstructionException} before any query runs.
 * Once a query is issued, failures are reported in the returned {@link ProcessedData}.
 */
@Slf4j
@Component
public class EtlExecutor {
    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][\\w]*(\\.[A-Za-z_][\\w]*)?");

    private final SourceRegistry registry;
    private final SourceConnectorProvider connectorProvider;
    private final SchemaIntrospector introspector;
    private final RelativePeriodResolver periodResolver;
    private final long defaultTimeoutMs;
    private final int maxRows;

    public EtlExecutor(
            SourceRegistry registry,
            SourceConnectorProvider connectorProvider,
            SchemaIntrospector introspector,
            RelativePeriodResolver periodResolver,
            @Value("${queryroute.etl.default-timeout-ms:60000}") long defaultTimeoutMs,
            @Value("${queryroute.etl.max-rows:100000}") int maxRows
    ) {
        this.registry = registry;
        this.connectorProvider = connectorProvider;
        this.introspector = introspector;
        this.periodResolver = periodResolver;
        this.defaultTimeoutMs = defaultTimeoutMs;
        this.maxRows = maxRows;
    }

    public ProcessedData execute(EtlInstructions instructions, String sourceId, EtlTaskContext context, EtlOptions options) {
        long start = System.currentTimeMillis();
        EtlTaskContext ctx = context != null ? context : new EtlTaskContext();
        EtlOptions opts = options != null ? options : EtlOptions.defaults();

        SourceDefinition source = registry.require(sourceId);
        String table = resolveTable(instructions, ctx, source);
        checkStructure(instructions, table);
        ResolvedFilters filters = resolveFilters(instructions, ctx);

        SourceConnector connector = connectorProvider.connectorFor(sourceId);
        String queryText = null;
        try (SourceSession session = connector.connect()) {
            if (!opts.isNamesOnly()) {
                checkFields(instructions, filters, table, introspector.describeOrEmpty(session, table));
            }
            SourceQuery query = EtlQueryRenderer.render(instructions, table, filters, connector.supportsSql());
            queryText = query.describe();
            log.info("Executing ETL: instruction_id={}, source_id={}, table={}, query={}",
                    instructions.getInstructionId(), sourceId, table, queryText);

            long timeoutMs = opts.getTimeoutMs() != null && opts.getTimeoutMs() > 0 ? opts.getTimeoutMs() : defaultTimeoutMs;
            ConnectorResult result = session.execute(query, maxRows, Duration.ofMillis(timeoutMs));
            if (!result.isSuccess()) {
                return failure(instructions, sourceId, queryText, result.getError(), start);
            }

            TabularData raw = result.toTabularData();
            TabularData transformed = TransformationApplier.apply(raw, instructions.getTransformations());
            Object processed = OutputShaper.shape(transformed, instructions);
            double confidence = ConfidenceCalculator.calculate(instructions, transformed, processed);

            Map<String, Object> metadata = new LinkedHashMap<>();
            metadata.put("instruction_id", instructions.getInstructionId());
            metadata.put("source_id", sourceId);
            metadata.put("table", table);
            metadata.put("query_type", instructions.getQueryType().wireName());
            metadata.put("output_format", instructions.getOutputFormat().wireName());
            metadata.put("columns", transformed.getColumns());
            metadata.put("null_ratio", ConfidenceCalculator.nullRatio(transformed));
            if (result.isTruncated()) {
                metadata.put("truncated", true);
            }

            ProcessedData data = ProcessedData.builder()
                    .success(true)
                    .rawData(raw)
                    .processedValue(processed)
                    .metadata(metadata)
                    .processingTimeMs(System.currentTimeMillis() - start)
                    .confidence(confidence)
                    .queryExecuted(queryText)
                    .rowsProcessed(raw.rowCount())
                    .build();
            log.info("ETL finished: instruction_id={}, rows={}, confidence={}, duration_ms={}",
                    instructions.getInstructionId(), raw.rowCount(), confidence, data.getProcessingTimeMs());
            return data;
        } catch (InvalidInstructionException e) {
            throw e;
        } catch (RuntimeException e) {
            log.warn("ETL failed: instruction_id={}, source_id={}", instructions.getInstructionId(), sourceId, e);
            return failure(instructions, sourceId, queryText, e.getMessage(), start);
        }
    }

    private static String resolveTable(EtlInstructions instructions, EtlTaskContext ctx, SourceDefinition source) {
        String table;
        if (notBlank(instructions.getTableName())) {
            table = instructions.getTableName();
        } else if (notBlank(ctx.getTableName())) {
            table = ctx.getTableName();
        } else if (notBlank(source.getDefaultTable())) {
            table = source.getDefaultTable();
        } else {
            throw new InvalidInstructionException("No table given and source " + source.getId() + " has no default table");
        }
        return table.trim();
    }

    /**
     * Checks everything that does not need the table's columns: identifiers, operators, aggregation presence
     * and transformations.
     */
    private static void checkStructure(EtlInstructions instructions, String table) {
        List<String> problems = new ArrayList<>();
        if (instructions.getQueryType() == null) {
            problems.add("query_type is required");
        }
        if (instructions.getOutputFormat() == null) {
            problems.add("output_format is required");
        }
        checkIdentifier(table, "table_name", problems);
        for (String field : instructions.getSourceFields()) {
            checkIdentifier(field, "source_fields", problems);
        }
        for (FilterConfig filter : instructions.getFilters()) {
            checkIdentifier(filter.getColumn(), "filters.column", problems);
            try {
                EtlQueryRenderer.normalizeOperator(filter.getOperator());
            } catch (InvalidInstructionException e) {
                problems.add(e.getMessage());
            }
        }
        if (instructions.getQueryType() == EtlQueryType.AGGREGATE && instructions.getAggregations().isEmpty()) {
            problems.add("aggregate query needs at least one aggregation");
        }
        for (AggregationConfig agg : instructions.getAggregations()) {
            if (agg.getFunction() == null) {
                problems.add("aggregations.function is required");
            }
            boolean countAll = agg.getFunction() == AggregateFunction.COUNT && "*".equals(agg.getField());
            if (!countAll) {
                checkIdentifier(agg.getField(), "aggregations.field", problems);
            }
            if (agg.hasGroupBy()) {
                agg.getGroupBy().forEach(g -> checkIdentifier(g, "aggregations.group_by", problems));
            }
            checkHaving(agg.getHavingCondition(), problems);
        }
        TimeFilterConfig time = instructions.getTimeConfig();
        if (time != null && time.getField() != null) {
            checkIdentifier(time.getField(), "time_config.field", problems);
        }
        RegionFilterConfig region = instructions.getRegionConfig();
        if (region != null && region.getField() != null) {
            checkIdentifier(region.getField(), "region_config.field", problems);
        }
        problems.addAll(TransformationApplier.validate(instructions.getTransformations()));
        if (!problems.isEmpty()) {
            throw new InvalidInstructionException("Invalid ETL instructions", problems);
        }
    }

    private static void checkHaving(String condition, List<String> problems) {
        if (condition == null || condition.isBlank()) {
            return;
        }
        Optional<HavingCondition> having = HavingCondition.parse(condition);
        if (having.isEmpty()) {
            problems.add("aggregations.having_condition: unsupported condition '" + condition + "'");
            return;
        }
        if (having.get().isCall()) {
            try {
                AggregateFunction.parse(having.get().function());
            } catch (IllegalArgumentException e) {
                problems.add("aggregations.having_condition: unknown function '" + having.get().function() + "'");
            }
        }
    }

    private static void checkIdentifier(String name, String where, List<String> problems) {
        if (name == null || !IDENTIFIER.matcher(name.trim()).matches()) {
            problems.add(where + ": invalid name '" + name + "'");
        }
    }

    private ResolvedFilters resolveFilters(EtlInstructions instructions, EtlTaskContext ctx) {
        String timeField = null;
        DateRange range = null;
        TimeFilterConfig time = instructions.getTimeConfig();
        if (time != null && notBlank(time.getField())) {
            timeField = time.getField();
            try {
                if (ctx.hasTimeRange()) {
                    range = DateRange.parse(ctx.getStartDate(), ctx.getEndDate());
                } else if (notBlank(time.getRelativePeriod())) {
                    range = periodResolver.resolve(time.getRelativePeriod());
                } else {
                    range = DateRange.parse(time.getStartDate(), time.getEndDate());
                }
            } catch (IllegalArgumentException e) {
                throw new InvalidInstructionException("Invalid time range: " + e.getMessage());
            }
        }

        RegionFilterConfig region = instructions.getRegionConfig();
        if (region == null || !notBlank(region.getField())) {
            return new ResolvedFilters(timeField, range, null, null, null);
        }
        String value = ctx.hasRegion() ? ctx.getRegion() : region.getRegionValue();
        return new ResolvedFilters(timeField, range, region.getField(), value, region.getRegionType());
    }

    /**
     * Rejects instructions naming columns the table does not have. An empty description means the table
     * could not be described and nothing is checked.
     */
    private static void checkFields(EtlInstructions instructions, ResolvedFilters filters, String table,
                                    List<ColumnDescriptor> columns) {
        if (columns.isEmpty()) {
            log.warn("No columns described, skipping field check: table={}", table);
            return;
        }
        Set<String> known = new LinkedHashSet<>();
        columns.forEach(c -> known.add(c.getName().toLowerCase(Locale.ROOT)));

        Set<String> referenced = new LinkedHashSet<>(instructions.getSourceFields());
        instructions.getFilters().forEach(f -> referenced.add(f.getColumn()));
        for (AggregationConfig agg : instructions.getAggregations()) {
            if (!"*".equals(agg.getField())) {
                referenced.add(agg.getField());
            }
            if (agg.hasGroupBy()) {
                referenced.addAll(agg.getGroupBy());
            }
        }
        if (filters.timeField() != null) {
            referenced.add(filters.timeField());
        }
        if (filters.regionField() != null) {
            referenced.add(filters.regionField());
        }
        for (TransformationConfig t : instructions.getTransformations()) {
            if (t.getField() != null && !isOutputColumn(instructions, t.getField())) {
                referenced.add(t.getField());
            }
        }

        List<String> problems = new ArrayList<>();
        for (String field : referenced) {
            if (!known.contains(field.trim().toLowerCase(Locale.ROOT))) {
                problems.add("field '" + field + "' not found in table " + table);
            }
        }
        if (!problems.isEmpty()) {
            throw new InvalidInstructionException("Instructions reference unknown fields", problems);
        }
    }

    // aggregate aliases and calculated fields exist only in the output
    private static boolean isOutputColumn(EtlInstructions instructions, String field) {
        for (AggregationConfig agg : instructions.getAggregations()) {
            if (agg.alias().equalsIgnoreCase(field)) {
                return true;
            }
        }
        for (TransformationConfig t : instructions.getTransformations()) {
            if (field.equalsIgnoreCase(t.getTargetField())) {
                return true;
            }
        }
        return false;
    }

    private static ProcessedData failure(EtlInstructions instructions, String sourceId, String queryText, String error, long start) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("instruction_id", instructions.getInstructionId());
        metadata.put("source_id", sourceId);
        metadata.put("error", error);
        return ProcessedData.builder()
                .success(false)
                .metadata(metadata)
                .processingTimeMs(System.currentTimeMillis() - start)
                .confidence(0.0)
                .queryExecuted(queryText)
                .rowsProcessed(0)
                .error(error)
                .build();
    }

    private static boolean notBlank(String s) {
        return s != null && !s.isBlank();
    }
}
