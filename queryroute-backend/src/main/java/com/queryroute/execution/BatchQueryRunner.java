package com.queryroute.execution;

import com.queryroute.connector.ConnectorResult;
import com.queryroute.connector.OperationStep;
import com.queryroute.connector.SourceQuery;
import com.queryroute.connector.SourceSession;
import com.queryroute.model.ExecutionResult;
import com.queryroute.model.TabularData;
import com.queryroute.routing.SqlDialect;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.function.BooleanSupplier;

/**
 * Reads a large result in sequential pages, watching heap pressure between pages.
 */
@Slf4j
@Component
public class BatchQueryRunner {
    private final MemoryMonitor memoryMonitor;
    private final int pageSize;
    private final int maxPages;
    private final double memoryThreshold;
    private final double memoryCritical;

    public BatchQueryRunner(
            MemoryMonitor memoryMonitor,
            @Value("${queryroute.batch.page-size:1000}") int pageSize,
            @Value("${queryroute.batch.max-pages:10000}") int maxPages,
            @Value("${queryroute.batch.memory-threshold:0.8}") double memoryThreshold,
            @Value("${queryroute.batch.memory-critical:0.9}") double memoryCritical
    ) {
        if (pageSize <= 0) {
            throw new IllegalArgumentException("queryroute.batch.page-size must be positive");
        }
        this.memoryMonitor = memoryMonitor;
        this.pageSize = pageSize;
        this.maxPages = maxPages;
        this.memoryThreshold = memoryThreshold;
        this.memoryCritical = memoryCritical;
    }

    public ExecutionResult run(SourceSession session, SourceQuery query, String dbType, Duration timeout) {
        return run(session, query, dbType, timeout, () -> false);
    }

    /**
     * @param abort checked before each page; returning {@code true} ends the scan with the pages read so far
     */
    public ExecutionResult run(SourceSession session, SourceQuery query, String dbType, Duration timeout, BooleanSupplier abort) {
        long start = System.currentTimeMillis();
        long deadline = timeout != null ? start + timeout.toMillis() : Long.MAX_VALUE;
        SqlDialect dialect = SqlDialect.forDbType(dbType);

        TabularData data = TabularData.empty();
        List<String> warnings = new ArrayList<>();
        List<String> errors = new ArrayList<>();
        List<Long> offsets = new ArrayList<>();
        boolean memoryAbort = false;
        long offset = 0;
        int pages = 0;

        while (pages < maxPages) {
            if (abort.getAsBoolean()) {
                warnings.add("scan aborted after " + pages + " pages");
                break;
            }
            if (underPressure()) {
                memoryAbort = true;
                warnings.add("memory pressure: stopped after " + pages + " pages");
                log.warn("Memory pressure abort: pages={}, rows={}", pages, data.rowCount());
                break;
            }

            long remaining = deadline - System.currentTimeMillis();
            ConnectorResult page;
            if (remaining <= 0) {
                page = ConnectorResult.failed("deadline exceeded after " + pages + " pages");
            } else {
                page = session.execute(pageQuery(query, dialect, offset), pageSize,
                        deadline == Long.MAX_VALUE ? null : Duration.ofMillis(remaining));
            }

            if (!page.isSuccess()) {
                if (pages == 0) {
                    ExecutionResult failed = ExecutionResult.failure(query.describe(), page.getError());
                    failed.setExecutionTimeMs(System.currentTimeMillis() - start);
                    return failed;
                }
                errors.add("page at offset " + offset + ": " + page.getError());
                break;
            }
            if (pages == 0) {
                data = new TabularData(page.getColumns(), List.of());
            }
            if (page.getRows().isEmpty()) {
                break;
            }
            data.append(page.toTabularData());
            offsets.add(offset);
            pages++;
            offset += pageSize;
        }

        ExecutionResult result = ExecutionResult.success(data, query.describe());
        result.setErrors(errors);
        result.setExecutionTimeMs(System.currentTimeMillis() - start);
        result.getPerformanceStats().put("batched", true);
        result.getPerformanceStats().put("pages_fetched", pages);
        result.getPerformanceStats().put("page_size", pageSize);
        result.getPerformanceStats().put("page_offsets", offsets);
        if (memoryAbort) {
            result.getMetadata().put("memory_pressure_abort", true);
        }
        if (!errors.isEmpty()) {
            result.getMetadata().put("partial", true);
        }
        if (!warnings.isEmpty()) {
            result.getMetadata().put("warnings", warnings);
        }
        log.info("Batched scan finished: pages={}, rows={}, duration_ms={}", pages, data.rowCount(), result.getExecutionTimeMs());
        return result;
    }

    private boolean underPressure() {
        if (memoryMonitor.utilization() <= memoryThreshold) {
            return false;
        }
        memoryMonitor.requestGc();
        return memoryMonitor.utilization() > memoryCritical;
    }

    private SourceQuery pageQuery(SourceQuery query, SqlDialect dialect, long offset) {
        if (query.isSql()) {
            return SourceQuery.sql(dialect.page(query.getSql(), offset, pageSize));
        }
        return query.withSteps(OperationStep.offset((int) offset), OperationStep.limit(pageSize));
    }

    public int getPageSize() {
        return pageSize;
    }
}
