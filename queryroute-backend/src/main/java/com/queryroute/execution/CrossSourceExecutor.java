package com.queryroute.execution;

import com.queryroute.connector.ConnectorResult;
import com.queryroute.connector.OperationType;
import com.queryroute.connector.SourceConnector;
import com.queryroute.connector.SourceConnectorProvider;
import com.queryroute.connector.SourceQuery;
import com.queryroute.connector.SourceSession;
import com.queryroute.model.Complexity;
import com.queryroute.model.DatabaseQueryTask;
import com.queryroute.model.ExecutionResult;
import com.queryroute.model.QueryPlan;
import com.queryroute.model.RouteConstraints;
import com.queryroute.model.TabularData;
import com.queryroute.routing.SqlDialect;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/**
 * Runs query tasks against their sources and merges the outcomes.
 *
 * <p>Several tasks run concurrently on a fixed pool; the caller's deadline covers the whole batch and every
 * task is awaited, so a failed or slow source never hides the results of the others.
 */
@Slf4j
@Component
public class CrossSourceExecutor {
    private final SourceConnectorProvider connectorProvider;
    private final BatchQueryRunner batchRunner;
    private final ExecutorService pool;
    private final long defaultTimeoutMs;
    private final int maxRows;

    public CrossSourceExecutor(
            SourceConnectorProvider connectorProvider,
            BatchQueryRunner batchRunner,
            @Value("${queryroute.executor.pool-size:4}") int poolSize,
            @Value("${queryroute.executor.default-timeout-ms:60000}") long defaultTimeoutMs,
            @Value("${queryroute.executor.max-rows:100000}") int maxRows
    ) {
        this.connectorProvider = connectorProvider;
        this.batchRunner = batchRunner;
        this.pool = Executors.newFixedThreadPool(poolSize, namedThreads());
        this.defaultTimeoutMs = defaultTimeoutMs;
        this.maxRows = maxRows;
    }

    public ExecutionResult execute(List<DatabaseQueryTask> tasks, QueryPlan plan, RouteConstraints constraints) {
        long start = System.currentTimeMillis();
        long timeoutMs = constraints.getTimeoutMs() != null && constraints.getTimeoutMs() > 0
                ? constraints.getTimeoutMs() : defaultTimeoutMs;
        List<ExecutionState> states = new ArrayList<>();
        states.add(ExecutionState.RECEIVED);

        if (tasks.isEmpty()) {
            states.add(ExecutionState.FAILED);
            ExecutionResult result = ExecutionResult.failure(null, "No query tasks to execute");
            result.setPerformanceStats(stats(tasks, List.of(), start, states));
            return result;
        }

        List<TaskOutcome> outcomes;
        if (tasks.size() == 1) {
            states.add(ExecutionState.SINGLE_SOURCE);
            states.add(ExecutionState.EXECUTING);
            DatabaseQueryTask task = tasks.get(0);
            outcomes = List.of(runSingle(task, shouldBatch(task, plan, constraints), Duration.ofMillis(timeoutMs)));
        } else {
            states.add(ExecutionState.MULTI_SOURCE);
            states.add(ExecutionState.EXECUTING);
            outcomes = runConcurrently(tasks, start + timeoutMs);
        }

        List<TaskOutcome> failed = outcomes.stream().filter(o -> !o.success()).toList();
        List<TaskOutcome> succeeded = outcomes.stream().filter(TaskOutcome::success).toList();
        String querySql = tasks.stream().map(DatabaseQueryTask::queryText).collect(Collectors.joining(";\n"));

        ExecutionResult result;
        if (succeeded.isEmpty()) {
            states.add(ExecutionState.FAILED);
            result = ExecutionResult.failure(querySql, failed.stream().map(TaskOutcome::error).toList());
        } else {
            TabularData data;
            if (succeeded.size() == 1) {
                data = succeeded.get(0).result().getData();
            } else {
                states.add(ExecutionState.MERGING);
                data = ResultMerger.merge(succeeded.stream().map(o -> o.result().getData()).toList());
            }
            states.add(ExecutionState.DONE);
            result = ExecutionResult.success(data, querySql);
            result.setErrors(new ArrayList<>(failed.stream().map(TaskOutcome::error).toList()));
            for (TaskOutcome outcome : succeeded) {
                result.getErrors().addAll(outcome.result().getErrors());
                result.getMetadata().putAll(outcome.result().getMetadata());
            }
            if (succeeded.size() == 1) {
                result.getPerformanceStats().putAll(succeeded.get(0).result().getPerformanceStats());
            }
        }

        List<String> failedSources = failed.stream().map(o -> o.task().getSourceId()).distinct().toList();
        if (!failedSources.isEmpty()) {
            result.getMetadata().put("failed_sources", failedSources);
        }
        result.setExecutionTimeMs(System.currentTimeMillis() - start);
        result.getPerformanceStats().putAll(stats(tasks, failedSources, start, states));
        result.getPerformanceStats().put("tasks_failed", failed.size());
        log.info("Executed tasks: tasks={}, failed={}, rows={}, duration_ms={}",
                tasks.size(), failed.size(), result.getRowCount(), result.getExecutionTimeMs());
        return result;
    }

    private List<TaskOutcome> runConcurrently(List<DatabaseQueryTask> tasks, long deadline) {
        List<Future<TaskOutcome>> futures = new ArrayList<>(tasks.size());
        for (int i = 0; i < tasks.size(); i++) {
            DatabaseQueryTask task = tasks.get(i);
            int taskNo = i + 1;
            futures.add(pool.submit(() -> runTask(taskNo, task, false,
                    Duration.ofMillis(Math.max(1, deadline - System.currentTimeMillis())))));
        }

        List<TaskOutcome> outcomes = new ArrayList<>(tasks.size());
        for (int i = 0; i < futures.size(); i++) {
            DatabaseQueryTask task = tasks.get(i);
            int taskNo = i + 1;
            Future<TaskOutcome> future = futures.get(i);
            try {
                long remaining = deadline - System.currentTimeMillis();
                outcomes.add(future.get(Math.max(0, remaining), TimeUnit.MILLISECONDS));
            } catch (TimeoutException e) {
                future.cancel(true);
                outcomes.add(TaskOutcome.failed(taskNo, task, "timed out"));
            } catch (ExecutionException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                log.warn("Task failed: task={}, source_id={}", taskNo, task.getSourceId(), cause);
                outcomes.add(TaskOutcome.failed(taskNo, task, cause.getMessage()));
            } catch (CancellationException e) {
                outcomes.add(TaskOutcome.failed(taskNo, task, "cancelled"));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                future.cancel(true);
                outcomes.add(TaskOutcome.failed(taskNo, task, "interrupted"));
            }
        }
        return outcomes;
    }

    private TaskOutcome runSingle(DatabaseQueryTask task, boolean batched, Duration timeout) {
        try {
            return runTask(1, task, batched, timeout);
        } catch (RuntimeException e) {
            log.warn("Task failed: task=1, source_id={}", task.getSourceId(), e);
            return TaskOutcome.failed(1, task, e.getMessage());
        }
    }

    private TaskOutcome runTask(int taskNo, DatabaseQueryTask task, boolean batched, Duration timeout) {
        SourceConnector connector = connectorProvider.connectorFor(task.getSourceId());
        SourceQuery query = task.isOperationSequence()
                ? SourceQuery.operations(task.getOperations())
                : SourceQuery.sql(task.getSql());
        if (query.isSql() && !connector.supportsSql()) {
            return TaskOutcome.failed(taskNo, task, "source type " + connector.getDbType() + " takes operation sequences, not SQL");
        }
        ExecutionResult result;
        try (SourceSession session = connector.connect()) {
            if (batched) {
                result = batchRunner.run(session, query, connector.getDbType(), timeout);
            } else {
                long started = System.currentTimeMillis();
                ConnectorResult raw = session.execute(query, maxRows, timeout);
                if (raw.isSuccess()) {
                    result = ExecutionResult.success(raw.toTabularData(), query.describe());
                    if (raw.isTruncated()) {
                        result.getMetadata().put("truncated", true);
                    }
                } else {
                    result = ExecutionResult.failure(query.describe(), raw.getError());
                }
                result.setExecutionTimeMs(System.currentTimeMillis() - started);
            }
        }
        if (!result.isSuccess()) {
            return TaskOutcome.failed(taskNo, task, String.join("; ", result.getErrors()));
        }
        return new TaskOutcome(task, true, result, null);
    }

    private boolean shouldBatch(DatabaseQueryTask task, QueryPlan plan, RouteConstraints constraints) {
        if (!constraints.isAllowBatching() || plan.isFallback()) {
            return false;
        }
        if (plan.getComplexity() == Complexity.HIGH) {
            return true;
        }
        if (task.isOperationSequence()) {
            return task.getOperations().stream().noneMatch(s -> s.getType() == OperationType.LIMIT);
        }
        return !SqlDialect.hasRowLimit(task.getSql());
    }

    private static Map<String, Object> stats(List<DatabaseQueryTask> tasks, List<String> failedSources,
                                             long start, List<ExecutionState> states) {
        Set<String> sources = new LinkedHashSet<>();
        tasks.forEach(t -> sources.add(t.getSourceId()));
        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("databases_queried", sources.size());
        stats.put("tasks_total", tasks.size());
        stats.put("tasks_failed", failedSources.size());
        stats.put("total_execution_time_ms", System.currentTimeMillis() - start);
        stats.put("failed_sources", failedSources);
        stats.put("states", List.copyOf(states));
        return stats;
    }

    private static ThreadFactory namedThreads() {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, "queryroute-exec-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    @PreDestroy
    public void shutdown() {
        pool.shutdownNow();
    }

    private record TaskOutcome(DatabaseQueryTask task, boolean success, ExecutionResult result, String error) {

        static TaskOutcome failed(int taskNo, DatabaseQueryTask task, String message) {
            String error = "Task " + taskNo + " [" + task.getSourceId() + "]: " + (message != null ? message : "unknown error");
            return new TaskOutcome(task, false, null, error);
        }
    }
}
