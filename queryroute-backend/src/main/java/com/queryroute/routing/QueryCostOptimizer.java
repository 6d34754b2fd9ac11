package com.queryroute.routing;

import com.queryroute.connector.OperationStep;
import com.queryroute.connector.OperationType;
import com.queryroute.model.DatabaseQueryTask;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reorders tasks by priority and rewrites expensive ones in place.
 */
@Slf4j
@Component
public class QueryCostOptimizer {
    private static final Pattern JOIN = Pattern.compile("\\bJOIN\\b", Pattern.CASE_INSENSITIVE);
    private static final int MAX_PRIORITY = 3;

    private final double costThreshold;
    private final long largeTableRows;
    private final int rowLimit;
    private final int timeoutHintSeconds;

    public QueryCostOptimizer(
            @Value("${queryroute.optimizer.cost-threshold:1000000}") double costThreshold,
            @Value("${queryroute.optimizer.large-table-rows:100000}") long largeTableRows,
            @Value("${queryroute.optimizer.row-limit:10000}") int rowLimit,
            @Value("${queryroute.optimizer.timeout-hint-seconds:300}") int timeoutHintSeconds
    ) {
        this.costThreshold = costThreshold;
        this.largeTableRows = largeTableRows;
        this.rowLimit = rowLimit;
        this.timeoutHintSeconds = timeoutHintSeconds;
    }

    public void optimize(List<DatabaseQueryTask> tasks) {
        tasks.sort(Comparator.comparingInt(DatabaseQueryTask::getPriority));

        for (DatabaseQueryTask task : tasks) {
            int joins = task.isOperationSequence() ? 0 : joinCount(task.getSql());
            double cost = task.totalRowCount() * (1 + 0.5 * joins);
            task.setEstimatedCost(cost);

            if (cost > costThreshold) {
                task.setPriority(Math.min(MAX_PRIORITY, task.getPriority() + 1));
            }

            boolean largeTable = task.getTables().stream().anyMatch(t -> t.getTable().getRowCount() > largeTableRows);
            if (task.isOperationSequence()) {
                if (largeTable && !hasLimitStep(task.getOperations())) {
                    List<OperationStep> steps = new ArrayList<>(task.getOperations());
                    steps.add(OperationStep.limit(rowLimit));
                    task.setOperations(List.copyOf(steps));
                }
            } else {
                if (largeTable && !SqlFragments.hasRowLimit(task.getSql())) {
                    task.setSql(SqlDialect.forDbType(task.getSourceType()).limit(task.getSql(), rowLimit));
                }
                if (joins > 2) {
                    task.setSql("/* QUERY_TIMEOUT=" + timeoutHintSeconds + " */ " + task.getSql());
                }
            }
            log.debug("Optimized task: source_id={}, cost={}, priority={}", task.getSourceId(), cost, task.getPriority());
        }
    }

    static boolean hasLimitStep(List<OperationStep> steps) {
        return steps.stream().anyMatch(s -> s.getType() == OperationType.LIMIT);
    }

    static int joinCount(String sql) {
        Matcher m = JOIN.matcher(sql);
        int count = 0;
        while (m.find()) {
            count++;
        }
        return count;
    }
}
