package com.queryroute.execution;

import com.queryroute.connector.ConnectorResult;
import com.queryroute.connector.OperationStep;
import com.queryroute.connector.SourceAccessException;
import com.queryroute.connector.SourceConnector;
import com.queryroute.connector.SourceQuery;
import com.queryroute.connector.SourceSession;
import com.queryroute.model.Complexity;
import com.queryroute.model.DatabaseQueryTask;
import com.queryroute.model.ExecutionResult;
import com.queryroute.model.QueryPlan;
import com.queryroute.model.RouteConstraints;
import com.queryroute.model.TabularData;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Supplier;

import static com.queryroute.model.TabularData.row;
import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("CrossSourceExecutor")
class CrossSourceExecutorTest {
    private static final QueryPlan PLAN = QueryPlan.builder().sourceId("a").complexity(Complexity.LOW).build();

    private final Map<String, Supplier<SourceSession>> sessions = new HashMap<>();
    private final Set<String> fileSources = new HashSet<>();
    private CrossSourceExecutor executor;

    private static final class StubConnector implements SourceConnector {
        private final String sourceId;
        private final Supplier<SourceSession> sessions;
        private final boolean sql;

        StubConnector(String sourceId, Supplier<SourceSession> sessions, boolean sql) {
            this.sourceId = sourceId;
            this.sessions = sessions;
            this.sql = sql;
        }

        @Override
        public String getSourceId() {
            return sourceId;
        }

        @Override
        public String getDbType() {
            return sql ? "postgres" : "csv";
        }

        @Override
        public boolean supportsSql() {
            return sql;
        }

        @Override
        public SourceSession connect() {
            return sessions.get();
        }

        @Override
        public void close() {
        }
    }

    /** Returns a fixed table, a fixed error, or blocks until interrupted. */
    private static final class FixedSession extends PagedTableSession {
        private final TabularData data;
        private final String error;
        private final long delayMs;
        private final List<SourceQuery> received = new ArrayList<>();

        FixedSession(TabularData data, String error, long delayMs) {
            super(0);
            this.data = data;
            this.error = error;
            this.delayMs = delayMs;
        }

        @Override
        public ConnectorResult execute(SourceQuery query, int limit, Duration timeout) {
            received.add(query);
            if (delayMs > 0) {
                try {
                    Thread.sleep(delayMs);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return ConnectorResult.failed("interrupted");
                }
            }
            if (error != null) {
                return ConnectorResult.failed(error);
            }
            return ConnectorResult.ok(data.getColumns(), data.getRows());
        }
    }

    private static SourceSession returning(TabularData data) {
        return new FixedSession(data, null, 0);
    }

    private static SourceSession failing(String error) {
        return new FixedSession(null, error, 0);
    }

    private static DatabaseQueryTask task(String sourceId, String sql) {
        return DatabaseQueryTask.builder().sourceId(sourceId).sql(sql).build();
    }

    @BeforeEach
    void setUp() {
        BatchQueryRunner batchRunner = new BatchQueryRunner(new RuntimeMemoryMonitor(), 1000, 100, 1.1, 1.1);
        executor = new CrossSourceExecutor(id -> new StubConnector(id, sessions.get(id), !fileSources.contains(id)),
                batchRunner, 4, 5_000, 100_000);
    }

    @AfterEach
    void tearDown() {
        executor.shutdown();
    }

    @Nested
    @DisplayName("Single task")
    class SingleTask {

        @Test
        @DisplayName("an unlimited query is read in pages")
        void batched() {
            PagedTableSession session = new PagedTableSession(1200);
            sessions.put("a", () -> session);

            ExecutionResult result = executor.execute(List.of(task("a", "SELECT n FROM t")), PLAN, RouteConstraints.defaults());

            assertThat(result.isSuccess()).isTrue();
            assertThat(result.getRowCount()).isEqualTo(1200);
            assertThat(result.getQuerySql()).isEqualTo("SELECT n FROM t");
            assertThat(result.getPerformanceStats())
                    .containsEntry("batched", true)
                    .containsEntry("pages_fetched", 2)
                    .containsEntry("databases_queried", 1)
                    .containsEntry("tasks_failed", 0);
            assertThat(result.getPerformanceStats().get("states")).isEqualTo(List.of(
                    ExecutionState.RECEIVED, ExecutionState.SINGLE_SOURCE, ExecutionState.EXECUTING, ExecutionState.DONE));
            assertThat(session.isClosed()).isTrue();
        }

        @Test
        @DisplayName("batching can be switched off")
        void direct() {
            PagedTableSession session = new PagedTableSession(1200);
            sessions.put("a", () -> session);
            RouteConstraints constraints = RouteConstraints.builder().allowBatching(false).build();

            ExecutionResult result = executor.execute(List.of(task("a", "SELECT n FROM t")), PLAN, constraints);

            assertThat(result.getRowCount()).isEqualTo(1200);
            assertThat(session.queries()).containsExactly("SELECT n FROM t");
            assertThat(result.getPerformanceStats()).doesNotContainKey("batched");
        }

        @Test
        @DisplayName("a source that cannot be opened fails the request")
        void unreachable() {
            sessions.put("a", () -> {
                throw new SourceAccessException("host unreachable");
            });

            ExecutionResult result = executor.execute(List.of(task("a", "SELECT 1")), PLAN, RouteConstraints.defaults());

            assertThat(result.isSuccess()).isFalse();
            assertThat(result.getErrors()).containsExactly("Task 1 [a]: host unreachable");
            assertThat(result.getData()).isNull();
        }

        @Test
        @DisplayName("an operation task reaches the source as an operation sequence")
        void operations() {
            FixedSession session = new FixedSession(new TabularData(List.of("qty"), List.of(row("qty", 4L))), null, 0);
            sessions.put("files", () -> session);
            fileSources.add("files");
            DatabaseQueryTask task = DatabaseQueryTask.builder()
                    .sourceId("files")
                    .operations(List.of(OperationStep.load("stock"), OperationStep.select(List.of("qty"))))
                    .build();
            RouteConstraints constraints = RouteConstraints.builder().allowBatching(false).build();

            ExecutionResult result = executor.execute(List.of(task), PLAN, constraints);

            assertThat(result.isSuccess()).isTrue();
            assertThat(result.getQuerySql()).isEqualTo("LOAD stock | SELECT qty");
            assertThat(session.received).singleElement().satisfies(q -> assertThat(q.isSql()).isFalse());
        }

        @Test
        @DisplayName("SQL sent to a source without SQL fails with the reason")
        void sqlToFileSource() {
            sessions.put("files", () -> returning(TabularData.empty()));
            fileSources.add("files");

            ExecutionResult result = executor.execute(List.of(task("files", "SELECT 1")), PLAN, RouteConstraints.defaults());

            assertThat(result.isSuccess()).isFalse();
            assertThat(result.getErrors()).containsExactly("Task 1 [files]: source type csv takes operation sequences, not SQL");
        }
    }

    @Nested
    @DisplayName("Several tasks")
    class SeveralTasks {

        @Test
        @DisplayName("one failing source leaves the other's data and exactly one error")
        void partialFailure() {
            sessions.put("a", () -> returning(new TabularData(List.of("x"), List.of(row("x", 1), row("x", 2)))));
            sessions.put("b", () -> failing("relation does not exist"));

            ExecutionResult result = executor.execute(
                    List.of(task("a", "SELECT x FROM a"), task("b", "SELECT y FROM b")), PLAN, RouteConstraints.defaults());

            assertThat(result.isSuccess()).isTrue();
            assertThat(result.getRowCount()).isEqualTo(2);
            assertThat(result.getErrors()).containsExactly("Task 2 [b]: relation does not exist");
            assertThat(result.getMetadata()).containsEntry("failed_sources", List.of("b"));
            assertThat(result.getPerformanceStats())
                    .containsEntry("databases_queried", 2)
                    .containsEntry("tasks_total", 2)
                    .containsEntry("tasks_failed", 1);
            assertThat(result.getQuerySql()).isEqualTo("SELECT x FROM a;\nSELECT y FROM b");
        }

        @Test
        @DisplayName("every source failing fails the request with one error per task")
        void totalFailure() {
            sessions.put("a", () -> failing("boom"));
            sessions.put("b", () -> failing("bang"));

            ExecutionResult result = executor.execute(
                    List.of(task("a", "SELECT 1"), task("b", "SELECT 2")), PLAN, RouteConstraints.defaults());

            assertThat(result.isSuccess()).isFalse();
            assertThat(result.getErrors()).containsExactly("Task 1 [a]: boom", "Task 2 [b]: bang");
            assertThat(result.getPerformanceStats().get("states")).asList().endsWith(ExecutionState.FAILED);
        }

        @Test
        @DisplayName("successful results are merged on shared columns")
        void merges() {
            sessions.put("a", () -> returning(new TabularData(List.of("id", "name"), List.of(row("id", 1, "name", "ann")))));
            sessions.put("b", () -> returning(new TabularData(List.of("id", "total"), List.of(row("id", 1, "total", 9)))));

            ExecutionResult result = executor.execute(
                    List.of(task("a", "SELECT 1"), task("b", "SELECT 2")), PLAN, RouteConstraints.defaults());

            assertThat(result.getData().getRows()).containsExactly(row("id", 1, "name", "ann", "total", 9));
            assertThat(result.getPerformanceStats().get("states")).asList().contains(ExecutionState.MULTI_SOURCE, ExecutionState.MERGING);
        }

        @Test
        @DisplayName("running the same plan twice returns the same rows")
        void repeatable() {
            sessions.put("a", () -> returning(new TabularData(List.of("id", "name"), List.of(row("id", 1, "name", "ann"), row("id", 2, "name", "bob")))));
            sessions.put("b", () -> returning(new TabularData(List.of("id", "total"), List.of(row("id", 1, "total", 9)))));
            List<DatabaseQueryTask> tasks = List.of(task("a", "SELECT id, name FROM a"), task("b", "SELECT id, total FROM b"));

            ExecutionResult first = executor.execute(tasks, PLAN, RouteConstraints.defaults());
            ExecutionResult second = executor.execute(tasks, PLAN, RouteConstraints.defaults());

            assertThat(first.getRowCount()).isEqualTo(2);
            assertThat(second.getRowCount()).isEqualTo(first.getRowCount());
            assertThat(second.getData().getRows()).isEqualTo(first.getData().getRows());
            assertThat(second.getQuerySql()).isEqualTo(first.getQuerySql());
        }

        @Test
        @DisplayName("a slow source times out without hiding the others")
        void timeout() {
            sessions.put("a", () -> returning(new TabularData(List.of("x"), List.of(row("x", 1)))));
            sessions.put("slow", () -> new FixedSession(TabularData.empty(), null, 10_000));
            RouteConstraints constraints = RouteConstraints.builder().timeoutMs(300L).build();

            ExecutionResult result = executor.execute(
                    List.of(task("a", "SELECT 1"), task("slow", "SELECT 2")), PLAN, constraints);

            assertThat(result.isSuccess()).isTrue();
            assertThat(result.getRowCount()).isEqualTo(1);
            assertThat(result.getErrors()).containsExactly("Task 2 [slow]: timed out");
        }
    }

    @Test
    @DisplayName("no tasks is a failure")
    void noTasks() {
        ExecutionResult result = executor.execute(List.of(), PLAN, RouteConstraints.defaults());

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getErrors()).containsExactly("No query tasks to execute");
    }
}
