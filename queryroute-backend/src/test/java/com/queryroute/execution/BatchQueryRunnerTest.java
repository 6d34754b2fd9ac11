package com.queryroute.execution;

import com.queryroute.connector.SourceQuery;
import com.queryroute.model.ExecutionResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("BatchQueryRunner")
class BatchQueryRunnerTest {
    private static final SourceQuery QUERY = SourceQuery.sql("SELECT n FROM t");

    /** Replays utilization readings, then reports 0.5. */
    private static final class ScriptedMemory implements MemoryMonitor {
        private final Deque<Double> readings;
        private int gcRequests;

        ScriptedMemory(Double... readings) {
            this.readings = new ArrayDeque<>(List.of(readings));
        }

        @Override
        public double utilization() {
            return readings.isEmpty() ? 0.5 : readings.poll();
        }

        @Override
        public void requestGc() {
            gcRequests++;
        }
    }

    private static BatchQueryRunner runner(MemoryMonitor memory) {
        return new BatchQueryRunner(memory, 1000, 10_000, 0.8, 0.9);
    }

    @Nested
    @DisplayName("Paging")
    class Paging {

        @Test
        @DisplayName("2500 rows are read in three pages")
        void threePages() {
            PagedTableSession session = new PagedTableSession(2500);

            ExecutionResult result = runner(new ScriptedMemory()).run(session, QUERY, "postgres", Duration.ofSeconds(30));

            assertThat(result.isSuccess()).isTrue();
            assertThat(result.getRowCount()).isEqualTo(2500);
            assertThat(result.getData().getColumns()).containsExactly("n");
            assertThat(result.getPerformanceStats())
                    .containsEntry("batched", true)
                    .containsEntry("pages_fetched", 3)
                    .containsEntry("page_size", 1000)
                    .containsEntry("page_offsets", List.of(0L, 1000L, 2000L));
            assertThat(session.queries()).containsExactly(
                    "SELECT n FROM t LIMIT 1000 OFFSET 0",
                    "SELECT n FROM t LIMIT 1000 OFFSET 1000",
                    "SELECT n FROM t LIMIT 1000 OFFSET 2000",
                    "SELECT n FROM t LIMIT 1000 OFFSET 3000");
            assertThat(result.getMetadata()).doesNotContainKey("partial");
        }

        @Test
        @DisplayName("an empty first page gives an empty success")
        void emptyTable() {
            ExecutionResult result = runner(new ScriptedMemory()).run(new PagedTableSession(0), QUERY, "postgres", null);

            assertThat(result.isSuccess()).isTrue();
            assertThat(result.getRowCount()).isZero();
            assertThat(result.getPerformanceStats()).containsEntry("pages_fetched", 0);
        }

        @Test
        @DisplayName("fetch-first dialects page with OFFSET .. FETCH NEXT")
        void fetchFirst() {
            PagedTableSession session = new PagedTableSession(0);

            runner(new ScriptedMemory()).run(session, QUERY, "oracle", null);

            assertThat(session.queries().get(0)).isEqualTo("SELECT n FROM t OFFSET 0 ROWS FETCH NEXT 1000 ROWS ONLY");
        }
    }

    @Nested
    @DisplayName("Failures")
    class Failures {

        @Test
        @DisplayName("a failing later page keeps the pages already read")
        void partial() {
            PagedTableSession session = new PagedTableSession(2500).failOnCall(2);

            ExecutionResult result = runner(new ScriptedMemory()).run(session, QUERY, "postgres", null);

            assertThat(result.isSuccess()).isTrue();
            assertThat(result.getRowCount()).isEqualTo(1000);
            assertThat(result.getErrors()).containsExactly("page at offset 1000: connection reset");
            assertThat(result.getMetadata()).containsEntry("partial", true);
        }

        @Test
        @DisplayName("a failing first page fails the scan")
        void firstPage() {
            PagedTableSession session = new PagedTableSession(2500).failOnCall(1);

            ExecutionResult result = runner(new ScriptedMemory()).run(session, QUERY, "postgres", null);

            assertThat(result.isSuccess()).isFalse();
            assertThat(result.getData()).isNull();
            assertThat(result.getErrors()).containsExactly("connection reset");
        }
    }

    @Nested
    @DisplayName("Memory pressure")
    class MemoryPressure {

        @Test
        @DisplayName("pressure that survives a GC stops the scan")
        void abortsUnderPressure() {
            ScriptedMemory memory = new ScriptedMemory(0.5, 0.5, 0.95, 0.95);

            ExecutionResult result = runner(memory).run(new PagedTableSession(5000), QUERY, "postgres", null);

            assertThat(result.isSuccess()).isTrue();
            assertThat(result.getRowCount()).isEqualTo(2000);
            assertThat(result.getMetadata()).containsEntry("memory_pressure_abort", true);
            assertThat(result.getMetadata()).containsKey("warnings");
            assertThat(memory.gcRequests).isEqualTo(1);
        }

        @Test
        @DisplayName("pressure relieved by a GC lets the scan continue")
        void relievedByGc() {
            ScriptedMemory memory = new ScriptedMemory(0.85, 0.6);

            ExecutionResult result = runner(memory).run(new PagedTableSession(1500), QUERY, "postgres", null);

            assertThat(result.getRowCount()).isEqualTo(1500);
            assertThat(result.getMetadata()).doesNotContainKey("memory_pressure_abort");
            assertThat(memory.gcRequests).isEqualTo(1);
        }
    }

    @Test
    @DisplayName("the abort signal ends the scan before the next page")
    void abortSignal() {
        PagedTableSession session = new PagedTableSession(2500);

        ExecutionResult result = runner(new ScriptedMemory()).run(session, QUERY, "postgres", null, () -> true);

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getRowCount()).isZero();
        assertThat(session.queries()).isEmpty();
    }
}
