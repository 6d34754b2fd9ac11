package com.queryroute.routing;

import com.queryroute.catalog.SourceRegistry;
import com.queryroute.connector.OperationStep;
import com.queryroute.model.AggregationConfig;
import com.queryroute.model.Complexity;
import com.queryroute.model.DatabaseQueryTask;
import com.queryroute.model.FilterConfig;
import com.queryroute.model.QueryPlan;
import com.queryroute.model.SourceDefinition;
import com.queryroute.model.TableCandidate;
import com.queryroute.model.TableDescriptor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static com.queryroute.TestTables.candidate;
import static com.queryroute.TestTables.table;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

@DisplayName("QueryTaskGenerator")
class QueryTaskGeneratorTest {
    private final TableCandidate orders = candidate(table("pg", "orders", 1000, "id", "user_id"), 1.0);
    private final TableCandidate users = candidate(table("pg", "users", 100, "id", "name", "level"), 0.9);

    private QueryTaskGenerator generator;

    @BeforeEach
    void setUp() {
        SourceDefinition pg = new SourceDefinition();
        pg.setId("pg");
        pg.setName("Sales");
        pg.setType("postgres");
        SourceDefinition files = new SourceDefinition();
        files.setId("files");
        files.setType("csv");
        SourceRegistry registry = mock(SourceRegistry.class);
        when(registry.find("pg")).thenReturn(Optional.of(pg));
        when(registry.find("files")).thenReturn(Optional.of(files));
        generator = new QueryTaskGenerator(registry);
    }

    @Test
    @DisplayName("a single-source plan renders one joined query")
    void singleSource() {
        QueryPlan plan = QueryPlan.builder()
                .sourceId("pg")
                .primaryTables(List.of(orders, users))
                .joinConditions(List.of("users.id = orders.user_id"))
                .selectColumns(List.of("orders.id", "users.name"))
                .whereConditions(List.of("users.level = 'VIP'"))
                .orderByColumns(List.of("orders.id DESC"))
                .complexity(Complexity.LOW)
                .executionOrder(List.of("pg"))
                .build();

        List<DatabaseQueryTask> tasks = generator.generateTasks(plan);

        assertThat(tasks).hasSize(1);
        DatabaseQueryTask task = tasks.get(0);
        assertThat(task.getSql()).isEqualTo("SELECT orders.id, users.name FROM orders"
                + " LEFT JOIN users ON users.id = orders.user_id"
                + " WHERE users.level = 'VIP' ORDER BY orders.id DESC");
        assertThat(task.getPriority()).isEqualTo(1);
        assertThat(task.getSourceName()).isEqualTo("Sales");
        assertThat(task.getSourceType()).isEqualTo("postgres");
        assertThat(task.getTables()).containsExactly(orders, users);
    }

    @Test
    @DisplayName("aggregates render GROUP BY after WHERE")
    void groupBy() {
        QueryPlan plan = QueryPlan.builder()
                .sourceId("pg")
                .primaryTables(List.of(users))
                .selectColumns(List.of("users.level", "COUNT(*) as total_count"))
                .groupByColumns(List.of("users.level"))
                .orderByColumns(List.of("total_count DESC"))
                .complexity(Complexity.LOW)
                .build();

        assertThat(generator.generateTasks(plan).get(0).getSql()).isEqualTo(
                "SELECT users.level, COUNT(*) as total_count FROM users GROUP BY users.level ORDER BY total_count DESC");
    }

    @Test
    @DisplayName("tables without a join condition are left out with their columns")
    void unlinkedTable() {
        TableCandidate logs = candidate(table("pg", "logs", 10, "message"), 0.5);
        QueryPlan plan = QueryPlan.builder()
                .sourceId("pg")
                .primaryTables(List.of(orders, logs))
                .selectColumns(List.of("orders.id", "logs.message"))
                .complexity(Complexity.LOW)
                .build();

        assertThat(generator.generateTasks(plan).get(0).getSql()).isEqualTo("SELECT orders.id FROM orders");
    }

    @Test
    @DisplayName("schema-qualified tables keep their bare name as alias")
    void schemaQualified() {
        TableDescriptor qualified = table("pg", "orders", 10, "id").toBuilder().schema("public").build();
        QueryPlan plan = QueryPlan.builder()
                .sourceId("pg")
                .primaryTables(List.of(candidate(qualified, 1.0)))
                .selectColumns(List.of("*"))
                .complexity(Complexity.LOW)
                .build();

        assertThat(generator.generateTasks(plan).get(0).getSql()).isEqualTo("SELECT * FROM public.orders orders");
    }

    @Test
    @DisplayName("a cross-source plan splits into one task per source")
    void crossSource() {
        TableCandidate stock = candidate(table("csv", "stock", 50, "sku", "qty"), 0.8);
        TableCandidate audit = candidate(table("mysql", "audit", 5, "id"), 0.4);
        QueryPlan plan = QueryPlan.builder()
                .sourceId("pg")
                .primaryTables(List.of(orders, stock))
                .joinTables(List.of(users, audit))
                .joinConditions(List.of("users.id = orders.user_id"))
                .selectColumns(List.of("orders.id", "stock.qty", "users.name"))
                .whereConditions(List.of("stock.qty > 0"))
                .complexity(Complexity.MEDIUM)
                .crossDatabase(true)
                .executionOrder(List.of("pg", "csv", "mysql"))
                .build();

        List<DatabaseQueryTask> tasks = generator.generateTasks(plan);

        assertThat(tasks).extracting(DatabaseQueryTask::getSourceId).containsExactly("pg", "csv", "mysql");
        assertThat(tasks.get(0).getSql())
                .isEqualTo("SELECT orders.id, users.name FROM orders LEFT JOIN users ON users.id = orders.user_id");
        assertThat(tasks.get(1).getSql()).isEqualTo("SELECT stock.qty FROM stock WHERE stock.qty > 0");
        assertThat(tasks.get(2).getSql()).isEqualTo("SELECT * FROM audit");
        assertThat(tasks).extracting(DatabaseQueryTask::getPriority).containsExactly(1, 1, 2);
        assertThat(tasks.get(2).getSourceName()).isEqualTo("mysql");
    }

    @Test
    @DisplayName("a fallback plan counts the placeholder table")
    void fallback() {
        QueryPlan plan = QueryPlan.builder()
                .sourceId("pg")
                .selectColumns(List.of(QueryPlanner.FALLBACK_SELECT))
                .complexity(Complexity.LOW)
                .fallback(true)
                .placeholderTable("default_table")
                .build();

        List<DatabaseQueryTask> tasks = generator.generateTasks(plan);

        assertThat(tasks).hasSize(1);
        assertThat(tasks.get(0).getSql()).isEqualTo("SELECT COUNT(*) as count FROM default_table");
        assertThat(tasks.get(0).getTables()).isEmpty();
        assertThat(tasks.get(0).getSourceId()).isEqualTo("pg");
    }

    @Test
    @DisplayName("a flat-file source gets an operation sequence over its first table")
    void flatFileAggregate() {
        TableCandidate stock = candidate(table("files", "stock", 10, "sku", "qty", "updated"), 1.0);
        TableCandidate regions = candidate(table("files", "regions", 3, "code", "name"), 0.5);
        QueryPlan plan = QueryPlan.builder()
                .sourceId("files")
                .primaryTables(List.of(stock, regions))
                .filters(List.of(
                        new FilterConfig("stock.updated", ">=", "2024-01-01"),
                        new FilterConfig("regions.code", "=", "N")))
                .selectColumns(List.of("COUNT(*) as total_count", "SUM(stock.qty) as qty_sum", "stock.sku"))
                .groupByColumns(List.of("stock.sku"))
                .orderByColumns(List.of("total_count DESC"))
                .complexity(Complexity.LOW)
                .build();

        DatabaseQueryTask task = generator.generateTasks(plan).get(0);

        assertThat(task.getSql()).isNull();
        assertThat(task.isOperationSequence()).isTrue();
        assertThat(task.queryText()).isEqualTo(
                "LOAD stock | FILTER updated >= 2024-01-01 | AGGREGATE count(*) sum(qty) BY sku | ORDER_BY total_count DESC");
        OperationStep aggregate = task.getOperations().get(2);
        assertThat(aggregate.getAggregations()).extracting(AggregationConfig::alias).containsExactly("total_count", "qty_sum");
    }

    @Test
    @DisplayName("a detail plan on a flat-file source selects the matched columns")
    void flatFileDetail() {
        TableCandidate stock = candidate(table("files", "stock", 10, "sku", "qty", "updated"), 1.0);
        QueryPlan plan = QueryPlan.builder()
                .sourceId("files")
                .primaryTables(List.of(stock))
                .selectColumns(List.of("stock.sku", "stock.updated"))
                .orderByColumns(List.of("stock.updated DESC"))
                .complexity(Complexity.LOW)
                .build();

        assertThat(generator.generateTasks(plan).get(0).queryText())
                .isEqualTo("LOAD stock | SELECT sku, updated | ORDER_BY updated DESC");
    }

    @Test
    @DisplayName("a fallback plan on a flat-file source counts the placeholder file")
    void flatFileFallback() {
        QueryPlan plan = QueryPlan.builder()
                .sourceId("files")
                .selectColumns(List.of(QueryPlanner.FALLBACK_SELECT))
                .complexity(Complexity.LOW)
                .fallback(true)
                .placeholderTable("default_table")
                .build();

        DatabaseQueryTask task = generator.generateTasks(plan).get(0);

        assertThat(task.queryText()).isEqualTo("LOAD default_table | AGGREGATE count(*)");
        assertThat(task.getOperations().get(1).getAggregations().get(0).alias()).isEqualTo("count");
    }
}
