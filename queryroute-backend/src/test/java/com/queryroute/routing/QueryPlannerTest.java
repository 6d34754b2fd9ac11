package com.queryroute.routing;

import com.queryroute.analyzer.KeywordVocabulary;
import com.queryroute.analyzer.SemanticAnalyzer;
import com.queryroute.catalog.MetadataCatalog;
import com.queryroute.model.Complexity;
import com.queryroute.model.FilterConfig;
import com.queryroute.model.QueryContext;
import com.queryroute.model.QueryPlan;
import com.queryroute.model.TableCandidate;
import com.queryroute.model.TableDescriptor;
import com.queryroute.model.TableRelation;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static com.queryroute.TestTables.candidate;
import static com.queryroute.TestTables.table;
import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("QueryPlanner")
class QueryPlannerTest {
    private final KeywordVocabulary vocabulary = KeywordVocabulary.defaults();
    private final SemanticAnalyzer analyzer = new SemanticAnalyzer(vocabulary);

    private final TableDescriptor users = table("pg", "users", 50_000, "id", "name", "level", "created_at");
    private final TableDescriptor orders = table("pg", "orders", 2_000_000, "id", "user_id", "amount", "created_at");

    private QueryPlanner planner;

    @BeforeEach
    void setUp() {
        MetadataCatalog catalog = new MetadataCatalog();
        catalog.replace("pg", List.of(users, orders), List.of(new TableRelation("users", "id", "orders", "user_id")));
        Clock clock = Clock.fixed(Instant.parse("2026-03-15T08:30:05Z"), ZoneOffset.UTC);
        planner = new QueryPlanner(catalog, vocabulary, clock, "default_table");
    }

    @Nested
    @DisplayName("Aggregating requests")
    class Aggregating {

        @Test
        @DisplayName("VIP order count joins users and orders with the declared relation")
        void vipOrderCount() {
            QueryContext ctx = analyzer.analyze("上月VIP用户的订单总数");
            List<TableCandidate> candidates = List.of(
                    candidate(orders, 1.0, "user_id", "amount", "created_at"),
                    candidate(users, 0.9, "created_at"));

            QueryPlan plan = planner.createPlan(ctx, candidates, "pg");

            assertThat(plan.getPrimaryTables()).hasSize(2);
            assertThat(plan.getJoinTables()).isEmpty();
            assertThat(plan.getJoinConditions()).containsExactly("users.id = orders.user_id");
            assertThat(plan.getSelectColumns()).containsExactly("COUNT(*) as total_count");
            assertThat(plan.getGroupByColumns()).isEmpty();
            assertThat(plan.getOrderByColumns()).containsExactly("total_count DESC");
            assertThat(plan.getWhereConditions()).containsExactly(
                    "orders.created_at >= '2026-02-01 00:00:00' AND orders.created_at < '2026-03-01 00:00:00'",
                    "users.level = 'VIP'");
            assertThat(plan.getFilters()).containsExactly(
                    new FilterConfig("orders.created_at", ">=", "2026-02-01"),
                    new FilterConfig("orders.created_at", "<", "2026-03-01"),
                    new FilterConfig("users.level", "=", "VIP"));
            assertThat(plan.getComplexity()).isEqualTo(Complexity.LOW);
            assertThat(plan.isCrossDatabase()).isFalse();
            assertThat(plan.getExecutionOrder()).containsExactly("pg");
        }

        @Test
        @DisplayName("non-count functions aggregate matched measure columns")
        void sumOverMeasures() {
            QueryContext ctx = analyzer.analyze("order summary of the sum of amount");
            List<TableCandidate> candidates = List.of(candidate(orders, 1.0, "amount", "created_at"));

            QueryPlan plan = planner.createPlan(ctx, candidates, "pg");

            assertThat(plan.getSelectColumns()).containsExactly(
                    "COUNT(*) as total_count",
                    "SUM(orders.amount) as amount_sum");
            assertThat(plan.getOrderByColumns()).containsExactly("total_count DESC");
        }

        @Test
        @DisplayName("filters on columns no table owns stay unqualified")
        void unqualifiedFilter() {
            QueryContext ctx = analyzer.analyze("VIP order count");
            List<TableCandidate> candidates = List.of(candidate(orders, 1.0));

            QueryPlan plan = planner.createPlan(ctx, candidates, "pg");

            assertThat(plan.getWhereConditions()).containsExactly("level = 'VIP'");
        }
    }

    @Nested
    @DisplayName("Detail requests")
    class Detail {

        @Test
        @DisplayName("select matched columns and order by the first time column")
        void detailColumns() {
            QueryContext ctx = analyzer.analyze("list orders");
            List<TableCandidate> candidates = List.of(candidate(orders, 1.0, "id", "created_at"));

            QueryPlan plan = planner.createPlan(ctx, candidates, "pg");

            assertThat(plan.getSelectColumns()).containsExactly("orders.id", "orders.created_at");
            assertThat(plan.getGroupByColumns()).isEmpty();
            assertThat(plan.getOrderByColumns()).containsExactly("orders.created_at DESC");
            assertThat(plan.getJoinConditions()).isEmpty();
        }

        @Test
        @DisplayName("no matched columns selects everything")
        void star() {
            QueryPlan plan = planner.createPlan(analyzer.analyze("list orders"), List.of(candidate(orders, 1.0)), "pg");

            assertThat(plan.getSelectColumns()).containsExactly("*");
            assertThat(plan.getOrderByColumns()).isEmpty();
        }

        @Test
        @DisplayName("candidates beyond the first two become join tables")
        void joinTables() {
            TableDescriptor items = table("pg", "items", 10, "id", "order_id");
            List<TableCandidate> candidates = List.of(
                    candidate(orders, 1.0), candidate(users, 0.9), candidate(items, 0.5));

            QueryPlan plan = planner.createPlan(analyzer.analyze("list orders"), candidates, "pg");

            assertThat(plan.getPrimaryTables()).extracting(TableCandidate::getTableName).containsExactly("orders", "users");
            assertThat(plan.getJoinTables()).extracting(TableCandidate::getTableName).containsExactly("items");
            assertThat(plan.getJoinConditions()).containsExactly(
                    "users.id = orders.user_id",
                    "items.order_id = orders.id");
            assertThat(plan.getComplexity()).isEqualTo(Complexity.MEDIUM);
        }
    }

    @Test
    @DisplayName("tables from several sources make a cross-database plan")
    void crossDatabase() {
        TableDescriptor stock = table("csv", "stock", 100, "sku", "qty");
        List<TableCandidate> candidates = List.of(candidate(orders, 1.0), candidate(stock, 0.8));

        QueryPlan plan = planner.createPlan(analyzer.analyze("list orders"), candidates, "pg");

        assertThat(plan.isCrossDatabase()).isTrue();
        assertThat(plan.getExecutionOrder()).containsExactly("pg", "csv");
        assertThat(plan.getJoinConditions()).isEmpty();
    }

    @Test
    @DisplayName("no candidates gives a stamped fallback plan")
    void fallback() {
        QueryPlan plan = planner.createPlan(analyzer.analyze("anything"), List.of(), "pg");

        assertThat(plan.isFallback()).isTrue();
        assertThat(plan.getSelectColumns()).containsExactly("COUNT(*) as count");
        assertThat(plan.getPlaceholderTable()).isEqualTo("default_table");
        assertThat(plan.getExecutionOrder()).containsExactly("fallback_20260315_083005");
        assertThat(plan.getComplexity()).isEqualTo(Complexity.LOW);
        assertThat(plan.allTables()).isEmpty();
    }

    @Test
    @DisplayName("plans are deterministic")
    void deterministic() {
        QueryContext ctx = analyzer.analyze("上月VIP用户的订单总数");
        List<TableCandidate> candidates = List.of(candidate(orders, 1.0, "amount"), candidate(users, 0.9));

        assertThat(planner.createPlan(ctx, candidates, "pg")).isEqualTo(planner.createPlan(ctx, candidates, "pg"));
    }

    @Test
    @DisplayName("join inference tolerates a plural parent name")
    void inferJoin() {
        assertThat(QueryPlanner.inferJoin(orders, users)).contains("orders.user_id = users.id");
        assertThat(QueryPlanner.inferJoin(users, orders)).contains("orders.user_id = users.id");
        assertThat(QueryPlanner.inferJoin(users, table("pg", "logs", 0, "message"))).isEmpty();
    }

    @Test
    @DisplayName("complexity grows with tables and joins")
    void complexity() {
        assertThat(QueryPlanner.complexity(2, 1)).isEqualTo(Complexity.LOW);
        assertThat(QueryPlanner.complexity(3, 1)).isEqualTo(Complexity.MEDIUM);
        assertThat(QueryPlanner.complexity(4, 3)).isEqualTo(Complexity.MEDIUM);
        assertThat(QueryPlanner.complexity(5, 2)).isEqualTo(Complexity.HIGH);
        assertThat(QueryPlanner.complexity(2, 4)).isEqualTo(Complexity.HIGH);
    }
}
