package com.queryroute.etl;

import com.queryroute.connector.OperationStep;
import com.queryroute.connector.OperationType;
import com.queryroute.connector.SourceQuery;
import com.queryroute.etl.EtlQueryRenderer.ResolvedFilters;
import com.queryroute.etl.RelativePeriodResolver.DateRange;
import com.queryroute.model.AggregateFunction;
import com.queryroute.model.AggregationConfig;
import com.queryroute.model.EtlInstructions;
import com.queryroute.model.EtlQueryType;
import com.queryroute.model.FilterConfig;
import com.queryroute.model.RegionMatchMode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("EtlQueryRenderer")
class EtlQueryRendererTest {
    private static final ResolvedFilters NONE = new ResolvedFilters(null, null, null, null, null);

    private static EtlInstructions regionalSum() {
        return EtlInstructions.builder()
                .queryType(EtlQueryType.AGGREGATE)
                .aggregations(List.of(AggregationConfig.builder()
                        .function(AggregateFunction.SUM).field("amount").groupBy(List.of("region")).build()))
                .filters(new ArrayList<>(List.of(
                        FilterConfig.builder().column("status").operator("like").value("paid").build(),
                        FilterConfig.builder().column("category").operator("IN").value(List.of("a", "b")).build())))
                .build();
    }

    @Nested
    @DisplayName("SQL")
    class Sql {

        @Test
        @DisplayName("aggregates with filters, time window and region prefix")
        void aggregate() {
            ResolvedFilters resolved = new ResolvedFilters("order_date",
                    new DateRange(LocalDate.of(2024, 1, 1), LocalDate.of(2024, 1, 31)),
                    "region", " East ", RegionMatchMode.STARTS_WITH);

            SourceQuery query = EtlQueryRenderer.render(regionalSum(), "sales", resolved, true);

            assertThat(query.getSql()).isEqualTo("SELECT SUM(amount) AS sum_amount, region FROM sales"
                    + " WHERE status LIKE '%paid%' AND category IN ('a', 'b')"
                    + " AND order_date >= '2024-01-01' AND order_date < '2024-02-01'"
                    + " AND region LIKE 'East%' GROUP BY region");
        }

        @Test
        @DisplayName("COUNT(*) is aliased count_all and HAVING names the aggregate itself")
        void countAll() {
            EtlInstructions instructions = EtlInstructions.builder()
                    .queryType(EtlQueryType.AGGREGATE)
                    .aggregations(List.of(AggregationConfig.builder().function(AggregateFunction.COUNT).field("*")
                            .groupBy(List.of("city")).havingCondition("count_all > 2").build()))
                    .build();

            assertThat(EtlQueryRenderer.render(instructions, "t", NONE, true).getSql())
                    .isEqualTo("SELECT COUNT(*) AS count_all, city FROM t GROUP BY city HAVING COUNT(*) > 2");
        }

        @Test
        @DisplayName("selects list the source fields, or * when there are none")
        void select() {
            EtlInstructions fields = EtlInstructions.builder().queryType(EtlQueryType.SELECT_FOR_CHART)
                    .sourceFields(List.of("day", "total")).build();
            EtlInstructions all = EtlInstructions.builder().queryType(EtlQueryType.SELECT).build();

            assertThat(EtlQueryRenderer.render(fields, "t", NONE, true).getSql()).isEqualTo("SELECT day, total FROM t ORDER BY day");
            assertThat(EtlQueryRenderer.render(all, "t", NONE, true).getSql()).isEqualTo("SELECT * FROM t");
        }
    }

    @Nested
    @DisplayName("Predicates")
    class Predicates {

        @Test
        @DisplayName("null values become IS NULL and IS NOT NULL")
        void nulls() {
            assertThat(EtlQueryRenderer.predicate(FilterConfig.builder().column("c").build())).isEqualTo("c IS NULL");
            assertThat(EtlQueryRenderer.predicate(FilterConfig.builder().column("c").operator("!=").build())).isEqualTo("c IS NOT NULL");
        }

        @Test
        @DisplayName("literals are quoted and escaped, numbers are not")
        void literals() {
            assertThat(EtlQueryRenderer.predicate(FilterConfig.builder().column("name").value("O'Brien").build()))
                    .isEqualTo("name = 'O''Brien'");
            assertThat(EtlQueryRenderer.predicate(FilterConfig.builder().column("n").operator(">=").value(10).build()))
                    .isEqualTo("n >= 10");
            assertThat(EtlQueryRenderer.predicate(FilterConfig.builder().column("n").operator("IN").value(List.of()).build()))
                    .isEqualTo("1 = 0");
        }

        @Test
        @DisplayName("unknown operators are rejected")
        void badOperator() {
            assertThatThrownBy(() -> EtlQueryRenderer.normalizeOperator("; DROP"))
                    .isInstanceOf(InvalidInstructionException.class);
        }
    }

    @Test
    @DisplayName("flat-file sources get an operation sequence")
    void operations() {
        ResolvedFilters resolved = new ResolvedFilters(null, null, "region", "East", RegionMatchMode.CONTAINS);

        SourceQuery query = EtlQueryRenderer.render(regionalSum(), "sales", resolved, false);

        assertThat(query.isSql()).isFalse();
        List<OperationStep> steps = query.getOperations();
        assertThat(steps).extracting(OperationStep::getType).containsExactly(
                OperationType.LOAD, OperationType.FILTER, OperationType.FILTER, OperationType.FILTER, OperationType.AGGREGATE);
        assertThat(steps.get(3).getFilter().getValue()).isEqualTo("%East%");
        assertThat(steps.get(4).getGroupBy()).containsExactly("region");
    }
}
