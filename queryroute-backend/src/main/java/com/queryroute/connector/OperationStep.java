package com.queryroute.connector;

import com.queryroute.model.AggregationConfig;
import com.queryroute.model.FilterConfig;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * One step of a declarative query run by sources that do not speak SQL.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OperationStep {
    private OperationType type;
    /** LOAD */
    private String table;
    /** FILTER */
    private FilterConfig filter;
    /** AGGREGATE */
    private List<String> groupBy;
    private List<AggregationConfig> aggregations;
    private String having;
    /** SELECT */
    private List<String> columns;
    /** ORDER_BY */
    private String orderBy;
    private boolean descending;
    /** OFFSET, LIMIT */
    private int count;

    public static OperationStep load(String table) {
        return OperationStep.builder().type(OperationType.LOAD).table(table).build();
    }

    public static OperationStep filter(FilterConfig filter) {
        return OperationStep.builder().type(OperationType.FILTER).filter(filter).build();
    }

    public static OperationStep aggregate(List<AggregationConfig> aggregations, List<String> groupBy, String having) {
        return OperationStep.builder()
                .type(OperationType.AGGREGATE)
                .aggregations(aggregations)
                .groupBy(groupBy)
                .having(having)
                .build();
    }

    public static OperationStep select(List<String> columns) {
        return OperationStep.builder().type(OperationType.SELECT).columns(columns).build();
    }

    public static OperationStep orderBy(String column, boolean descending) {
        return OperationStep.builder().type(OperationType.ORDER_BY).orderBy(column).descending(descending).build();
    }

    public static OperationStep offset(int count) {
        return OperationStep.builder().type(OperationType.OFFSET).count(count).build();
    }

    public static OperationStep limit(int count) {
        return OperationStep.builder().type(OperationType.LIMIT).count(count).build();
    }

    public String describe() {
        switch (type) {
            case LOAD:
                return "LOAD " + table;
            case FILTER:
                return "FILTER " + filter.getColumn() + " " + filter.getOperator() + " " + filter.getValue();
            case AGGREGATE:
                StringBuilder sb = new StringBuilder("AGGREGATE");
                for (AggregationConfig agg : aggregations) {
                    sb.append(' ').append(agg.getFunction().wireName()).append('(').append(agg.getField()).append(')');
                }
                if (groupBy != null && !groupBy.isEmpty()) {
                    sb.append(" BY ").append(String.join(", ", groupBy));
                }
                if (having != null && !having.isBlank()) {
                    sb.append(" HAVING ").append(having);
                }
                return sb.toString();
            case SELECT:
                return "SELECT " + String.join(", ", columns);
            case ORDER_BY:
                return "ORDER_BY " + orderBy + (descending ? " DESC" : "");
            default:
                return type + " " + count;
        }
    }
}
