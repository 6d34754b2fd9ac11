package com.queryroute.etl;

import com.queryroute.model.AggregationConfig;
import com.queryroute.model.EtlInstructions;
import com.queryroute.model.EtlQueryType;
import com.queryroute.model.OutputFormat;
import com.queryroute.model.TabularData;

import java.util.Map;

/**
 * Scores how much an ETL result can be trusted, between 0.1 and 1.0.
 */
final class ConfidenceCalculator {
    static final double MIN = 0.1;
    static final double MAX = 1.0;

    private ConfidenceCalculator() {
    }

    static double calculate(EtlInstructions instructions, TabularData data, Object processedValue) {
        double confidence = 1.0;

        if (effectivelyEmpty(instructions, data)) {
            confidence *= 0.1;
        }
        if (nullRatio(data) > 0.5) {
            confidence *= 0.7;
        }
        double complexity = instructions.getFilters().size() * 0.1
                + instructions.getAggregations().size() * 0.2
                + instructions.getTransformations().size() * 0.1;
        if (complexity > 1.0) {
            confidence *= 0.9;
        }
        if (instructions.getOutputFormat() == OutputFormat.SCALAR && processedValue == null) {
            confidence *= 0.5;
        }
        return Math.max(MIN, Math.min(MAX, confidence));
    }

    private static boolean effectivelyEmpty(EtlInstructions instructions, TabularData data) {
        if (data == null || data.isEmpty()) {
            return true;
        }
        if (instructions.getQueryType() != EtlQueryType.AGGREGATE || instructions.getAggregations().isEmpty()) {
            return false;
        }
        for (Map<String, Object> row : data.getRows()) {
            for (AggregationConfig agg : instructions.getAggregations()) {
                for (Map.Entry<String, Object> cell : row.entrySet()) {
                    if (cell.getKey().equalsIgnoreCase(agg.alias()) && cell.getValue() != null) {
                        return false;
                    }
                }
            }
        }
        return true;
    }

    static double nullRatio(TabularData data) {
        if (data == null || data.isEmpty() || data.getColumns().isEmpty()) {
            return 0.0;
        }
        long cells = 0;
        long nulls = 0;
        for (Map<String, Object> row : data.getRows()) {
            for (String column : data.getColumns()) {
                cells++;
                if (row.get(column) == null) {
                    nulls++;
                }
            }
        }
        return (double) nulls / cells;
    }
}
