package com.queryroute.etl;

import com.queryroute.model.AggregateFunction;
import com.queryroute.model.AggregationConfig;
import com.queryroute.model.EtlInstructions;
import com.queryroute.model.EtlQueryType;
import com.queryroute.model.TabularData;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

final class OutputShaper {

    private OutputShaper() {
    }

    /**
     * Shapes the result per output format: scalar, array, json or dataframe.
     */
    static Object shape(TabularData data, EtlInstructions instructions) {
        switch (instructions.getOutputFormat()) {
            case SCALAR:
                return scalar(data, instructions);
            case ARRAY:
                if (data.getColumns().size() == 1) {
                    String column = data.getColumns().get(0);
                    List<Object> values = new ArrayList<>(data.rowCount());
                    data.getRows().forEach(row -> values.add(row.get(column)));
                    return values;
                }
                return rowMaps(data);
            case JSON:
                return rowMaps(data);
            case DATAFRAME:
            default:
                return data;
        }
    }

    private static Object scalar(TabularData data, EtlInstructions instructions) {
        Object value = null;
        if (!data.isEmpty() && !data.getColumns().isEmpty()) {
            value = data.cell(0, data.getColumns().get(0));
        }
        if (value == null && instructions.getQueryType() == EtlQueryType.AGGREGATE) {
            AggregationConfig agg = instructions.primaryAggregation();
            if (agg != null && (agg.getFunction() == AggregateFunction.SUM || agg.getFunction() == AggregateFunction.COUNT)) {
                return 0L;
            }
        }
        return value;
    }

    private static List<Map<String, Object>> rowMaps(TabularData data) {
        List<Map<String, Object>> rows = new ArrayList<>(data.rowCount());
        data.getRows().forEach(row -> rows.add(new LinkedHashMap<>(row)));
        return rows;
    }
}
