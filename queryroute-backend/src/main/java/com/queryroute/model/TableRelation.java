package com.queryroute.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Declared parent/child relation between two tables of the same source.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TableRelation {
    private String parentTable;
    private String parentColumn;
    private String childTable;
    private String childColumn;

    public boolean connects(String tableA, String tableB) {
        return (parentTable.equalsIgnoreCase(tableA) && childTable.equalsIgnoreCase(tableB))
                || (parentTable.equalsIgnoreCase(tableB) && childTable.equalsIgnoreCase(tableA));
    }

    public String toJoinCondition() {
        return parentTable + "." + parentColumn + " = " + childTable + "." + childColumn;
    }
}
