package com.queryroute.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ColumnDescriptor {
    private String name;
    private String displayName;
    private String dataType;

    public static ColumnDescriptor of(String name, String dataType) {
        return ColumnDescriptor.builder().name(name).dataType(dataType).build();
    }
}
