package com.queryroute.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class EtlOptions {
    /** Skip table description; instructions are not checked against the table's columns. */
    private boolean namesOnly;
    private Long timeoutMs;

    public static EtlOptions defaults() {
        return new EtlOptions();
    }
}
