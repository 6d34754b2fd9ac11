package com.queryroute.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Kind of report placeholder an ETL instruction set is planned for.
 */
public enum PlaceholderCategory {
    STATISTIC,
    CHART,
    PERIOD,
    REGION;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
