package com.queryroute.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum EtlQueryType {
    SELECT,
    AGGREGATE,
    SELECT_FOR_CHART;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
