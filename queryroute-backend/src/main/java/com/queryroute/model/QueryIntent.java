package com.queryroute.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Inferred purpose of a data request.
 */
public enum QueryIntent {
    STATISTICAL,
    DETAIL,
    TREND,
    COMPARISON,
    AGGREGATION,
    JOIN;

    /**
     * Whether the intent asks for aggregated figures rather than rows.
     *
     * @return true for statistical and aggregation intents
     */
    public boolean isAggregating() {
        return this == STATISTICAL || this == AGGREGATION;
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
