package com.queryroute.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum OutputFormat {
    SCALAR,
    ARRAY,
    JSON,
    DATAFRAME;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
