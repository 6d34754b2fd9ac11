package com.queryroute.connector;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class JdbcPoolSettings {
    @Builder.Default
    int maximumPoolSize = 5;
    @Builder.Default
    int minimumIdle = 0;
    @Builder.Default
    long connectionTimeoutMs = 5000;
    @Builder.Default
    long idleTimeoutMs = 60000;

    public static JdbcPoolSettings defaults() {
        return JdbcPoolSettings.builder().build();
    }
}
