package com.queryroute.util;

import lombok.Builder;
import lombok.Value;

import java.util.Optional;

/**
 * JDBC settings resolved for one registered source.
 */
@Value
@Builder
public class JdbcConnectionInfo {
    String sourceId;
    String url;
    String username;
    String password;
    /** Normalized, see {@link DbTypeNormalizer}. */
    String dbType;

    /**
     * Driver the pool is pinned to. Empty leaves the choice to {@link java.sql.DriverManager}.
     */
    public Optional<String> driverClassName() {
        if ("postgres".equals(dbType)) {
            return Optional.of("org.postgresql.Driver");
        }
        if ("mysql".equals(dbType) || "doris".equals(dbType)) {
            return Optional.of("com.mysql.cj.jdbc.Driver");
        }
        return Optional.empty();
    }

    public String maskedUrl() {
        return DsnParser.mask(url);
    }

    @Override
    public String toString() {
        return sourceId + " [" + dbType + "] " + maskedUrl();
    }
}
