package com.queryroute.util;

import com.queryroute.model.SourceDefinition;
import org.springframework.stereotype.Component;

/**
 * Resolves a registered source into JDBC connection settings.
 *
 * <p>An explicit {@code jdbcUrl} is used as-is; otherwise the DSN is mapped per database type.
 */
@Component
public class JdbcConnectionInfoResolver {

    public JdbcConnectionInfo resolve(SourceDefinition source) {
        String declaredType = DbTypeNormalizer.normalize(source.getType());
        if (source.getJdbcUrl() != null && !source.getJdbcUrl().isBlank()) {
            String dbType = !declaredType.isBlank() ? declaredType : typeFromJdbcUrl(source.getJdbcUrl());
            return JdbcConnectionInfo.builder()
                    .sourceId(source.getId())
                    .url(source.getJdbcUrl())
                    .username(source.getUsername())
                    .password(source.getPassword())
                    .dbType(dbType)
                    .build();
        }

        DsnParser.ParsedDsn parsed = DsnParser.parse(source.getDsn(), declaredType);
        String dbType = parsed.getDbType();
        return JdbcConnectionInfo.builder()
                .sourceId(source.getId())
                .url(buildJdbcUrl(dbType, parsed))
                .username(firstNonBlank(source.getUsername(), parsed.getUsername()))
                .password(firstNonBlank(source.getPassword(), parsed.getPassword()))
                .dbType(dbType)
                .build();
    }

    private String buildJdbcUrl(String dbType, DsnParser.ParsedDsn parsed) {
        String database = parsed.getDatabase() != null ? parsed.getDatabase() : "";
        switch (dbType) {
            case "postgres":
                return String.format("jdbc:postgresql://%s:%d/%s", parsed.getHost(), portOr(parsed, 5432), database);
            case "mysql":
                return String.format("jdbc:mysql://%s:%d/%s", parsed.getHost(), portOr(parsed, 3306), database);
            case "doris":
                // Doris speaks the MySQL protocol on its query port
                return String.format("jdbc:mysql://%s:%d/%s", parsed.getHost(), portOr(parsed, 9030), database);
            case "oracle":
                return buildOracleJdbcUrl(parsed);
            case "sqlserver":
                return String.format("jdbc:sqlserver://%s:%d;databaseName=%s", parsed.getHost(), portOr(parsed, 1433), database);
            default:
                throw new IllegalArgumentException("Unsupported database type: " + dbType);
        }
    }

    private String buildOracleJdbcUrl(DsnParser.ParsedDsn parsed) {
        String sid = parsed.getParams().get("sid");
        if (sid != null && !sid.isEmpty()) {
            return String.format("jdbc:oracle:thin:@%s:%d:%s", parsed.getHost(), portOr(parsed, 1521), sid);
        }
        if (parsed.getPort() == -1 && (parsed.getDatabase() == null || parsed.getDatabase().isEmpty())) {
            // TNS alias
            return String.format("jdbc:oracle:thin:@%s", parsed.getHost());
        }
        return String.format("jdbc:oracle:thin:@//%s:%d/%s", parsed.getHost(), portOr(parsed, 1521), parsed.getDatabase());
    }

    static String typeFromJdbcUrl(String jdbcUrl) {
        String[] parts = jdbcUrl.split(":");
        return parts.length > 1 ? DbTypeNormalizer.normalize(parts[1]) : "";
    }

    private static int portOr(DsnParser.ParsedDsn parsed, int defaultPort) {
        return parsed.getPort() > 0 ? parsed.getPort() : defaultPort;
    }

    private static String firstNonBlank(String preferred, String fallback) {
        return preferred != null && !preferred.isBlank() ? preferred : fallback;
    }

}
