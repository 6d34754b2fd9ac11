package com.queryroute.util;

import java.util.Locale;
import java.util.Map;

/**
 * Maps the source types found in the registry (and their aliases) onto canonical names.
 */
public final class DbTypeNormalizer {

    private static final Map<String, String> ALIASES = Map.ofEntries(
            Map.entry("postgresql", "postgres"),
            Map.entry("pg", "postgres"),
            Map.entry("mariadb", "mysql"),
            Map.entry("mssql", "sqlserver"),
            Map.entry("sql_server", "sqlserver"),
            Map.entry("file", "csv"),
            Map.entry("flatfile", "csv")
    );

    private DbTypeNormalizer() {
    }

    /**
     * @param dbType incoming type, may be null
     * @return lowercased, alias-resolved type; empty string when blank
     */
    public static String normalize(String dbType) {
        if (dbType == null) {
            return "";
        }
        String v = dbType.trim().toLowerCase(Locale.ROOT);
        return ALIASES.getOrDefault(v, v);
    }

    public static boolean isFlatFile(String dbType) {
        return "csv".equals(normalize(dbType));
    }

    /**
     * Oracle and SQL Server page with {@code OFFSET .. FETCH}; everything else understands {@code LIMIT}.
     */
    public static boolean usesFetchFirst(String dbType) {
        String v = normalize(dbType);
        return "oracle".equals(v) || "sqlserver".equals(v);
    }
}
