package com.queryroute.routing;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Small helpers for the SQL fragments carried in a query plan.
 */
final class SqlFragments {
    private static final Pattern AGGREGATE = Pattern.compile("\\b(COUNT|SUM|AVG|MAX|MIN)\\s*\\(", Pattern.CASE_INSENSITIVE);
    private static final Pattern ALIAS = Pattern.compile("\\s+as\\s+([\\w]+)\\s*$", Pattern.CASE_INSENSITIVE);
    private static final Pattern QUALIFIER = Pattern.compile("(?<![\\w.'])([A-Za-z_][\\w]*)\\.[A-Za-z_*][\\w]*");
    private static final Pattern LIMIT = Pattern.compile("\\bLIMIT\\s+\\d+|\\bFETCH\\s+(FIRST|NEXT)\\s+\\d+|\\bTOP\\s+\\d+", Pattern.CASE_INSENSITIVE);

    private SqlFragments() {
    }

    static boolean isAggregate(String expr) {
        return AGGREGATE.matcher(expr).find();
    }

    /**
     * @return the {@code AS} alias, or the expression itself when it has none
     */
    static String alias(String expr) {
        Matcher m = ALIAS.matcher(expr);
        return m.find() ? m.group(1) : expr.trim();
    }

    /**
     * Table names used as column qualifiers ({@code t.col}) in a fragment, string literals excluded.
     */
    static Set<String> qualifiers(String fragment) {
        Set<String> tables = new LinkedHashSet<>();
        Matcher m = QUALIFIER.matcher(stripLiterals(fragment));
        while (m.find()) {
            tables.add(m.group(1).toLowerCase(Locale.ROOT));
        }
        return tables;
    }

    /**
     * @return whether every qualifier in the fragment names one of {@code tableNames}
     */
    static boolean onlyReferences(String fragment, Collection<String> tableNames) {
        Set<String> allowed = new LinkedHashSet<>();
        for (String t : tableNames) {
            allowed.add(t.toLowerCase(Locale.ROOT));
        }
        return allowed.containsAll(qualifiers(fragment));
    }

    static boolean hasRowLimit(String sql) {
        return LIMIT.matcher(stripLiterals(sql)).find();
    }

    static String quote(String value) {
        return "'" + value.replace("'", "''") + "'";
    }

    private static String stripLiterals(String s) {
        return s.replaceAll("'(?:[^']|'')*'", "''");
    }
}
