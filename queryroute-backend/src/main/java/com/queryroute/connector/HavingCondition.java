package com.queryroute.connector;

import lombok.Value;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parsed HAVING condition: {@code <alias|FN(field)> <op> <number>}. Nothing else is accepted.
 */
@Value
public class HavingCondition {
    private static final Pattern PATTERN = Pattern.compile(
            "^\\s*([A-Za-z_][\\w]*(?:\\s*\\(\\s*[A-Za-z_*][\\w]*\\s*\\))?)\\s*(>=|<=|!=|<>|=|>|<)\\s*(-?\\d+(?:\\.\\d+)?)\\s*$");

    /** Alias, or call with whitespace removed such as {@code sum(amount)}. */
    String expression;
    String operator;
    String threshold;

    public static Optional<HavingCondition> parse(String condition) {
        if (condition == null) {
            return Optional.empty();
        }
        Matcher m = PATTERN.matcher(condition);
        if (!m.matches()) {
            return Optional.empty();
        }
        return Optional.of(new HavingCondition(m.group(1).replaceAll("\\s+", ""), m.group(2), m.group(3)));
    }

    public boolean isCall() {
        return expression.indexOf('(') >= 0;
    }

    /**
     * @return function name of a call, e.g. {@code sum}; null for an alias
     */
    public String function() {
        return isCall() ? expression.substring(0, expression.indexOf('(')) : null;
    }

    /**
     * @return argument of a call, a column or {@code *}; null for an alias
     */
    public String argument() {
        return isCall() ? expression.substring(expression.indexOf('(') + 1, expression.length() - 1) : null;
    }
}
