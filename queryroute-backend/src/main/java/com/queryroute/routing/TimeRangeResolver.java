package com.queryroute.routing;

import com.queryroute.model.TimeRange;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.Optional;

/**
 * Resolves a recognized {@link TimeRange} to fixed bounds against the clock, so the rendered predicate
 * compares the time column with plain literals every source understands.
 */
public class TimeRangeResolver {
    static final DateTimeFormatter LITERAL = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");
    static final DateTimeFormatter DATE = DateTimeFormatter.ISO_LOCAL_DATE;

    private final Clock clock;

    public TimeRangeResolver(Clock clock) {
        this.clock = clock;
    }

    /**
     * Half-open window {@code [start, end)}.
     */
    public record Bounds(LocalDateTime start, LocalDateTime end) {

        public String startLiteral() {
            return "'" + LITERAL.format(start) + "'";
        }

        public String endLiteral() {
            return "'" + LITERAL.format(end) + "'";
        }

        /**
         * Unquoted start for text comparison with cells. Midnight is written as the bare date so that
         * date-only cells on the first day stay inside the window.
         */
        public String startValue() {
            return value(start);
        }

        public String endValue() {
            return value(end);
        }

        private static String value(LocalDateTime t) {
            return t.toLocalTime().equals(LocalTime.MIDNIGHT) ? DATE.format(t) : LITERAL.format(t);
        }
    }

    /**
     * @return bounds for the built-in labels; empty for labels only a custom vocabulary knows
     */
    public Optional<Bounds> resolve(TimeRange range) {
        if (range == null || range.getLabel() == null) {
            return Optional.empty();
        }
        LocalDateTime now = LocalDateTime.now(clock).truncatedTo(ChronoUnit.SECONDS);
        LocalDate today = now.toLocalDate();
        int amount = range.getAmount() != null ? range.getAmount() : 1;
        switch (range.getLabel()) {
            case "last_n_days":
                return Optional.of(new Bounds(now.minusDays(amount), now));
            case "last_n_months":
                return Optional.of(new Bounds(now.minusMonths(amount), now));
            case "last_n_years":
                return Optional.of(new Bounds(now.minusYears(amount), now));
            case "today":
                return days(today, today.plusDays(1));
            case "yesterday":
                return days(today.minusDays(1), today);
            case "this_month":
                return days(today.withDayOfMonth(1), today.withDayOfMonth(1).plusMonths(1));
            case "last_month":
                return days(today.withDayOfMonth(1).minusMonths(1), today.withDayOfMonth(1));
            case "this_year":
                return days(today.withDayOfYear(1), today.withDayOfYear(1).plusYears(1));
            case "last_year":
                return days(today.withDayOfYear(1).minusYears(1), today.withDayOfYear(1));
            default:
                return Optional.empty();
        }
    }

    private static Optional<Bounds> days(LocalDate start, LocalDate end) {
        return Optional.of(new Bounds(start.atStartOfDay(), end.atStartOfDay()));
    }
}
