package com.queryroute.etl;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.Locale;

/**
 * Turns a named reporting period into an inclusive date range.
 */
@Slf4j
@Component
public class RelativePeriodResolver {
    private final Clock clock;

    public RelativePeriodResolver(Clock clock) {
        this.clock = clock;
    }

    /**
     * Supported names: today, yesterday, this_month, last_month, this_year, last_year. Anything else
     * resolves to this_month.
     */
    public DateRange resolve(String period) {
        LocalDate today = LocalDate.now(clock);
        String key = period == null ? "" : period.trim().toLowerCase(Locale.ROOT);
        switch (key) {
            case "today":
                return new DateRange(today, today);
            case "yesterday":
                return new DateRange(today.minusDays(1), today.minusDays(1));
            case "last_month": {
                LocalDate first = today.withDayOfMonth(1).minusMonths(1);
                return new DateRange(first, first.withDayOfMonth(first.lengthOfMonth()));
            }
            case "this_year":
                return new DateRange(today.withDayOfYear(1), today.withMonth(12).withDayOfMonth(31));
            case "last_year": {
                LocalDate first = today.withDayOfYear(1).minusYears(1);
                return new DateRange(first, first.withMonth(12).withDayOfMonth(31));
            }
            case "this_month":
                return thisMonth(today);
            default:
                log.debug("Unknown relative period, using this_month: period={}", period);
                return thisMonth(today);
        }
    }

    private static DateRange thisMonth(LocalDate today) {
        return new DateRange(today.withDayOfMonth(1), today.withDayOfMonth(today.lengthOfMonth()));
    }

    /**
     * Inclusive calendar range. Either end may be null when the caller only bounds one side.
     */
    public record DateRange(LocalDate start, LocalDate end) {

        public static DateRange parse(String start, String end) {
            return new DateRange(parseDate(start), parseDate(end));
        }

        /**
         * @return the day after {@link #end()}, used as an exclusive upper bound
         */
        public LocalDate endExclusive() {
            return end == null ? null : end.plusDays(1);
        }

        private static LocalDate parseDate(String value) {
            if (value == null || value.isBlank()) {
                return null;
            }
            String v = value.trim();
            try {
                return LocalDate.parse(v.length() > 10 ? v.substring(0, 10) : v);
            } catch (DateTimeParseException e) {
                throw new IllegalArgumentException("Invalid date: " + value, e);
            }
        }
    }
}
