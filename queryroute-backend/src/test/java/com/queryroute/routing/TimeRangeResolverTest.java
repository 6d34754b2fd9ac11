package com.queryroute.routing;

import com.queryroute.model.TimeRange;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("TimeRangeResolver")
class TimeRangeResolverTest {

    private final TimeRangeResolver resolver =
            new TimeRangeResolver(Clock.fixed(Instant.parse("2026-01-10T14:20:30.500Z"), ZoneOffset.UTC));

    private static TimeRange range(String label, Integer amount) {
        return new TimeRange(label, "start", "end", amount);
    }

    @Test
    @DisplayName("calendar windows start and end at midnight")
    void calendarWindows() {
        TimeRangeResolver.Bounds lastMonth = resolver.resolve(range("last_month", null)).orElseThrow();
        assertThat(lastMonth.startLiteral()).isEqualTo("'2025-12-01 00:00:00'");
        assertThat(lastMonth.endLiteral()).isEqualTo("'2026-01-01 00:00:00'");

        TimeRangeResolver.Bounds lastYear = resolver.resolve(range("last_year", null)).orElseThrow();
        assertThat(lastYear.startLiteral()).isEqualTo("'2025-01-01 00:00:00'");
        assertThat(lastYear.endLiteral()).isEqualTo("'2026-01-01 00:00:00'");

        TimeRangeResolver.Bounds today = resolver.resolve(range("today", null)).orElseThrow();
        assertThat(today.startLiteral()).isEqualTo("'2026-01-10 00:00:00'");
        assertThat(today.endLiteral()).isEqualTo("'2026-01-11 00:00:00'");
    }

    @Test
    @DisplayName("rolling windows count back from now")
    void rollingWindows() {
        TimeRangeResolver.Bounds days = resolver.resolve(range("last_n_days", 7)).orElseThrow();

        assertThat(days.startLiteral()).isEqualTo("'2026-01-03 14:20:30'");
        assertThat(days.endLiteral()).isEqualTo("'2026-01-10 14:20:30'");
        assertThat(resolver.resolve(range("last_n_months", 3)).orElseThrow().startLiteral())
                .isEqualTo("'2025-10-10 14:20:30'");
    }

    @Test
    @DisplayName("filter values drop the time of day at midnight")
    void filterValues() {
        TimeRangeResolver.Bounds lastMonth = resolver.resolve(range("last_month", null)).orElseThrow();
        TimeRangeResolver.Bounds days = resolver.resolve(range("last_n_days", 7)).orElseThrow();

        assertThat(lastMonth.startValue()).isEqualTo("2025-12-01");
        assertThat(lastMonth.endValue()).isEqualTo("2026-01-01");
        assertThat(days.startValue()).isEqualTo("2026-01-03 14:20:30");
    }

    @Test
    @DisplayName("labels it does not know stay unresolved")
    void unknownLabel() {
        assertThat(resolver.resolve(range("fiscal_quarter", null))).isEmpty();
        assertThat(resolver.resolve(null)).isEmpty();
    }
}
