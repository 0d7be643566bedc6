package com.baykanat.insider.analytics.domain.query;

import com.baykanat.insider.analytics.domain.model.BucketGranularity;
import com.baykanat.insider.analytics.domain.model.TimeSpec;
import com.baykanat.insider.analytics.domain.model.TimeWindow;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for TimeWindowResolver.
 *
 * <p>The clock is fixed at Wednesday 2025-03-12 10:15:30.5 UTC so every bound is deterministic.
 */
class TimeWindowResolverTest {

    private static final Instant NOW = Instant.parse("2025-03-12T10:15:30.500Z");
    private static final Instant NOW_SECONDS = Instant.parse("2025-03-12T10:15:30Z");
    private static final ZoneId UTC = ZoneId.of("UTC");

    private TimeWindowResolver resolver;

    @BeforeEach
    void setUp() {
        resolver = new TimeWindowResolver(Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    @DisplayName("Date range ending today should be bounded by now, not by midnight")
    void dateRangeEndingTodayIsClampedToNow() {
        TimeWindow window = resolver.resolve(
                TimeSpec.dateRange(LocalDate.of(2025, 3, 1), LocalDate.of(2025, 3, 12)), UTC);

        assertThat(window.getLowerBound()).isEqualTo(Instant.parse("2025-03-01T00:00:00Z"));
        assertThat(window.isLowerInclusive()).isTrue();
        assertThat(window.getUpperBound()).isEqualTo(NOW_SECONDS);
        assertThat(window.isUpperInclusive()).isFalse();
    }

    @Test
    @DisplayName("Date range ending in the future should also be clamped to now")
    void dateRangeEndingInFutureIsClampedToNow() {
        TimeWindow window = resolver.resolve(
                TimeSpec.dateRange(LocalDate.of(2025, 3, 10), LocalDate.of(2025, 3, 20)), UTC);

        assertThat(window.getUpperBound()).isEqualTo(NOW_SECONDS);
    }

    @Test
    @DisplayName("Date range in the past should end at the start of the day after endDate")
    void pastDateRangeEndsAtNextMidnight() {
        TimeWindow window = resolver.resolve(
                TimeSpec.dateRange(LocalDate.of(2025, 3, 1), LocalDate.of(2025, 3, 5)), UTC);

        assertThat(window.getUpperBound()).isEqualTo(Instant.parse("2025-03-06T00:00:00Z"));
        assertThat(window.isUpperInclusive()).isFalse();
    }

    @Test
    @DisplayName("Date range should be interpreted in the caller's timezone")
    void dateRangeUsesCallerTimezone() {
        TimeWindow window = resolver.resolve(
                TimeSpec.dateRange(LocalDate.of(2025, 3, 1), LocalDate.of(2025, 3, 5)),
                ZoneId.of("Europe/Istanbul"));

        assertThat(window.getLowerBound()).isEqualTo(Instant.parse("2025-02-28T21:00:00Z"));
        assertThat(window.getUpperBound()).isEqualTo(Instant.parse("2025-03-05T21:00:00Z"));
    }

    @Test
    @DisplayName("pastMinutes should be an interval open at the past end and closed at now")
    void pastMinutesWindow() {
        TimeWindow window = resolver.resolve(TimeSpec.pastMinutes(30), UTC);

        assertThat(window.getLowerBound()).isEqualTo(Instant.parse("2025-03-12T09:45:30Z"));
        assertThat(window.isLowerInclusive()).isFalse();
        assertThat(window.getUpperBound()).isEqualTo(NOW_SECONDS);
        assertThat(window.isUpperInclusive()).isTrue();
    }

    @Test
    @DisplayName("pastMinutes range should be bounded by both offsets from now")
    void pastMinutesRangeWindow() {
        TimeWindow window = resolver.resolve(TimeSpec.pastMinutesRange(60, 30), UTC);

        assertThat(window.getLowerBound()).isEqualTo(Instant.parse("2025-03-12T09:15:30Z"));
        assertThat(window.getUpperBound()).isEqualTo(Instant.parse("2025-03-12T09:45:30Z"));
    }

    @Test
    @DisplayName("Week period should start on the previous Sunday")
    void weekPeriodStartsOnSunday() {
        TimeWindow window = resolver.resolve(TimeSpec.calendarPeriod(BucketGranularity.WEEK), UTC);

        assertThat(window.getLowerBound()).isEqualTo(Instant.parse("2025-03-09T00:00:00Z"));
        assertThat(window.isLowerInclusive()).isTrue();
        assertThat(window.getUpperBound()).isEqualTo(NOW_SECONDS);
    }

    @Test
    @DisplayName("Hour, month and year periods should start at the calendar boundary")
    void calendarPeriodStarts() {
        assertThat(resolver.resolve(TimeSpec.calendarPeriod(BucketGranularity.HOUR), UTC).getLowerBound())
                .isEqualTo(Instant.parse("2025-03-12T10:00:00Z"));
        assertThat(resolver.resolve(TimeSpec.calendarPeriod(BucketGranularity.MONTH), UTC).getLowerBound())
                .isEqualTo(Instant.parse("2025-03-01T00:00:00Z"));
        assertThat(resolver.resolve(TimeSpec.calendarPeriod(BucketGranularity.YEAR), UTC).getLowerBound())
                .isEqualTo(Instant.parse("2025-01-01T00:00:00Z"));
    }

    @Test
    @DisplayName("Sub-hour granularities are not calendar periods")
    void minuteIsNotACalendarPeriod() {
        assertThatThrownBy(() -> resolver.resolve(TimeSpec.calendarPeriod(BucketGranularity.MINUTE), UTC))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("All-time should produce no time predicate and no gap fill")
    void allTimeHasNoBoundsAndNoFill() {
        TimeWindow window = resolver.resolve(TimeSpec.allTime(), UTC);

        assertThat(window.isBounded()).isFalse();
        assertThat(resolver.whereFragment(window).isEmpty()).isTrue();
        assertThat(resolver.gapFillPlan(window, BucketGranularity.DAY, UTC)).isEmpty();
        assertThat(resolver.fillClause(window, BucketGranularity.DAY, UTC).isEmpty()).isTrue();
    }

    @Test
    @DisplayName("WHERE fragment should render inclusive and exclusive comparisons")
    void whereFragmentRendersComparisons() {
        TimeWindow window = resolver.resolve(
                TimeSpec.dateRange(LocalDate.of(2025, 3, 1), LocalDate.of(2025, 3, 12)), UTC);

        SqlFragment where = resolver.whereFragment(window);

        assertThat(where.getSql()).isEqualTo(
                "AND timestamp >= toDateTime(?, 'UTC') AND timestamp < toDateTime(?, 'UTC')");
        assertThat(where.getArgs()).containsExactly("2025-03-01 00:00:00", "2025-03-12 10:15:30");
    }

    @Test
    @DisplayName("Gap fill should start at the bucketed lower bound and stop before the upper bound")
    void fillClauseUsesBucketExpression() {
        TimeWindow window = resolver.resolve(
                TimeSpec.dateRange(LocalDate.of(2025, 3, 1), LocalDate.of(2025, 3, 12)), UTC);

        SqlFragment fill = resolver.fillClause(window, BucketGranularity.DAY, ZoneId.of("Europe/Istanbul"));

        assertThat(fill.getSql()).isEqualTo(
                "WITH FILL FROM toDateTime(toStartOfDay(toTimeZone(toDateTime(?, 'UTC'), ?)), ?)"
                        + " TO toTimeZone(toDateTime(?, 'UTC'), ?)"
                        + " STEP INTERVAL 1 DAY");
        assertThat(fill.getArgs()).containsExactly(
                "2025-03-01 00:00:00", "Europe/Istanbul", "Europe/Istanbul",
                "2025-03-12 10:15:30", "Europe/Istanbul");
    }
}
