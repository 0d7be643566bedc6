package com.baykanat.insider.analytics.domain.query;

import com.baykanat.insider.analytics.domain.model.BucketGranularity;
import com.baykanat.insider.analytics.domain.model.GapFillPlan;
import com.baykanat.insider.analytics.domain.model.TimeSpec;
import com.baykanat.insider.analytics.domain.model.TimeWindow;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.DayOfWeek;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.time.temporal.TemporalAdjusters;
import java.util.Optional;

/**
 * TimeSpec'i istemcinin saat diliminden UTC sınırlarına çevirir; WHERE parçası ve gap-fill planı üretir.
 *
 * <p>"Şimdi" enjekte edilen {@link Clock}'tan alınır ve saniyeye kesilir (events.timestamp DateTime).
 */
@Component
@RequiredArgsConstructor
public class TimeWindowResolver {

    static final String TIMESTAMP_COLUMN = "timestamp";

    private static final DateTimeFormatter DATE_TIME = DateTimeFormatter
            .ofPattern("yyyy-MM-dd HH:mm:ss")
            .withZone(ZoneOffset.UTC);

    private final Clock clock;

    public TimeWindow resolve(TimeSpec spec, ZoneId zone) {
        Instant now = clock.instant().truncatedTo(ChronoUnit.SECONDS);

        return switch (spec.getKind()) {
            case ALL_TIME -> TimeWindow.unbounded();
            case DATE_RANGE -> dateRange(spec, zone, now);
            case PAST_MINUTES -> TimeWindow.builder()
                    .lowerBound(now.minus(Duration.ofMinutes(spec.getPastMinutes())))
                    .upperBound(now)
                    .upperInclusive(true)
                    .build();
            case PAST_MINUTES_RANGE -> TimeWindow.builder()
                    .lowerBound(now.minus(Duration.ofMinutes(spec.getPastMinutesStart())))
                    .upperBound(now.minus(Duration.ofMinutes(spec.getPastMinutesEnd())))
                    .upperInclusive(true)
                    .build();
            case CALENDAR_PERIOD -> TimeWindow.builder()
                    .lowerBound(periodStart(spec.getCalendarPeriod(), zone, now))
                    .lowerInclusive(true)
                    .upperBound(now)
                    .build();
        };
    }

    /** Devam eden gün gece yarısıyla değil, şimdiyle sınırlanır. */
    private TimeWindow dateRange(TimeSpec spec, ZoneId zone, Instant now) {
        LocalDate today = LocalDate.ofInstant(now, zone);
        Instant upper = spec.getEndDate().isBefore(today)
                ? spec.getEndDate().plusDays(1).atStartOfDay(zone).toInstant()
                : now;

        return TimeWindow.builder()
                .lowerBound(spec.getStartDate().atStartOfDay(zone).toInstant())
                .lowerInclusive(true)
                .upperBound(upper)
                .build();
    }

    /** Haftalar toStartOfWeek ile aynı şekilde pazar günü başlar. */
    private Instant periodStart(BucketGranularity period, ZoneId zone, Instant now) {
        LocalDate today = LocalDate.ofInstant(now, zone);
        return switch (period) {
            case HOUR -> now.atZone(zone).truncatedTo(ChronoUnit.HOURS).toInstant();
            case DAY -> today.atStartOfDay(zone).toInstant();
            case WEEK -> today.with(TemporalAdjusters.previousOrSame(DayOfWeek.SUNDAY)).atStartOfDay(zone).toInstant();
            case MONTH -> today.withDayOfMonth(1).atStartOfDay(zone).toInstant();
            case YEAR -> today.withDayOfYear(1).atStartOfDay(zone).toInstant();
            default -> throw new IllegalArgumentException("Not a calendar period: " + period.getValue());
        };
    }

    /** "AND timestamp ..." parçası; all-time için boş. Sınırlar "?" ile bağlanır. */
    public SqlFragment whereFragment(TimeWindow window) {
        if (!window.isBounded()) {
            return SqlFragment.empty();
        }
        return SqlFragment.format("AND %1$s %2$s %3$s AND %1$s %4$s %5$s",
                TIMESTAMP_COLUMN, window.isLowerInclusive() ? ">=" : ">", dateTime(window.getLowerBound()),
                window.isUpperInclusive() ? "<=" : "<", dateTime(window.getUpperBound()));
    }

    /** All-time sorgular doldurulmaz; doldurulacak sabit sınır yoktur. */
    public Optional<GapFillPlan> gapFillPlan(TimeWindow window, BucketGranularity granularity, ZoneId zone) {
        if (!window.isBounded()) {
            return Optional.empty();
        }
        return Optional.of(new GapFillPlan(window.getLowerBound(), window.getUpperBound(), granularity, zone));
    }

    /**
     * ORDER BY'a eklenen WITH FILL ifadesi. FROM, zaman sütunuyla aynı bucket ifadesinden geçer;
     * TO hariçtir.
     */
    public SqlFragment fillClause(TimeWindow window, BucketGranularity granularity, ZoneId zone) {
        return gapFillPlan(window, granularity, zone)
                .map(this::renderFill)
                .orElse(SqlFragment.empty());
    }

    /** Zaman ifadesini istemcinin saat diliminde dilimler; saat dilimi bağlı değerdir. */
    public SqlFragment bucket(BucketGranularity granularity, SqlFragment timeExpression, ZoneId zone) {
        return SqlFragment.format(granularity.bucketExpression("%1$s", "%2$s"),
                timeExpression, SqlFragment.value(zone.getId()));
    }

    /** UTC anı, saniye hassasiyetinde DateTime ifadesi. */
    static SqlFragment dateTime(Instant instant) {
        return SqlFragment.format("toDateTime(%1$s, 'UTC')", SqlFragment.value(DATE_TIME.format(instant)));
    }

    private SqlFragment renderFill(GapFillPlan fill) {
        return SqlFragment.format("WITH FILL FROM %1$s TO toTimeZone(%2$s, %3$s) STEP INTERVAL %4$s",
                bucket(fill.getGranularity(), dateTime(fill.getFrom()), fill.getTimezone()),
                dateTime(fill.getTo()), SqlFragment.value(fill.getTimezone().getId()),
                fill.getGranularity().getStepInterval());
    }
}
