package com.baykanat.insider.analytics.domain.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.time.LocalDate;

/** İstek zaman penceresi; her istekte tam olarak bir varyant dolu olur. */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class TimeSpec {

    public enum Kind {
        ALL_TIME,
        DATE_RANGE,
        PAST_MINUTES,
        PAST_MINUTES_RANGE,
        CALENDAR_PERIOD
    }

    Kind kind;
    LocalDate startDate;
    LocalDate endDate;
    Integer pastMinutes;
    Integer pastMinutesStart;
    Integer pastMinutesEnd;
    BucketGranularity calendarPeriod;

    public static TimeSpec allTime() {
        return new TimeSpec(Kind.ALL_TIME, null, null, null, null, null, null);
    }

    public static TimeSpec dateRange(LocalDate startDate, LocalDate endDate) {
        return new TimeSpec(Kind.DATE_RANGE, startDate, endDate, null, null, null, null);
    }

    public static TimeSpec pastMinutes(int minutes) {
        return new TimeSpec(Kind.PAST_MINUTES, null, null, minutes, null, null, null);
    }

    /** start > end; start daha eski sınırdır. */
    public static TimeSpec pastMinutesRange(int start, int end) {
        return new TimeSpec(Kind.PAST_MINUTES_RANGE, null, null, null, start, end, null);
    }

    public static TimeSpec calendarPeriod(BucketGranularity period) {
        return new TimeSpec(Kind.CALENDAR_PERIOD, null, null, null, null, null, period);
    }

    public boolean isAllTime() {
        return kind == Kind.ALL_TIME;
    }
}
