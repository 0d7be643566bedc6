package com.baykanat.insider.analytics.domain.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/** Çözülmüş UTC zaman sınırları; all-time için iki sınır da null. */
@Value
@Builder
public class TimeWindow {

    Instant lowerBound;
    boolean lowerInclusive;
    Instant upperBound;
    boolean upperInclusive;

    public static TimeWindow unbounded() {
        return TimeWindow.builder().build();
    }

    public boolean isBounded() {
        return lowerBound != null;
    }
}
