package com.baykanat.insider.analytics.domain.model;

import lombok.Value;

import java.time.Instant;
import java.time.ZoneId;

/** Boş zaman dilimlerinin doldurulması: ilk sınır, son sınır (hariç) ve adım. */
@Value
public class GapFillPlan {

    Instant from;
    Instant to;
    BucketGranularity granularity;
    ZoneId timezone;
}
