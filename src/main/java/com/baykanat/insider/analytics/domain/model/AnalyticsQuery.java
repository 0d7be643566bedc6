package com.baykanat.insider.analytics.domain.model;

import lombok.Builder;
import lombok.Value;

import java.time.ZoneId;
import java.util.List;

/** Doğrulanmış, normalize edilmiş analitik isteği. Tek bir site ile sınırlıdır. */
@Value
@Builder(toBuilder = true)
public class AnalyticsQuery {

    int siteId;
    TimeSpec timeSpec;
    ZoneId timezone;
    BucketGranularity bucket;
    List<FilterPredicate> filters;
    String userId;
    int page;
    int pageSize;
    String sortBy;
    SortOrder sortOrder;

    public enum SortOrder {
        ASC,
        DESC
    }

    /** page 1'den başlar; büyük sayfa numaraları int sınırını aşabilir. */
    public long getOffset() {
        return Math.multiplyExact((long) page - 1, pageSize);
    }
}
