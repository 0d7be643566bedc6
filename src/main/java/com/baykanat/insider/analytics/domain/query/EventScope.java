package com.baykanat.insider.analytics.domain.query;

import com.baykanat.insider.analytics.domain.model.AnalyticsQuery;
import com.baykanat.insider.analytics.domain.model.TimeWindow;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/** events tablosu için site + ek koşul + filtre + zaman WHERE gövdesini birleştirir. */
@Component
@RequiredArgsConstructor
public class EventScope {

    private final FilterCompiler filterCompiler;
    private final TimeWindowResolver timeWindowResolver;

    public TimeWindow window(AnalyticsQuery query) {
        return timeWindowResolver.resolve(query.getTimeSpec(), query.getTimezone());
    }

    /** "WHERE" anahtar kelimesi olmadan döner; ilk koşul her zaman site kapsamıdır. */
    public SqlFragment where(AnalyticsQuery query, TimeWindow window, SqlFragment... conditions) {
        List<SqlFragment> parts = new ArrayList<>();
        parts.add(SqlFragment.of(SessionExpressions.siteScope(query.getSiteId())));
        parts.addAll(Arrays.asList(conditions));

        return SqlFragment.join(" ", List.of(
                SqlFragment.join(" AND ", parts),
                filterCompiler.compile(query.getFilters(), query.getSiteId()),
                timeWindowResolver.whereFragment(window)));
    }

    public SqlFragment fillClause(AnalyticsQuery query, TimeWindow window) {
        return timeWindowResolver.fillClause(window, query.getBucket(), query.getTimezone());
    }

    /** Zaman sütununu sorgunun bucket'ına ve saat dilimine göre dilimler. */
    public SqlFragment bucket(AnalyticsQuery query, String timeColumn) {
        return timeWindowResolver.bucket(query.getBucket(), SqlFragment.of(timeColumn), query.getTimezone());
    }
}
