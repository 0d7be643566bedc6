package com.baykanat.insider.analytics.domain.query;

import com.baykanat.insider.analytics.domain.model.AnalyticsQuery;
import com.baykanat.insider.analytics.domain.model.AnalyticsStatement;
import com.baykanat.insider.analytics.domain.model.TimeWindow;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Set;

/** Kullanıcı listesi ve toplam kullanıcı sayısı sorguları. */
@Component
@RequiredArgsConstructor
public class UserQueryBuilder {

    /** ORDER BY'a girebilecek sütunlar; sortBy yalnızca bu kümeden gelir. */
    public static final Set<String> SORTABLE_COLUMNS = Set.of(
            "first_seen", "last_seen", "pageviews", "sessions", "events", "user_id");

    private static final String USER_LIST_SQL = """
            SELECT
                user_id,
                argMax(country, timestamp) AS country,
                argMax(region, timestamp) AS region,
                argMax(city, timestamp) AS city,
                argMax(language, timestamp) AS language,
                argMax(browser, timestamp) AS browser,
                argMax(operating_system, timestamp) AS operating_system,
                argMax(device_type, timestamp) AS device_type,
                countIf(%1$s) AS pageviews,
                countIf(%2$s) AS events,
                uniqExact(session_id) AS sessions,
                toString(max(timestamp)) AS last_seen,
                toString(min(timestamp)) AS first_seen
            FROM
            (
                SELECT *
                FROM events
                WHERE %3$s
            )
            GROUP BY user_id
            ORDER BY %4$s %5$s, user_id ASC
            LIMIT %6$d OFFSET %7$d""";

    private static final String USER_COUNT_SQL = """
            SELECT uniqExact(user_id) AS total_count
            FROM events
            WHERE %1$s""";

    private final EventScope eventScope;

    public AnalyticsStatement userList(AnalyticsQuery query) {
        if (!SORTABLE_COLUMNS.contains(query.getSortBy())) {
            throw new IllegalArgumentException("Unsupported sort column: " + query.getSortBy());
        }
        TimeWindow window = eventScope.window(query);

        SqlFragment sql = SqlFragment.format(USER_LIST_SQL,
                SessionExpressions.IS_PAGEVIEW,
                SessionExpressions.IS_CUSTOM_EVENT,
                eventScope.where(query, window),
                query.getSortBy(),
                query.getSortOrder().name(),
                query.getPageSize(),
                query.getOffset());
        return new AnalyticsStatement("user-list", sql.getSql(), sql.getArgs());
    }

    public AnalyticsStatement userCount(AnalyticsQuery query) {
        TimeWindow window = eventScope.window(query);
        SqlFragment sql = SqlFragment.format(USER_COUNT_SQL, eventScope.where(query, window));
        return new AnalyticsStatement("user-count", sql.getSql(), sql.getArgs());
    }
}
