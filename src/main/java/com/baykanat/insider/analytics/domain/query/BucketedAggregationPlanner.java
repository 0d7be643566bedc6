package com.baykanat.insider.analytics.domain.query;

import com.baykanat.insider.analytics.domain.model.AnalyticsQuery;
import com.baykanat.insider.analytics.domain.model.AnalyticsStatement;
import com.baykanat.insider.analytics.domain.model.TimeWindow;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Overview sorguları.
 *
 * <p>Oturum tarafı önce oturum başına bir satıra indirilir (min/max timestamp, sayfa sayısı),
 * sonra dilimlenir; böylece birden fazla dilime yayılan oturumlar tek kez sayılır. Sayfa görüntüleme
 * tarafı doğrudan dilimlenir. İki taraf ayrı ayrı doldurulur ve zaman üzerinden FULL JOIN edilir.
 */
@Component
@RequiredArgsConstructor
public class BucketedAggregationPlanner {

    private static final String SESSION_ROWS = """
            SELECT
                session_id,
                min(timestamp) AS start_time,
                max(timestamp) AS end_time,
                count() AS pages_in_session
            FROM events
            WHERE %1$s
            GROUP BY session_id""";

    private static final String SESSION_METRICS = """
            count() AS sessions,
                    ifNotFinite(avg(pages_in_session), 0) AS pages_per_session,
                    if(count() = 0, 0, sumIf(1, pages_in_session = 1) / count()) AS bounce_rate,
                    ifNotFinite(avg(end_time - start_time), 0) AS session_duration""";

    private static final String BUCKETED_SQL = """
            SELECT
                toString(bucket_time) AS time,
                sessions,
                pages_per_session,
                bounce_rate,
                session_duration,
                pageviews,
                users
            FROM
            (
                SELECT
                    time AS bucket_time,
                    session_stats.sessions AS sessions,
                    session_stats.pages_per_session AS pages_per_session,
                    session_stats.bounce_rate * 100 AS bounce_rate,
                    session_stats.session_duration AS session_duration,
                    page_stats.pageviews AS pageviews,
                    page_stats.users AS users
                FROM
                (
                    SELECT
                        %1$s AS time,
                        %2$s
                    FROM
                    (
                        %3$s
                    )
                    GROUP BY time
                    ORDER BY time %4$s
                ) AS session_stats
                FULL JOIN
                (
                    SELECT
                        %5$s AS time,
                        count() AS pageviews,
                        uniqExact(user_id) AS users
                    FROM events
                    WHERE %6$s
                    GROUP BY time
                    ORDER BY time %4$s
                ) AS page_stats
                USING time
            )
            ORDER BY bucket_time""";

    private static final String OVERVIEW_SQL = """
            SELECT
                session_stats.sessions AS sessions,
                session_stats.pages_per_session AS pages_per_session,
                session_stats.bounce_rate * 100 AS bounce_rate,
                session_stats.session_duration AS session_duration,
                page_stats.pageviews AS pageviews,
                page_stats.users AS users
            FROM
            (
                SELECT
                    %1$s
                FROM
                (
                    %2$s
                )
            ) AS session_stats
            CROSS JOIN
            (
                SELECT
                    count() AS pageviews,
                    uniqExact(user_id) AS users
                FROM events
                WHERE %3$s
            ) AS page_stats""";

    private final EventScope eventScope;

    /** Zaman serisi: satırlar dilim zamanına göre artan sırada gelir. */
    public AnalyticsStatement planBucketed(AnalyticsQuery query) {
        TimeWindow window = eventScope.window(query);
        SqlFragment where = eventScope.where(query, window, SqlFragment.of(SessionExpressions.IS_PAGEVIEW));

        SqlFragment sql = SqlFragment.format(BUCKETED_SQL,
                eventScope.bucket(query, "start_time"),
                SESSION_METRICS,
                SqlFragment.format(SESSION_ROWS, where),
                eventScope.fillClause(query, window),
                eventScope.bucket(query, "timestamp"),
                where);
        return new AnalyticsStatement("overview-bucketed", sql.getSql(), sql.getArgs());
    }

    /** Tüm pencere için tek satırlık toplamlar. */
    public AnalyticsStatement planOverview(AnalyticsQuery query) {
        TimeWindow window = eventScope.window(query);
        SqlFragment where = eventScope.where(query, window, SqlFragment.of(SessionExpressions.IS_PAGEVIEW));

        SqlFragment sql = SqlFragment.format(OVERVIEW_SQL,
                SESSION_METRICS,
                SqlFragment.format(SESSION_ROWS, where),
                where);
        return new AnalyticsStatement("overview", sql.getSql(), sql.getArgs());
    }
}
