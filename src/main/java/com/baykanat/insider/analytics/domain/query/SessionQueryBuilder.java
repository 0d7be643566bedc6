package com.baykanat.insider.analytics.domain.query;

import com.baykanat.insider.analytics.domain.model.AnalyticsQuery;
import com.baykanat.insider.analytics.domain.model.AnalyticsStatement;
import com.baykanat.insider.analytics.domain.model.TimeWindow;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/** Oturum listesi, oturum detayı ve kullanıcı bazlı günlük oturum sayısı sorguları. */
@Component
@RequiredArgsConstructor
public class SessionQueryBuilder {

    private static final String SESSION_LIST_SQL = """
            SELECT
                session_id,
                argMin(user_id, timestamp) AS user_id,
                argMin(country, timestamp) AS country,
                argMin(region, timestamp) AS region,
                argMin(city, timestamp) AS city,
                argMin(language, timestamp) AS language,
                argMin(device_type, timestamp) AS device_type,
                argMin(browser, timestamp) AS browser,
                argMin(operating_system, timestamp) AS operating_system,
                argMin(referrer, timestamp) AS referrer,
                argMin(channel, timestamp) AS channel,
                argMin(url_parameters['utm_source'], timestamp) AS utm_source,
                argMin(url_parameters['utm_medium'], timestamp) AS utm_medium,
                argMin(url_parameters['utm_campaign'], timestamp) AS utm_campaign,
                argMin(url_parameters['utm_term'], timestamp) AS utm_term,
                argMin(url_parameters['utm_content'], timestamp) AS utm_content,
                toString(max(timestamp)) AS session_end,
                toString(min(timestamp)) AS session_start,
                dateDiff('second', min(timestamp), max(timestamp)) AS session_duration,
                %1$s AS entry_page,
                %2$s AS exit_page,
                countIf(%3$s) AS pageviews,
                countIf(%4$s) AS events
            FROM
            (
                SELECT *
                FROM events
                WHERE %5$s
            )
            GROUP BY session_id
            ORDER BY max(timestamp) DESC, session_id ASC
            LIMIT %6$d OFFSET %7$d""";

    private static final String SESSION_DETAILS_SQL = """
            SELECT
                session_id,
                argMin(user_id, timestamp) AS user_id,
                argMin(country, timestamp) AS country,
                argMin(region, timestamp) AS region,
                argMin(language, timestamp) AS language,
                argMin(device_type, timestamp) AS device_type,
                argMin(browser, timestamp) AS browser,
                argMin(browser_version, timestamp) AS browser_version,
                argMin(operating_system, timestamp) AS operating_system,
                argMin(operating_system_version, timestamp) AS operating_system_version,
                argMin(screen_width, timestamp) AS screen_width,
                argMin(screen_height, timestamp) AS screen_height,
                argMin(referrer, timestamp) AS referrer,
                toString(max(timestamp)) AS session_end,
                toString(min(timestamp)) AS session_start,
                countIf(%1$s) AS pageviews,
                %2$s AS entry_page,
                %3$s AS exit_page
            FROM
            (
                SELECT *
                FROM events
                WHERE %4$s
            )
            GROUP BY session_id""";

    private static final String SESSION_EVENT_COUNT_SQL = """
            SELECT count() AS total
            FROM events
            WHERE %1$s""";

    private static final String SESSION_EVENTS_SQL = """
            SELECT
                toString(event_time) AS timestamp,
                pathname,
                hostname,
                querystring,
                page_title,
                referrer,
                type,
                event_name,
                properties
            FROM
            (
                SELECT
                    timestamp AS event_time,
                    pathname,
                    hostname,
                    querystring,
                    page_title,
                    referrer,
                    type,
                    event_name,
                    properties
                FROM events
                WHERE %1$s
                ORDER BY timestamp ASC, pathname ASC
                LIMIT %2$d OFFSET %3$d
            )
            ORDER BY event_time ASC, pathname ASC""";

    private static final String USER_SESSION_COUNT_SQL = """
            SELECT
                toString(toDate(start_time, %1$s)) AS date,
                count() AS sessions
            FROM
            (
                SELECT
                    session_id,
                    min(timestamp) AS start_time
                FROM events
                WHERE %2$s
                GROUP BY session_id
            )
            GROUP BY date
            ORDER BY date ASC""";

    private final EventScope eventScope;

    /** Sayfa numaralı liste; en yeni oturum önce. Toplam sayı üretilmez. */
    public AnalyticsStatement sessionList(AnalyticsQuery query) {
        TimeWindow window = eventScope.window(query);
        List<SqlFragment> conditions = new ArrayList<>();
        if (query.getUserId() != null) {
            conditions.add(equalsValue("user_id", query.getUserId()));
        }
        SqlFragment where = eventScope.where(query, window, conditions.toArray(SqlFragment[]::new));

        SqlFragment sql = SqlFragment.format(SESSION_LIST_SQL,
                SessionExpressions.ENTRY_PAGE,
                SessionExpressions.EXIT_PAGE,
                SessionExpressions.IS_PAGEVIEW,
                SessionExpressions.IS_CUSTOM_EVENT,
                where,
                query.getPageSize(),
                query.getOffset());
        return statement("session-list", sql);
    }

    public AnalyticsStatement sessionDetails(AnalyticsQuery query, String sessionId) {
        SqlFragment sql = SqlFragment.format(SESSION_DETAILS_SQL,
                SessionExpressions.IS_PAGEVIEW,
                SessionExpressions.ENTRY_PAGE,
                SessionExpressions.EXIT_PAGE,
                sessionWhere(query, sessionId));
        return statement("session-details", sql);
    }

    public AnalyticsStatement sessionEventCount(AnalyticsQuery query, String sessionId) {
        return statement("session-event-count",
                SqlFragment.format(SESSION_EVENT_COUNT_SQL, sessionWhere(query, sessionId)));
    }

    /** Oturumun olayları, zaman sırasıyla offset/limit sayfası. */
    public AnalyticsStatement sessionEvents(AnalyticsQuery query, String sessionId, int limit, int offset) {
        SqlFragment sql = SqlFragment.format(SESSION_EVENTS_SQL, sessionWhere(query, sessionId), limit, offset);
        return statement("session-events", sql);
    }

    /** Kullanıcının oturumlarını, istemci saat dilimindeki başlangıç gününe göre sayar. */
    public AnalyticsStatement userSessionCount(AnalyticsQuery query) {
        TimeWindow window = eventScope.window(query);
        SqlFragment where = eventScope.where(query, window, equalsValue("user_id", query.getUserId()));

        SqlFragment sql = SqlFragment.format(USER_SESSION_COUNT_SQL,
                SqlFragment.value(query.getTimezone().getId()), where);
        return statement("user-session-count", sql);
    }

    private SqlFragment sessionWhere(AnalyticsQuery query, String sessionId) {
        return eventScope.where(query, eventScope.window(query), equalsValue("session_id", sessionId));
    }

    private static SqlFragment equalsValue(String column, String value) {
        return SqlFragment.format("%1$s = %2$s", column, SqlFragment.value(value));
    }

    private static AnalyticsStatement statement(String name, SqlFragment sql) {
        return new AnalyticsStatement(name, sql.getSql(), sql.getArgs());
    }
}
