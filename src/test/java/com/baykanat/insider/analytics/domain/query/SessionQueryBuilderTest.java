package com.baykanat.insider.analytics.domain.query;

import com.baykanat.insider.analytics.domain.model.AnalyticsStatement;
import com.baykanat.insider.analytics.domain.model.TimeSpec;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.ZoneId;

import static org.assertj.core.api.Assertions.assertThat;

class SessionQueryBuilderTest {

    private SessionQueryBuilder builder;

    @BeforeEach
    void setUp() {
        builder = new SessionQueryBuilder(QueryFixtures.eventScope());
    }

    @Test
    @DisplayName("Session list should page by offset, newest first with a stable tie-break")
    void sessionListPagination() {
        AnalyticsStatement statement = builder.sessionList(QueryFixtures.query().page(3).pageSize(100).build());

        assertThat(statement.getName()).isEqualTo("session-list");
        assertThat(statement.getSql())
                .contains("ORDER BY max(timestamp) DESC, session_id ASC")
                .endsWith("LIMIT 100 OFFSET 200");
    }

    @Test
    @DisplayName("Very large page numbers should produce a positive offset beyond the int range")
    void sessionListLargePageOffset() {
        AnalyticsStatement statement = builder.sessionList(QueryFixtures.query().page(30_000_000).pageSize(100).build());

        assertThat(statement.getSql())
                .endsWith("LIMIT 100 OFFSET 2999999900")
                .doesNotContain("OFFSET -");
    }

    @Test
    @DisplayName("Session list should use the tie-broken entry and exit expressions")
    void sessionListEntryExit() {
        String sql = builder.sessionList(QueryFixtures.query().build()).getSql();

        assertThat(sql)
                .contains("argMin(pathname, (timestamp, pathname)) AS entry_page")
                .contains("argMax(pathname, (timestamp, pathname)) AS exit_page")
                .contains("countIf(type = 'pageview') AS pageviews")
                .contains("countIf(type = 'custom_event') AS events");
    }

    @Test
    @DisplayName("userId should scope the session list as a bound value")
    void sessionListUserScope() {
        AnalyticsStatement statement = builder.sessionList(QueryFixtures.query().userId("u'1").build());

        assertThat(statement.getSql()).contains("WHERE site_id = 1 AND user_id = ? AND timestamp >= ");
        assertThat(statement.getArgs()).containsExactly("u'1", "2025-03-01 00:00:00", "2025-03-12 10:15:30");
    }

    @Test
    @DisplayName("Session event page should order by time and pathname")
    void sessionEventsPage() {
        AnalyticsStatement statement = builder.sessionEvents(QueryFixtures.query().build(), "s-1", 50, 100);

        assertThat(statement.getName()).isEqualTo("session-events");
        assertThat(statement.getArgs()).first().isEqualTo("s-1");
        assertThat(statement.getSql())
                .contains("site_id = 1 AND session_id = ?")
                .contains("LIMIT 50 OFFSET 100")
                .endsWith("ORDER BY event_time ASC, pathname ASC");
    }

    @Test
    @DisplayName("Session event count should share the event page's WHERE clause")
    void sessionEventCountSharesWhere() {
        AnalyticsStatement count = builder.sessionEventCount(QueryFixtures.query().build(), "s-1");
        AnalyticsStatement details = builder.sessionDetails(QueryFixtures.query().build(), "s-1");

        assertThat(count.getSql()).startsWith("SELECT count() AS total").contains("session_id = ?");
        assertThat(details.getSql()).contains("session_id = ?").contains("GROUP BY session_id");
        assertThat(count.getArgs()).isEqualTo(details.getArgs()).first().isEqualTo("s-1");
    }

    @Test
    @DisplayName("User session count should group by start date in the caller's timezone")
    void userSessionCountByDate() {
        AnalyticsStatement statement = builder.userSessionCount(QueryFixtures.query()
                .userId("u1")
                .timezone(ZoneId.of("America/New_York"))
                .timeSpec(TimeSpec.allTime())
                .build());

        assertThat(statement.getSql())
                .contains("toString(toDate(start_time, ?)) AS date")
                .contains("WHERE site_id = 1 AND user_id = ?")
                .endsWith("ORDER BY date ASC");
        assertThat(statement.getArgs()).containsExactly("America/New_York", "u1");
    }
}
