package com.baykanat.insider.analytics.domain.query;

import com.baykanat.insider.analytics.domain.model.AnalyticsStatement;
import com.baykanat.insider.analytics.domain.model.BucketGranularity;
import com.baykanat.insider.analytics.domain.model.FilterParameter;
import com.baykanat.insider.analytics.domain.model.FilterPredicate;
import com.baykanat.insider.analytics.domain.model.FilterType;
import com.baykanat.insider.analytics.domain.model.TimeSpec;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.ZoneId;
import java.util.List;
import java.util.regex.Pattern;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for BucketedAggregationPlanner.
 *
 * <p>Checks the statement shape: both sides bucketed with the same expression, each side
 * gap-filled, joined on time and ordered ascending.
 */
class BucketedAggregationPlannerTest {

    private BucketedAggregationPlanner planner;

    @BeforeEach
    void setUp() {
        planner = new BucketedAggregationPlanner(QueryFixtures.eventScope());
    }

    @Test
    @DisplayName("Bucketed overview should FULL JOIN session and pageview sides on time")
    void bucketedJoinsOnTime() {
        AnalyticsStatement statement = planner.planBucketed(QueryFixtures.query().build());

        assertThat(statement.getName()).isEqualTo("overview-bucketed");
        assertThat(statement.getSql())
                .contains(") AS session_stats")
                .contains("FULL JOIN")
                .contains(") AS page_stats")
                .contains("USING time")
                .endsWith("ORDER BY bucket_time");
    }

    @Test
    @DisplayName("Both sides should be gap-filled with the same clause")
    void bothSidesAreFilled() {
        String sql = planner.planBucketed(QueryFixtures.query().build()).getSql();
        String fill = "ORDER BY time WITH FILL FROM "
                + "toDateTime(toStartOfDay(toTimeZone(toDateTime(?, 'UTC'), ?)), ?)"
                + " TO toTimeZone(toDateTime(?, 'UTC'), ?) STEP INTERVAL 1 DAY";

        assertThat(sql.split(Pattern.quote(fill), -1)).hasSize(3);
    }

    @Test
    @DisplayName("Bound arguments should line up with the placeholders in text order")
    void argumentsFollowPlaceholders() {
        AnalyticsStatement statement = planner.planBucketed(QueryFixtures.query().build());
        String from = "2025-03-01 00:00:00";
        String to = "2025-03-12 10:15:30";

        assertThat(statement.getSql().chars().filter(c -> c == '?').count())
                .isEqualTo(statement.getArgs().size());
        assertThat(statement.getArgs()).containsExactly(
                "UTC", "UTC",
                from, to,
                from, "UTC", "UTC", to, "UTC",
                "UTC", "UTC",
                from, to,
                from, "UTC", "UTC", to, "UTC");
    }

    @Test
    @DisplayName("Session side should bucket by session start, pageview side by event time")
    void bucketExpressions() {
        AnalyticsStatement statement = planner.planBucketed(QueryFixtures.query()
                .bucket(BucketGranularity.HOUR)
                .timezone(ZoneId.of("Europe/Istanbul"))
                .build());

        assertThat(statement.getSql())
                .contains("toDateTime(toStartOfHour(toTimeZone(start_time, ?)), ?) AS time")
                .contains("toDateTime(toStartOfHour(toTimeZone(timestamp, ?)), ?) AS time")
                .contains("STEP INTERVAL 1 HOUR")
                .doesNotContain("Europe/Istanbul");
        assertThat(statement.getArgs()).startsWith("Europe/Istanbul", "Europe/Istanbul");
    }

    @Test
    @DisplayName("All-time bucketed query should not be gap-filled")
    void allTimeIsNotFilled() {
        String sql = planner.planBucketed(QueryFixtures.query().timeSpec(TimeSpec.allTime()).build()).getSql();

        assertThat(sql).doesNotContain("WITH FILL").doesNotContain("AND timestamp");
    }

    @Test
    @DisplayName("Metrics should guard against empty buckets")
    void metricsAreNanSafe() {
        String sql = planner.planBucketed(QueryFixtures.query().build()).getSql();

        assertThat(sql)
                .contains("ifNotFinite(avg(pages_in_session), 0) AS pages_per_session")
                .contains("if(count() = 0, 0, sumIf(1, pages_in_session = 1) / count()) AS bounce_rate")
                .contains("session_stats.bounce_rate * 100 AS bounce_rate")
                .contains("toString(bucket_time) AS time");
    }

    @Test
    @DisplayName("Site scope, pageview condition and filters should appear on both sides")
    void whereIsSharedByBothSides() {
        FilterPredicate browser = FilterPredicate.builder()
                .parameter(FilterParameter.column("browser"))
                .type(FilterType.EQUALS)
                .values(List.of("Chrome"))
                .build();
        AnalyticsStatement statement = planner.planBucketed(QueryFixtures.query().filters(List.of(browser)).build());
        String where = "site_id = 1 AND type = 'pageview' AND browser = ? AND timestamp >= ";

        assertThat(statement.getSql().split(Pattern.quote(where), -1)).hasSize(3);
        assertThat(statement.getArgs()).filteredOn("Chrome"::equals).hasSize(2);
    }

    @Test
    @DisplayName("Overview should CROSS JOIN the two single-row aggregates")
    void overviewCrossJoins() {
        AnalyticsStatement statement = planner.planOverview(QueryFixtures.query().build());

        assertThat(statement.getName()).isEqualTo("overview");
        assertThat(statement.getSql())
                .contains("CROSS JOIN")
                .contains("count() AS pageviews")
                .contains("uniqExact(user_id) AS users")
                .doesNotContain("WITH FILL");
    }
}
