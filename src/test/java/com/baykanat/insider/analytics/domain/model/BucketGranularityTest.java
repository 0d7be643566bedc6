package com.baykanat.insider.analytics.domain.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import static org.assertj.core.api.Assertions.assertThat;

class BucketGranularityTest {

    @ParameterizedTest
    @EnumSource(BucketGranularity.class)
    @DisplayName("Every granularity should round-trip through its API value")
    void fromValueResolvesEveryConstant(BucketGranularity granularity) {
        assertThat(BucketGranularity.fromValue(granularity.getValue())).contains(granularity);
    }

    @Test
    @DisplayName("Unknown values should not resolve")
    void unknownValueIsEmpty() {
        assertThat(BucketGranularity.fromValue("fortnight")).isEmpty();
        assertThat(BucketGranularity.fromValue(null)).isEmpty();
    }

    @Test
    @DisplayName("Fill steps should match the truncation functions")
    void stepMatchesTruncation() {
        assertThat(BucketGranularity.MINUTE.getStepInterval()).isEqualTo("1 MINUTE");
        assertThat(BucketGranularity.FIVE_MINUTES.getStepInterval()).isEqualTo("5 MINUTE");
        assertThat(BucketGranularity.TEN_MINUTES.getStepInterval()).isEqualTo("10 MINUTE");
        assertThat(BucketGranularity.FIFTEEN_MINUTES.getStepInterval()).isEqualTo("15 MINUTE");
        assertThat(BucketGranularity.HOUR.getStepInterval()).isEqualTo("1 HOUR");
        assertThat(BucketGranularity.DAY.getStepInterval()).isEqualTo("1 DAY");
        assertThat(BucketGranularity.WEEK.bucketExpression("t", "z")).startsWith("toDateTime(toStartOfWeek(");
        assertThat(BucketGranularity.WEEK.getStepInterval()).isEqualTo("7 DAY");
        assertThat(BucketGranularity.MONTH.getStepInterval()).isEqualTo("1 MONTH");
        assertThat(BucketGranularity.YEAR.getStepInterval()).isEqualTo("1 YEAR");
    }

    @Test
    @DisplayName("Bucket expression should truncate in the caller's timezone")
    void bucketExpressionAppliesTimezone() {
        assertThat(BucketGranularity.HOUR.bucketExpression("timestamp", "'Europe/Istanbul'"))
                .isEqualTo("toDateTime(toStartOfHour(toTimeZone(timestamp, 'Europe/Istanbul')), 'Europe/Istanbul')");
    }
}
