package com.baykanat.insider.analytics.domain.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * Zaman serisi örnekleme aralığı.
 *
 * <p>Her sabit hem ClickHouse truncation fonksiyonunu hem de WITH FILL adımını taşır;
 * ikisi aynı sabitte tanımlı olduğu için birbirinden kopamaz.
 */
public enum BucketGranularity {

    MINUTE("minute", "toStartOfMinute", 1, "MINUTE"),
    FIVE_MINUTES("five_minutes", "toStartOfFiveMinutes", 5, "MINUTE"),
    TEN_MINUTES("ten_minutes", "toStartOfTenMinutes", 10, "MINUTE"),
    FIFTEEN_MINUTES("fifteen_minutes", "toStartOfFifteenMinutes", 15, "MINUTE"),
    HOUR("hour", "toStartOfHour", 1, "HOUR"),
    DAY("day", "toStartOfDay", 1, "DAY"),
    WEEK("week", "toStartOfWeek", 7, "DAY"),
    MONTH("month", "toStartOfMonth", 1, "MONTH"),
    YEAR("year", "toStartOfYear", 1, "YEAR");

    private final String value;
    private final String truncationFunction;
    private final int stepAmount;
    private final String stepUnit;

    BucketGranularity(String value, String truncationFunction, int stepAmount, String stepUnit) {
        this.value = value;
        this.truncationFunction = truncationFunction;
        this.stepAmount = stepAmount;
        this.stepUnit = stepUnit;
    }

    /** API'de kullanılan ad (ör. five_minutes). */
    public String getValue() {
        return value;
    }

    /** WITH FILL için interval literal'i, ör. "5 MINUTE". */
    public String getStepInterval() {
        return stepAmount + " " + stepUnit;
    }

    /**
     * Verilen zaman ifadesini bu aralığa göre, istemcinin saat diliminde keser.
     * Zaman sütunu ve gap-fill sınırları aynı ifadeyle üretilir; saat dilimi ifadesi iki kez geçer.
     */
    public String bucketExpression(String timeExpression, String timezoneExpression) {
        return String.format("toDateTime(%s(toTimeZone(%s, %s)), %s)",
                truncationFunction, timeExpression, timezoneExpression, timezoneExpression);
    }

    public static Optional<BucketGranularity> fromValue(String value) {
        return Arrays.stream(values())
                .filter(granularity -> granularity.value.equals(value))
                .findFirst();
    }
}
