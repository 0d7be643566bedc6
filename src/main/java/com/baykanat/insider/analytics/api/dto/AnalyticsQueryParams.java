package com.baykanat.insider.analytics.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Analitik uç noktalarının ham sorgu parametreleri. Tek alan aralıkları burada Bean Validation ile,
 * alanlar arası kurallar ParameterValidator'da denetlenir.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Raw query parameters shared by analytics endpoints")
public class AnalyticsQueryParams {

    /** pageSize ve oturum detayı limit'i için üst sınır. */
    public static final int MAX_PAGE_SIZE = 100;

    @Schema(description = "Numeric site identifier", example = "1")
    private String site;

    @Schema(description = "Inclusive start date (yyyy-MM-dd) in the caller's timezone", example = "2025-01-01")
    private String startDate;

    @Schema(description = "Inclusive end date (yyyy-MM-dd) in the caller's timezone", example = "2025-01-31")
    private String endDate;

    @Schema(description = "IANA timezone of the caller. Default: UTC", example = "Europe/Istanbul")
    private String timezone;

    @Positive(message = "pastMinutes must be a positive integer")
    @Schema(description = "Rolling window: last N minutes", example = "30")
    private Integer pastMinutes;

    @Positive(message = "pastMinutesStart must be a positive integer")
    @Schema(description = "Further-past bound of a minutes range", example = "60")
    private Integer pastMinutesStart;

    @PositiveOrZero(message = "pastMinutesEnd must not be negative")
    @Schema(description = "Nearer bound of a minutes range", example = "30")
    private Integer pastMinutesEnd;

    @Schema(description = "Current calendar period: hour, day, week, month or year", example = "month")
    private String period;

    @Schema(description = "Time series granularity. Default: hour", example = "day")
    private String bucket;

    @Schema(description = "JSON array of {parameter, type, value}", example = "[{\"parameter\":\"browser\",\"type\":\"equals\",\"value\":[\"Chrome\"]}]")
    private String filters;

    @Min(value = 1, message = "page must be a positive integer")
    @Schema(description = "1-based page number", example = "1")
    private Integer page;

    @Min(value = 1, message = "pageSize must be between 1 and 100")
    @Max(value = MAX_PAGE_SIZE, message = "pageSize must be between 1 and 100")
    @Schema(description = "Page size, at most 100", example = "100")
    private Integer pageSize;

    @Schema(description = "User list sort column", example = "last_seen")
    private String sortBy;

    @Schema(description = "asc or desc", example = "desc")
    private String sortOrder;

    @Schema(description = "Restrict to one user", example = "f1e2d3")
    private String userId;
}
