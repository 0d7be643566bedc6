package com.baykanat.insider.analytics.domain.service;

import com.baykanat.insider.analytics.api.dto.AnalyticsQueryParams;
import com.baykanat.insider.analytics.api.dto.FilterRequest;
import com.baykanat.insider.analytics.config.AppProperties;
import com.baykanat.insider.analytics.domain.exception.InvalidParameterException;
import com.baykanat.insider.analytics.domain.mapper.FilterMapper;
import com.baykanat.insider.analytics.domain.model.AnalyticsQuery;
import com.baykanat.insider.analytics.domain.model.BucketGranularity;
import com.baykanat.insider.analytics.domain.model.FilterPredicate;
import com.baykanat.insider.analytics.domain.model.TimeSpec;
import com.baykanat.insider.analytics.domain.query.FilterAllowList;
import com.baykanat.insider.analytics.domain.query.UserQueryBuilder;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.ZoneId;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Ham istek parametrelerini doğrular ve AnalyticsQuery'ye normalize eder.
 *
 * <p>Tek alan aralıkları AnalyticsQueryParams üzerindeki kısıtlarla denetlenir; burada alanlar
 * arası kurallar ve allow-list kalır. Yan etkisi yoktur; her hata alanı belirten
 * {@link InvalidParameterException}'dır. Güvensiz girdi hiçbir zaman sessizce düzeltilmez.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ParameterValidator {

    static final String DEFAULT_SORT_BY = "last_seen";
    static final ZoneId DEFAULT_TIMEZONE = ZoneId.of("UTC");

    private static final Set<BucketGranularity> CALENDAR_PERIODS = EnumSet.of(
            BucketGranularity.HOUR, BucketGranularity.DAY, BucketGranularity.WEEK,
            BucketGranularity.MONTH, BucketGranularity.YEAR);

    private final FilterMapper filterMapper;
    private final FilterAllowList filterAllowList;
    private final AppProperties appProperties;

    /** Tüm ortak parametreleri doğrular; eksik olanlara varsayılan atar. */
    public AnalyticsQuery validate(AnalyticsQueryParams params) {
        return AnalyticsQuery.builder()
                .siteId(validateSite(params.getSite()))
                .timeSpec(resolveTimeSpec(params))
                .timezone(validateTimezone(params.getTimezone()))
                .bucket(validateBucket(params.getBucket()))
                .filters(validateFilters(params.getFilters()))
                .userId(validateOptionalUserId(params.getUserId()))
                .page(params.getPage() != null ? params.getPage() : 1)
                .pageSize(pageSizeOrDefault(params.getPageSize()))
                .sortBy(validateSortBy(params.getSortBy()))
                .sortOrder(validateSortOrder(params.getSortOrder()))
                .build();
    }

    public int validateSite(String site) {
        if (site == null || site.isBlank()) {
            throw new InvalidParameterException("site", "Site is required");
        }
        try {
            int siteId = Integer.parseInt(site.trim());
            if (siteId <= 0) {
                throw new InvalidParameterException("site", "Site must be a positive integer");
            }
            return siteId;
        } catch (NumberFormatException e) {
            throw new InvalidParameterException("site", "Site must be a positive integer", e);
        }
    }

    /**
     * Varyant önceliği: dakika aralığı > son N dakika > takvim dönemi > tarih aralığı.
     * Birden fazla varyant gönderilmişse istek reddedilir.
     */
    public TimeSpec resolveTimeSpec(AnalyticsQueryParams params) {
        boolean hasMinutesRange = params.getPastMinutesStart() != null || params.getPastMinutesEnd() != null;
        boolean hasPastMinutes = params.getPastMinutes() != null;
        boolean hasPeriod = hasText(params.getPeriod());
        boolean hasDates = hasText(params.getStartDate()) || hasText(params.getEndDate());

        List<String> supplied = new ArrayList<>();
        if (hasMinutesRange) supplied.add("pastMinutesStart/pastMinutesEnd");
        if (hasPastMinutes) supplied.add("pastMinutes");
        if (hasPeriod) supplied.add("period");
        if (hasDates) supplied.add("startDate/endDate");
        if (supplied.size() > 1) {
            throw new InvalidParameterException("time",
                    "Only one time window may be supplied, got: " + String.join(", ", supplied));
        }

        if (hasMinutesRange) {
            return minutesRange(params.getPastMinutesStart(), params.getPastMinutesEnd());
        }
        if (hasPastMinutes) {
            return TimeSpec.pastMinutes(params.getPastMinutes());
        }
        if (hasPeriod) {
            BucketGranularity period = BucketGranularity.fromValue(params.getPeriod())
                    .filter(CALENDAR_PERIODS::contains)
                    .orElseThrow(() -> new InvalidParameterException("period",
                            "period must be one of hour, day, week, month, year"));
            return TimeSpec.calendarPeriod(period);
        }
        if (hasDates) {
            return dateRange(params.getStartDate(), params.getEndDate());
        }
        return TimeSpec.allTime();
    }

    private TimeSpec minutesRange(Integer start, Integer end) {
        if (start == null || end == null) {
            throw new InvalidParameterException("pastMinutesStart",
                    "pastMinutesStart and pastMinutesEnd must be supplied together");
        }
        if (start <= end) {
            throw new InvalidParameterException("pastMinutesStart", "pastMinutesStart must be greater than pastMinutesEnd");
        }
        return TimeSpec.pastMinutesRange(start, end);
    }

    private TimeSpec dateRange(String startDate, String endDate) {
        if (!hasText(startDate) || !hasText(endDate)) {
            throw new InvalidParameterException("startDate", "startDate and endDate must be supplied together");
        }
        LocalDate start = parseDate("startDate", startDate);
        LocalDate end = parseDate("endDate", endDate);
        if (start.isAfter(end)) {
            throw new InvalidParameterException("startDate", "startDate must not be after endDate");
        }
        return TimeSpec.dateRange(start, end);
    }

    private LocalDate parseDate(String field, String value) {
        try {
            return LocalDate.parse(value);
        } catch (DateTimeParseException e) {
            throw new InvalidParameterException(field, field + " must be an ISO date (yyyy-MM-dd)", e);
        }
    }

    /** Yalnızca bölge adları (ör. Europe/Istanbul); offset biçimleri ClickHouse'ta geçersiz. */
    public ZoneId validateTimezone(String timezone) {
        if (!hasText(timezone)) {
            return DEFAULT_TIMEZONE;
        }
        if (!ZoneId.getAvailableZoneIds().contains(timezone)) {
            throw new InvalidParameterException("timezone", "Unknown timezone: " + timezone);
        }
        return ZoneId.of(timezone);
    }

    public BucketGranularity validateBucket(String bucket) {
        if (!hasText(bucket)) {
            return BucketGranularity.HOUR;
        }
        return BucketGranularity.fromValue(bucket)
                .orElseThrow(() -> new InvalidParameterException("bucket", "Unsupported bucket: " + bucket));
    }

    /** filters JSON'unu çözer; parametre ve operatör MapStruct dönüşümünde doğrulanır. */
    public List<FilterPredicate> validateFilters(String filters) {
        List<FilterRequest> requests = filterMapper.decode(filters);
        for (FilterRequest request : requests) {
            if (request == null) {
                throw new InvalidParameterException(FilterMapper.FIELD, "Filter entries must be objects");
            }
            if (request.getValue() == null || request.getValue().isEmpty()) {
                throw new InvalidParameterException(FilterMapper.FIELD,
                        "Filter on " + request.getParameter() + " must have at least one value");
            }
            if (request.getValue().stream().anyMatch(v -> v == null)) {
                throw new InvalidParameterException(FilterMapper.FIELD,
                        "Filter on " + request.getParameter() + " has a null value");
            }
        }
        List<FilterPredicate> predicates = filterMapper.toPredicates(requests, filterAllowList);
        log.debug("Validated {} filter predicates", predicates.size());
        return List.copyOf(predicates);
    }

    /** Sayfa boyu ve limit; aralık kontrolü istek sınırında Bean Validation ile yapılır. */
    public int pageSizeOrDefault(Integer pageSize) {
        return pageSize != null ? pageSize : appProperties.getPagination().getDefaultPageSize();
    }

    public int offsetOrDefault(Integer offset) {
        return offset != null ? offset : 0;
    }

    public String validateSortBy(String sortBy) {
        if (!hasText(sortBy)) {
            return DEFAULT_SORT_BY;
        }
        if (!UserQueryBuilder.SORTABLE_COLUMNS.contains(sortBy)) {
            throw new InvalidParameterException("sortBy", "Unsupported sort column: " + sortBy);
        }
        return sortBy;
    }

    public AnalyticsQuery.SortOrder validateSortOrder(String sortOrder) {
        if (!hasText(sortOrder)) {
            return AnalyticsQuery.SortOrder.DESC;
        }
        return switch (sortOrder.toLowerCase(Locale.ROOT)) {
            case "asc" -> AnalyticsQuery.SortOrder.ASC;
            case "desc" -> AnalyticsQuery.SortOrder.DESC;
            default -> throw new InvalidParameterException("sortOrder", "sortOrder must be asc or desc");
        };
    }

    public String validateSessionId(String sessionId) {
        if (!hasText(sessionId)) {
            throw new InvalidParameterException("sessionId", "sessionId is required");
        }
        return sessionId;
    }

    public String requireUserId(String userId) {
        if (!hasText(userId)) {
            throw new InvalidParameterException("userId", "userId is required");
        }
        return userId;
    }

    private String validateOptionalUserId(String userId) {
        if (userId == null) {
            return null;
        }
        return requireUserId(userId);
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
