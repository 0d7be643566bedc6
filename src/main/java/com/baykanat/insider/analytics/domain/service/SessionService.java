package com.baykanat.insider.analytics.domain.service;

import com.baykanat.insider.analytics.api.dto.AnalyticsQueryParams;
import com.baykanat.insider.analytics.api.dto.PagedResponse;
import com.baykanat.insider.analytics.api.dto.SessionDetailsResponse;
import com.baykanat.insider.analytics.config.AppProperties;
import com.baykanat.insider.analytics.domain.model.AnalyticsQuery;
import com.baykanat.insider.analytics.domain.query.SessionQueryBuilder;
import com.baykanat.insider.analytics.infrastructure.persistence.AnalyticsJdbcRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;

/**
 * Oturum listesi ve oturum detayı.
 *
 * <p>Liste sabit sayfa boyuyla sayfa numarasına göre gelir; sayfa tam doluysa devamı olabilir.
 * Detaydaki olaylar offset/limit ile gelir ve toplam sunucuda sayılır.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SessionService {

    static final String TOTAL_COLUMN = "total";

    private final ParameterValidator parameterValidator;
    private final SessionQueryBuilder sessionQueryBuilder;
    private final AnalyticsJdbcRepository analyticsRepository;
    private final AppProperties appProperties;

    public PagedResponse getSessions(AnalyticsQueryParams params) {
        int pageSize = appProperties.getPagination().getSessionPageSize();
        AnalyticsQuery query = parameterValidator.validate(params).toBuilder()
                .pageSize(pageSize)
                .build();
        log.debug("Sessions for site_id={}, user_id={}, page={}", query.getSiteId(), query.getUserId(), query.getPage());

        List<Map<String, Object>> rows = analyticsRepository.query(sessionQueryBuilder.sessionList(query));
        return PagedResponse.builder()
                .data(rows)
                .page(query.getPage())
                .pageSize(pageSize)
                .hasMore(rows.size() == pageSize)
                .build();
    }

    public SessionDetailsResponse getSessionDetails(AnalyticsQueryParams params, String sessionId,
                                                    Integer limit, Integer offset) {
        AnalyticsQuery query = parameterValidator.validate(params);
        String validSessionId = parameterValidator.validateSessionId(sessionId);
        int validLimit = parameterValidator.pageSizeOrDefault(limit);
        int validOffset = parameterValidator.offsetOrDefault(offset);

        List<Map<String, Object>> summary = analyticsRepository.query(
                sessionQueryBuilder.sessionDetails(query, validSessionId));
        long total = analyticsRepository.queryForCount(
                sessionQueryBuilder.sessionEventCount(query, validSessionId), TOTAL_COLUMN);
        List<Map<String, Object>> events = analyticsRepository.query(
                sessionQueryBuilder.sessionEvents(query, validSessionId, validLimit, validOffset));

        return SessionDetailsResponse.builder()
                .session(summary.isEmpty() ? null : summary.get(0))
                .pageviews(events)
                .pagination(SessionDetailsResponse.Pagination.builder()
                        .total(total)
                        .limit(validLimit)
                        .offset(validOffset)
                        .hasMore((long) validOffset + validLimit < total)
                        .build())
                .build();
    }

    /** Kullanıcının günlük oturum sayıları; tarih istemcinin saat dilimine göre. */
    public List<Map<String, Object>> getUserSessionCount(AnalyticsQueryParams params) {
        AnalyticsQuery query = parameterValidator.validate(params);
        parameterValidator.requireUserId(query.getUserId());
        return analyticsRepository.query(sessionQueryBuilder.userSessionCount(query));
    }
}
