package com.baykanat.insider.analytics.domain.service;

import com.baykanat.insider.analytics.api.dto.AnalyticsQueryParams;
import com.baykanat.insider.analytics.api.dto.PagedResponse;
import com.baykanat.insider.analytics.domain.model.AnalyticsQuery;
import com.baykanat.insider.analytics.domain.query.UserQueryBuilder;
import com.baykanat.insider.analytics.infrastructure.persistence.AnalyticsJdbcRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;

/** Kullanıcı listesi; sayfa + sıralama, toplam kullanıcı sayısı ayrı sayım sorgusundan. */
@Slf4j
@Service
@RequiredArgsConstructor
public class UserService {

    static final String TOTAL_COUNT_COLUMN = "total_count";

    private final ParameterValidator parameterValidator;
    private final UserQueryBuilder userQueryBuilder;
    private final AnalyticsJdbcRepository analyticsRepository;

    public PagedResponse getUsers(AnalyticsQueryParams params) {
        AnalyticsQuery query = parameterValidator.validate(params);
        log.debug("Users for site_id={}, page={}, pageSize={}, sort={} {}",
                query.getSiteId(), query.getPage(), query.getPageSize(), query.getSortBy(), query.getSortOrder());

        List<Map<String, Object>> rows = analyticsRepository.query(userQueryBuilder.userList(query));
        long totalCount = analyticsRepository.queryForCount(userQueryBuilder.userCount(query), TOTAL_COUNT_COLUMN);

        return PagedResponse.builder()
                .data(rows)
                .page(query.getPage())
                .pageSize(query.getPageSize())
                .totalCount(totalCount)
                .hasMore(query.getOffset() + rows.size() < totalCount)
                .build();
    }
}
