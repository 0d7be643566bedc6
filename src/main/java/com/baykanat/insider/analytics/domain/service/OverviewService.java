package com.baykanat.insider.analytics.domain.service;

import com.baykanat.insider.analytics.api.dto.AnalyticsQueryParams;
import com.baykanat.insider.analytics.domain.model.AnalyticsQuery;
import com.baykanat.insider.analytics.domain.query.BucketedAggregationPlanner;
import com.baykanat.insider.analytics.infrastructure.persistence.AnalyticsJdbcRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;

/** Overview toplamları ve dilimli zaman serisi. */
@Slf4j
@Service
@RequiredArgsConstructor
public class OverviewService {

    private final ParameterValidator parameterValidator;
    private final BucketedAggregationPlanner planner;
    private final AnalyticsJdbcRepository analyticsRepository;

    public List<Map<String, Object>> getOverview(AnalyticsQueryParams params) {
        AnalyticsQuery query = parameterValidator.validate(params);
        log.debug("Overview for site_id={}, time={}, filters={}",
                query.getSiteId(), query.getTimeSpec(), query.getFilters().size());
        return analyticsRepository.query(planner.planOverview(query));
    }

    /** Satırlar dilim zamanına göre artan sırada, boş dilimler 0 değerleriyle doldurulmuş gelir. */
    public List<Map<String, Object>> getOverviewBucketed(AnalyticsQueryParams params) {
        AnalyticsQuery query = parameterValidator.validate(params);
        log.debug("Bucketed overview for site_id={}, time={}, bucket={}, filters={}",
                query.getSiteId(), query.getTimeSpec(), query.getBucket().getValue(), query.getFilters().size());
        return analyticsRepository.query(planner.planBucketed(query));
    }
}
