package com.baykanat.insider.analytics.domain.service;

import com.baykanat.insider.analytics.api.dto.AnalyticsQueryParams;
import com.baykanat.insider.analytics.api.dto.PagedResponse;
import com.baykanat.insider.analytics.domain.model.AnalyticsQuery;
import com.baykanat.insider.analytics.domain.model.AnalyticsStatement;
import com.baykanat.insider.analytics.domain.model.TimeSpec;
import com.baykanat.insider.analytics.domain.query.UserQueryBuilder;
import com.baykanat.insider.analytics.infrastructure.persistence.AnalyticsJdbcRepository;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.ZoneId;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class UserServiceTest {

    private static final AnalyticsStatement LIST = new AnalyticsStatement("user-list", "SELECT 1", List.of());
    private static final AnalyticsStatement COUNT = new AnalyticsStatement("user-count", "SELECT 2", List.of());

    @Mock
    private ParameterValidator parameterValidator;

    @Mock
    private UserQueryBuilder userQueryBuilder;

    @Mock
    private AnalyticsJdbcRepository analyticsRepository;

    @InjectMocks
    private UserService userService;

    @Test
    @DisplayName("User list should carry totalCount and hasMore from the count query")
    void userListWithTotal() {
        PagedResponse response = listPage(2, 25, 25, 120L);

        assertThat(response.getTotalCount()).isEqualTo(120L);
        assertThat(response.getPage()).isEqualTo(2);
        assertThat(response.getPageSize()).isEqualTo(25);
        assertThat(response.isHasMore()).isTrue();
    }

    @Test
    @DisplayName("Last user page should report hasMore=false")
    void lastUserPage() {
        PagedResponse response = listPage(5, 25, 20, 120L);

        assertThat(response.getData()).hasSize(20);
        assertThat(response.isHasMore()).isFalse();
    }

    @Test
    @DisplayName("Pages far beyond the last user should be empty without overflowing the offset")
    void pageBeyondLastUser() {
        PagedResponse response = listPage(30_000_000, 100, 0, 2L);

        assertThat(response.getData()).isEmpty();
        assertThat(response.getPage()).isEqualTo(30_000_000);
        assertThat(response.isHasMore()).isFalse();
    }

    private PagedResponse listPage(int page, int pageSize, int rows, long total) {
        AnalyticsQueryParams params = AnalyticsQueryParams.builder().site("1").page(page).pageSize(pageSize).build();
        AnalyticsQuery query = AnalyticsQuery.builder()
                .siteId(1)
                .timeSpec(TimeSpec.allTime())
                .timezone(ZoneId.of("UTC"))
                .filters(List.of())
                .page(page)
                .pageSize(pageSize)
                .sortBy("last_seen")
                .sortOrder(AnalyticsQuery.SortOrder.DESC)
                .build();
        when(parameterValidator.validate(params)).thenReturn(query);
        when(userQueryBuilder.userList(query)).thenReturn(LIST);
        when(userQueryBuilder.userCount(query)).thenReturn(COUNT);
        when(analyticsRepository.query(LIST)).thenReturn(Collections.<Map<String, Object>>nCopies(rows, Map.of("user_id", "u")));
        when(analyticsRepository.queryForCount(COUNT, "total_count")).thenReturn(total);

        return userService.getUsers(params);
    }
}
