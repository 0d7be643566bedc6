package com.baykanat.insider.analytics.api.controller;

import com.baykanat.insider.analytics.api.dto.AnalyticsQueryParams;
import com.baykanat.insider.analytics.api.dto.AnalyticsResponse;
import com.baykanat.insider.analytics.api.dto.PagedResponse;
import com.baykanat.insider.analytics.api.dto.SessionDetailsResponse;
import com.baykanat.insider.analytics.domain.service.SessionService;
import com.baykanat.insider.analytics.domain.service.SiteAccessService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springdoc.core.annotations.ParameterObject;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.ModelAttribute;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/** Oturum listesi, oturum detayı ve kullanıcı başına günlük oturum sayısı. */
@Slf4j
@RestController
@RequiredArgsConstructor
@Validated
@Tag(name = "Sessions", description = "Reconstructed visitor sessions")
public class SessionController {

    private final SiteAccessService siteAccessService;
    private final SessionService sessionService;

    /** Sayfa boyu sabit 100; totalCount yok. Gönderilen pageSize kullanılmaz ama yine doğrulanır. */
    @GetMapping("/sessions/{site}")
    @Operation(summary = "List sessions",
            description = "Returns sessions newest first, 100 per page. pageSize does not change the page size "
                    + "here, but a supplied pageSize outside 1..100 is still rejected with 400")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Sessions retrieved successfully"),
            @ApiResponse(responseCode = "400", description = "Invalid query parameters, including pageSize outside 1..100"),
            @ApiResponse(responseCode = "403", description = "Site access denied")
    })
    public ResponseEntity<PagedResponse> getSessions(
            @Parameter(description = "Numeric site identifier", required = true, example = "1")
            @PathVariable("site") String site,
            @Valid @ParameterObject @ModelAttribute AnalyticsQueryParams params,
            HttpServletRequest request
    ) {
        siteAccessService.requireAccess(request, site);
        params.setSite(site);
        return ResponseEntity.ok(sessionService.getSessions(params));
    }

    @GetMapping("/session/{sessionId}/{site}")
    @Operation(summary = "Get session details",
            description = "Returns the session summary and an offset/limit page of its events")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Session retrieved successfully"),
            @ApiResponse(responseCode = "400", description = "Invalid query parameters"),
            @ApiResponse(responseCode = "403", description = "Site access denied")
    })
    public ResponseEntity<AnalyticsResponse<SessionDetailsResponse>> getSessionDetails(
            @Parameter(description = "Session identifier", required = true, example = "9f8e7d")
            @PathVariable("sessionId") String sessionId,

            @Parameter(description = "Numeric site identifier", required = true, example = "1")
            @PathVariable("site") String site,

            @Parameter(description = "Events per page, 1..100. Default: 100", example = "100")
            @RequestParam(value = "limit", required = false)
            @Min(value = 1, message = "limit must be between 1 and 100")
            @Max(value = AnalyticsQueryParams.MAX_PAGE_SIZE, message = "limit must be between 1 and 100") Integer limit,

            @Parameter(description = "Events to skip. Default: 0", example = "0")
            @RequestParam(value = "offset", required = false)
            @PositiveOrZero(message = "offset must not be negative") Integer offset,

            @Valid @ParameterObject @ModelAttribute AnalyticsQueryParams params,
            HttpServletRequest request
    ) {
        siteAccessService.requireAccess(request, site);
        params.setSite(site);
        return ResponseEntity.ok(AnalyticsResponse.of(
                sessionService.getSessionDetails(params, sessionId, limit, offset)));
    }

    @GetMapping("/user/session-count/{site}")
    @Operation(summary = "Get sessions per day for a user",
            description = "Returns one row per day with the user's session count, dated in the caller's timezone")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Counts retrieved successfully"),
            @ApiResponse(responseCode = "400", description = "Missing userId or invalid query parameters"),
            @ApiResponse(responseCode = "403", description = "Site access denied")
    })
    public ResponseEntity<AnalyticsResponse<List<Map<String, Object>>>> getUserSessionCount(
            @Parameter(description = "Numeric site identifier", required = true, example = "1")
            @PathVariable("site") String site,
            @Valid @ParameterObject @ModelAttribute AnalyticsQueryParams params,
            HttpServletRequest request
    ) {
        siteAccessService.requireAccess(request, site);
        params.setSite(site);
        return ResponseEntity.ok(AnalyticsResponse.of(sessionService.getUserSessionCount(params)));
    }
}
