package com.baykanat.insider.analytics.api.controller;

import com.baykanat.insider.analytics.api.dto.AnalyticsQueryParams;
import com.baykanat.insider.analytics.api.dto.AnalyticsResponse;
import com.baykanat.insider.analytics.domain.service.OverviewService;
import com.baykanat.insider.analytics.domain.service.SiteAccessService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springdoc.core.annotations.ParameterObject;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.ModelAttribute;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/** GET /overview ve /overview-bucketed. Erişim kontrolü sorgudan önce yapılır. */
@Slf4j
@RestController
@RequiredArgsConstructor
@Validated
@Tag(name = "Overview", description = "Site-wide totals and time series")
public class OverviewController {

    private final SiteAccessService siteAccessService;
    private final OverviewService overviewService;

    @GetMapping("/overview/{site}")
    @Operation(summary = "Get overview totals",
            description = "Returns pageviews, visitors, sessions, pages per session, bounce rate and session duration")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Overview retrieved successfully"),
            @ApiResponse(responseCode = "400", description = "Invalid query parameters"),
            @ApiResponse(responseCode = "403", description = "Site access denied"),
            @ApiResponse(responseCode = "503", description = "Analytics store temporarily unavailable")
    })
    public ResponseEntity<AnalyticsResponse<List<Map<String, Object>>>> getOverview(
            @Parameter(description = "Numeric site identifier", required = true, example = "1")
            @PathVariable("site") String site,
            @Valid @ParameterObject @ModelAttribute AnalyticsQueryParams params,
            HttpServletRequest request
    ) {
        siteAccessService.requireAccess(request, site);
        params.setSite(site);
        return ResponseEntity.ok(AnalyticsResponse.of(overviewService.getOverview(params)));
    }

    /** Boş dilimler sıfırla doldurulur; satırlar time'a göre artan. */
    @GetMapping("/overview-bucketed/{site}")
    @Operation(summary = "Get bucketed overview",
            description = "Returns the overview metrics per time bucket, gap-filled over the requested window")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Time series retrieved successfully"),
            @ApiResponse(responseCode = "400", description = "Invalid query parameters"),
            @ApiResponse(responseCode = "403", description = "Site access denied"),
            @ApiResponse(responseCode = "503", description = "Analytics store temporarily unavailable")
    })
    public ResponseEntity<AnalyticsResponse<List<Map<String, Object>>>> getOverviewBucketed(
            @Parameter(description = "Numeric site identifier", required = true, example = "1")
            @PathVariable("site") String site,
            @Valid @ParameterObject @ModelAttribute AnalyticsQueryParams params,
            HttpServletRequest request
    ) {
        siteAccessService.requireAccess(request, site);
        params.setSite(site);
        return ResponseEntity.ok(AnalyticsResponse.of(overviewService.getOverviewBucketed(params)));
    }
}
