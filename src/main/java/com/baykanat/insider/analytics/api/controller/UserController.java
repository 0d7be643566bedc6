package com.baykanat.insider.analytics.api.controller;

import com.baykanat.insider.analytics.api.dto.AnalyticsQueryParams;
import com.baykanat.insider.analytics.api.dto.PagedResponse;
import com.baykanat.insider.analytics.domain.service.SiteAccessService;
import com.baykanat.insider.analytics.domain.service.UserService;
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

/** GET /users: sayfalı ve sıralı kullanıcı listesi. */
@Slf4j
@RestController
@RequiredArgsConstructor
@Validated
@Tag(name = "Users", description = "Identified users of a site")
public class UserController {

    private final SiteAccessService siteAccessService;
    private final UserService userService;

    @GetMapping("/users/{site}")
    @Operation(summary = "List users", description = "Returns users with activity counts, sorted and paginated")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Users retrieved successfully"),
            @ApiResponse(responseCode = "400", description = "Invalid query parameters"),
            @ApiResponse(responseCode = "403", description = "Site access denied")
    })
    public ResponseEntity<PagedResponse> getUsers(
            @Parameter(description = "Numeric site identifier", required = true, example = "1")
            @PathVariable("site") String site,
            @Valid @ParameterObject @ModelAttribute AnalyticsQueryParams params,
            HttpServletRequest request
    ) {
        siteAccessService.requireAccess(request, site);
        params.setSite(site);
        return ResponseEntity.ok(userService.getUsers(params));
    }
}
