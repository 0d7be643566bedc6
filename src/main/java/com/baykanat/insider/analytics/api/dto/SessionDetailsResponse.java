package com.baykanat.insider.analytics.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/** Oturum özeti + offset/limit sayfalı olay listesi. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Session summary with a page of its events")
public class SessionDetailsResponse {

    @JsonProperty("session")
    @Schema(description = "Session summary, null when the session has no events in the window")
    private Map<String, Object> session;

    @JsonProperty("pageviews")
    @Schema(description = "Events of the session in time order")
    private List<Map<String, Object>> pageviews;

    @JsonProperty("pagination")
    private Pagination pagination;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @Schema(description = "Offset pagination with a server-side total")
    public static class Pagination {
        @Schema(description = "Total events in the session", example = "250")
        private long total;
        @Schema(description = "Page size", example = "100")
        private int limit;
        @Schema(description = "Offset of this page", example = "100")
        private int offset;
        @Schema(description = "offset + limit < total", example = "true")
        private boolean hasMore;
    }
}
