package com.baykanat.insider.analytics.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Sayfalamasız analitik yanıtı: {data}. */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Analytics response envelope")
public class AnalyticsResponse<T> {

    @JsonProperty("data")
    @Schema(description = "Normalized result rows")
    private T data;

    public static <T> AnalyticsResponse<T> of(T data) {
        return new AnalyticsResponse<>(data);
    }
}
