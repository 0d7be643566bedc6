package com.baykanat.insider.analytics.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/** filters sorgu parametresindeki JSON dizisinin tek elemanı; henüz doğrulanmamış. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Serialized filter predicate")
public class FilterRequest {

    @JsonProperty("parameter")
    @Schema(description = "Filter target (allow-listed column, utm_*, url_param:<name> or virtual parameter)", example = "browser")
    private String parameter;

    @JsonProperty("type")
    @Schema(description = "equals, not_equals, contains or not_contains", example = "equals")
    private String type;

    @JsonProperty("value")
    @Schema(description = "Values OR-ed together", example = "[\"Chrome\", \"Firefox\"]")
    private List<String> value;
}
