package com.baykanat.insider.analytics.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * Sayfa numaralı liste yanıtı.
 *
 * <p>Oturum listesinde totalCount yoktur; hasMore dolu sayfa sezgisidir. Kullanıcı listesinde
 * totalCount sayım sorgusundan gelir.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "Page-numbered list response")
public class PagedResponse {

    @JsonProperty("data")
    @Schema(description = "Rows of the requested page")
    private List<Map<String, Object>> data;

    @JsonProperty("page")
    @Schema(description = "1-based page number", example = "1")
    private int page;

    @JsonProperty("pageSize")
    @Schema(description = "Requested page size", example = "100")
    private int pageSize;

    @JsonProperty("totalCount")
    @Schema(description = "Total matching rows, when cheap to compute", example = "250")
    private Long totalCount;

    @JsonProperty("hasMore")
    @Schema(description = "Whether page + 1 may return rows", example = "true")
    private boolean hasMore;
}
