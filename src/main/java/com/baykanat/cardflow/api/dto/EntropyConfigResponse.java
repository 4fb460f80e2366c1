package com.baykanat.cardflow.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Stored auto-postpone period")
public class EntropyConfigResponse {

    @JsonProperty("scope")
    @Schema(example = "board")
    private String scope;

    @JsonProperty("scope_id")
    private String scopeId;

    @JsonProperty("auto_postpone_period")
    @Schema(example = "P30D", type = "string")
    private Duration autoPostponePeriod;

    @JsonProperty("updated_by")
    private String updatedBy;

    @JsonProperty("updated_at")
    private Instant updatedAt;
}
