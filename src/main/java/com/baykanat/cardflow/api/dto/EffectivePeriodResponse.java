package com.baykanat.cardflow.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Resolved auto-postpone period for a board")
public class EffectivePeriodResponse {

    @JsonProperty("board_id")
    private String boardId;

    @JsonProperty("auto_postpone_period")
    @Schema(example = "P30D", type = "string")
    private Duration autoPostponePeriod;
}
