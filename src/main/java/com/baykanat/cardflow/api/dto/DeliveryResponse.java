package com.baykanat.cardflow.api.dto;

import com.baykanat.cardflow.domain.model.DeliveryOutcome;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Manuel teslim sonucu; bundle zaten teslim edilmişse SKIPPED. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Result of a manual bundle delivery")
public class DeliveryResponse {

    @JsonProperty("bundle_id")
    private String bundleId;

    @JsonProperty("outcome")
    @Schema(example = "DELIVERED")
    private DeliveryOutcome outcome;
}
