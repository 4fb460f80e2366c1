package com.baykanat.cardflow.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;

/** Süre ISO-8601 olarak gelir (ör. P30D, PT12H); pozitiflik servis katmanında kontrol edilir. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Auto-postpone period configuration")
public class EntropyConfigRequest {

    @NotNull(message = "auto_postpone_period is required")
    @JsonProperty("auto_postpone_period")
    @Schema(description = "ISO-8601 duration", example = "P30D", type = "string")
    private Duration autoPostponePeriod;
}
