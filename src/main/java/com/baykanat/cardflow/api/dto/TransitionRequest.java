package com.baykanat.cardflow.api.dto;

import com.baykanat.cardflow.domain.model.LifecycleAction;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Lifecycle transition request")
public class TransitionRequest {

    @NotNull(message = "action is required")
    @JsonProperty("action")
    @Schema(description = "publish, close, postpone, reopen, resume or triageInto", example = "publish")
    private LifecycleAction action;

    @JsonProperty("column_id")
    @Schema(description = "Target column, required for triageInto")
    private String columnId;
}
