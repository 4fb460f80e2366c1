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
@Schema(description = "Open card close to being auto-postponed")
public class ExpiryWarningResponse {

    @JsonProperty("card_id")
    private String cardId;

    @JsonProperty("board_id")
    private String boardId;

    @JsonProperty("title")
    private String title;

    @JsonProperty("last_active_at")
    private Instant lastActiveAt;

    @JsonProperty("period")
    @Schema(example = "P30D", type = "string")
    private Duration period;

    @JsonProperty("postpone_at")
    @Schema(description = "Instant the entropy sweep will postpone the card if it stays untouched")
    private Instant postponeAt;
}
