package com.baykanat.cardflow.api.dto;

import com.baykanat.cardflow.domain.model.CardStatus;
import com.baykanat.cardflow.domain.model.EffectiveState;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalDate;

/** Kart görünümü; effective_state her okumada türetilir. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "Card with its derived effective state")
public class CardResponse {

    @JsonProperty("id")
    private String id;

    @JsonProperty("number")
    @Schema(description = "Human-readable card number, unique within the tenant", example = "42")
    private long number;

    @JsonProperty("board_id")
    private String boardId;

    @JsonProperty("column_id")
    private String columnId;

    @JsonProperty("title")
    private String title;

    @JsonProperty("due_on")
    @Schema(example = "2026-08-01")
    private LocalDate dueOn;

    @JsonProperty("creator_id")
    private String creatorId;

    @JsonProperty("status")
    private CardStatus status;

    @JsonProperty("effective_state")
    @Schema(description = "drafted, active, triage, closed or not_now", example = "active")
    private EffectiveState effectiveState;

    @JsonProperty("closed_at")
    private Instant closedAt;

    @JsonProperty("closed_by")
    private String closedBy;

    @JsonProperty("postponed_at")
    private Instant postponedAt;

    @JsonProperty("postponed_by")
    private String postponedBy;

    @JsonProperty("last_active_at")
    private Instant lastActiveAt;

    @JsonProperty("golden")
    private boolean golden;

    @JsonProperty("activity_spike_at")
    private Instant activitySpikeAt;

    @JsonProperty("created_at")
    private Instant createdAt;

    @JsonProperty("version")
    private long version;
}
