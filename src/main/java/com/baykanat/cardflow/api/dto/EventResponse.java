package com.baykanat.cardflow.api.dto;

import com.baykanat.cardflow.domain.model.EventAction;
import com.baykanat.cardflow.domain.model.TargetType;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

/** Event log kaydı. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Event log entry")
public class EventResponse {

    @JsonProperty("id")
    private String id;

    @JsonProperty("board_id")
    private String boardId;

    @JsonProperty("actor_id")
    private String actorId;

    @JsonProperty("action")
    @Schema(example = "postpone")
    private EventAction action;

    @JsonProperty("target_type")
    private TargetType targetType;

    @JsonProperty("target_id")
    private String targetId;

    @JsonProperty("payload")
    @Schema(example = "{\"reason\": \"entropy\"}")
    private Map<String, Object> payload;

    @JsonProperty("created_at")
    private Instant createdAt;
}
