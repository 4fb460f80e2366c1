package com.baykanat.cardflow.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Board column")
public class ColumnResponse {

    @JsonProperty("id")
    private String id;

    @JsonProperty("board_id")
    private String boardId;

    @JsonProperty("name")
    private String name;

    @JsonProperty("position")
    @Schema(description = "Zero-based order on the board", example = "0")
    private int position;

    @JsonProperty("created_at")
    private Instant createdAt;
}
