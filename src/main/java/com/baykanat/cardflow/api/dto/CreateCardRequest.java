package com.baykanat.cardflow.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

/** Yeni kart; drafted olarak açılır. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Card creation payload")
public class CreateCardRequest {

    @NotBlank(message = "board_id is required")
    @JsonProperty("board_id")
    @Schema(description = "Board the card belongs to", example = "0b6d6f1e-8a39-4c3f-9c55-2f6f3f1c2a10")
    private String boardId;

    @Size(max = 500, message = "title must be at most 500 characters")
    @JsonProperty("title")
    @Schema(description = "Card title; blank titles become \"Untitled\" on publish", example = "Fix login redirect")
    private String title;

    @JsonProperty("column_id")
    @Schema(description = "Optional initial column on the same board; omitted → card awaits triage")
    private String columnId;

    @JsonProperty("due_on")
    @Schema(description = "Optional due date (ISO-8601 date)", example = "2026-08-01")
    private LocalDate dueOn;
}
