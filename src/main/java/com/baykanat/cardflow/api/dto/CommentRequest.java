package com.baykanat.cardflow.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Comment payload")
public class CommentRequest {

    @NotBlank(message = "body is required")
    @Size(max = 10000, message = "body must be at most 10000 characters")
    @JsonProperty("body")
    @Schema(description = "Comment text", example = "Reproduced on staging")
    private String body;
}
