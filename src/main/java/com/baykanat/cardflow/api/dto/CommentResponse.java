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
@Schema(description = "Comment")
public class CommentResponse {

    @JsonProperty("id")
    private String id;

    @JsonProperty("card_id")
    private String cardId;

    @JsonProperty("author_id")
    private String authorId;

    @JsonProperty("body")
    private String body;

    @JsonProperty("created_at")
    private Instant createdAt;
}
