package com.baykanat.cardflow.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/** Board'a ait kolon; kart yalnızca kendi board'unun kolonlarına triage edilebilir. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BoardColumn {

    private String id;
    private String tenantId;
    private String boardId;
    private String name;
    private int position;
    private Instant createdAt;
}
