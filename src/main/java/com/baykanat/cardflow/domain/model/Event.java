package com.baykanat.cardflow.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

/** events tablosu satırı; yazıldıktan sonra değişmez. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Event {

    private String id;
    private String tenantId;
    private String boardId;
    private String actorId;
    private EventAction action;
    private EventTarget target;
    private Map<String, Object> payload; // JSONB
    private Instant createdAt;
}
