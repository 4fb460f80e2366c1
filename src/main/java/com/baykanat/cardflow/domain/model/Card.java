package com.baykanat.cardflow.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalDate;

/** cards tablosu satırı (JDBC, JPA değil). Sadece LifecycleEngine üzerinden değişir. */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Card {

    private String id;
    private String tenantId;
    private long number;         // tenant içinde 1'den artan
    private String boardId;
    private String columnId;     // null → triage bekliyor
    private String title;
    private LocalDate dueOn;
    private String creatorId;
    private CardStatus status;
    private Instant closedAt;
    private String closedBy;
    private Instant postponedAt;
    private String postponedBy;
    private Instant lastActiveAt;
    private boolean golden;
    private Instant activitySpikeAt;
    private Instant createdAt;
    private long version;

    public EffectiveState effectiveState() {
        return EffectiveState.of(this);
    }
}
