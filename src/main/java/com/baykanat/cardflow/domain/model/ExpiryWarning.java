package com.baykanat.cardflow.domain.model;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.time.Instant;

/** Entropy süresinin uyarı oranını geçmiş açık kart. */
@Value
@Builder
public class ExpiryWarning {

    String cardId;
    String boardId;
    String title;
    Instant lastActiveAt;
    Duration period;
    Instant postponeAt;
}
