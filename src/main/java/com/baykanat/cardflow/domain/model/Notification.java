package com.baykanat.cardflow.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/** Alıcı başına bir event kaydı; teslim edilince bundleId ve deliveredAt dolar. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Notification {

    private String id;
    private String tenantId;
    private String recipientId;
    private String eventId;
    private Instant createdAt;
    private String bundleId;
    private Instant deliveredAt;
}
