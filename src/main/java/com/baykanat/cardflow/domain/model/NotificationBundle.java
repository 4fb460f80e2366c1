package com.baykanat.cardflow.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/** Alıcı başına zaman penceresi; (tenant, recipient) için en fazla bir pending bundle. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NotificationBundle {

    private String id;
    private String tenantId;
    private String recipientId;
    private Instant windowStart;
    private Instant windowEnd;
    private BundleStatus status;
    private int attempts;
    private Instant claimedUntil; // processing iken yeniden deneme / lease bitişi
    private Instant deliveredAt;
}
