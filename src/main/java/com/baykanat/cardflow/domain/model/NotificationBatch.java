package com.baykanat.cardflow.domain.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/** Teslim kanalına tek seferde verilen bildirim paketi. */
@Value
@Builder
public class NotificationBatch {

    String bundleId;
    String tenantId;
    String recipientId;
    Instant windowStart;
    Instant windowEnd;
    List<Item> items;

    @Value
    @Builder
    public static class Item {
        String notificationId;
        String eventId;
        String action;
        String targetType;
        String targetId;
        String boardId;
        String actorId;
        Map<String, Object> payload;
        Instant createdAt;
    }
}
