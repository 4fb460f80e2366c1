package com.baykanat.cardflow.infrastructure.persistence;

import com.baykanat.cardflow.domain.model.Notification;
import com.baykanat.cardflow.domain.model.NotificationBatch;
import com.baykanat.cardflow.domain.model.UndeliveredBacklog;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import static com.baykanat.cardflow.infrastructure.persistence.SqlTimestamps.getInstant;
import static com.baykanat.cardflow.infrastructure.persistence.SqlTimestamps.toTimestamp;

/** notifications tablosu; teslim anında events ile join edilerek paket oluşturulur. */
@Slf4j
@Repository
@RequiredArgsConstructor
public class NotificationJdbcRepository {

    private static final TypeReference<Map<String, Object>> PAYLOAD_TYPE = new TypeReference<>() {
    };

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;

    /** (event_id, recipient_id) tekrarında satır atlanır. */
    public void batchInsert(List<Notification> notifications) {
        if (notifications.isEmpty()) {
            return;
        }
        jdbcTemplate.batchUpdate("""
                INSERT INTO notifications (id, tenant_id, recipient_id, event_id, created_at)
                VALUES (?, ?, ?, ?, ?)
                ON CONFLICT (event_id, recipient_id) DO NOTHING
                """, notifications, notifications.size(),
                (ps, n) -> {
                    ps.setString(1, n.getId());
                    ps.setString(2, n.getTenantId());
                    ps.setString(3, n.getRecipientId());
                    ps.setString(4, n.getEventId());
                    ps.setTimestamp(5, toTimestamp(n.getCreatedAt()));
                });
    }

    /** Alıcının [windowStart, windowEnd] içinde oluşmuş ve henüz teslim edilmemiş bildirimleri. */
    public List<NotificationBatch.Item> findUndeliveredInWindow(String tenantId, String recipientId,
                                                                Instant windowStart, Instant windowEnd) {
        return jdbcTemplate.query("""
                SELECT n.id AS notification_id, n.created_at AS notified_at,
                       e.id AS event_id, e.action, e.target_type, e.target_id, e.board_id, e.actor_id, e.payload
                FROM notifications n
                JOIN events e ON e.id = n.event_id
                WHERE n.tenant_id = ? AND n.recipient_id = ?
                  AND n.delivered_at IS NULL
                  AND n.created_at >= ? AND n.created_at <= ?
                ORDER BY n.created_at, n.id
                """,
                (rs, rowNum) -> NotificationBatch.Item.builder()
                        .notificationId(rs.getString("notification_id"))
                        .eventId(rs.getString("event_id"))
                        .action(rs.getString("action"))
                        .targetType(rs.getString("target_type"))
                        .targetId(rs.getString("target_id"))
                        .boardId(rs.getString("board_id"))
                        .actorId(rs.getString("actor_id"))
                        .payload(readPayload(rs.getString("payload")))
                        .createdAt(getInstant(rs, "notified_at"))
                        .build(),
                tenantId, recipientId, toTimestamp(windowStart), toTimestamp(windowEnd));
    }

    public void markDelivered(Collection<String> notificationIds, String bundleId, Instant deliveredAt) {
        if (notificationIds.isEmpty()) {
            return;
        }
        List<Object[]> batchArgs = notificationIds.stream()
                .map(id -> new Object[]{bundleId, toTimestamp(deliveredAt), id})
                .toList();
        jdbcTemplate.batchUpdate(
                "UPDATE notifications SET bundle_id = ?, delivered_at = ? WHERE id = ? AND delivered_at IS NULL",
                batchArgs);
    }

    /** Alıcının teslim edilmemiş en eski bildirim zamanı. */
    public Optional<Instant> findEarliestUndelivered(String tenantId, String recipientId) {
        return jdbcTemplate.query("""
                SELECT MIN(created_at) AS earliest FROM notifications
                WHERE tenant_id = ? AND recipient_id = ? AND delivered_at IS NULL
                """,
                (rs, rowNum) -> getInstant(rs, "earliest"),
                tenantId, recipientId).stream()
                .filter(Objects::nonNull)
                .findFirst();
    }

    /**
     * olderThan'dan önce oluşmuş teslim edilmemiş bildirimi olup pending veya processing bundle'ı
     * bulunmayan alıcılar. Bundle teslim edilirken henüz commit edilmemiş bildirimler böyle kalır.
     */
    public List<UndeliveredBacklog> findRecipientsWithoutBundle(Instant olderThan, int limit) {
        return jdbcTemplate.query("""
                SELECT n.tenant_id, n.recipient_id, MIN(n.created_at) AS earliest
                FROM notifications n
                WHERE n.delivered_at IS NULL AND n.created_at < ?
                  AND NOT EXISTS (
                      SELECT 1 FROM notification_bundles b
                      WHERE b.tenant_id = n.tenant_id AND b.recipient_id = n.recipient_id
                        AND b.status IN ('pending', 'processing'))
                GROUP BY n.tenant_id, n.recipient_id
                ORDER BY earliest
                LIMIT ?
                """,
                (rs, rowNum) -> UndeliveredBacklog.builder()
                        .tenantId(rs.getString("tenant_id"))
                        .recipientId(rs.getString("recipient_id"))
                        .earliest(getInstant(rs, "earliest"))
                        .build(),
                toTimestamp(olderThan), limit);
    }

    private Map<String, Object> readPayload(String json) {
        if (json == null) {
            return Map.of();
        }
        try {
            return objectMapper.readValue(json, PAYLOAD_TYPE);
        } catch (JsonProcessingException e) {
            log.warn("Unreadable event payload in notification batch: {}", e.getMessage());
            return Map.of();
        }
    }
}
