package com.baykanat.cardflow.infrastructure.persistence;

import com.baykanat.cardflow.domain.model.BundleStatus;
import com.baykanat.cardflow.domain.model.NotificationBundle;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static com.baykanat.cardflow.infrastructure.persistence.SqlTimestamps.getInstant;
import static com.baykanat.cardflow.infrastructure.persistence.SqlTimestamps.toTimestamp;

/**
 * notification_bundles tablosu.
 *
 * <p>Durum geçişleri koşullu UPDATE ile yapılır; etkilenen satır sayısı sahipliği belirler.
 * (tenant, recipient) başına tek pending kaydı partial unique index garanti eder.
 */
@Repository
@RequiredArgsConstructor
public class NotificationBundleJdbcRepository {

    private final JdbcTemplate jdbcTemplate;

    private static final RowMapper<NotificationBundle> ROW_MAPPER = (rs, rowNum) -> NotificationBundle.builder()
            .id(rs.getString("id"))
            .tenantId(rs.getString("tenant_id"))
            .recipientId(rs.getString("recipient_id"))
            .windowStart(getInstant(rs, "window_start"))
            .windowEnd(getInstant(rs, "window_end"))
            .status(BundleStatus.fromDbValue(rs.getString("status")))
            .attempts(rs.getInt("attempts"))
            .claimedUntil(getInstant(rs, "claimed_until"))
            .deliveredAt(getInstant(rs, "delivered_at"))
            .build();

    /** true → yeni pending bundle açıldı; false → alıcının zaten pending bundle'ı var. */
    public boolean insertPendingIfAbsent(NotificationBundle bundle) {
        return jdbcTemplate.update("""
                INSERT INTO notification_bundles (id, tenant_id, recipient_id, window_start, window_end, status)
                VALUES (?, ?, ?, ?, ?, 'pending')
                ON CONFLICT DO NOTHING
                """,
                bundle.getId(), bundle.getTenantId(), bundle.getRecipientId(),
                toTimestamp(bundle.getWindowStart()), toTimestamp(bundle.getWindowEnd())) > 0;
    }

    public Optional<NotificationBundle> findById(String bundleId) {
        return jdbcTemplate.query("SELECT * FROM notification_bundles WHERE id = ?", ROW_MAPPER, bundleId)
                .stream().findFirst();
    }

    public Optional<NotificationBundle> findPending(String tenantId, String recipientId) {
        return jdbcTemplate.query(
                "SELECT * FROM notification_bundles WHERE tenant_id = ? AND recipient_id = ? AND status = 'pending'",
                ROW_MAPPER, tenantId, recipientId).stream().findFirst();
    }

    /** pending → processing. Yalnızca bir çağıran başarılı olur. */
    public boolean claim(String bundleId, Instant claimedUntil) {
        return jdbcTemplate.update("""
                UPDATE notification_bundles SET status = 'processing', claimed_until = ?
                WHERE id = ? AND status = 'pending'
                """, toTimestamp(claimedUntil), bundleId) == 1;
    }

    /** Süresi dolmuş processing claim'ini yeniden alır (başarısız teslim veya çöken işçi). */
    public boolean reclaim(String bundleId, Instant now, Instant claimedUntil) {
        return jdbcTemplate.update("""
                UPDATE notification_bundles SET claimed_until = ?
                WHERE id = ? AND status = 'processing' AND claimed_until <= ?
                """, toTimestamp(claimedUntil), bundleId, toTimestamp(now)) == 1;
    }

    public boolean markDelivered(String bundleId, Instant deliveredAt) {
        return jdbcTemplate.update("""
                UPDATE notification_bundles SET status = 'delivered', delivered_at = ?, claimed_until = NULL
                WHERE id = ? AND status = 'processing'
                """, toTimestamp(deliveredAt), bundleId) == 1;
    }

    /** Başarısız teslim: processing kalır, claimed_until bir sonraki deneme zamanı olur. */
    public void markFailed(String bundleId, int attempts, Instant retryAt) {
        jdbcTemplate.update("""
                UPDATE notification_bundles SET attempts = ?, claimed_until = ?
                WHERE id = ? AND status = 'processing'
                """, attempts, toTimestamp(retryAt), bundleId);
    }

    public List<String> findDuePending(Instant now, int limit) {
        return jdbcTemplate.queryForList("""
                SELECT id FROM notification_bundles
                WHERE status = 'pending' AND window_end <= ?
                ORDER BY window_end
                LIMIT ?
                """, String.class, toTimestamp(now), limit);
    }

    public List<String> findExpiredProcessing(Instant now, int limit) {
        return jdbcTemplate.queryForList("""
                SELECT id FROM notification_bundles
                WHERE status = 'processing' AND claimed_until <= ?
                ORDER BY claimed_until
                LIMIT ?
                """, String.class, toTimestamp(now), limit);
    }
}
