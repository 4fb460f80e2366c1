package com.baykanat.cardflow.domain.service;

import com.baykanat.cardflow.config.AppProperties;
import com.baykanat.cardflow.domain.exception.NotFoundException;
import com.baykanat.cardflow.domain.model.AccessContext;
import com.baykanat.cardflow.domain.model.BundleStatus;
import com.baykanat.cardflow.domain.model.DeliveryOutcome;
import com.baykanat.cardflow.domain.model.Event;
import com.baykanat.cardflow.domain.model.Notification;
import com.baykanat.cardflow.domain.model.NotificationBatch;
import com.baykanat.cardflow.domain.model.NotificationBundle;
import com.baykanat.cardflow.domain.model.UndeliveredBacklog;
import com.baykanat.cardflow.infrastructure.persistence.NotificationBundleJdbcRepository;
import com.baykanat.cardflow.infrastructure.persistence.NotificationJdbcRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.time.Clock;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Bildirimleri alıcı başına zaman pencerelerinde toplar ve pencere sonunda tek paket olarak teslim eder.
 *
 * <p>Teslim en az bir kez çalışabilir: zamanlanmış callback, manuel tetikleme ve catch-all sweep
 * aynı {@link #deliver} metodunu çağırır; pending → processing geçişi koşullu UPDATE olduğundan
 * yalnızca bir çağıran paketi gönderir.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class NotificationBundler {

    private final NotificationJdbcRepository notificationRepository;
    private final NotificationBundleJdbcRepository bundleRepository;
    private final NotificationDeliveryChannel deliveryChannel;
    private final DeliveryRetryPolicy retryPolicy;
    private final TaskScheduler taskScheduler;
    private final AppProperties appProperties;
    private final Clock clock;

    /**
     * Event'i her alıcı için bildirim olarak kaydeder; pending bundle'ı olmayan alıcıya yeni pencere açar.
     * Mevcut pending bundle değiştirilmez, bildirim teslim anında event log taranarak toplanır.
     */
    public void record(AccessContext ctx, Event event, Collection<String> recipients) {
        if (!ctx.getTenantId().equals(event.getTenantId())) {
            throw new IllegalArgumentException("Event " + event.getId() + " does not belong to tenant " + ctx.getTenantId());
        }
        List<String> distinctRecipients = recipients.stream().distinct().toList();
        if (distinctRecipients.isEmpty()) {
            return;
        }

        Instant now = clock.instant();
        List<Notification> notifications = distinctRecipients.stream()
                .map(recipientId -> Notification.builder()
                        .id(UUID.randomUUID().toString())
                        .tenantId(ctx.getTenantId())
                        .recipientId(recipientId)
                        .eventId(event.getId())
                        .createdAt(now)
                        .build())
                .toList();
        notificationRepository.batchInsert(notifications);

        int opened = 0;
        for (String recipientId : distinctRecipients) {
            if (openBundleIfAbsent(ctx.getTenantId(), recipientId, now)) {
                opened++;
            }
        }
        log.debug("Recorded event {} for {} recipients, {} new bundles opened",
                event.getAction().getValue(), distinctRecipients.size(), opened);
    }

    /**
     * Bundle'ı teslim eder. Bundle yoksa veya pending değilse no-op; böylece tekrar eden çağrılar
     * ve erken manuel teslimden sonra gelen zamanlanmış callback etkisiz kalır.
     */
    public DeliveryOutcome deliver(String bundleId) {
        Optional<NotificationBundle> found = bundleRepository.findById(bundleId);
        if (found.isEmpty()) {
            log.debug("Bundle {} not found, nothing to deliver", bundleId);
            return DeliveryOutcome.SKIPPED;
        }
        NotificationBundle bundle = found.get();
        if (bundle.getStatus() != BundleStatus.PENDING) {
            log.debug("Bundle {} is {}, skipping delivery", bundleId, bundle.getStatus().getDbValue());
            return DeliveryOutcome.SKIPPED;
        }

        Instant now = clock.instant();
        if (!bundleRepository.claim(bundleId, now.plus(appProperties.getNotifications().getProcessingLease()))) {
            log.debug("Bundle {} was claimed by another worker", bundleId);
            return DeliveryOutcome.SKIPPED;
        }
        return process(bundle, now);
    }

    /** Manuel erken teslim; bundle çağıranın tenant'ına ait olmalı. */
    public DeliveryOutcome deliver(AccessContext ctx, String bundleId) {
        NotificationBundle bundle = bundleRepository.findById(bundleId)
                .filter(b -> b.getTenantId().equals(ctx.getTenantId()))
                .orElseThrow(() -> new NotFoundException("Notification bundle", bundleId));
        return deliver(bundle.getId());
    }

    /**
     * Catch-all sweep: penceresi bitmiş pending bundle'ları ve claim süresi dolmuş processing
     * bundle'ları (başarısız teslim veya çöken işçi) teslim eder. Bir pencereden eski teslim
     * edilmemiş bildirimi olup bundle'ı olmayan alıcılara en eski bildirimden başlayan bundle açar.
     *
     * @return bu turda teslim edilen bundle sayısı
     */
    public int deliverOverdue() {
        Instant now = clock.instant();
        int batchSize = appProperties.getNotifications().getSweepBatchSize();
        int delivered = 0;

        for (String bundleId : bundleRepository.findDuePending(now, batchSize)) {
            try {
                if (deliver(bundleId) == DeliveryOutcome.DELIVERED) {
                    delivered++;
                }
            } catch (RuntimeException e) {
                log.error("Overdue delivery failed for bundle {}: {}", bundleId, e.getMessage(), e);
            }
        }

        for (String bundleId : bundleRepository.findExpiredProcessing(now, batchSize)) {
            try {
                if (retry(bundleId, now) == DeliveryOutcome.DELIVERED) {
                    delivered++;
                }
            } catch (RuntimeException e) {
                log.error("Retry failed for bundle {}: {}", bundleId, e.getMessage(), e);
            }
        }

        reopenStrandedBacklogs(now, batchSize);
        return delivered;
    }

    private void reopenStrandedBacklogs(Instant now, int batchSize) {
        Instant olderThan = now.minus(appProperties.getNotifications().getBundleWindow());
        for (UndeliveredBacklog backlog : notificationRepository.findRecipientsWithoutBundle(olderThan, batchSize)) {
            try {
                if (openBundleIfAbsent(backlog.getTenantId(), backlog.getRecipientId(), backlog.getEarliest())) {
                    log.warn("Recipient {} had undelivered notifications since {} without a bundle, reopened",
                            backlog.getRecipientId(), backlog.getEarliest());
                }
            } catch (RuntimeException e) {
                log.error("Could not reopen bundle for recipient {}: {}", backlog.getRecipientId(), e.getMessage(), e);
            }
        }
    }

    private DeliveryOutcome retry(String bundleId, Instant now) {
        Optional<NotificationBundle> found = bundleRepository.findById(bundleId);
        if (found.isEmpty() || found.get().getStatus() != BundleStatus.PROCESSING) {
            return DeliveryOutcome.SKIPPED;
        }
        if (!bundleRepository.reclaim(bundleId, now, now.plus(appProperties.getNotifications().getProcessingLease()))) {
            return DeliveryOutcome.SKIPPED;
        }
        log.info("Retrying bundle {} (previous attempts: {})", bundleId, found.get().getAttempts());
        return process(found.get(), now);
    }

    private DeliveryOutcome process(NotificationBundle bundle, Instant claimedAt) {
        // Pencere bittikten sonra ama claim'den önce gelenler de bu pakete girer
        Instant collectUntil = bundle.getWindowEnd().isAfter(claimedAt) ? bundle.getWindowEnd() : claimedAt;
        List<NotificationBatch.Item> items = notificationRepository.findUndeliveredInWindow(
                bundle.getTenantId(), bundle.getRecipientId(), bundle.getWindowStart(), collectUntil);

        if (!items.isEmpty()) {
            NotificationBatch batch = NotificationBatch.builder()
                    .bundleId(bundle.getId())
                    .tenantId(bundle.getTenantId())
                    .recipientId(bundle.getRecipientId())
                    .windowStart(bundle.getWindowStart())
                    .windowEnd(bundle.getWindowEnd())
                    .items(items)
                    .build();
            try {
                deliveryChannel.deliver(bundle.getRecipientId(), batch);
            } catch (RuntimeException e) {
                int attempts = bundle.getAttempts() + 1;
                Instant retryAt = claimedAt.plus(retryPolicy.delayFor(attempts));
                bundleRepository.markFailed(bundle.getId(), attempts, retryAt);
                log.warn("Delivery of bundle {} to recipient {} failed (attempt {}), next retry at {}: {}",
                        bundle.getId(), bundle.getRecipientId(), attempts, retryAt, e.getMessage());
                return DeliveryOutcome.FAILED;
            }
        }

        Instant deliveredAt = clock.instant();
        notificationRepository.markDelivered(
                items.stream().map(NotificationBatch.Item::getNotificationId).toList(), bundle.getId(), deliveredAt);
        bundleRepository.markDelivered(bundle.getId(), deliveredAt);
        log.info("Delivered bundle {} to recipient {}: {} notifications", bundle.getId(), bundle.getRecipientId(), items.size());

        openFollowUpIfNeeded(bundle);
        return DeliveryOutcome.DELIVERED;
    }

    /** Hiçbir pencereye düşmemiş teslim edilmemiş bildirim kaldıysa en eskisinden başlayan bundle açar. */
    private void openFollowUpIfNeeded(NotificationBundle delivered) {
        notificationRepository.findEarliestUndelivered(delivered.getTenantId(), delivered.getRecipientId())
                .ifPresent(earliest -> {
                    if (openBundleIfAbsent(delivered.getTenantId(), delivered.getRecipientId(), earliest)) {
                        log.info("Opened follow-up bundle for recipient {} starting at {}", delivered.getRecipientId(), earliest);
                    }
                });
    }

    private boolean openBundleIfAbsent(String tenantId, String recipientId, Instant windowStart) {
        NotificationBundle bundle = NotificationBundle.builder()
                .id(UUID.randomUUID().toString())
                .tenantId(tenantId)
                .recipientId(recipientId)
                .windowStart(windowStart)
                .windowEnd(windowStart.plus(appProperties.getNotifications().getBundleWindow()))
                .status(BundleStatus.PENDING)
                .build();
        if (!bundleRepository.insertPendingIfAbsent(bundle)) {
            return false;
        }
        scheduleDelivery(bundle);
        return true;
    }

    /** Transaction varsa commit sonrasına ertelenir; geri alınan bundle için callback kurulmaz. */
    private void scheduleDelivery(NotificationBundle bundle) {
        Runnable schedule = () -> taskScheduler.schedule(() -> deliverScheduled(bundle.getId()), bundle.getWindowEnd());
        if (TransactionSynchronizationManager.isSynchronizationActive()) {
            TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
                @Override
                public void afterCommit() {
                    schedule.run();
                }
            });
        } else {
            schedule.run();
        }
    }

    private void deliverScheduled(String bundleId) {
        try {
            deliver(bundleId);
        } catch (RuntimeException e) {
            // catch-all sweep yeniden dener
            log.error("Scheduled delivery of bundle {} failed: {}", bundleId, e.getMessage(), e);
        }
    }
}
