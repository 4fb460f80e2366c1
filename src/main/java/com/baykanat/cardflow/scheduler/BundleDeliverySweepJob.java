package com.baykanat.cardflow.scheduler;

import com.baykanat.cardflow.domain.service.NotificationBundler;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Kaçırılmış zamanlanmış teslimler (restart) ve yeniden denenecek bundle'lar için catch-all tarama.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BundleDeliverySweepJob {

    private final NotificationBundler notificationBundler;

    @Scheduled(
            fixedRateString = "${app.scheduler.bundle-delivery-sweep-rate:60000}",
            initialDelayString = "${app.scheduler.bundle-delivery-sweep-initial-delay:30000}"
    )
    public void deliverOverdueBundles() {
        try {
            int delivered = notificationBundler.deliverOverdue();
            if (delivered > 0) {
                log.info("Bundle sweep: delivered {} overdue bundles", delivered);
            } else {
                log.debug("Bundle sweep: no overdue bundles");
            }
        } catch (Exception e) {
            log.error("Bundle delivery sweep failed: {}", e.getMessage(), e);
        }
    }
}
