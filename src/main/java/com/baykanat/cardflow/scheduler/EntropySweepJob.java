package com.baykanat.cardflow.scheduler;

import com.baykanat.cardflow.domain.service.EntropyScheduler;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;

/** Entropy taramasını periyodik çalıştırır (varsayılan saatte bir). */
@Slf4j
@Component
@RequiredArgsConstructor
public class EntropySweepJob {

    private final EntropyScheduler entropyScheduler;
    private final Clock clock;

    @Scheduled(
            fixedRateString = "${app.scheduler.entropy-sweep-rate:3600000}",
            initialDelayString = "${app.scheduler.entropy-sweep-initial-delay:60000}"
    )
    public void runSweep() {
        try {
            entropyScheduler.sweep(clock.instant());
        } catch (Exception e) {
            log.error("Entropy sweep failed: {}", e.getMessage(), e);
        }
    }
}
