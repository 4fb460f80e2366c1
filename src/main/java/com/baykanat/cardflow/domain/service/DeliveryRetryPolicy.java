package com.baykanat.cardflow.domain.service;

import com.baykanat.cardflow.config.AppProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Başarısız bundle teslimi için exponential backoff + jitter.
 *
 * <p>Gecikme: {@code baseDelay * 2^(attempt-1)}, {@code maxDelay} ile sınırlı, [0.5, 1.5) jitter.
 */
@Component
public class DeliveryRetryPolicy {

    private final long baseDelayMs;
    private final long maxDelayMs;

    public DeliveryRetryPolicy(AppProperties appProperties) {
        this(appProperties.getNotifications().getRetryBaseDelay(), appProperties.getNotifications().getRetryMaxDelay());
    }

    DeliveryRetryPolicy(Duration baseDelay, Duration maxDelay) {
        if (baseDelay.isZero() || baseDelay.isNegative()) {
            throw new IllegalArgumentException("retry base delay must be > 0, got: " + baseDelay);
        }
        if (maxDelay.compareTo(baseDelay) < 0) {
            throw new IllegalArgumentException("retry max delay must be >= base delay, got: " + maxDelay);
        }
        this.baseDelayMs = baseDelay.toMillis();
        this.maxDelayMs = maxDelay.toMillis();
    }

    public Duration delayFor(int attempts) {
        if (attempts <= 0) {
            return Duration.ZERO;
        }
        long expDelay;
        if (attempts >= 31) {
            expDelay = Long.MAX_VALUE;
        } else {
            long shift = 1L << (attempts - 1);
            // taşma: shift > max/base ise doğrudan sınıra çek
            expDelay = shift > maxDelayMs / baseDelayMs ? Long.MAX_VALUE : baseDelayMs * shift;
        }
        long capped = Math.min(maxDelayMs, expDelay);
        double jitter = ThreadLocalRandom.current().nextDouble(0.5, 1.5);
        long withJitter = (long) (capped * jitter);
        return Duration.ofMillis(Math.min(maxDelayMs, Math.max(0L, withJitter)));
    }
}
