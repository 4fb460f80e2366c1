package com.baykanat.cardflow.infrastructure.kafka;

import com.baykanat.cardflow.config.AppProperties;
import com.baykanat.cardflow.domain.exception.DeliveryUnavailableException;
import com.baykanat.cardflow.domain.model.NotificationBatch;
import com.baykanat.cardflow.domain.service.NotificationDeliveryChannel;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Bildirim paketini Kafka'ya yazar; e-posta/push tüketicileri topic'i dinler.
 * Key = recipient_id. Retry + Circuit Breaker; tüm denemeler biterse bundle yeniden denenmek üzere kalır.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class KafkaNotificationDeliveryChannel implements NotificationDeliveryChannel {

    private static final long SEND_TIMEOUT_SECONDS = 5;

    private final KafkaTemplate<String, Object> kafkaTemplate;
    private final AppProperties appProperties;

    /** Ack beklenir (acks=all); zaman aşımı veya broker hatası DeliveryUnavailableException olur. */
    @Override
    @Retry(name = "notificationDelivery")
    @CircuitBreaker(name = "notificationDelivery", fallbackMethod = "handleDeliveryFailure")
    public void deliver(String recipientId, NotificationBatch batch) {
        String topic = Objects.requireNonNull(appProperties.getKafka().getTopic().getNotificationDeliveries());
        String key = Objects.requireNonNull(recipientId, "recipientId");
        try {
            kafkaTemplate.send(topic, key, batch).get(SEND_TIMEOUT_SECONDS, TimeUnit.SECONDS);
            log.debug("Bundle {} published to {} for recipient {}", batch.getBundleId(), topic, recipientId);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DeliveryUnavailableException("Interrupted while publishing bundle " + batch.getBundleId(), e);
        } catch (ExecutionException | TimeoutException e) {
            throw new DeliveryUnavailableException("Kafka publish failed for bundle " + batch.getBundleId(), e);
        }
    }

    /** Circuit breaker açıkken gönderim denenmez. */
    @SuppressWarnings("unused")
    private void handleDeliveryFailure(String recipientId, NotificationBatch batch, CallNotPermittedException ex) {
        log.warn("Circuit breaker is OPEN for notification delivery. Bundle {} for recipient {} will be retried",
                batch.getBundleId(), recipientId);
        throw new DeliveryUnavailableException("Notification delivery circuit breaker is open", ex);
    }

    /** Tüm retry'lar tükendikten sonra. */
    @SuppressWarnings("unused")
    private void handleDeliveryFailure(String recipientId, NotificationBatch batch, Exception ex) {
        log.error("Notification delivery failed for bundle {} (recipient {}): {}",
                batch.getBundleId(), recipientId, ex.getMessage());
        if (ex instanceof DeliveryUnavailableException unavailable) {
            throw unavailable;
        }
        throw new DeliveryUnavailableException("Notification delivery failed: " + ex.getMessage(), ex);
    }
}
