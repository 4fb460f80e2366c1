package com.baykanat.cardflow.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/** app.* için tip güvenli configuration (Kafka topic, entropy, bildirim penceresi, scheduler aralıkları). */
@Configuration
@ConfigurationProperties(prefix = "app")
@Getter
@Setter
public class AppProperties {

    private KafkaTopicProperties kafka = new KafkaTopicProperties();
    private EntropyProperties entropy = new EntropyProperties();
    private NotificationProperties notifications = new NotificationProperties();
    private ActivitySpikeProperties activitySpike = new ActivitySpikeProperties();
    private SchedulerProperties scheduler = new SchedulerProperties();

    @Getter
    @Setter
    public static class KafkaTopicProperties {
        private TopicNames topic = new TopicNames();

        @Getter
        @Setter
        public static class TopicNames {
            private String notificationDeliveries = "notification-deliveries";
        }
    }

    @Getter
    @Setter
    public static class EntropyProperties {
        /** Board ve tenant ayarı yoksa kullanılan süre. */
        private Duration defaultPeriod = Duration.ofDays(30);
        /** Sürenin bu oranı geçilince kart "yaklaşıyor" listesine girer. */
        private double warningRatio = 0.75;
    }

    @Getter
    @Setter
    public static class NotificationProperties {
        private Duration bundleWindow = Duration.ofMinutes(30);
        /** processing claim süresi; dolarsa catch-all sweep bundle'ı yeniden alır. */
        private Duration processingLease = Duration.ofMinutes(5);
        private Duration retryBaseDelay = Duration.ofMinutes(1);
        private Duration retryMaxDelay = Duration.ofHours(1);
        /** Catch-all sweep başına işlenecek en fazla bundle. */
        private int sweepBatchSize = 200;
    }

    @Getter
    @Setter
    public static class ActivitySpikeProperties {
        /** window içinde bu kadar yorum → activitySpikeAt set edilir. */
        private int threshold = 3;
        private Duration window = Duration.ofHours(1);
    }

    @Getter
    @Setter
    public static class SchedulerProperties {
        /** Entropy tarama aralığı (ms). */
        private long entropySweepRate = 3600000;
        private long entropySweepInitialDelay = 60000;
        /** Gecikmiş bundle teslim taraması aralığı (ms). */
        private long bundleDeliverySweepRate = 60000;
        private long bundleDeliverySweepInitialDelay = 30000;
    }
}
