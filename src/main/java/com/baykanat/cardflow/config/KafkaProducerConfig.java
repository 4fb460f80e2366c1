package com.baykanat.cardflow.config;

import org.apache.kafka.clients.admin.NewTopic;

import java.util.Objects;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

/** Bildirim teslim topic bean'i; partition/replica sayıları burada. */
@Configuration
public class KafkaProducerConfig {

    @Value("${app.kafka.topic.notification-deliveries}")
    private String notificationDeliveriesTopic;

    /** Teslim topic'i. Key = recipient_id, aynı alıcının paketleri sıralı kalır. */
    @Bean
    public NewTopic notificationDeliveriesTopic() {
        return TopicBuilder.name(Objects.requireNonNull(notificationDeliveriesTopic, "notificationDeliveriesTopic"))
                .partitions(3)
                .replicas(1)
                .build();
    }
}
