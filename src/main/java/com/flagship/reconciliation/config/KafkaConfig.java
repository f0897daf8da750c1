package com.flagship.reconciliation.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

/**
 * Kafka configuration for the provider feed.
 *
 * Only active together with the consumer, so the service runs without a broker
 * when feeds are disabled.
 */
@Configuration
@ConditionalOnProperty(name = "consumer.enabled", havingValue = "true", matchIfMissing = true)
public class KafkaConfig {

    @Value("${kafka.topic.provider-transactions:provider-transactions}")
    private String providerTransactionsTopic;

    /**
     * Creates the provider feed topic if it doesn't exist.
     * Uses 3 partitions for parallel ingestion.
     */
    @Bean
    public NewTopic providerTransactionsTopic() {
        return TopicBuilder.name(providerTransactionsTopic)
                .partitions(3)
                .replicas(1)
                .build();
    }
}
