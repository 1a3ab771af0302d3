package com.flagship.settlement_engine.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

/**
 * Topics the outbox publishes to. Swap events are keyed by fingerprint,
 * marketplace events by identity or listing id.
 */
@Configuration
public class KafkaConfig {

    @Value("${kafka.topic.swaps:settlement.swaps}")
    private String swapsTopic;

    @Value("${kafka.topic.marketplace:settlement.marketplace}")
    private String marketplaceTopic;

    @Bean
    public NewTopic swapsTopic() {
        return TopicBuilder.name(swapsTopic)
                .partitions(3)
                .replicas(1)
                .build();
    }

    @Bean
    public NewTopic marketplaceTopic() {
        return TopicBuilder.name(marketplaceTopic)
                .partitions(3)
                .replicas(1)
                .build();
    }
}
