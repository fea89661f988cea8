package com.flagship.retail_banking.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

/**
 * Topics the outbox publisher writes to. Only declared when the publisher runs.
 */
@Configuration
@ConditionalOnProperty(name = "outbox.publisher.enabled", havingValue = "true", matchIfMissing = true)
public class KafkaConfig {

    @Value("${kafka.topic.transfers:transfers}")
    private String transfersTopic;

    @Value("${kafka.topic.transfer-failures:transfer-failures}")
    private String transferFailuresTopic;

    @Value("${kafka.topic.partitions:3}")
    private int partitions;

    @Bean
    public NewTopic transfersTopic() {
        return TopicBuilder.name(transfersTopic)
                .partitions(partitions)
                .replicas(1)
                .build();
    }

    @Bean
    public NewTopic transferFailuresTopic() {
        return TopicBuilder.name(transferFailuresTopic)
                .partitions(partitions)
                .replicas(1)
                .build();
    }
}
