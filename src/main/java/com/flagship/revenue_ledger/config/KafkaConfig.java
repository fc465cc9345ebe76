package com.flagship.revenue_ledger.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

/**
 * Topics the outbox publisher writes to. Created on startup if missing.
 */
@Configuration
public class KafkaConfig {

    @Value("${kafka.topic.ledgers:revenue-ledger.ledgers}")
    private String ledgersTopic;

    @Value("${kafka.topic.deployments:revenue-ledger.deployments}")
    private String deploymentsTopic;

    @Value("${kafka.topic.partitions:3}")
    private int partitions;

    @Bean
    public NewTopic ledgersTopic() {
        return TopicBuilder.name(ledgersTopic)
                .partitions(partitions)
                .replicas(1)
                .build();
    }

    @Bean
    public NewTopic deploymentsTopic() {
        return TopicBuilder.name(deploymentsTopic)
                .partitions(partitions)
                .replicas(1)
                .build();
    }
}
