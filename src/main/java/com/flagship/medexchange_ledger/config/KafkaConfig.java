package com.flagship.medexchange_ledger.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

/**
 * Declares the workflow events topic. Partitioned by aggregate id, so one
 * exchange's or delivery's events are consumed in order.
 */
@Configuration
public class KafkaConfig {

    @Value("${kafka.topic.workflow-events:workflow-events}")
    private String workflowEventsTopic;

    @Value("${kafka.topic.workflow-events-partitions:3}")
    private int partitions;

    @Bean
    public NewTopic workflowEventsTopic() {
        return TopicBuilder.name(workflowEventsTopic)
                .partitions(partitions)
                .replicas(1)
                .build();
    }
}
