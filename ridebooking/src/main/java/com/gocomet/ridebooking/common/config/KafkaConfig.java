package com.gocomet.ridebooking.common.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

/**
 * Kafka topic definitions.
 *
 * ride-events — log of every ride transition; keyed by rideId
 *
 * Partition count is 2 for local dev. Increase for production.
 */
@Configuration
public class KafkaConfig {

    @Value("${app.kafka.topics.ride-events}")
    private String rideEventsTopic;

    @Bean
    public NewTopic rideEventsTopic() {
        return TopicBuilder.name(rideEventsTopic)
                .partitions(2)
                .replicas(1)
                .build();
    }
}
