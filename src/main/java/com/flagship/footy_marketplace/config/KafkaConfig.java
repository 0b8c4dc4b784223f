package com.flagship.footy_marketplace.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

/**
 * Kafka topics for domain events.
 *
 * - memberships: MembershipActivated / Expired / Cancelled
 * - billing: InvoiceIssued / Paid / Voided
 */
@Configuration
public class KafkaConfig {

    @Value("${kafka.topic.memberships:memberships}")
    private String membershipsTopic;

    @Value("${kafka.topic.billing:billing}")
    private String billingTopic;

    @Value("${kafka.topic.partitions:3}")
    private int partitions;

    @Bean
    public NewTopic membershipsTopic() {
        return TopicBuilder.name(membershipsTopic)
                .partitions(partitions)
                .replicas(1)
                .build();
    }

    @Bean
    public NewTopic billingTopic() {
        return TopicBuilder.name(billingTopic)
                .partitions(partitions)
                .replicas(1)
                .build();
    }
}
