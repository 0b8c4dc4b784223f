package com.flagship.footy_marketplace.outbox;

import com.flagship.footy_marketplace.observability.OutboxMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Polls the outbox and publishes pending events to Kafka.
 *
 * Membership events go to the memberships topic and invoice events to the billing topic,
 * keyed by aggregate id so consumers see each aggregate's events in order. Sends are
 * synchronous; a failed send bumps the retry count and the event is dead-lettered once
 * it reaches outbox.publisher.max-retries.
 */
@Component
@ConditionalOnProperty(name = "outbox.publisher.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class OutboxPublisher {

    public static final String MEMBERSHIP_AGGREGATE = "Membership";
    public static final String INVOICE_AGGREGATE = "Invoice";

    private final OutboxService outboxService;
    private final KafkaTemplate<String, String> kafkaTemplate;
    private final OutboxMetrics outboxMetrics;

    @Value("${kafka.topic.memberships:memberships}")
    private String membershipsTopic;

    @Value("${kafka.topic.billing:billing}")
    private String billingTopic;

    @Value("${outbox.publisher.batch-size:100}")
    private int batchSize;

    @Value("${outbox.publisher.max-retries:5}")
    private int maxRetries;

    @Value("${outbox.publisher.retention:P7D}")
    private Duration retention;

    @Scheduled(fixedRateString = "${outbox.publisher.poll-interval-ms:1000}")
    public void publishPendingEvents() {
        try {
            List<OutboxEvent> events = outboxService.claimPublishable(maxRetries, batchSize);
            if (events.isEmpty()) {
                return;
            }

            log.debug("Publishing {} outbox events", events.size());
            events.forEach(this::publish);
        } catch (Exception e) {
            log.error("Error in outbox publisher polling loop", e);
        }
    }

    @Scheduled(cron = "${outbox.publisher.purge-cron:0 30 3 * * *}")
    public void purgePublishedEvents() {
        try {
            outboxService.purgePublishedBefore(Instant.now().minus(retention));
        } catch (Exception e) {
            log.error("Outbox purge failed", e);
        }
    }

    private void publish(OutboxEvent event) {
        try {
            String topic = topicFor(event);
            SendResult<String, String> result = kafkaTemplate
                .send(topic, event.getAggregateId().toString(), event.getPayload())
                .get();

            log.debug("Published {} {} to {}-{}@{}",
                event.getEventType(), event.getId(),
                result.getRecordMetadata().topic(),
                result.getRecordMetadata().partition(),
                result.getRecordMetadata().offset());

            outboxService.markPublished(event.getId());
            outboxMetrics.recordEventPublished(event.getEventType());

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            outboxService.markFailed(event.getId(), "interrupted");
            outboxMetrics.recordEventPublishFailed(event.getEventType());
        } catch (Exception e) {
            log.error("Failed to publish outbox event {} ({}): {}",
                event.getId(), event.getEventType(), e.getMessage());
            int attempts = outboxService.markFailed(event.getId(), e.getMessage());
            outboxMetrics.recordEventPublishFailed(event.getEventType());

            if (attempts >= maxRetries) {
                log.warn("Outbox event {} dead-lettered after {} attempts: eventType={}, aggregateId={}",
                    event.getId(), attempts, event.getEventType(), event.getAggregateId());
                outboxMetrics.recordEventDeadLettered(event.getEventType());
            }
        }
    }

    String topicFor(OutboxEvent event) {
        return switch (event.getAggregateType()) {
            case MEMBERSHIP_AGGREGATE -> membershipsTopic;
            case INVOICE_AGGREGATE -> billingTopic;
            default -> throw new IllegalStateException(
                "No topic mapped for aggregate type " + event.getAggregateType());
        };
    }
}
