package com.flagship.footy_marketplace.consumer;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.footy_marketplace.notification.NotificationEventHandler;
import com.flagship.footy_marketplace.outbox.OutboxPublisher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.stereotype.Component;

import java.util.UUID;

/**
 * Consumes membership and billing events and sends notifications for them.
 *
 * Offsets are acknowledged manually after the handler and its processed_events row commit.
 * A message that cannot be parsed is acknowledged and dropped; a handler failure is not
 * acknowledged so the message is redelivered.
 */
@Component
@ConditionalOnProperty(name = "consumer.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class NotificationEventConsumer {

    static final String CONSUMER_GROUP = "notification-consumer";

    private final IdempotentEventProcessor eventProcessor;
    private final NotificationEventHandler notificationHandler;
    private final ObjectMapper objectMapper;

    @Value("${kafka.topic.memberships:memberships}")
    private String membershipsTopic;

    @KafkaListener(
        topics = {"${kafka.topic.memberships:memberships}", "${kafka.topic.billing:billing}"},
        groupId = "${spring.kafka.consumer.group-id:footy-marketplace-notifications}"
    )
    public void consume(ConsumerRecord<String, String> record, Acknowledgment ack) {
        log.debug("Received message: topic={}, partition={}, offset={}, key={}",
            record.topic(), record.partition(), record.offset(), record.key());

        EventEnvelope envelope = parse(record);
        if (envelope == null) {
            log.warn("Could not parse event at {}-{}@{}, acknowledging to skip",
                record.topic(), record.partition(), record.offset());
            ack.acknowledge();
            return;
        }

        try {
            boolean processed;
            if (notificationHandler.handles(envelope.eventType())) {
                processed = eventProcessor.processEvent(
                    envelope.eventId(), envelope.eventType(),
                    envelope.aggregateType(), envelope.aggregateId(),
                    CONSUMER_GROUP,
                    () -> notificationHandler.handle(envelope.eventType(), envelope.eventId(), envelope.body()));
            } else {
                eventProcessor.skipEvent(
                    envelope.eventId(), envelope.eventType(),
                    envelope.aggregateType(), envelope.aggregateId(),
                    CONSUMER_GROUP, "No notification for event type");
                processed = false;
            }

            ack.acknowledge();
            if (processed) {
                log.info("Processed event: type={}, eventId={}, aggregateId={}",
                    envelope.eventType(), envelope.eventId(), envelope.aggregateId());
            }
        } catch (RuntimeException e) {
            log.error("Error processing event {} at offset {}: {}",
                envelope.eventId(), record.offset(), e.getMessage(), e);
            throw e;
        }
    }

    private EventEnvelope parse(ConsumerRecord<String, String> record) {
        try {
            JsonNode node = objectMapper.readTree(record.value());
            UUID eventId = UUID.fromString(node.get("eventId").asText());
            String eventType = node.get("eventType").asText();
            UUID aggregateId = record.key() != null ? UUID.fromString(record.key()) : null;
            String aggregateType = membershipsTopic.equals(record.topic())
                ? OutboxPublisher.MEMBERSHIP_AGGREGATE
                : OutboxPublisher.INVOICE_AGGREGATE;
            return new EventEnvelope(eventId, eventType, aggregateType, aggregateId, node);
        } catch (Exception e) {
            log.error("Failed to parse event envelope: {}", e.getMessage());
            return null;
        }
    }

    private record EventEnvelope(UUID eventId, String eventType, String aggregateType,
                                 UUID aggregateId, JsonNode body) {}
}
