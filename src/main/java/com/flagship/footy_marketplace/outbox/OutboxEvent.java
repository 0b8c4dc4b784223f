package com.flagship.footy_marketplace.outbox;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * A domain event waiting in the outbox table to be published to Kafka.
 *
 * Written in the same transaction as the membership or invoice change it describes,
 * so a committed change always has its event and a rolled-back change never does.
 */
@Value
public class OutboxEvent {
    UUID id;
    String aggregateType;      // "Membership" or "Invoice"
    UUID aggregateId;
    String eventType;          // e.g. "MembershipActivated"
    String payload;            // JSON
    Instant createdAt;
    Instant publishedAt;
    int retryCount;
    String lastError;
    Long sequenceNumber;

    public static OutboxEvent create(String aggregateType, UUID aggregateId,
                                     String eventType, String payload) {
        return new OutboxEvent(
            UUID.randomUUID(),
            aggregateType,
            aggregateId,
            eventType,
            payload,
            Instant.now(),
            null,
            0,
            null,
            null
        );
    }

    public boolean isPublished() {
        return publishedAt != null;
    }

    public boolean isDeadLettered(int maxRetries) {
        return publishedAt == null && retryCount >= maxRetries;
    }
}
