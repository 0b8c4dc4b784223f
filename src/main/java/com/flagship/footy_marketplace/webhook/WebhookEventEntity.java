package com.flagship.footy_marketplace.webhook;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Dedupe row for a gateway event. The primary key is the gateway's event id, so a
 * second insert of the same event fails inside the transaction that would have applied it.
 */
@Entity
@Table(name = "webhook_events")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class WebhookEventEntity {

    @Id
    @Column(name = "event_id", nullable = false, updatable = false)
    private String eventId;

    @Column(name = "event_type", nullable = false, length = 100)
    private String eventType;

    @Column(name = "payment_intent_id")
    private String paymentIntentId;

    @Enumerated(EnumType.STRING)
    @Column(name = "result", nullable = false, length = 20)
    private WebhookResult result;

    @Column(name = "received_at", nullable = false, updatable = false)
    private Instant receivedAt;

    static WebhookEventEntity fromDomain(ReceivedWebhook webhook) {
        return new WebhookEventEntity(
            webhook.getEventId(),
            webhook.getEventType(),
            webhook.getPaymentIntentId(),
            webhook.getResult(),
            webhook.getReceivedAt()
        );
    }

    public ReceivedWebhook toDomain() {
        return new ReceivedWebhook(eventId, eventType, paymentIntentId, result, receivedAt);
    }

    void updateFromDomain(ReceivedWebhook webhook) {
        this.result = webhook.getResult();
    }
}
