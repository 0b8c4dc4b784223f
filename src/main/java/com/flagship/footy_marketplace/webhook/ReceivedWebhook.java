package com.flagship.footy_marketplace.webhook;

import lombok.Value;

import java.time.Instant;

@Value
public class ReceivedWebhook {
    String eventId;
    String eventType;
    String paymentIntentId;
    WebhookResult result;
    Instant receivedAt;

    public static ReceivedWebhook claim(String eventId, String eventType, String paymentIntentId,
                                        WebhookResult result) {
        return new ReceivedWebhook(eventId, eventType, paymentIntentId, result, Instant.now());
    }

    public ReceivedWebhook skipped() {
        return new ReceivedWebhook(eventId, eventType, paymentIntentId, WebhookResult.SKIPPED, receivedAt);
    }
}
