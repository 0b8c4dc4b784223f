package com.flagship.footy_marketplace.gateway;

import lombok.Value;

import java.util.Map;

/**
 * A webhook event whose signature has been verified.
 */
@Value
public class GatewayEvent {
    public static final String PAYMENT_SUCCEEDED = "payment_intent.succeeded";
    public static final String PAYMENT_FAILED = "payment_intent.payment_failed";
    public static final String PAYMENT_CANCELED = "payment_intent.canceled";

    String eventId;
    String type;
    String paymentIntentId;
    String intentStatus;
    Map<String, String> metadata;

    public boolean isPaymentSucceeded() {
        return PAYMENT_SUCCEEDED.equals(type);
    }

    public boolean isPaymentFailed() {
        return PAYMENT_FAILED.equals(type);
    }

    public boolean isPaymentCanceled() {
        return PAYMENT_CANCELED.equals(type);
    }
}
