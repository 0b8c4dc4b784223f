package com.flagship.footy_marketplace.gateway;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.time.Instant;

/**
 * Builds Stripe-Signature header values the way Stripe signs webhook deliveries.
 */
public final class StripeSignatures {

    private StripeSignatures() {
    }

    public static String sign(String payload, String secret) {
        return sign(payload, secret, Instant.now().getEpochSecond());
    }

    public static String sign(String payload, String secret, long timestamp) {
        try {
            Mac mac = Mac.getInstance("HmacSHA256");
            mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), "HmacSHA256"));
            byte[] digest = mac.doFinal((timestamp + "." + payload).getBytes(StandardCharsets.UTF_8));
            StringBuilder hex = new StringBuilder();
            for (byte b : digest) {
                hex.append(String.format("%02x", b));
            }
            return "t=" + timestamp + ",v1=" + hex;
        } catch (Exception e) {
            throw new IllegalStateException("Could not sign payload", e);
        }
    }

    public static String paymentIntentEvent(String eventId, String type, String intentId, String status) {
        return """
            {
              "id": "%s",
              "object": "event",
              "type": "%s",
              "data": {
                "object": {
                  "id": "%s",
                  "object": "payment_intent",
                  "status": "%s",
                  "metadata": {"purpose": "MEMBERSHIP"}
                }
              }
            }
            """.formatted(eventId, type, intentId, status);
    }
}
