package com.flagship.footy_marketplace.gateway;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.footy_marketplace.exception.InvalidSignatureException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class StripePaymentGatewayTest {

    private static final String SECRET = "whsec_unit_test";

    private final StripePaymentGateway gateway =
        new StripePaymentGateway(new ObjectMapper(), "sk_test_unused", SECRET, 300);

    @Test
    @DisplayName("A correctly signed event is parsed with its intent and metadata")
    void parsesSignedEvent() {
        String payload = StripeSignatures.paymentIntentEvent(
            "evt_1", GatewayEvent.PAYMENT_SUCCEEDED, "pi_1", "succeeded");

        GatewayEvent event = gateway.parseWebhookEvent(payload, StripeSignatures.sign(payload, SECRET));

        assertEquals("evt_1", event.getEventId());
        assertEquals("pi_1", event.getPaymentIntentId());
        assertEquals("succeeded", event.getIntentStatus());
        assertEquals("MEMBERSHIP", event.getMetadata().get("purpose"));
        assertTrue(event.isPaymentSucceeded());
        assertFalse(event.isPaymentCanceled());
        assertFalse(event.isPaymentFailed());
    }

    @Test
    @DisplayName("A signature made with another secret is rejected")
    void rejectsWrongSecret() {
        String payload = StripeSignatures.paymentIntentEvent(
            "evt_2", GatewayEvent.PAYMENT_SUCCEEDED, "pi_2", "succeeded");

        assertThrows(InvalidSignatureException.class,
            () -> gateway.parseWebhookEvent(payload, StripeSignatures.sign(payload, "whsec_other")));
    }

    @Test
    @DisplayName("A tampered body is rejected")
    void rejectsTamperedPayload() {
        String payload = StripeSignatures.paymentIntentEvent(
            "evt_3", GatewayEvent.PAYMENT_FAILED, "pi_3", "requires_payment_method");
        String header = StripeSignatures.sign(payload, SECRET);

        assertThrows(InvalidSignatureException.class,
            () -> gateway.parseWebhookEvent(payload.replace("pi_3", "pi_4"), header));
    }

    @Test
    @DisplayName("A signature older than the tolerance is rejected")
    void rejectsStaleTimestamp() {
        String payload = StripeSignatures.paymentIntentEvent(
            "evt_4", GatewayEvent.PAYMENT_SUCCEEDED, "pi_5", "succeeded");
        long anHourAgo = Instant.now().minusSeconds(3600).getEpochSecond();

        assertThrows(InvalidSignatureException.class,
            () -> gateway.parseWebhookEvent(payload, StripeSignatures.sign(payload, SECRET, anHourAgo)));
    }

    @Test
    @DisplayName("Missing header, empty body and malformed events fail closed")
    void failsClosed() {
        String payload = StripeSignatures.paymentIntentEvent(
            "evt_5", GatewayEvent.PAYMENT_SUCCEEDED, "pi_6", "succeeded");
        assertThrows(InvalidSignatureException.class, () -> gateway.parseWebhookEvent(payload, null));
        assertThrows(InvalidSignatureException.class, () -> gateway.parseWebhookEvent("", "t=1,v1=abc"));

        String noObject = "{\"id\":\"evt_6\",\"type\":\"payment_intent.succeeded\",\"data\":{}}";
        assertThrows(InvalidSignatureException.class,
            () -> gateway.parseWebhookEvent(noObject, StripeSignatures.sign(noObject, SECRET)));
    }

    @Test
    @DisplayName("An unset webhook secret rejects every event")
    void unsetSecretRejects() {
        StripePaymentGateway unconfigured = new StripePaymentGateway(new ObjectMapper(), "", "", 300);
        String payload = StripeSignatures.paymentIntentEvent(
            "evt_7", GatewayEvent.PAYMENT_SUCCEEDED, "pi_7", "succeeded");

        assertThrows(InvalidSignatureException.class,
            () -> unconfigured.parseWebhookEvent(payload, StripeSignatures.sign(payload, "")));
    }

    @Test
    @DisplayName("Amounts convert to the smallest currency unit")
    void smallestUnitConversion() {
        assertEquals(2999L, gateway.toSmallestUnit(new BigDecimal("29.99"), "usd"));
        assertEquals(5000L, gateway.toSmallestUnit(new BigDecimal("50.00"), "USD"));
        assertEquals(1000L, gateway.toSmallestUnit(new BigDecimal("1000"), "jpy"));
        assertEquals(new BigDecimal("19.99"), gateway.fromSmallestUnit(1999L, "usd"));
    }

    @Test
    @DisplayName("Stripe statuses map to gateway statuses")
    void statusMapping() {
        assertEquals(GatewayIntentStatus.SUCCEEDED, GatewayIntentStatus.fromStripeStatus("succeeded"));
        assertEquals(GatewayIntentStatus.FAILED, GatewayIntentStatus.fromStripeStatus("canceled"));
        assertEquals(GatewayIntentStatus.CREATED, GatewayIntentStatus.fromStripeStatus("requires_payment_method"));
    }
}
