package com.flagship.footy_marketplace.gateway;

import com.flagship.footy_marketplace.exception.GatewayUnavailableException;
import com.flagship.footy_marketplace.exception.InvalidSignatureException;

import java.math.BigDecimal;
import java.util.Map;

/**
 * Port to the external payment processor.
 *
 * The rest of the service only sees gateway-neutral values: intents, their status and
 * verified webhook events.
 */
public interface PaymentGateway {

    /**
     * Creates a payment intent for the given amount (major currency units).
     *
     * @throws GatewayUnavailableException if the processor cannot be reached
     */
    GatewayPaymentIntent createPaymentIntent(BigDecimal amount, String currency, Map<String, String> metadata);

    /**
     * Fetches the processor's current view of an intent.
     *
     * @throws GatewayUnavailableException if the processor cannot be reached
     */
    GatewayPaymentIntent retrievePaymentIntent(String paymentIntentId);

    /**
     * Verifies the signature of a raw webhook body and extracts the payment intent fields.
     *
     * @throws InvalidSignatureException if the header is missing, does not match, or the body is malformed
     */
    GatewayEvent parseWebhookEvent(String payload, String signatureHeader);
}
