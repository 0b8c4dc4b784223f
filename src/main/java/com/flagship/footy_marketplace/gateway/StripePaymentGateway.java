package com.flagship.footy_marketplace.gateway;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.footy_marketplace.exception.GatewayUnavailableException;
import com.flagship.footy_marketplace.exception.InvalidSignatureException;
import com.stripe.exception.SignatureVerificationException;
import com.stripe.exception.StripeException;
import com.stripe.model.PaymentIntent;
import com.stripe.net.RequestOptions;
import com.stripe.net.Webhook;
import com.stripe.param.PaymentIntentCreateParams;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;
import java.util.Set;

/**
 * Stripe adapter.
 *
 * Uses per-request API keys and never sets the global Stripe.apiKey. Webhook bodies are
 * verified against the endpoint secret before Jackson reads them.
 */
@Component
@Slf4j
public class StripePaymentGateway implements PaymentGateway {

    private static final Set<String> ZERO_DECIMAL_CURRENCIES = Set.of(
        "BIF", "CLP", "DJF", "GNF", "JPY", "KMF", "KRW", "MGA", "PYG", "RWF", "UGX", "VND", "VUV",
        "XAF", "XOF", "XPF");

    private final ObjectMapper objectMapper;
    private final String apiKey;
    private final String webhookSecret;
    private final long toleranceSeconds;

    public StripePaymentGateway(
            ObjectMapper objectMapper,
            @Value("${stripe.api-key:}") String apiKey,
            @Value("${stripe.webhook-secret:}") String webhookSecret,
            @Value("${stripe.webhook-tolerance-seconds:300}") long toleranceSeconds) {
        this.objectMapper = objectMapper;
        this.apiKey = apiKey;
        this.webhookSecret = webhookSecret;
        this.toleranceSeconds = toleranceSeconds;
    }

    @Override
    public GatewayPaymentIntent createPaymentIntent(BigDecimal amount, String currency, Map<String, String> metadata) {
        PaymentIntentCreateParams params = PaymentIntentCreateParams.builder()
            .setAmount(toSmallestUnit(amount, currency))
            .setCurrency(currency.toLowerCase())
            .putAllMetadata(metadata)
            .setAutomaticPaymentMethods(
                PaymentIntentCreateParams.AutomaticPaymentMethods.builder().setEnabled(true).build())
            .build();
        try {
            PaymentIntent intent = PaymentIntent.create(params, requestOptions());
            log.info("Created Stripe payment intent: id={}, amount={} {}", intent.getId(), amount, currency);
            return toGatewayIntent(intent, amount);
        } catch (StripeException e) {
            log.error("Stripe intent creation failed: {}", e.getMessage(), e);
            throw new GatewayUnavailableException("Payment intent creation failed: " + e.getMessage(), e);
        }
    }

    @Override
    public GatewayPaymentIntent retrievePaymentIntent(String paymentIntentId) {
        try {
            PaymentIntent intent = PaymentIntent.retrieve(paymentIntentId, requestOptions());
            return toGatewayIntent(intent, fromSmallestUnit(intent.getAmount(), intent.getCurrency()));
        } catch (StripeException e) {
            log.error("Stripe intent lookup failed for {}: {}", paymentIntentId, e.getMessage());
            throw new GatewayUnavailableException("Payment intent lookup failed: " + e.getMessage(), e);
        }
    }

    @Override
    public GatewayEvent parseWebhookEvent(String payload, String signatureHeader) {
        if (signatureHeader == null || signatureHeader.isBlank()) {
            throw new InvalidSignatureException("Missing Stripe-Signature header");
        }
        if (payload == null || payload.isEmpty()) {
            throw new InvalidSignatureException("Empty webhook payload");
        }
        if (webhookSecret == null || webhookSecret.isBlank()) {
            throw new InvalidSignatureException("Webhook secret is not configured");
        }
        try {
            Webhook.Signature.verifyHeader(payload, signatureHeader, webhookSecret, toleranceSeconds);
        } catch (SignatureVerificationException e) {
            throw new InvalidSignatureException("Signature verification failed: " + e.getMessage(), e);
        }
        return readEvent(payload);
    }

    private GatewayEvent readEvent(String payload) {
        JsonNode root;
        try {
            root = objectMapper.readTree(payload);
        } catch (JsonProcessingException e) {
            throw new InvalidSignatureException("Webhook payload is not valid JSON", e);
        }

        String eventId = text(root, "id");
        String type = text(root, "type");
        JsonNode object = root.path("data").path("object");
        String intentId = text(object, "id");
        if (eventId == null || type == null || intentId == null) {
            throw new InvalidSignatureException("Webhook payload is missing id, type or data.object.id");
        }

        Map<String, String> metadata = new HashMap<>();
        JsonNode metadataNode = object.path("metadata");
        if (metadataNode.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> fields = metadataNode.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                metadata.put(field.getKey(), field.getValue().asText());
            }
        }

        return new GatewayEvent(eventId, type, intentId, text(object, "status"), Map.copyOf(metadata));
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }

    private GatewayPaymentIntent toGatewayIntent(PaymentIntent intent, BigDecimal amount) {
        return new GatewayPaymentIntent(
            intent.getId(),
            intent.getClientSecret(),
            amount,
            intent.getCurrency(),
            GatewayIntentStatus.fromStripeStatus(intent.getStatus())
        );
    }

    private RequestOptions requestOptions() {
        return RequestOptions.builder().setApiKey(apiKey).build();
    }

    long toSmallestUnit(BigDecimal amount, String currency) {
        if (ZERO_DECIMAL_CURRENCIES.contains(currency.toUpperCase())) {
            return amount.longValue();
        }
        return amount.multiply(BigDecimal.valueOf(100)).setScale(0, RoundingMode.HALF_UP).longValue();
    }

    BigDecimal fromSmallestUnit(Long amount, String currency) {
        if (amount == null) {
            return BigDecimal.ZERO;
        }
        if (currency != null && ZERO_DECIMAL_CURRENCIES.contains(currency.toUpperCase())) {
            return BigDecimal.valueOf(amount);
        }
        return BigDecimal.valueOf(amount, 2);
    }
}
