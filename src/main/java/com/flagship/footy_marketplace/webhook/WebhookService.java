package com.flagship.footy_marketplace.webhook;

import com.flagship.footy_marketplace.exception.InvalidSignatureException;
import com.flagship.footy_marketplace.gateway.GatewayEvent;
import com.flagship.footy_marketplace.gateway.PaymentGateway;
import com.flagship.footy_marketplace.observability.CorrelationContext;
import com.flagship.footy_marketplace.observability.MarketplaceMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

/**
 * Entry point for gateway webhooks: verifies, dedupes and hands the event to the processor.
 *
 * Not transactional itself. The processor's transaction has to commit before the event is
 * cached as seen, and a losing concurrent duplicate surfaces here as a constraint violation.
 * Only a violation backed by a committed claim for the same event counts as a duplicate; any
 * other integrity error propagates so the gateway retries the delivery.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class WebhookService {

    private final PaymentGateway paymentGateway;
    private final IdempotentWebhookProcessor processor;
    private final WebhookIdempotencyCache cache;
    private final WebhookEventRepository webhookEventRepository;
    private final MarketplaceMetrics metrics;

    public WebhookOutcome handle(String payload, String signatureHeader) {
        long start = System.currentTimeMillis();

        GatewayEvent event;
        try {
            event = paymentGateway.parseWebhookEvent(payload, signatureHeader);
        } catch (InvalidSignatureException e) {
            log.warn("Rejected webhook: {}", e.getMessage());
            metrics.recordWebhook(WebhookOutcome.REJECTED.name());
            return WebhookOutcome.REJECTED;
        }

        MDC.put(CorrelationContext.WEBHOOK_EVENT_ID_MDC_KEY, event.getEventId());
        try {
            if (cache.isKnown(event.getEventId())) {
                metrics.recordIdempotencyHit("redis");
                metrics.recordWebhook(WebhookOutcome.DUPLICATE.name());
                log.info("Webhook event {} seen before (cache)", event.getEventId());
                return WebhookOutcome.DUPLICATE;
            }
            metrics.recordIdempotencyMiss();

            WebhookOutcome outcome;
            try {
                outcome = processor.process(event);
            } catch (DataIntegrityViolationException e) {
                if (!webhookEventRepository.existsById(event.getEventId())) {
                    log.error("Webhook event {} failed on a data integrity violation", event.getEventId(), e);
                    throw e;
                }
                log.info("Webhook event {} claimed concurrently by another delivery", event.getEventId());
                outcome = WebhookOutcome.DUPLICATE;
            }

            if (outcome == WebhookOutcome.DUPLICATE) {
                metrics.recordIdempotencyHit("database");
            }
            cache.remember(event.getEventId());
            metrics.recordWebhook(outcome.name());
            metrics.recordLatency("webhook", System.currentTimeMillis() - start);
            log.info("Webhook event {} ({}) -> {}", event.getEventId(), event.getType(), outcome);
            return outcome;
        } finally {
            MDC.remove(CorrelationContext.WEBHOOK_EVENT_ID_MDC_KEY);
        }
    }
}
