package com.flagship.footy_marketplace.webhook;

import com.flagship.footy_marketplace.gateway.GatewayEvent;
import com.flagship.footy_marketplace.membership.MembershipService;
import com.flagship.footy_marketplace.payment.PaymentIntentRecord;
import com.flagship.footy_marketplace.payment.PaymentIntentService;
import com.flagship.footy_marketplace.placement.PlacementInvoiceService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

/**
 * Applies a verified gateway event at most once.
 *
 * The dedupe row is inserted and flushed before any state change, in the same transaction.
 * A concurrent delivery of the same event blocks on the primary key and then fails with a
 * constraint violation; a handler failure rolls the claim back so the gateway's retry is
 * processed again.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class IdempotentWebhookProcessor {

    private final WebhookEventRepository webhookEventRepository;
    private final PaymentIntentService paymentIntentService;
    private final MembershipService membershipService;
    private final PlacementInvoiceService placementInvoiceService;

    @Transactional
    public WebhookOutcome process(GatewayEvent event) {
        if (webhookEventRepository.existsById(event.getEventId())) {
            log.info("Webhook event {} already handled, skipping", event.getEventId());
            return WebhookOutcome.DUPLICATE;
        }

        Optional<PaymentIntentRecord> intent = Optional.ofNullable(event.getPaymentIntentId())
            .flatMap(paymentIntentService::findById);
        boolean handled = (event.isPaymentSucceeded() || event.isPaymentFailed() || event.isPaymentCanceled())
            && intent.isPresent();

        ReceivedWebhook claim = ReceivedWebhook.claim(event.getEventId(), event.getType(),
            event.getPaymentIntentId(), handled ? WebhookResult.PROCESSED : WebhookResult.SKIPPED);
        WebhookEventEntity entity = webhookEventRepository.saveAndFlush(WebhookEventEntity.fromDomain(claim));

        if (!handled) {
            log.info("Webhook event {} of type {} skipped: {}", event.getEventId(), event.getType(),
                intent.isPresent() ? "unhandled event type" : "unknown payment intent " + event.getPaymentIntentId());
            return WebhookOutcome.SKIPPED;
        }

        boolean applied = route(event, intent.get());
        if (!applied) {
            entity.updateFromDomain(claim.skipped());
            webhookEventRepository.save(entity);
            return WebhookOutcome.SKIPPED;
        }
        return WebhookOutcome.PROCESSED;
    }

    private boolean route(GatewayEvent event, PaymentIntentRecord intent) {
        String intentId = intent.getId();
        switch (intent.getPurpose()) {
            case MEMBERSHIP:
                if (event.isPaymentSucceeded()) {
                    return membershipService.onPaymentSucceeded(intentId);
                }
                if (event.isPaymentCanceled()) {
                    membershipService.onPaymentCanceled(intentId);
                } else {
                    membershipService.onPaymentFailed(intentId);
                }
                return true;
            case INVOICE:
                if (event.isPaymentSucceeded()) {
                    return placementInvoiceService.onPaymentSucceeded(intentId);
                }
                placementInvoiceService.onPaymentFailed(intentId);
                return true;
            default:
                throw new IllegalStateException("Unhandled payment purpose: " + intent.getPurpose());
        }
    }
}
