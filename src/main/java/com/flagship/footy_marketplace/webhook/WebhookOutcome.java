package com.flagship.footy_marketplace.webhook;

/**
 * The answer given to the gateway for one delivery.
 */
public enum WebhookOutcome {
    PROCESSED,
    DUPLICATE,
    SKIPPED,
    REJECTED;

    public String status() {
        return switch (this) {
            case PROCESSED -> "processed";
            case DUPLICATE -> "duplicate";
            case SKIPPED -> "skipped";
            case REJECTED -> "ignored";
        };
    }
}
