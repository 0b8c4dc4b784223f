package com.flagship.footy_marketplace.webhook;

/**
 * What a claimed webhook event did. Stored with the dedupe row.
 */
public enum WebhookResult {
    PROCESSED,
    SKIPPED
}
