package com.flagship.footy_marketplace.gateway;

/**
 * Payment intent status as reported by the processor, collapsed to what billing cares about.
 */
public enum GatewayIntentStatus {
    CREATED,
    SUCCEEDED,
    FAILED;

    /**
     * Maps a Stripe intent status string. Everything short of a final outcome stays CREATED.
     */
    public static GatewayIntentStatus fromStripeStatus(String status) {
        if (status == null) {
            return CREATED;
        }
        return switch (status) {
            case "succeeded" -> SUCCEEDED;
            case "canceled" -> FAILED;
            default -> CREATED;
        };
    }
}
