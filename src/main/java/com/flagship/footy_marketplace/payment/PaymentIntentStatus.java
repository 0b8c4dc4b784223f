package com.flagship.footy_marketplace.payment;

/**
 * Lifecycle of a payment intent as recorded on our side.
 *
 * CREATED -> SUCCEEDED
 * CREATED -> FAILED
 * FAILED  -> SUCCEEDED (the payer retried with another method)
 */
public enum PaymentIntentStatus {
    CREATED,
    SUCCEEDED,
    FAILED
}
