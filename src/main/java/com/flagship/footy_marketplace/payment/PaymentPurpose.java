package com.flagship.footy_marketplace.payment;

/**
 * What a payment intent pays for. Decides where a succeeded payment is routed.
 */
public enum PaymentPurpose {
    MEMBERSHIP,
    INVOICE
}
