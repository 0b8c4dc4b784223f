package com.flagship.footy_marketplace.exception;

import com.flagship.footy_marketplace.gateway.GatewayIntentStatus;

public class PaymentNotSucceededException extends MarketplaceException {

    public PaymentNotSucceededException(String paymentIntentId, GatewayIntentStatus status) {
        super("PAYMENT_NOT_SUCCEEDED", String.format(
            "Payment intent %s has not succeeded (gateway status: %s)", paymentIntentId, status));
    }
}
