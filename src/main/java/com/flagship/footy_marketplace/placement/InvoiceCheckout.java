package com.flagship.footy_marketplace.placement;

import lombok.Value;

@Value
public class InvoiceCheckout {
    Invoice invoice;
    String paymentIntentId;
    String clientSecret;
}
