package com.flagship.footy_marketplace.gateway;

import lombok.Value;

import java.math.BigDecimal;

@Value
public class GatewayPaymentIntent {
    String id;
    String clientSecret;
    BigDecimal amount;
    String currency;
    GatewayIntentStatus status;
}
