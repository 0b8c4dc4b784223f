package com.flagship.footy_marketplace.placement.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.footy_marketplace.placement.InvoiceCheckout;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

@Value
@Builder
public class InvoicePaymentIntentResponse {

    @JsonProperty("payment_intent_id")
    String paymentIntentId;

    @JsonProperty("client_secret")
    String clientSecret;

    @JsonProperty("invoice_id")
    UUID invoiceId;

    @JsonProperty("amount")
    BigDecimal amount;

    @JsonProperty("currency")
    String currency;

    public static InvoicePaymentIntentResponse from(InvoiceCheckout checkout) {
        return InvoicePaymentIntentResponse.builder()
            .paymentIntentId(checkout.getPaymentIntentId())
            .clientSecret(checkout.getClientSecret())
            .invoiceId(checkout.getInvoice().getId())
            .amount(checkout.getInvoice().getAmount())
            .currency(checkout.getInvoice().getCurrency())
            .build();
    }
}
