package com.flagship.footy_marketplace.membership.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.footy_marketplace.membership.MembershipCheckout;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

@Value
@Builder
public class CheckoutResponse {

    @JsonProperty("payment_intent_id")
    String paymentIntentId;

    @JsonProperty("client_secret")
    String clientSecret;

    @JsonProperty("membership_id")
    UUID membershipId;

    @JsonProperty("plan_type")
    String planType;

    @JsonProperty("amount")
    BigDecimal amount;

    @JsonProperty("currency")
    String currency;

    @JsonProperty("replaces_membership_id")
    UUID replacesMembershipId;

    public static CheckoutResponse from(MembershipCheckout checkout) {
        return CheckoutResponse.builder()
            .paymentIntentId(checkout.getPaymentIntentId())
            .clientSecret(checkout.getClientSecret())
            .membershipId(checkout.getMembership().getId())
            .planType(checkout.getMembership().getPlan().name())
            .amount(checkout.getMembership().getPrice())
            .currency(checkout.getMembership().getCurrency())
            .replacesMembershipId(checkout.getReplaces() != null ? checkout.getReplaces().getId() : null)
            .build();
    }
}
