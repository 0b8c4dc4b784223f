package com.flagship.footy_marketplace.membership.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.footy_marketplace.membership.Membership;
import com.flagship.footy_marketplace.membership.MembershipStatus;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class MembershipResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("candidate_id")
    UUID candidateId;

    @JsonProperty("plan_type")
    String planType;

    @JsonProperty("price")
    BigDecimal price;

    @JsonProperty("currency")
    String currency;

    @JsonProperty("status")
    MembershipStatus status;

    @JsonProperty("start_date")
    Instant startDate;

    @JsonProperty("renewal_date")
    Instant renewalDate;

    @JsonProperty("payment_intent_id")
    String paymentIntentId;

    @JsonProperty("cancellation_reason")
    String cancellationReason;

    @JsonProperty("created_at")
    Instant createdAt;

    @JsonProperty("updated_at")
    Instant updatedAt;

    public static MembershipResponse from(Membership membership) {
        return MembershipResponse.builder()
            .id(membership.getId())
            .candidateId(membership.getCandidateId())
            .planType(membership.getPlan().name())
            .price(membership.getPrice())
            .currency(membership.getCurrency())
            .status(membership.getStatus())
            .startDate(membership.getStartDate())
            .renewalDate(membership.getRenewalDate())
            .paymentIntentId(membership.getPaymentIntentId())
            .cancellationReason(membership.getCancellationReason())
            .createdAt(membership.getCreatedAt())
            .updatedAt(membership.getUpdatedAt())
            .build();
    }
}
