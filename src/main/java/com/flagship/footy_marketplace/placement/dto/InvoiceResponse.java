package com.flagship.footy_marketplace.placement.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.footy_marketplace.placement.Invoice;
import com.flagship.footy_marketplace.placement.InvoiceStatus;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class InvoiceResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("placement_id")
    UUID placementId;

    @JsonProperty("team_id")
    UUID teamId;

    @JsonProperty("amount")
    BigDecimal amount;

    @JsonProperty("currency")
    String currency;

    @JsonProperty("status")
    InvoiceStatus status;

    @JsonProperty("due_date")
    Instant dueDate;

    @JsonProperty("paid_at")
    Instant paidAt;

    @JsonProperty("void_reason")
    String voidReason;

    @JsonProperty("created_at")
    Instant createdAt;

    public static InvoiceResponse from(Invoice invoice) {
        return InvoiceResponse.builder()
            .id(invoice.getId())
            .placementId(invoice.getPlacementId())
            .teamId(invoice.getTeamId())
            .amount(invoice.getAmount())
            .currency(invoice.getCurrency())
            .status(invoice.getStatus())
            .dueDate(invoice.getDueDate())
            .paidAt(invoice.getPaidAt())
            .voidReason(invoice.getVoidReason())
            .createdAt(invoice.getCreatedAt())
            .build();
    }
}
