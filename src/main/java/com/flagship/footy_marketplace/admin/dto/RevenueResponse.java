package com.flagship.footy_marketplace.admin.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.footy_marketplace.admin.RevenueSummary;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

@Value
@Builder
public class RevenueResponse {

    @JsonProperty("membership_revenue")
    BigDecimal membershipRevenue;

    @JsonProperty("membership_payments")
    long membershipPayments;

    @JsonProperty("placement_revenue")
    BigDecimal placementRevenue;

    @JsonProperty("paid_invoices")
    long paidInvoices;

    @JsonProperty("total_revenue")
    BigDecimal totalRevenue;

    @JsonProperty("currency")
    String currency;

    public static RevenueResponse from(RevenueSummary summary) {
        return RevenueResponse.builder()
            .membershipRevenue(summary.getMembershipRevenue())
            .membershipPayments(summary.getMembershipPayments())
            .placementRevenue(summary.getPlacementRevenue())
            .paidInvoices(summary.getPaidInvoices())
            .totalRevenue(summary.getTotal())
            .currency(summary.getCurrency())
            .build();
    }
}
