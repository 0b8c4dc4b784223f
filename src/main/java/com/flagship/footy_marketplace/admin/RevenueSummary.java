package com.flagship.footy_marketplace.admin;

import lombok.Value;

import java.math.BigDecimal;

@Value
public class RevenueSummary {
    BigDecimal membershipRevenue;
    long membershipPayments;
    BigDecimal placementRevenue;
    long paidInvoices;
    String currency;

    public BigDecimal getTotal() {
        return membershipRevenue.add(placementRevenue);
    }
}
