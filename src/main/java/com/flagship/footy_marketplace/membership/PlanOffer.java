package com.flagship.footy_marketplace.membership;

import lombok.Value;

import java.math.BigDecimal;
import java.util.List;

/**
 * A plan as offered for sale: price, currency and period resolved from configuration.
 */
@Value
public class PlanOffer {
    MembershipPlan plan;
    int tier;
    BigDecimal price;
    String currency;
    long periodDays;
    List<String> features;
}
