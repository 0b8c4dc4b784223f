package com.flagship.footy_marketplace.membership;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Plan prices, billing currency and membership period, read from marketplace.membership.*.
 */
@Component
public class PlanCatalog {

    private final Map<MembershipPlan, BigDecimal> prices = new EnumMap<>(MembershipPlan.class);
    private final String currency;
    private final Duration period;

    public PlanCatalog(
            @Value("${marketplace.membership.prices.basic:9.99}") BigDecimal basic,
            @Value("${marketplace.membership.prices.premium:19.99}") BigDecimal premium,
            @Value("${marketplace.membership.prices.professional:29.99}") BigDecimal professional,
            @Value("${marketplace.currency:usd}") String currency,
            @Value("${marketplace.membership.period-days:30}") long periodDays) {
        prices.put(MembershipPlan.BASIC, basic);
        prices.put(MembershipPlan.PREMIUM, premium);
        prices.put(MembershipPlan.PROFESSIONAL, professional);
        this.currency = currency;
        this.period = Duration.ofDays(periodDays);
    }

    public BigDecimal priceOf(MembershipPlan plan) {
        return prices.get(plan);
    }

    public String currency() {
        return currency;
    }

    public Duration period() {
        return period;
    }

    public List<PlanOffer> offers() {
        return Arrays.stream(MembershipPlan.values())
            .map(plan -> new PlanOffer(plan, plan.getTier(), priceOf(plan), currency,
                period.toDays(), plan.getFeatures()))
            .toList();
    }
}
