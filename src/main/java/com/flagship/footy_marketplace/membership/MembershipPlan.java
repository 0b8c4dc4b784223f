package com.flagship.footy_marketplace.membership;

import com.flagship.footy_marketplace.exception.InvalidPlanException;

import java.util.List;
import java.util.Locale;

/**
 * Membership plans, ordered by tier. Prices live in PlanCatalog.
 */
public enum MembershipPlan {
    BASIC(1, List.of(
        "Apply to unlimited positions",
        "Basic profile visibility",
        "Email notifications")),
    PREMIUM(2, List.of(
        "All Basic features",
        "Priority in search results",
        "Direct messaging with teams",
        "Application tracking")),
    PROFESSIONAL(3, List.of(
        "All Premium features",
        "Featured profile highlighting",
        "Career consultation",
        "Resume review service"));

    private final int tier;
    private final List<String> features;

    MembershipPlan(int tier, List<String> features) {
        this.tier = tier;
        this.features = features;
    }

    public int getTier() {
        return tier;
    }

    public List<String> getFeatures() {
        return features;
    }

    public boolean isHigherThan(MembershipPlan other) {
        return this.tier > other.tier;
    }

    /**
     * Parses a plan code case-insensitively.
     *
     * @throws InvalidPlanException if the code is blank or unknown
     */
    public static MembershipPlan fromCode(String code) {
        if (code == null || code.isBlank()) {
            throw new InvalidPlanException(String.valueOf(code));
        }
        try {
            return MembershipPlan.valueOf(code.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new InvalidPlanException(code);
        }
    }
}
