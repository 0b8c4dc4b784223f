package com.flagship.footy_marketplace.exception;

import com.flagship.footy_marketplace.membership.MembershipPlan;

import java.util.UUID;

/**
 * Thrown when a candidate asks for a plan that is not above the one they already hold.
 */
public class AlreadyActiveException extends MarketplaceException {

    public AlreadyActiveException(UUID candidateId, MembershipPlan activePlan, MembershipPlan requestedPlan) {
        super("ALREADY_ACTIVE", String.format(
            "Candidate %s already has an active %s membership; %s is not a higher tier",
            candidateId, activePlan, requestedPlan));
    }
}
