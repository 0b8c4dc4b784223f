package com.flagship.footy_marketplace.membership;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

/**
 * A candidate's membership.
 *
 * Immutable: each transition returns a new instance and rejects moves the state machine
 * in MembershipStatus does not allow. Start and renewal dates are only set on activation.
 */
@Value
public class Membership {
    UUID id;
    UUID candidateId;
    MembershipPlan plan;
    BigDecimal price;
    String currency;
    MembershipStatus status;
    Instant startDate;
    Instant renewalDate;
    String paymentIntentId;
    String cancellationReason;
    Instant createdAt;
    Instant updatedAt;

    public static Membership pending(UUID id, UUID candidateId, MembershipPlan plan,
                                     BigDecimal price, String currency, String paymentIntentId) {
        if (price == null || price.signum() <= 0) {
            throw new IllegalArgumentException("Membership price must be positive");
        }
        Instant now = Instant.now();
        return new Membership(id, candidateId, plan, price, currency, MembershipStatus.PENDING,
            null, null, paymentIntentId, null, now, now);
    }

    /**
     * Activates a pending membership starting at {@code now} for one plan period.
     *
     * @throws IllegalStateException unless the membership is PENDING
     */
    public Membership activate(Instant now, Duration period) {
        if (status != MembershipStatus.PENDING) {
            throw new IllegalStateException(String.format(
                "Cannot activate membership %s in %s status. Only PENDING memberships can be activated.",
                id, status));
        }
        return new Membership(id, candidateId, plan, price, currency, MembershipStatus.ACTIVE,
            now, now.plus(period), paymentIntentId, null, createdAt, Instant.now());
    }

    /**
     * @throws IllegalStateException unless the membership is ACTIVE
     */
    public Membership expire() {
        if (status != MembershipStatus.ACTIVE) {
            throw new IllegalStateException(String.format(
                "Cannot expire membership %s in %s status. Only ACTIVE memberships can expire.", id, status));
        }
        return new Membership(id, candidateId, plan, price, currency, MembershipStatus.EXPIRED,
            startDate, renewalDate, paymentIntentId, null, createdAt, Instant.now());
    }

    /**
     * @throws IllegalStateException if the membership is already EXPIRED or CANCELLED
     */
    public Membership cancel(String reason) {
        if (isTerminal()) {
            throw new IllegalStateException(String.format(
                "Cannot cancel membership %s in %s status.", id, status));
        }
        return new Membership(id, candidateId, plan, price, currency, MembershipStatus.CANCELLED,
            startDate, renewalDate, paymentIntentId, reason, createdAt, Instant.now());
    }

    /**
     * Active means ACTIVE status and a renewal date still in the future. A membership past its
     * renewal date is inactive even if the expiry sweep has not reached it yet.
     */
    public boolean isActiveAt(Instant at) {
        return status == MembershipStatus.ACTIVE && renewalDate != null && renewalDate.isAfter(at);
    }

    public boolean isTerminal() {
        return status == MembershipStatus.EXPIRED || status == MembershipStatus.CANCELLED;
    }
}
