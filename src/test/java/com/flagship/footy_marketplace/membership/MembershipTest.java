package com.flagship.footy_marketplace.membership;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class MembershipTest {

    private static final Duration PERIOD = Duration.ofDays(30);

    private Membership pending(MembershipPlan plan) {
        return Membership.pending(UUID.randomUUID(), UUID.randomUUID(), plan,
            new BigDecimal("29.99"), "usd", "pi_123");
    }

    @Test
    @DisplayName("A new membership is PENDING with no dates")
    void pendingHasNoDates() {
        Membership membership = pending(MembershipPlan.PROFESSIONAL);

        assertEquals(MembershipStatus.PENDING, membership.getStatus());
        assertNull(membership.getStartDate());
        assertNull(membership.getRenewalDate());
        assertFalse(membership.isActiveAt(Instant.now()));
    }

    @Test
    @DisplayName("Non-positive prices are rejected")
    void rejectsNonPositivePrice() {
        assertThrows(IllegalArgumentException.class, () -> Membership.pending(UUID.randomUUID(),
            UUID.randomUUID(), MembershipPlan.BASIC, BigDecimal.ZERO, "usd", "pi_1"));
    }

    @Test
    @DisplayName("Activation sets renewal date to start plus one period")
    void activationSetsRenewalDate() {
        Instant now = Instant.parse("2026-03-01T10:00:00Z");

        Membership active = pending(MembershipPlan.PROFESSIONAL).activate(now, PERIOD);

        assertEquals(MembershipStatus.ACTIVE, active.getStatus());
        assertEquals(now, active.getStartDate());
        assertEquals(Instant.parse("2026-03-31T10:00:00Z"), active.getRenewalDate());
        assertTrue(active.isActiveAt(now.plus(Duration.ofDays(29))));
    }

    @Test
    @DisplayName("Only PENDING memberships can be activated")
    void activateTwiceFails() {
        Membership active = pending(MembershipPlan.BASIC).activate(Instant.now(), PERIOD);

        assertThrows(IllegalStateException.class, () -> active.activate(Instant.now(), PERIOD));
    }

    @Test
    @DisplayName("An ACTIVE membership past its renewal date reads as inactive")
    void inactiveAfterRenewalDate() {
        Instant start = Instant.parse("2026-01-01T00:00:00Z");
        Membership active = pending(MembershipPlan.PREMIUM).activate(start, PERIOD);

        assertFalse(active.isActiveAt(start.plus(PERIOD)));
        assertFalse(active.isActiveAt(start.plus(Duration.ofDays(45))));
    }

    @Test
    @DisplayName("Expire only applies to ACTIVE memberships")
    void expireRequiresActive() {
        Membership pending = pending(MembershipPlan.BASIC);
        assertThrows(IllegalStateException.class, pending::expire);

        Membership expired = pending.activate(Instant.now(), PERIOD).expire();
        assertEquals(MembershipStatus.EXPIRED, expired.getStatus());
        assertTrue(expired.isTerminal());
    }

    @Test
    @DisplayName("Cancelling keeps the reason and a terminal membership cannot be cancelled again")
    void cancelRules() {
        Membership cancelled = pending(MembershipPlan.BASIC)
            .activate(Instant.now(), PERIOD)
            .cancel("Moving abroad");

        assertEquals(MembershipStatus.CANCELLED, cancelled.getStatus());
        assertEquals("Moving abroad", cancelled.getCancellationReason());
        assertThrows(IllegalStateException.class, () -> cancelled.cancel("again"));
    }
}
