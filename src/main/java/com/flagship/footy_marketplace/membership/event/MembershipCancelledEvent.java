package com.flagship.footy_marketplace.membership.event;

import com.flagship.footy_marketplace.membership.Membership;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Emitted for explicit cancellations, failed payments and supersession by a newer membership.
 */
@Value
public class MembershipCancelledEvent implements MembershipEvent {
    public static final String EVENT_TYPE = "MembershipCancelled";

    UUID eventId;
    UUID membershipId;
    UUID candidateId;
    String planType;
    String previousStatus;
    String reason;
    Instant occurredAt;

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static MembershipCancelledEvent from(Membership previous, Membership cancelled) {
        return new MembershipCancelledEvent(
            UUID.randomUUID(),
            cancelled.getId(),
            cancelled.getCandidateId(),
            cancelled.getPlan().name(),
            previous.getStatus().name(),
            cancelled.getCancellationReason(),
            Instant.now()
        );
    }
}
