package com.flagship.footy_marketplace.membership.event;

import com.flagship.footy_marketplace.membership.Membership;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
public class MembershipExpiredEvent implements MembershipEvent {
    public static final String EVENT_TYPE = "MembershipExpired";

    UUID eventId;
    UUID membershipId;
    UUID candidateId;
    String planType;
    Instant renewalDate;
    Instant occurredAt;

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static MembershipExpiredEvent from(Membership membership) {
        return new MembershipExpiredEvent(
            UUID.randomUUID(),
            membership.getId(),
            membership.getCandidateId(),
            membership.getPlan().name(),
            membership.getRenewalDate(),
            Instant.now()
        );
    }
}
