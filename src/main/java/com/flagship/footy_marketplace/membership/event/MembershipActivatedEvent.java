package com.flagship.footy_marketplace.membership.event;

import com.flagship.footy_marketplace.membership.Membership;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
public class MembershipActivatedEvent implements MembershipEvent {
    public static final String EVENT_TYPE = "MembershipActivated";

    UUID eventId;
    UUID membershipId;
    UUID candidateId;
    String planType;
    BigDecimal price;
    String currency;
    Instant startDate;
    Instant renewalDate;
    String paymentIntentId;
    Instant occurredAt;

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static MembershipActivatedEvent from(Membership membership) {
        return new MembershipActivatedEvent(
            UUID.randomUUID(),
            membership.getId(),
            membership.getCandidateId(),
            membership.getPlan().name(),
            membership.getPrice(),
            membership.getCurrency(),
            membership.getStartDate(),
            membership.getRenewalDate(),
            membership.getPaymentIntentId(),
            Instant.now()
        );
    }
}
