package com.flagship.footy_marketplace.membership.event;

import java.time.Instant;
import java.util.UUID;

/**
 * Facts about membership changes, written to the outbox and published on the memberships topic.
 */
public interface MembershipEvent {

    /**
     * Unique per event instance; consumers dedupe on it.
     */
    UUID getEventId();

    UUID getMembershipId();

    UUID getCandidateId();

    Instant getOccurredAt();

    String getEventType();
}
