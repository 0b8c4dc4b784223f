package com.flagship.footy_marketplace.placement;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * A hire of a candidate by a team for a vacancy.
 */
@Value
public class Placement {
    UUID id;
    UUID candidateId;
    UUID teamId;
    UUID vacancyId;
    PlacementStatus status;
    Instant createdAt;
    Instant updatedAt;

    public static Placement create(UUID id, UUID candidateId, UUID teamId, UUID vacancyId) {
        Instant now = Instant.now();
        return new Placement(id, candidateId, teamId, vacancyId, PlacementStatus.PENDING, now, now);
    }

    /**
     * Idempotent on CONFIRMED.
     *
     * @throws IllegalStateException if the placement was cancelled
     */
    public Placement confirm() {
        if (status == PlacementStatus.CONFIRMED) {
            return this;
        }
        if (status != PlacementStatus.PENDING) {
            throw new IllegalStateException(String.format(
                "Cannot confirm placement %s in %s status.", id, status));
        }
        return new Placement(id, candidateId, teamId, vacancyId, PlacementStatus.CONFIRMED, createdAt, Instant.now());
    }

    /**
     * Idempotent on CANCELLED.
     *
     * @throws IllegalStateException if the placement was already confirmed
     */
    public Placement cancel() {
        if (status == PlacementStatus.CANCELLED) {
            return this;
        }
        if (status != PlacementStatus.PENDING) {
            throw new IllegalStateException(String.format(
                "Cannot cancel placement %s in %s status.", id, status));
        }
        return new Placement(id, candidateId, teamId, vacancyId, PlacementStatus.CANCELLED, createdAt, Instant.now());
    }
}
