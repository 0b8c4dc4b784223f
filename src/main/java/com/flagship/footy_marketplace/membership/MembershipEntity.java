package com.flagship.footy_marketplace.membership;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * JPA entity for memberships.
 *
 * No setters: state only changes through updateFromDomain with a Membership that has gone
 * through a valid transition. The one-ACTIVE-per-candidate rule is a partial unique index
 * in the Flyway schema, which JPA annotations cannot express.
 */
@Entity
@Table(
    name = "memberships",
    indexes = {
        @Index(name = "idx_memberships_candidate", columnList = "candidate_id"),
        @Index(name = "idx_memberships_status_renewal", columnList = "status, renewal_date")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class MembershipEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "candidate_id", nullable = false, updatable = false)
    private UUID candidateId;

    @Enumerated(EnumType.STRING)
    @Column(name = "plan_type", nullable = false, updatable = false, length = 20)
    private MembershipPlan plan;

    @Column(nullable = false, updatable = false, precision = 19, scale = 2)
    private BigDecimal price;

    @Column(nullable = false, updatable = false, length = 3)
    private String currency;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private MembershipStatus status;

    @Column(name = "start_date")
    private Instant startDate;

    @Column(name = "renewal_date")
    private Instant renewalDate;

    @Column(name = "payment_intent_id", nullable = false, updatable = false, unique = true)
    private String paymentIntentId;

    @Column(name = "cancellation_reason")
    private String cancellationReason;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    void onCreate() {
        this.createdAt = Instant.now();
        this.updatedAt = this.createdAt;
    }

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    static MembershipEntity fromDomain(Membership membership) {
        return new MembershipEntity(
            membership.getId(),
            membership.getCandidateId(),
            membership.getPlan(),
            membership.getPrice(),
            membership.getCurrency(),
            membership.getStatus(),
            membership.getStartDate(),
            membership.getRenewalDate(),
            membership.getPaymentIntentId(),
            membership.getCancellationReason(),
            null,
            null
        );
    }

    public Membership toDomain() {
        return new Membership(
            id,
            candidateId,
            plan,
            price,
            currency,
            status,
            startDate,
            renewalDate,
            paymentIntentId,
            cancellationReason,
            createdAt,
            updatedAt
        );
    }

    void updateFromDomain(Membership membership) {
        this.status = membership.getStatus();
        this.startDate = membership.getStartDate();
        this.renewalDate = membership.getRenewalDate();
        this.cancellationReason = membership.getCancellationReason();
    }
}
