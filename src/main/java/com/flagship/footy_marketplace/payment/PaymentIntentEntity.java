package com.flagship.footy_marketplace.payment;

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
 * JPA entity for payment intents, keyed by the gateway's intent id.
 *
 * Only status is mutable; everything else is fixed when the intent is created.
 */
@Entity
@Table(
    name = "payment_intents",
    indexes = {
        @Index(name = "idx_payment_intents_membership", columnList = "membership_id"),
        @Index(name = "idx_payment_intents_invoice", columnList = "invoice_id")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class PaymentIntentEntity {

    @Id
    @Column(nullable = false, updatable = false, length = 255)
    private String id;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false, length = 20)
    private PaymentPurpose purpose;

    @Column(name = "candidate_id", updatable = false)
    private UUID candidateId;

    @Column(name = "team_id", updatable = false)
    private UUID teamId;

    @Column(name = "membership_id", updatable = false)
    private UUID membershipId;

    @Column(name = "invoice_id", updatable = false)
    private UUID invoiceId;

    @Column(name = "plan_type", updatable = false, length = 20)
    private String planType;

    @Column(nullable = false, updatable = false, precision = 19, scale = 2)
    private BigDecimal amount;

    @Column(nullable = false, updatable = false, length = 3)
    private String currency;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private PaymentIntentStatus status;

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

    static PaymentIntentEntity fromDomain(PaymentIntentRecord intent) {
        return new PaymentIntentEntity(
            intent.getId(),
            intent.getPurpose(),
            intent.getCandidateId(),
            intent.getTeamId(),
            intent.getMembershipId(),
            intent.getInvoiceId(),
            intent.getPlanType(),
            intent.getAmount(),
            intent.getCurrency(),
            intent.getStatus(),
            null,
            null
        );
    }

    public PaymentIntentRecord toDomain() {
        return new PaymentIntentRecord(
            id,
            purpose,
            candidateId,
            teamId,
            membershipId,
            invoiceId,
            planType,
            amount,
            currency,
            status,
            createdAt,
            updatedAt
        );
    }

    void updateFromDomain(PaymentIntentRecord intent) {
        this.status = intent.getStatus();
    }
}
