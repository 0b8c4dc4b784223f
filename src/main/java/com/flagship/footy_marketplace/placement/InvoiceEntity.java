package com.flagship.footy_marketplace.placement;

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
 * JPA entity for placement invoices. team_id is copied from the placement so the vacancy
 * gate is a single indexed lookup.
 */
@Entity
@Table(
    name = "invoices",
    indexes = {
        @Index(name = "idx_invoices_team_status", columnList = "team_id, status")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class InvoiceEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "placement_id", nullable = false, updatable = false, unique = true)
    private UUID placementId;

    @Column(name = "team_id", nullable = false, updatable = false)
    private UUID teamId;

    @Column(nullable = false, updatable = false, precision = 19, scale = 2)
    private BigDecimal amount;

    @Column(nullable = false, updatable = false, length = 3)
    private String currency;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private InvoiceStatus status;

    @Column(name = "due_date", nullable = false, updatable = false)
    private Instant dueDate;

    @Column(name = "paid_at")
    private Instant paidAt;

    @Column(name = "void_reason")
    private String voidReason;

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

    static InvoiceEntity fromDomain(Invoice invoice) {
        return new InvoiceEntity(
            invoice.getId(),
            invoice.getPlacementId(),
            invoice.getTeamId(),
            invoice.getAmount(),
            invoice.getCurrency(),
            invoice.getStatus(),
            invoice.getDueDate(),
            invoice.getPaidAt(),
            invoice.getVoidReason(),
            null,
            null
        );
    }

    public Invoice toDomain() {
        return new Invoice(id, placementId, teamId, amount, currency, status, dueDate, paidAt,
            voidReason, createdAt, updatedAt);
    }

    void updateFromDomain(Invoice invoice) {
        this.status = invoice.getStatus();
        this.paidAt = invoice.getPaidAt();
        this.voidReason = invoice.getVoidReason();
    }
}
