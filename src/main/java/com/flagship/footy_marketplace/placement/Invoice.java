package com.flagship.footy_marketplace.placement;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

/**
 * Fixed-fee invoice issued to a team for a placement.
 *
 * Both PAID and VOID are terminal. Repeating the transition that led to the current
 * terminal state returns the invoice unchanged; the other transition is rejected.
 */
@Value
public class Invoice {
    UUID id;
    UUID placementId;
    UUID teamId;
    BigDecimal amount;
    String currency;
    InvoiceStatus status;
    Instant dueDate;
    Instant paidAt;
    String voidReason;
    Instant createdAt;
    Instant updatedAt;

    public static Invoice issue(UUID id, UUID placementId, UUID teamId, BigDecimal amount,
                                String currency, Instant issuedAt, Duration paymentTerm) {
        if (amount == null || amount.signum() <= 0) {
            throw new IllegalArgumentException("Invoice amount must be positive");
        }
        return new Invoice(id, placementId, teamId, amount, currency, InvoiceStatus.UNPAID,
            issuedAt.plus(paymentTerm), null, null, issuedAt, issuedAt);
    }

    /**
     * @throws IllegalStateException if the invoice is VOID
     */
    public Invoice markPaid(Instant at) {
        if (status == InvoiceStatus.PAID) {
            return this;
        }
        if (status == InvoiceStatus.VOID) {
            throw new IllegalStateException(String.format(
                "Cannot pay invoice %s: it was voided (%s).", id, voidReason));
        }
        return new Invoice(id, placementId, teamId, amount, currency, InvoiceStatus.PAID,
            dueDate, at, null, createdAt, Instant.now());
    }

    /**
     * @throws IllegalStateException if the invoice is PAID
     */
    public Invoice voidInvoice(String reason) {
        if (status == InvoiceStatus.VOID) {
            return this;
        }
        if (status == InvoiceStatus.PAID) {
            throw new IllegalStateException(String.format(
                "Cannot void invoice %s: it was already paid.", id));
        }
        return new Invoice(id, placementId, teamId, amount, currency, InvoiceStatus.VOID,
            dueDate, null, reason, createdAt, Instant.now());
    }

    public boolean isOverdueAt(Instant at) {
        return status == InvoiceStatus.UNPAID && dueDate.isBefore(at);
    }
}
