package com.flagship.footy_marketplace.payment;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Our audit copy of a gateway payment intent.
 *
 * It ties the gateway id to the membership or invoice being paid for. It is never the
 * source of truth for membership or invoice status.
 */
@Value
public class PaymentIntentRecord {
    String id;
    PaymentPurpose purpose;
    UUID candidateId;
    UUID teamId;
    UUID membershipId;
    UUID invoiceId;
    String planType;
    BigDecimal amount;
    String currency;
    PaymentIntentStatus status;
    Instant createdAt;
    Instant updatedAt;

    public static PaymentIntentRecord forMembership(String id, UUID candidateId, UUID membershipId,
                                                    String planType, BigDecimal amount, String currency) {
        Instant now = Instant.now();
        return new PaymentIntentRecord(id, PaymentPurpose.MEMBERSHIP, candidateId, null, membershipId, null,
            planType, amount, currency, PaymentIntentStatus.CREATED, now, now);
    }

    public static PaymentIntentRecord forInvoice(String id, UUID teamId, UUID invoiceId,
                                                 BigDecimal amount, String currency) {
        Instant now = Instant.now();
        return new PaymentIntentRecord(id, PaymentPurpose.INVOICE, null, teamId, null, invoiceId,
            null, amount, currency, PaymentIntentStatus.CREATED, now, now);
    }

    public PaymentIntentRecord succeed() {
        if (status == PaymentIntentStatus.SUCCEEDED) {
            return this;
        }
        return withStatus(PaymentIntentStatus.SUCCEEDED);
    }

    /**
     * @throws IllegalStateException if the intent already succeeded
     */
    public PaymentIntentRecord fail() {
        if (status == PaymentIntentStatus.SUCCEEDED) {
            throw new IllegalStateException("Payment intent " + id + " already succeeded and cannot fail");
        }
        if (status == PaymentIntentStatus.FAILED) {
            return this;
        }
        return withStatus(PaymentIntentStatus.FAILED);
    }

    public boolean isSucceeded() {
        return status == PaymentIntentStatus.SUCCEEDED;
    }

    private PaymentIntentRecord withStatus(PaymentIntentStatus newStatus) {
        return new PaymentIntentRecord(id, purpose, candidateId, teamId, membershipId, invoiceId,
            planType, amount, currency, newStatus, createdAt, Instant.now());
    }
}
