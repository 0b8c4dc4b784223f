package com.flagship.footy_marketplace.placement.event;

import com.flagship.footy_marketplace.placement.Invoice;
import com.flagship.footy_marketplace.placement.Placement;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
public class InvoiceIssuedEvent implements InvoiceEvent {
    public static final String EVENT_TYPE = "InvoiceIssued";

    UUID eventId;
    UUID invoiceId;
    UUID placementId;
    UUID teamId;
    UUID candidateId;
    UUID vacancyId;
    BigDecimal amount;
    String currency;
    Instant dueDate;
    Instant occurredAt;

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static InvoiceIssuedEvent from(Invoice invoice, Placement placement) {
        return new InvoiceIssuedEvent(
            UUID.randomUUID(),
            invoice.getId(),
            placement.getId(),
            invoice.getTeamId(),
            placement.getCandidateId(),
            placement.getVacancyId(),
            invoice.getAmount(),
            invoice.getCurrency(),
            invoice.getDueDate(),
            Instant.now()
        );
    }
}
