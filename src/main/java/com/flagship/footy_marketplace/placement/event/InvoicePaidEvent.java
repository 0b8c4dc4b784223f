package com.flagship.footy_marketplace.placement.event;

import com.flagship.footy_marketplace.placement.Invoice;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
public class InvoicePaidEvent implements InvoiceEvent {
    public static final String EVENT_TYPE = "InvoicePaid";

    UUID eventId;
    UUID invoiceId;
    UUID placementId;
    UUID teamId;
    BigDecimal amount;
    String currency;
    Instant paidAt;
    String source;             // "gateway" or "admin"
    Instant occurredAt;

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static InvoicePaidEvent from(Invoice invoice, String source) {
        return new InvoicePaidEvent(
            UUID.randomUUID(),
            invoice.getId(),
            invoice.getPlacementId(),
            invoice.getTeamId(),
            invoice.getAmount(),
            invoice.getCurrency(),
            invoice.getPaidAt(),
            source,
            Instant.now()
        );
    }
}
