package com.flagship.footy_marketplace.placement.event;

import com.flagship.footy_marketplace.placement.Invoice;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
public class InvoiceVoidedEvent implements InvoiceEvent {
    public static final String EVENT_TYPE = "InvoiceVoided";

    UUID eventId;
    UUID invoiceId;
    UUID placementId;
    UUID teamId;
    String reason;
    Instant occurredAt;

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static InvoiceVoidedEvent from(Invoice invoice) {
        return new InvoiceVoidedEvent(
            UUID.randomUUID(),
            invoice.getId(),
            invoice.getPlacementId(),
            invoice.getTeamId(),
            invoice.getVoidReason(),
            Instant.now()
        );
    }
}
