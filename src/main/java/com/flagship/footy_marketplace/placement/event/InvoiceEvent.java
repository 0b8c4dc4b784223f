package com.flagship.footy_marketplace.placement.event;

import java.time.Instant;
import java.util.UUID;

/**
 * Facts about placement invoices, published on the billing topic.
 */
public interface InvoiceEvent {

    UUID getEventId();

    UUID getInvoiceId();

    UUID getTeamId();

    Instant getOccurredAt();

    String getEventType();
}
