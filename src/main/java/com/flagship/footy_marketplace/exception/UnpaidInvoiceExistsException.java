package com.flagship.footy_marketplace.exception;

import java.util.UUID;

/**
 * Thrown when a team with outstanding placement invoices tries to publish a new vacancy.
 */
public class UnpaidInvoiceExistsException extends MarketplaceException {

    public UnpaidInvoiceExistsException(UUID teamId) {
        super("UNPAID_INVOICE_EXISTS",
            "Team " + teamId + " has unpaid placement invoices and cannot create vacancies");
    }
}
