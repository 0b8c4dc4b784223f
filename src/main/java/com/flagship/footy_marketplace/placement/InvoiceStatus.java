package com.flagship.footy_marketplace.placement;

/**
 * UNPAID -> PAID  (terminal)
 * UNPAID -> VOID  (terminal, admin only)
 */
public enum InvoiceStatus {
    UNPAID,
    PAID,
    VOID
}
