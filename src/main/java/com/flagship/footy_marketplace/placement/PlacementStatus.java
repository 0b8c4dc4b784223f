package com.flagship.footy_marketplace.placement;

/**
 * PENDING -> CONFIRMED  its invoice was paid
 * PENDING -> CANCELLED  its invoice was voided
 */
public enum PlacementStatus {
    PENDING,
    CONFIRMED,
    CANCELLED
}
