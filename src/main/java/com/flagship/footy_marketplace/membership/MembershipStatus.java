package com.flagship.footy_marketplace.membership;

/**
 * PENDING -> ACTIVE     payment confirmed
 * PENDING -> CANCELLED  payment canceled
 * ACTIVE  -> EXPIRED    expiry sweep after the renewal date
 * ACTIVE  -> CANCELLED  cancelled by the candidate or superseded by a newer membership
 */
public enum MembershipStatus {
    PENDING,
    ACTIVE,
    EXPIRED,
    CANCELLED
}
