package com.flagship.footy_marketplace.exception;

/**
 * Thrown when a membership plan code does not match any known plan.
 */
public class InvalidPlanException extends MarketplaceException {

    public InvalidPlanException(String planCode) {
        super("INVALID_PLAN", "Unknown membership plan: " + planCode);
    }
}
