package com.flagship.footy_marketplace.exception;

/**
 * Thrown when the payment processor cannot be reached or rejects a request.
 * Not retried here; callers (or the processor's own webhook retries) decide.
 */
public class GatewayUnavailableException extends MarketplaceException {

    public GatewayUnavailableException(String message, Throwable cause) {
        super("GATEWAY_UNAVAILABLE", message, cause);
    }
}
