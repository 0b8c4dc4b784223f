package com.flagship.footy_marketplace.exception;

/**
 * Thrown when a gateway webhook cannot be trusted: missing or wrong signature,
 * stale timestamp, or a payload that does not have the expected shape.
 */
public class InvalidSignatureException extends MarketplaceException {

    public InvalidSignatureException(String message) {
        super("INVALID_SIGNATURE", message);
    }

    public InvalidSignatureException(String message, Throwable cause) {
        super("INVALID_SIGNATURE", message, cause);
    }
}
