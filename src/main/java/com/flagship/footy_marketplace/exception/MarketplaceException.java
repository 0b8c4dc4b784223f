package com.flagship.footy_marketplace.exception;

/**
 * Base class for business rule violations surfaced to API callers.
 *
 * Each subclass carries a stable error code; GlobalExceptionHandler maps
 * subclasses to HTTP status codes.
 */
public abstract class MarketplaceException extends RuntimeException {

    private final String errorCode;

    protected MarketplaceException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    protected MarketplaceException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
