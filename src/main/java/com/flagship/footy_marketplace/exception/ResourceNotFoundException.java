package com.flagship.footy_marketplace.exception;

public class ResourceNotFoundException extends MarketplaceException {

    public ResourceNotFoundException(String resource, Object id) {
        super("NOT_FOUND", resource + " not found: " + id);
    }
}
