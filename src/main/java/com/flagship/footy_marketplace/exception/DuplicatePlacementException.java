package com.flagship.footy_marketplace.exception;

import java.util.UUID;

public class DuplicatePlacementException extends MarketplaceException {

    public DuplicatePlacementException(UUID candidateId, UUID vacancyId) {
        super("DUPLICATE_PLACEMENT", String.format(
            "A placement already exists for candidate %s on vacancy %s", candidateId, vacancyId));
    }
}
