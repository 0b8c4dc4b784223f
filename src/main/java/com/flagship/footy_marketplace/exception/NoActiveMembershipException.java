package com.flagship.footy_marketplace.exception;

import java.util.UUID;

public class NoActiveMembershipException extends MarketplaceException {

    public NoActiveMembershipException(UUID candidateId) {
        super("NO_ACTIVE_MEMBERSHIP", "Candidate " + candidateId + " has no active membership");
    }
}
