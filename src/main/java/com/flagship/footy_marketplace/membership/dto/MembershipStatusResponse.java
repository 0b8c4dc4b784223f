package com.flagship.footy_marketplace.membership.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

import java.util.UUID;

@Value
public class MembershipStatusResponse {

    @JsonProperty("candidate_id")
    UUID candidateId;

    @JsonProperty("active")
    boolean active;
}
