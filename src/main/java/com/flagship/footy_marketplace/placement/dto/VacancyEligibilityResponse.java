package com.flagship.footy_marketplace.placement.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

import java.util.UUID;

@Value
public class VacancyEligibilityResponse {

    @JsonProperty("team_id")
    UUID teamId;

    @JsonProperty("can_create_vacancy")
    boolean canCreateVacancy;
}
