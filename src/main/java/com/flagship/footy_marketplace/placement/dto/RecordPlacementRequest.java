package com.flagship.footy_marketplace.placement.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.UUID;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class RecordPlacementRequest {

    @NotNull(message = "candidate_id is required")
    @JsonProperty("candidate_id")
    private UUID candidateId;

    @NotNull(message = "team_id is required")
    @JsonProperty("team_id")
    private UUID teamId;

    @NotNull(message = "vacancy_id is required")
    @JsonProperty("vacancy_id")
    private UUID vacancyId;
}
