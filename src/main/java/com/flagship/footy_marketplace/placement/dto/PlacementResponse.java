package com.flagship.footy_marketplace.placement.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.footy_marketplace.placement.Placement;
import com.flagship.footy_marketplace.placement.PlacementRecord;
import com.flagship.footy_marketplace.placement.PlacementStatus;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class PlacementResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("candidate_id")
    UUID candidateId;

    @JsonProperty("team_id")
    UUID teamId;

    @JsonProperty("vacancy_id")
    UUID vacancyId;

    @JsonProperty("status")
    PlacementStatus status;

    @JsonProperty("created_at")
    Instant createdAt;

    /** Present only on the response to recording a placement. */
    @JsonProperty("invoice")
    InvoiceResponse invoice;

    public static PlacementResponse from(PlacementRecord record) {
        return base(record.getPlacement())
            .invoice(InvoiceResponse.from(record.getInvoice()))
            .build();
    }

    public static PlacementResponse from(Placement placement) {
        return base(placement).build();
    }

    private static PlacementResponseBuilder base(Placement placement) {
        return PlacementResponse.builder()
            .id(placement.getId())
            .candidateId(placement.getCandidateId())
            .teamId(placement.getTeamId())
            .vacancyId(placement.getVacancyId())
            .status(placement.getStatus())
            .createdAt(placement.getCreatedAt());
    }
}
