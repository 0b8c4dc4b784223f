package com.flagship.footy_marketplace.membership.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Body of purchase and upgrade requests. The plan code is validated by MembershipPlan so
 * unknown codes surface as INVALID_PLAN rather than a deserialization error.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class PlanTypeRequest {

    @NotBlank(message = "plan_type is required")
    @JsonProperty("plan_type")
    private String planType;
}
