package com.flagship.footy_marketplace.membership.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class CancelMembershipRequest {

    @Size(max = 255)
    @JsonProperty("reason")
    private String reason;
}
