package com.flagship.footy_marketplace.membership.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.footy_marketplace.membership.PlanOffer;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;

@Value
public class PlanResponse {

    @JsonProperty("plan")
    String plan;

    @JsonProperty("tier")
    int tier;

    @JsonProperty("price")
    BigDecimal price;

    @JsonProperty("currency")
    String currency;

    @JsonProperty("period_days")
    long periodDays;

    @JsonProperty("features")
    List<String> features;

    public static PlanResponse from(PlanOffer offer) {
        return new PlanResponse(offer.getPlan().name(), offer.getTier(), offer.getPrice(),
            offer.getCurrency(), offer.getPeriodDays(), offer.getFeatures());
    }
}
