package com.flagship.footy_marketplace.vacancy.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.footy_marketplace.vacancy.Vacancy;
import com.flagship.footy_marketplace.vacancy.VacancyStatus;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class VacancyResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("team_id")
    UUID teamId;

    @JsonProperty("title")
    String title;

    @JsonProperty("description")
    String description;

    @JsonProperty("requirements")
    String requirements;

    @JsonProperty("location")
    String location;

    @JsonProperty("position_type")
    String positionType;

    @JsonProperty("experience_level")
    String experienceLevel;

    @JsonProperty("salary_min")
    BigDecimal salaryMin;

    @JsonProperty("salary_max")
    BigDecimal salaryMax;

    @JsonProperty("expiry_date")
    Instant expiryDate;

    @JsonProperty("status")
    VacancyStatus status;

    @JsonProperty("created_at")
    Instant createdAt;

    public static VacancyResponse from(Vacancy vacancy) {
        return VacancyResponse.builder()
            .id(vacancy.getId())
            .teamId(vacancy.getTeamId())
            .title(vacancy.getTitle())
            .description(vacancy.getDescription())
            .requirements(vacancy.getRequirements())
            .location(vacancy.getLocation())
            .positionType(vacancy.getPositionType())
            .experienceLevel(vacancy.getExperienceLevel())
            .salaryMin(vacancy.getSalaryMin())
            .salaryMax(vacancy.getSalaryMax())
            .expiryDate(vacancy.getExpiryDate())
            .status(vacancy.getStatus())
            .createdAt(vacancy.getCreatedAt())
            .build();
    }
}
