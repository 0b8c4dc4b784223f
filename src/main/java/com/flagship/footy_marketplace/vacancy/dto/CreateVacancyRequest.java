package com.flagship.footy_marketplace.vacancy.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Future;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class CreateVacancyRequest {

    @NotBlank(message = "title is required")
    @Size(max = 200, message = "title must be at most 200 characters")
    @JsonProperty("title")
    private String title;

    @NotBlank(message = "description is required")
    @JsonProperty("description")
    private String description;

    @JsonProperty("requirements")
    private String requirements;

    @NotBlank(message = "location is required")
    @JsonProperty("location")
    private String location;

    @NotBlank(message = "position_type is required")
    @JsonProperty("position_type")
    private String positionType;

    @NotBlank(message = "experience_level is required")
    @JsonProperty("experience_level")
    private String experienceLevel;

    @PositiveOrZero(message = "salary_min must not be negative")
    @JsonProperty("salary_min")
    private BigDecimal salaryMin;

    @PositiveOrZero(message = "salary_max must not be negative")
    @JsonProperty("salary_max")
    private BigDecimal salaryMax;

    @NotNull(message = "expiry_date is required")
    @Future(message = "expiry_date must be in the future")
    @JsonProperty("expiry_date")
    private Instant expiryDate;
}
