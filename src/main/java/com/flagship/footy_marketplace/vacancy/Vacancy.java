package com.flagship.footy_marketplace.vacancy;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * A position a team is hiring for. Starts as DRAFT, is published with activate() and ends CLOSED.
 */
@Value
public class Vacancy {
    UUID id;
    UUID teamId;
    String title;
    String description;
    String requirements;
    String location;
    String positionType;
    String experienceLevel;
    BigDecimal salaryMin;
    BigDecimal salaryMax;
    Instant expiryDate;
    VacancyStatus status;
    Instant createdAt;
    Instant updatedAt;

    public static Vacancy draft(UUID id, UUID teamId, String title, String description, String requirements,
                                String location, String positionType, String experienceLevel,
                                BigDecimal salaryMin, BigDecimal salaryMax, Instant expiryDate) {
        if (salaryMin != null && salaryMax != null && salaryMin.compareTo(salaryMax) > 0) {
            throw new IllegalArgumentException("salary_min must not exceed salary_max");
        }
        Instant now = Instant.now();
        return new Vacancy(id, teamId, title, description, requirements, location, positionType,
            experienceLevel, salaryMin, salaryMax, expiryDate, VacancyStatus.DRAFT, now, now);
    }

    /**
     * @throws IllegalStateException if the vacancy is closed or already past its expiry date
     */
    public Vacancy activate(Instant now) {
        if (status == VacancyStatus.ACTIVE) {
            return this;
        }
        if (status == VacancyStatus.CLOSED) {
            throw new IllegalStateException("Cannot activate closed vacancy " + id);
        }
        if (expiryDate.isBefore(now)) {
            throw new IllegalStateException("Cannot activate vacancy " + id + ": it expired at " + expiryDate);
        }
        return withStatus(VacancyStatus.ACTIVE);
    }

    public Vacancy close() {
        if (status == VacancyStatus.CLOSED) {
            return this;
        }
        return withStatus(VacancyStatus.CLOSED);
    }

    private Vacancy withStatus(VacancyStatus newStatus) {
        return new Vacancy(id, teamId, title, description, requirements, location, positionType,
            experienceLevel, salaryMin, salaryMax, expiryDate, newStatus, createdAt, Instant.now());
    }
}
