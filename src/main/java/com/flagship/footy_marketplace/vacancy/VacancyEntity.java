package com.flagship.footy_marketplace.vacancy;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Entity
@Table(
    name = "vacancies",
    indexes = {
        @Index(name = "idx_vacancies_team", columnList = "team_id")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class VacancyEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "team_id", nullable = false, updatable = false)
    private UUID teamId;

    @Column(nullable = false)
    private String title;

    @Column(columnDefinition = "TEXT")
    private String description;

    @Column(columnDefinition = "TEXT")
    private String requirements;

    private String location;

    @Column(name = "position_type", length = 100)
    private String positionType;

    @Column(name = "experience_level", length = 100)
    private String experienceLevel;

    @Column(name = "salary_min", precision = 12, scale = 2)
    private BigDecimal salaryMin;

    @Column(name = "salary_max", precision = 12, scale = 2)
    private BigDecimal salaryMax;

    @Column(name = "expiry_date", nullable = false)
    private Instant expiryDate;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private VacancyStatus status;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    void onCreate() {
        this.createdAt = Instant.now();
        this.updatedAt = this.createdAt;
    }

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    static VacancyEntity fromDomain(Vacancy vacancy) {
        return new VacancyEntity(
            vacancy.getId(),
            vacancy.getTeamId(),
            vacancy.getTitle(),
            vacancy.getDescription(),
            vacancy.getRequirements(),
            vacancy.getLocation(),
            vacancy.getPositionType(),
            vacancy.getExperienceLevel(),
            vacancy.getSalaryMin(),
            vacancy.getSalaryMax(),
            vacancy.getExpiryDate(),
            vacancy.getStatus(),
            null,
            null
        );
    }

    public Vacancy toDomain() {
        return new Vacancy(id, teamId, title, description, requirements, location, positionType,
            experienceLevel, salaryMin, salaryMax, expiryDate, status, createdAt, updatedAt);
    }

    void updateFromDomain(Vacancy vacancy) {
        this.status = vacancy.getStatus();
    }
}
