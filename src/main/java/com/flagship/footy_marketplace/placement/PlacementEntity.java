package com.flagship.footy_marketplace.placement;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(
    name = "placements",
    uniqueConstraints = {
        @UniqueConstraint(name = "uk_placements_vacancy_candidate", columnNames = {"vacancy_id", "candidate_id"})
    },
    indexes = {
        @Index(name = "idx_placements_team", columnList = "team_id")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class PlacementEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "candidate_id", nullable = false, updatable = false)
    private UUID candidateId;

    @Column(name = "team_id", nullable = false, updatable = false)
    private UUID teamId;

    @Column(name = "vacancy_id", nullable = false, updatable = false)
    private UUID vacancyId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private PlacementStatus status;

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

    static PlacementEntity fromDomain(Placement placement) {
        return new PlacementEntity(
            placement.getId(),
            placement.getCandidateId(),
            placement.getTeamId(),
            placement.getVacancyId(),
            placement.getStatus(),
            null,
            null
        );
    }

    public Placement toDomain() {
        return new Placement(id, candidateId, teamId, vacancyId, status, createdAt, updatedAt);
    }

    void updateFromDomain(Placement placement) {
        this.status = placement.getStatus();
    }
}
