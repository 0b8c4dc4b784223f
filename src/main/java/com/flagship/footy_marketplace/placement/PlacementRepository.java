package com.flagship.footy_marketplace.placement;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface PlacementRepository extends JpaRepository<PlacementEntity, UUID> {

    boolean existsByVacancyIdAndCandidateId(UUID vacancyId, UUID candidateId);

    List<PlacementEntity> findByTeamIdOrderByCreatedAtDesc(UUID teamId);
}
