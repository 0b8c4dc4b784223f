package com.flagship.footy_marketplace.vacancy;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface VacancyRepository extends JpaRepository<VacancyEntity, UUID> {

    List<VacancyEntity> findByTeamIdOrderByCreatedAtDesc(UUID teamId);

    long countByStatus(VacancyStatus status);
}
