package com.flagship.footy_marketplace.vacancy;

import com.flagship.footy_marketplace.exception.ResourceNotFoundException;
import com.flagship.footy_marketplace.exception.UnpaidInvoiceExistsException;
import com.flagship.footy_marketplace.observability.MarketplaceMetrics;
import com.flagship.footy_marketplace.placement.PlacementInvoiceService;
import com.flagship.footy_marketplace.vacancy.dto.CreateVacancyRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Vacancy lifecycle. Creation is refused while the team has an UNPAID placement invoice.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class VacancyService {

    private final VacancyRepository vacancyRepository;
    private final PlacementInvoiceService placementInvoiceService;
    private final MarketplaceMetrics metrics;

    /**
     * @throws UnpaidInvoiceExistsException if the team owes a placement fee
     * @throws IllegalArgumentException if salary_min exceeds salary_max
     */
    @Transactional
    public Vacancy create(UUID teamId, CreateVacancyRequest request) {
        if (!placementInvoiceService.canCreateVacancy(teamId)) {
            metrics.recordVacancyGate(false);
            log.warn("Vacancy creation blocked for team {}: unpaid placement invoice", teamId);
            throw new UnpaidInvoiceExistsException(teamId);
        }
        metrics.recordVacancyGate(true);

        Vacancy vacancy = Vacancy.draft(
            UUID.randomUUID(),
            teamId,
            request.getTitle(),
            request.getDescription(),
            request.getRequirements(),
            request.getLocation(),
            request.getPositionType(),
            request.getExperienceLevel(),
            request.getSalaryMin(),
            request.getSalaryMax(),
            request.getExpiryDate());

        Vacancy saved = vacancyRepository.save(VacancyEntity.fromDomain(vacancy)).toDomain();
        log.info("Vacancy {} created for team {}: {}", saved.getId(), teamId, saved.getTitle());
        return saved;
    }

    @Transactional(readOnly = true)
    public Vacancy get(UUID vacancyId) {
        return find(vacancyId).toDomain();
    }

    @Transactional(readOnly = true)
    public List<Vacancy> listByTeam(UUID teamId) {
        return vacancyRepository.findByTeamIdOrderByCreatedAtDesc(teamId).stream()
            .map(VacancyEntity::toDomain)
            .toList();
    }

    @Transactional
    public Vacancy activate(UUID vacancyId) {
        VacancyEntity entity = find(vacancyId);
        Vacancy activated = entity.toDomain().activate(Instant.now());
        entity.updateFromDomain(activated);
        vacancyRepository.save(entity);
        log.info("Vacancy {} is {}", vacancyId, activated.getStatus());
        return activated;
    }

    @Transactional
    public Vacancy close(UUID vacancyId) {
        VacancyEntity entity = find(vacancyId);
        Vacancy closed = entity.toDomain().close();
        entity.updateFromDomain(closed);
        vacancyRepository.save(entity);
        log.info("Vacancy {} closed", vacancyId);
        return closed;
    }

    private VacancyEntity find(UUID vacancyId) {
        return vacancyRepository.findById(vacancyId)
            .orElseThrow(() -> new ResourceNotFoundException("Vacancy", vacancyId));
    }
}
