package com.flagship.footy_marketplace.vacancy;

import com.flagship.footy_marketplace.vacancy.dto.CreateVacancyRequest;
import com.flagship.footy_marketplace.vacancy.dto.VacancyResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class VacancyController {

    private final VacancyService vacancyService;

    @PostMapping("/teams/{teamId}/vacancies")
    public ResponseEntity<VacancyResponse> create(
            @PathVariable("teamId") UUID teamId,
            @Valid @RequestBody CreateVacancyRequest request) {
        Vacancy vacancy = vacancyService.create(teamId, request);
        return ResponseEntity.status(HttpStatus.CREATED).body(VacancyResponse.from(vacancy));
    }

    @GetMapping("/teams/{teamId}/vacancies")
    public List<VacancyResponse> listByTeam(@PathVariable("teamId") UUID teamId) {
        return vacancyService.listByTeam(teamId).stream().map(VacancyResponse::from).toList();
    }

    @GetMapping("/vacancies/{vacancyId}")
    public VacancyResponse get(@PathVariable("vacancyId") UUID vacancyId) {
        return VacancyResponse.from(vacancyService.get(vacancyId));
    }

    @PostMapping("/vacancies/{vacancyId}/activate")
    public VacancyResponse activate(@PathVariable("vacancyId") UUID vacancyId) {
        return VacancyResponse.from(vacancyService.activate(vacancyId));
    }

    @PostMapping("/vacancies/{vacancyId}/close")
    public VacancyResponse close(@PathVariable("vacancyId") UUID vacancyId) {
        return VacancyResponse.from(vacancyService.close(vacancyId));
    }
}
