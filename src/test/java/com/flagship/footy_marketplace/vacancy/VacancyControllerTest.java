package com.flagship.footy_marketplace.vacancy;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.footy_marketplace.IntegrationTestSupport;
import com.flagship.footy_marketplace.placement.PlacementInvoiceService;
import com.flagship.footy_marketplace.placement.PlacementRecord;
import com.flagship.footy_marketplace.vacancy.dto.CreateVacancyRequest;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@AutoConfigureMockMvc
class VacancyControllerTest extends IntegrationTestSupport {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private VacancyService vacancyService;

    @Autowired
    private PlacementInvoiceService placementInvoiceService;

    private CreateVacancyRequest request(String title) {
        return new CreateVacancyRequest(title, "Matchday analyst for the first team", null, "Leeds",
            "full-time", "mid", new BigDecimal("30000"), null, Instant.now().plus(Duration.ofDays(30)));
    }

    @Test
    @DisplayName("Should create a vacancy and return 201")
    void createVacancy() throws Exception {
        UUID teamId = UUID.randomUUID();

        mockMvc.perform(post("/api/teams/{teamId}/vacancies", teamId)
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(request("Performance Analyst"))))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.id").exists())
            .andExpect(jsonPath("$.team_id").value(teamId.toString()))
            .andExpect(jsonPath("$.title").value("Performance Analyst"))
            .andExpect(jsonPath("$.status").value("DRAFT"));

        assertEquals(1, vacancyService.listByTeam(teamId).size());
    }

    @Test
    @DisplayName("Should refuse a new vacancy with 409 while the team has an unpaid invoice")
    void unpaidInvoiceBlocksCreation() throws Exception {
        UUID teamId = UUID.randomUUID();
        Vacancy first = vacancyService.create(teamId, request("Goalkeeping Coach"));
        PlacementRecord record = placementInvoiceService.recordPlacement(UUID.randomUUID(), teamId, first.getId());

        mockMvc.perform(post("/api/teams/{teamId}/vacancies", teamId)
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(request("Scout"))))
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.code").value("UNPAID_INVOICE_EXISTS"));

        placementInvoiceService.markInvoicePaid(record.getInvoice().getId());

        mockMvc.perform(post("/api/teams/{teamId}/vacancies", teamId)
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(request("Scout"))))
            .andExpect(status().isCreated());
    }

    @Test
    @DisplayName("Should return 400 with field details when required fields are missing")
    void validationFailure() throws Exception {
        mockMvc.perform(post("/api/teams/{teamId}/vacancies", UUID.randomUUID())
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"title\":\"\",\"description\":\"x\"}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.code").value("VALIDATION_FAILED"))
            .andExpect(jsonPath("$.details.title").exists())
            .andExpect(jsonPath("$.details.expiryDate").exists());
    }

    @Test
    @DisplayName("Should activate, close and fetch a vacancy")
    void lifecycle() throws Exception {
        Vacancy vacancy = vacancyService.create(UUID.randomUUID(), request("Physio"));

        mockMvc.perform(post("/api/vacancies/{id}/activate", vacancy.getId()))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("ACTIVE"));

        mockMvc.perform(post("/api/vacancies/{id}/close", vacancy.getId()))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("CLOSED"));

        mockMvc.perform(get("/api/vacancies/{id}", vacancy.getId()))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("CLOSED"));

        mockMvc.perform(get("/api/vacancies/{id}", UUID.randomUUID()))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.code").value("NOT_FOUND"));
    }
}
