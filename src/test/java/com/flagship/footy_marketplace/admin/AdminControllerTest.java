package com.flagship.footy_marketplace.admin;

import com.flagship.footy_marketplace.IntegrationTestSupport;
import com.flagship.footy_marketplace.gateway.GatewayIntentStatus;
import com.flagship.footy_marketplace.membership.MembershipCheckout;
import com.flagship.footy_marketplace.membership.MembershipService;
import com.flagship.footy_marketplace.placement.InvoiceStatus;
import com.flagship.footy_marketplace.placement.PlacementInvoiceService;
import com.flagship.footy_marketplace.placement.PlacementRecord;
import com.flagship.footy_marketplace.placement.PlacementStatus;
import com.flagship.footy_marketplace.vacancy.Vacancy;
import com.flagship.footy_marketplace.vacancy.VacancyService;
import com.flagship.footy_marketplace.vacancy.dto.CreateVacancyRequest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@AutoConfigureMockMvc
class AdminControllerTest extends IntegrationTestSupport {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private VacancyService vacancyService;

    @Autowired
    private PlacementInvoiceService placementInvoiceService;

    @Autowired
    private MembershipService membershipService;

    private UUID teamId;
    private Vacancy vacancy;

    @BeforeEach
    void setUp() {
        teamId = UUID.randomUUID();
        vacancy = vacancyService.create(teamId, new CreateVacancyRequest("Kit Manager", "Matchday kit and travel",
            null, "Bristol", "part-time", "junior", null, null, Instant.now().plus(Duration.ofDays(14))));
    }

    @Test
    @DisplayName("Should mark an invoice paid and drop it from the unpaid list")
    void markPaid() throws Exception {
        PlacementRecord record = placementInvoiceService.recordPlacement(UUID.randomUUID(), teamId, vacancy.getId());
        UUID invoiceId = record.getInvoice().getId();

        mockMvc.perform(get("/api/admin/invoices/unpaid"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.length()").value(1))
            .andExpect(jsonPath("$[0].id").value(invoiceId.toString()));

        mockMvc.perform(post("/api/admin/invoices/{id}/mark-paid", invoiceId))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("PAID"))
            .andExpect(jsonPath("$.paid_at").exists());

        mockMvc.perform(get("/api/admin/invoices/unpaid"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.length()").value(0));
        assertTrue(placementInvoiceService.canCreateVacancy(teamId));
    }

    @Test
    @DisplayName("Should void an unpaid invoice with a reason and cancel its placement")
    void voidInvoice() throws Exception {
        PlacementRecord record = placementInvoiceService.recordPlacement(UUID.randomUUID(), teamId, vacancy.getId());
        UUID invoiceId = record.getInvoice().getId();

        mockMvc.perform(post("/api/admin/invoices/{id}/void", invoiceId)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.code").value("VALIDATION_FAILED"));

        mockMvc.perform(post("/api/admin/invoices/{id}/void", invoiceId)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"reason\":\"Candidate withdrew before signing\"}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("VOID"))
            .andExpect(jsonPath("$.void_reason").value("Candidate withdrew before signing"));

        assertEquals(InvoiceStatus.VOID, placementInvoiceService.getInvoice(invoiceId).getStatus());
        assertEquals(PlacementStatus.CANCELLED, placementInvoiceService.placementsForTeam(teamId).get(0).getStatus());
        assertTrue(placementInvoiceService.canCreateVacancy(teamId));
    }

    @Test
    @DisplayName("Should return 404 when overriding an unknown invoice")
    void unknownInvoice() throws Exception {
        mockMvc.perform(post("/api/admin/invoices/{id}/mark-paid", UUID.randomUUID()))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.code").value("NOT_FOUND"));
    }

    @Test
    @DisplayName("Should report membership and placement revenue together")
    void revenue() throws Exception {
        MembershipCheckout checkout = membershipService.createPaymentIntent(UUID.randomUUID(), "PREMIUM");
        gatewayReports(checkout.getPaymentIntentId(), GatewayIntentStatus.SUCCEEDED);
        membershipService.confirmPayment(checkout.getPaymentIntentId());

        PlacementRecord record = placementInvoiceService.recordPlacement(UUID.randomUUID(), teamId, vacancy.getId());
        placementInvoiceService.markInvoicePaid(record.getInvoice().getId());

        mockMvc.perform(get("/api/admin/revenue"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.membership_payments").value(1))
            .andExpect(jsonPath("$.paid_invoices").value(1))
            .andExpect(jsonPath("$.total_revenue").value(69.99))
            .andExpect(jsonPath("$.currency").value("usd"));
    }

    @Test
    @DisplayName("Should run the expiry sweep on demand")
    void expirySweep() throws Exception {
        mockMvc.perform(post("/api/admin/memberships/expire"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.expired").value(0));
    }
}
