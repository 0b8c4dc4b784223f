package com.flagship.footy_marketplace.placement;

import com.flagship.footy_marketplace.IntegrationTestSupport;
import com.flagship.footy_marketplace.exception.DuplicatePlacementException;
import com.flagship.footy_marketplace.exception.ResourceNotFoundException;
import com.flagship.footy_marketplace.exception.UnpaidInvoiceExistsException;
import com.flagship.footy_marketplace.outbox.OutboxService;
import com.flagship.footy_marketplace.payment.PaymentIntentService;
import com.flagship.footy_marketplace.payment.PaymentIntentStatus;
import com.flagship.footy_marketplace.placement.event.InvoiceIssuedEvent;
import com.flagship.footy_marketplace.placement.event.InvoicePaidEvent;
import com.flagship.footy_marketplace.vacancy.Vacancy;
import com.flagship.footy_marketplace.vacancy.VacancyService;
import com.flagship.footy_marketplace.vacancy.dto.CreateVacancyRequest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class PlacementInvoiceServiceTest extends IntegrationTestSupport {

    @Autowired
    private PlacementInvoiceService placementInvoiceService;

    @Autowired
    private VacancyService vacancyService;

    @Autowired
    private PaymentIntentService paymentIntentService;

    @Autowired
    private OutboxService outboxService;

    private UUID teamId;
    private Vacancy vacancy;

    @BeforeEach
    void setUp() {
        teamId = UUID.randomUUID();
        vacancy = vacancyService.create(teamId, vacancyRequest("Striker"));
    }

    static CreateVacancyRequest vacancyRequest(String title) {
        return new CreateVacancyRequest(title, "First-team squad role", "Pro licence", "Manchester",
            "full-time", "senior", new BigDecimal("40000"), new BigDecimal("60000"),
            Instant.now().plus(Duration.ofDays(60)));
    }

    @Test
    @DisplayName("Gate scenario: placement issues a $50 invoice that blocks new vacancies until paid")
    void vacancyGateScenario() {
        assertTrue(placementInvoiceService.canCreateVacancy(teamId));

        PlacementRecord record = placementInvoiceService.recordPlacement(UUID.randomUUID(), teamId, vacancy.getId());

        Invoice invoice = record.getInvoice();
        assertEquals(InvoiceStatus.UNPAID, invoice.getStatus());
        assertEquals(0, new BigDecimal("50.00").compareTo(invoice.getAmount()));
        assertEquals(PlacementStatus.PENDING, record.getPlacement().getStatus());
        assertFalse(placementInvoiceService.canCreateVacancy(teamId));
        assertThrows(UnpaidInvoiceExistsException.class,
            () -> vacancyService.create(teamId, vacancyRequest("Winger")));

        placementInvoiceService.markInvoicePaid(invoice.getId());

        assertTrue(placementInvoiceService.canCreateVacancy(teamId));
        Vacancy next = vacancyService.create(teamId, vacancyRequest("Winger"));
        assertEquals(2, vacancyService.listByTeam(teamId).size());
        assertNotNull(next.getId());
        assertEquals(1, outboxService.getEventsOfType(InvoiceIssuedEvent.EVENT_TYPE).size());
        assertEquals(1, outboxService.getEventsOfType(InvoicePaidEvent.EVENT_TYPE).size());
    }

    @Test
    @DisplayName("The gate only looks at the team's own invoices")
    void gateIsPerTeam() {
        placementInvoiceService.recordPlacement(UUID.randomUUID(), teamId, vacancy.getId());

        assertTrue(placementInvoiceService.canCreateVacancy(UUID.randomUUID()));
    }

    @Test
    @DisplayName("The same candidate cannot be placed twice on one vacancy")
    void duplicatePlacementRejected() {
        UUID candidateId = UUID.randomUUID();
        placementInvoiceService.recordPlacement(candidateId, teamId, vacancy.getId());

        assertThrows(DuplicatePlacementException.class,
            () -> placementInvoiceService.recordPlacement(candidateId, teamId, vacancy.getId()));
        assertEquals(1, placementInvoiceService.invoicesForTeam(teamId).size());
    }

    @Test
    @DisplayName("A placement on another team's vacancy is refused")
    void vacancyMustBelongToTeam() {
        assertThrows(ResourceNotFoundException.class,
            () -> placementInvoiceService.recordPlacement(UUID.randomUUID(), UUID.randomUUID(), vacancy.getId()));
        assertThrows(ResourceNotFoundException.class,
            () -> placementInvoiceService.recordPlacement(UUID.randomUUID(), teamId, UUID.randomUUID()));
    }

    @Test
    @DisplayName("Paying confirms the placement and is idempotent")
    void markPaidConfirmsPlacement() {
        PlacementRecord record = placementInvoiceService.recordPlacement(UUID.randomUUID(), teamId, vacancy.getId());
        UUID invoiceId = record.getInvoice().getId();

        Invoice paid = placementInvoiceService.markInvoicePaid(invoiceId);
        Invoice again = placementInvoiceService.markInvoicePaid(invoiceId);

        assertEquals(InvoiceStatus.PAID, paid.getStatus());
        assertEquals(InvoiceStatus.PAID, again.getStatus());
        assertEquals(PlacementStatus.CONFIRMED, placementInvoiceService.placementsForTeam(teamId).get(0).getStatus());
        assertEquals(1, outboxService.getEventsOfType(InvoicePaidEvent.EVENT_TYPE).size());
    }

    @Test
    @DisplayName("Void cancels the placement, lifts the gate and blocks later payment")
    void voidRules() {
        PlacementRecord record = placementInvoiceService.recordPlacement(UUID.randomUUID(), teamId, vacancy.getId());
        UUID invoiceId = record.getInvoice().getId();

        Invoice voided = placementInvoiceService.voidInvoice(invoiceId, "Transfer collapsed");

        assertEquals(InvoiceStatus.VOID, voided.getStatus());
        assertEquals(PlacementStatus.CANCELLED, placementInvoiceService.placementsForTeam(teamId).get(0).getStatus());
        assertTrue(placementInvoiceService.canCreateVacancy(teamId));
        assertThrows(IllegalStateException.class, () -> placementInvoiceService.markInvoicePaid(invoiceId));
        assertEquals(InvoiceStatus.VOID, placementInvoiceService.voidInvoice(invoiceId, "again").getStatus());
    }

    @Test
    @DisplayName("A paid invoice cannot be voided")
    void paidCannotBeVoided() {
        PlacementRecord record = placementInvoiceService.recordPlacement(UUID.randomUUID(), teamId, vacancy.getId());
        placementInvoiceService.markInvoicePaid(record.getInvoice().getId());

        assertThrows(IllegalStateException.class,
            () -> placementInvoiceService.voidInvoice(record.getInvoice().getId(), "nope"));
    }

    @Test
    @DisplayName("An invoice payment intent settles the invoice when its success arrives")
    void invoicePaymentIntent() {
        PlacementRecord record = placementInvoiceService.recordPlacement(UUID.randomUUID(), teamId, vacancy.getId());
        UUID invoiceId = record.getInvoice().getId();

        InvoiceCheckout checkout = placementInvoiceService.createInvoicePaymentIntent(invoiceId);
        assertNotNull(checkout.getClientSecret());

        assertTrue(placementInvoiceService.onPaymentSucceeded(checkout.getPaymentIntentId()));

        assertEquals(InvoiceStatus.PAID, placementInvoiceService.getInvoice(invoiceId).getStatus());
        assertEquals(PaymentIntentStatus.SUCCEEDED,
            paymentIntentService.findById(checkout.getPaymentIntentId()).orElseThrow().getStatus());
        assertThrows(IllegalStateException.class, () -> placementInvoiceService.createInvoicePaymentIntent(invoiceId));
    }

    @Test
    @DisplayName("A payment landing on a voided invoice leaves it void")
    void paymentOnVoidedInvoice() {
        PlacementRecord record = placementInvoiceService.recordPlacement(UUID.randomUUID(), teamId, vacancy.getId());
        UUID invoiceId = record.getInvoice().getId();
        InvoiceCheckout checkout = placementInvoiceService.createInvoicePaymentIntent(invoiceId);
        placementInvoiceService.voidInvoice(invoiceId, "Duplicate billing");

        assertFalse(placementInvoiceService.onPaymentSucceeded(checkout.getPaymentIntentId()));
        assertEquals(InvoiceStatus.VOID, placementInvoiceService.getInvoice(invoiceId).getStatus());
    }

    @Test
    @DisplayName("Unpaid invoices are listed oldest due date first and paid revenue is summed")
    void reports() {
        Vacancy second = vacancyService.create(UUID.randomUUID(), vacancyRequest("Scout"));
        PlacementRecord first = placementInvoiceService.recordPlacement(UUID.randomUUID(), teamId, vacancy.getId());
        placementInvoiceService.recordPlacement(UUID.randomUUID(), second.getTeamId(), second.getId());

        assertEquals(2, placementInvoiceService.unpaidInvoices().size());
        assertEquals(first.getInvoice().getId(), placementInvoiceService.unpaidInvoices().get(0).getId());

        placementInvoiceService.markInvoicePaid(first.getInvoice().getId());
        assertEquals(1, placementInvoiceService.unpaidInvoices().size());
        assertEquals(0, new BigDecimal("50.00").compareTo(placementInvoiceService.paidRevenue()));
    }
}
