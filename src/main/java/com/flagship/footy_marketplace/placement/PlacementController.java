package com.flagship.footy_marketplace.placement;

import com.flagship.footy_marketplace.placement.dto.InvoicePaymentIntentResponse;
import com.flagship.footy_marketplace.placement.dto.InvoiceResponse;
import com.flagship.footy_marketplace.placement.dto.PlacementResponse;
import com.flagship.footy_marketplace.placement.dto.RecordPlacementRequest;
import com.flagship.footy_marketplace.placement.dto.VacancyEligibilityResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
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
@RequestMapping("/api/placements")
@RequiredArgsConstructor
@Slf4j
public class PlacementController {

    private final PlacementInvoiceService placementInvoiceService;

    @PostMapping
    public ResponseEntity<PlacementResponse> record(@Valid @RequestBody RecordPlacementRequest request) {
        log.info("Placement requested: team={}, candidate={}, vacancy={}",
            request.getTeamId(), request.getCandidateId(), request.getVacancyId());
        PlacementRecord record = placementInvoiceService.recordPlacement(
            request.getCandidateId(), request.getTeamId(), request.getVacancyId());
        return ResponseEntity.status(HttpStatus.CREATED).body(PlacementResponse.from(record));
    }

    @GetMapping("/teams/{teamId}")
    public List<PlacementResponse> placements(@PathVariable("teamId") UUID teamId) {
        return placementInvoiceService.placementsForTeam(teamId).stream().map(PlacementResponse::from).toList();
    }

    @GetMapping("/teams/{teamId}/invoices")
    public List<InvoiceResponse> invoices(@PathVariable("teamId") UUID teamId) {
        return placementInvoiceService.invoicesForTeam(teamId).stream().map(InvoiceResponse::from).toList();
    }

    @GetMapping("/teams/{teamId}/vacancy-eligibility")
    public VacancyEligibilityResponse eligibility(@PathVariable("teamId") UUID teamId) {
        return new VacancyEligibilityResponse(teamId, placementInvoiceService.canCreateVacancy(teamId));
    }

    @GetMapping("/invoices/{invoiceId}")
    public InvoiceResponse invoice(@PathVariable("invoiceId") UUID invoiceId) {
        return InvoiceResponse.from(placementInvoiceService.getInvoice(invoiceId));
    }

    @PostMapping("/invoices/{invoiceId}/payment-intent")
    public ResponseEntity<InvoicePaymentIntentResponse> createPaymentIntent(@PathVariable("invoiceId") UUID invoiceId) {
        InvoiceCheckout checkout = placementInvoiceService.createInvoicePaymentIntent(invoiceId);
        return ResponseEntity.status(HttpStatus.CREATED).body(InvoicePaymentIntentResponse.from(checkout));
    }
}
