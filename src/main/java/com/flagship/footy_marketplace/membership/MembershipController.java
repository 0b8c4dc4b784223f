package com.flagship.footy_marketplace.membership;

import com.flagship.footy_marketplace.exception.NoActiveMembershipException;
import com.flagship.footy_marketplace.membership.dto.CancelMembershipRequest;
import com.flagship.footy_marketplace.membership.dto.CheckoutResponse;
import com.flagship.footy_marketplace.membership.dto.MembershipResponse;
import com.flagship.footy_marketplace.membership.dto.MembershipStatusResponse;
import com.flagship.footy_marketplace.membership.dto.PlanResponse;
import com.flagship.footy_marketplace.membership.dto.PlanTypeRequest;
import com.flagship.footy_marketplace.observability.CorrelationContext;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
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
@RequestMapping("/api/memberships")
@RequiredArgsConstructor
@Slf4j
public class MembershipController {

    private final MembershipService membershipService;

    @GetMapping("/plans")
    public List<PlanResponse> plans() {
        return membershipService.listPlans().stream().map(PlanResponse::from).toList();
    }

    @PostMapping("/candidates/{candidateId}/payment-intents")
    public ResponseEntity<CheckoutResponse> createPaymentIntent(
            @PathVariable("candidateId") UUID candidateId,
            @Valid @RequestBody PlanTypeRequest request) {
        MDC.put(CorrelationContext.CANDIDATE_ID_MDC_KEY, candidateId.toString());
        log.info("Membership purchase requested: plan={}", request.getPlanType());

        MembershipCheckout checkout = membershipService.createPaymentIntent(candidateId, request.getPlanType());
        return ResponseEntity.status(HttpStatus.CREATED).body(CheckoutResponse.from(checkout));
    }

    @PostMapping("/payment-intents/{intentId}/confirm")
    public MembershipResponse confirm(@PathVariable("intentId") String intentId) {
        return MembershipResponse.from(membershipService.confirmPayment(intentId));
    }

    @PostMapping("/candidates/{candidateId}/upgrade")
    public ResponseEntity<CheckoutResponse> upgrade(
            @PathVariable("candidateId") UUID candidateId,
            @Valid @RequestBody PlanTypeRequest request) {
        MDC.put(CorrelationContext.CANDIDATE_ID_MDC_KEY, candidateId.toString());
        log.info("Membership upgrade requested: plan={}", request.getPlanType());

        MembershipCheckout checkout = membershipService.upgrade(candidateId, request.getPlanType());
        return ResponseEntity.status(HttpStatus.CREATED).body(CheckoutResponse.from(checkout));
    }

    @PostMapping("/candidates/{candidateId}/cancel")
    public MembershipResponse cancel(
            @PathVariable("candidateId") UUID candidateId,
            @Valid @RequestBody(required = false) CancelMembershipRequest request) {
        String reason = request != null ? request.getReason() : null;
        return MembershipResponse.from(membershipService.cancel(candidateId, reason));
    }

    @GetMapping("/candidates/{candidateId}/active")
    public MembershipResponse active(@PathVariable("candidateId") UUID candidateId) {
        return membershipService.getActiveMembership(candidateId)
            .map(MembershipResponse::from)
            .orElseThrow(() -> new NoActiveMembershipException(candidateId));
    }

    @GetMapping("/candidates/{candidateId}/status")
    public MembershipStatusResponse status(@PathVariable("candidateId") UUID candidateId) {
        return new MembershipStatusResponse(candidateId, membershipService.isActive(candidateId));
    }

    @GetMapping("/candidates/{candidateId}/history")
    public List<MembershipResponse> history(@PathVariable("candidateId") UUID candidateId) {
        return membershipService.history(candidateId).stream().map(MembershipResponse::from).toList();
    }
}
