package com.flagship.footy_marketplace.observability;

import com.flagship.footy_marketplace.membership.MembershipRepository;
import com.flagship.footy_marketplace.membership.MembershipStatus;
import com.flagship.footy_marketplace.placement.InvoiceRepository;
import com.flagship.footy_marketplace.placement.InvoiceStatus;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Business metrics for memberships, webhooks and placement billing.
 *
 * Tag values come from enums or fixed strings so cardinality stays bounded.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class MarketplaceMetrics {

    private final MeterRegistry registry;
    private final MembershipRepository membershipRepository;
    private final InvoiceRepository invoiceRepository;

    private final AtomicLong activeMemberships = new AtomicLong();
    private final AtomicLong unpaidInvoices = new AtomicLong();

    @PostConstruct
    public void init() {
        Gauge.builder("memberships.active", activeMemberships, AtomicLong::get)
            .description("Memberships currently in ACTIVE status")
            .register(registry);

        Gauge.builder("invoices.unpaid", unpaidInvoices, AtomicLong::get)
            .description("Placement invoices awaiting payment")
            .register(registry);
    }

    @Transactional(readOnly = true)
    public void refreshGauges() {
        try {
            activeMemberships.set(membershipRepository.countByStatus(MembershipStatus.ACTIVE));
            unpaidInvoices.set(invoiceRepository.countByStatus(InvoiceStatus.UNPAID));
        } catch (Exception e) {
            log.warn("Failed to refresh marketplace gauges: {}", e.getMessage());
        }
    }

    // ==================== Memberships ====================

    public void recordMembershipIntentCreated(String plan, String kind) {
        registry.counter("memberships.intents.created", "plan", plan, "kind", kind).increment();
    }

    public void recordMembershipActivated(String plan, String source) {
        registry.counter("memberships.activated", "plan", plan, "source", source).increment();
    }

    public void recordMembershipCancelled(String cause) {
        registry.counter("memberships.cancelled", "cause", cause).increment();
    }

    public void recordMembershipsExpired(int count) {
        registry.counter("memberships.expired").increment(count);
    }

    // ==================== Webhooks ====================

    public void recordWebhook(String outcome) {
        registry.counter("webhooks.received", "outcome", outcome).increment();
    }

    public void recordIdempotencyHit(String store) {
        registry.counter("webhooks.idempotency", "result", "hit", "store", store).increment();
    }

    public void recordIdempotencyMiss() {
        registry.counter("webhooks.idempotency", "result", "miss", "store", "none").increment();
    }

    // ==================== Placements & invoices ====================

    public void recordPlacementRecorded() {
        registry.counter("placements.recorded").increment();
    }

    public void recordInvoicePaid(String source) {
        registry.counter("invoices.paid", "source", source).increment();
    }

    public void recordInvoiceVoided() {
        registry.counter("invoices.voided").increment();
    }

    public void recordVacancyGate(boolean allowed) {
        registry.counter("vacancies.gate", "result", allowed ? "allowed" : "blocked").increment();
    }

    // ==================== Latency ====================

    public void recordLatency(String operation, long durationMs) {
        registry.timer("marketplace.operation.latency", "operation", operation)
            .record(Duration.ofMillis(durationMs));
    }
}
