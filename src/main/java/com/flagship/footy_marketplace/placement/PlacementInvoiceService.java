package com.flagship.footy_marketplace.placement;

import com.flagship.footy_marketplace.exception.DuplicatePlacementException;
import com.flagship.footy_marketplace.exception.ResourceNotFoundException;
import com.flagship.footy_marketplace.gateway.GatewayPaymentIntent;
import com.flagship.footy_marketplace.gateway.PaymentGateway;
import com.flagship.footy_marketplace.observability.CorrelationContext;
import com.flagship.footy_marketplace.observability.MarketplaceMetrics;
import com.flagship.footy_marketplace.outbox.OutboxPublisher;
import com.flagship.footy_marketplace.outbox.OutboxService;
import com.flagship.footy_marketplace.payment.PaymentIntentRecord;
import com.flagship.footy_marketplace.payment.PaymentIntentService;
import com.flagship.footy_marketplace.payment.PaymentPurpose;
import com.flagship.footy_marketplace.placement.event.InvoiceIssuedEvent;
import com.flagship.footy_marketplace.placement.event.InvoicePaidEvent;
import com.flagship.footy_marketplace.placement.event.InvoiceVoidedEvent;
import com.flagship.footy_marketplace.vacancy.VacancyEntity;
import com.flagship.footy_marketplace.vacancy.VacancyRepository;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Records placements, issues their fixed-fee invoices and answers the vacancy gate.
 *
 * Invoice transitions lock the invoice row, so an admin override and a payment webhook
 * arriving together apply once.
 */
@Service
@Slf4j
public class PlacementInvoiceService {

    private static final String AGGREGATE_TYPE = OutboxPublisher.INVOICE_AGGREGATE;

    private final PlacementRepository placementRepository;
    private final InvoiceRepository invoiceRepository;
    private final VacancyRepository vacancyRepository;
    private final PaymentIntentService paymentIntentService;
    private final PaymentGateway paymentGateway;
    private final OutboxService outboxService;
    private final MarketplaceMetrics metrics;
    private final BigDecimal invoiceAmount;
    private final String currency;
    private final Duration paymentTerm;

    public PlacementInvoiceService(PlacementRepository placementRepository,
                                   InvoiceRepository invoiceRepository,
                                   VacancyRepository vacancyRepository,
                                   PaymentIntentService paymentIntentService,
                                   PaymentGateway paymentGateway,
                                   OutboxService outboxService,
                                   MarketplaceMetrics metrics,
                                   @Value("${marketplace.placement.invoice-amount:50.00}") BigDecimal invoiceAmount,
                                   @Value("${marketplace.currency:usd}") String currency,
                                   @Value("${marketplace.placement.payment-term-days:30}") long paymentTermDays) {
        this.placementRepository = placementRepository;
        this.invoiceRepository = invoiceRepository;
        this.vacancyRepository = vacancyRepository;
        this.paymentIntentService = paymentIntentService;
        this.paymentGateway = paymentGateway;
        this.outboxService = outboxService;
        this.metrics = metrics;
        this.invoiceAmount = invoiceAmount;
        this.currency = currency;
        this.paymentTerm = Duration.ofDays(paymentTermDays);
    }

    /**
     * Records a hire and issues its UNPAID invoice.
     *
     * @throws ResourceNotFoundException if the vacancy does not exist or belongs to another team
     * @throws DuplicatePlacementException if the candidate was already placed on this vacancy
     */
    @Transactional
    public PlacementRecord recordPlacement(UUID candidateId, UUID teamId, UUID vacancyId) {
        VacancyEntity vacancy = vacancyRepository.findById(vacancyId)
            .filter(v -> v.getTeamId().equals(teamId))
            .orElseThrow(() -> new ResourceNotFoundException("Vacancy for team " + teamId, vacancyId));

        if (placementRepository.existsByVacancyIdAndCandidateId(vacancy.getId(), candidateId)) {
            throw new DuplicatePlacementException(candidateId, vacancyId);
        }

        Placement placement = Placement.create(UUID.randomUUID(), candidateId, teamId, vacancyId);
        try {
            placement = placementRepository.saveAndFlush(PlacementEntity.fromDomain(placement)).toDomain();
        } catch (DataIntegrityViolationException e) {
            // lost a race with a concurrent request for the same pair
            throw new DuplicatePlacementException(candidateId, vacancyId);
        }

        Invoice invoice = Invoice.issue(UUID.randomUUID(), placement.getId(), teamId,
            invoiceAmount, currency, Instant.now(), paymentTerm);
        invoice = invoiceRepository.save(InvoiceEntity.fromDomain(invoice)).toDomain();

        outboxService.saveEvent(AGGREGATE_TYPE, invoice.getId(),
            InvoiceIssuedEvent.EVENT_TYPE, InvoiceIssuedEvent.from(invoice, placement));

        metrics.recordPlacementRecorded();
        log.info("Placement recorded: placement={}, team={}, candidate={}, vacancy={}, invoice={} ({} {}, due {})",
            placement.getId(), teamId, candidateId, vacancyId, invoice.getId(),
            invoice.getAmount(), invoice.getCurrency(), invoice.getDueDate());

        return new PlacementRecord(placement, invoice);
    }

    /**
     * Admin override: marks an invoice paid without a gateway payment. Idempotent.
     *
     * @throws IllegalStateException if the invoice is VOID
     */
    @Transactional
    public Invoice markInvoicePaid(UUID invoiceId) {
        return pay(lockInvoice(invoiceId), "admin");
    }

    /**
     * Webhook path for a succeeded invoice payment.
     *
     * @return false if the invoice was voided before the payment landed
     */
    @Transactional
    public boolean onPaymentSucceeded(String paymentIntentId) {
        PaymentIntentRecord intent = lockInvoiceIntent(paymentIntentId);
        paymentIntentService.update(intent.succeed());

        InvoiceEntity entity = lockInvoice(intent.getInvoiceId());
        if (entity.getStatus() == InvoiceStatus.VOID) {
            log.warn("Payment {} succeeded for voided invoice {}; needs manual refund",
                paymentIntentId, entity.getId());
            return false;
        }
        pay(entity, "gateway");
        return true;
    }

    @Transactional
    public void onPaymentFailed(String paymentIntentId) {
        PaymentIntentRecord intent = lockInvoiceIntent(paymentIntentId);
        if (intent.isSucceeded()) {
            log.warn("Ignoring failure notice for already succeeded intent {}", paymentIntentId);
            return;
        }
        paymentIntentService.update(intent.fail());
        log.info("Payment {} for invoice {} failed; invoice stays UNPAID", paymentIntentId, intent.getInvoiceId());
    }

    private Invoice pay(InvoiceEntity entity, String source) {
        MDC.put(CorrelationContext.INVOICE_ID_MDC_KEY, entity.getId().toString());
        try {
            Invoice current = entity.toDomain();
            if (current.getStatus() == InvoiceStatus.PAID) {
                log.info("Invoice already paid, nothing to do");
                return current;
            }

            Invoice paid = current.markPaid(Instant.now());
            entity.updateFromDomain(paid);
            invoiceRepository.save(entity);

            PlacementEntity placement = placementRepository.findById(paid.getPlacementId())
                .orElseThrow(() -> new IllegalStateException("Invoice " + paid.getId() + " has no placement"));
            placement.updateFromDomain(placement.toDomain().confirm());
            placementRepository.save(placement);

            outboxService.saveEvent(AGGREGATE_TYPE, paid.getId(),
                InvoicePaidEvent.EVENT_TYPE, InvoicePaidEvent.from(paid, source));
            metrics.recordInvoicePaid(source);
            log.info("Invoice paid: team={}, amount={} {}, source={}",
                paid.getTeamId(), paid.getAmount(), paid.getCurrency(), source);
            return paid;
        } finally {
            MDC.remove(CorrelationContext.INVOICE_ID_MDC_KEY);
        }
    }

    /**
     * Admin action: voids an UNPAID invoice and cancels its placement. Idempotent on VOID.
     *
     * @throws IllegalStateException if the invoice is already PAID
     */
    @Transactional
    public Invoice voidInvoice(UUID invoiceId, String reason) {
        InvoiceEntity entity = lockInvoice(invoiceId);
        Invoice current = entity.toDomain();
        if (current.getStatus() == InvoiceStatus.VOID) {
            return current;
        }

        Invoice voided = current.voidInvoice(reason);
        entity.updateFromDomain(voided);
        invoiceRepository.save(entity);

        placementRepository.findById(voided.getPlacementId()).ifPresent(placement -> {
            placement.updateFromDomain(placement.toDomain().cancel());
            placementRepository.save(placement);
        });

        outboxService.saveEvent(AGGREGATE_TYPE, voided.getId(),
            InvoiceVoidedEvent.EVENT_TYPE, InvoiceVoidedEvent.from(voided));
        metrics.recordInvoiceVoided();
        log.info("Invoice {} voided: {}", invoiceId, reason);
        return voided;
    }

    /**
     * Creates a gateway intent the team can use to pay an UNPAID invoice.
     *
     * @throws IllegalStateException if the invoice is not UNPAID
     */
    @Transactional
    public InvoiceCheckout createInvoicePaymentIntent(UUID invoiceId) {
        Invoice invoice = lockInvoice(invoiceId).toDomain();
        if (invoice.getStatus() != InvoiceStatus.UNPAID) {
            throw new IllegalStateException(String.format(
                "Invoice %s is %s and cannot be paid", invoiceId, invoice.getStatus()));
        }

        GatewayPaymentIntent intent = paymentGateway.createPaymentIntent(
            invoice.getAmount(),
            invoice.getCurrency(),
            Map.of(
                "purpose", PaymentPurpose.INVOICE.name(),
                "invoice_id", invoice.getId().toString(),
                "team_id", invoice.getTeamId().toString()
            ));

        paymentIntentService.record(PaymentIntentRecord.forInvoice(
            intent.getId(), invoice.getTeamId(), invoice.getId(), invoice.getAmount(), invoice.getCurrency()));

        log.info("Payment intent {} created for invoice {}", intent.getId(), invoiceId);
        return new InvoiceCheckout(invoice, intent.getId(), intent.getClientSecret());
    }

    /**
     * The vacancy gate: false iff the team has at least one UNPAID invoice.
     */
    @Transactional(readOnly = true)
    public boolean canCreateVacancy(UUID teamId) {
        return !invoiceRepository.existsByTeamIdAndStatus(teamId, InvoiceStatus.UNPAID);
    }

    @Transactional(readOnly = true)
    public List<Invoice> invoicesForTeam(UUID teamId) {
        return invoiceRepository.findByTeamIdOrderByCreatedAtDesc(teamId).stream()
            .map(InvoiceEntity::toDomain)
            .toList();
    }

    @Transactional(readOnly = true)
    public List<Invoice> unpaidInvoices() {
        return invoiceRepository.findByStatusOrderByDueDateAsc(InvoiceStatus.UNPAID).stream()
            .map(InvoiceEntity::toDomain)
            .toList();
    }

    @Transactional(readOnly = true)
    public List<Placement> placementsForTeam(UUID teamId) {
        return placementRepository.findByTeamIdOrderByCreatedAtDesc(teamId).stream()
            .map(PlacementEntity::toDomain)
            .toList();
    }

    @Transactional(readOnly = true)
    public Invoice getInvoice(UUID invoiceId) {
        return invoiceRepository.findById(invoiceId)
            .map(InvoiceEntity::toDomain)
            .orElseThrow(() -> new ResourceNotFoundException("Invoice", invoiceId));
    }

    @Transactional(readOnly = true)
    public BigDecimal paidRevenue() {
        return invoiceRepository.sumAmountByStatus(InvoiceStatus.PAID);
    }

    @Transactional(readOnly = true)
    public long countByStatus(InvoiceStatus status) {
        return invoiceRepository.countByStatus(status);
    }

    private InvoiceEntity lockInvoice(UUID invoiceId) {
        return invoiceRepository.findByIdForUpdate(invoiceId)
            .orElseThrow(() -> new ResourceNotFoundException("Invoice", invoiceId));
    }

    private PaymentIntentRecord lockInvoiceIntent(String paymentIntentId) {
        PaymentIntentRecord intent = paymentIntentService.lock(paymentIntentId)
            .orElseThrow(() -> new ResourceNotFoundException("Payment intent", paymentIntentId));
        if (intent.getPurpose() != PaymentPurpose.INVOICE) {
            throw new ResourceNotFoundException("Invoice payment intent", paymentIntentId);
        }
        return intent;
    }
}
