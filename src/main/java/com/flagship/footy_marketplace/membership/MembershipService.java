package com.flagship.footy_marketplace.membership;

import com.flagship.footy_marketplace.exception.AlreadyActiveException;
import com.flagship.footy_marketplace.exception.NoActiveMembershipException;
import com.flagship.footy_marketplace.exception.PaymentNotSucceededException;
import com.flagship.footy_marketplace.exception.ResourceNotFoundException;
import com.flagship.footy_marketplace.gateway.GatewayIntentStatus;
import com.flagship.footy_marketplace.gateway.GatewayPaymentIntent;
import com.flagship.footy_marketplace.gateway.PaymentGateway;
import com.flagship.footy_marketplace.membership.event.MembershipActivatedEvent;
import com.flagship.footy_marketplace.membership.event.MembershipCancelledEvent;
import com.flagship.footy_marketplace.membership.event.MembershipExpiredEvent;
import com.flagship.footy_marketplace.observability.CorrelationContext;
import com.flagship.footy_marketplace.observability.MarketplaceMetrics;
import com.flagship.footy_marketplace.outbox.OutboxPublisher;
import com.flagship.footy_marketplace.outbox.OutboxService;
import com.flagship.footy_marketplace.payment.PaymentIntentRecord;
import com.flagship.footy_marketplace.payment.PaymentIntentService;
import com.flagship.footy_marketplace.payment.PaymentPurpose;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Owns membership state per candidate.
 *
 * Activation happens either through an explicit confirmation (the gateway is asked whether
 * the payment succeeded) or through a payment_intent.succeeded webhook. Both paths lock the
 * payment intent row first, so racing confirmations activate the membership once. Activation
 * then takes a per-candidate advisory lock, so two intents of one candidate activate in turn.
 *
 * {@link #isActive(UUID)} is the only membership status query other components use.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MembershipService {

    private static final String AGGREGATE_TYPE = OutboxPublisher.MEMBERSHIP_AGGREGATE;

    private final MembershipRepository membershipRepository;
    private final PaymentIntentService paymentIntentService;
    private final PaymentGateway paymentGateway;
    private final PlanCatalog planCatalog;
    private final OutboxService outboxService;
    private final MarketplaceMetrics metrics;

    public List<PlanOffer> listPlans() {
        return planCatalog.offers();
    }

    /**
     * Starts a purchase: creates a gateway intent and a PENDING membership for it.
     *
     * @throws com.flagship.footy_marketplace.exception.InvalidPlanException if the plan code is unknown
     * @throws AlreadyActiveException if the candidate already holds an equal or higher plan
     */
    @Transactional
    public MembershipCheckout createPaymentIntent(UUID candidateId, String planCode) {
        MembershipPlan plan = MembershipPlan.fromCode(planCode);
        Optional<Membership> current = findActive(candidateId, Instant.now());

        current.ifPresent(active -> {
            if (!plan.isHigherThan(active.getPlan())) {
                throw new AlreadyActiveException(candidateId, active.getPlan(), plan);
            }
        });

        return startCheckout(candidateId, plan, current.orElse(null), "purchase");
    }

    /**
     * Starts an upgrade. The new plan is charged in full and, once paid, its membership
     * replaces the current one with a fresh period.
     *
     * @throws NoActiveMembershipException if the candidate has no active membership
     * @throws AlreadyActiveException if the new plan is not a higher tier
     */
    @Transactional
    public MembershipCheckout upgrade(UUID candidateId, String planCode) {
        MembershipPlan plan = MembershipPlan.fromCode(planCode);
        Membership current = findActive(candidateId, Instant.now())
            .orElseThrow(() -> new NoActiveMembershipException(candidateId));

        if (!plan.isHigherThan(current.getPlan())) {
            throw new AlreadyActiveException(candidateId, current.getPlan(), plan);
        }

        return startCheckout(candidateId, plan, current, "upgrade");
    }

    private MembershipCheckout startCheckout(UUID candidateId, MembershipPlan plan,
                                             Membership replaces, String kind) {
        long startTime = System.currentTimeMillis();
        UUID membershipId = UUID.randomUUID();
        MDC.put(CorrelationContext.MEMBERSHIP_ID_MDC_KEY, membershipId.toString());

        try {
            GatewayPaymentIntent intent = paymentGateway.createPaymentIntent(
                planCatalog.priceOf(plan),
                planCatalog.currency(),
                Map.of(
                    "purpose", PaymentPurpose.MEMBERSHIP.name(),
                    "membership_id", membershipId.toString(),
                    "candidate_id", candidateId.toString(),
                    "plan_type", plan.name()
                ));

            Membership pending = Membership.pending(membershipId, candidateId, plan,
                planCatalog.priceOf(plan), planCatalog.currency(), intent.getId());
            Membership saved = membershipRepository.save(MembershipEntity.fromDomain(pending)).toDomain();

            paymentIntentService.record(PaymentIntentRecord.forMembership(
                intent.getId(), candidateId, membershipId, plan.name(),
                pending.getPrice(), pending.getCurrency()));

            metrics.recordMembershipIntentCreated(plan.name(), kind);
            metrics.recordLatency("membership_checkout", System.currentTimeMillis() - startTime);
            log.info("Membership {} started: candidate={}, plan={}, intent={}",
                kind, candidateId, plan, intent.getId());

            return new MembershipCheckout(saved, intent.getId(), intent.getClientSecret(), replaces);
        } finally {
            MDC.remove(CorrelationContext.MEMBERSHIP_ID_MDC_KEY);
        }
    }

    /**
     * Confirms a membership payment after asking the gateway whether it succeeded.
     * Confirming an already active membership returns it unchanged.
     *
     * @throws ResourceNotFoundException if the intent is not a known membership intent
     * @throws PaymentNotSucceededException if the gateway does not report success
     */
    @Transactional
    public Membership confirmPayment(String paymentIntentId) {
        PaymentIntentRecord intent = lockMembershipIntent(paymentIntentId);
        Membership membership = membershipFor(intent);

        if (membership.getStatus() == MembershipStatus.ACTIVE) {
            log.info("Membership {} already active, confirmation is a no-op", membership.getId());
            return membership;
        }

        GatewayIntentStatus gatewayStatus = paymentGateway.retrievePaymentIntent(paymentIntentId).getStatus();
        if (gatewayStatus != GatewayIntentStatus.SUCCEEDED) {
            throw new PaymentNotSucceededException(paymentIntentId, gatewayStatus);
        }

        return activate(intent, membership, "api");
    }

    /**
     * Webhook path for payment_intent.succeeded. The event itself is the proof of payment,
     * so the gateway is not queried again.
     *
     * @return false if the membership can no longer be activated (it was cancelled or expired)
     */
    @Transactional
    public boolean onPaymentSucceeded(String paymentIntentId) {
        PaymentIntentRecord intent = lockMembershipIntent(paymentIntentId);
        Membership membership = membershipFor(intent);

        if (membership.getStatus() == MembershipStatus.ACTIVE) {
            log.info("Membership {} already active, webhook confirmation ignored", membership.getId());
            return true;
        }
        if (membership.isTerminal()) {
            paymentIntentService.update(intent.succeed());
            log.warn("Payment {} succeeded for membership {} in {} status; needs manual reconciliation",
                paymentIntentId, membership.getId(), membership.getStatus());
            return false;
        }

        activate(intent, membership, "webhook");
        return true;
    }

    /**
     * Webhook path for payment_intent.payment_failed. The attempt failed but the intent stays
     * usable, so the intent is marked FAILED and the membership remains PENDING for a retry.
     */
    @Transactional
    public void onPaymentFailed(String paymentIntentId) {
        PaymentIntentRecord intent = lockMembershipIntent(paymentIntentId);
        if (intent.isSucceeded()) {
            log.warn("Ignoring failure notice for already succeeded intent {}", paymentIntentId);
            return;
        }
        paymentIntentService.update(intent.fail());

        Membership membership = membershipFor(intent);
        log.info("Payment attempt failed for intent {}; membership {} stays {}", paymentIntentId,
            membership.getId(), membership.getStatus());
    }

    /**
     * Webhook path for payment_intent.canceled: the intent is marked FAILED and a still-pending
     * membership is cancelled.
     */
    @Transactional
    public void onPaymentCanceled(String paymentIntentId) {
        PaymentIntentRecord intent = lockMembershipIntent(paymentIntentId);
        if (intent.isSucceeded()) {
            log.warn("Ignoring cancellation notice for already succeeded intent {}", paymentIntentId);
            return;
        }
        paymentIntentService.update(intent.fail());

        Membership membership = membershipFor(intent);
        if (membership.getStatus() == MembershipStatus.PENDING) {
            Membership cancelled = membership.cancel("Payment canceled");
            save(cancelled);
            outboxService.saveEvent(AGGREGATE_TYPE, cancelled.getId(),
                MembershipCancelledEvent.EVENT_TYPE, MembershipCancelledEvent.from(membership, cancelled));
            metrics.recordMembershipCancelled("payment_canceled");
            log.info("Pending membership {} cancelled after canceled payment {}", membership.getId(), paymentIntentId);
        }
    }

    private Membership activate(PaymentIntentRecord intent, Membership membership, String source) {
        long startTime = System.currentTimeMillis();
        MDC.put(CorrelationContext.MEMBERSHIP_ID_MDC_KEY, membership.getId().toString());

        try {
            membershipRepository.lockCandidate(membership.getCandidateId().toString());
            Instant now = Instant.now();

            // Retire the previous membership first and flush, so the partial unique index never sees two ACTIVE rows.
            for (MembershipEntity entity : membershipRepository.findActiveByCandidateForUpdate(membership.getCandidateId())) {
                Membership previous = entity.toDomain();
                if (previous.getRenewalDate().isBefore(now)) {
                    Membership expired = previous.expire();
                    entity.updateFromDomain(expired);
                    membershipRepository.saveAndFlush(entity);
                    outboxService.saveEvent(AGGREGATE_TYPE, expired.getId(),
                        MembershipExpiredEvent.EVENT_TYPE, MembershipExpiredEvent.from(expired));
                    metrics.recordMembershipsExpired(1);
                    log.info("Membership {} ({}) expired before activating {}", previous.getId(), previous.getPlan(), membership.getId());
                    continue;
                }
                Membership superseded = previous.cancel("Superseded by membership " + membership.getId());
                entity.updateFromDomain(superseded);
                membershipRepository.saveAndFlush(entity);
                outboxService.saveEvent(AGGREGATE_TYPE, superseded.getId(),
                    MembershipCancelledEvent.EVENT_TYPE, MembershipCancelledEvent.from(previous, superseded));
                metrics.recordMembershipCancelled("superseded");
                log.info("Membership {} ({}) superseded by {}", previous.getId(), previous.getPlan(), membership.getId());
            }

            Membership active = membership.activate(now, planCatalog.period());
            save(active);
            paymentIntentService.update(intent.succeed());

            outboxService.saveEvent(AGGREGATE_TYPE, active.getId(),
                MembershipActivatedEvent.EVENT_TYPE, MembershipActivatedEvent.from(active));

            metrics.recordMembershipActivated(active.getPlan().name(), source);
            metrics.recordLatency("membership_activate", System.currentTimeMillis() - startTime);
            log.info("Membership activated: candidate={}, plan={}, renewalDate={}, source={}",
                active.getCandidateId(), active.getPlan(), active.getRenewalDate(), source);
            return active;
        } finally {
            MDC.remove(CorrelationContext.MEMBERSHIP_ID_MDC_KEY);
        }
    }

    /**
     * @throws NoActiveMembershipException if the candidate has no active membership
     */
    @Transactional
    public Membership cancel(UUID candidateId, String reason) {
        Instant now = Instant.now();
        MembershipEntity entity = membershipRepository.findActiveByCandidateForUpdate(candidateId).stream()
            .filter(candidate -> candidate.toDomain().isActiveAt(now))
            .findFirst()
            .orElseThrow(() -> new NoActiveMembershipException(candidateId));

        Membership previous = entity.toDomain();
        Membership cancelled = previous.cancel(reason == null || reason.isBlank() ? "Cancelled by candidate" : reason);
        entity.updateFromDomain(cancelled);
        membershipRepository.save(entity);

        outboxService.saveEvent(AGGREGATE_TYPE, cancelled.getId(),
            MembershipCancelledEvent.EVENT_TYPE, MembershipCancelledEvent.from(previous, cancelled));
        metrics.recordMembershipCancelled("candidate");
        log.info("Membership {} cancelled by candidate {}", cancelled.getId(), candidateId);
        return cancelled;
    }

    /**
     * Marks every ACTIVE membership whose renewal date is before {@code now} as EXPIRED.
     *
     * @return number of memberships expired
     */
    @Transactional
    public int expireMemberships(Instant now) {
        List<MembershipEntity> overdue = membershipRepository.findOverdueForUpdate(now);
        for (MembershipEntity entity : overdue) {
            Membership expired = entity.toDomain().expire();
            entity.updateFromDomain(expired);
            membershipRepository.save(entity);
            outboxService.saveEvent(AGGREGATE_TYPE, expired.getId(),
                MembershipExpiredEvent.EVENT_TYPE, MembershipExpiredEvent.from(expired));
        }

        if (!overdue.isEmpty()) {
            metrics.recordMembershipsExpired(overdue.size());
            log.info("Expired {} memberships with renewal date before {}", overdue.size(), now);
        }
        return overdue.size();
    }

    @Transactional(readOnly = true)
    public boolean isActive(UUID candidateId) {
        return isActiveAt(candidateId, Instant.now());
    }

    @Transactional(readOnly = true)
    public boolean isActiveAt(UUID candidateId, Instant at) {
        return membershipRepository.existsByCandidateIdAndStatusAndRenewalDateAfter(
            candidateId, MembershipStatus.ACTIVE, at);
    }

    @Transactional(readOnly = true)
    public Optional<Membership> getActiveMembership(UUID candidateId) {
        return findActive(candidateId, Instant.now());
    }

    @Transactional(readOnly = true)
    public List<Membership> history(UUID candidateId) {
        return membershipRepository.findByCandidateIdOrderByCreatedAtDesc(candidateId).stream()
            .map(MembershipEntity::toDomain)
            .toList();
    }

    @Transactional(readOnly = true)
    public Optional<Membership> findById(UUID membershipId) {
        return membershipRepository.findById(membershipId).map(MembershipEntity::toDomain);
    }

    private Optional<Membership> findActive(UUID candidateId, Instant at) {
        return membershipRepository
            .findFirstByCandidateIdAndStatusAndRenewalDateAfter(candidateId, MembershipStatus.ACTIVE, at)
            .map(MembershipEntity::toDomain);
    }

    private PaymentIntentRecord lockMembershipIntent(String paymentIntentId) {
        PaymentIntentRecord intent = paymentIntentService.lock(paymentIntentId)
            .orElseThrow(() -> new ResourceNotFoundException("Payment intent", paymentIntentId));
        if (intent.getPurpose() != PaymentPurpose.MEMBERSHIP) {
            throw new ResourceNotFoundException("Membership payment intent", paymentIntentId);
        }
        return intent;
    }

    private Membership membershipFor(PaymentIntentRecord intent) {
        return membershipRepository.findByPaymentIntentId(intent.getId())
            .map(MembershipEntity::toDomain)
            .orElseThrow(() -> new IllegalStateException(
                "No membership recorded for payment intent " + intent.getId()));
    }

    private void save(Membership membership) {
        MembershipEntity entity = membershipRepository.findById(membership.getId())
            .orElseThrow(() -> new ResourceNotFoundException("Membership", membership.getId()));
        entity.updateFromDomain(membership);
        membershipRepository.save(entity);
    }
}
