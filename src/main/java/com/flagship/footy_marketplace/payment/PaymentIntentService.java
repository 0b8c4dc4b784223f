package com.flagship.footy_marketplace.payment;

import com.flagship.footy_marketplace.exception.ResourceNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * Persistence of payment intent audit records.
 *
 * Writes join the caller's transaction so the intent status always moves together with
 * the membership or invoice it pays for.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PaymentIntentService {

    private final PaymentIntentRepository repository;

    @Transactional(propagation = Propagation.MANDATORY)
    public PaymentIntentRecord record(PaymentIntentRecord intent) {
        PaymentIntentEntity saved = repository.save(PaymentIntentEntity.fromDomain(intent));
        log.debug("Recorded {} payment intent {}", intent.getPurpose(), intent.getId());
        return saved.toDomain();
    }

    /**
     * Locks and loads an intent for the rest of the caller's transaction.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public Optional<PaymentIntentRecord> lock(String intentId) {
        return repository.findByIdForUpdate(intentId).map(PaymentIntentEntity::toDomain);
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public PaymentIntentRecord update(PaymentIntentRecord intent) {
        PaymentIntentEntity entity = repository.findById(intent.getId())
            .orElseThrow(() -> new ResourceNotFoundException("Payment intent", intent.getId()));
        entity.updateFromDomain(intent);
        return repository.save(entity).toDomain();
    }

    @Transactional(readOnly = true)
    public Optional<PaymentIntentRecord> findById(String intentId) {
        return repository.findById(intentId).map(PaymentIntentEntity::toDomain);
    }

    @Transactional(readOnly = true)
    public BigDecimal succeededRevenue(PaymentPurpose purpose) {
        return repository.sumSucceededAmount(purpose);
    }

    @Transactional(readOnly = true)
    public long succeededCount(PaymentPurpose purpose) {
        return repository.countSucceeded(purpose);
    }
}
