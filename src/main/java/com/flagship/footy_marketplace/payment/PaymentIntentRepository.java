package com.flagship.footy_marketplace.payment;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface PaymentIntentRepository extends JpaRepository<PaymentIntentEntity, String> {

    /**
     * Loads the intent with SELECT ... FOR UPDATE. Serializes concurrent confirmations of the
     * same intent (API confirm racing a webhook, or two webhooks).
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT p FROM PaymentIntentEntity p WHERE p.id = :id")
    Optional<PaymentIntentEntity> findByIdForUpdate(@Param("id") String id);

    List<PaymentIntentEntity> findByInvoiceId(UUID invoiceId);

    @Query("""
        SELECT COALESCE(SUM(p.amount), 0) FROM PaymentIntentEntity p
        WHERE p.purpose = :purpose AND p.status = com.flagship.footy_marketplace.payment.PaymentIntentStatus.SUCCEEDED
        """)
    BigDecimal sumSucceededAmount(@Param("purpose") PaymentPurpose purpose);

    @Query("""
        SELECT COUNT(p) FROM PaymentIntentEntity p
        WHERE p.purpose = :purpose AND p.status = com.flagship.footy_marketplace.payment.PaymentIntentStatus.SUCCEEDED
        """)
    long countSucceeded(@Param("purpose") PaymentPurpose purpose);
}
