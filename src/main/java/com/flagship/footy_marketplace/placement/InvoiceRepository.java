package com.flagship.footy_marketplace.placement;

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
public interface InvoiceRepository extends JpaRepository<InvoiceEntity, UUID> {

    /**
     * SELECT ... FOR UPDATE, so an admin override and a payment webhook on the same invoice serialize.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT i FROM InvoiceEntity i WHERE i.id = :id")
    Optional<InvoiceEntity> findByIdForUpdate(@Param("id") UUID id);

    Optional<InvoiceEntity> findByPlacementId(UUID placementId);

    boolean existsByTeamIdAndStatus(UUID teamId, InvoiceStatus status);

    List<InvoiceEntity> findByTeamIdOrderByCreatedAtDesc(UUID teamId);

    List<InvoiceEntity> findByStatusOrderByDueDateAsc(InvoiceStatus status);

    long countByStatus(InvoiceStatus status);

    @Query("SELECT COALESCE(SUM(i.amount), 0) FROM InvoiceEntity i WHERE i.status = :status")
    BigDecimal sumAmountByStatus(@Param("status") InvoiceStatus status);
}
