package com.flagship.footy_marketplace.membership;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface MembershipRepository extends JpaRepository<MembershipEntity, UUID> {

    Optional<MembershipEntity> findByPaymentIntentId(String paymentIntentId);

    List<MembershipEntity> findByCandidateIdOrderByCreatedAtDesc(UUID candidateId);

    Optional<MembershipEntity> findFirstByCandidateIdAndStatusAndRenewalDateAfter(
        UUID candidateId, MembershipStatus status, Instant after);

    boolean existsByCandidateIdAndStatusAndRenewalDateAfter(
        UUID candidateId, MembershipStatus status, Instant after);

    long countByStatus(MembershipStatus status);

    /**
     * Takes a transaction-scoped advisory lock for one candidate. Activations for the same
     * candidate queue behind it even when no ACTIVE row exists yet to lock.
     */
    @Query(value = "SELECT 1 FROM pg_advisory_xact_lock(hashtext(:lockKey))", nativeQuery = true)
    Integer lockCandidate(@Param("lockKey") String lockKey);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("""
        SELECT m FROM MembershipEntity m
        WHERE m.candidateId = :candidateId
          AND m.status = com.flagship.footy_marketplace.membership.MembershipStatus.ACTIVE
        """)
    List<MembershipEntity> findActiveByCandidateForUpdate(@Param("candidateId") UUID candidateId);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("""
        SELECT m FROM MembershipEntity m
        WHERE m.status = com.flagship.footy_marketplace.membership.MembershipStatus.ACTIVE
          AND m.renewalDate < :now
        ORDER BY m.renewalDate ASC
        """)
    List<MembershipEntity> findOverdueForUpdate(@Param("now") Instant now);
}
