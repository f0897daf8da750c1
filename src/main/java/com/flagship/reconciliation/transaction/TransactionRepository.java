package com.flagship.reconciliation.transaction;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * Repository for transaction persistence.
 */
@Repository
public interface TransactionRepository extends JpaRepository<TransactionEntity, UUID>,
        JpaSpecificationExecutor<TransactionEntity> {

    Optional<TransactionEntity> findByProviderAndExternalId(Provider provider, String externalId);

    /**
     * Conditional status update: only applies if the row still has the expected status.
     * The affected row count is the compare-and-swap outcome (1 = applied, 0 = lost).
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
        UPDATE TransactionEntity t
        SET t.status = :newStatus,
            t.matchedTransactionId = :matchedTransactionId,
            t.updatedAt = :updatedAt
        WHERE t.id = :id AND t.status = :expectedStatus
        """)
    int transitionStatus(@Param("id") UUID id,
                         @Param("expectedStatus") ReconciliationStatus expectedStatus,
                         @Param("newStatus") ReconciliationStatus newStatus,
                         @Param("matchedTransactionId") UUID matchedTransactionId,
                         @Param("updatedAt") Instant updatedAt);
}
