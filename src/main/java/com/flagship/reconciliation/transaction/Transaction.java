package com.flagship.reconciliation.transaction;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Transaction domain object.
 *
 * One side of a potential intercompany transfer, as recorded by a single provider.
 *
 * Key principles:
 * - Everything except status and matchedTransactionId is immutable after ingestion
 * - Status only moves PENDING → MATCHED, enforced by {@link #matchWith(UUID)}
 * - State changes produce a new instance
 */
@Value
public class Transaction {
    UUID id;
    Provider provider;
    String externalId;
    BigDecimal amount;
    String currency;
    LocalDate transactionDate;
    String description;
    TransactionDetails details;
    ReconciliationStatus status;
    UUID matchedTransactionId;
    Instant createdAt;
    Instant updatedAt;

    /**
     * Creates a new Transaction in PENDING status.
     */
    public static Transaction create(UUID id, Provider provider, String externalId, BigDecimal amount,
                                     String currency, LocalDate transactionDate, String description,
                                     TransactionDetails details, Instant createdAt) {
        return new Transaction(
            id,
            provider,
            externalId,
            amount,
            currency,
            transactionDate,
            description,
            details != null ? details : TransactionDetails.none(),
            ReconciliationStatus.PENDING,
            null,
            createdAt,
            createdAt
        );
    }

    /**
     * Transitions the transaction to MATCHED, linked to the given counterpart.
     * Only valid from PENDING status.
     *
     * @param counterpartId ID of the transaction on the other side of the pair
     * @return New Transaction instance with MATCHED status
     * @throws IllegalStateException if the transaction is already matched
     */
    public Transaction matchWith(UUID counterpartId) {
        if (this.status != ReconciliationStatus.PENDING) {
            throw new IllegalStateException(
                String.format("Cannot match transaction %s in %s status. Only PENDING transactions can be matched.",
                    this.id, this.status)
            );
        }
        if (counterpartId == null || counterpartId.equals(this.id)) {
            throw new IllegalArgumentException("Counterpart must be a different transaction");
        }
        return new Transaction(
            this.id,
            this.provider,
            this.externalId,
            this.amount,
            this.currency,
            this.transactionDate,
            this.description,
            this.details,
            ReconciliationStatus.MATCHED,
            counterpartId,
            this.createdAt,
            Instant.now()
        );
    }

    public boolean isPending() {
        return this.status == ReconciliationStatus.PENDING;
    }

    public boolean isMatched() {
        return this.status == ReconciliationStatus.MATCHED;
    }
}
