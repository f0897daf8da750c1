package com.flagship.reconciliation.transaction;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * JPA Entity for transaction persistence.
 *
 * Key design principles:
 * - No @Setter: status and match link only change through the conditional update
 *   in {@link TransactionRepository#transitionStatus}
 * - Immutable fields are updatable = false
 * - Controlled factory: fromDomain() is the only way to create entities
 */
@Entity
@Table(
    name = "transactions",
    uniqueConstraints = {
        @UniqueConstraint(name = "uk_transactions_provider_external_id", columnNames = {"provider", "external_id"})
    },
    indexes = {
        @Index(name = "idx_transactions_status", columnList = "status"),
        @Index(name = "idx_transactions_currency_date", columnList = "currency, transaction_date"),
        @Index(name = "idx_transactions_entity_id", columnList = "entity_id")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class TransactionEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false, length = 20)
    private Provider provider;

    @Column(name = "external_id", nullable = false, updatable = false)
    private String externalId;

    @Column(nullable = false, updatable = false, precision = 18, scale = 2)
    private BigDecimal amount;

    @Column(nullable = false, updatable = false, length = 3)
    private String currency;

    @Column(name = "transaction_date", nullable = false, updatable = false)
    private LocalDate transactionDate;

    @Column(updatable = false, length = 500)
    private String description;

    @Column(name = "entity_id", updatable = false)
    private UUID entityId;

    @Column(updatable = false)
    private String reference;

    @Column(name = "transaction_type", updatable = false, length = 50)
    private String transactionType;

    @Column(name = "contact_name", updatable = false)
    private String contactName;

    @Column(name = "account_code", updatable = false, length = 50)
    private String accountCode;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private ReconciliationStatus status;

    @Column(name = "matched_transaction_id")
    private UUID matchedTransactionId;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    /**
     * Creates an entity from a domain object.
     * createdAt is taken from the domain object; it is the tie-breaker the match index orders by.
     */
    static TransactionEntity fromDomain(Transaction transaction) {
        return new TransactionEntity(
            transaction.getId(),
            transaction.getProvider(),
            transaction.getExternalId(),
            transaction.getAmount(),
            transaction.getCurrency(),
            transaction.getTransactionDate(),
            transaction.getDescription(),
            transaction.getDetails().getEntityId(),
            transaction.getDetails().getReference(),
            transaction.getDetails().getTransactionType(),
            transaction.getDetails().getContactName(),
            transaction.getDetails().getAccountCode(),
            transaction.getStatus(),
            transaction.getMatchedTransactionId(),
            transaction.getCreatedAt(),
            transaction.getUpdatedAt() != null ? transaction.getUpdatedAt() : transaction.getCreatedAt()
        );
    }

    public Transaction toDomain() {
        return new Transaction(
            id,
            provider,
            externalId,
            amount,
            currency,
            transactionDate,
            description,
            TransactionDetails.builder()
                .entityId(entityId)
                .reference(reference)
                .transactionType(transactionType)
                .contactName(contactName)
                .accountCode(accountCode)
                .build(),
            status,
            matchedTransactionId,
            createdAt,
            updatedAt
        );
    }
}
