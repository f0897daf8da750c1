package com.flagship.reconciliation.transaction.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.reconciliation.transaction.Provider;
import com.flagship.reconciliation.transaction.ReconciliationStatus;
import com.flagship.reconciliation.transaction.Transaction;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Response DTO for transaction operations.
 */
@Value
@Builder
public class TransactionResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("provider")
    Provider provider;

    @JsonProperty("external_id")
    String externalId;

    @JsonProperty("amount")
    BigDecimal amount;

    @JsonProperty("currency")
    String currency;

    @JsonProperty("transaction_date")
    LocalDate transactionDate;

    @JsonProperty("description")
    String description;

    @JsonProperty("entity_id")
    UUID entityId;

    @JsonProperty("reference")
    String reference;

    @JsonProperty("transaction_type")
    String transactionType;

    @JsonProperty("contact_name")
    String contactName;

    @JsonProperty("account_code")
    String accountCode;

    @JsonProperty("status")
    ReconciliationStatus status;

    @JsonProperty("matched_transaction_id")
    UUID matchedTransactionId;

    @JsonProperty("created_at")
    Instant createdAt;

    @JsonProperty("updated_at")
    Instant updatedAt;

    public static TransactionResponse from(Transaction transaction) {
        return TransactionResponse.builder()
            .id(transaction.getId())
            .provider(transaction.getProvider())
            .externalId(transaction.getExternalId())
            .amount(transaction.getAmount())
            .currency(transaction.getCurrency())
            .transactionDate(transaction.getTransactionDate())
            .description(transaction.getDescription())
            .entityId(transaction.getDetails().getEntityId())
            .reference(transaction.getDetails().getReference())
            .transactionType(transaction.getDetails().getTransactionType())
            .contactName(transaction.getDetails().getContactName())
            .accountCode(transaction.getDetails().getAccountCode())
            .status(transaction.getStatus())
            .matchedTransactionId(transaction.getMatchedTransactionId())
            .createdAt(transaction.getCreatedAt())
            .updatedAt(transaction.getUpdatedAt())
            .build();
    }
}
