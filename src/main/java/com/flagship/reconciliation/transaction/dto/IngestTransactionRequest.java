package com.flagship.reconciliation.transaction.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

/**
 * A transaction record as delivered by a provider, over REST or the provider feed.
 */
@Value
@Builder
@Jacksonized
public class IngestTransactionRequest {

    @NotBlank(message = "Provider is required")
    @JsonProperty("provider")
    String provider;

    @NotBlank(message = "External ID is required")
    @Size(max = 255, message = "External ID must be at most 255 characters")
    @JsonProperty("external_id")
    String externalId;

    @NotNull(message = "Amount is required")
    @DecimalMin(value = "0.01", message = "Amount must be greater than 0")
    @JsonProperty("amount")
    BigDecimal amount;

    @NotBlank(message = "Currency is required")
    @Pattern(regexp = "^[A-Za-z]{3}$", message = "Currency must be a 3-letter ISO code")
    @JsonProperty("currency")
    String currency;

    @NotNull(message = "Transaction date is required")
    @JsonProperty("transaction_date")
    LocalDate transactionDate;

    @Size(max = 500, message = "Description must be at most 500 characters")
    @JsonProperty("description")
    String description;

    @JsonProperty("entity_id")
    UUID entityId;

    @Size(max = 255, message = "Reference must be at most 255 characters")
    @JsonProperty("reference")
    String reference;

    @Size(max = 50, message = "Transaction type must be at most 50 characters")
    @JsonProperty("transaction_type")
    String transactionType;

    @Size(max = 255, message = "Contact name must be at most 255 characters")
    @JsonProperty("contact_name")
    String contactName;

    @Size(max = 50, message = "Account code must be at most 50 characters")
    @JsonProperty("account_code")
    String accountCode;
}
