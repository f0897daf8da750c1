package com.flagship.reconciliation.transaction.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.reconciliation.matching.ReconciliationResult;
import com.flagship.reconciliation.transaction.ReconciliationStatus;
import lombok.Value;

import java.util.UUID;

/**
 * Response DTO for a manual reconciliation trigger.
 */
@Value
public class ReconciliationResponse {

    @JsonProperty("transaction_id")
    UUID transactionId;

    @JsonProperty("status")
    ReconciliationStatus status;

    @JsonProperty("matched_transaction_id")
    UUID matchedTransactionId;

    public static ReconciliationResponse from(ReconciliationResult result) {
        return new ReconciliationResponse(
            result.getTransactionId(),
            result.getStatus(),
            result.getMatchedTransactionId()
        );
    }
}
