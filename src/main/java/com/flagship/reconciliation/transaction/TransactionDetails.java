package com.flagship.reconciliation.transaction;

import lombok.Builder;
import lombok.Value;

import java.util.UUID;

/**
 * Descriptive fields a provider may attach to a record.
 *
 * Never used for matching. Stored as given at ingestion and immutable afterwards.
 */
@Value
@Builder
public class TransactionDetails {

    private static final TransactionDetails NONE = TransactionDetails.builder().build();

    /** Company (ledger) the record was booked in */
    UUID entityId;
    String reference;
    /** Provider's own type, e.g. SPEND or RECEIVE for Xero bank transactions */
    String transactionType;
    String contactName;
    String accountCode;

    public static TransactionDetails none() {
        return NONE;
    }
}
