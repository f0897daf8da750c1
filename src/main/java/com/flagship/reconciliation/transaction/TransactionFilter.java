package com.flagship.reconciliation.transaction;

import lombok.Value;

import java.util.UUID;

/**
 * Optional criteria for listing transactions. A null field matches everything.
 */
@Value
public class TransactionFilter {
    ReconciliationStatus status;
    Provider provider;
    UUID entityId;

    public static TransactionFilter all() {
        return new TransactionFilter(null, null, null);
    }

    public static TransactionFilter byStatus(ReconciliationStatus status) {
        return new TransactionFilter(status, null, null);
    }
}
