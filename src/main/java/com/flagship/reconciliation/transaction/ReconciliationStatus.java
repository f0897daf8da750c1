package com.flagship.reconciliation.transaction;

/**
 * Reconciliation state of a transaction.
 *
 * Transitions are monotonic: PENDING → MATCHED. There is no way back.
 */
public enum ReconciliationStatus {
    /**
     * Ingested, no counterpart found yet.
     * Initial state for all transactions.
     */
    PENDING,

    /**
     * Linked to exactly one counterpart from the other provider.
     * Terminal state - no further transitions allowed.
     */
    MATCHED
}
