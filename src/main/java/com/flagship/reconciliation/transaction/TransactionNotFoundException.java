package com.flagship.reconciliation.transaction;

import java.util.UUID;

/**
 * Thrown when a referenced transaction does not exist. Not retried.
 */
public class TransactionNotFoundException extends RuntimeException {

    private final UUID transactionId;

    public TransactionNotFoundException(UUID transactionId) {
        super("Transaction not found: " + transactionId);
        this.transactionId = transactionId;
    }

    public UUID getTransactionId() {
        return transactionId;
    }
}
