package com.flagship.reconciliation.matching;

import com.flagship.reconciliation.transaction.ReconciliationStatus;
import com.flagship.reconciliation.transaction.Transaction;
import lombok.Value;

import java.util.UUID;

/**
 * Outcome of a reconciliation attempt.
 *
 * PENDING with no counterpart is a normal outcome, not an error.
 */
@Value
public class ReconciliationResult {
    UUID transactionId;
    ReconciliationStatus status;
    UUID matchedTransactionId;

    public static ReconciliationResult pending(UUID transactionId) {
        return new ReconciliationResult(transactionId, ReconciliationStatus.PENDING, null);
    }

    public static ReconciliationResult matched(UUID transactionId, UUID matchedTransactionId) {
        return new ReconciliationResult(transactionId, ReconciliationStatus.MATCHED, matchedTransactionId);
    }

    public static ReconciliationResult of(Transaction transaction) {
        return transaction.isMatched()
            ? matched(transaction.getId(), transaction.getMatchedTransactionId())
            : pending(transaction.getId());
    }

    public boolean isMatched() {
        return status == ReconciliationStatus.MATCHED;
    }
}
