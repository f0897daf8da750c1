package com.flagship.reconciliation.matching;

import java.util.UUID;

/**
 * A stored match breaks symmetry or the one-match-per-transaction rule.
 *
 * The engine never writes such a state, so this signals corruption from outside it.
 * It is surfaced as-is and never repaired automatically.
 */
public class MatchConstraintViolationException extends RuntimeException {

    private final UUID transactionId;

    public MatchConstraintViolationException(UUID transactionId, String message) {
        super(message);
        this.transactionId = transactionId;
    }

    public UUID getTransactionId() {
        return transactionId;
    }
}
