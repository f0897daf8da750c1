package com.flagship.reconciliation.transaction;

/**
 * Outcome of {@link TransactionStore#atomicUpdatePair}.
 */
public enum PairUpdateResult {
    /**
     * Both records had their expected status and were updated together.
     */
    SUCCESS,

    /**
     * At least one record had changed since it was loaded; nothing was written.
     */
    CONFLICT
}
