package com.flagship.reconciliation.matching;

/**
 * First rule a candidate pair failed. Used for debug logging of rejected candidates.
 */
public enum MismatchReason {
    SAME_TRANSACTION,
    SAME_PROVIDER,
    CURRENCY_MISMATCH,
    AMOUNT_OUT_OF_TOLERANCE,
    DATE_OUT_OF_WINDOW,
    NOT_PENDING
}
