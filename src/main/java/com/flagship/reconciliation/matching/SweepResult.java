package com.flagship.reconciliation.matching;

import lombok.Value;

/**
 * Counts from one pass over the pending transactions.
 */
@Value
public class SweepResult {
    int scanned;
    int matched;
    int stillPending;
    int failed;
}
