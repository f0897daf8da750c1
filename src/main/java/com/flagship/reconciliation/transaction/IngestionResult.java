package com.flagship.reconciliation.transaction;

import lombok.Value;

/**
 * Stored transaction after ingestion and reconciliation.
 * created is false when the record had already been ingested.
 */
@Value
public class IngestionResult {
    Transaction transaction;
    boolean created;
}
