package com.flagship.reconciliation.observability;

import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Centralized metrics for ingestion and reconciliation.
 *
 * Metrics exposed:
 * - reconciliation.attempts: Counter tagged by outcome (matched, no_match, already_matched, error)
 * - reconciliation.race_lost: Counter of pair updates lost to a concurrent reconciliation
 * - reconciliation.latency: Timer for reconcile() calls
 * - transactions.ingested: Counter tagged by provider and outcome (created, duplicate, invalid)
 * - match_index.size: Gauge of indexed pending transactions
 */
@Component
public class ReconciliationMetrics {

    public static final String OUTCOME_MATCHED = "matched";
    public static final String OUTCOME_NO_MATCH = "no_match";
    public static final String OUTCOME_ALREADY_MATCHED = "already_matched";
    public static final String OUTCOME_ERROR = "error";

    private final MeterRegistry registry;

    public ReconciliationMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordReconciliation(String outcome, long durationMs) {
        registry.counter("reconciliation.attempts", "outcome", sanitizeTag(outcome)).increment();
        registry.timer("reconciliation.latency", "outcome", sanitizeTag(outcome))
                .record(Duration.ofMillis(durationMs));
    }

    public void recordRaceLost() {
        registry.counter("reconciliation.race_lost").increment();
    }

    public void recordIngested(String provider, String outcome) {
        registry.counter("transactions.ingested",
                "provider", sanitizeTag(provider),
                "outcome", sanitizeTag(outcome)
        ).increment();
    }

    public void registerMatchIndexSizeGauge(Supplier<Number> supplier) {
        Gauge.builder("match_index.size", supplier).register(registry);
    }

    /**
     * Sanitizes a tag value to prevent cardinality explosion.
     */
    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.replaceAll("[^a-zA-Z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
