package com.flagship.reconciliation.config;

import com.flagship.reconciliation.matching.MatchIndex;
import com.flagship.reconciliation.matching.MatchingPolicy;
import com.flagship.reconciliation.matching.ReconciliationEngine;
import com.flagship.reconciliation.observability.ReconciliationMetrics;
import com.flagship.reconciliation.transaction.TransactionStore;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.math.BigDecimal;

/**
 * Wires the matching core.
 *
 * The policy, index and engine are plain classes with no Spring annotations; their single
 * instances live here, scoped to the application context.
 */
@Configuration
public class ReconciliationConfig {

    @Value("${reconciliation.amount-tolerance:0.01}")
    private BigDecimal amountTolerance;

    @Value("${reconciliation.date-window-days:3}")
    private int dateWindowDays;

    @Bean
    public MatchingPolicy matchingPolicy() {
        return new MatchingPolicy(amountTolerance, dateWindowDays);
    }

    @Bean
    public MatchIndex matchIndex(ReconciliationMetrics metrics) {
        MatchIndex index = new MatchIndex(amountTolerance, dateWindowDays);
        metrics.registerMatchIndexSizeGauge(index::size);
        return index;
    }

    @Bean
    public ReconciliationEngine reconciliationEngine(TransactionStore transactionStore,
                                                     MatchIndex matchIndex,
                                                     MatchingPolicy matchingPolicy,
                                                     ReconciliationMetrics metrics) {
        return new ReconciliationEngine(transactionStore, matchIndex, matchingPolicy, metrics);
    }
}
