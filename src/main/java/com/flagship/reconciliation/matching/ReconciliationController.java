package com.flagship.reconciliation.matching;

import com.flagship.reconciliation.transaction.Provider;
import com.flagship.reconciliation.transaction.ReconciliationStatus;
import com.flagship.reconciliation.transaction.Transaction;
import com.flagship.reconciliation.transaction.TransactionFilter;
import com.flagship.reconciliation.transaction.TransactionStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reconciliation-wide operations: status summary and on-demand pending sweep.
 */
@RestController
@RequestMapping("/api/reconciliation")
@RequiredArgsConstructor
@Slf4j
public class ReconciliationController {

    private final TransactionStore transactionStore;
    private final PendingReconciliationSweeper sweeper;
    private final MatchIndex matchIndex;

    /**
     * Counts transactions by status, globally and per provider.
     */
    @GetMapping("/summary")
    public Map<String, Object> summary() {
        List<Transaction> transactions = transactionStore.list(TransactionFilter.all());

        Map<ReconciliationStatus, Long> byStatus = emptyCounts();
        Map<Provider, Map<ReconciliationStatus, Long>> byProvider = new EnumMap<>(Provider.class);
        for (Provider provider : Provider.values()) {
            byProvider.put(provider, emptyCounts());
        }

        for (Transaction transaction : transactions) {
            byStatus.merge(transaction.getStatus(), 1L, Long::sum);
            byProvider.get(transaction.getProvider()).merge(transaction.getStatus(), 1L, Long::sum);
        }

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("total_transactions", transactions.size());
        response.put("by_status", byStatus);
        response.put("by_provider", byProvider);
        response.put("pending_indexed", matchIndex.size());
        return response;
    }

    @PostMapping("/sweep")
    public SweepResult sweep() {
        log.info("Manual pending sweep requested");
        return sweeper.sweep();
    }

    private static Map<ReconciliationStatus, Long> emptyCounts() {
        Map<ReconciliationStatus, Long> counts = new EnumMap<>(ReconciliationStatus.class);
        for (ReconciliationStatus status : ReconciliationStatus.values()) {
            counts.put(status, 0L);
        }
        return counts;
    }
}
