package com.flagship.reconciliation.matching;

import com.flagship.reconciliation.transaction.ReconciliationStatus;
import com.flagship.reconciliation.transaction.Transaction;
import com.flagship.reconciliation.transaction.TransactionFilter;
import com.flagship.reconciliation.transaction.TransactionNotFoundException;
import com.flagship.reconciliation.transaction.TransactionStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Comparator;
import java.util.List;

/**
 * Re-runs reconciliation for every PENDING transaction, oldest first.
 *
 * Catches up pairs whose automatic post-ingestion reconciliation did not run
 * (e.g. the process stopped between persisting and reconciling).
 * A corrupt stored match fails only its own transaction; store failures abort the sweep.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PendingReconciliationSweeper {

    private final TransactionStore store;
    private final ReconciliationEngine reconciliationEngine;

    public SweepResult sweep() {
        long startTime = System.currentTimeMillis();
        List<Transaction> pending = store.list(TransactionFilter.byStatus(ReconciliationStatus.PENDING))
            .stream()
            .sorted(Comparator.comparing(Transaction::getCreatedAt).thenComparing(Transaction::getId))
            .toList();

        int matched = 0;
        int stillPending = 0;
        int failed = 0;

        for (Transaction transaction : pending) {
            try {
                ReconciliationResult result = reconciliationEngine.reconcile(transaction.getId());
                if (result.isMatched()) {
                    matched++;
                } else {
                    stillPending++;
                }
            } catch (TransactionNotFoundException | MatchConstraintViolationException e) {
                failed++;
                log.error("Sweep skipped transaction {}: {}", transaction.getId(), e.getMessage());
            }
        }

        SweepResult result = new SweepResult(pending.size(), matched, stillPending, failed);
        log.info("Pending sweep complete: scanned={}, matched={}, stillPending={}, failed={}, duration={}ms",
                result.getScanned(), matched, stillPending, failed, System.currentTimeMillis() - startTime);
        return result;
    }
}
