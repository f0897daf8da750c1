package com.flagship.reconciliation.matching;

import com.flagship.reconciliation.transaction.ReconciliationStatus;
import com.flagship.reconciliation.transaction.Transaction;
import com.flagship.reconciliation.transaction.TransactionFilter;
import com.flagship.reconciliation.transaction.TransactionStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Rebuilds the in-memory match index from the store on startup.
 *
 * The store is the only state that survives a restart; without this, transactions
 * ingested before the restart could never be found as candidates.
 */
@Component
@ConditionalOnProperty(name = "reconciliation.index.preload", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class MatchIndexLoader implements ApplicationRunner {

    private final TransactionStore store;
    private final MatchIndex matchIndex;

    @Override
    public void run(ApplicationArguments args) {
        load();
    }

    public int load() {
        long startTime = System.currentTimeMillis();
        List<Transaction> pending = store.list(TransactionFilter.byStatus(ReconciliationStatus.PENDING));

        int added = 0;
        for (Transaction transaction : pending) {
            if (matchIndex.insert(transaction)) {
                added++;
            }
        }

        log.info("Match index loaded: pending={}, added={}, indexSize={}, duration={}ms",
                pending.size(), added, matchIndex.size(), System.currentTimeMillis() - startTime);
        return added;
    }
}
