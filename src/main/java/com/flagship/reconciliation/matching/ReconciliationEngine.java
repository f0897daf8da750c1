package com.flagship.reconciliation.matching;

import com.flagship.reconciliation.observability.CorrelationContext;
import com.flagship.reconciliation.observability.ReconciliationMetrics;
import com.flagship.reconciliation.transaction.PairUpdateResult;
import com.flagship.reconciliation.transaction.ReconciliationStatus;
import com.flagship.reconciliation.transaction.Transaction;
import com.flagship.reconciliation.transaction.TransactionNotFoundException;
import com.flagship.reconciliation.transaction.TransactionStore;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;

import java.util.Optional;
import java.util.UUID;

/**
 * Decides and atomically applies a match for one transaction.
 *
 * Key principles:
 * - Candidates come from the {@link MatchIndex} in tie-break order: closest date,
 *   then closest amount, then earliest created
 * - Each candidate is re-loaded from the store and checked by the {@link MatchingPolicy}
 *   before anything is written
 * - Both sides are written by one compare-and-swap ({@link TransactionStore#atomicUpdatePair}),
 *   so two concurrent reconciliations can never claim the same counterpart
 * - A lost compare-and-swap moves on to the next candidate; it is never surfaced
 * - MATCHED transactions never stay indexed: a matched candidate is dropped when met, and
 *   a walk that finds nothing re-checks whether this transaction was matched meanwhile
 * - Idempotent: reconciling an already MATCHED transaction returns the existing match
 *
 * The same single operation serves the automatic post-ingestion call and manual triggers.
 */
@Slf4j
public class ReconciliationEngine {

    private final TransactionStore store;
    private final MatchIndex matchIndex;
    private final MatchingPolicy policy;
    private final ReconciliationMetrics metrics;

    public ReconciliationEngine(TransactionStore store, MatchIndex matchIndex,
                                MatchingPolicy policy, ReconciliationMetrics metrics) {
        this.store = store;
        this.matchIndex = matchIndex;
        this.policy = policy;
        this.metrics = metrics;
    }

    /**
     * Reconciles a transaction against its pending counterparts.
     *
     * @param transactionId ID of the transaction to reconcile
     * @return MATCHED with the counterpart id, or PENDING if nothing matched
     * @throws TransactionNotFoundException if the transaction does not exist
     * @throws MatchConstraintViolationException if a stored match is corrupt
     */
    public ReconciliationResult reconcile(UUID transactionId) {
        long startTime = System.currentTimeMillis();
        String previousTransactionId = MDC.get(CorrelationContext.TRANSACTION_ID_MDC_KEY);
        MDC.put(CorrelationContext.TRANSACTION_ID_MDC_KEY, transactionId.toString());

        try {
            Transaction transaction = store.get(transactionId)
                .orElseThrow(() -> new TransactionNotFoundException(transactionId));

            if (transaction.isMatched()) {
                ReconciliationResult existing = verifiedMatch(transaction);
                matchIndex.remove(transactionId);
                metrics.recordReconciliation(ReconciliationMetrics.OUTCOME_ALREADY_MATCHED,
                        System.currentTimeMillis() - startTime);
                log.debug("Transaction already matched with {}", existing.getMatchedTransactionId());
                return existing;
            }

            matchIndex.insert(transaction);
            ReconciliationResult result = matchAgainstCandidates(transaction);

            long duration = System.currentTimeMillis() - startTime;
            metrics.recordReconciliation(result.isMatched()
                    ? ReconciliationMetrics.OUTCOME_MATCHED
                    : ReconciliationMetrics.OUTCOME_NO_MATCH, duration);

            if (!result.isMatched()) {
                log.debug("No counterpart found, transaction stays PENDING: duration={}ms", duration);
            }
            return result;

        } catch (TransactionNotFoundException e) {
            log.warn("Reconciliation requested for unknown transaction");
            throw e;
        } catch (RuntimeException e) {
            long duration = System.currentTimeMillis() - startTime;
            metrics.recordReconciliation(ReconciliationMetrics.OUTCOME_ERROR, duration);
            log.error("Reconciliation failed: error={}, duration={}ms", e.getMessage(), duration);
            throw e;
        } finally {
            if (previousTransactionId != null) {
                MDC.put(CorrelationContext.TRANSACTION_ID_MDC_KEY, previousTransactionId);
            } else {
                MDC.remove(CorrelationContext.TRANSACTION_ID_MDC_KEY);
            }
        }
    }

    private ReconciliationResult matchAgainstCandidates(Transaction transaction) {
        for (UUID candidateId : matchIndex.query(transaction)) {
            Optional<Transaction> loaded = store.get(candidateId);
            if (loaded.isEmpty()) {
                log.warn("Indexed candidate {} no longer exists, dropping it from the index", candidateId);
                matchIndex.remove(candidateId);
                continue;
            }

            Transaction candidate = loaded.get();
            if (candidate.isMatched()) {
                // Re-indexed by a reconciliation that loaded it before it was matched
                log.debug("Candidate {} is already matched, dropping it from the index", candidateId);
                matchIndex.remove(candidateId);
                continue;
            }

            Optional<MismatchReason> mismatch = policy.evaluate(transaction, candidate);
            if (mismatch.isPresent()) {
                log.debug("Candidate {} rejected: {}", candidateId, mismatch.get());
                continue;
            }

            PairUpdateResult outcome = store.atomicUpdatePair(
                transaction,
                candidate,
                ReconciliationStatus.PENDING,
                ReconciliationStatus.PENDING,
                transaction.matchWith(candidate.getId()),
                candidate.matchWith(transaction.getId())
            );

            if (outcome == PairUpdateResult.SUCCESS) {
                matchIndex.remove(transaction.getId());
                matchIndex.remove(candidate.getId());
                log.info("Matched with {}: amount={}/{}, currency={}, dates={}/{}, providers={}/{}",
                        candidate.getId(), transaction.getAmount(), candidate.getAmount(),
                        transaction.getCurrency(), transaction.getTransactionDate(),
                        candidate.getTransactionDate(), transaction.getProvider(), candidate.getProvider());
                return ReconciliationResult.matched(transaction.getId(), candidate.getId());
            }

            // Concurrent match lost: the candidate or this transaction was claimed in between
            metrics.recordRaceLost();
            Optional<ReconciliationResult> concurrent = concurrentMatch(transaction);
            if (concurrent.isPresent()) {
                return concurrent.get();
            }
            log.info("Candidate {} claimed concurrently, trying next candidate", candidateId);
        }

        // The load that put this transaction in the index may predate its match
        return concurrentMatch(transaction)
            .orElseGet(() -> ReconciliationResult.pending(transaction.getId()));
    }

    /**
     * Reloads the transaction and, if another reconciliation matched it in the meantime,
     * drops it from the index and returns that match.
     */
    private Optional<ReconciliationResult> concurrentMatch(Transaction transaction) {
        Transaction current = store.get(transaction.getId())
            .orElseThrow(() -> new TransactionNotFoundException(transaction.getId()));
        if (!current.isMatched()) {
            return Optional.empty();
        }
        matchIndex.remove(current.getId());
        log.info("Matched concurrently by another reconciliation with {}", current.getMatchedTransactionId());
        return Optional.of(verifiedMatch(current));
    }

    /**
     * Checks the stored pair is symmetric before reporting it.
     */
    private ReconciliationResult verifiedMatch(Transaction transaction) {
        UUID counterpartId = transaction.getMatchedTransactionId();
        if (counterpartId == null) {
            throw new MatchConstraintViolationException(transaction.getId(),
                String.format("Transaction %s is MATCHED without a counterpart", transaction.getId()));
        }

        Transaction counterpart = store.get(counterpartId)
            .orElseThrow(() -> new MatchConstraintViolationException(transaction.getId(),
                String.format("Transaction %s is matched with missing transaction %s",
                    transaction.getId(), counterpartId)));

        if (!counterpart.isMatched() || !transaction.getId().equals(counterpart.getMatchedTransactionId())) {
            throw new MatchConstraintViolationException(transaction.getId(),
                String.format("Asymmetric match: %s -> %s, but %s is %s -> %s",
                    transaction.getId(), counterpartId, counterpartId,
                    counterpart.getStatus(), counterpart.getMatchedTransactionId()));
        }
        return ReconciliationResult.of(transaction);
    }
}
