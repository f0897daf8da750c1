package com.flagship.reconciliation.transaction;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Thread-safe in-memory {@link TransactionStore} for unit tests.
 *
 * The pair update is a compare-and-swap under a single monitor, mirroring the
 * all-or-nothing semantics of the database implementation.
 */
public class InMemoryTransactionStore implements TransactionStore {

    private final Map<UUID, Transaction> transactions = new ConcurrentHashMap<>();
    private final AtomicInteger pairUpdateConflicts = new AtomicInteger();
    private final AtomicInteger pairUpdateSuccesses = new AtomicInteger();

    @Override
    public Optional<Transaction> get(UUID id) {
        return Optional.ofNullable(transactions.get(id));
    }

    @Override
    public Optional<Transaction> findByExternalId(Provider provider, String externalId) {
        return transactions.values().stream()
            .filter(t -> t.getProvider() == provider && t.getExternalId().equals(externalId))
            .findFirst();
    }

    @Override
    public List<Transaction> list(TransactionFilter filter) {
        return transactions.values().stream()
            .filter(t -> filter.getStatus() == null || t.getStatus() == filter.getStatus())
            .filter(t -> filter.getProvider() == null || t.getProvider() == filter.getProvider())
            .filter(t -> filter.getEntityId() == null || filter.getEntityId().equals(t.getDetails().getEntityId()))
            .sorted(Comparator.comparing(Transaction::getTransactionDate).reversed())
            .toList();
    }

    @Override
    public synchronized Transaction create(Transaction transaction) {
        if (findByExternalId(transaction.getProvider(), transaction.getExternalId()).isPresent()) {
            throw new IllegalStateException("Duplicate external id " + transaction.getExternalId());
        }
        transactions.put(transaction.getId(), transaction);
        return transaction;
    }

    @Override
    public synchronized PairUpdateResult atomicUpdatePair(Transaction a, Transaction b,
                                                          ReconciliationStatus expectedStatusA,
                                                          ReconciliationStatus expectedStatusB,
                                                          Transaction newA, Transaction newB) {
        Transaction storedA = transactions.get(a.getId());
        Transaction storedB = transactions.get(b.getId());
        if (storedA == null || storedB == null
                || storedA.getStatus() != expectedStatusA
                || storedB.getStatus() != expectedStatusB) {
            pairUpdateConflicts.incrementAndGet();
            return PairUpdateResult.CONFLICT;
        }
        transactions.put(newA.getId(), newA);
        transactions.put(newB.getId(), newB);
        pairUpdateSuccesses.incrementAndGet();
        return PairUpdateResult.SUCCESS;
    }

    /**
     * Overwrites a stored record directly, bypassing every rule. For corrupting state in tests.
     */
    public void put(Transaction transaction) {
        transactions.put(transaction.getId(), transaction);
    }

    public void delete(UUID id) {
        transactions.remove(id);
    }

    public int getPairUpdateConflicts() {
        return pairUpdateConflicts.get();
    }

    public int getPairUpdateSuccesses() {
        return pairUpdateSuccesses.get();
    }
}
