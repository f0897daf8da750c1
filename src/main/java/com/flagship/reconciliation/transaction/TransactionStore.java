package com.flagship.reconciliation.transaction;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Durable transaction storage as seen by the reconciliation engine.
 *
 * Implementations propagate infrastructure failures as unchecked exceptions
 * (Spring's DataAccessException hierarchy for the JPA store); callers may retry.
 */
public interface TransactionStore {

    Optional<Transaction> get(UUID id);

    /**
     * Looks up a transaction by its provider-side identity.
     */
    Optional<Transaction> findByExternalId(Provider provider, String externalId);

    List<Transaction> list(TransactionFilter filter);

    /**
     * Persists a newly ingested transaction.
     *
     * @return the stored transaction
     */
    Transaction create(Transaction transaction);

    /**
     * Writes both new states if, and only if, both stored records still carry their
     * expected status. Either both writes become visible or neither does.
     *
     * @param a first record as loaded by the caller
     * @param b second record as loaded by the caller
     * @param expectedStatusA status {@code a} must still have
     * @param expectedStatusB status {@code b} must still have
     * @param newA state to write for {@code a}
     * @param newB state to write for {@code b}
     * @return SUCCESS if written, CONFLICT if either record had moved on
     */
    PairUpdateResult atomicUpdatePair(Transaction a, Transaction b,
                                      ReconciliationStatus expectedStatusA,
                                      ReconciliationStatus expectedStatusB,
                                      Transaction newA, Transaction newB);
}
