package com.flagship.reconciliation.transaction;

import jakarta.persistence.criteria.Predicate;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * PostgreSQL-backed {@link TransactionStore}.
 *
 * The pairwise update runs in its own database transaction:
 * - Rows are updated in ascending id order, so two reconcilers racing on the same pair
 *   from opposite sides lock rows in the same order and cannot deadlock
 * - Each UPDATE carries the expected status in its WHERE clause (compare-and-swap)
 * - If either UPDATE affects no row, the transaction is rolled back and CONFLICT returned
 * - A violation of the one-link-per-counterpart index is also reported as CONFLICT
 */
@Service
@Slf4j
public class JpaTransactionStore implements TransactionStore {

    private static final Sort LIST_ORDER = Sort.by(
        Sort.Order.desc("transactionDate"), Sort.Order.desc("createdAt"));

    private final TransactionRepository repository;
    private final TransactionTemplate pairUpdateTemplate;

    public JpaTransactionStore(TransactionRepository repository, PlatformTransactionManager transactionManager) {
        this.repository = repository;
        this.pairUpdateTemplate = new TransactionTemplate(transactionManager);
        this.pairUpdateTemplate.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Transaction> get(UUID id) {
        return repository.findById(id).map(TransactionEntity::toDomain);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Transaction> findByExternalId(Provider provider, String externalId) {
        return repository.findByProviderAndExternalId(provider, externalId).map(TransactionEntity::toDomain);
    }

    @Override
    @Transactional(readOnly = true)
    public List<Transaction> list(TransactionFilter filter) {
        return repository.findAll(toSpecification(filter), LIST_ORDER)
            .stream()
            .map(TransactionEntity::toDomain)
            .toList();
    }

    static Specification<TransactionEntity> toSpecification(TransactionFilter filter) {
        return (root, query, cb) -> {
            List<Predicate> predicates = new ArrayList<>();
            if (filter.getStatus() != null) {
                predicates.add(cb.equal(root.get("status"), filter.getStatus()));
            }
            if (filter.getProvider() != null) {
                predicates.add(cb.equal(root.get("provider"), filter.getProvider()));
            }
            if (filter.getEntityId() != null) {
                predicates.add(cb.equal(root.get("entityId"), filter.getEntityId()));
            }
            return cb.and(predicates.toArray(new Predicate[0]));
        };
    }

    @Override
    @Transactional
    public Transaction create(Transaction transaction) {
        // Flush inside the call so a duplicate surfaces here as DataIntegrityViolationException
        TransactionEntity saved = repository.saveAndFlush(TransactionEntity.fromDomain(transaction));
        log.debug("Saved transaction {} ({} {})", saved.getId(), saved.getProvider(), saved.getExternalId());
        return saved.toDomain();
    }

    @Override
    public PairUpdateResult atomicUpdatePair(Transaction a, Transaction b,
                                             ReconciliationStatus expectedStatusA,
                                             ReconciliationStatus expectedStatusB,
                                             Transaction newA, Transaction newB) {
        if (!a.getId().equals(newA.getId()) || !b.getId().equals(newB.getId())) {
            throw new IllegalArgumentException("New states must belong to the records being updated");
        }

        // Canonical lock order: ascending id
        boolean aFirst = a.getId().compareTo(b.getId()) < 0;
        Transaction firstNew = aFirst ? newA : newB;
        Transaction secondNew = aFirst ? newB : newA;
        ReconciliationStatus firstExpected = aFirst ? expectedStatusA : expectedStatusB;
        ReconciliationStatus secondExpected = aFirst ? expectedStatusB : expectedStatusA;

        PairUpdateResult result;
        try {
            result = pairUpdateTemplate.execute(status -> {
                if (applyTransition(firstNew, firstExpected) && applyTransition(secondNew, secondExpected)) {
                    return PairUpdateResult.SUCCESS;
                }
                status.setRollbackOnly();
                return PairUpdateResult.CONFLICT;
            });
        } catch (DataIntegrityViolationException e) {
            // Unique match link: the counterpart is already claimed by a third transaction
            log.debug("Pair update rejected by match link constraint: {} / {}", a.getId(), b.getId());
            return PairUpdateResult.CONFLICT;
        }

        if (result == PairUpdateResult.CONFLICT) {
            log.debug("Pair update lost: {} / {} no longer in expected status", a.getId(), b.getId());
        }
        return result;
    }

    private boolean applyTransition(Transaction newState, ReconciliationStatus expectedStatus) {
        int updated = repository.transitionStatus(
            newState.getId(),
            expectedStatus,
            newState.getStatus(),
            newState.getMatchedTransactionId(),
            newState.getUpdatedAt()
        );
        return updated == 1;
    }
}
