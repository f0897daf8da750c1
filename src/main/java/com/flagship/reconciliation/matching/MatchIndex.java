package com.flagship.reconciliation.matching;

import com.flagship.reconciliation.transaction.Provider;
import com.flagship.reconciliation.transaction.Transaction;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.NavigableSet;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.UUID;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * In-memory index of PENDING transactions.
 *
 * Transactions are partitioned by (currency, provider). Within a partition they are kept
 * ordered by transaction date, then amount, then createdAt, so a candidate lookup only
 * touches the dates inside the window instead of scanning the whole pending set. Entries
 * outside the amount tolerance are filtered out before the engine loads them.
 *
 * All access goes through one read/write lock: a query sees an entry either fully indexed
 * or fully removed, never half-way.
 */
public class MatchIndex {

    private static final Comparator<IndexEntry> PARTITION_ORDER = Comparator
        .comparing(IndexEntry::getAmount)
        .thenComparing(IndexEntry::getCreatedAt)
        .thenComparing(IndexEntry::getId);

    private final BigDecimal amountTolerance;
    private final int dateWindowDays;
    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final Map<PartitionKey, NavigableMap<LocalDate, NavigableSet<IndexEntry>>> partitions = new HashMap<>();
    private final Map<UUID, IndexEntry> entriesById = new HashMap<>();

    public MatchIndex(BigDecimal amountTolerance, int dateWindowDays) {
        if (amountTolerance == null || amountTolerance.signum() < 0) {
            throw new IllegalArgumentException("Amount tolerance must be zero or positive");
        }
        if (dateWindowDays < 0) {
            throw new IllegalArgumentException("Date window must be zero or positive");
        }
        this.amountTolerance = amountTolerance;
        this.dateWindowDays = dateWindowDays;
    }

    /**
     * Adds a PENDING transaction to its (currency, provider) partition.
     *
     * @return true if added, false if it was already indexed
     * @throws IllegalArgumentException if the transaction is not PENDING
     */
    public boolean insert(Transaction transaction) {
        if (!transaction.isPending()) {
            throw new IllegalArgumentException(
                String.format("Only PENDING transactions can be indexed, %s is %s",
                    transaction.getId(), transaction.getStatus()));
        }
        IndexEntry entry = IndexEntry.of(transaction);

        lock.writeLock().lock();
        try {
            if (entriesById.containsKey(entry.getId())) {
                return false;
            }
            partitions
                .computeIfAbsent(PartitionKey.of(entry), key -> new TreeMap<>())
                .computeIfAbsent(entry.getTransactionDate(), date -> new TreeSet<>(PARTITION_ORDER))
                .add(entry);
            entriesById.put(entry.getId(), entry);
            return true;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public boolean remove(Transaction transaction) {
        return remove(transaction.getId());
    }

    /**
     * Removes a transaction from its partition. No-op if absent.
     *
     * @return true if an entry was removed
     */
    public boolean remove(UUID transactionId) {
        lock.writeLock().lock();
        try {
            IndexEntry entry = entriesById.remove(transactionId);
            if (entry == null) {
                return false;
            }
            PartitionKey key = PartitionKey.of(entry);
            NavigableMap<LocalDate, NavigableSet<IndexEntry>> partition = partitions.get(key);
            NavigableSet<IndexEntry> sameDay = partition.get(entry.getTransactionDate());
            sameDay.remove(entry);
            if (sameDay.isEmpty()) {
                partition.remove(entry.getTransactionDate());
            }
            if (partition.isEmpty()) {
                partitions.remove(key);
            }
            return true;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Returns the ids of counterpart candidates for a transaction: entries in the other
     * providers' partitions of the same currency whose date is within the window and whose
     * amount is within the tolerance.
     *
     * Ordered by ascending date distance, then ascending amount distance, then ascending
     * createdAt (then id). Nothing is computed until iteration starts; every new iterator
     * takes a fresh snapshot, so the sequence can be restarted and never mutates the index.
     */
    public Iterable<UUID> query(Transaction transaction) {
        return () -> snapshotCandidates(transaction).iterator();
    }

    public boolean contains(UUID transactionId) {
        lock.readLock().lock();
        try {
            return entriesById.containsKey(transactionId);
        } finally {
            lock.readLock().unlock();
        }
    }

    public int size() {
        lock.readLock().lock();
        try {
            return entriesById.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    public void clear() {
        lock.writeLock().lock();
        try {
            partitions.clear();
            entriesById.clear();
        } finally {
            lock.writeLock().unlock();
        }
    }

    private List<UUID> snapshotCandidates(Transaction transaction) {
        LocalDate from = transaction.getTransactionDate().minusDays(dateWindowDays);
        LocalDate to = transaction.getTransactionDate().plusDays(dateWindowDays);
        List<IndexEntry> window = new ArrayList<>();

        lock.readLock().lock();
        try {
            for (Provider provider : Provider.values()) {
                if (provider == transaction.getProvider()) {
                    continue;
                }
                NavigableMap<LocalDate, NavigableSet<IndexEntry>> partition =
                    partitions.get(new PartitionKey(transaction.getCurrency(), provider));
                if (partition == null) {
                    continue;
                }
                for (NavigableSet<IndexEntry> sameDay : partition.subMap(from, true, to, true).values()) {
                    for (IndexEntry entry : sameDay) {
                        if (!entry.getId().equals(transaction.getId())
                                && withinTolerance(entry.getAmount(), transaction.getAmount())) {
                            window.add(entry);
                        }
                    }
                }
            }
        } finally {
            lock.readLock().unlock();
        }

        window.sort(closestTo(transaction));
        return window.stream().map(IndexEntry::getId).toList();
    }

    private boolean withinTolerance(BigDecimal a, BigDecimal b) {
        return a.subtract(b).abs().compareTo(amountTolerance) <= 0;
    }

    private static Comparator<IndexEntry> closestTo(Transaction transaction) {
        return Comparator
            .comparingLong((IndexEntry e) -> Math.abs(ChronoUnit.DAYS.between(transaction.getTransactionDate(), e.getTransactionDate())))
            .thenComparing(e -> e.getAmount().subtract(transaction.getAmount()).abs())
            .thenComparing(IndexEntry::getCreatedAt)
            .thenComparing(IndexEntry::getId);
    }

    @Value
    static class PartitionKey {
        String currency;
        Provider provider;

        static PartitionKey of(IndexEntry entry) {
            return new PartitionKey(entry.getCurrency(), entry.getProvider());
        }
    }

    /**
     * Immutable copy of the fields the index orders by.
     */
    @Value
    static class IndexEntry {
        UUID id;
        Provider provider;
        String currency;
        BigDecimal amount;
        LocalDate transactionDate;
        Instant createdAt;

        static IndexEntry of(Transaction transaction) {
            return new IndexEntry(
                transaction.getId(),
                transaction.getProvider(),
                transaction.getCurrency(),
                transaction.getAmount(),
                transaction.getTransactionDate(),
                transaction.getCreatedAt()
            );
        }
    }
}
